/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.json;


import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Optional;

import io.crums.util.json.JsonEntityParser;
import io.crums.util.json.JsonParsingException;
import io.crums.util.json.JsonUtils;
import io.crums.util.json.simple.JSONArray;
import io.crums.util.json.simple.JSONObject;
import io.crums.zone.ZoneException;
import io.crums.zone.att.Attestation;

/**
 * {@linkplain Attestation} JSON parser. Hashes are written in lowercase hex;
 * the signature, in Base64.
 *
 * <h2>Format</h2>
 * <pre>
 * {
 *   "attestation_id": "..",
 *   "zone_id": "..",
 *   "canon_id": "..",
 *   "claim_hash": "..",
 *   "evidence_hash": "..",
 *   "evidence_location": "..",    (optional)
 *   "citations": [ "..", .. ],
 *   "timestamp": 1700000000,
 *   "signature": ".."
 * }
 * </pre>
 */
public class AttestationParser implements JsonEntityParser<Attestation> {

  /** Stateless instance. */
  public final static AttestationParser INSTANCE = new AttestationParser();

  public final static String ATT_ID = "attestation_id";
  public final static String ZONE_ID = "zone_id";
  public final static String CANON_ID = "canon_id";
  public final static String CLAIM_HASH = "claim_hash";
  public final static String EVIDENCE_HASH = "evidence_hash";
  public final static String EVIDENCE_LOC = "evidence_location";
  public final static String CITATIONS = "citations";
  public final static String TIMESTAMP = "timestamp";
  public final static String SIGNATURE = "signature";


  @Override
  public JSONObject injectEntity(Attestation att, JSONObject jObj) {
    jObj.put(ATT_ID, HashCodec.encode(att.attestationId()));
    jObj.put(ZONE_ID, HashCodec.encode(att.zoneId()));
    jObj.put(CANON_ID, HashCodec.encode(att.canonId()));
    jObj.put(CLAIM_HASH, HashCodec.encode(att.claimHash()));
    jObj.put(EVIDENCE_HASH, HashCodec.encode(att.evidenceHash()));
    att.evidenceLocation().ifPresent(loc -> jObj.put(EVIDENCE_LOC, loc));
    var jCites = new JSONArray(att.citations().size());
    for (var cite : att.citations())
      jCites.add(HashCodec.encode(cite));
    jObj.put(CITATIONS, jCites);
    jObj.put(TIMESTAMP, att.timestamp());
    jObj.put(SIGNATURE, HashCodec.toBase64(att.signature()));
    return jObj;
  }


  @Override
  public Attestation toEntity(JSONObject jObj) throws JsonParsingException {
    var attId = HashCodec.getHash(jObj, ATT_ID);
    var zoneId = HashCodec.getHash(jObj, ZONE_ID);
    var canonId = HashCodec.getHash(jObj, CANON_ID);
    var claimHash = HashCodec.getHash(jObj, CLAIM_HASH);
    var evidenceHash = HashCodec.getHash(jObj, EVIDENCE_HASH);
    var evidenceLoc = Optional.ofNullable(JsonUtils.getString(jObj, EVIDENCE_LOC, false));

    var citations = new ArrayList<ByteBuffer>();
    var jCites = JsonUtils.getJsonArray(jObj, CITATIONS, false);
    if (jCites != null)
      for (Object cite : jCites)
        citations.add(HashCodec.decode(cite, CITATIONS));

    long timestamp = HashCodec.getNonNegativeLong(jObj, TIMESTAMP);
    var signature = HashCodec.getBase64(jObj, SIGNATURE);

    try {
      return new Attestation(
          attId, zoneId, canonId, claimHash, evidenceHash, evidenceLoc,
          citations, timestamp, signature);
    } catch (ZoneException zx) {
      throw new JsonParsingException("on parsing attestation: " + zx.getMessage(), zx);
    }
  }

}
