/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.json;


import java.util.Optional;

import io.crums.util.json.JsonEntityParser;
import io.crums.util.json.JsonParsingException;
import io.crums.util.json.JsonUtils;
import io.crums.util.json.simple.JSONObject;
import io.crums.zone.ZoneException;
import io.crums.zone.anchor.Anchor;
import io.crums.zone.cite.RemoteRecord;
import io.crums.zone.id.KeyAlgo;
import io.crums.zone.id.ZoneKey;

/**
 * {@linkplain RemoteRecord} JSON parser. This is the response a zone serves
 * for an attestation lookup.
 *
 * <pre>
 * {
 *   "attestation": { .. },
 *   "proof": { .. },
 *   "anchor": { .. },            (optional)
 *   "public_key": "..",          (optional)
 *   "public_key_type": ".."      (required with public_key)
 * }
 * </pre>
 *
 * @see AttestationParser
 * @see MerkleProofParser
 * @see AnchorParser
 */
public class RemoteRecordParser implements JsonEntityParser<RemoteRecord> {

  /** Stateless instance. */
  public final static RemoteRecordParser INSTANCE = new RemoteRecordParser();

  public final static String ATTESTATION = "attestation";
  public final static String PROOF = "proof";
  public final static String ANCHOR = "anchor";
  public final static String PUB_KEY = "public_key";
  public final static String PUB_KEY_TYPE = "public_key_type";


  @Override
  public JSONObject injectEntity(RemoteRecord record, JSONObject jObj) {
    jObj.put(ATTESTATION, AttestationParser.INSTANCE.toJsonObject(record.attestation()));
    jObj.put(PROOF, MerkleProofParser.INSTANCE.toJsonObject(record.proof()));
    record.anchor().ifPresent(
        anchor -> jObj.put(ANCHOR, AnchorParser.INSTANCE.toJsonObject(anchor)));
    record.zoneKey().ifPresent(key -> {
      jObj.put(PUB_KEY, key.publicKeyHex());
      jObj.put(PUB_KEY_TYPE, key.algo().symbol());
    });
    return jObj;
  }


  @Override
  public RemoteRecord toEntity(JSONObject jObj) throws JsonParsingException {
    var att = AttestationParser.INSTANCE.toEntity(
        JsonUtils.getJsonObject(jObj, ATTESTATION, true));
    var proof = MerkleProofParser.INSTANCE.toEntity(
        JsonUtils.getJsonObject(jObj, PROOF, true));
    var jAnchor = JsonUtils.getJsonObject(jObj, ANCHOR, false);
    Optional<Anchor> anchor = jAnchor == null ?
        Optional.empty() : Optional.of(AnchorParser.INSTANCE.toEntity(jAnchor));

    return new RemoteRecord(att, proof, anchor, readKey(jObj));
  }


  /**
   * Reads the optional {@code public_key} / {@code public_key_type} pair.
   */
  static Optional<ZoneKey> readKey(JSONObject jObj) throws JsonParsingException {
    var hex = JsonUtils.getString(jObj, PUB_KEY, false);
    if (hex == null)
      return Optional.empty();
    var type = JsonUtils.getString(jObj, PUB_KEY_TYPE, true);
    try {
      return Optional.of(ZoneKey.fromHex(KeyAlgo.forSymbol(type), hex));
    } catch (ZoneException | IllegalArgumentException x) {
      throw new JsonParsingException("on parsing public key: " + x.getMessage(), x);
    }
  }

}
