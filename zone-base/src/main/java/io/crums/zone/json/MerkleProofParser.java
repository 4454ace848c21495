/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.json;


import java.nio.ByteBuffer;
import java.util.ArrayList;

import io.crums.util.json.JsonEntityParser;
import io.crums.util.json.JsonParsingException;
import io.crums.util.json.JsonUtils;
import io.crums.util.json.simple.JSONArray;
import io.crums.util.json.simple.JSONObject;
import io.crums.zone.ZoneConstants;
import io.crums.zone.ZoneException;
import io.crums.zone.mrkl.MerkleProof;

/**
 * {@linkplain MerkleProof} JSON parser. Sibling entries are hex hashes, or
 * the reserved {@code "*"} duplicate marker (which cannot collide with a hex
 * value).
 *
 * <h2>Format</h2>
 * <pre>
 * {
 *   "version": "1.0",
 *   "leaf_hash": "..",
 *   "leaf_index": 5,
 *   "proof": [ "..", "*", .. ],
 *   "root": ".."
 * }
 * </pre>
 * <p>
 * Only major version {@code 1} is accepted. A missing version is taken to be
 * {@code "1.0"}.
 * </p>
 */
public class MerkleProofParser implements JsonEntityParser<MerkleProof> {

  /** Stateless instance. */
  public final static MerkleProofParser INSTANCE = new MerkleProofParser();

  public final static String VERSION = "version";
  public final static String LEAF_HASH = "leaf_hash";
  public final static String LEAF_INDEX = "leaf_index";
  public final static String PROOF = "proof";
  public final static String ROOT = "root";


  @Override
  public JSONObject injectEntity(MerkleProof proof, JSONObject jObj) {
    jObj.put(VERSION, ZoneConstants.PROOF_VERSION);
    jObj.put(LEAF_HASH, HashCodec.encode(proof.leafHash()));
    jObj.put(LEAF_INDEX, proof.leafIndex());
    var jProof = new JSONArray(proof.siblings().size());
    for (var sib : proof.siblings())
      jProof.add(MerkleProof.isDup(sib) ? MerkleProof.DUP_TOKEN : HashCodec.encode(sib));
    jObj.put(PROOF, jProof);
    jObj.put(ROOT, HashCodec.encode(proof.root()));
    return jObj;
  }


  @Override
  public MerkleProof toEntity(JSONObject jObj) throws JsonParsingException {
    var version = JsonUtils.getString(jObj, VERSION, ZoneConstants.PROOF_VERSION);
    if (!version.equals("1") && !version.startsWith("1."))
      throw new JsonParsingException("unsupported proof version: " + version);

    var leaf = HashCodec.getHash(jObj, LEAF_HASH);
    long index = HashCodec.getNonNegativeLong(jObj, LEAF_INDEX);
    if (index > Integer.MAX_VALUE)
      throw new JsonParsingException("'" + LEAF_INDEX + "' out of bounds: " + index);

    var jProof = JsonUtils.getJsonArray(jObj, PROOF, true);
    var siblings = new ArrayList<ByteBuffer>(jProof.size());
    for (Object entry : jProof)
      siblings.add(
          MerkleProof.DUP_TOKEN.equals(entry) ?
              MerkleProof.DUP : HashCodec.decode(entry, PROOF));

    var root = HashCodec.getHash(jObj, ROOT);
    try {
      return new MerkleProof(leaf, (int) index, siblings, root);
    } catch (ZoneException zx) {
      throw new JsonParsingException("on parsing proof: " + zx.getMessage(), zx);
    }
  }

}
