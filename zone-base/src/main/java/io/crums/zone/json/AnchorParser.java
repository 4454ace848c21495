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

/**
 * {@linkplain Anchor} JSON parser.
 *
 * <pre>
 * {
 *   "merkle_root": "..",
 *   "type": "bitcoin",
 *   "timestamp": 1700000000,
 *   "reference": ".."       (optional)
 * }
 * </pre>
 */
public class AnchorParser implements JsonEntityParser<Anchor> {

  /** Stateless instance. */
  public final static AnchorParser INSTANCE = new AnchorParser();

  public final static String ROOT = "merkle_root";
  public final static String TYPE = "type";
  public final static String TIMESTAMP = "timestamp";
  public final static String REF = "reference";


  @Override
  public JSONObject injectEntity(Anchor anchor, JSONObject jObj) {
    jObj.put(ROOT, HashCodec.encode(anchor.root()));
    jObj.put(TYPE, anchor.type());
    jObj.put(TIMESTAMP, anchor.utc());
    anchor.reference().ifPresent(ref -> jObj.put(REF, ref));
    return jObj;
  }


  @Override
  public Anchor toEntity(JSONObject jObj) throws JsonParsingException {
    var root = HashCodec.getHash(jObj, ROOT);
    var type = JsonUtils.getString(jObj, TYPE, true);
    long utc = HashCodec.getNonNegativeLong(jObj, TIMESTAMP);
    var ref = Optional.ofNullable(JsonUtils.getString(jObj, REF, false));
    try {
      return new Anchor(root, type, utc, ref);
    } catch (ZoneException zx) {
      throw new JsonParsingException("on parsing anchor: " + zx.getMessage(), zx);
    }
  }

}
