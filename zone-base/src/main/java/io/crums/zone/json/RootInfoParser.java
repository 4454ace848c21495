/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.json;


import java.util.Optional;

import io.crums.util.json.JsonEntityParser;
import io.crums.util.json.JsonParsingException;
import io.crums.util.json.JsonUtils;
import io.crums.util.json.simple.JSONObject;
import io.crums.zone.RootInfo;
import io.crums.zone.ZoneException;
import io.crums.zone.anchor.Anchor;

/**
 * {@linkplain RootInfo} JSON parser.
 *
 * <pre>
 * {
 *   "merkle_root": "..",
 *   "attestation_count": 42,
 *   "anchor": { .. }            (optional)
 * }
 * </pre>
 */
public class RootInfoParser implements JsonEntityParser<RootInfo> {

  /** Stateless instance. */
  public final static RootInfoParser INSTANCE = new RootInfoParser();

  public final static String ROOT = "merkle_root";
  public final static String COUNT = "attestation_count";
  public final static String ANCHOR = "anchor";


  @Override
  public JSONObject injectEntity(RootInfo info, JSONObject jObj) {
    jObj.put(ROOT, HashCodec.encode(info.root()));
    jObj.put(COUNT, info.attestationCount());
    info.lastAnchor().ifPresent(
        anchor -> jObj.put(ANCHOR, AnchorParser.INSTANCE.toJsonObject(anchor)));
    return jObj;
  }


  @Override
  public RootInfo toEntity(JSONObject jObj) throws JsonParsingException {
    var root = HashCodec.getHash(jObj, ROOT);
    long count = HashCodec.getNonNegativeLong(jObj, COUNT);
    var jAnchor = JsonUtils.getJsonObject(jObj, ANCHOR, false);
    Optional<Anchor> anchor = jAnchor == null ?
        Optional.empty() : Optional.of(AnchorParser.INSTANCE.toEntity(jAnchor));
    try {
      return new RootInfo(root, count, anchor);
    } catch (ZoneException zx) {
      throw new JsonParsingException("on parsing root info: " + zx.getMessage(), zx);
    }
  }

}
