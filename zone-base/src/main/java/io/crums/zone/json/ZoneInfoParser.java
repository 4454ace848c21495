/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.json;


import io.crums.util.json.JsonEntityParser;
import io.crums.util.json.JsonParsingException;
import io.crums.util.json.JsonUtils;
import io.crums.util.json.simple.JSONObject;
import io.crums.zone.ZoneConstants;
import io.crums.zone.ZoneInfo;

/**
 * {@linkplain ZoneInfo} JSON parser. On read, the {@code zone_id} field (if
 * present) must match the hash of the public key.
 *
 * <pre>
 * {
 *   "zone_id": "..",
 *   "name": "..",
 *   "description": "..",
 *   "public_key": "..",
 *   "public_key_type": "ed25519",
 *   "api_version": "1.0-rc.0",
 *   "glsr": "e3b0c442.."
 * }
 * </pre>
 */
public class ZoneInfoParser implements JsonEntityParser<ZoneInfo> {

  /** Stateless instance. */
  public final static ZoneInfoParser INSTANCE = new ZoneInfoParser();

  public final static String ZONE_ID = "zone_id";
  public final static String NAME = "name";
  public final static String DESC = "description";
  public final static String PUB_KEY = RemoteRecordParser.PUB_KEY;
  public final static String PUB_KEY_TYPE = RemoteRecordParser.PUB_KEY_TYPE;
  public final static String API_VERSION = "api_version";
  public final static String GLSR = "glsr";


  @Override
  public JSONObject injectEntity(ZoneInfo info, JSONObject jObj) {
    jObj.put(ZONE_ID, HashCodec.encode(info.zoneId()));
    jObj.put(NAME, info.name());
    jObj.put(DESC, info.description());
    jObj.put(PUB_KEY, info.key().publicKeyHex());
    jObj.put(PUB_KEY_TYPE, info.key().algo().symbol());
    jObj.put(API_VERSION, info.apiVersion());
    jObj.put(GLSR, ZoneConstants.GLSR_HEX);
    return jObj;
  }


  @Override
  public ZoneInfo toEntity(JSONObject jObj) throws JsonParsingException {
    var key = RemoteRecordParser.readKey(jObj).orElseThrow(
        () -> new JsonParsingException("missing '" + PUB_KEY + "'"));
    var zoneIdHex = JsonUtils.getString(jObj, ZONE_ID, false);
    if (zoneIdHex != null && !key.bindsTo(HashCodec.decode(zoneIdHex, ZONE_ID)))
      throw new JsonParsingException(
          "'" + ZONE_ID + "' " + zoneIdHex + " is not the hash of the public key");
    var name = JsonUtils.getString(jObj, NAME, "");
    var desc = JsonUtils.getString(jObj, DESC, "");
    var apiVersion = JsonUtils.getString(jObj, API_VERSION, ZoneConstants.PROTOCOL_VERSION);
    return new ZoneInfo(name, desc, key, apiVersion);
  }

}
