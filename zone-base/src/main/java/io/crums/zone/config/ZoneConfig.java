/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.config;


import java.io.File;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import io.crums.util.json.JsonEntityParser;
import io.crums.util.json.JsonParsingException;
import io.crums.util.json.JsonUtils;
import io.crums.util.json.simple.JSONObject;
import io.crums.zone.id.KeyAlgo;
import io.crums.zone.id.ZoneIdentity;
import io.crums.zone.mrkl.MerkleTree;

/**
 * Zone configuration. Usually loaded from a JSON file.
 *
 * <pre>
 * {
 *   "name": "example",
 *   "description": "an example zone",
 *   "key_algo": "ed25519",
 *   "key_file": "keys/zone.key",
 *   "auto_generate": true,
 *   "citation_timeout_millis": 10000,
 *   "citation_threads": 4,
 *   "parallel_threshold": 4096
 * }
 * </pre>
 * <p>
 * Only {@code name} is required. A relative {@code key_file} is resolved against
 * the directory of the config file it was loaded from.
 * </p>
 *
 * @param name                  zone name
 * @param description           zone description (may be empty)
 * @param keyAlgo               signing algorithm
 * @param keyFile               private key file (hex), if any
 * @param autoGenerate          if {@code true}, a key is generated (and saved to {@code keyFile})
 *                              if none is found
 * @param citationTimeoutMillis per-citation-check timeout
 * @param citationThreads       citation verifier pool size
 * @param parallelThreshold     Merkle level width at which hashing goes parallel
 *
 * @see #PARSER
 * @see #load(File)
 */
public record ZoneConfig(
    String name,
    String description,
    KeyAlgo keyAlgo,
    Optional<File> keyFile,
    boolean autoGenerate,
    long citationTimeoutMillis,
    int citationThreads,
    int parallelThreshold) {

  /** Default citation-check timeout (millis). */
  public final static long DEFAULT_CITATION_TIMEOUT = 10_000;
  /** Default citation verifier pool size. */
  public final static int DEFAULT_CITATION_THREADS = 4;

  /** JSON parser. Relative key file paths are left as is. */
  public final static Parser PARSER = new Parser(null);


  /**
   * @throws IllegalArgumentException on a blank name, or non-positive timeout,
   *         thread count, or threshold
   */
  public ZoneConfig {
    Objects.requireNonNull(name, "null name");
    if (name.isBlank())
      throw new IllegalArgumentException("blank name");
    name = name.trim();
    description = description == null ? "" : description.trim();
    Objects.requireNonNull(keyAlgo, "null keyAlgo");
    if (keyFile == null)
      keyFile = Optional.empty();
    if (citationTimeoutMillis <= 0)
      throw new IllegalArgumentException("citation timeout " + citationTimeoutMillis + " <= 0");
    if (citationThreads < 1)
      throw new IllegalArgumentException("citation threads " + citationThreads + " < 1");
    if (parallelThreshold < 2)
      throw new IllegalArgumentException("parallel threshold " + parallelThreshold + " < 2");
  }


  /**
   * Creates an instance with defaults, an Ed25519 key, and no key file (a new
   * key is generated).
   */
  public ZoneConfig(String name, String description) {
    this(
        name, description, KeyAlgo.ED25519, Optional.empty(), true,
        DEFAULT_CITATION_TIMEOUT, DEFAULT_CITATION_THREADS,
        MerkleTree.DEFAULT_PARALLEL_THRESHOLD);
  }


  /** Returns the citation-check timeout. */
  public Duration citationTimeout() {
    return Duration.ofMillis(citationTimeoutMillis);
  }


  /**
   * Loads the zone's identity per this configuration.
   *
   * @see ZoneIdentity#load(KeyAlgo, File, boolean)
   */
  public ZoneIdentity loadIdentity() {
    return ZoneIdentity.load(keyAlgo, keyFile.orElse(null), autoGenerate);
  }


  /**
   * Loads the configuration from the given JSON file.
   *
   * @throws JsonParsingException on malformed or missing content
   */
  public static ZoneConfig load(File file) throws JsonParsingException {
    return new Parser(file.getAbsoluteFile().getParentFile()).toEntity(file);
  }



  /**
   * JSON parser.
   */
  public static class Parser implements JsonEntityParser<ZoneConfig> {

    public final static String NAME = "name";
    public final static String DESC = "description";
    public final static String KEY_ALGO = "key_algo";
    public final static String KEY_FILE = "key_file";
    public final static String AUTO_GEN = "auto_generate";
    public final static String CITE_TIMEOUT = "citation_timeout_millis";
    public final static String CITE_THREADS = "citation_threads";
    public final static String PAR_THRESHOLD = "parallel_threshold";

    private final File baseDir;

    /**
     * @param baseDir   relative key file paths are resolved against this
     *                  directory (if not {@code null})
     */
    public Parser(File baseDir) {
      this.baseDir = baseDir;
    }


    @Override
    public JSONObject injectEntity(ZoneConfig config, JSONObject jObj) {
      jObj.put(NAME, config.name());
      jObj.put(DESC, config.description());
      jObj.put(KEY_ALGO, config.keyAlgo().symbol());
      config.keyFile().ifPresent(f -> jObj.put(KEY_FILE, f.getPath()));
      jObj.put(AUTO_GEN, config.autoGenerate());
      jObj.put(CITE_TIMEOUT, config.citationTimeoutMillis());
      jObj.put(CITE_THREADS, config.citationThreads());
      jObj.put(PAR_THRESHOLD, config.parallelThreshold());
      return jObj;
    }


    @Override
    public ZoneConfig toEntity(JSONObject jObj) throws JsonParsingException {
      var name = JsonUtils.getString(jObj, NAME, true);
      var desc = JsonUtils.getString(jObj, DESC, "");
      var keyFilepath = JsonUtils.getString(jObj, KEY_FILE, false);
      Optional<File> keyFile = Optional.ofNullable(keyFilepath).map(this::resolve);
      boolean autoGen = JsonUtils.getBoolean(jObj, AUTO_GEN, true);
      long timeout = JsonUtils.getLong(jObj, CITE_TIMEOUT, DEFAULT_CITATION_TIMEOUT);
      int threads = JsonUtils.getInt(jObj, CITE_THREADS, DEFAULT_CITATION_THREADS);
      int threshold = JsonUtils.getInt(
          jObj, PAR_THRESHOLD, MerkleTree.DEFAULT_PARALLEL_THRESHOLD);
      try {
        var algo = KeyAlgo.forSymbol(
            JsonUtils.getString(jObj, KEY_ALGO, KeyAlgo.ED25519.symbol()));
        return new ZoneConfig(
            name, desc, algo, keyFile, autoGen, timeout, threads, threshold);

      } catch (IllegalArgumentException iax) {
        throw new JsonParsingException(iax);
      }
    }


    private File resolve(String path) {
      var file = new File(path);
      return baseDir == null || file.isAbsolute() ? file : new File(baseDir, path);
    }
  }

}
