/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.anchor;


import java.nio.ByteBuffer;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import io.crums.zone.UnreachableException;

/**
 * Record of the anchors obtained for a zone's roots. More than one anchor may
 * bind the same root (e.g. via different mechanisms); the earliest one counts.
 *
 * @see InMemoryAnchorLog
 */
public interface AnchorLog extends AutoCloseable {

  /**
   * Records the given anchor.
   */
  void record(Anchor anchor) throws UnreachableException;


  /**
   * Returns all anchors, in the order recorded.
   */
  List<Anchor> list() throws UnreachableException;


  /**
   * Returns the number of anchors recorded.
   */
  default int size() throws UnreachableException {
    return list().size();
  }


  /**
   * Returns the most recently recorded anchor, if any.
   */
  default Optional<Anchor> latest() throws UnreachableException {
    var all = list();
    return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
  }


  /**
   * Returns the earliest (by timestamp) anchor binding the given root, if any.
   */
  default Optional<Anchor> forRoot(ByteBuffer root) throws UnreachableException {
    return list().stream()
        .filter(a -> a.anchors(root))
        .min(Comparator.comparingLong(Anchor::utc));
  }


  /**
   * Releases resources. Does nothing, by default.
   */
  @Override
  default void close() throws UnreachableException {  }

}
