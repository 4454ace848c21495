/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.anchor;


import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Volatile anchor log.
 */
public class InMemoryAnchorLog implements AnchorLog {

  private final CopyOnWriteArrayList<Anchor> anchors = new CopyOnWriteArrayList<>();


  @Override
  public void record(Anchor anchor) {
    anchors.add(Objects.requireNonNull(anchor, "null anchor"));
  }

  @Override
  public List<Anchor> list() {
    return List.copyOf(anchors);
  }

  @Override
  public int size() {
    return anchors.size();
  }

}
