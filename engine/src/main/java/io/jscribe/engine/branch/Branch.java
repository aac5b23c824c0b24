package io.jscribe.engine.branch;

import io.jscribe.parser.SourceLocation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named output buffer. Chunks are only ever appended; references are kept symbolic until the
 * branch is flattened.
 */
public final class Branch {
  private final String id;
  private final String kind;
  private final String destination;
  private final Branch parent;
  private final List<Chunk> chunks = new ArrayList<>();

  Branch(String id, String kind, String destination, Branch parent) {
    this.id = id;
    this.kind = kind;
    this.destination = destination;
    this.parent = parent;
  }

  public String id() {
    return id;
  }

  /** Returns the kind of the root this branch belongs to. The engine does not interpret it. */
  public String kind() {
    return kind;
  }

  /** Returns the destination tag of a root branch, or null. */
  public String destination() {
    return destination;
  }

  /** Returns the branch this one was created under, or null for a root. */
  public Branch parent() {
    return parent;
  }

  public boolean isRoot() {
    return parent == null;
  }

  public List<Chunk> chunks() {
    return Collections.unmodifiableList(chunks);
  }

  void appendText(String text) {
    if (text.isEmpty()) {
      return;
    }
    if (!chunks.isEmpty() && chunks.get(chunks.size() - 1) instanceof Chunk.Text last) {
      last.append(text);
    } else {
      chunks.add(new Chunk.Text(text));
    }
  }

  void appendReference(String targetId, SourceLocation location) {
    chunks.add(new Chunk.Reference(targetId, location));
  }

  @Override
  public String toString() {
    return "Branch{" + id + ", kind=" + kind + ", chunks=" + chunks.size() + '}';
  }
}
