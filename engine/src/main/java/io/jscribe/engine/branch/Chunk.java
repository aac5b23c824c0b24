package io.jscribe.engine.branch;

import io.jscribe.parser.SourceLocation;

/** One element of a branch: literal text or a reference to another branch. */
public sealed interface Chunk permits Chunk.Text, Chunk.Reference {

  /** Literal output text. Consecutive writes are merged into the last text chunk. */
  final class Text implements Chunk {
    private final StringBuilder text = new StringBuilder();

    Text(String initial) {
      text.append(initial);
    }

    void append(String more) {
      text.append(more);
    }

    public String text() {
      return text.toString();
    }

    @Override
    public String toString() {
      return text.toString();
    }
  }

  /**
   * A reference to another branch, resolved when the containing branch is flattened.
   *
   * @param targetId identifier of the referenced branch
   * @param location location of the {@code $branch.append} that recorded the reference
   */
  record Reference(String targetId, SourceLocation location) implements Chunk {}
}
