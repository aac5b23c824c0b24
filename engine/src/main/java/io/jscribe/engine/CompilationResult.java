package io.jscribe.engine;

import java.util.List;

/**
 * The flattened root branches of a successful compilation, in creation order.
 *
 * @param branches one entry per root branch
 */
public record CompilationResult(List<RenderedBranch> branches) {

  /**
   * The final text of one root branch.
   *
   * @param id branch identifier
   * @param kind branch kind as given at creation
   * @param destination destination tag, or null if the branch is kept in memory only
   * @param text flattened text
   */
  public record RenderedBranch(String id, String kind, String destination, String text) {}

  public CompilationResult {
    branches = List.copyOf(branches);
  }

  /**
   * Returns the text of a root branch.
   *
   * @param id branch identifier
   * @return flattened text
   * @throws IllegalArgumentException if no root branch has this identifier
   */
  public String text(String id) {
    return branches.stream()
        .filter(b -> b.id().equals(id))
        .findFirst()
        .map(RenderedBranch::text)
        .orElseThrow(() -> new IllegalArgumentException("No root branch: " + id));
  }

  /** Returns the text of the main branch. */
  public String mainText() {
    return text(Compiler.MAIN_BRANCH);
  }
}
