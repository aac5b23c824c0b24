package io.jscribe.engine.branch;

import io.jscribe.engine.CycleException;
import io.jscribe.engine.EvaluationException;
import io.jscribe.engine.RedefinitionException;
import io.jscribe.parser.SourceLocation;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the branch tree of a compilation unit.
 *
 * <p>Output is produced in two phases. During expansion text and references are appended to
 * branches. Once expansion is over, {@link #flatten(String)} resolves every reference against the
 * content its target has at that point, so a branch can be placed before it is written.
 *
 * <pre>{@code
 * branches.createRoot("text", "main", "out.txt");
 * branches.createSub("notes");
 * branches.append("notes", at);          // placeholder in main
 * branches.appendText("notes", "[1] A"); // later write, still lands at the placeholder
 * String text = branches.flatten("main");
 * }</pre>
 */
public final class BranchManager {
  private static final Logger log = LoggerFactory.getLogger(BranchManager.class);

  /** Prefix of a requested identifier that asks for a generated, unique one. */
  public static final char AUTO_MARKER = '!';

  private final Map<String, Branch> branches = new LinkedHashMap<>();
  private final Map<String, String> destinations = new HashMap<>();
  private final Map<String, Integer> autoSequence = new HashMap<>();
  private Branch active;

  /** Returns true if the identifier requests a generated name. */
  public static boolean isAutoNamed(String requestedId) {
    return requestedId.length() > 1 && requestedId.charAt(0) == AUTO_MARKER;
  }

  /**
   * Creates a root branch. The first root created becomes the active branch.
   *
   * @param kind opaque kind forwarded to the destination writer
   * @param requestedId identifier, or {@code !base} for a generated {@code base#n}
   * @param destination destination tag, or null or empty for none
   * @return the new branch
   * @throws RedefinitionException if the identifier or destination is already in use
   */
  public Branch createRoot(String kind, String requestedId, String destination)
      throws RedefinitionException {
    String dest = destination == null || destination.isEmpty() ? null : destination;
    if (dest != null && destinations.containsKey(dest)) {
      throw new RedefinitionException(
          "destination already used by branch " + destinations.get(dest) + ": " + dest);
    }
    Branch branch = register(new Branch(resolveId(requestedId), kind, dest, null));
    if (dest != null) {
      destinations.put(dest, branch.id());
    }
    if (active == null) {
      active = branch;
    }
    return branch;
  }

  /**
   * Creates a branch under the active branch. The new branch inherits the active branch's kind and
   * does not appear in any output until it is appended somewhere.
   *
   * @param requestedId identifier, or {@code !base} for a generated {@code base#n}
   * @return the new branch
   * @throws RedefinitionException if the identifier is already in use
   * @throws IllegalStateException if no root branch exists yet
   */
  public Branch createSub(String requestedId) throws RedefinitionException {
    if (active == null) {
      throw new IllegalStateException("No active branch");
    }
    return register(new Branch(resolveId(requestedId), active.kind(), null, active));
  }

  private String resolveId(String requestedId) throws RedefinitionException {
    if (!isAutoNamed(requestedId)) {
      if (branches.containsKey(requestedId)) {
        throw new RedefinitionException("a branch of this name already exists: " + requestedId);
      }
      return requestedId;
    }
    String base = requestedId.substring(1);
    String id;
    do {
      int n = autoSequence.merge(base, 1, Integer::sum);
      id = base + "#" + n;
    } while (branches.containsKey(id));
    return id;
  }

  private Branch register(Branch branch) {
    branches.put(branch.id(), branch);
    log.debug(
        "Created branch {} (kind {}, parent {})",
        branch.id(),
        branch.kind(),
        branch.parent() == null ? "none" : branch.parent().id());
    return branch;
  }

  /**
   * Looks up a branch.
   *
   * @throws EvaluationException if no branch has this identifier
   */
  public Branch get(String id) throws EvaluationException {
    Branch branch = branches.get(id);
    if (branch == null) {
      throw new EvaluationException("branch not found: " + id);
    }
    return branch;
  }

  public boolean contains(String id) {
    return branches.containsKey(id);
  }

  public Branch active() {
    return active;
  }

  public void activate(Branch branch) {
    this.active = branch;
  }

  /** Appends text to the active branch. */
  public void appendText(String text) {
    if (active == null) {
      throw new IllegalStateException("No active branch");
    }
    active.appendText(text);
  }

  /**
   * Appends text to a branch.
   *
   * @throws EvaluationException if no branch has this identifier
   */
  public void appendText(String id, String text) throws EvaluationException {
    get(id).appendText(text);
  }

  /**
   * Records a reference to branch {@code id} at the current end of the active branch. The reference
   * is resolved by {@link #flatten(String)}, against whatever the target holds by then.
   *
   * @param id identifier of the branch to place
   * @param location location of the request, reported if the reference closes a cycle
   * @throws EvaluationException if no branch has this identifier
   */
  public void append(String id, SourceLocation location) throws EvaluationException {
    Branch target = get(id);
    if (active == null) {
      throw new IllegalStateException("No active branch");
    }
    active.appendReference(target.id(), location);
  }

  /**
   * Resolves a branch into text, substituting referenced branches depth first. Does not modify any
   * branch, so flattening an unchanged tree twice gives the same text.
   *
   * @param id identifier of the branch, usually a root
   * @return the flattened text
   * @throws EvaluationException if no branch has this identifier
   * @throws CycleException if a branch transitively references itself
   */
  public String flatten(String id) throws EvaluationException, CycleException {
    StringBuilder out = new StringBuilder();
    render(get(id), new LinkedHashSet<>(), out);
    log.debug("Flattened branch {} into {} chars", id, out.length());
    return out.toString();
  }

  private void render(Branch branch, LinkedHashSet<String> path, StringBuilder out)
      throws EvaluationException, CycleException {
    path.add(branch.id());
    for (Chunk chunk : branch.chunks()) {
      if (chunk instanceof Chunk.Text text) {
        out.append(text.text());
      } else if (chunk instanceof Chunk.Reference ref) {
        if (path.contains(ref.targetId())) {
          List<String> chain = new ArrayList<>(path);
          chain.add(ref.targetId());
          throw new CycleException("branch reference cycle", chain, ref.location());
        }
        render(get(ref.targetId()), path, out);
      }
    }
    path.remove(branch.id());
  }

  /**
   * Checks the whole reference graph, including branches that no root reaches.
   *
   * @throws CycleException if any branch transitively references itself
   */
  public void checkAcyclic() throws CycleException {
    Set<String> done = new HashSet<>();
    for (Branch branch : branches.values()) {
      visit(branch, new LinkedHashSet<>(), done);
    }
  }

  private void visit(Branch branch, LinkedHashSet<String> path, Set<String> done)
      throws CycleException {
    if (done.contains(branch.id())) {
      return;
    }
    path.add(branch.id());
    for (Chunk chunk : branch.chunks()) {
      if (chunk instanceof Chunk.Reference ref) {
        if (path.contains(ref.targetId())) {
          List<String> chain = new ArrayList<>(path);
          chain.add(ref.targetId());
          throw new CycleException("branch reference cycle", chain, ref.location());
        }
        visit(branches.get(ref.targetId()), path, done);
      }
    }
    path.remove(branch.id());
    done.add(branch.id());
  }

  /** Returns the root branches in creation order. */
  public List<Branch> roots() {
    List<Branch> roots = new ArrayList<>();
    for (Branch b : branches.values()) {
      if (b.isRoot()) {
        roots.add(b);
      }
    }
    return roots;
  }
}
