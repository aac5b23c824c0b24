package io.jscribe.engine.expand;

import io.jscribe.engine.EvaluationException;
import io.jscribe.parser.EscapeMode;
import io.jscribe.parser.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * The output produced by expanding a node sequence into a capture. Text is kept as pieces tagged
 * with the escape mode it was tokenized under; computed text carries {@link EscapeMode#NONE}.
 * Branch references made while the capture was open stay in place among the text and are recorded
 * in the branch only when the capture is emitted.
 *
 * @param pieces captured pieces in output order
 */
public record Rendered(List<Piece> pieces) {

  /** One element of captured output. */
  public sealed interface Piece permits Text, Reference {}

  /**
   * A run of captured text.
   *
   * @param text unescaped text
   * @param escape mode applied when the piece reaches output
   */
  public record Text(String text, EscapeMode escape) implements Piece {}

  /**
   * A deferred placement of another branch.
   *
   * @param branchId identifier of the referenced branch
   * @param location location of the {@code $branch.append} that made it
   */
  public record Reference(String branchId, SourceLocation location) implements Piece {}

  public Rendered {
    pieces = List.copyOf(pieces);
  }

  /**
   * Returns the text with no escaping applied, for names, numbers and paths.
   *
   * @throws EvaluationException if the capture holds a branch reference
   */
  public String raw() throws EvaluationException {
    StringBuilder sb = new StringBuilder();
    for (Piece piece : pieces) {
      sb.append(textOf(piece).text());
    }
    return sb.toString();
  }

  /**
   * Returns the text as it appears in output.
   *
   * @throws EvaluationException if the capture holds a branch reference
   */
  public String escaped() throws EvaluationException {
    StringBuilder sb = new StringBuilder();
    for (Piece piece : pieces) {
      Text text = textOf(piece);
      sb.append(text.escape().apply(text.text()));
    }
    return sb.toString();
  }

  /** Returns true if the capture holds at least one branch reference. */
  public boolean hasReferences() {
    for (Piece piece : pieces) {
      if (piece instanceof Reference) {
        return true;
      }
    }
    return false;
  }

  /**
   * Transforms the unescaped text of every text piece, keeping each piece's escape mode. Branch
   * references are kept where they are.
   */
  public Rendered map(UnaryOperator<String> transform) {
    List<Piece> mapped = new ArrayList<>(pieces.size());
    for (Piece piece : pieces) {
      if (piece instanceof Text text) {
        mapped.add(new Text(transform.apply(text.text()), text.escape()));
      } else {
        mapped.add(piece);
      }
    }
    return new Rendered(mapped);
  }

  private static Text textOf(Piece piece) throws EvaluationException {
    if (piece instanceof Reference ref) {
      throw new EvaluationException(
          "branch " + ref.branchId() + " appended where plain text is required");
    }
    return (Text) piece;
  }
}
