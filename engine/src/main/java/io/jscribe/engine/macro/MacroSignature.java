package io.jscribe.engine.macro;

import io.jscribe.engine.EvaluationException;
import io.jscribe.parser.Tokenizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The head of a macro definition: {@code name}, {@code name()} or {@code name(a, b)}.
 *
 * @param name macro name
 * @param params parameter names in order
 */
public record MacroSignature(String name, List<String> params) {

  public MacroSignature {
    params = List.copyOf(params);
  }

  /**
   * Parses a signature.
   *
   * @param text signature source
   * @return parsed signature
   * @throws EvaluationException if the signature is malformed or repeats a parameter
   */
  public static MacroSignature parse(String text) throws EvaluationException {
    String source = text.strip();
    int open = source.indexOf('(');
    String name = open < 0 ? source : source.substring(0, open).strip();
    if (!Tokenizer.isValidName(name)) {
      throw new EvaluationException("invalid macro signature: '" + text + "'");
    }
    List<String> params = new ArrayList<>();
    if (open >= 0) {
      if (!source.endsWith(")")) {
        throw new EvaluationException("invalid macro signature: '" + text + "'");
      }
      String list = source.substring(open + 1, source.length() - 1).strip();
      if (!list.isEmpty()) {
        Set<String> seen = new HashSet<>();
        for (String part : list.split(",", -1)) {
          String param = part.strip();
          if (!Tokenizer.isValidName(param)) {
            throw new EvaluationException(
                "invalid parameter name in signature '" + text + "': '" + param + "'");
          }
          if (!seen.add(param)) {
            throw new EvaluationException(
                "duplicate parameter in signature '" + text + "': " + param);
          }
          params.add(param);
        }
      }
    }
    return new MacroSignature(name, params);
  }
}
