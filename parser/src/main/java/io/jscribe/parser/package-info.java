/**
 * Source-level model of the jscribe macro language.
 *
 * <p>{@link io.jscribe.parser.Tokenizer} turns source text into {@link io.jscribe.parser.ast.Node}
 * trees, applying directives to the unit's {@link io.jscribe.parser.ModeState} as it reads them.
 * All failures derive from {@link io.jscribe.parser.ScribeException} and carry a {@link
 * io.jscribe.parser.SourceLocation}.
 *
 * <p><b>Example</b>
 *
 * <pre>{@code
 * ModeState modes = new ModeState();
 * List<Node> nodes = Tokenizer.tokenize("intro.psc", "$$whitespace.skip\n$greet[World]", modes);
 * }</pre>
 */
package io.jscribe.parser;
