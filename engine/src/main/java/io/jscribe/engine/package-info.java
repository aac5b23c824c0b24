/**
 * The jscribe expansion engine.
 *
 * <p>{@link io.jscribe.engine.Compiler} owns one {@link io.jscribe.engine.CompilationContext} per
 * run. Expansion appends text and branch references; flattening resolves them once expansion is
 * over. Every failure is a checked {@link io.jscribe.parser.ScribeException} subtype and aborts the
 * whole unit.
 *
 * <p><b>Example</b>
 *
 * <pre>{@code
 * CompilationResult result =
 *     Compiler.builder()
 *         .build()
 *         .compileSource("hello.psc", "$macro.new[greet(name)][Hello, $name!]$greet[World]");
 * result.mainText(); // "Hello, World!"
 * }</pre>
 */
package io.jscribe.engine;
