package io.jscribe.parser.ast;

import io.jscribe.parser.SourceLocation;

/** A unit of tokenized source: either a literal text run or a macro invocation. */
public sealed interface Node permits TextNode, CallNode {

  /** Returns where the node starts in its source file. */
  SourceLocation location();
}
