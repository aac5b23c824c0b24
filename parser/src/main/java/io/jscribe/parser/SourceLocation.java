package io.jscribe.parser;

/**
 * Position of a token in a source file.
 *
 * @param file logical name of the file, as given to the tokenizer
 * @param line 1-based line index
 * @param column 1-based column index
 */
public record SourceLocation(String file, int line, int column) {

  /**
   * Returns the location of the first character of a file.
   *
   * @param file logical file name
   * @return location at line 1, column 1
   */
  public static SourceLocation start(String file) {
    return new SourceLocation(file, 1, 1);
  }

  @Override
  public String toString() {
    return file + ":" + line + ":" + column;
  }
}
