package edu.jhu.hlt.ptb.data;

/**
 * Bracketed text that does not form a tree: unbalanced parentheses, or an atom
 * where only subtrees may appear.
 */
public class PtbParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int line;

  public PtbParseException(String message, int line) {
    super(line == Token.NO_LINE ? message : "line " + line + ": " + message);
    this.line = line;
  }

  public PtbParseException(String message, Token at) {
    this(message + ", at " + at, at.getLine());
  }

  /** 1-based line of the offending token, or {@link Token#NO_LINE} */
  public int getLine() {
    return line;
  }
}
