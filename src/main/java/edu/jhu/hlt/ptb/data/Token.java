package edu.jhu.hlt.ptb.data;

/**
 * One lexical item of bracketed tree text. Only {@link TokenKind#ATOM} tokens
 * carry text.
 */
public final class Token {
  public static final int NO_LINE = -1;

  private final TokenKind kind;
  private final String text;
  private final int line;

  public Token(TokenKind kind, String text, int line) {
    if (kind == null)
      throw new IllegalArgumentException("kind");
    if ((kind == TokenKind.ATOM) != (text != null))
      throw new IllegalArgumentException("only atoms carry text: " + kind + " " + text);
    this.kind = kind;
    this.text = text;
    this.line = line;
  }

  public static Token lparen(int line) {
    return new Token(TokenKind.LPAREN, null, line);
  }

  public static Token rparen(int line) {
    return new Token(TokenKind.RPAREN, null, line);
  }

  public static Token atom(String text, int line) {
    return new Token(TokenKind.ATOM, text, line);
  }

  public TokenKind getKind() {
    return kind;
  }

  public boolean is(TokenKind k) {
    return kind == k;
  }

  /** null unless this is an atom */
  public String getText() {
    return text;
  }

  /** 1-based line number, or {@link #NO_LINE} */
  public int getLine() {
    return line;
  }

  @Override
  public String toString() {
    return "Token:'" + (text != null ? text : kind.getDisplay()) + "'"
        + (line != NO_LINE ? ":" + line : "");
  }
}
