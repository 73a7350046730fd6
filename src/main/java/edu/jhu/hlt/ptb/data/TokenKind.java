package edu.jhu.hlt.ptb.data;

public enum TokenKind {
  LPAREN("("),
  RPAREN(")"),
  ATOM("STRING");

  private final String display;

  TokenKind(String display) {
    this.display = display;
  }

  public String getDisplay() {
    return display;
  }
}
