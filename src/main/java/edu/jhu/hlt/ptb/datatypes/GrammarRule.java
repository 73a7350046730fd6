package edu.jhu.hlt.ptb.datatypes;

/**
 * A production as a (left hand side, space separated right hand side) pair.
 * Lexical rules have the part of speech on the left and the word on the right.
 */
public final class GrammarRule {
  private final String lhs;
  private final String rhs;

  public GrammarRule(String lhs, String rhs) {
    this.lhs = lhs;
    this.rhs = rhs;
  }

  public String getLhs() {
    return lhs;
  }

  public String getRhs() {
    return rhs;
  }

  @Override
  public int hashCode() {
    return 31 * lhs.hashCode() + rhs.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof GrammarRule) {
      GrammarRule r = (GrammarRule) other;
      return lhs.equals(r.lhs) && rhs.equals(r.rhs);
    }
    return false;
  }

  @Override
  public String toString() {
    return lhs + " -> " + rhs;
  }
}
