package edu.jhu.hlt.ptb.datatypes;

import java.util.List;

/**
 * A non-terminal. The symbol is null for a headless constituent, which is how
 * the unlabelled outer brackets of some treebanks come out of the parser.
 */
public class Constituent extends Node {

  private Symbol symbol;
  private Node firstChild;

  public Constituent(Symbol symbol, Node firstChild) {
    this.symbol = symbol;
    this.firstChild = firstChild;
  }

  /**
   * Links the given nodes into a sibling chain under a new constituent.
   */
  public static Constituent of(Symbol symbol, List<Node> children) {
    return new Constituent(symbol, link(children));
  }

  /**
   * Chains the nodes together in list order and returns the first (or null
   * if there are none). The last node's next sibling is cleared.
   */
  public static Node link(List<Node> nodes) {
    if (nodes.isEmpty())
      return null;
    for (int i = 0; i < nodes.size() - 1; i++)
      nodes.get(i).setNextSibling(nodes.get(i + 1));
    nodes.get(nodes.size() - 1).setNextSibling(null);
    return nodes.get(0);
  }

  @Override
  public boolean isLeaf() {
    return false;
  }

  @Override
  public Symbol getSymbol() {
    return symbol;
  }

  public void setSymbol(Symbol symbol) {
    this.symbol = symbol;
  }

  public boolean isHeadless() {
    return symbol == null;
  }

  @Override
  public Leaf getLeaf() {
    return null;
  }

  @Override
  public Node getFirstChild() {
    return firstChild;
  }

  public void setFirstChild(Node firstChild) {
    this.firstChild = firstChild;
  }

  /** Full symbol string, or the empty string when headless. */
  public String symbolString() {
    return symbol == null ? "" : symbol.toString();
  }

  @Override
  public String rhsLabel() {
    return symbolString();
  }

  @Override
  public GrammarRule ruleTuple() {
    StringBuilder rhs = new StringBuilder();
    for (Node c = firstChild; c != null; c = c.getNextSibling()) {
      if (rhs.length() > 0)
        rhs.append(' ');
      rhs.append(c.rhsLabel());
    }
    return new GrammarRule(symbolString(), rhs.toString());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(");
    sb.append(symbolString());
    sb.append(' ');
    boolean first = true;
    for (Node c = firstChild; c != null; c = c.getNextSibling()) {
      if (first) first = false;
      else sb.append(' ');
      sb.append(c);
    }
    sb.append(')');
    return sb.toString();
  }
}
