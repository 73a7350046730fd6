package edu.jhu.hlt.ptb.datatypes;

public class LeafNode extends Node {

  private final Leaf leaf;

  public LeafNode(Leaf leaf) {
    if (leaf == null)
      throw new IllegalArgumentException("leaf");
    this.leaf = leaf;
  }

  @Override
  public boolean isLeaf() {
    return true;
  }

  @Override
  public Symbol getSymbol() {
    return null;
  }

  @Override
  public Leaf getLeaf() {
    return leaf;
  }

  @Override
  public Node getFirstChild() {
    return null;
  }

  @Override
  public String rhsLabel() {
    return leaf.getPos();
  }

  @Override
  public GrammarRule ruleTuple() {
    return new GrammarRule(leaf.getPos(), leaf.getWord());
  }

  @Override
  public String toString() {
    return leaf.toString();
  }
}
