package edu.jhu.hlt.ptb.datatypes;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A node in a bracketed tree, either a {@link Constituent} or a
 * {@link LeafNode}. Children are held as a chain: a constituent points at its
 * first child, and each child points at its next sibling. A node is owned by
 * exactly one parent.
 */
public abstract class Node {

  private Node nextSibling;

  public Node getNextSibling() {
    return nextSibling;
  }

  public void setNextSibling(Node nextSibling) {
    this.nextSibling = nextSibling;
  }

  public abstract boolean isLeaf();

  /** null for leaves and headless constituents */
  public abstract Symbol getSymbol();

  /** null for constituents */
  public abstract Leaf getLeaf();

  /** null for leaves and childless constituents */
  public abstract Node getFirstChild();

  /** The label shown for this node on the right hand side of a rule. */
  public abstract String rhsLabel();

  /** e.g. "NP -> DT NN", or "DT -> the" for a leaf */
  public String rule() {
    GrammarRule r = ruleTuple();
    return r.getLhs() + " -> " + r.getRhs();
  }

  public abstract GrammarRule ruleTuple();

  public Iterable<Node> children() {
    return new Iterable<Node>() {
      @Override
      public Iterator<Node> iterator() {
        return new Iterator<Node>() {
          private Node cur = getFirstChild();
          @Override
          public boolean hasNext() {
            return cur != null;
          }
          @Override
          public Node next() {
            if (cur == null)
              throw new NoSuchElementException();
            Node n = cur;
            cur = cur.getNextSibling();
            return n;
          }
        };
      }
    };
  }

  public int numChildren() {
    int n = 0;
    for (Node c = getFirstChild(); c != null; c = c.getNextSibling())
      n++;
    return n;
  }
}
