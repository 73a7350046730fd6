package edu.jhu.hlt.ptb.datatypes;

/**
 * A terminal: a word and its part of speech.
 */
public class Leaf {
  public static final String NULL_POS = "-NONE-";

  private final String word;
  private String pos;

  public Leaf(String word, String pos) {
    if (word == null || pos == null)
      throw new IllegalArgumentException("word=" + word + " pos=" + pos);
    this.word = word;
    this.pos = pos;
  }

  public String getWord() {
    return word;
  }

  public String getPos() {
    return pos;
  }

  public void setPos(String pos) {
    this.pos = pos;
  }

  /** true for empty elements such as traces */
  public boolean isNull() {
    return NULL_POS.equals(pos);
  }

  @Override
  public int hashCode() {
    return 31 * word.hashCode() + pos.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Leaf) {
      Leaf l = (Leaf) other;
      return word.equals(l.word) && pos.equals(l.pos);
    }
    return false;
  }

  @Override
  public String toString() {
    return "(" + pos + " " + word + ")";
  }
}
