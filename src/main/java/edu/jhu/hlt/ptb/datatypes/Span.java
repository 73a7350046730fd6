package edu.jhu.hlt.ptb.datatypes;

import java.util.Arrays;
import java.util.List;

/**
 * A labelled range of token offsets, begin inclusive and end exclusive. The
 * label may be null (leaves and headless nodes in an anchored tree).
 */
public final class Span {
  private final String label;
  private final int begin;
  private final int end;

  public Span(String label, int begin, int end) {
    if (begin < 0 || end < begin)
      throw new IllegalArgumentException("begin=" + begin + " end=" + end);
    this.label = label;
    this.begin = begin;
    this.end = end;
  }

  public String getLabel() {
    return label;
  }

  public int getBegin() {
    return begin;
  }

  public int getEnd() {
    return end;
  }

  public int width() {
    return end - begin;
  }

  /** [label, begin, end], label may be null */
  public List<Object> toJson() {
    return Arrays.<Object>asList(label, begin, end);
  }

  @Override
  public int hashCode() {
    return (label == null ? 0 : label.hashCode() * 31 * 31) + (begin << 16) + end;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Span) {
      Span s = (Span) other;
      return begin == s.begin && end == s.end
          && (label == null ? s.label == null : label.equals(s.label));
    }
    return false;
  }

  @Override
  public String toString() {
    return "(" + label + ", " + begin + ", " + end + ")";
  }
}
