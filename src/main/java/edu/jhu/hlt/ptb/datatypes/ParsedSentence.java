package edu.jhu.hlt.ptb.datatypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The terminals of a tree (null elements included) together with its
 * anchored form. Offsets in the anchored spans index into the terminals.
 */
public class ParsedSentence {
  private final List<Leaf> terminals;
  private final AnchoredTree tree;

  public ParsedSentence(List<Leaf> terminals, AnchoredTree tree) {
    this.terminals = Collections.unmodifiableList(new ArrayList<>(terminals));
    this.tree = tree;
  }

  public List<Leaf> getTerminals() {
    return terminals;
  }

  public AnchoredTree getTree() {
    return tree;
  }

  public int size() {
    return terminals.size();
  }

  public List<String> words() {
    return words(0, terminals.size());
  }

  public List<String> words(Span s) {
    return words(s.getBegin(), s.getEnd());
  }

  public List<String> words(int begin, int end) {
    List<String> w = new ArrayList<>();
    for (Leaf l : range(begin, end))
      w.add(l.getWord());
    return w;
  }

  public List<String> tags() {
    return tags(0, terminals.size());
  }

  public List<String> tags(Span s) {
    return tags(s.getBegin(), s.getEnd());
  }

  public List<String> tags(int begin, int end) {
    List<String> t = new ArrayList<>();
    for (Leaf l : range(begin, end))
      t.add(l.getPos());
    return t;
  }

  /** (pos, word) pairs, as leaves */
  public List<Leaf> taggedWords(int begin, int end) {
    return range(begin, end);
  }

  public List<Leaf> taggedWords(Span s) {
    return range(s.getBegin(), s.getEnd());
  }

  private List<Leaf> range(int begin, int end) {
    // out of range ends are clipped, the way sequence slicing behaves
    int b = Math.max(0, Math.min(begin, terminals.size()));
    int e = Math.max(b, Math.min(end, terminals.size()));
    return terminals.subList(b, e);
  }

  public Map<String, Object> toJson() {
    Map<String, Object> j = new LinkedHashMap<>();
    j.put("parse", tree.toJson());
    j.put("words", words());
    j.put("tags", tags());
    return j;
  }
}
