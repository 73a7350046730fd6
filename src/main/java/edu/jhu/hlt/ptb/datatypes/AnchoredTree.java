package edu.jhu.hlt.ptb.datatypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A tree flattened into spans indexed by pre-order position, plus one edge
 * entry per non-leaf node listing the indices of its direct children.
 */
public class AnchoredTree {

  public static final class Edge {
    private final int parent;
    private final List<Integer> children;

    public Edge(int parent, List<Integer> children) {
      this.parent = parent;
      this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public int getParent() {
      return parent;
    }

    public List<Integer> getChildren() {
      return children;
    }

    /** [parent, [children...]] */
    public List<Object> toJson() {
      List<Object> j = new ArrayList<>(2);
      j.add(parent);
      j.add(children);
      return j;
    }

    @Override
    public String toString() {
      return "(" + parent + ", " + children + ")";
    }
  }

  private final List<Span> spans;
  private final List<Edge> edges;

  public AnchoredTree(List<Span> spans, List<Edge> edges) {
    this.spans = Collections.unmodifiableList(new ArrayList<>(spans));
    this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
  }

  /** indexed by pre-order node index */
  public List<Span> getSpans() {
    return spans;
  }

  /** in the pre-order of their parent nodes */
  public List<Edge> getEdges() {
    return edges;
  }

  public Map<String, Object> toJson() {
    List<Object> s = new ArrayList<>(spans.size());
    for (Span sp : spans)
      s.add(sp.toJson());
    List<Object> e = new ArrayList<>(edges.size());
    for (Edge ed : edges)
      e.add(ed.toJson());
    Map<String, Object> j = new LinkedHashMap<>();
    j.put("spans", s);
    j.put("edges", e);
    return j;
  }
}
