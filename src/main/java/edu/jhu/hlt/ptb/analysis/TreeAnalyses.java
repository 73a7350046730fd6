package edu.jhu.hlt.ptb.analysis;

import static edu.jhu.hlt.ptb.util.ImmutableStacks.peek;
import static edu.jhu.hlt.ptb.util.ImmutableStacks.pop;
import static edu.jhu.hlt.ptb.util.ImmutableStacks.push;
import static edu.jhu.hlt.ptb.util.ImmutableStacks.replaceTop;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.ptb.datatypes.AnchoredTree;
import edu.jhu.hlt.ptb.datatypes.GrammarRule;
import edu.jhu.hlt.ptb.datatypes.Leaf;
import edu.jhu.hlt.ptb.datatypes.Node;
import edu.jhu.hlt.ptb.datatypes.ParsedSentence;
import edu.jhu.hlt.ptb.datatypes.Span;
import edu.jhu.hlt.ptb.datatypes.Symbol;
import edu.jhu.hlt.ptb.util.TreeTraversal;

/**
 * Read only extractions from a tree. None of these modify it.
 */
public final class TreeAnalyses {

  private TreeAnalyses() {}

  /**
   * Production rules of every non-leaf node in pre-order, e.g. "S -> NP VP".
   * Leaf children contribute their part of speech.
   */
  public static List<String> allRules(Node tree) {
    return TreeTraversal.preOrder(tree,
        (n, st) -> n.isLeaf() ? st : push(st, n.rule()),
        ImmutableList.<String>of());
  }

  /**
   * Every node's rule as an (lhs, rhs) pair in pre-order, lexical rules
   * (pos, word) included.
   */
  public static List<GrammarRule> grammarRules(Node tree) {
    return TreeTraversal.preOrder(tree,
        (n, st) -> push(st, n.ruleTuple()),
        ImmutableList.<GrammarRule>of());
  }

  /** All leaves, left to right. */
  public static List<Leaf> leaves(Node tree) {
    return TreeTraversal.preOrder(tree,
        (n, st) -> n.isLeaf() ? push(st, n.getLeaf()) : st,
        ImmutableList.<Leaf>of());
  }

  /**
   * One "words\tlabel" line per node in pre-order, where words are the node's
   * leaves joined by spaces and label is its base label (a leaf's part of
   * speech, the empty string for a headless node).
   */
  public static List<String> labelledPhrases(Node tree) {
    return TreeTraversal.preOrder(tree,
        (n, st) -> push(st, Sentences.words(n) + "\t" + baseLabel(n)),
        ImmutableList.<String>of());
  }

  static String baseLabel(Node n) {
    Symbol s = n.getSymbol();
    if (s != null)
      return s.getLabel();
    if (n.isLeaf())
      return n.getLeaf().getPos();
    return "";
  }

  /** Span with its node's pre-order number, for sorting back into pre-order. */
  private static final class Numbered {
    final int index;
    final Span span;
    Numbered(int index, Span span) {
      this.index = index;
      this.span = span;
    }
  }

  /** (pre-order number, begin) of a node whose children are being walked */
  private static final class Open {
    final int index;
    final int begin;
    Open(int index, int begin) {
      this.index = index;
      this.begin = begin;
    }
  }

  private static final class SpanState {
    final ImmutableList<Numbered> spans;
    final ImmutableList<Open> open;
    final int offset;
    final int count;
    SpanState(ImmutableList<Numbered> spans, ImmutableList<Open> open, int offset, int count) {
      this.spans = spans;
      this.open = open;
      this.offset = offset;
      this.count = count;
    }
  }

  /**
   * (label, begin, end) over token offsets for every labelled node, in
   * pre-order. Constituents are labelled with their full symbol, leaves with
   * their part of speech. Null elements cover no tokens, so their spans are
   * empty. Headless nodes are left out.
   */
  public static List<Span> allSpans(Node tree) {
    SpanState init = new SpanState(ImmutableList.<Numbered>of(), ImmutableList.<Open>of(), 0, 0);
    SpanState fin = TreeTraversal.traverse(tree,
        (n, st) -> new SpanState(st.spans,
            push(st.open, new Open(st.count, st.offset)),
            st.offset,
            st.count + 1),
        (n, st) -> {
          Open o = peek(st.open);
          int end = st.offset;
          String label = null;
          if (n.isLeaf()) {
            if (!n.getLeaf().isNull())
              end = o.begin + 1;
            label = n.getLeaf().getPos();
          } else if (n.getSymbol() != null) {
            label = n.getSymbol().toString();
          }
          ImmutableList<Numbered> spans = st.spans;
          if (label != null && !label.isEmpty())
            spans = push(spans, new Numbered(o.index, new Span(label, o.begin, end)));
          return new SpanState(spans, pop(st.open), end, st.count);
        },
        init);
    List<Numbered> numbered = new ArrayList<>(fin.spans);
    Collections.sort(numbered, Comparator.comparingInt(x -> x.index));
    List<Span> out = new ArrayList<>(numbered.size());
    for (Numbered x : numbered)
      out.add(x.span);
    return out;
  }

  /** A node whose children are being walked, and the indices seen so far. */
  private static final class Frame {
    final int index;
    final ImmutableList<Integer> children;
    Frame(int index, ImmutableList<Integer> children) {
      this.index = index;
      this.children = children;
    }
  }

  private static final class Finished {
    final int index;
    final Span span;
    final AnchoredTree.Edge edge;
    Finished(int index, Span span, AnchoredTree.Edge edge) {
      this.index = index;
      this.span = span;
      this.edge = edge;
    }
  }

  private static final class AnchorState {
    final ImmutableList<Integer> begins;   // by pre-order index
    final ImmutableList<Finished> done;
    final ImmutableList<Frame> frames;
    final int nextIndex;
    final int offset;
    AnchorState(ImmutableList<Integer> begins, ImmutableList<Finished> done,
        ImmutableList<Frame> frames, int nextIndex, int offset) {
      this.begins = begins;
      this.done = done;
      this.frames = frames;
      this.nextIndex = nextIndex;
      this.offset = offset;
    }
  }

  /**
   * Flattens a tree into a span per node (indexed in pre-order) and an edge
   * per non-leaf node. Every leaf, null elements included, covers one token,
   * so offsets line up with {@link #leaves}. Constituent spans are labelled
   * with the full symbol; leaf spans and headless nodes have a null label.
   */
  public static AnchoredTree makeAnchored(Node tree) {
    // frame -1 collects the root's index
    AnchorState init = new AnchorState(ImmutableList.<Integer>of(), ImmutableList.<Finished>of(),
        ImmutableList.of(new Frame(-1, ImmutableList.<Integer>of())), 0, 0);
    AnchorState fin = TreeTraversal.traverse(tree,
        (n, st) -> new AnchorState(push(st.begins, st.offset), st.done,
            push(st.frames, new Frame(st.nextIndex, ImmutableList.<Integer>of())),
            st.nextIndex + 1, st.offset),
        (n, st) -> {
          Frame f = peek(st.frames);
          ImmutableList<Frame> frames = pop(st.frames);
          int end = n.isLeaf() ? st.offset + 1 : st.offset;
          Symbol sym = n.getSymbol();
          Span span = new Span(sym == null ? null : sym.toString(), st.begins.get(f.index), end);
          AnchoredTree.Edge edge = n.isLeaf() ? null : new AnchoredTree.Edge(f.index, f.children);
          Frame parent = peek(frames);
          frames = replaceTop(frames, new Frame(parent.index, push(parent.children, f.index)));
          return new AnchorState(st.begins, push(st.done, new Finished(f.index, span, edge)),
              frames, st.nextIndex, end);
        },
        init);

    List<Finished> byIndex = new ArrayList<>(fin.done);
    Collections.sort(byIndex, Comparator.comparingInt(x -> x.index));
    List<Span> spans = new ArrayList<>(byIndex.size());
    List<AnchoredTree.Edge> edges = new ArrayList<>();
    for (Finished x : byIndex) {
      spans.add(x.span);
      if (x.edge != null)
        edges.add(x.edge);
    }
    return new AnchoredTree(spans, edges);
  }

  public static ParsedSentence makeParsedSentence(Node tree) {
    return new ParsedSentence(leaves(tree), makeAnchored(tree));
  }

  static String join(List<String> words) {
    return Joiner.on(' ').join(words);
  }
}
