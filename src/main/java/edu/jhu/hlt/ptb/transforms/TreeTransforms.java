package edu.jhu.hlt.ptb.transforms;

import static edu.jhu.hlt.ptb.util.ImmutableStacks.peek;
import static edu.jhu.hlt.ptb.util.ImmutableStacks.pop;
import static edu.jhu.hlt.ptb.util.ImmutableStacks.push;
import static edu.jhu.hlt.ptb.util.ImmutableStacks.replaceTop;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import edu.jhu.hlt.ptb.datatypes.Constituent;
import edu.jhu.hlt.ptb.datatypes.Leaf;
import edu.jhu.hlt.ptb.datatypes.Node;
import edu.jhu.hlt.ptb.datatypes.Symbol;
import edu.jhu.hlt.ptb.util.TreeTraversal;

/**
 * In place rewrites of a parsed tree. Each returns the (possibly new) root.
 */
public final class TreeTransforms {

  public static final String ROOT = "ROOT";
  public static final String TOP = "TOP";
  public static final String PARENT_SEPARATOR = "^";

  /** Head labels which {@link #addRoot} relabels instead of wrapping. */
  public static final ImmutableSet<String> RESERVED_ROOT_LABELS = ImmutableSet.of(ROOT, TOP);

  private TreeTransforms() {}

  /** A child as seen by its parent's post visit. */
  private static final class Kept {
    final boolean keep;
    final Node node;
    Kept(boolean keep, Node node) {
      this.keep = keep;
      this.node = node;
    }
  }

  /**
   * Removes null elements (leaves tagged -NONE-) and every constituent left
   * with no children because of it. Survivors keep their order. The root
   * itself is never removed, though it may end up with no children.
   */
  public static Node removeEmptyElements(Node tree) {
    ImmutableList<ImmutableList<Kept>> init = ImmutableList.of(ImmutableList.<Kept>of());
    TreeTraversal.traverse(tree,
        (n, st) -> n.isLeaf() ? st : push(st, ImmutableList.<Kept>of()),
        (n, st) -> {
          boolean keep;
          if (n.isLeaf()) {
            keep = !n.getLeaf().isNull();
          } else {
            List<Node> survivors = new ArrayList<>();
            for (Kept k : peek(st))
              if (k.keep)
                survivors.add(k.node);
            st = pop(st);
            ((Constituent) n).setFirstChild(Constituent.link(survivors));
            keep = !survivors.isEmpty();
          }
          return replaceTop(st, push(peek(st), new Kept(keep, n)));
        },
        init);
    return tree;
  }

  /**
   * Clears indices and parent marks from every label, and all functional tags
   * except SBJ when keepSbj is set.
   */
  public static Node simplifyLabels(Node tree, boolean keepSbj) {
    TreeTraversal.preOrder(tree, (n, st) -> {
      if (n.getSymbol() != null)
        n.getSymbol().simplify(keepSbj);
      return st;
    }, null);
    return tree;
  }

  public static Node simplifyLabels(Node tree) {
    return simplifyLabels(tree, false);
  }

  /**
   * Marks each labelled node with its parent's base label and tags, e.g. the
   * NP under "(S-TPC ...)" prints as "NP^S-TPC". The root is not marked.
   * Children of a headless root get an empty mark.
   */
  public static Node annotateParent(Node tree) {
    TreeTraversal.traverse(tree,
        (n, st) -> {
          Symbol sym = n.getSymbol();
          String s = sym == null ? "" : sym.labelWithTags();
          if (!st.isEmpty() && sym != null)
            sym.setParentMark(peek(st));
          return push(st, s);
        },
        (n, st) -> pop(st),
        ImmutableList.<String>of());
    return tree;
  }

  /**
   * Cuts labels and parts of speech at the first '^', for trees read back in
   * after being written with parent annotation.
   */
  public static Node removeParent(Node tree) {
    TreeTraversal.preOrder(tree, (n, st) -> {
      Symbol sym = n.getSymbol();
      Leaf leaf = n.getLeaf();
      if (sym != null)
        sym.setLabel(beforeParent(sym.getLabel()));
      else if (leaf != null)
        leaf.setPos(beforeParent(leaf.getPos()));
      return st;
    }, null);
    return tree;
  }

  static String beforeParent(String s) {
    int i = s.indexOf(PARENT_SEPARATOR);
    return i < 0 ? s : s.substring(0, i);
  }

  /**
   * Marks the single child of the root with the parent mark ROOT.
   *
   * @throws StructuralPreconditionException unless the root has exactly one
   * child and that child is a labelled constituent
   */
  public static Node markTop(Node tree) {
    int n = tree.numChildren();
    if (n != 1)
      throw new StructuralPreconditionException(
          "markTop needs exactly one top level child, found " + n + " in " + tree);
    Symbol top = tree.getFirstChild().getSymbol();
    if (top == null)
      throw new StructuralPreconditionException(
          "markTop needs a labelled top level constituent: " + tree);
    top.setParentMark(ROOT);
    return tree;
  }

  /**
   * Gives the tree a root labelled rootLabel. A headless root, or one labelled
   * ROOT, TOP or rootLabel itself, is relabelled; any other tree is wrapped in
   * a new one child root node. Labels are compared as parsed symbols, so "S1"
   * matches a root already relabelled from "S1".
   *
   * @return the root, which is a new node if the tree was wrapped
   */
  public static Node addRoot(Node tree, String rootLabel) {
    if (rootLabel == null || rootLabel.isEmpty())
      throw new IllegalArgumentException("rootLabel");
    Symbol root = new Symbol(rootLabel);
    if (tree instanceof Constituent) {
      Constituent c = (Constituent) tree;
      if (c.isHeadless()
          || RESERVED_ROOT_LABELS.contains(c.getSymbol().getLabel())
          || root.toString().equals(c.getSymbol().toString())) {
        c.setSymbol(root);
        return c;
      }
    }
    return new Constituent(root, tree);
  }

  public static Node addRoot(Node tree) {
    return addRoot(tree, ROOT);
  }
}
