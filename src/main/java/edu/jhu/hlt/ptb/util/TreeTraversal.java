package edu.jhu.hlt.ptb.util;

import java.util.function.BiFunction;

import edu.jhu.hlt.ptb.datatypes.Node;

/**
 * Depth first walk over a tree with explicitly threaded state.
 *
 * If given, {@code pre} is called on a node before its children and its return
 * value is the state handed to the first child. {@code post} is called after
 * the last child and its return value is handed on to the next sibling (or
 * back up to the parent). Either may be null, in which case the state passes
 * through unchanged.
 *
 * Callbacks must return a state rather than mutate a shared one, otherwise
 * sibling subtrees see each other's changes.
 */
public final class TreeTraversal {

  private TreeTraversal() {}

  public static <S> S traverse(Node root,
      BiFunction<Node, S, S> pre,
      BiFunction<Node, S, S> post,
      S state) {
    if (pre != null)
      state = pre.apply(root, state);
    // the sibling link is read after the child's walk: post may relink
    // grandchildren but never the child itself
    for (Node c = root.getFirstChild(); c != null; c = c.getNextSibling())
      state = traverse(c, pre, post, state);
    if (post != null)
      state = post.apply(root, state);
    return state;
  }

  public static <S> S preOrder(Node root, BiFunction<Node, S, S> pre, S state) {
    return traverse(root, pre, null, state);
  }

  public static <S> S postOrder(Node root, BiFunction<Node, S, S> post, S state) {
    return traverse(root, null, post, state);
  }
}
