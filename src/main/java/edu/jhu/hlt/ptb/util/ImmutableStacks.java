package edu.jhu.hlt.ptb.util;

import com.google.common.collect.ImmutableList;

/**
 * Copying push/pop on {@link ImmutableList}s, used as traversal state so that
 * each level of a walk gets its own value. Trees are sentence sized, so the
 * copies are cheap.
 */
public final class ImmutableStacks {

  private ImmutableStacks() {}

  public static <T> ImmutableList<T> push(ImmutableList<T> stack, T item) {
    return ImmutableList.<T>builder().addAll(stack).add(item).build();
  }

  public static <T> ImmutableList<T> pop(ImmutableList<T> stack) {
    if (stack.isEmpty())
      throw new IllegalStateException("pop on empty stack");
    return stack.subList(0, stack.size() - 1);
  }

  public static <T> T peek(ImmutableList<T> stack) {
    if (stack.isEmpty())
      throw new IllegalStateException("peek on empty stack");
    return stack.get(stack.size() - 1);
  }

  public static <T> ImmutableList<T> replaceTop(ImmutableList<T> stack, T item) {
    return push(pop(stack), item);
  }
}
