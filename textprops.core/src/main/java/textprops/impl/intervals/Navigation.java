package textprops.impl.intervals;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import textprops.intervals.Interval;
import textprops.intervals.IntervalContainer;
import textprops.intervals.PositionOutOfRangeException;

import java.util.ArrayDeque;
import java.util.function.Consumer;

/*
 * Interval.position is a cache. find() computes it from the weights on the way down,
 * next(), prev() and update() derive it from the cache of the node they start from,
 * so they are only as good as that node's cache. Nothing here orders nodes by position.
 */
@SuppressWarnings({"WeakerAccess", "unused"})
public class Navigation {

  private Navigation() {}

  /**
   * Finds the node whose span contains {@code position}. For a root the position is a text
   * position (starting from the container's begin offset), for any other node it is relative
   * to the start of its subtree. The end of the text belongs to the last node.
   * <p>
   * The tree may be rebalanced first, so {@code tree} is not necessarily its top afterwards.
   */
  @NotNull
  public static Interval find(@NotNull Interval tree, long position) {
    long relative = position;
    IntervalContainer container = tree.getContainer();
    if (container != null) {
      relative -= container.beginOffset();
    }
    if (relative < 0 || relative > tree.totalLength) {
      long from = position - relative;
      throw new PositionOutOfRangeException(position, from, from + tree.totalLength);
    }

    Interval i = Balancer.balancePossibleRoot(tree);
    while (true) {
      if (relative < i.leftTotalLength()) {
        i = i.getLeft();
      }
      else if (i.hasRight() && relative >= i.totalLength - i.rightTotalLength()) {
        relative -= i.totalLength - i.rightTotalLength();
        i = i.getRight();
      }
      else {
        i.position = position - relative + i.leftTotalLength();
        return i;
      }
    }
  }

  /**
   * The node right after {@code interval} in the text, or {@code null} for the last one.
   */
  @Nullable
  public static Interval next(@NotNull Interval interval) {
    long nextPosition = interval.end();
    Interval i = interval.getRight();
    if (i != null) {
      while (i.hasLeft()) {
        i = i.getLeft();
      }
      i.position = nextPosition;
      return i;
    }

    i = interval;
    while (i.hasParent()) {
      boolean leftChild = i.isLeftChild();
      i = i.getParent();
      if (leftChild) {
        i.position = nextPosition;
        return i;
      }
    }
    return null;
  }

  @Nullable
  public static Interval prev(@NotNull Interval interval) {
    Interval i = interval.getLeft();
    if (i != null) {
      while (i.hasRight()) {
        i = i.getRight();
      }
      i.position = interval.position - i.length();
      return i;
    }

    i = interval;
    while (i.hasParent()) {
      boolean rightChild = i.isRightChild();
      i = i.getParent();
      if (rightChild) {
        i.position = interval.position - i.length();
        return i;
      }
    }
    return null;
  }

  /**
   * Finds the node containing {@code position} starting from {@code i}, whose cache must be trusted.
   * Every node passed on the way gets its cache recomputed from the previous one, so stale caches
   * elsewhere in the tree do no harm. Cheaper than {@link #find} when the target is close.
   * The end of the text resolves to the last node, as in {@link #find}.
   */
  @NotNull
  public static Interval update(@NotNull Interval i, long position) {
    while (true) {
      if (position < i.position) {
        if (position >= i.position - i.leftTotalLength()) {
          Interval left = i.getLeft();
          left.position = i.position - left.totalLength + left.leftTotalLength();
          i = left;
        }
        else if (!i.hasParent()) {
          throw new PositionOutOfRangeException(position, i.position - i.leftTotalLength(), i.end() + i.rightTotalLength());
        }
        else {
          i = ascend(i);
        }
      }
      else if (position >= i.end()) {
        if (position < i.end() + i.rightTotalLength()) {
          Interval right = i.getRight();
          right.position = i.end() + right.leftTotalLength();
          i = right;
        }
        else if (!i.hasParent()) {
          if (position == i.end() + i.rightTotalLength()) {
            Interval last = last(i);
            last.position = position - last.length();
            return last;
          }
          throw new PositionOutOfRangeException(position, i.position - i.leftTotalLength(), i.end() + i.rightTotalLength());
        }
        else {
          i = ascend(i);
        }
      }
      else {
        return i;
      }
    }
  }

  @NotNull
  private static Interval ascend(@NotNull Interval i) {
    Interval parent = i.getParent();
    if (i.isLeftChild()) {
      parent.position = i.end() + i.rightTotalLength();
    }
    else {
      parent.position = i.position - i.leftTotalLength() - parent.length();
    }
    return parent;
  }

  @NotNull
  public static Interval first(@NotNull Interval tree) {
    Interval i = tree;
    while (i.hasLeft()) {
      i = i.getLeft();
    }
    return i;
  }

  @NotNull
  public static Interval last(@NotNull Interval tree) {
    Interval i = tree;
    while (i.hasRight()) {
      i = i.getRight();
    }
    return i;
  }

  /**
   * Visits the nodes of {@code tree} in text order, setting the cache of each one on the way,
   * {@code start} being the position of the first span. The visitor must not change the tree.
   */
  public static void traverse(@Nullable Interval tree, long start, @NotNull Consumer<Interval> visitor) {
    ArrayDeque<Interval> stack = new ArrayDeque<>();
    long position = start;
    Interval i = tree;
    while (i != null || !stack.isEmpty()) {
      while (i != null) {
        stack.push(i);
        i = i.getLeft();
      }
      i = stack.pop();
      i.position = position;
      visitor.accept(i);
      position += i.length();
      i = i.getRight();
    }
  }

  /**
   * Visits every node of {@code tree} in no particular order, caches are not touched.
   */
  public static void traverseUnordered(@Nullable Interval tree, @NotNull Consumer<Interval> visitor) {
    if (tree == null) {
      return;
    }
    ArrayDeque<Interval> stack = new ArrayDeque<>();
    stack.push(tree);
    while (!stack.isEmpty()) {
      Interval i = stack.pop();
      visitor.accept(i);
      if (i.hasRight()) {
        stack.push(i.getRight());
      }
      if (i.hasLeft()) {
        stack.push(i.getLeft());
      }
    }
  }
}
