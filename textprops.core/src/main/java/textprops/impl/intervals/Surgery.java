package textprops.impl.intervals;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import textprops.intervals.Interval;
import textprops.intervals.IntervalContainer;
import textprops.intervals.PositionOutOfRangeException;
import textprops.intervals.ViolatedInvariantException;

@SuppressWarnings({"WeakerAccess", "unused"})
public class Surgery {
  private static final Logger LOG = LoggerFactory.getLogger(Surgery.class);

  private Surgery() {}

  /**
   * Splits the span of {@code interval} after {@code offset} characters. The first part becomes
   * a new default node which is returned, {@code interval} keeps its properties and the second part.
   * <pre>
   *       interval              interval
   *        /                      /
   *       l          =>         new
   *                             /
   *                            l
   * </pre>
   */
  @NotNull
  public static Interval splitLeft(@NotNull Interval interval, long offset) {
    checkOffset(interval, offset);
    Interval piece = new Interval();
    piece.position = interval.position;
    interval.position = interval.position + offset;

    Interval left = interval.takeLeft();
    if (left == null) {
      piece.totalLength = offset;
      interval.setLeft(piece);
    }
    else {
      piece.setLeft(left);
      piece.totalLength = offset + left.totalLength;
      interval.setLeft(piece);
      Balancer.balanceSelf(piece);
    }
    LOG.trace("split {} at {}, new left piece {}", interval, offset, piece);

    Balancer.balancePossibleRoot(interval);
    return piece;
  }

  /**
   * Splits the span of {@code interval} after {@code offset} characters. The second part becomes
   * a new default node which is returned, {@code interval} keeps its properties and the first part.
   */
  @NotNull
  public static Interval splitRight(@NotNull Interval interval, long offset) {
    checkOffset(interval, offset);
    Interval piece = new Interval();
    long newLength = interval.length() - offset;
    piece.position = interval.position + offset;

    Interval right = interval.takeRight();
    if (right == null) {
      piece.totalLength = newLength;
      interval.setRight(piece);
    }
    else {
      piece.setRight(right);
      piece.totalLength = newLength + right.totalLength;
      interval.setRight(piece);
      Balancer.balanceSelf(piece);
    }
    LOG.trace("split {} at {}, new right piece {}", interval, offset, piece);

    Balancer.balancePossibleRoot(interval);
    return piece;
  }

  private static void checkOffset(Interval interval, long offset) {
    if (offset <= 0 || offset >= interval.length()) {
      throw new IllegalArgumentException("offset:" + offset + ", length:" + interval.length());
    }
  }

  /**
   * Removes {@code interval} from its tree. Its span goes to the node right after it, or to the
   * node right before it when it is the last one, and that node keeps its own properties.
   * Deleting the only node of a tree leaves the container without intervals.
   * The cache of {@code interval} must be trusted, the removed node is reset.
   *
   * @return the node that took over the span, {@code null} when the tree is gone
   */
  @Nullable
  public static Interval delete(@NotNull Interval interval) {
    if (interval.hasRight() || ancestorAfter(interval) != null) {
      return mergeRight(interval);
    }
    if (interval.hasLeft() || ancestorBefore(interval) != null) {
      return mergeLeft(interval);
    }
    unlink(interval);
    return null;
  }

  /**
   * Takes a node out of the tree once its own span has been handed over, its children take its slot.
   */
  private static void unlink(@NotNull Interval interval) {
    Interval merged = mergeChildren(interval);
    Tree.replaceInParent(interval, merged);
    interval.reset();
  }

  /**
   * Joins both subtrees of {@code interval}: the left one goes below the leftmost node of the right one.
   * The children are detached from {@code interval}.
   */
  @Nullable
  static Interval mergeChildren(@NotNull Interval interval) {
    Interval left = interval.takeLeft();
    Interval right = interval.takeRight();
    if (left == null) {
      return right;
    }
    if (right == null) {
      return left;
    }

    long migrate = left.totalLength;
    Interval i = right;
    i.totalLength += migrate;
    while (i.hasLeft()) {
      i = i.getLeft();
      i.totalLength += migrate;
    }
    i.setLeft(left);
    return right;
  }

  /**
   * Gives the span of {@code interval} to the node before it and removes {@code interval}.
   * The predecessor keeps its own properties, its cache is derived from the cache of {@code interval}.
   *
   * @return the predecessor
   */
  @NotNull
  public static Interval mergeLeft(@NotNull Interval interval) {
    long absorb = interval.length();
    long position = interval.position;
    Interval predecessor = interval.getLeft();
    if (predecessor != null) {
      // below us, grow the right spine on the way down
      while (predecessor.hasRight()) {
        predecessor.totalLength += absorb;
        predecessor = predecessor.getRight();
      }
      predecessor.totalLength += absorb;
    }
    else {
      predecessor = ancestorBefore(interval);
      ViolatedInvariantException.check(predecessor != null, "merging the first span to the left");
      // above us, everything between loses the span
      interval.totalLength -= absorb;
      for (Interval i = interval.getParent(); i != predecessor; i = i.getParent()) {
        i.totalLength -= absorb;
      }
    }
    assert interval.length() == 0;
    predecessor.position = position - (predecessor.length() - absorb);
    LOG.trace("merged {} into preceding {}", interval, predecessor);
    unlink(interval);
    return predecessor;
  }

  /**
   * Gives the span of {@code interval} to the node after it and removes {@code interval}.
   * The successor keeps its own properties and now starts where {@code interval} started.
   *
   * @return the successor
   */
  @NotNull
  public static Interval mergeRight(@NotNull Interval interval) {
    long absorb = interval.length();
    long position = interval.position;
    Interval successor = interval.getRight();
    if (successor != null) {
      while (successor.hasLeft()) {
        successor.totalLength += absorb;
        successor = successor.getLeft();
      }
      successor.totalLength += absorb;
    }
    else {
      successor = ancestorAfter(interval);
      ViolatedInvariantException.check(successor != null, "merging the last span to the right");
      interval.totalLength -= absorb;
      for (Interval i = interval.getParent(); i != successor; i = i.getParent()) {
        i.totalLength -= absorb;
      }
    }
    assert interval.length() == 0;
    successor.position = position;
    LOG.trace("merged {} into following {}", interval, successor);
    unlink(interval);
    return successor;
  }

  /** The closest ancestor whose span comes right before the subtree of {@code interval}. */
  @Nullable
  private static Interval ancestorBefore(Interval interval) {
    Interval i = interval;
    while (i.hasParent()) {
      boolean rightChild = i.isRightChild();
      i = i.getParent();
      if (rightChild) {
        return i;
      }
    }
    return null;
  }

  @Nullable
  private static Interval ancestorAfter(Interval interval) {
    Interval i = interval;
    while (i.hasParent()) {
      boolean leftChild = i.isLeftChild();
      i = i.getParent();
      if (leftChild) {
        return i;
      }
    }
    return null;
  }

  /**
   * Builds a detached tree with the spans of {@code tree} between {@code start} and
   * {@code start + length}, each with a copy of the properties of the span it comes from.
   * Positions in the new tree start from 0.
   *
   * @return the top of the new tree, {@code null} for an empty range or a range within one default span
   */
  @Nullable
  public static Interval copyIntervals(@NotNull Interval tree, long start, long length) {
    if (length <= 0) {
      return null;
    }
    IntervalContainer container = tree.getContainer();
    long from = container == null ? 0 : container.beginOffset();
    if (start < from || start - from + length > tree.totalLength) {
      throw new PositionOutOfRangeException(start + length, from, from + tree.totalLength);
    }
    Interval i = Navigation.find(tree, start);
    if (start - i.position + length <= i.length() && i.isDefault()) {
      return null;
    }

    Interval copy = new Interval(length);
    copy.position = 0;
    copy.copyProperties(i);
    long got = i.length() - (start - i.position);

    Interval t = copy;
    long prevLength = got;
    while (got < length) {
      i = Navigation.next(i);
      ViolatedInvariantException.check(i != null, "copied range runs past the end of the text");
      t = splitRight(t, prevLength);
      t.copyProperties(i);
      prevLength = i.length();
      got += prevLength;
    }
    return Balancer.balance(copy);
  }
}
