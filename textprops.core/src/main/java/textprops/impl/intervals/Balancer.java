package textprops.impl.intervals;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import textprops.intervals.Interval;
import textprops.intervals.IntervalContainer;
import textprops.intervals.ViolatedInvariantException;

/*
 * Trees are balanced by weight, i.e. by the amount of text on each side, not by height.
 * A rotation is only done when it makes the two sides of the rotated node closer in length,
 * which gives a local fixpoint rather than any global depth bound.
 * Rotations here are the relinking ones so that callers holding a node keep holding the same span.
 */
@SuppressWarnings({"WeakerAccess", "unused"})
public class Balancer {
  private static final Logger LOG = LoggerFactory.getLogger(Balancer.class);

  private Balancer() {}

  /**
   * Rotates at {@code i} until no single rotation there reduces the length difference of its sides.
   * The subtrees are assumed to be balanced already.
   *
   * @return the node now at the top of the subtree
   */
  @NotNull
  public static Interval balanceSelf(@NotNull Interval i) {
    if (i.length() <= 0 || i.totalLength < i.length()) {
      throw new ViolatedInvariantException("cannot balance " + i);
    }
    while (true) {
      long oldDiff = i.leftTotalLength() - i.rightTotalLength();
      if (oldDiff > 0) {
        // the left side is longer, so there is one
        Interval left = i.getLeft();
        long newDiff = i.totalLength - left.totalLength + left.rightTotalLength() - left.leftTotalLength();
        if (Math.abs(newDiff) >= oldDiff) {
          break;
        }
        i = Rotations.rotateRightRelinking(i);
        balanceSelf(i.getRight());
      }
      else if (oldDiff < 0) {
        Interval right = i.getRight();
        long newDiff = i.totalLength - right.totalLength + right.leftTotalLength() - right.rightTotalLength();
        if (Math.abs(newDiff) >= -oldDiff) {
          break;
        }
        i = Rotations.rotateLeftRelinking(i);
        balanceSelf(i.getLeft());
      }
      else {
        break;
      }
      if (Math.abs(i.leftTotalLength() - i.rightTotalLength()) >= Math.abs(oldDiff)) {
        throw new ViolatedInvariantException("rotation did not reduce imbalance at " + i);
      }
    }
    return i;
  }

  /**
   * Balances both subtrees, then {@code tree} itself.
   *
   * @return the node now at the top of the subtree
   */
  @NotNull
  public static Interval balance(@NotNull Interval tree) {
    Interval left = tree.getLeft();
    if (left != null) {
      balance(left);
    }
    Interval right = tree.getRight();
    if (right != null) {
      balance(right);
    }
    return balanceSelf(tree);
  }

  /**
   * Balances {@code i} unless it is a detached node. When {@code i} was the root of a container,
   * the container gets whatever node ended up on top.
   */
  @NotNull
  public static Interval balancePossibleRoot(@NotNull Interval i) {
    IntervalContainer container = i.getContainer();
    if (container == null && !i.hasParent()) {
      return i;
    }
    Interval top = balanceSelf(i);
    if (container != null && container.root() != top) {
      container.attachRoot(top);
      LOG.debug("root of {} rotated from {} to {}", container, i, top);
    }
    return top;
  }

  /**
   * Balances a whole tree and reattaches its top when the tree belongs to a container.
   */
  @NotNull
  public static Interval balanceTree(@NotNull Interval tree) {
    IntervalContainer container = tree.getContainer();
    Interval top = balance(tree);
    if (container != null && container.root() != top) {
      container.attachRoot(top);
      LOG.debug("root of {} is now {} after balancing", container, top);
    }
    return top;
  }
}
