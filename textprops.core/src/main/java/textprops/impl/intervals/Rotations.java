package textprops.impl.intervals;

import org.jetbrains.annotations.NotNull;
import textprops.intervals.Interval;
import textprops.intervals.ViolatedInvariantException;

/**
 * Single rotations of a property tree. Both families keep the total length of the rotated
 * subtree and the order of its spans, so no span moves in the text and all position caches
 * stay as they were.
 * <p>
 * The in-place family swaps the payload of the pivot with its child and rearranges children
 * under the pivot, the object at the top of the subtree stays the same one and its parent
 * or container never learns about the rotation. The relinking family moves node objects
 * instead, a node keeps its span and properties but the subtree gets a new top node.
 */
@SuppressWarnings({"WeakerAccess", "unused"})
public class Rotations {

  private Rotations() {}

  /**
   * <pre>
   *      A            B
   *     / \          / \
   *    B   e   =>   d   A
   *   / \              / \
   *  d   c            c   e
   * </pre>
   * The object {@code a} ends up holding B's payload, its former left child object holds A's.
   */
  public static void rotateRight(@NotNull Interval a) {
    Interval b = a.getLeft();
    ViolatedInvariantException.check(b != null, "rotating right without a left child");
    long oldTotal = a.totalLength;
    checkBefore(a, b);

    a.swapPayload(b);

    a.takeLeft();
    Interval e = a.takeRight();
    Interval d = b.takeLeft();
    Interval c = b.takeRight();
    a.setLeft(d);
    a.setRight(b);
    b.setLeft(c);
    b.setRight(e);

    // b is A now: it lost B's span and B's left subtree
    b.totalLength -= a.totalLength - b.leftTotalLength();
    a.totalLength = oldTotal;
    checkAfter(a, b);
  }

  /**
   * <pre>
   *    A                B
   *   / \              / \
   *  d   B     =>     A   e
   *     / \          / \
   *    c   e        d   c
   * </pre>
   */
  public static void rotateLeft(@NotNull Interval a) {
    Interval b = a.getRight();
    ViolatedInvariantException.check(b != null, "rotating left without a right child");
    long oldTotal = a.totalLength;
    checkBefore(a, b);

    a.swapPayload(b);

    a.takeRight();
    Interval d = a.takeLeft();
    Interval c = b.takeLeft();
    Interval e = b.takeRight();
    b.setLeft(d);
    b.setRight(c);
    a.setLeft(b);
    a.setRight(e);

    b.totalLength -= a.totalLength - b.rightTotalLength();
    a.totalLength = oldTotal;
    checkAfter(a, b);
  }

  /**
   * Same picture as {@link #rotateRight} but node objects move: B becomes the top of the subtree,
   * takes over A's slot in A's parent and A's back-reference. When A was the root, B now refers
   * to the container while the container still holds A, the caller has to attach B.
   *
   * @return the new top of the subtree
   */
  @NotNull
  public static Interval rotateRightRelinking(@NotNull Interval a) {
    Interval b = a.getLeft();
    ViolatedInvariantException.check(b != null, "rotating right without a left child");
    long oldTotal = a.totalLength;
    checkBefore(a, b);

    Interval parent = a.getParent();
    boolean wasLeftChild = a.isLeftChild();

    a.takeLeft();
    Interval c = b.takeRight();
    a.setLeft(c);

    a.copyParentTo(b);
    if (parent != null) {
      if (wasLeftChild) {
        parent.setLeft(b);
      }
      else {
        parent.setRight(b);
      }
    }
    b.setRight(a);

    a.totalLength -= b.totalLength - (c == null ? 0 : c.totalLength);
    b.totalLength = oldTotal;
    checkAfter(b, a);
    return b;
  }

  @NotNull
  public static Interval rotateLeftRelinking(@NotNull Interval a) {
    Interval b = a.getRight();
    ViolatedInvariantException.check(b != null, "rotating left without a right child");
    long oldTotal = a.totalLength;
    checkBefore(a, b);

    Interval parent = a.getParent();
    boolean wasLeftChild = a.isLeftChild();

    a.takeRight();
    Interval c = b.takeLeft();
    a.setRight(c);

    a.copyParentTo(b);
    if (parent != null) {
      if (wasLeftChild) {
        parent.setLeft(b);
      }
      else {
        parent.setRight(b);
      }
    }
    b.setLeft(a);

    a.totalLength -= b.totalLength - (c == null ? 0 : c.totalLength);
    b.totalLength = oldTotal;
    checkAfter(b, a);
    return b;
  }

  private static void checkBefore(Interval pivot, Interval child) {
    if (pivot.totalLength <= 0 || pivot.length() <= 0 || child.length() <= 0) {
      throw new ViolatedInvariantException("cannot rotate " + pivot + " with child " + child);
    }
  }

  private static void checkAfter(Interval top, Interval lowered) {
    if (lowered.totalLength <= 0 || lowered.length() <= 0 || top.length() <= 0) {
      throw new ViolatedInvariantException("rotation left an empty span: " + top + ", " + lowered);
    }
  }
}
