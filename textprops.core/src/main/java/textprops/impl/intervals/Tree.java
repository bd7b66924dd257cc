package textprops.impl.intervals;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import textprops.intervals.Interval;
import textprops.intervals.IntervalContainer;
import textprops.intervals.ViolatedInvariantException;

import java.util.ArrayDeque;

@SuppressWarnings({"WeakerAccess", "unused"})
public class Tree {
  private static final Logger LOG = LoggerFactory.getLogger(Tree.class);

  private Tree() {}

  /**
   * Creates the single-span tree of {@code container} and installs it there.
   */
  @NotNull
  public static Interval createRoot(@NotNull IntervalContainer container) {
    long length = container.length();
    if (length <= 0) {
      throw new IllegalArgumentException("cannot create intervals for empty text, length:" + length);
    }
    Interval root = new Interval(length);
    root.position = container.beginOffset();
    root.setContainer(container);
    container.attachRoot(root);
    LOG.debug("created root interval of length {} for {}", length, container);
    return root;
  }

  /**
   * Puts {@code replacement} where {@code old} stood: into the parent's child slot,
   * or into the container when {@code old} was the root. {@code old} ends up unlinked.
   */
  public static void replaceInParent(@NotNull Interval old, @Nullable Interval replacement) {
    IntervalContainer container = old.getContainer();
    Interval parent = old.getParent();
    if (container != null) {
      old.clearParent();
      if (replacement != null) {
        replacement.setContainer(container);
      }
      container.attachRoot(replacement);
      if (replacement == null) {
        LOG.debug("intervals of {} are gone", container);
      }
      else {
        LOG.debug("root of {} is now {}", container, replacement);
      }
    }
    else if (parent != null) {
      boolean left = old.isLeftChild();
      old.clearParent();
      if (left) {
        parent.setLeft(replacement);
      }
      else {
        parent.setRight(replacement);
      }
    }
    else if (replacement != null) {
      replacement.clearParent();
    }
  }

  /**
   * Walks the whole tree checking that every node has a positive own span and that every child
   * points back at its parent. The top node must have no parent, only it may refer to a container,
   * which in turn holds it.
   * Returns the number of nodes.
   */
  public static long verify(@NotNull Interval tree) {
    ViolatedInvariantException.check(!tree.hasParent(), "top of the tree has a parent");
    IntervalContainer container = tree.getContainer();
    if (container != null) {
      ViolatedInvariantException.check(container.root() == tree, "container does not hold its root");
      if (container.length() != tree.totalLength) {
        throw new ViolatedInvariantException("container length " + container.length() +
                                             " differs from tree length " + tree.totalLength);
      }
    }
    long count = 0;
    ArrayDeque<Interval> stack = new ArrayDeque<>();
    stack.push(tree);
    while (!stack.isEmpty()) {
      Interval i = stack.pop();
      count++;
      if (i.length() <= 0 || i.totalLength <= 0) {
        throw new ViolatedInvariantException("non positive span: " + i);
      }
      if (i != tree) {
        ViolatedInvariantException.check(!i.isRoot(), "inner node refers to a container");
      }
      Interval left = i.getLeft();
      if (left != null) {
        ViolatedInvariantException.check(left.getParent() == i, "left child does not point back at its parent");
        stack.push(left);
      }
      Interval right = i.getRight();
      if (right != null) {
        ViolatedInvariantException.check(right.getParent() == i, "right child does not point back at its parent");
        stack.push(right);
      }
    }
    return count;
  }

  public static int depth(@Nullable Interval tree) {
    if (tree == null) {
      return 0;
    }
    return 1 + Math.max(depth(tree.getLeft()), depth(tree.getRight()));
  }
}
