package textprops.intervals;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import textprops.impl.intervals.Balancer;
import textprops.impl.intervals.Navigation;
import textprops.impl.intervals.Rotations;
import textprops.impl.intervals.Surgery;
import textprops.impl.intervals.Tree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Entry point to the property trees of texts. All operations mutate the tree in place and
 * expect exclusive access to it, callers serialize access through the owning container.
 */
public final class Intervals {

  private Intervals() {}

  @NotNull
  public static Interval createRoot(@NotNull IntervalContainer container) {
    return Tree.createRoot(container);
  }

  /**
   * @throws PositionOutOfRangeException when {@code position} is outside of the text
   */
  @NotNull
  public static Interval find(@NotNull Interval tree, long position) {
    return Navigation.find(tree, position);
  }

  @NotNull
  public static Interval find(@NotNull IntervalContainer container, long position) {
    Interval root = container.root();
    if (root == null) {
      throw new PositionOutOfRangeException(position, container.beginOffset(), container.beginOffset());
    }
    return Navigation.find(root, position);
  }

  @Nullable
  public static Interval next(@NotNull Interval interval) {
    return Navigation.next(interval);
  }

  @Nullable
  public static Interval prev(@NotNull Interval interval) {
    return Navigation.prev(interval);
  }

  /**
   * @throws PositionOutOfRangeException when the walk leaves the tree
   */
  @NotNull
  public static Interval update(@NotNull Interval interval, long position) {
    return Navigation.update(interval, position);
  }

  public static void rotateLeft(@NotNull Interval interval) {
    Rotations.rotateLeft(interval);
  }

  public static void rotateRight(@NotNull Interval interval) {
    Rotations.rotateRight(interval);
  }

  @NotNull
  public static Interval rotateLeftRelinking(@NotNull Interval interval) {
    return Rotations.rotateLeftRelinking(interval);
  }

  @NotNull
  public static Interval rotateRightRelinking(@NotNull Interval interval) {
    return Rotations.rotateRightRelinking(interval);
  }

  @NotNull
  public static Interval splitLeft(@NotNull Interval interval, long offset) {
    return Surgery.splitLeft(interval, offset);
  }

  @NotNull
  public static Interval splitRight(@NotNull Interval interval, long offset) {
    return Surgery.splitRight(interval, offset);
  }

  @Nullable
  public static Interval delete(@NotNull Interval interval) {
    return Surgery.delete(interval);
  }

  @NotNull
  public static Interval mergeLeft(@NotNull Interval interval) {
    return Surgery.mergeLeft(interval);
  }

  @NotNull
  public static Interval mergeRight(@NotNull Interval interval) {
    return Surgery.mergeRight(interval);
  }

  @Nullable
  public static Interval copyIntervals(@NotNull Interval tree, long start, long length) {
    return Surgery.copyIntervals(tree, start, length);
  }

  @NotNull
  public static Interval balanceSelf(@NotNull Interval interval) {
    return Balancer.balanceSelf(interval);
  }

  @NotNull
  public static Interval balance(@NotNull Interval tree) {
    return Balancer.balanceTree(tree);
  }

  @NotNull
  public static Interval balancePossibleRoot(@NotNull Interval interval) {
    return Balancer.balancePossibleRoot(interval);
  }

  public static void traverse(@Nullable Interval tree, long start, @NotNull Consumer<Interval> visitor) {
    Navigation.traverse(tree, start, visitor);
  }

  public static void traverseUnordered(@Nullable Interval tree, @NotNull Consumer<Interval> visitor) {
    Navigation.traverseUnordered(tree, visitor);
  }

  /**
   * The nodes of a container's tree in text order with fresh position caches.
   */
  @NotNull
  public static List<Interval> spans(@NotNull IntervalContainer container) {
    List<Interval> spans = new ArrayList<>();
    Navigation.traverse(container.root(), container.beginOffset(), spans::add);
    return spans;
  }

  /**
   * @return the number of nodes in {@code tree}
   * @throws ViolatedInvariantException when the tree is corrupted
   */
  public static long verify(@NotNull Interval tree) {
    return Tree.verify(tree);
  }

  public static int depth(@Nullable Interval tree) {
    return Tree.depth(tree);
  }
}
