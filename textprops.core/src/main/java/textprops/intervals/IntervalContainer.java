package textprops.intervals;

import org.jetbrains.annotations.Nullable;

/**
 * Owner of an interval tree: a buffer or a string. The tree calls back into its container
 * whenever the node standing at the root position changes.
 */
public interface IntervalContainer {

  /**
   * Offset of the first character, 1 for buffers and 0 for strings.
   */
  long beginOffset();

  long length();

  void attachRoot(@Nullable Interval root);

  @Nullable
  Interval root();
}
