package textprops.text;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import textprops.intervals.Interval;
import textprops.intervals.IntervalContainer;
import textprops.intervals.Intervals;

/**
 * Text with an optional property tree. The tree is created lazily, the first time
 * someone asks for it with {@link #intervals()}.
 */
public abstract class TextContainer implements IntervalContainer {
  private Interval intervals;

  @NotNull
  public abstract CharSequence text();

  @Override
  public long length() {
    return text().length();
  }

  @Override
  public void attachRoot(@Nullable Interval root) {
    this.intervals = root;
  }

  @Nullable
  @Override
  public Interval root() {
    return intervals;
  }

  @NotNull
  public Interval intervals() {
    if (intervals == null) {
      Intervals.createRoot(this);
    }
    return intervals;
  }

  /** The last valid position: the end of the text. */
  public long end() {
    return beginOffset() + length();
  }
}
