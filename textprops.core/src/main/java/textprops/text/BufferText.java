package textprops.text;

import org.jetbrains.annotations.NotNull;

/**
 * Buffer-like container, positions start from 1.
 */
public class BufferText extends TextContainer {
  private final StringBuilder text;

  public BufferText(@NotNull CharSequence text) {
    this.text = new StringBuilder(text);
  }

  @Override
  public long beginOffset() {
    return 1;
  }

  @NotNull
  @Override
  public CharSequence text() {
    return text;
  }

  @Override
  public String toString() {
    return "BufferText{length=" + text.length() + '}';
  }
}
