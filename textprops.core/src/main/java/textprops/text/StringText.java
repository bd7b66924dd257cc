package textprops.text;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * String-like container, positions start from 0.
 */
public class StringText extends TextContainer {
  private final String text;

  public StringText(@NotNull String text) {
    this.text = Objects.requireNonNull(text);
  }

  @Override
  public long beginOffset() {
    return 0;
  }

  @NotNull
  @Override
  public CharSequence text() {
    return text;
  }

  @Override
  public String toString() {
    return "StringText{length=" + text.length() + '}';
  }
}
