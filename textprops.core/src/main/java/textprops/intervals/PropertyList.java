package textprops.intervals;

import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import textprops.Attr;

import java.util.Objects;

/**
 * Immutable property set of a span. Keys are {@link Attr}s, values are opaque to the tree:
 * it only asks whether the list is empty and how to copy it.
 */
public final class PropertyList {

  public static final PropertyList EMPTY = new PropertyList(new Map<>());

  private final IMap<Attr<?>, Object> map;

  private PropertyList(IMap<Attr<?>, Object> map) {
    this.map = map;
  }

  public static PropertyList empty() {
    return EMPTY;
  }

  public static <T> PropertyList of(@NotNull Attr<T> key, @NotNull T value) {
    return EMPTY.put(key, value);
  }

  public boolean isEmpty() {
    return map.size() == 0;
  }

  public long size() {
    return map.size();
  }

  public boolean contains(@NotNull Attr<?> key) {
    return map.contains(key);
  }

  @Nullable
  public <T> T get(@NotNull Attr<T> key) {
    return key.cast(map.get(key, null));
  }

  @NotNull
  public <T> PropertyList put(@NotNull Attr<T> key, @NotNull T value) {
    Objects.requireNonNull(value, "value");
    return new PropertyList(map.put(key, value));
  }

  @NotNull
  public PropertyList remove(@NotNull Attr<?> key) {
    if (!map.contains(key)) {
      return this;
    }
    IMap<Attr<?>, Object> removed = map.remove(key);
    return removed.size() == 0 ? EMPTY : new PropertyList(removed);
  }

  /**
   * The backing map is persistent, so a copy shares its structure with the original
   * and later {@link #put}s on either side stay invisible to the other.
   */
  @NotNull
  public PropertyList copy() {
    return isEmpty() ? EMPTY : new PropertyList(map);
  }

  public Iterable<Attr<?>> keys() {
    return map.keys();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PropertyList list = (PropertyList)o;
    return map.equals(list.map);
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public String toString() {
    return map.toString();
  }
}
