package textprops;

import java.util.Objects;

/**
 * Typed key of a text property. Two attrs are the same key when their names are equal,
 * the value type is only a convenience for {@link textprops.intervals.PropertyList#get(Attr)}.
 */
public class Attr<T> {
  public final String name;
  public final Class<T> type;

  public Attr(String name, Class<T> type) {
    this.name = Objects.requireNonNull(name);
    this.type = Objects.requireNonNull(type);
  }

  public static <T> Attr<T> of(String name, Class<T> type) {
    return new Attr<>(name, type);
  }

  public T cast(Object value) {
    return value == null ? null : type.cast(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Attr<?> attr = (Attr<?>)o;
    return Objects.equals(name, attr.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return "Attr{" +
           "name=" + name +
           '}';
  }
}
