package textprops.intervals;

public class PositionOutOfRangeException extends IndexOutOfBoundsException {
  public final long position;
  public final long from;
  public final long to;

  public PositionOutOfRangeException(long position, long from, long to) {
    super("position:" + position + ", from:" + from + ", to:" + to);
    this.position = position;
    this.from = from;
    this.to = to;
  }
}
