package textprops.text;

import org.junit.jupiter.api.Test;
import textprops.intervals.Interval;
import textprops.intervals.Intervals;
import textprops.intervals.PositionOutOfRangeException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextContainerTest {

  @Test
  public void treeIsCreatedOnDemand() {
    BufferText buffer = new BufferText("some text");
    assertNull(buffer.root());

    Interval root = buffer.intervals();

    assertSame(root, buffer.root());
    assertSame(root, buffer.intervals());
    assertSame(buffer, root.getContainer());
    assertEquals(9, root.totalLength);
    assertEquals(1, root.position);
    assertTrue(root.isDefault());
    assertEquals(10, buffer.end());
  }

  @Test
  public void stringsStartFromZero() {
    StringText string = new StringText("abc");
    assertEquals(0, string.intervals().position);
    assertEquals(3, string.end());
  }

  @Test
  public void emptyTextHasNoTree() {
    StringText string = new StringText("");
    assertThrows(IllegalArgumentException.class, string::intervals);
    assertThrows(PositionOutOfRangeException.class, () -> Intervals.find(string, 0));
  }

  @Test
  public void spansCarryAbsolutePositions() {
    BufferText buffer = new BufferText("0123456789");
    Interval i = buffer.intervals();
    i = Intervals.splitRight(i, 2);
    Intervals.splitRight(i, 5);

    List<Interval> spans = Intervals.spans(buffer);

    assertEquals(3, spans.size());
    assertEquals(1, spans.get(0).position);
    assertEquals(3, spans.get(1).position);
    assertEquals(8, spans.get(2).position);
    assertEquals(11, spans.get(2).end());
  }
}
