package textprops.impl.intervals;

import org.junit.jupiter.api.Test;
import textprops.intervals.Interval;
import textprops.intervals.Intervals;
import textprops.intervals.PositionOutOfRangeException;
import textprops.text.BufferText;
import textprops.text.StringText;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static textprops.intervals.IntervalTrees.*;

public class NavigationTest {

  @Test
  public void everyPositionHasOwner() {
    StringText text = faces(3, 1, 4, 1, 5, 9, 2, 6);
    long total = text.length();
    for (long p = 0; p <= total; p++) {
      Interval i = Intervals.find(text, p);
      if (p < total) {
        assertTrue(i.position <= p && p < i.end(), "position " + p + " in " + i);
      }
      else {
        assertEquals(p, i.end());
        assertNull(Navigation.next(i));
      }
    }
  }

  @Test
  public void findReturnsSpansInTextOrder() {
    StringText text = faces(3, 1, 4, 1, 5);
    List<String> found = new ArrayList<>();
    long p = 0;
    while (p < text.length()) {
      Interval i = Intervals.find(text, p);
      found.add(i.plist.get(FACE));
      p = i.end();
    }
    assertThat(found).containsExactly("f0", "f1", "f2", "f3", "f4");
  }

  @Test
  public void nextStartsWhereCurrentEnds() {
    StringText text = spans(2, 7, 1, 8, 2, 8);
    for (long p = 0; p < text.length(); p++) {
      Interval i = Intervals.find(text, p);
      long end = i.position + i.length();
      Interval next = Navigation.next(i);
      if (next != null) {
        assertEquals(end, next.position);
        assertSame(next, Intervals.find(text, end));
      }
      else {
        assertEquals(text.length(), end);
      }
    }
  }

  @Test
  public void prevEndsWhereCurrentStarts() {
    StringText text = spans(2, 7, 1, 8, 2, 8);
    for (long p = 0; p < text.length(); p++) {
      Interval i = Intervals.find(text, p);
      long start = i.position;
      Interval prev = Navigation.prev(i);
      if (prev != null) {
        assertEquals(start, prev.end());
        assertSame(prev, Intervals.find(text, prev.position));
      }
      else {
        assertEquals(0, start);
      }
    }
  }

  @Test
  public void walkingForwardVisitsAllSpans() {
    StringText text = faces(1, 2, 3, 4, 5, 6);
    Interval i = Intervals.find(text, 0);
    List<String> faces = new ArrayList<>();
    while (i != null) {
      faces.add(i.plist.get(FACE));
      i = Navigation.next(i);
    }
    assertThat(faces).containsExactly("f0", "f1", "f2", "f3", "f4", "f5");
  }

  @Test
  public void bufferPositionsStartFromOne() {
    BufferText buffer = new BufferText("hello world");
    Interval root = buffer.intervals();
    assertEquals(1, root.position);

    Interval i = Intervals.find(buffer, 1);
    assertEquals(1, i.position);
    assertSame(i, Intervals.find(buffer, 12));

    Interval tail = Intervals.splitRight(i, 6);
    assertEquals(7, tail.position);
    assertSame(tail, Intervals.find(buffer, 7));
    assertEquals(7, Intervals.find(buffer, 7).position);
    assertEquals(1, Intervals.find(buffer, 6).position);

    assertThrows(PositionOutOfRangeException.class, () -> Intervals.find(buffer, 0));
    assertThrows(PositionOutOfRangeException.class, () -> Intervals.find(buffer, 13));
  }

  @Test
  public void outOfRangeCarriesBounds() {
    StringText text = spans(4, 4);
    PositionOutOfRangeException e = assertThrows(PositionOutOfRangeException.class, () -> Intervals.find(text, 9));
    assertEquals(9, e.position);
    assertEquals(0, e.from);
    assertEquals(8, e.to);
    assertThrows(PositionOutOfRangeException.class, () -> Intervals.find(text, -1));
  }

  @Test
  public void findInSubtreeIsRelative() {
    Interval right = node(3, leaf(2), leaf(4));
    Interval root = node(5, leaf(1), right);
    attach(root);

    Interval i = Navigation.find(right, 1);
    assertEquals(2, i.length());
    i = Navigation.find(right, 2);
    assertEquals(3, i.length());
    assertEquals(2, i.position);
  }

  @Test
  public void updateWalksFromTrustedNode() {
    StringText text = spans(3, 1, 4, 1, 5, 9, 2, 6);
    List<Interval> nodes = Intervals.spans(text);
    long[] starts = {0, 3, 4, 8, 9, 14, 23, 25};
    Random random = new Random(17);
    Interval i = nodes.get(0);
    for (int k = 0; k < 200; k++) {
      long trusted = i.position;
      Intervals.traverseUnordered(text.root(), n -> n.position = -100);
      i.position = trusted;

      long p = random.nextInt((int)text.length());
      Interval updated = Navigation.update(i, p);
      int owner = nodes.indexOf(updated);
      assertEquals(starts[owner], updated.position);
      assertTrue(updated.position <= p && p < updated.end(), "position " + p + " in " + updated);
      i = updated;
    }
  }

  @Test
  public void updateRecomputesStaleAncestors() {
    StringText text = spans(3, 4, 5);
    Intervals.traverseUnordered(text.root(), i -> i.position = -100);
    Interval first = Intervals.find(text, 0);
    assertEquals(0, first.position);

    Interval owner = Navigation.update(first, 8);

    assertEquals(7, owner.position);
    assertEquals(5, owner.length());
    assertSame(owner, Navigation.update(Intervals.find(text, 11), 8));
  }

  @Test
  public void updateGoesBackThroughStaleAncestors() {
    StringText text = spans(2, 2, 2, 2, 2, 2, 2);
    Intervals.traverseUnordered(text.root(), i -> i.position = 1000);
    Interval last = Intervals.find(text, 13);
    assertEquals(12, last.position);

    Interval owner = Navigation.update(last, 1);

    assertEquals(0, owner.position);
    assertSame(Navigation.first(text.root()), owner);
  }

  @Test
  public void neighboursFollowSpanMovedByDelete() {
    for (int k = 0; k < 5; k++) {
      StringText text = spans(3, 4, 5, 6, 2);
      Interval removed = Intervals.spans(text).get(k);
      Intervals.delete(removed);

      assertWalksMatch(text);
    }
  }

  @Test
  public void neighboursFollowSpanMovedByMerge() {
    for (int k = 1; k < 5; k++) {
      StringText text = spans(3, 4, 5, 6, 2);
      Intervals.mergeLeft(Intervals.spans(text).get(k));
      assertWalksMatch(text);

      text = spans(3, 4, 5, 6, 2);
      Intervals.mergeRight(Intervals.spans(text).get(k - 1));
      assertWalksMatch(text);
    }
  }

  /**
   * Walks forth from the first span and back from the last one with every other cache spoiled,
   * the positions met must be those of a full traversal.
   */
  private static void assertWalksMatch(StringText text) {
    List<Long> expected = new ArrayList<>();
    Intervals.traverse(text.root(), 0, i -> expected.add(i.position));
    Intervals.traverseUnordered(text.root(), i -> i.position = -100);

    List<Long> forth = new ArrayList<>();
    for (Interval i = Intervals.find(text, 0); i != null; i = Intervals.next(i)) {
      forth.add(i.position);
    }
    assertEquals(expected, forth);

    Intervals.traverseUnordered(text.root(), i -> i.position = -100);
    List<Long> back = new ArrayList<>();
    for (Interval i = Intervals.find(text, text.length() - 1); i != null; i = Intervals.prev(i)) {
      back.add(0, i.position);
    }
    assertEquals(expected, back);
  }

  @Test
  public void updateAcceptsEndOfText() {
    StringText text = spans(3, 4, 5);
    Intervals.spans(text);
    Interval first = Intervals.find(text, 0);
    Interval last = Navigation.update(first, 12);
    assertEquals(12, last.end());
    assertNull(Navigation.next(last));
  }

  @Test
  public void updateOutsideOfTextFails() {
    StringText text = spans(3, 4, 5);
    Intervals.spans(text);
    Interval middle = Intervals.find(text, 5);
    assertThrows(PositionOutOfRangeException.class, () -> Navigation.update(middle, 13));
    assertThrows(PositionOutOfRangeException.class, () -> Navigation.update(middle, -1));
  }

  @Test
  public void traverseRefreshesCaches() {
    StringText text = spans(3, 4, 5);
    Intervals.traverseUnordered(text.root(), i -> i.position = -100);

    List<Long> starts = new ArrayList<>();
    Intervals.traverse(text.root(), 0, i -> starts.add(i.position));
    assertThat(starts).containsExactly(0L, 3L, 7L);
  }

  @Test
  public void unorderedTraversalVisitsEveryNodeOnce() {
    StringText text = spans(1, 1, 1, 1, 1, 1, 1);
    List<Interval> nodes = preOrder(text.root());
    assertEquals(7, nodes.size());
    assertSame(text.root(), nodes.get(0));
    assertThat(nodes).doesNotHaveDuplicates();
  }

  @Test
  public void firstAndLast() {
    StringText text = faces(2, 2, 2, 2);
    assertEquals("f0", Navigation.first(text.root()).plist.get(FACE));
    assertEquals("f3", Navigation.last(text.root()).plist.get(FACE));
  }
}
