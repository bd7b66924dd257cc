package textprops.intervals;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A node of a text property tree.
 * <p>
 * The node owns the span that lies between its left and right subtrees in the text,
 * its own length is never stored and always derived from {@link #totalLength}.
 * Children are owned, the way up is a back-reference tagged either as a parent node
 * or as the {@link IntervalContainer} when the node is the root.
 */
public final class Interval {

  /** Length of the own span plus both subtrees. */
  public long totalLength;

  /** Cached absolute start of the own span, see {@link textprops.impl.intervals.Navigation}. */
  public long position;

  public boolean writeProtect;
  public boolean visible;
  public boolean frontSticky;
  public boolean rearSticky;

  @NotNull
  public PropertyList plist = PropertyList.EMPTY;

  private Interval left;
  private Interval right;

  private boolean parentIsContainer;
  private Interval parent;
  private IntervalContainer container;

  public Interval() {
  }

  public Interval(long totalLength) {
    this.totalLength = totalLength;
  }

  public long length() {
    return totalLength - leftTotalLength() - rightTotalLength();
  }

  public long leftTotalLength() {
    return left == null ? 0 : left.totalLength;
  }

  public long rightTotalLength() {
    return right == null ? 0 : right.totalLength;
  }

  /** Absolute position right after the own span, valid when {@link #position} is. */
  public long end() {
    return position + length();
  }

  public boolean isDefault() {
    return plist.isEmpty();
  }

  public boolean hasLeft() {
    return left != null;
  }

  public boolean hasRight() {
    return right != null;
  }

  public boolean hasChildren() {
    return left != null || right != null;
  }

  public boolean hasBothChildren() {
    return left != null && right != null;
  }

  public boolean hasParent() {
    return !parentIsContainer && parent != null;
  }

  public boolean isRoot() {
    return parentIsContainer;
  }

  public boolean isOnly() {
    return !hasParent() && !hasChildren();
  }

  public boolean isLeftChild() {
    Interval p = getParent();
    return p != null && p.left == this;
  }

  public boolean isRightChild() {
    Interval p = getParent();
    return p != null && p.right == this;
  }

  @Nullable
  public Interval getLeft() {
    return left;
  }

  @Nullable
  public Interval getRight() {
    return right;
  }

  @Nullable
  public Interval getParent() {
    return parentIsContainer ? null : parent;
  }

  @Nullable
  public IntervalContainer getContainer() {
    return parentIsContainer ? container : null;
  }

  /**
   * Installs {@code child} as the left subtree and points it back at this node.
   * {@code null} clears the slot, the previous child is not touched.
   */
  public void setLeft(@Nullable Interval child) {
    assert child != this;
    this.left = child;
    if (child != null) {
      child.setParent(this);
    }
  }

  public void setRight(@Nullable Interval child) {
    assert child != this;
    this.right = child;
    if (child != null) {
      child.setParent(this);
    }
  }

  /**
   * Detaches the left subtree. Its back-reference is cleared, the caller is expected
   * to link it somewhere else.
   */
  @Nullable
  public Interval takeLeft() {
    Interval child = this.left;
    this.left = null;
    if (child != null) {
      child.clearParent();
    }
    return child;
  }

  @Nullable
  public Interval takeRight() {
    Interval child = this.right;
    this.right = null;
    if (child != null) {
      child.clearParent();
    }
    return child;
  }

  public void setParent(@Nullable Interval parent) {
    this.parentIsContainer = false;
    this.container = null;
    this.parent = parent;
  }

  public void setContainer(@NotNull IntervalContainer container) {
    this.parentIsContainer = true;
    this.parent = null;
    this.container = container;
  }

  public void clearParent() {
    this.parentIsContainer = false;
    this.parent = null;
    this.container = null;
  }

  /**
   * Makes the way up of {@code other} whatever it is for this node, regardless of its kind.
   * Only the back-reference moves, the parent's child slot is left as is.
   */
  public void copyParentTo(@NotNull Interval other) {
    if (parentIsContainer) {
      other.setContainer(container);
    }
    else {
      other.setParent(parent);
    }
  }

  public void copyProperties(@NotNull Interval source) {
    if (source.isDefault() && this.isDefault()) {
      return;
    }
    this.writeProtect = source.writeProtect;
    this.visible = source.visible;
    this.frontSticky = source.frontSticky;
    this.rearSticky = source.rearSticky;
    this.plist = source.plist.copy();
  }

  /**
   * Exchanges everything except the links with {@code other}: lengths, cached position and properties.
   */
  public void swapPayload(@NotNull Interval other) {
    long totalLength = this.totalLength;
    this.totalLength = other.totalLength;
    other.totalLength = totalLength;

    long position = this.position;
    this.position = other.position;
    other.position = position;

    boolean writeProtect = this.writeProtect;
    this.writeProtect = other.writeProtect;
    other.writeProtect = writeProtect;

    boolean visible = this.visible;
    this.visible = other.visible;
    other.visible = visible;

    boolean frontSticky = this.frontSticky;
    this.frontSticky = other.frontSticky;
    other.frontSticky = frontSticky;

    boolean rearSticky = this.rearSticky;
    this.rearSticky = other.rearSticky;
    other.rearSticky = rearSticky;

    PropertyList plist = this.plist;
    this.plist = other.plist;
    other.plist = plist;
  }

  /** Back to the default, zero-length, unlinked state so the node can be reused. */
  public void reset() {
    this.totalLength = 0;
    this.position = 0;
    this.left = null;
    this.right = null;
    clearParent();
    this.writeProtect = false;
    this.visible = false;
    this.frontSticky = false;
    this.rearSticky = false;
    this.plist = PropertyList.EMPTY;
  }

  @Override
  public String toString() {
    return "Interval{" +
           "position=" + position +
           ", length=" + length() +
           ", totalLength=" + totalLength +
           ", plist=" + plist +
           '}';
  }
}
