package textprops.intervals;

/**
 * The tree is corrupted. Never caught by the library: once thrown, the tree's invariants
 * can no longer be trusted.
 */
public class ViolatedInvariantException extends IllegalStateException {

  public ViolatedInvariantException(String message) {
    super(message);
  }

  public static void check(boolean condition, String message) {
    if (!condition) {
      throw new ViolatedInvariantException(message);
    }
  }
}
