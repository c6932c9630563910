package works.ordmap.exceptions;

/**
 * Indicates that a red-black tree was found in a shape that the balancing
 * algorithm should never produce: a rotation with a missing child,
 * a right-leaning red link at rest, unequal black heights, and so on.
 * <p>
 * This is always a bug in the library, not in the caller,
 * so there's no sensible way to recover from it.
 */
public class InvariantViolationException extends IllegalStateException {
	public InvariantViolationException(String message) { super(message); }
	public InvariantViolationException(Throwable cause) { super(cause); }
	public InvariantViolationException(String message, Throwable cause) { super(message, cause); }
}
