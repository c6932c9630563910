package works.ordmap;

import org.jetbrains.annotations.Nullable;
import works.ordmap.exceptions.InvariantViolationException;

import static works.ordmap.Color.RED;

/**
 * Rotations and color flips for left-leaning red-black trees,
 * after Sedgewick's <em>Left-leaning Red-Black Trees</em>.
 * <p>
 * Every method that returns a {@link Node} returns the new root of the
 * subtree it was given; the caller must store it back into the parent.
 */
final class Balancing {
	private Balancing() {}

	static boolean isRed(@Nullable Node<?,?> node) {
		// Absent nodes count as black
		return node != null && node.color == RED;
	}

	static void flipColor(Node<?,?> node) {
		node.color = node.color.flipped();
	}

	/**
	 * Splits a temporary 4-node, or (during deletion) merges two 2-nodes
	 * with their parent into a temporary 4-node.
	 */
	static void flipColors(Node<?,?> node) {
		flipColor(node);
		flipColor(requireLeft(node));
		flipColor(requireRight(node));
	}

	/**
	 * Turns a right-leaning red link into a left-leaning one.
	 */
	static <K,V> Node<K,V> rotateLeft(Node<K,V> node) {
		Node<K,V> right = requireRight(node);
		node.right = right.left;
		right.left = node;
		right.color = node.color;
		node.color = RED;
		return right;
	}

	/**
	 * Turns a left-leaning red link into a right-leaning one.
	 */
	static <K,V> Node<K,V> rotateRight(Node<K,V> node) {
		Node<K,V> left = requireLeft(node);
		node.left = left.right;
		left.right = node;
		left.color = node.color;
		node.color = RED;
		return left;
	}

	/**
	 * Assuming <code>node</code> is red and both <code>node.left</code> and
	 * <code>node.left.left</code> are black, makes <code>node.left</code>
	 * or one of its children red, borrowing from the right sibling if it's a 3-node.
	 */
	static <K,V> Node<K,V> moveRedLeft(Node<K,V> node) {
		flipColors(node);
		Node<K,V> right = requireRight(node);
		if (isRed(right.left)) {
			node.right = rotateRight(right);
			node = rotateLeft(node);
			flipColors(node);
		}
		return node;
	}

	/**
	 * Mirror image of {@link #moveRedLeft}: assuming <code>node</code> is red and both
	 * <code>node.right</code> and <code>node.right.left</code> are black,
	 * makes <code>node.right</code> or one of its children red.
	 */
	static <K,V> Node<K,V> moveRedRight(Node<K,V> node) {
		flipColors(node);
		Node<K,V> left = requireLeft(node);
		if (isRed(left.left)) {
			node = rotateRight(node);
			flipColors(node);
		}
		return node;
	}

	/**
	 * Restores the local LLRB shape of <code>node</code> after one of its subtrees has changed.
	 */
	static <K,V> Node<K,V> fixUp(Node<K,V> node) {
		if (isRed(node.right) && !isRed(node.left)) {
			node = rotateLeft(node);
		}
		if (isRed(node.left) && isRed(requireLeft(node).left)) {
			node = rotateRight(node);
		}
		if (isRed(node.left) && isRed(node.right)) {
			flipColors(node);
		}
		return node;
	}

	static <K,V> Node<K,V> requireLeft(Node<K,V> node) {
		Node<K,V> left = node.left;
		if (left == null) {
			throw new InvariantViolationException("Expected a left child under " + node);
		}
		return left;
	}

	static <K,V> Node<K,V> requireRight(Node<K,V> node) {
		Node<K,V> right = node.right;
		if (right == null) {
			throw new InvariantViolationException("Expected a right child under " + node);
		}
		return right;
	}
}
