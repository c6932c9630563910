package works.ordmap;

import org.jetbrains.annotations.Nullable;

import static works.ordmap.Color.RED;

/**
 * A mutable tree node, owned exclusively by its parent (or, for the root, by the {@link OrderedMap}).
 * <p>
 * The {@link Balancing} primitives rewire the fields in place.
 */
final class Node<K,V> {
	K key; // Only reassigned when a successor is spliced in during deletion
	V value;
	Color color;
	@Nullable Node<K,V> left, right;

	Node(K key, V value) {
		this.key = key;
		this.value = value;
		this.color = RED;
	}

	@Override
	public String toString() {
		return "Node(" + key + "=" + value + ", " + color + ")";
	}
}
