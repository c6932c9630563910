package works.ordmap;

import java.util.ArrayDeque;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * Walks an {@link OrderedMap} in key order using its own stack,
 * so any number of these can be active over the same map at once.
 * The stack never holds more than one node per level of the tree.
 */
final class InOrderIterator<K,V,T> implements Iterator<T> {
	private final OrderedMap<K,V> map;
	private final Function<Node<K,V>, T> extractor;
	private final Deque<Node<K,V>> stack = new ArrayDeque<>();
	private final int expectedModCount;

	InOrderIterator(OrderedMap<K,V> map, Function<Node<K,V>, T> extractor) {
		this.map = map;
		this.extractor = extractor;
		this.expectedModCount = map.modCount;
		pushLeftSpine(map.root);
	}

	@Override
	public boolean hasNext() {
		return !stack.isEmpty();
	}

	@Override
	public T next() {
		if (map.modCount != expectedModCount) {
			throw new ConcurrentModificationException();
		}
		Node<K,V> node = stack.poll();
		if (node == null) {
			throw new NoSuchElementException();
		}
		pushLeftSpine(node.right);
		return extractor.apply(node);
	}

	private void pushLeftSpine(@Nullable Node<K,V> node) {
		for (Node<K,V> n = node; n != null; n = n.left) {
			stack.push(n);
		}
	}
}
