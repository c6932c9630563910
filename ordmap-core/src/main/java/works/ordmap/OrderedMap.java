package works.ordmap;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.BiPredicate;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.ordmap.exceptions.InvariantViolationException;

import static works.ordmap.Balancing.fixUp;
import static works.ordmap.Balancing.isRed;
import static works.ordmap.Balancing.moveRedLeft;
import static works.ordmap.Balancing.moveRedRight;
import static works.ordmap.Balancing.requireLeft;
import static works.ordmap.Balancing.requireRight;
import static works.ordmap.Balancing.rotateRight;
import static works.ordmap.Color.BLACK;

/**
 * A mutable map whose entries are kept in key order by a left-leaning red-black tree.
 * Lookups, insertions and deletions take time logarithmic in {@link #size()}.
 *
 * <p>
 * Keys are ordered by a caller-supplied {@link Comparator}, and matched by a
 * caller-supplied equality test that must agree with it: two keys are equal
 * exactly when neither compares less than the other. When no equality test is
 * given, keys that compare as zero are equal. If the two disagree, the equality
 * test wins: a key it considers present is updated rather than duplicated.
 *
 * <p>
 * Neither keys nor values may be null. Missing keys are reported with
 * {@link Optional#empty()} or <code>false</code>, never with an exception.
 *
 * <p>
 * Traversal via {@link #entries()}, {@link #keys()} and {@link #values()} is lazy,
 * and each call to <code>iterator()</code> starts a fresh, independent walk.
 * Iterators are fail-fast: a structural modification (adding a new key,
 * or removing one) after an iterator is created causes its next call to
 * <code>next()</code> to throw {@link java.util.ConcurrentModificationException}.
 *
 * <p>
 * Instances are not thread-safe.
 */
public final class OrderedMap<K,V> implements Iterable<Map.Entry<K,V>> {
	private final Comparator<? super K> ordering;
	private final BiPredicate<? super K, ? super K> equality;

	@Nullable Node<K,V> root;
	private int size;

	/**
	 * Incremented on every structural modification; watched by {@link InOrderIterator}.
	 */
	int modCount;

	public OrderedMap(@NonNull Comparator<? super K> ordering) {
		this(ordering, (a, b) -> ordering.compare(a, b) == 0);
	}

	public OrderedMap(@NonNull Comparator<? super K> ordering, @NonNull BiPredicate<? super K, ? super K> equality) {
		this.ordering = ordering;
		this.equality = equality;
	}

	/**
	 * Adds the given entries in order, as though by {@link #setAll}.
	 */
	public OrderedMap(@NonNull Comparator<? super K> ordering, @NonNull Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
		this(ordering);
		setAll(entries);
	}

	public static <KK extends Comparable<? super KK>, VV> OrderedMap<KK,VV> naturalOrder() {
		return new OrderedMap<>(Comparator.<KK>naturalOrder());
	}

	public static <KK extends Comparable<? super KK>, VV> OrderedMap<KK,VV> of(@NonNull Iterable<? extends Map.Entry<? extends KK, ? extends VV>> entries) {
		return new OrderedMap<>(Comparator.<KK>naturalOrder(), entries);
	}

	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	/**
	 * Associates <code>value</code> with <code>key</code>, replacing any value
	 * already associated with it. Replacing a value leaves {@link #size()} unchanged.
	 *
	 * @return <code>this</code>
	 */
	public OrderedMap<K,V> set(@NonNull K key, @NonNull V value) {
		int priorSize = size;
		Node<K,V> newRoot = set(root, key, value);
		newRoot.color = BLACK;
		root = newRoot;
		if (size != priorSize) {
			modCount++;
		}
		return this;
	}

	/**
	 * Calls {@link #set} for each entry in turn, so later duplicates overwrite earlier ones.
	 *
	 * @return <code>this</code>
	 */
	public OrderedMap<K,V> setAll(@NonNull Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
		for (Map.Entry<? extends K, ? extends V> entry: entries) {
			set(entry.getKey(), entry.getValue());
		}
		return this;
	}

	public Optional<V> get(@NonNull K key) {
		Node<K,V> node = find(key);
		if (node == null) {
			return Optional.empty();
		} else {
			return Optional.of(node.value);
		}
	}

	public boolean containsKey(@NonNull K key) {
		return find(key) != null;
	}

	public Optional<K> min() {
		Node<K,V> node = root;
		if (node == null) {
			return Optional.empty();
		}
		return Optional.of(leftmost(node).key);
	}

	public Optional<K> max() {
		Node<K,V> node = root;
		if (node == null) {
			return Optional.empty();
		}
		return Optional.of(rightmost(node).key);
	}

	/**
	 * @return the largest key strictly less than <code>key</code>.
	 * <code>key</code> itself need not be present, and is never the answer.
	 */
	public Optional<K> previous(@NonNull K key) {
		Node<K,V> node = previous(root, key);
		return (node == null) ? Optional.empty() : Optional.of(node.key);
	}

	/**
	 * @return the smallest key strictly greater than <code>key</code>.
	 * <code>key</code> itself need not be present, and is never the answer.
	 */
	public Optional<K> next(@NonNull K key) {
		Node<K,V> node = next(root, key);
		return (node == null) ? Optional.empty() : Optional.of(node.key);
	}

	/**
	 * @return true if <code>key</code> was present and has been removed;
	 * false if it was absent, in which case the map is untouched.
	 */
	public boolean delete(@NonNull K key) {
		Node<K,V> oldRoot = root;
		if (oldRoot == null || find(key) == null) {
			LOGGER.trace("delete({}): absent", key);
			return false;
		}
		int priorSize = size;
		boolean removed = replaceRootAfterDeletion(delete(oldRoot, key), priorSize);
		LOGGER.trace("delete({}): removed={} size={}", key, removed, size);
		return removed;
	}

	public boolean deleteMin() {
		Node<K,V> oldRoot = root;
		if (oldRoot == null) {
			return false;
		}
		int priorSize = size;
		boolean removed = replaceRootAfterDeletion(deleteMin(oldRoot), priorSize);
		LOGGER.trace("deleteMin: removed={} size={}", removed, size);
		return removed;
	}

	public boolean deleteMax() {
		Node<K,V> oldRoot = root;
		if (oldRoot == null) {
			return false;
		}
		int priorSize = size;
		boolean removed = replaceRootAfterDeletion(deleteMax(oldRoot), priorSize);
		LOGGER.trace("deleteMax: removed={} size={}", removed, size);
		return removed;
	}

	public void clear() {
		LOGGER.debug("Clearing {} entries", size);
		root = null;
		size = 0;
		modCount++;
	}

	/**
	 * @return a restartable view of the entries in key order.
	 * The entries themselves are snapshots and don't support {@link Map.Entry#setValue}.
	 */
	public Iterable<Map.Entry<K,V>> entries() {
		return () -> new InOrderIterator<K,V,Map.Entry<K,V>>(this, node -> new SimpleImmutableEntry<>(node.key, node.value));
	}

	public Iterable<K> keys() {
		return () -> new InOrderIterator<K,V,K>(this, node -> node.key);
	}

	public Iterable<V> values() {
		return () -> new InOrderIterator<K,V,V>(this, node -> node.value);
	}

	@Override
	public Iterator<Map.Entry<K,V>> iterator() {
		return entries().iterator();
	}

	/**
	 * Walks the whole tree checking the red-black invariants, key order, and {@link #size()}.
	 * Takes linear time, so this is meant for tests and debugging.
	 *
	 * @throws InvariantViolationException if the tree is malformed
	 */
	public void verifyIntegrity() {
		Node<K,V> node = root;
		if (isRed(node)) {
			throw new InvariantViolationException("Root is red: " + node);
		}
		int blackHeight = verifiedBlackHeight(node);

		int nodeCount = 0;
		K priorKey = null;
		for (K key: keys()) {
			if (nodeCount >= 1 && ordering.compare(priorKey, key) >= 0) {
				throw new InvariantViolationException("Keys out of order: " + priorKey + " precedes " + key);
			}
			priorKey = key;
			nodeCount++;
		}
		if (nodeCount != size) {
			throw new InvariantViolationException("Size is " + size + " but tree has " + nodeCount + " nodes");
		}
		LOGGER.debug("Verified {} entries with black height {}", size, blackHeight);
	}

	@Override
	public String toString() {
		StringJoiner joiner = new StringJoiner(", ", "{", "}");
		for (Map.Entry<K,V> entry: this) {
			joiner.add(entry.getKey() + "=" + entry.getValue());
		}
		return joiner.toString();
	}

	private Node<K,V> set(@Nullable Node<K,V> node, K key, V value) {
		if (node == null) {
			size++;
			return new Node<>(key, value);
		}

		// Equality goes first so a dubious comparator can't create a duplicate
		if (equality.test(key, node.key)) {
			node.value = value;
		} else if (ordering.compare(key, node.key) < 0) {
			node.left = set(node.left, key, value);
		} else {
			node.right = set(node.right, key, value);
		}

		return fixUp(node);
	}

	private @Nullable Node<K,V> find(K key) {
		Node<K,V> node = root;
		while (node != null) {
			if (equality.test(key, node.key)) {
				return node;
			} else if (ordering.compare(key, node.key) < 0) {
				node = node.left;
			} else {
				node = node.right;
			}
		}
		return null;
	}

	private static <K,V> Node<K,V> leftmost(Node<K,V> node) {
		Node<K,V> result = node;
		for (Node<K,V> left = result.left; left != null; left = left.left) {
			result = left;
		}
		return result;
	}

	private static <K,V> Node<K,V> rightmost(Node<K,V> node) {
		Node<K,V> result = node;
		for (Node<K,V> right = result.right; right != null; right = right.right) {
			result = right;
		}
		return result;
	}

	private @Nullable Node<K,V> previous(@Nullable Node<K,V> node, K key) {
		if (node == null) {
			return null;
		}
		if (ordering.compare(key, node.key) <= 0) {
			return previous(node.left, key);
		}
		// This node qualifies, but there may be a closer one to the right
		Node<K,V> closer = previous(node.right, key);
		return (closer == null) ? node : closer;
	}

	private @Nullable Node<K,V> next(@Nullable Node<K,V> node, K key) {
		if (node == null) {
			return null;
		}
		if (ordering.compare(key, node.key) >= 0) {
			return next(node.right, key);
		}
		Node<K,V> closer = next(node.left, key);
		return (closer == null) ? node : closer;
	}

	private boolean replaceRootAfterDeletion(@Nullable Node<K,V> newRoot, int priorSize) {
		root = newRoot;
		if (newRoot != null) {
			newRoot.color = BLACK;
		}
		boolean removed = size < priorSize;
		if (removed) {
			modCount++;
		}
		return removed;
	}

	private @Nullable Node<K,V> deleteMin(Node<K,V> node) {
		if (node.left == null) {
			size--;
			return null;
		}
		if (!isRed(node.left) && !isRed(requireLeft(node).left)) {
			node = moveRedLeft(node);
		}
		node.left = deleteMin(requireLeft(node));
		return fixUp(node);
	}

	private @Nullable Node<K,V> deleteMax(Node<K,V> node) {
		if (isRed(node.left)) {
			// Right-leaning 3-node, so we have something to borrow on the way down
			node = rotateRight(node);
		}
		if (node.right == null) {
			size--;
			return null;
		}
		if (!isRed(node.right) && !isRed(requireRight(node).left)) {
			node = moveRedRight(node);
		}
		node.right = deleteMax(requireRight(node));
		return fixUp(node);
	}

	/**
	 * @param key must be present in the subtree rooted at <code>node</code>
	 */
	private @Nullable Node<K,V> delete(Node<K,V> node, K key) {
		// As in set and find, an equality match never descends left
		if (!equality.test(key, node.key) && ordering.compare(key, node.key) < 0) {
			if (!isRed(node.left) && !isRed(requireLeft(node).left)) {
				node = moveRedLeft(node);
			}
			node.left = delete(requireLeft(node), key);
		} else {
			if (isRed(node.left)) {
				node = rotateRight(node);
			}
			if (equality.test(key, node.key) && node.right == null) {
				size--;
				return null;
			}
			if (!isRed(node.right) && !isRed(requireRight(node).left)) {
				node = moveRedRight(node);
			}
			if (equality.test(key, node.key)) {
				// Splice in the successor, then remove it from the right subtree
				Node<K,V> successor = leftmost(requireRight(node));
				node.key = successor.key;
				node.value = successor.value;
				node.right = deleteMin(requireRight(node));
			} else {
				node.right = delete(requireRight(node), key);
			}
		}
		return fixUp(node);
	}

	private int verifiedBlackHeight(@Nullable Node<K,V> node) {
		if (node == null) {
			return 0;
		}
		if (isRed(node.right)) {
			throw new InvariantViolationException("Right-leaning red link under " + node);
		}
		if (isRed(node.left) && isRed(requireLeft(node).left)) {
			throw new InvariantViolationException("Two left red links in a row under " + node);
		}
		int leftHeight = verifiedBlackHeight(node.left);
		int rightHeight = verifiedBlackHeight(node.right);
		if (leftHeight != rightHeight) {
			throw new InvariantViolationException("Black heights differ under " + node + ": " + leftHeight + " on the left, " + rightHeight + " on the right");
		}
		return isRed(node) ? leftHeight : leftHeight + 1;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OrderedMap.class);
}
