package works.ordmap;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.util.Map.entry;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InOrderIteratorTest {
	OrderedMap<String, Integer> map;

	@BeforeEach
	void setupMap() {
		map = OrderedMap.naturalOrder();
		map.set("delta", 4).set("alpha", 1).set("echo", 5).set("charlie", 3).set("bravo", 2);
	}

	@Test
	void entries_inKeyOrder() {
		assertThat(map.entries(), contains(
			entry("alpha", 1),
			entry("bravo", 2),
			entry("charlie", 3),
			entry("delta", 4),
			entry("echo", 5)));
		assertThat(map.keys(), contains("alpha", "bravo", "charlie", "delta", "echo"));
		assertThat(map.values(), contains(1, 2, 3, 4, 5));
	}

	@Test
	void sameIterable_restartable() {
		Iterable<String> keys = map.keys();
		assertEquals(collect(keys), collect(keys));
	}

	@Test
	void interleavedIterators_independent() {
		Iterator<String> first = map.keys().iterator();
		Iterator<String> second = map.keys().iterator();
		assertEquals("alpha", first.next());
		assertEquals("bravo", first.next());
		assertEquals("alpha", second.next());
		assertEquals("charlie", first.next());
		assertEquals("bravo", second.next());
	}

	@Test
	void exhausted_throwsNoSuchElement() {
		Iterator<Map.Entry<String, Integer>> iterator = map.iterator();
		for (int i = 0; i < 5; i++) {
			assertTrue(iterator.hasNext());
			iterator.next();
		}
		assertFalse(iterator.hasNext());
		assertThrows(NoSuchElementException.class, iterator::next);
	}

	@Test
	void newKeyDuringIteration_failsFast() {
		Iterator<String> iterator = map.keys().iterator();
		iterator.next();
		map.set("foxtrot", 6);
		assertThrows(ConcurrentModificationException.class, iterator::next);
	}

	@Test
	void deletionDuringIteration_failsFast() {
		Iterator<String> iterator = map.keys().iterator();
		iterator.next();
		map.deleteMax();
		assertThrows(ConcurrentModificationException.class, iterator::next);
	}

	@Test
	void clearDuringIteration_failsFast() {
		Iterator<Integer> iterator = map.values().iterator();
		map.clear();
		assertThrows(ConcurrentModificationException.class, iterator::next);
	}

	@Test
	void nonStructuralChanges_allowed() {
		Iterator<Map.Entry<String, Integer>> iterator = map.iterator();
		assertEquals(entry("alpha", 1), iterator.next());
		map.set("bravo", 22);
		map.delete("zulu");
		assertEquals(entry("bravo", 22), iterator.next());
	}

	@Test
	void remove_unsupported() {
		Iterator<String> iterator = map.keys().iterator();
		iterator.next();
		assertThrows(UnsupportedOperationException.class, iterator::remove);
		assertEquals(5, map.size());
	}

	@Test
	void entrySnapshot_isImmutable() {
		Map.Entry<String, Integer> first = map.iterator().next();
		assertThrows(UnsupportedOperationException.class, () -> first.setValue(100));
		assertEquals(1, map.get("alpha").orElseThrow());
	}

	private static <T> List<T> collect(Iterable<T> iterable) {
		List<T> result = new ArrayList<>();
		iterable.forEach(result::add);
		return result;
	}
}
