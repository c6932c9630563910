package works.ordmap;

import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * The mutating benchmarks must leave the maps as they found them,
 * or later iterations would be measuring a different tree.
 */
class OrderedMapBenchmarkTest {
	OrderedMapBenchmark benchmark;
	OrderedMapBenchmark.BenchmarkState state;

	@BeforeEach
	void setupState() {
		benchmark = new OrderedMapBenchmark();
		state = new OrderedMapBenchmark.BenchmarkState();
		state.setup();
	}

	@Test
	void setThenDelete_sizeUnchanged() {
		int orderedMapSize = state.orderedMapSize();
		int treeMapSize = state.treeMapSize();
		for (int i = 0; i < 3 * OrderedMapBenchmark.PROBE_COUNT; i++) {
			assertEquals(Boolean.TRUE, benchmark.orderedMapSetThenDelete(state));
			assertEquals("New entry", benchmark.treeMapPutThenRemove(state));
		}
		assertEquals(orderedMapSize, state.orderedMapSize());
		assertEquals(treeMapSize, state.treeMapSize());
	}

	@Test
	void gets_alwaysHit() {
		for (int i = 0; i < OrderedMapBenchmark.PROBE_COUNT; i++) {
			Object result = benchmark.orderedMapGet(state);
			assertTrue(result instanceof Optional && ((Optional<?>) result).isPresent());
			assertTrue(benchmark.treeMapGet(state) != null);
		}
	}
}
