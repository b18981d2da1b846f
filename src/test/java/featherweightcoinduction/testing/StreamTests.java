package featherweightcoinduction.testing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import featherweightcoinduction.core.Stream;
import featherweightcoinduction.util.Pair;
import featherweightcoinduction.util.Thunk;

/**
 * Tests for the construction and observation of lazy streams.
 *
 * @author David J. Pearce
 *
 */
public class StreamTests {

	// ==============================================================
	// Construction
	// ==============================================================

	@Test
	public void test_01() {
		Stream<Integer> nat = Stream.iterate(0, n -> n + 1);
		assertEquals(Arrays.asList(0, 1, 2, 3, 4), nat.take(5));
	}

	@Test
	public void test_02() {
		Stream<Integer> s = Stream.constant(7);
		assertSame(s, s.tl());
		assertEquals(Arrays.asList(7, 7, 7), s.take(3));
	}

	@Test
	public void test_03() {
		Stream<Integer> s = Stream.cycle(1, 2, 3);
		assertSame(s, s.drop(3));
		assertEquals(Arrays.asList(1, 2, 3, 1, 2, 3, 1), s.take(7));
	}

	@Test
	public void test_04() {
		Stream<Integer> s = Stream.periodic(0, i -> new Pair<>(i * 10, (i + 1) % 4));
		assertSame(s, s.drop(4));
		assertEquals(Arrays.asList(0, 10, 20, 30, 0), s.take(5));
	}

	@Test
	public void test_05() {
		// Fibonacci
		Stream<Integer> fib = Stream.unfold(new Pair<>(0, 1), p -> new Pair<>(p.first(), new Pair<>(p.second(), p.first() + p.second())));
		assertEquals(Arrays.asList(0, 1, 1, 2, 3, 5, 8, 13), fib.take(8));
	}

	@Test
	public void test_06() {
		Stream<Integer> s = Stream.cons(1, Stream.constant(2));
		assertEquals(Arrays.asList(1, 2, 2, 2), s.take(4));
	}

	@Test
	public void test_07() {
		assertThrows(IllegalArgumentException.class, () -> Stream.<Integer>cycle());
	}

	@Test
	public void test_08() {
		assertEquals("[0, 1, 2, 3, 4, ...]", Stream.iterate(0, n -> n + 1).toString());
	}

	@Test
	public void test_09() {
		assertEquals(0, Stream.constant(1).take(0).size());
	}

	// ==============================================================
	// Finite State
	// ==============================================================

	@Test
	public void test_20() {
		assertTrue(Stream.constant(1).isFiniteState());
		assertTrue(Stream.cycle(1, 2).isFiniteState());
		assertTrue(Stream.cycle(1, 2).tl().isFiniteState());
		assertTrue(Stream.cons(0, Stream.constant(1)).isFiniteState());
	}

	@Test
	public void test_21() {
		assertFalse(Stream.iterate(0, n -> n + 1).isFiniteState());
		assertFalse(Stream.cons(0, () -> Stream.constant(1)).isFiniteState());
		assertFalse(Stream.cons(0, Stream.iterate(0, n -> n + 1)).isFiniteState());
	}

	@Test
	public void test_22() {
		// A generator revisiting a state is still not finite-state unless periodic
		Stream<Integer> s = Stream.unfold(0, i -> new Pair<>(i, (i + 1) % 2));
		assertFalse(s.isFiniteState());
		assertFalse(s == s.drop(2));
	}

	// ==============================================================
	// Memoisation
	// ==============================================================

	@Test
	public void test_40() {
		AtomicInteger count = new AtomicInteger();
		Stream<Integer> s = Stream.unfold(0, i -> {
			count.incrementAndGet();
			return new Pair<>(i, i + 1);
		});
		// Head is available without forcing the tail
		assertEquals(Integer.valueOf(0), s.hd());
		assertFalse(s.isTailForced());
		assertEquals(1, count.get());
		Stream<Integer> t = s.tl();
		assertSame(t, s.tl());
		assertTrue(s.isTailForced());
		assertEquals(2, count.get());
	}

	@Test
	public void test_41() {
		AtomicInteger count = new AtomicInteger();
		Stream<Integer> s = Stream.cons(1, () -> {
			count.incrementAndGet();
			return Stream.constant(2);
		});
		s.take(10);
		s.take(10);
		assertEquals(1, count.get());
	}

	@Test
	public void test_42() {
		AtomicReference<Thunk<Integer>> self = new AtomicReference<>();
		Thunk<Integer> t = new Thunk<>(() -> self.get().get());
		self.set(t);
		assertThrows(IllegalStateException.class, () -> t.get());
	}

	@Test
	public void test_43() {
		Thunk<Integer> t = Thunk.of(3);
		assertTrue(t.isForced());
		assertEquals(Integer.valueOf(3), t.get());
	}
}
