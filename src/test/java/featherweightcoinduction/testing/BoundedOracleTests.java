// This file is part of Featherweight Coinduction (fwc).
//
// Featherweight Coinduction is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// Featherweight Coinduction is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with Featherweight Coinduction. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package featherweightcoinduction.testing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import featherweightcoinduction.core.BoundedOracle;
import featherweightcoinduction.core.CoinductiveChecker;
import featherweightcoinduction.core.Relation;
import featherweightcoinduction.core.Stream;
import featherweightcoinduction.core.Syntax.RecType;
import featherweightcoinduction.core.Syntax.RecType.Arrow;
import featherweightcoinduction.util.Pair;

/**
 * Test cases for the bounded unrolling of relations, including agreement with
 * the assume/check algorithm on finite-state inputs.
 *
 * @author David J. Pearce
 *
 */
public class BoundedOracleTests {
	private static final BoundedOracle oracle = new BoundedOracle();
	private static final CoinductiveChecker checker = new CoinductiveChecker();

	private static Stream<Integer> nat() {
		return Stream.iterate(0, n -> n + 1);
	}

	// ==============================================================
	// Base Case
	// ==============================================================

	@Test
	public void test_01() {
		// Nothing is disproved at depth zero
		assertTrue(oracle.relatesUpTo(Relation.LEXLESS, Stream.constant(1), Stream.constant(0), 0));
		assertTrue(oracle.relatesUpTo(Relation.SUBTYPE, RecType.Top, RecType.Bottom, 0));
	}

	@Test
	public void test_02() {
		// Nothing is witnessed at depth zero
		assertFalse(oracle.relatesUpTo(Relation.NOT_LEXLESS, Stream.constant(1), Stream.constant(0), 0));
		assertFalse(oracle.relatesUpTo(Relation.SUBTYPE.negate(), RecType.Top, RecType.Bottom, 0));
	}

	@Test
	public void test_03() {
		assertFalse(oracle.relatesUpTo(Relation.LEXLESS, Stream.constant(1), Stream.constant(0), 1));
		assertTrue(oracle.relatesUpTo(Relation.NOT_LEXLESS, Stream.constant(1), Stream.constant(0), 1));
	}

	@Test
	public void test_04() {
		assertThrows(IllegalArgumentException.class,
				() -> oracle.relatesUpTo(Relation.BISIM, Stream.constant(1), Stream.constant(1), -1));
	}

	// ==============================================================
	// Duality
	// ==============================================================

	@Test
	public void test_20() {
		List<Pair<Stream<Integer>, Stream<Integer>>> pairs = Arrays.asList(
				new Pair<>(Stream.cycle(1, 2), Stream.cycle(1, 3)),
				new Pair<>(Stream.cycle(1, 3), Stream.cycle(1, 2)),
				new Pair<>(Stream.constant(0), Stream.constant(0)),
				new Pair<>(nat(), nat()),
				new Pair<>(nat(), Stream.constant(0)),
				new Pair<>(Stream.cycle(0, 0, 0, 1), Stream.cycle(0, 0, 0, 0, 1)));
		for (Pair<Stream<Integer>, Stream<Integer>> p : pairs) {
			for (int k = 0; k <= 12; ++k) {
				boolean positive = oracle.relatesUpTo(Relation.LEXLESS, p.first(), p.second(), k);
				boolean negative = oracle.relatesUpTo(Relation.NOT_LEXLESS, p.first(), p.second(), k);
				assertTrue(p + " at " + k, positive != negative);
			}
		}
	}

	@Test
	public void test_21() {
		Arrow x = Arrow.fix(self -> new Pair<>(RecType.Bottom, self));
		Arrow y = Arrow.fix(self -> new Pair<>(RecType.Top, self));
		for (int k = 0; k <= 8; ++k) {
			assertTrue(oracle.relatesUpTo(Relation.SUBTYPE, y, x, k) != oracle.relatesUpTo(Relation.SUBTYPE.negate(), y, x, k));
			assertTrue(oracle.relatesUpTo(Relation.SUBTYPE, x, y, k) != oracle.relatesUpTo(Relation.SUBTYPE.negate(), x, y, k));
		}
	}

	// ==============================================================
	// Non Finite-State
	// ==============================================================

	@Test
	public void test_40() {
		// Terminates on streams which never repeat
		Stream<Integer> s = Stream.unfold(0, n -> new Pair<>(n, n + 1));
		assertTrue(oracle.relatesUpTo(Relation.BISIM, nat(), s, 200));
		assertTrue(oracle.relatesUpTo(Relation.LEXLESS, nat(), s, 200));
	}

	@Test
	public void test_41() {
		// Relation holds up to the first difference only
		Stream<Integer> s = nat();
		Stream<Integer> t = Stream.unfold(0, n -> new Pair<>(n == 10 ? 0 : n, n + 1));
		assertTrue(oracle.relatesUpTo(Relation.BISIM, s, t, 10));
		assertFalse(oracle.relatesUpTo(Relation.BISIM, s, t, 11));
		assertTrue(oracle.relatesUpTo(Relation.LEXLESS, t, s, 50));
	}

	// ==============================================================
	// Witnesses
	// ==============================================================

	@Test
	public void test_60() {
		assertThrows(IllegalArgumentException.class,
				() -> oracle.witness(Relation.NOT_LEXLESS, Stream.constant(0), Stream.constant(0), 10));
	}

	@Test
	public void test_61() {
		assertEquals(BoundedOracle.NO_WITNESS, oracle.witness(Relation.LEXLESS, nat(), nat(), 10));
		assertEquals(BoundedOracle.NO_WITNESS, oracle.witness(Relation.BISIM, nat(), nat(), 0));
	}

	@Test
	public void test_62() {
		assertEquals(3, oracle.witness(Relation.LEXLESS, nat(), Stream.cons(0, Stream.cons(1, Stream.constant(0))), 10));
		assertEquals(1, oracle.witness(Relation.BISIM, Stream.constant(0), Stream.constant(1), 10));
	}

	@Test
	public void test_63() {
		// Agrees with the depth found by the checker
		Stream<Integer> s = Stream.cycle(0, 0, 0, 1);
		Stream<Integer> t = Stream.cycle(0, 0, 0, 0, 1);
		int expected = checker.counterexample(Relation.LEXLESS, s, t);
		assertEquals(4, expected);
		assertEquals(expected, oracle.witness(Relation.LEXLESS, s, t, 20));
		assertEquals(BoundedOracle.NO_WITNESS, oracle.witness(Relation.LEXLESS, s, t, 3));
	}

	@Test
	public void test_64() {
		Arrow x = Arrow.fix(self -> new Pair<>(RecType.Bottom, self));
		Arrow y = Arrow.fix(self -> new Pair<>(RecType.Top, self));
		assertEquals(checker.counterexample(Relation.SUBTYPE, x, y), oracle.witness(Relation.SUBTYPE, x, y, 10));
		assertEquals(BoundedOracle.NO_WITNESS, oracle.witness(Relation.SUBTYPE, y, x, 10));
	}
}
