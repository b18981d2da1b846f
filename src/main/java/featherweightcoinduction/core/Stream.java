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
package featherweightcoinduction.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import featherweightcoinduction.core.Syntax.AbstractNode;
import featherweightcoinduction.util.Pair;
import featherweightcoinduction.util.Thunk;

/**
 * An infinite sequence of values. The head of a stream is always available,
 * whilst its tail is computed on demand the first time it is requested and
 * cached thereafter. A stream may be its own tail, as in the case of a constant
 * stream.
 *
 * @author David J. Pearce
 *
 * @param <A> The type of elements in this stream
 */
public final class Stream<A> extends AbstractNode {
	/**
	 * Number of elements shown by <code>toString()</code>.
	 */
	private static final int PRINT_LIMIT = 5;

	private final A head;
	private final Thunk<Stream<A>> tail;
	private final boolean finiteState;

	private Stream(A head, Function<Stream<A>, Stream<A>> next, boolean finiteState) {
		super(Syntax.NODE_stream);
		this.head = head;
		this.tail = new Thunk<>(() -> next.apply(this));
		this.finiteState = finiteState;
	}

	@Override
	public A hd() {
		return head;
	}

	@Override
	public Stream<A> tl() {
		return tail.get();
	}

	@Override
	public boolean isFiniteState() {
		return finiteState;
	}

	/**
	 * Check whether the tail of this stream has been computed yet.
	 *
	 * @return
	 */
	public boolean isTailForced() {
		return tail.isForced();
	}

	/**
	 * Get the first <code>n</code> elements of this stream.
	 *
	 * @param n
	 * @return
	 */
	public List<A> take(int n) {
		ArrayList<A> items = new ArrayList<>();
		Stream<A> s = this;
		for (int i = 0; i < n; ++i) {
			if (i != 0) {
				s = s.tl();
			}
			items.add(s.head);
		}
		return items;
	}

	/**
	 * Get the stream remaining after <code>n</code> elements are removed.
	 *
	 * @param n
	 * @return
	 */
	public Stream<A> drop(int n) {
		Stream<A> s = this;
		for (int i = 0; i < n; ++i) {
			s = s.tl();
		}
		return s;
	}

	@Override
	public String toString() {
		String r = "";
		for (A item : take(PRINT_LIMIT)) {
			r += item + ", ";
		}
		return "[" + r + "...]";
	}

	// ==============================================================
	// Constructors
	// ==============================================================

	/**
	 * Construct a stream with a given head whose tail is computed on demand.
	 *
	 * @param head
	 * @param tail
	 * @return
	 */
	public static <A> Stream<A> cons(A head, Supplier<Stream<A>> tail) {
		return new Stream<>(head, self -> tail.get(), false);
	}

	/**
	 * Prepend a value onto an existing stream. The result is finite-state if the
	 * given tail is.
	 *
	 * @param head
	 * @param tail
	 * @return
	 */
	public static <A> Stream<A> cons(A head, Stream<A> tail) {
		return new Stream<>(head, self -> tail, tail.isFiniteState());
	}

	/**
	 * Construct a stream which repeats the same value forever. This is a single
	 * node whose tail is itself.
	 *
	 * @param value
	 * @return
	 */
	public static <A> Stream<A> constant(A value) {
		return new Stream<>(value, self -> self, true);
	}

	/**
	 * Construct a stream which repeats a given sequence of values forever. This is
	 * a cycle of exactly <code>values.length</code> nodes.
	 *
	 * @param values
	 * @return
	 */
	@SafeVarargs
	public static <A> Stream<A> cycle(A... values) {
		if (values.length == 0) {
			throw new IllegalArgumentException("cannot cycle an empty sequence");
		}
		return periodic(0, i -> new Pair<>(values[i], (i + 1) % values.length));
	}

	/**
	 * Construct a stream from a generator, which maps a state to the next head and
	 * the next state. Each tail is a fresh node, hence the result is not
	 * finite-state (even if the generator happens to revisit a state).
	 *
	 * @param state     Initial generator state
	 * @param generator
	 * @return
	 */
	public static <S, A> Stream<A> unfold(S state, Function<S, Pair<A, S>> generator) {
		Pair<A, S> p = generator.apply(state);
		return new Stream<>(p.first(), self -> unfold(p.second(), generator), false);
	}

	/**
	 * Construct a stream from a generator whose reachable states form a finite set.
	 * States are compared using <code>equals()</code> and each distinct state
	 * gives exactly one node, so revisiting a state ties the stream back into a
	 * cycle. The generator must reach only finitely many states.
	 *
	 * @param state     Initial generator state
	 * @param generator
	 * @return
	 */
	public static <S, A> Stream<A> periodic(S state, Function<S, Pair<A, S>> generator) {
		return new Periodic<S, A>(generator).node(state);
	}

	/**
	 * Construct the stream <code>seed, f(seed), f(f(seed)), ...</code>.
	 *
	 * @param seed
	 * @param f
	 * @return
	 */
	public static <A> Stream<A> iterate(A seed, UnaryOperator<A> f) {
		return unfold(seed, x -> new Pair<>(x, f.apply(x)));
	}

	/**
	 * Maintains the table of nodes generated for each state of a periodic
	 * generator.
	 *
	 * @param <S>
	 * @param <A>
	 */
	private static class Periodic<S, A> {
		private final Function<S, Pair<A, S>> generator;
		private final Map<S, Stream<A>> nodes = new HashMap<>();

		public Periodic(Function<S, Pair<A, S>> generator) {
			this.generator = generator;
		}

		public Stream<A> node(S state) {
			Stream<A> s = nodes.get(state);
			if (s == null) {
				Pair<A, S> p = generator.apply(state);
				s = new Stream<>(p.first(), self -> node(p.second()), true);
				nodes.put(state, s);
			}
			return s;
		}
	}
}
