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
package featherweightcoinduction.extensions;

import java.util.function.Function;

import featherweightcoinduction.core.Stream;

/**
 * Productive operations over streams. Each operation produces the head of its
 * result straight away, and suspends the computation of its tail until it is
 * demanded. This matters for <code>splitRight()</code>, which produces no head
 * of its own before calling <code>splitLeft()</code>: computing tails eagerly
 * would never terminate.
 *
 * @author David J. Pearce
 *
 */
public class StreamAlgebra {

	/**
	 * Add two streams elementwise under a given numeric policy.
	 *
	 * @param arithmetic
	 * @param s
	 * @param t
	 * @return
	 */
	public static <T> Stream<T> pointwiseAdd(Arithmetic<T> arithmetic, Stream<T> s, Stream<T> t) {
		T head = arithmetic.add(s.hd(), t.hd());
		return Stream.cons(head, () -> pointwiseAdd(arithmetic, s.tl(), t.tl()));
	}

	/**
	 * Interleave two streams, starting with the first. For example, merging
	 * <code>0,2,4,...</code> with <code>1,3,5,...</code> gives
	 * <code>0,1,2,3,...</code>.
	 *
	 * @param s
	 * @param t
	 * @return
	 */
	public static <A> Stream<A> merge(Stream<A> s, Stream<A> t) {
		return Stream.cons(s.hd(), () -> merge(t, s.tl()));
	}

	/**
	 * Extract the elements at even positions of a stream.
	 *
	 * @param s
	 * @return
	 */
	public static <A> Stream<A> splitLeft(Stream<A> s) {
		return Stream.cons(s.hd(), () -> splitRight(s.tl()));
	}

	/**
	 * Extract the elements at odd positions of a stream.
	 *
	 * @param s
	 * @return
	 */
	public static <A> Stream<A> splitRight(Stream<A> s) {
		return splitLeft(s.tl());
	}

	/**
	 * Apply a function to every element of a stream.
	 *
	 * @param f
	 * @param s
	 * @return
	 */
	public static <A, B> Stream<B> map(Function<? super A, ? extends B> f, Stream<A> s) {
		return Stream.cons(f.apply(s.hd()), () -> map(f, s.tl()));
	}
}
