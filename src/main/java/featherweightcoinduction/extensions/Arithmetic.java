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

import java.math.BigInteger;

import featherweightcoinduction.util.NumericOverflowException;

/**
 * A numeric policy determining how stream elements are added. Every stream
 * computed by pointwise addition uses a single policy for all of its elements.
 *
 * @author David J. Pearce
 *
 * @param <T> The type of numbers being added
 */
public abstract class Arithmetic<T> {
	/**
	 * Fixed-width (32bit) arithmetic where overflow is an error.
	 */
	public static final Arithmetic<Integer> CHECKED = new Arithmetic<Integer>("checked") {
		@Override
		public Integer add(Integer lhs, Integer rhs) {
			try {
				return Math.addExact(lhs, rhs);
			} catch (ArithmeticException e) {
				NumericOverflowException ex = new NumericOverflowException(lhs, rhs);
				ex.initCause(e);
				throw ex;
			}
		}
	};

	/**
	 * Fixed-width (32bit) arithmetic which wraps around on overflow.
	 */
	public static final Arithmetic<Integer> WRAPPING = new Arithmetic<Integer>("wrapping") {
		@Override
		public Integer add(Integer lhs, Integer rhs) {
			return lhs + rhs;
		}
	};

	/**
	 * Arbitrary precision arithmetic, which cannot overflow.
	 */
	public static final Arithmetic<BigInteger> UNBOUNDED = new Arithmetic<BigInteger>("unbounded") {
		@Override
		public BigInteger add(BigInteger lhs, BigInteger rhs) {
			return lhs.add(rhs);
		}
	};

	private final String name;

	public Arithmetic(String name) {
		this.name = name;
	}

	public abstract T add(T lhs, T rhs);

	@Override
	public String toString() {
		return name;
	}
}
