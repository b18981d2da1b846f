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
package featherweightcoinduction.util;

import java.util.function.Supplier;

/**
 * A suspended computation which is evaluated at most once. The first call to
 * <code>get()</code> runs the computation and caches its result, whilst all
 * subsequent calls return the cached result. If the computation fails, then
 * nothing is cached and the failure is reported again on the next call.
 *
 * @author David J. Pearce
 *
 * @param <T>
 */
public final class Thunk<T> implements Supplier<T> {
	/**
	 * The computation to run, or <code>null</code> once forced.
	 */
	private Supplier<? extends T> computation;
	/**
	 * Set whilst the computation is running, to catch a thunk which demands its
	 * own value.
	 */
	private boolean forcing;
	private T value;

	public Thunk(Supplier<? extends T> computation) {
		if (computation == null) {
			throw new IllegalArgumentException("computation cannot be null");
		}
		this.computation = computation;
	}

	private Thunk(T value) {
		this.value = value;
	}

	/**
	 * Construct a thunk which is already forced.
	 *
	 * @param value
	 * @return
	 */
	public static <T> Thunk<T> of(T value) {
		return new Thunk<>(value);
	}

	@Override
	public T get() {
		if (computation != null) {
			if (forcing) {
				throw new IllegalStateException("thunk forced during its own evaluation");
			}
			forcing = true;
			try {
				value = computation.get();
				computation = null;
			} finally {
				forcing = false;
			}
		}
		return value;
	}

	/**
	 * Check whether this thunk has been forced yet.
	 *
	 * @return
	 */
	public boolean isForced() {
		return computation == null;
	}

	@Override
	public String toString() {
		return isForced() ? String.valueOf(value) : "<thunk>";
	}
}
