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

/**
 * This exception is thrown when a node (or term) is used in a way which does
 * not match its syntactic form. For example, reading the domain of the
 * <code>bottom</code> type, or converting a capsule whose term is not an
 * abstraction.
 *
 * @author David J. Pearce
 */
public class MalformedNodeException extends RuntimeException {
	/**
	 * The offending element (e.g. a node or term).
	 */
	private final Object element;

	public MalformedNodeException(String msg, Object element) {
		super(msg + " (" + element + ")");
		this.element = element;
	}

	/**
	 * Get the element which was malformed.
	 *
	 * @return
	 */
	public Object element() {
		return element;
	}

	/**
	 * Check a given condition holds for an element, otherwise report it as
	 * malformed.
	 *
	 * @param condition
	 * @param msg
	 * @param element
	 */
	public static void check(boolean condition, String msg, Object element) {
		if (!condition) {
			throw new MalformedNodeException(msg, element);
		}
	}

	public static final long serialVersionUID = 1l;
}
