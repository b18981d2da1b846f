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

import featherweightcoinduction.core.Relation.Obligation;
import featherweightcoinduction.core.Syntax.Node;

/**
 * Approximates a relation by applying its one-step rule a bounded number of
 * times. Recursion is on the depth, not on the nodes, hence this always
 * terminates, even for streams which never repeat.
 * <p>
 * At depth zero a greatest fixpoint holds (it has not yet been disproved),
 * whilst a least fixpoint does not (it has not yet been witnessed). It follows
 * that, at every depth, a relation and its negation give opposite answers.
 *
 * @author David J. Pearce
 *
 */
public class BoundedOracle {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;
	/**
	 * Indicates no counterexample was found.
	 */
	public static final int NO_WITNESS = -1;

	/**
	 * Determine whether a relation holds between two nodes up to a given depth.
	 *
	 * @param relation
	 * @param a
	 * @param b
	 * @param depth    Number of times to apply the one-step rule.
	 * @return
	 */
	public boolean relatesUpTo(Relation relation, Node a, Node b, int depth) {
		if (depth < 0) {
			throw new IllegalArgumentException("invalid depth: " + depth);
		} else if (depth == 0) {
			return relation.isGreatest();
		}
		boolean local = relation.local(a, b);
		boolean r;
		if (relation.isGreatest()) {
			// Conjunctive: local condition and all obligations must hold
			r = local && all(relation, a, b, depth - 1);
		} else {
			// Disjunctive: local condition or some obligation must hold
			r = local || any(relation, a, b, depth - 1);
		}
		if (DEBUG) {
			System.err.println("[" + depth + "] " + relation + "(" + a + ", " + b + ") = " + r);
		}
		return r;
	}

	/**
	 * Find the smallest depth at which the negation of a given relation holds
	 * between two nodes. This identifies the depth of a concrete counterexample.
	 *
	 * @param relation A greatest fixpoint.
	 * @param a
	 * @param b
	 * @param maxDepth The largest depth to try.
	 * @return The depth of the counterexample, or <code>NO_WITNESS</code> if none
	 *         exists up to <code>maxDepth</code>.
	 */
	public int witness(Relation relation, Node a, Node b, int maxDepth) {
		if (!relation.isGreatest()) {
			throw new IllegalArgumentException("witness requires a greatest fixpoint: " + relation);
		}
		Relation negation = relation.negate();
		for (int k = 1; k <= maxDepth; ++k) {
			if (relatesUpTo(negation, a, b, k)) {
				return k;
			}
		}
		return NO_WITNESS;
	}

	private boolean all(Relation relation, Node a, Node b, int depth) {
		for (Obligation o : relation.obligations(a, b)) {
			if (!relatesUpTo(o.relation(), o.left(), o.right(), depth)) {
				return false;
			}
		}
		return true;
	}

	private boolean any(Relation relation, Node a, Node b, int depth) {
		for (Obligation o : relation.obligations(a, b)) {
			if (relatesUpTo(o.relation(), o.left(), o.right(), depth)) {
				return true;
			}
		}
		return false;
	}
}
