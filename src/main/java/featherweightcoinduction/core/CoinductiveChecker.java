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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import featherweightcoinduction.core.Relation.Obligation;
import featherweightcoinduction.core.Syntax.Node;

/**
 * Decides a relation exactly using the <i>assume/check</i> algorithm. When
 * checking whether two nodes are related, the pair is first assumed to be
 * related. Then, the local condition is checked and all obligations are
 * checked in turn under this assumption. Encountering an assumed pair again
 * (i.e. because of a cycle) immediately succeeds.
 * <p>
 * This terminates provided the set of pairs reachable from the initial pair is
 * finite, as for recursive types and closure graphs. For streams which are not
 * finite-state, this is not guaranteed. Such queries are either rejected, or
 * answered by a <code>BoundedOracle</code> when a depth budget is given.
 *
 * @author David J. Pearce
 *
 */
public class CoinductiveChecker {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;
	/**
	 * Indicates that queries which cannot be decided exactly are rejected.
	 */
	public static final int NO_BUDGET = -1;

	/**
	 * Depth at which queries over nodes that are not finite-state are answered,
	 * or <code>NO_BUDGET</code>.
	 */
	private final int budget;
	private final BoundedOracle oracle = new BoundedOracle();

	public CoinductiveChecker() {
		this(NO_BUDGET);
	}

	public CoinductiveChecker(int budget) {
		if (budget < 0 && budget != NO_BUDGET) {
			throw new IllegalArgumentException("invalid budget: " + budget);
		}
		this.budget = budget;
	}

	/**
	 * Determine whether a given relation holds between two nodes. A least
	 * fixpoint (i.e. the negation of some relation) is decided as the complement
	 * of its greatest fixpoint.
	 *
	 * @param relation
	 * @param a
	 * @param b
	 * @return
	 */
	public boolean relates(Relation relation, Node a, Node b) {
		if (!relation.isGreatest()) {
			return !relates(relation.negate(), a, b);
		} else if (!relation.isFiniteState(a, b)) {
			if (budget == NO_BUDGET) {
				throw new NonTerminationException(relation, a, b);
			}
			return oracle.relatesUpTo(relation, a, b, budget);
		}
		return relates(new Obligation(relation, a, b));
	}

	/**
	 * Determine the depth of the shortest counterexample to a relation holding
	 * between two nodes. That is, the smallest depth at which the negated rule
	 * holds when unrolled by a <code>BoundedOracle</code>.
	 *
	 * @param relation A greatest fixpoint.
	 * @param a
	 * @param b
	 * @return The depth of the counterexample, or
	 *         <code>BoundedOracle.NO_WITNESS</code> if the relation holds.
	 */
	public int counterexample(Relation relation, Node a, Node b) {
		if (!relation.isGreatest()) {
			throw new IllegalArgumentException("counterexample requires a greatest fixpoint: " + relation);
		} else if (!relation.isFiniteState(a, b)) {
			if (budget == NO_BUDGET) {
				throw new NonTerminationException(relation, a, b);
			}
			return oracle.witness(relation, a, b, budget);
		}
		// Breadth-first search for the nearest pair whose local condition fails
		Set<Obligation> visited = new HashSet<>();
		List<Obligation> frontier = new ArrayList<>();
		Obligation root = new Obligation(relation, a, b);
		visited.add(root);
		frontier.add(root);
		for (int depth = 1; !frontier.isEmpty(); ++depth) {
			List<Obligation> next = new ArrayList<>();
			for (Obligation o : frontier) {
				Relation r = o.relation();
				if (!r.local(o.left(), o.right())) {
					return depth;
				}
				for (Obligation sub : r.obligations(o.left(), o.right())) {
					if (visited.add(sub)) {
						next.add(sub);
					}
				}
			}
			frontier = next;
		}
		return BoundedOracle.NO_WITNESS;
	}

	/**
	 * Check every pair reachable from a given obligation. Since all pairs reached
	 * are assumed to hold, the relation holds exactly when no reachable pair fails
	 * its local condition. Pairs are explored using an explicit stack, so long
	 * chains of pairs do not exhaust the call stack.
	 *
	 * @param root
	 * @return
	 */
	private boolean relates(Obligation root) {
		Set<Obligation> assumed = new HashSet<>();
		ArrayDeque<Obligation> worklist = new ArrayDeque<>();
		worklist.push(root);
		while (!worklist.isEmpty()) {
			Obligation o = worklist.pop();
			if (!assumed.add(o)) {
				// Already assumed to hold
				continue;
			}
			Relation r = o.relation();
			boolean local = r.local(o.left(), o.right());
			if (DEBUG) {
				System.err.println("[" + assumed.size() + "] " + o + " = " + local);
			}
			if (!local) {
				return false;
			}
			for (Obligation sub : r.obligations(o.left(), o.right())) {
				worklist.push(sub);
			}
		}
		return true;
	}
}
