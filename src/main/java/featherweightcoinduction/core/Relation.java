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

import static featherweightcoinduction.core.Syntax.TYPE_arrow;
import static featherweightcoinduction.core.Syntax.TYPE_bottom;
import static featherweightcoinduction.core.Syntax.TYPE_top;
import static featherweightcoinduction.core.Syntax.VALUE_closure;
import static featherweightcoinduction.core.Syntax.VALUE_constant;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import featherweightcoinduction.core.Syntax.Node;
import featherweightcoinduction.core.Syntax.Value;

/**
 * A binary relation over nodes, defined by a <i>one-step rule</i>. The rule
 * consists of a local (i.e. non-recursive) condition on two nodes, along with
 * a set of obligations over their children. For a greatest fixpoint, the
 * relation holds when the local condition holds and every obligation holds.
 * The negation of such a relation is a least fixpoint, which holds when the
 * local condition fails or some obligation fails.
 *
 * @author David J. Pearce
 *
 */
public abstract class Relation {
	/**
	 * Subtyping between recursive types.
	 */
	public static final Relation SUBTYPE = new Subtype();
	/**
	 * Equivalence of recursive types (i.e. equality of their infinite unfoldings).
	 */
	public static final Relation TYPE_EQUIV = new TypeEquivalence();
	/**
	 * Lexicographic ordering of streams.
	 */
	public static final Relation LEXLESS = new LexLess();
	/**
	 * Negation of the lexicographic ordering.
	 */
	public static final Relation NOT_LEXLESS = LEXLESS.negate();
	/**
	 * Stream bisimulation (i.e. elementwise equality).
	 */
	public static final Relation BISIM = new Bisimulation();
	/**
	 * Approximation ordering between values.
	 */
	public static final Relation VAL_BELOW = new ValueBelow();
	/**
	 * Approximation ordering between environments.
	 */
	public static final Relation ENV_BELOW = new EnvironmentBelow();

	private final String name;
	private Relation negation;

	public Relation(String name) {
		this.name = name;
	}

	/**
	 * Determine whether this relation is a greatest fixpoint (i.e. holds unless
	 * disproved) or a least fixpoint (i.e. does not hold unless witnessed).
	 *
	 * @return
	 */
	public boolean isGreatest() {
		return true;
	}

	/**
	 * The local condition of the one-step rule.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public abstract boolean local(Node a, Node b);

	/**
	 * The obligations generated by the one-step rule. For a greatest fixpoint this
	 * may only be called when the local condition holds; for a least fixpoint, only
	 * when it fails.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public abstract List<Obligation> obligations(Node a, Node b);

	/**
	 * Determine whether the set of node pairs reachable from two nodes is known to
	 * be finite. Only then can this relation be decided exactly.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public boolean isFiniteState(Node a, Node b) {
		return a.isFiniteState() && b.isFiniteState();
	}

	/**
	 * Get the dual of this relation, whose one-step rule holds exactly when this
	 * rule fails.
	 *
	 * @return
	 */
	public Relation negate() {
		if (negation == null) {
			negation = new Negation(this);
		}
		return negation;
	}

	@Override
	public String toString() {
		return name;
	}

	/**
	 * Represents the obligation that a given relation holds between two nodes.
	 * Obligations are equal only when they have the same relation and identical
	 * (not equivalent) nodes.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Obligation {
		private final Relation relation;
		private final Node left;
		private final Node right;

		public Obligation(Relation relation, Node left, Node right) {
			this.relation = relation;
			this.left = left;
			this.right = right;
		}

		public Relation relation() {
			return relation;
		}

		public Node left() {
			return left;
		}

		public Node right() {
			return right;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Obligation) {
				Obligation p = (Obligation) o;
				return relation == p.relation && left == p.left && right == p.right;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return (31 * System.identityHashCode(left)) ^ System.identityHashCode(right) ^ relation.hashCode();
		}

		@Override
		public String toString() {
			return relation + "(" + left + ", " + right + ")";
		}
	}

	private static List<Obligation> list(Obligation... items) {
		return Arrays.asList(items);
	}

	// ==============================================================
	// Recursive Types
	// ==============================================================

	/**
	 * S-Bottom, S-Top and S-Arrow. Arrows are contravariant in their domain and
	 * covariant in their range.
	 */
	private static class Subtype extends Relation {
		public Subtype() {
			super("Subtype");
		}

		@Override
		public boolean local(Node a, Node b) {
			return a.getOpcode() == TYPE_bottom || b.getOpcode() == TYPE_top
					|| (a.getOpcode() == TYPE_arrow && b.getOpcode() == TYPE_arrow);
		}

		@Override
		public List<Obligation> obligations(Node a, Node b) {
			if (a.getOpcode() == TYPE_arrow && b.getOpcode() == TYPE_arrow) {
				return list(new Obligation(SUBTYPE, b.dom(), a.dom()), new Obligation(SUBTYPE, a.ran(), b.ran()));
			} else {
				return Collections.emptyList();
			}
		}
	}

	/**
	 * E-Atom and E-Arrow.
	 */
	private static class TypeEquivalence extends Relation {
		public TypeEquivalence() {
			super("TypeEquiv");
		}

		@Override
		public boolean local(Node a, Node b) {
			return a.getOpcode() == b.getOpcode();
		}

		@Override
		public List<Obligation> obligations(Node a, Node b) {
			if (a.getOpcode() == TYPE_arrow) {
				return list(new Obligation(TYPE_EQUIV, a.dom(), b.dom()),
						new Obligation(TYPE_EQUIV, a.ran(), b.ran()));
			} else {
				return Collections.emptyList();
			}
		}
	}

	// ==============================================================
	// Streams
	// ==============================================================

	/**
	 * L-Less and L-Equal. The heads of both streams must be mutually comparable.
	 */
	private static class LexLess extends Relation {
		public LexLess() {
			super("LexLess");
		}

		@Override
		public boolean local(Node s, Node t) {
			return compare(s.hd(), t.hd()) <= 0;
		}

		@Override
		public List<Obligation> obligations(Node s, Node t) {
			if (compare(s.hd(), t.hd()) == 0) {
				return list(new Obligation(LEXLESS, s.tl(), t.tl()));
			} else {
				return Collections.emptyList();
			}
		}

		@SuppressWarnings("unchecked")
		private static int compare(Object lhs, Object rhs) {
			return ((Comparable<Object>) lhs).compareTo(rhs);
		}
	}

	/**
	 * B-Cons.
	 */
	private static class Bisimulation extends Relation {
		public Bisimulation() {
			super("Bisim");
		}

		@Override
		public boolean local(Node s, Node t) {
			return Objects.equals(s.hd(), t.hd());
		}

		@Override
		public List<Obligation> obligations(Node s, Node t) {
			return list(new Obligation(BISIM, s.tl(), t.tl()));
		}
	}

	// ==============================================================
	// Values & Environments
	// ==============================================================

	/**
	 * V-Const and V-Closure. Two closures are only related when they have the same
	 * code, in which case their environments must be related.
	 */
	private static class ValueBelow extends Relation {
		public ValueBelow() {
			super("ValBelow");
		}

		@Override
		public boolean local(Node u, Node v) {
			if (u.getOpcode() != v.getOpcode()) {
				return false;
			} else if (u.getOpcode() == VALUE_constant) {
				return u.constant().equals(v.constant());
			} else {
				return u.abs().equals(v.abs());
			}
		}

		@Override
		public List<Obligation> obligations(Node u, Node v) {
			if (u.getOpcode() == VALUE_closure) {
				return list(new Obligation(ENV_BELOW, u.env(), v.env()));
			} else {
				return Collections.emptyList();
			}
		}
	}

	/**
	 * V-Env. Every variable bound in the first environment must be bound in the
	 * second, and their values related.
	 */
	private static class EnvironmentBelow extends Relation {
		public EnvironmentBelow() {
			super("ClEnvBelow");
		}

		@Override
		public boolean local(Node c, Node d) {
			return d.bindings().keySet().containsAll(c.bindings().keySet());
		}

		@Override
		public List<Obligation> obligations(Node c, Node d) {
			Map<String, Value> lhs = c.bindings();
			Map<String, Value> rhs = d.bindings();
			ArrayList<Obligation> r = new ArrayList<>();
			for (Map.Entry<String, Value> e : lhs.entrySet()) {
				r.add(new Obligation(VAL_BELOW, e.getValue(), rhs.get(e.getKey())));
			}
			return r;
		}
	}

	// ==============================================================
	// Negation
	// ==============================================================

	/**
	 * The dual of a given relation. Its local condition is the negation of the
	 * original, and its obligations are the negations of the original's.
	 * Obligations are combined disjunctively rather than conjunctively.
	 */
	private static class Negation extends Relation {
		private final Relation positive;

		public Negation(Relation positive) {
			super("Not" + positive);
			this.positive = positive;
		}

		@Override
		public boolean isGreatest() {
			return !positive.isGreatest();
		}

		@Override
		public boolean local(Node a, Node b) {
			return !positive.local(a, b);
		}

		@Override
		public List<Obligation> obligations(Node a, Node b) {
			ArrayList<Obligation> r = new ArrayList<>();
			for (Obligation o : positive.obligations(a, b)) {
				r.add(new Obligation(o.relation().negate(), o.left(), o.right()));
			}
			return r;
		}

		@Override
		public boolean isFiniteState(Node a, Node b) {
			return positive.isFiniteState(a, b);
		}

		@Override
		public Relation negate() {
			return positive;
		}
	}
}
