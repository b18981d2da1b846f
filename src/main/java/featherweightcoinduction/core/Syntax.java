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

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiFunction;
import java.util.function.Function;

import featherweightcoinduction.util.MalformedNodeException;
import featherweightcoinduction.util.Pair;
import featherweightcoinduction.util.Thunk;

public class Syntax {
	// Node opcodes
	public final static int NODE_stream = 0;
	public final static int TYPE_bottom = 1;
	public final static int TYPE_top = 2;
	public final static int TYPE_arrow = 3;
	public final static int VALUE_constant = 4;
	public final static int VALUE_closure = 5;
	public final static int NODE_environment = 6;
	// Term opcodes
	public final static int TERM_const = 10;
	public final static int TERM_var = 11;
	public final static int TERM_abs = 12;

	// Error messages
	public final static String EXPECTED_STREAM = "expected stream";
	public final static String EXPECTED_ARROW = "expected arrow type";
	public final static String EXPECTED_CLOSURE = "expected closure";
	public final static String EXPECTED_CONSTANT = "expected constant";
	public final static String EXPECTED_ENVIRONMENT = "expected environment";
	public final static String UNTIED_ARROW = "arrow type has not been tied";

	/**
	 * A node in a (possibly cyclic) graph. Every node has an opcode identifying
	 * its syntactic form, and a set of accessors for its children. An accessor may
	 * only be used on a node of the matching form and fails with
	 * {@link MalformedNodeException} otherwise.
	 * <p>
	 * Nodes do not override <code>equals()</code> or <code>hashCode()</code>. Their
	 * identity is used only to detect cycles, never to compare two nodes
	 * semantically.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Node {
		/**
		 * Get the opcode associated with the syntactic form of this node.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * Determine whether the set of nodes reachable from this node is known to be
		 * finite. All nodes built from explicit identity cycles are finite-state.
		 * Streams generated on demand, where each tail is a fresh node, are not.
		 *
		 * @return
		 */
		public boolean isFiniteState();

		/**
		 * Get the head of a stream.
		 *
		 * @return
		 */
		public Object hd();

		/**
		 * Get the tail of a stream.
		 *
		 * @return
		 */
		public Node tl();

		/**
		 * Get the domain of an arrow type.
		 *
		 * @return
		 */
		public RecType dom();

		/**
		 * Get the range of an arrow type.
		 *
		 * @return
		 */
		public RecType ran();

		/**
		 * Get the code of a closure.
		 *
		 * @return
		 */
		public Term.Abs abs();

		/**
		 * Get the environment of a closure.
		 *
		 * @return
		 */
		public Environment env();

		/**
		 * Get the variable bindings of an environment.
		 *
		 * @return
		 */
		public Map<String, Value> bindings();

		/**
		 * Get the constant of a constant value.
		 *
		 * @return
		 */
		public Term.Const constant();
	}

	/**
	 * An abstract node to be implemented by all other nodes. Every accessor fails
	 * by default, and each node overrides only those matching its form.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class AbstractNode implements Node {
		private final int opcode;

		public AbstractNode(int opcode) {
			this.opcode = opcode;
		}

		@Override
		public int getOpcode() {
			return opcode;
		}

		@Override
		public boolean isFiniteState() {
			return true;
		}

		@Override
		public Object hd() {
			throw new MalformedNodeException(EXPECTED_STREAM, this);
		}

		@Override
		public Node tl() {
			throw new MalformedNodeException(EXPECTED_STREAM, this);
		}

		@Override
		public RecType dom() {
			throw new MalformedNodeException(EXPECTED_ARROW, this);
		}

		@Override
		public RecType ran() {
			throw new MalformedNodeException(EXPECTED_ARROW, this);
		}

		@Override
		public Term.Abs abs() {
			throw new MalformedNodeException(EXPECTED_CLOSURE, this);
		}

		@Override
		public Environment env() {
			throw new MalformedNodeException(EXPECTED_CLOSURE, this);
		}

		@Override
		public Map<String, Value> bindings() {
			throw new MalformedNodeException(EXPECTED_ENVIRONMENT, this);
		}

		@Override
		public Term.Const constant() {
			throw new MalformedNodeException(EXPECTED_CONSTANT, this);
		}
	}

	// ==============================================================
	// Recursive Types
	// ==============================================================

	/**
	 * Represents an equi-recursive type. That is, a possibly cyclic graph of arrow
	 * types over <code>bottom</code> and <code>top</code>, which is equivalent to
	 * its own (possibly infinite) unfolding.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface RecType extends Node {
		/**
		 * Constant representing the empty type
		 */
		public static RecType Bottom = new Bottom();
		/**
		 * Constant representing the type of everything
		 */
		public static RecType Top = new Top();

		public static class Bottom extends AbstractNode implements RecType {
			private Bottom() {
				super(TYPE_bottom);
			}

			@Override
			public String toString() {
				return "bottom";
			}
		}

		public static class Top extends AbstractNode implements RecType {
			private Top() {
				super(TYPE_top);
			}

			@Override
			public String toString() {
				return "top";
			}
		}

		/**
		 * Represents a function type <code>T1 -> T2</code>. An arrow can be created
		 * <i>open</i> and then tied exactly once, which allows its children to refer
		 * back to the arrow itself. For example, the following constructs the type
		 * <code>µX.(X -> top)</code>:
		 *
		 * <pre>
		 * Arrow x = new Arrow();
		 * x.tie(x, RecType.Top);
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Arrow extends AbstractNode implements RecType {
			private RecType dom;
			private RecType ran;

			public Arrow() {
				super(TYPE_arrow);
			}

			public Arrow(RecType dom, RecType ran) {
				this();
				tie(dom, ran);
			}

			/**
			 * Fix the children of this arrow. This can be called at most once, and only
			 * on an arrow created open.
			 *
			 * @param dom
			 * @param ran
			 * @return
			 */
			public Arrow tie(RecType dom, RecType ran) {
				if (dom == null || ran == null) {
					throw new IllegalArgumentException("arrow requires a domain and range");
				} else if (isTied()) {
					throw new IllegalStateException("arrow already tied");
				}
				this.dom = dom;
				this.ran = ran;
				return this;
			}

			/**
			 * Check whether the children of this arrow have been fixed.
			 *
			 * @return
			 */
			public boolean isTied() {
				return dom != null;
			}

			@Override
			public RecType dom() {
				MalformedNodeException.check(isTied(), UNTIED_ARROW, this);
				return dom;
			}

			@Override
			public RecType ran() {
				MalformedNodeException.check(isTied(), UNTIED_ARROW, this);
				return ran;
			}

			@Override
			public String toString() {
				return TypePrinter.print(this);
			}

			/**
			 * Construct a recursive arrow whose children are given in terms of the arrow
			 * itself.
			 *
			 * @param body Given the (open) arrow, returns its domain and range.
			 * @return
			 */
			public static Arrow fix(Function<Arrow, Pair<RecType, RecType>> body) {
				Arrow self = new Arrow();
				Pair<RecType, RecType> children = body.apply(self);
				return self.tie(children.first(), children.second());
			}
		}
	}

	/**
	 * Prints a recursive type, introducing a binder <code>µX.</code> for every
	 * arrow which is the target of a back edge.
	 *
	 * @author David J. Pearce
	 *
	 */
	private static class TypePrinter {

		public static String print(RecType type) {
			Set<RecType> recursive = identitySet();
			findBackEdges(type, identitySet(), identitySet(), recursive);
			return print(type, recursive, new IdentityHashMap<>());
		}

		private static void findBackEdges(RecType type, Set<RecType> path, Set<RecType> done,
				Set<RecType> recursive) {
			if (path.contains(type)) {
				recursive.add(type);
			} else if (type instanceof RecType.Arrow && ((RecType.Arrow) type).isTied() && done.add(type)) {
				path.add(type);
				findBackEdges(type.dom(), path, done, recursive);
				findBackEdges(type.ran(), path, done, recursive);
				path.remove(type);
			}
		}

		private static String print(RecType type, Set<RecType> recursive, Map<RecType, String> bound) {
			if (!(type instanceof RecType.Arrow)) {
				return type.toString();
			} else if (!((RecType.Arrow) type).isTied()) {
				return "?";
			} else if (bound.containsKey(type)) {
				return bound.get(type);
			} else if (recursive.contains(type)) {
				String name = "X" + bound.size();
				bound.put(type, name);
				String body = print(type.dom(), recursive, bound) + " -> " + print(type.ran(), recursive, bound);
				bound.remove(type);
				return "µ" + name + ".(" + body + ")";
			} else {
				return "(" + print(type.dom(), recursive, bound) + " -> " + print(type.ran(), recursive, bound) + ")";
			}
		}

		private static Set<RecType> identitySet() {
			return Collections.newSetFromMap(new IdentityHashMap<>());
		}
	}

	// ==============================================================
	// Terms
	// ==============================================================

	/**
	 * Represents the (finite) syntax of the lambda calculus, as produced by some
	 * external front end. Unlike nodes, terms are compared structurally.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Term {

		/**
		 * Get the opcode associated with the syntactic form of this term.
		 *
		 * @return
		 */
		public int getOpcode();

		public static abstract class AbstractTerm implements Term {
			private final int opcode;

			public AbstractTerm(int opcode) {
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}
		}

		/**
		 * A reference to a named constant, such as <code>zero</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Const extends AbstractTerm {
			private final String name;

			public Const(String name) {
				super(TERM_const);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Const && ((Const) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		public static class Var extends AbstractTerm {
			private final String name;

			public Var(String name) {
				super(TERM_var);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Var && ((Var) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode() + 1;
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * Represents an abstraction binding one variable over a body, such as the
		 * following:
		 *
		 * <pre>
		 * \x.f
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Abs extends AbstractTerm {
			private final String variable;
			private final Term body;

			public Abs(String variable, Term body) {
				super(TERM_abs);
				this.variable = variable;
				this.body = body;
			}

			public String variable() {
				return variable;
			}

			public Term body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Abs) {
					Abs a = (Abs) o;
					return variable.equals(a.variable) && body.equals(a.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return variable.hashCode() ^ body.hashCode();
			}

			@Override
			public String toString() {
				return "\\" + variable + "." + body;
			}
		}
	}

	// ==============================================================
	// Values & Environments
	// ==============================================================

	public interface Value extends Node {

		public static class Constant extends AbstractNode implements Value {
			private final Term.Const constant;

			public Constant(Term.Const constant) {
				super(VALUE_constant);
				this.constant = constant;
			}

			@Override
			public Term.Const constant() {
				return constant;
			}

			@Override
			public String toString() {
				return constant.toString();
			}
		}

		/**
		 * Represents a closure, which pairs the code of an abstraction with the
		 * environment in which it is evaluated. Since an environment can bind a
		 * variable to a closure over that same environment, closures and environments
		 * may form cycles.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Closure extends AbstractNode implements Value {
			private final Term.Abs abs;
			private final Environment env;

			public Closure(Term.Abs abs, Environment env) {
				super(VALUE_closure);
				if (abs == null || env == null) {
					throw new IllegalArgumentException("closure requires code and environment");
				}
				this.abs = abs;
				this.env = env;
			}

			@Override
			public Term.Abs abs() {
				return abs;
			}

			@Override
			public Environment env() {
				return env;
			}

			@Override
			public String toString() {
				// NOTE: the environment may contain this closure
				return "<" + abs + ", " + env + ">";
			}
		}
	}

	/**
	 * A finite mapping from variables to values. Bindings are either given up
	 * front, or computed on demand by a <i>binder</i> which is given the
	 * environment itself. In the latter case, each binding is computed at most
	 * once and then cached, which allows a binding to refer back to its own
	 * environment.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Environment extends AbstractNode {
		private final TreeMap<String, Thunk<Value>> entries = new TreeMap<>();

		public Environment(Map<String, ? extends Value> bindings) {
			super(NODE_environment);
			for (Map.Entry<String, ? extends Value> e : bindings.entrySet()) {
				entries.put(e.getKey(), Thunk.of(e.getValue()));
			}
		}

		/**
		 * Construct an environment whose bindings are computed on demand. The binder
		 * must be identity-closed: any closure it returns should refer to the given
		 * environment (or to some other environment built ahead of time), rather
		 * than to a fresh environment allocated on each call. Otherwise, the graph
		 * reachable from this environment is not finite even though
		 * <code>isFiniteState()</code> reports it is, and deciding a relation over it
		 * will not terminate.
		 *
		 * @param variables Variables bound by this environment
		 * @param binder    Given this environment and a variable, returns its value.
		 */
		public Environment(Collection<String> variables, BiFunction<Environment, String, Value> binder) {
			super(NODE_environment);
			for (String variable : variables) {
				entries.put(variable, new Thunk<>(() -> binder.apply(this, variable)));
			}
		}

		/**
		 * Get the set of variables bound in this environment.
		 *
		 * @return
		 */
		public Set<String> domain() {
			return Collections.unmodifiableSet(entries.keySet());
		}

		/**
		 * Get the value bound to a given variable, or <code>null</code> if the
		 * variable is not bound.
		 *
		 * @param variable
		 * @return
		 */
		public Value get(String variable) {
			Thunk<Value> entry = entries.get(variable);
			return entry == null ? null : entry.get();
		}

		@Override
		public Map<String, Value> bindings() {
			TreeMap<String, Value> r = new TreeMap<>();
			for (String variable : entries.keySet()) {
				r.put(variable, get(variable));
			}
			return Collections.unmodifiableMap(r);
		}

		@Override
		public String toString() {
			// NOTE: bound values are not printed, since they may contain this environment
			return "env" + entries.keySet();
		}
	}

	/**
	 * A term paired with a substitution for its free variables. Each variable is
	 * mapped to a constant or an abstraction.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Capsule {
		private final Term term;
		private final Map<String, Term> substitution;

		public Capsule(Term term, Map<String, ? extends Term> substitution) {
			this.term = term;
			this.substitution = Collections.unmodifiableMap(new TreeMap<>(substitution));
		}

		public Term term() {
			return term;
		}

		public Map<String, Term> substitution() {
			return substitution;
		}

		@Override
		public String toString() {
			return "(" + term + ", " + substitution + ")";
		}
	}
}
