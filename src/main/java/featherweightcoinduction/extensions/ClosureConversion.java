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

import java.util.Map;
import java.util.TreeMap;

import featherweightcoinduction.core.Syntax;
import featherweightcoinduction.core.Syntax.Capsule;
import featherweightcoinduction.core.Syntax.Environment;
import featherweightcoinduction.core.Syntax.Term;
import featherweightcoinduction.core.Syntax.Value;
import featherweightcoinduction.util.MalformedNodeException;

/**
 * Converts a capsule into a closure. Every variable of the capsule's
 * substitution which maps to an abstraction becomes a closure over the
 * <i>same</i> environment being constructed, so that all closures from one
 * capsule share one environment, and that environment refers back to them.
 * <p>
 * Capsules are assumed to be well-scoped. That is, no check is made that the
 * free variables of each abstraction are bound by the substitution.
 *
 * @author David J. Pearce
 *
 */
public class ClosureConversion {
	public final static String EXPECTED_ABSTRACTION = "expected abstraction";
	public final static String INVALID_SUBSTITUTION = "expected constant or abstraction";

	/**
	 * Convert a given capsule into a closure.
	 *
	 * @param capsule
	 * @return
	 */
	public static Value.Closure convert(Capsule capsule) {
		Term term = capsule.term();
		MalformedNodeException.check(term.getOpcode() == Syntax.TERM_abs, EXPECTED_ABSTRACTION, term);
		return new Value.Closure((Term.Abs) term, environment(capsule.substitution()));
	}

	/**
	 * Construct the (self-referential) environment for a given substitution.
	 *
	 * @param substitution
	 * @return
	 */
	public static Environment environment(Map<String, ? extends Term> substitution) {
		final TreeMap<String, Term> bindings = new TreeMap<>(substitution);
		for (Term t : bindings.values()) {
			MalformedNodeException.check(t.getOpcode() == Syntax.TERM_const || t.getOpcode() == Syntax.TERM_abs,
					INVALID_SUBSTITUTION, t);
		}
		return new Environment(bindings.keySet(), (self, variable) -> bind(bindings.get(variable), self));
	}

	private static Value bind(Term term, Environment env) {
		if (term.getOpcode() == Syntax.TERM_const) {
			return new Value.Constant((Term.Const) term);
		} else {
			return new Value.Closure((Term.Abs) term, env);
		}
	}
}
