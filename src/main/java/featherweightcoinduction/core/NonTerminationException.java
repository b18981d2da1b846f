package featherweightcoinduction.core;

import featherweightcoinduction.core.Syntax.Node;

/**
 * Thrown when a relation is to be decided exactly over nodes whose reachable
 * pairs are not known to be finite (e.g. streams generated on demand), and no
 * depth budget was given to fall back on. The nodes are not printed in the
 * message, since printing a stream would force its tails.
 *
 * @author David J. Pearce
 *
 */
public class NonTerminationException extends RuntimeException {
	private final Relation relation;
	private final Node left;
	private final Node right;

	public NonTerminationException(Relation relation, Node left, Node right) {
		super(relation + " cannot be decided exactly (not finite-state, and no depth budget given)");
		this.relation = relation;
		this.left = left;
		this.right = right;
	}

	/**
	 * Get the relation which could not be decided.
	 *
	 * @return
	 */
	public Relation relation() {
		return relation;
	}

	public Node left() {
		return left;
	}

	public Node right() {
		return right;
	}

	public static final long serialVersionUID = 1l;
}
