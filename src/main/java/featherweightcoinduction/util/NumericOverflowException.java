package featherweightcoinduction.util;

/**
 * Thrown when fixed-width arithmetic configured to reject overflow produces a
 * result which does not fit.
 *
 * @author David J. Pearce
 *
 */
public class NumericOverflowException extends ArithmeticException {
	private final Number lhs;
	private final Number rhs;

	public NumericOverflowException(Number lhs, Number rhs) {
		super("integer overflow: " + lhs + " + " + rhs);
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public Number leftOperand() {
		return lhs;
	}

	public Number rightOperand() {
		return rhs;
	}

	public static final long serialVersionUID = 1l;
}
