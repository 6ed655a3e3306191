package tberg.kopls;

/**
 * Zero-norm kernel or a singular matrix where an inverse is needed.
 */
public class NumericalDegeneracyException extends ConsensusOPLSException {

	private static final long serialVersionUID = 1L;

	public NumericalDegeneracyException(String message) {
		super(message);
	}

	public NumericalDegeneracyException(String message, Throwable cause) {
		super(message, cause);
	}

}
