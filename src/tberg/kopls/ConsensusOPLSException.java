package tberg.kopls;

/**
 * Root of the errors raised while fitting or applying a consensus kernel-OPLS
 * model.
 */
public class ConsensusOPLSException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ConsensusOPLSException(String message) {
		super(message);
	}

	public ConsensusOPLSException(String message, Throwable cause) {
		super(message, cause);
	}

}
