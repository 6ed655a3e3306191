package tberg.kopls;

/**
 * Bad caller input: block shapes, response shape, option values. Always raised
 * before any kernel is built.
 */
public class InputValidationException extends ConsensusOPLSException {

	private static final long serialVersionUID = 1L;

	public InputValidationException(String message) {
		super(message);
	}

}
