package tberg.kopls;

/**
 * Unknown kernel family, missing kernel parameter, or prediction blocks that do
 * not match the fitted ones.
 */
public class ConfigurationException extends ConsensusOPLSException {

	private static final long serialVersionUID = 1L;

	public ConfigurationException(String message) {
		super(message);
	}

}
