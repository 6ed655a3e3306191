package tberg.kopls;

/**
 * A deflation step could not extract another orthogonal component because the
 * kernel rank is exhausted. The caller has to ask for fewer components.
 */
public class ConvergenceException extends ConsensusOPLSException {

	private static final long serialVersionUID = 1L;

	private final int component;

	public ConvergenceException(int component, String message) {
		super(message);
		this.component = component;
	}

	/** 1-based index of the orthogonal component that could not be extracted. */
	public int getComponent() {
		return component;
	}

}
