package tberg.kopls.cv;

/**
 * A (round, orthogonal count) cell whose fit failed; its predictions are NaN.
 */
public final class CellFailure {

	private final int round;
	private final int numOrthogonal;
	private final String message;

	public CellFailure(int round, int numOrthogonal, String message) {
		this.round = round;
		this.numOrthogonal = numOrthogonal;
		this.message = message;
	}

	public int getRound() {
		return round;
	}

	public int getNumOrthogonal() {
		return numOrthogonal;
	}

	public String getMessage() {
		return message;
	}

	public String toString() {
		return "CellFailure(round="+round+", nox="+numOrthogonal+": "+message+")";
	}

}
