package tberg.kopls.permutation;

import tberg.kopls.arrays.a;

/**
 * Quality metrics of the unpermuted model (index 0) followed by one entry per
 * response permutation. A failed permutation round is all NaN.
 */
public final class PermutationStats {

	private final double[] r2Y;
	private final double[] q2Y;
	private final double[] dq2Y;
	private final double[] responseCorrelation;
	private final int numFailed;

	PermutationStats(double[] r2Y, double[] q2Y, double[] dq2Y, double[] responseCorrelation, int numFailed) {
		this.r2Y = r2Y;
		this.q2Y = q2Y;
		this.dq2Y = dq2Y;
		this.responseCorrelation = responseCorrelation;
		this.numFailed = numFailed;
	}

	public int numPermutations() {
		return r2Y.length - 1;
	}

	public int numFailed() {
		return numFailed;
	}

	public double[] getR2Y() {
		return a.copy(r2Y);
	}

	public double[] getQ2Y() {
		return a.copy(q2Y);
	}

	/** NaN everywhere for regression models. */
	public double[] getDQ2Y() {
		return a.copy(dq2Y);
	}

	/** Correlation between each permuted response and the original one. */
	public double[] getResponseCorrelation() {
		return a.copy(responseCorrelation);
	}

	public double r2YPValue() {
		return pValue(r2Y);
	}

	public double q2YPValue() {
		return pValue(q2Y);
	}

	public double dq2YPValue() {
		return pValue(dq2Y);
	}

	/**
	 * (1 + #{permuted >= observed}) / (1 + #completed permutations). NaN when
	 * the observed value is NaN.
	 */
	static double pValue(double[] stats) {
		double observed = stats[0];
		if (Double.isNaN(observed)) return Double.NaN;
		int atLeast = 0;
		int completed = 0;
		for (int i=1; i<stats.length; ++i) {
			if (Double.isNaN(stats[i])) continue;
			completed++;
			if (stats[i] >= observed) atLeast++;
		}
		return (1.0 + atLeast) / (1.0 + completed);
	}

}
