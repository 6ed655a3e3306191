package tberg.kopls.selection;

import tberg.kopls.arrays.a;
import tberg.kopls.model.ModelType;

/**
 * Selection curve over orthogonal counts 0..maxOcomp and the chosen count.
 */
public final class SelectionResult {

	private final ModelType modelType;
	private final double[] curve;
	private final double[][] dq2;
	private final double[][] pressd;
	private final int nOcompOpt;
	private final int greedyNOcomp;

	SelectionResult(ModelType modelType, double[] curve, double[][] dq2, double[][] pressd, int nOcompOpt) {
		this(modelType, curve, dq2, pressd, nOcompOpt, nOcompOpt);
	}

	private SelectionResult(ModelType modelType, double[] curve, double[][] dq2, double[][] pressd, int nOcompOpt, int greedyNOcomp) {
		this.modelType = modelType;
		this.curve = curve;
		this.dq2 = dq2;
		this.pressd = pressd;
		this.nOcompOpt = nOcompOpt;
		this.greedyNOcomp = greedyNOcomp;
	}

	/** Same curve with the count that the final model was actually fitted with. */
	public SelectionResult withFittedCount(int fitted) {
		if (fitted < 0 || fitted > greedyNOcomp) throw new IllegalArgumentException("Fitted count "+fitted+" outside [0, "+greedyNOcomp+"]");
		return new SelectionResult(modelType, curve, dq2, pressd, fitted, greedyNOcomp);
	}

	public ModelType getModelType() {
		return modelType;
	}

	/** DQ2 averaged over response columns (discriminant) or Q2Yhat (regression). */
	public double[] getCurve() {
		return a.copy(curve);
	}

	/** DQ2 per orthogonal count and response column; null for regression. */
	public double[][] getDQ2() {
		return a.copy(dq2);
	}

	/** PRESSD per orthogonal count and response column; null for regression. */
	public double[][] getPRESSD() {
		return a.copy(pressd);
	}

	/** Mean DQ2 per orthogonal count; null for regression. */
	public double[] getDQ2Yhat() {
		return modelType == ModelType.DISCRIMINANT ? a.copy(curve) : null;
	}

	/** Orthogonal count of the final model. */
	public int getNOcompOpt() {
		return nOcompOpt;
	}

	/** Count chosen by the greedy rule, before any step-down. */
	public int getGreedyNOcomp() {
		return greedyNOcomp;
	}

	public boolean isSteppedDown() {
		return nOcompOpt < greedyNOcomp;
	}

}
