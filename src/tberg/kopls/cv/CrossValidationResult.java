package tberg.kopls.cv;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jblas.DoubleMatrix;

import tberg.kopls.arrays.a;

/**
 * Aggregated held-out predictions of a cross-validation run.
 *
 * Row r of {@link #getAllYhat()} is the prediction for sample
 * {@code getTestIndex()[r]}; column {@code k * c + j} holds response column j
 * predicted with k orthogonal components.
 */
public final class CrossValidationResult {

	private final CrossValidationSet cvSet;
	private final int maxOcomp;
	private final int numResponseColumns;
	private final DoubleMatrix allYhat;
	private final DoubleMatrix yTest;
	private final double[] q2Yhat;
	private final double[][] q2YhatVars;
	private final List<CellFailure> failures;

	CrossValidationResult(CrossValidationSet cvSet, int maxOcomp, int numResponseColumns, DoubleMatrix allYhat, DoubleMatrix yTest, double[] q2Yhat, double[][] q2YhatVars, List<CellFailure> failures) {
		this.cvSet = cvSet;
		this.maxOcomp = maxOcomp;
		this.numResponseColumns = numResponseColumns;
		this.allYhat = allYhat;
		this.yTest = yTest;
		this.q2Yhat = q2Yhat;
		this.q2YhatVars = q2YhatVars;
		this.failures = Collections.unmodifiableList(new ArrayList<CellFailure>(failures));
	}

	public CrossValidationType getType() {
		return cvSet.getType();
	}

	public int numRounds() {
		return cvSet.numRounds();
	}

	public int getMaxOcomp() {
		return maxOcomp;
	}

	public int numResponseColumns() {
		return numResponseColumns;
	}

	public DoubleMatrix getAllYhat() {
		return allYhat.dup();
	}

	/** Held-out predictions made with {@code k} orthogonal components. */
	public DoubleMatrix getYhat(int k) {
		return allYhat.getRange(0, allYhat.rows, k * numResponseColumns, (k+1) * numResponseColumns);
	}

	/** Observed response of the aggregated test rows. */
	public DoubleMatrix getYTest() {
		return yTest.dup();
	}

	public int[] getTestIndex() {
		return cvSet.getConcatenatedTestIndex();
	}

	public int[] getTestIndex(int round) {
		return cvSet.getTestIndex(round);
	}

	public int[] getTrainingIndex(int round) {
		return cvSet.getTrainingIndex(round);
	}

	/** Q2 of the held-out predictions per orthogonal count 0..maxOcomp. */
	public double[] getQ2Yhat() {
		return a.copy(q2Yhat);
	}

	/** Q2 per orthogonal count and response column. */
	public double[][] getQ2YhatVars() {
		return a.copy(q2YhatVars);
	}

	public List<CellFailure> getFailures() {
		return failures;
	}

}
