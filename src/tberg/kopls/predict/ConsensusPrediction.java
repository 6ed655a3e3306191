package tberg.kopls.predict;

import tberg.kopls.arrays.a;

/**
 * Predictions for new samples. Class, margin and probabilities are only set
 * for discriminant models.
 */
public final class ConsensusPrediction {

	private final double[][] yhat;
	private final double[][] predictiveScores;
	private final double[][] orthogonalScores;
	private final String[] predictedClass;
	private final double[] margin;
	private final double[][] probabilities;

	ConsensusPrediction(double[][] yhat, double[][] predictiveScores, double[][] orthogonalScores, String[] predictedClass, double[] margin, double[][] probabilities) {
		this.yhat = yhat;
		this.predictiveScores = predictiveScores;
		this.orthogonalScores = orthogonalScores;
		this.predictedClass = predictedClass;
		this.margin = margin;
		this.probabilities = probabilities;
	}

	public int numSamples() {
		return yhat.length;
	}

	public double[][] getYhat() {
		return a.copy(yhat);
	}

	public double[][] getPredictiveScores() {
		return a.copy(predictiveScores);
	}

	public double[][] getOrthogonalScores() {
		return a.copy(orthogonalScores);
	}

	public boolean isDiscriminant() {
		return predictedClass != null;
	}

	/** Arg-max class per sample; null for regression. */
	public String[] getPredictedClass() {
		return a.copy(predictedClass);
	}

	/** Top score minus runner-up score per sample; null for regression. */
	public double[] getMargin() {
		return a.copy(margin);
	}

	/** Softmax of the predicted scores per sample; null for regression. */
	public double[][] getProbabilities() {
		return a.copy(probabilities);
	}

}
