package tberg.kopls.regressor;

import org.jblas.DoubleMatrix;

public final class KernelOPLSPrediction {

	private final DoubleMatrix Yhat;
	private final DoubleMatrix predictiveScores;
	private final DoubleMatrix orthogonalScores;

	KernelOPLSPrediction(DoubleMatrix Yhat, DoubleMatrix predictiveScores, DoubleMatrix orthogonalScores) {
		this.Yhat = Yhat;
		this.predictiveScores = predictiveScores;
		this.orthogonalScores = orthogonalScores;
	}

	public DoubleMatrix getYhat() {
		return Yhat.dup();
	}

	public DoubleMatrix getPredictiveScores() {
		return predictiveScores.dup();
	}

	public DoubleMatrix getOrthogonalScores() {
		return orthogonalScores.dup();
	}

}
