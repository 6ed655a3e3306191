package tberg.kopls.regressor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jblas.DoubleMatrix;

import tberg.kopls.arrays.a;
import tberg.kopls.kernel.KernelCentering;

/**
 * A trained kernel OPLS model: latent components plus the deflation history
 * needed to project a test-by-training kernel. Accessors return copies.
 */
public final class KernelOPLSModel {

	final int A;
	final int nox;
	final KernelCentering centering;
	final DoubleMatrix yMean;
	final DoubleMatrix Cp;
	final DoubleMatrix Sp;
	final DoubleMatrix Up;
	// Up Sp^-1/2
	final DoubleMatrix W;
	final List<DoubleMatrix> Tp;
	final List<DoubleMatrix> Bt;
	final List<DoubleMatrix> K1;
	final List<DoubleMatrix> KK;
	final List<DoubleMatrix> co;
	final double[] so;
	final double[] toNorm;
	final DoubleMatrix To;
	final double ssTotK;
	final double ssTotY;
	final double[] R2X;
	final double[] R2XO;
	final double[] R2XC;
	final double R2Y;
	final double[] R2Yhat;

	KernelOPLSModel(int A, int nox, KernelCentering centering, DoubleMatrix yMean, DoubleMatrix Cp, DoubleMatrix Sp, DoubleMatrix Up, DoubleMatrix W,
			List<DoubleMatrix> Tp, List<DoubleMatrix> Bt, List<DoubleMatrix> K1, List<DoubleMatrix> KK, List<DoubleMatrix> co, double[] so, double[] toNorm,
			DoubleMatrix To, double ssTotK, double ssTotY, double[] R2X, double[] R2XO, double[] R2XC, double R2Y, double[] R2Yhat) {
		this.A = A;
		this.nox = nox;
		this.centering = centering;
		this.yMean = yMean;
		this.Cp = Cp;
		this.Sp = Sp;
		this.Up = Up;
		this.W = W;
		this.Tp = Collections.unmodifiableList(new ArrayList<DoubleMatrix>(Tp));
		this.Bt = Collections.unmodifiableList(new ArrayList<DoubleMatrix>(Bt));
		this.K1 = Collections.unmodifiableList(new ArrayList<DoubleMatrix>(K1));
		this.KK = Collections.unmodifiableList(new ArrayList<DoubleMatrix>(KK));
		this.co = Collections.unmodifiableList(new ArrayList<DoubleMatrix>(co));
		this.so = so;
		this.toNorm = toNorm;
		this.To = To;
		this.ssTotK = ssTotK;
		this.ssTotY = ssTotY;
		this.R2X = R2X;
		this.R2XO = R2XO;
		this.R2XC = R2XC;
		this.R2Y = R2Y;
		this.R2Yhat = R2Yhat;
	}

	/**
	 * Projects a test-by-training kernel through the first {@code numOrthogonal}
	 * orthogonal deflations.
	 *
	 * @param KteTrRaw m x n kernel between test and training samples, uncentred
	 */
	public KernelOPLSPrediction predict(DoubleMatrix KteTrRaw, int numOrthogonal) {
		if (numOrthogonal < 0 || numOrthogonal > nox) {
			throw new IllegalArgumentException("Model has "+nox+" orthogonal components, asked for "+numOrthogonal);
		}
		int n = Up.rows;
		if (KteTrRaw.columns != n) throw new IllegalArgumentException("Test kernel has "+KteTrRaw.columns+" columns, model was trained on "+n+" samples");
		DoubleMatrix KteTr1 = centering != null ? centering.centerTest(KteTrRaw) : KteTrRaw.dup();
		DoubleMatrix KteTrii = KteTr1;
		DoubleMatrix ToTe = DoubleMatrix.zeros(KteTrRaw.rows, numOrthogonal);
		for (int i=0; i<numOrthogonal; ++i) {
			DoubleMatrix Tpi = Tp.get(i);
			DoubleMatrix toi = To.getColumn(i);
			DoubleMatrix TpTe = KteTr1.mmul(W);
			DoubleMatrix toTe = KteTrii.sub(TpTe.mmul(Tpi.transpose())).mmul(Tpi).mmul(co.get(i));
			toTe.muli(1.0 / (Math.sqrt(so[i]) * toNorm[i]));
			ToTe.putColumn(i, toTe);

			DoubleMatrix toTeto = toTe.mmul(toi.transpose());
			DoubleMatrix Kii = KK.get(i);
			DoubleMatrix nextKteTr1 = KteTr1.sub(toTeto.mmul(K1.get(i).transpose()));
			DoubleMatrix nextKteTrii = KteTrii.sub(KteTrii.mmul(toi).mmul(toi.transpose()))
				.subi(toTeto.mmul(Kii))
				.addi(toTeto.mmul(Kii).mmul(toi).mmul(toi.transpose()));
			KteTr1 = nextKteTr1;
			KteTrii = nextKteTrii;
		}
		DoubleMatrix TpTe = KteTr1.mmul(W);
		DoubleMatrix Yhat = TpTe.mmul(Bt.get(numOrthogonal)).addiRowVector(yMean);
		return new KernelOPLSPrediction(Yhat, TpTe, ToTe);
	}

	public int numPredictive() {
		return A;
	}

	public int numOrthogonal() {
		return nox;
	}

	public int numTrain() {
		return Up.rows;
	}

	/** Predictive scores after all orthogonal deflations, n x A. */
	public DoubleMatrix getPredictiveScores() {
		return Tp.get(nox).dup();
	}

	/** Predictive scores after the first {@code i} orthogonal deflations. */
	public DoubleMatrix getPredictiveScores(int i) {
		return Tp.get(i).dup();
	}

	/** Unit-norm orthogonal scores, n x nox. */
	public DoubleMatrix getOrthogonalScores() {
		return To.dup();
	}

	public double[] getOrthogonalScoreNorms() {
		return a.copy(toNorm);
	}

	/** Fitted response with all orthogonal components, in the original response units. */
	public DoubleMatrix getFittedResponse() {
		return Tp.get(nox).mmul(Bt.get(nox)).addiRowVector(yMean);
	}

	public DoubleMatrix getResponseMean() {
		return yMean.dup();
	}

	/** Y-weights of the predictive components, c x A. */
	public DoubleMatrix getResponseWeights() {
		return Cp.dup();
	}

	public DoubleMatrix getResponseScores() {
		return Up.dup();
	}

	public DoubleMatrix getPredictiveSingularValues() {
		return Sp.dup();
	}

	public DoubleMatrix getScoreCoefficients(int i) {
		return Bt.get(i).dup();
	}

	/** Centred training kernel after {@code i} orthogonal deflations on both sides. */
	public DoubleMatrix getDeflatedKernel(int i) {
		return KK.get(i).dup();
	}

	public double getKernelSumOfSquares() {
		return ssTotK;
	}

	public double getResponseSumOfSquares() {
		return ssTotY;
	}

	/** R2X per model size 0..nox. */
	public double[] getR2X() {
		return a.copy(R2X);
	}

	public double[] getR2XO() {
		return a.copy(R2XO);
	}

	public double[] getR2XC() {
		return a.copy(R2XC);
	}

	public double getR2Y() {
		return R2Y;
	}

	/** R2 of the fitted response per model size 0..nox. */
	public double[] getR2Yhat() {
		return a.copy(R2Yhat);
	}

}
