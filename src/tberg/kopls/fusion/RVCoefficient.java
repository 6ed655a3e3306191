package tberg.kopls.fusion;

import org.jblas.DoubleMatrix;

import tberg.kopls.NumericalDegeneracyException;

/**
 * Modified RV coefficient (Smilde et al. 2009): the RV coefficient between X X'
 * and Y Y' with both diagonals removed. Lies in [-1, 1].
 */
public class RVCoefficient {

	public static double modified(DoubleMatrix x, DoubleMatrix y) {
		if (x.rows != y.rows) throw new IllegalArgumentException("RV needs equal row counts, got "+x.rows+" and "+y.rows);
		DoubleMatrix AA = offDiagonalCrossProduct(x);
		DoubleMatrix BB = offDiagonalCrossProduct(y);
		double denom = Math.sqrt(AA.dot(AA) * BB.dot(BB));
		if (!(denom > 0.0) || Double.isInfinite(denom)) {
			throw new NumericalDegeneracyException("RV coefficient is undefined: a similarity matrix has no off-diagonal mass");
		}
		double rv = AA.dot(BB) / denom;
		return Math.max(-1.0, Math.min(1.0, rv));
	}

	/** (RV + 1) / 2, the block weight used for fusion. */
	public static double rescaled(double rv) {
		return Math.max(0.0, Math.min(1.0, (rv + 1.0) / 2.0));
	}

	private static DoubleMatrix offDiagonalCrossProduct(DoubleMatrix x) {
		DoubleMatrix xx = x.mmul(x.transpose());
		for (int i=0; i<xx.rows; ++i) xx.put(i, i, 0.0);
		return xx;
	}

}
