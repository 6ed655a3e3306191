package tberg.kopls.math;

import org.jblas.DoubleMatrix;

public class m {

	public static double logAdd(double logX, double logY) {
		if (logY > logX) {
			double tmp = logX;
			logX = logY;
			logY = tmp;
		}
		if (logX == Double.NEGATIVE_INFINITY) return logX;
		double diff = logX - logY;
		if (diff > 30) return logX;
		return logX + Math.log(1.0 + Math.exp(-diff));
	}

	/**
	 * Softmax of one row of scores, normalized in log space so large scores do
	 * not overflow.
	 */
	public static double[] softmax(double[] scores) {
		double logSum = Double.NEGATIVE_INFINITY;
		for (double s : scores) logSum = logAdd(logSum, s);
		double[] result = new double[scores.length];
		for (int i=0; i<scores.length; ++i) {
			result[i] = Math.exp(scores[i] - logSum);
		}
		return result;
	}

	public static double frobeniusNorm(DoubleMatrix x) {
		return Math.sqrt(sumSquares(x));
	}

	public static double sumSquares(DoubleMatrix x) {
		return x.dot(x);
	}

	public static double trace(DoubleMatrix x) {
		return x.diag().sum();
	}

	/** diag(X' X) as a row vector. */
	public static DoubleMatrix columnSquaredNorms(DoubleMatrix x) {
		return x.mul(x).columnSums();
	}

	/** I - t t' for a unit-norm column vector t. */
	public static DoubleMatrix deflator(DoubleMatrix t) {
		return DoubleMatrix.eye(t.rows).subi(t.mmul(t.transpose()));
	}

	/** Sub-matrix of the given rows and columns, in the given order. */
	public static DoubleMatrix select(DoubleMatrix x, int[] rows, int[] cols) {
		DoubleMatrix result = new DoubleMatrix(rows.length, cols.length);
		for (int j=0; j<cols.length; ++j) {
			for (int i=0; i<rows.length; ++i) {
				result.put(i, j, x.get(rows[i], cols[j]));
			}
		}
		return result;
	}

	public static DoubleMatrix selectRows(DoubleMatrix x, int[] rows) {
		DoubleMatrix result = new DoubleMatrix(rows.length, x.columns);
		for (int i=0; i<rows.length; ++i) {
			result.putRow(i, x.getRow(rows[i]));
		}
		return result;
	}

	public static boolean isFinite(DoubleMatrix x) {
		for (int i=0; i<x.length; ++i) {
			if (Double.isNaN(x.data[i]) || Double.isInfinite(x.data[i])) return false;
		}
		return true;
	}

	public static DoubleMatrix nan(int rows, int cols) {
		DoubleMatrix result = new DoubleMatrix(rows, cols);
		result.fill(Double.NaN);
		return result;
	}

	/** Pearson correlation, NaN when either side has no variance. */
	public static double correlation(double[] x, double[] y) {
		int n = x.length;
		double mx = 0.0, my = 0.0;
		for (int i=0; i<n; ++i) {
			mx += x[i];
			my += y[i];
		}
		mx /= n;
		my /= n;
		double sxy = 0.0, sxx = 0.0, syy = 0.0;
		for (int i=0; i<n; ++i) {
			sxy += (x[i]-mx)*(y[i]-my);
			sxx += (x[i]-mx)*(x[i]-mx);
			syy += (y[i]-my)*(y[i]-my);
		}
		if (sxx == 0.0 || syy == 0.0) return Double.NaN;
		return sxy / Math.sqrt(sxx * syy);
	}

}
