package tberg.kopls.selection;

import org.jblas.DoubleMatrix;

/**
 * Prediction quality measures over held-out predictions. Rows whose prediction
 * has a NaN entry are left out of both the error and the total sum of squares.
 * Neither Q2 nor DQ2 is clamped, so both can fall below -1.
 */
public class QualityStatistics {

	/** 1 - PRESS / TSS over all response columns. */
	public static double q2(DoubleMatrix yhat, DoubleMatrix y) {
		boolean[] complete = completeRows(yhat);
		double press = 0.0;
		double tss = 0.0;
		for (int j=0; j<y.columns; ++j) {
			double[] sums = pressAndTss(yhat, y, j, complete);
			press += sums[0];
			tss += sums[1];
		}
		return ratio(press, tss);
	}

	public static double[] q2PerColumn(DoubleMatrix yhat, DoubleMatrix y) {
		boolean[] complete = completeRows(yhat);
		double[] result = new double[y.columns];
		for (int j=0; j<y.columns; ++j) {
			double[] sums = pressAndTss(yhat, y, j, complete);
			result[j] = ratio(sums[0], sums[1]);
		}
		return result;
	}

	/**
	 * DQ2 (Westerhuis et al. 2008) of one 0/1 response column: residuals of
	 * class-0 samples predicted below 0 and of class-1 samples predicted above 1
	 * are not errors. The value is not clamped below: predictions on the wrong
	 * side of the class boundary can take it under -1.
	 *
	 * @return {DQ2, PRESSD}
	 */
	public static double[] dq2(DoubleMatrix yhat, DoubleMatrix y) {
		double mean = 0.0;
		int count = 0;
		for (int i=0; i<y.rows; ++i) {
			if (Double.isNaN(yhat.get(i))) continue;
			mean += y.get(i);
			count++;
		}
		if (count == 0) return new double[] {Double.NaN, Double.NaN};
		mean /= count;
		double pressd = 0.0;
		double tss = 0.0;
		for (int i=0; i<y.rows; ++i) {
			double pred = yhat.get(i);
			if (Double.isNaN(pred)) continue;
			double obs = y.get(i);
			double e = pred - obs;
			if (obs < 0.5) {
				if (e > 0.0) pressd += e*e;
			} else {
				if (e < 0.0) pressd += e*e;
			}
			tss += (obs-mean)*(obs-mean);
		}
		return new double[] {ratio(pressd, tss), pressd};
	}

	public static int countCompleteRows(DoubleMatrix yhat) {
		int count = 0;
		for (boolean b : completeRows(yhat)) if (b) count++;
		return count;
	}

	private static double[] pressAndTss(DoubleMatrix yhat, DoubleMatrix y, int j, boolean[] complete) {
		double mean = 0.0;
		int count = 0;
		for (int i=0; i<y.rows; ++i) {
			if (!complete[i]) continue;
			mean += y.get(i, j);
			count++;
		}
		if (count == 0) return new double[] {Double.NaN, Double.NaN};
		mean /= count;
		double press = 0.0;
		double tss = 0.0;
		for (int i=0; i<y.rows; ++i) {
			if (!complete[i]) continue;
			double e = yhat.get(i, j) - y.get(i, j);
			press += e*e;
			tss += (y.get(i, j)-mean)*(y.get(i, j)-mean);
		}
		return new double[] {press, tss};
	}

	private static boolean[] completeRows(DoubleMatrix yhat) {
		boolean[] result = new boolean[yhat.rows];
		for (int i=0; i<yhat.rows; ++i) {
			result[i] = true;
			for (int j=0; j<yhat.columns; ++j) {
				if (Double.isNaN(yhat.get(i, j))) {
					result[i] = false;
					break;
				}
			}
		}
		return result;
	}

	private static double ratio(double press, double tss) {
		if (Double.isNaN(press) || Double.isNaN(tss) || tss == 0.0) return Double.NaN;
		return 1.0 - press / tss;
	}

}
