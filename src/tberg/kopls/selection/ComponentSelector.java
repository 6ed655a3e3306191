package tberg.kopls.selection;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jblas.DoubleMatrix;

import tberg.kopls.arrays.a;
import tberg.kopls.cv.CrossValidationResult;
import tberg.kopls.model.ModelType;
import tberg.kopls.threading.BetterThreader;
import tberg.kopls.threading.WorkerAllocation;

/**
 * Chooses the number of orthogonal components from the cross-validated quality
 * curve with a greedy rule: keep adding a component while it improves the curve
 * by more than {@link #IMPROVEMENT_THRESHOLD}.
 */
public class ComponentSelector {

	private static final Logger logger = LogManager.getLogger(ComponentSelector.class);

	public static final double IMPROVEMENT_THRESHOLD = 0.01;

	private final ModelType modelType;
	private final int maxPcomp;
	private final int maxOcomp;
	private final int numThreads;

	public ComponentSelector(ModelType modelType, int maxPcomp, int maxOcomp, int numThreads) {
		this.modelType = modelType;
		this.maxPcomp = maxPcomp;
		this.maxOcomp = maxOcomp;
		this.numThreads = numThreads;
	}

	public SelectionResult select(CrossValidationResult cv) {
		if (modelType == ModelType.REGRESSION) {
			double[] curve = cv.getQ2Yhat();
			int nOcompOpt = greedySelect(curve, maxPcomp, maxOcomp);
			logger.debug("Q2Yhat curve {} selects {} orthogonal components", a.toString(curve), nOcompOpt);
			return new SelectionResult(modelType, curve, null, null, nOcompOpt);
		}
		final double[][] dq2 = new double[maxOcomp+1][];
		final double[][] pressd = new double[maxOcomp+1][];
		computeDQ2(cv, dq2, pressd);
		double[] curve = new double[maxOcomp+1];
		for (int k=0; k<=maxOcomp; ++k) {
			curve[k] = a.mean(dq2[k]);
			if (Double.isNaN(curve[k])) logger.warn("DQ2 with {} orthogonal components is missing", k);
		}
		int nOcompOpt = greedySelect(curve, maxPcomp, maxOcomp);
		logger.debug("DQ2 curve {} selects {} orthogonal components", a.toString(curve), nOcompOpt);
		return new SelectionResult(modelType, curve, dq2, pressd, nOcompOpt);
	}

	private void computeDQ2(final CrossValidationResult cv, final double[][] dq2, final double[][] pressd) {
		final int c = cv.numResponseColumns();
		final DoubleMatrix yTest = cv.getYTest();
		final WorkerAllocation workers = WorkerAllocation.sqrtSplit(numThreads, maxOcomp+1, c);
		BetterThreader.forEachIndex(maxOcomp+1, workers.outer(), new BetterThreader.Function<Integer,Integer>(){public void call(final Integer k, Integer outerThread){
			final DoubleMatrix yhat = cv.getYhat(k);
			dq2[k] = new double[c];
			pressd[k] = new double[c];
			BetterThreader.forEachIndex(c, workers.inner(), new BetterThreader.Function<Integer,Integer>(){public void call(Integer j, Integer innerThread){
				double[] result = QualityStatistics.dq2(yhat.getColumn(j), yTest.getColumn(j));
				dq2[k][j] = result[0];
				pressd[k][j] = result[1];
			}});
		}});
	}

	/**
	 * Greedy stopping rule over a curve indexed by orthogonal count. The search
	 * starts at position maxPcomp and never moves past maxOcomp + maxPcomp - 1;
	 * a NaN difference stops it. The result is clamped to [0, maxOcomp].
	 */
	public static int greedySelect(double[] curve, int maxPcomp, int maxOcomp) {
		if (maxOcomp <= 0) return 0;
		int index = maxPcomp;
		while (index < maxOcomp + maxPcomp - 1 && index + 1 < curve.length) {
			double gain = curve[index+1] - curve[index];
			if (!(gain > IMPROVEMENT_THRESHOLD)) break;
			index++;
		}
		int result = index + 1 - maxPcomp;
		return Math.max(0, Math.min(maxOcomp, result));
	}

}
