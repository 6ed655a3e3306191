package tberg.kopls.cv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jblas.DoubleMatrix;

import tberg.kopls.ConsensusOPLSException;
import tberg.kopls.math.m;
import tberg.kopls.regressor.KernelOPLSModel;
import tberg.kopls.regressor.KernelOPLSRegressor;
import tberg.kopls.selection.QualityStatistics;
import tberg.kopls.threading.BetterThreader;

/**
 * Fits one kernel OPLS model per (round, orthogonal count) cell and collects the
 * held-out predictions.
 *
 * A cell whose fit fails numerically is logged, recorded as a
 * {@link CellFailure} and contributes NaN predictions; the other cells are not
 * affected. Q2 for an orthogonal count skips the test rows whose prediction is
 * missing.
 */
public class CrossValidationController {

	private static final Logger logger = LogManager.getLogger(CrossValidationController.class);

	private final int maxPcomp;
	private final int maxOcomp;
	private final int numThreads;

	public CrossValidationController(int maxPcomp, int maxOcomp, int numThreads) {
		this.maxPcomp = maxPcomp;
		this.maxOcomp = maxOcomp;
		this.numThreads = numThreads;
	}

	public CrossValidationResult run(final DoubleMatrix K, final DoubleMatrix Y, final CrossValidationSet cvSet) {
		final int numRounds = cvSet.numRounds();
		final int numCounts = maxOcomp + 1;
		final int c = Y.columns;
		final DoubleMatrix[] cellYhat = new DoubleMatrix[numRounds * numCounts];
		final CellFailure[] cellFailures = new CellFailure[numRounds * numCounts];

		BetterThreader.forEachIndex(numRounds * numCounts, numThreads, new BetterThreader.Function<Integer,Integer>(){public void call(Integer cell, Integer threadId){
			int round = cell / numCounts;
			int k = cell % numCounts;
			int[] train = cvSet.getTrainingIndex(round);
			int[] test = cvSet.getTestIndex(round);
			try {
				KernelOPLSModel model = new KernelOPLSRegressor(maxPcomp, k).train(m.select(K, train, train), m.selectRows(Y, train));
				cellYhat[cell] = model.predict(m.select(K, test, train), k).getYhat();
			} catch (ConsensusOPLSException e) {
				logger.warn("CV round {} with {} orthogonal components failed: {}", round, k, e.getMessage());
				cellYhat[cell] = m.nan(test.length, c);
				cellFailures[cell] = new CellFailure(round, k, e.getMessage());
			}
		}});

		int[] testIndex = cvSet.getConcatenatedTestIndex();
		DoubleMatrix allYhat = new DoubleMatrix(testIndex.length, numCounts * c);
		List<CellFailure> failures = new ArrayList<CellFailure>();
		int offset = 0;
		for (int round=0; round<numRounds; ++round) {
			int size = cvSet.getTestIndex(round).length;
			for (int k=0; k<numCounts; ++k) {
				int cell = round * numCounts + k;
				DoubleMatrix yhat = cellYhat[cell];
				for (int i=0; i<size; ++i) {
					for (int j=0; j<c; ++j) {
						allYhat.put(offset + i, k * c + j, yhat.get(i, j));
					}
				}
				if (cellFailures[cell] != null) failures.add(cellFailures[cell]);
			}
			offset += size;
		}

		DoubleMatrix yTest = m.selectRows(Y, testIndex);
		double[] q2Yhat = new double[numCounts];
		double[][] q2YhatVars = new double[numCounts][];
		for (int k=0; k<numCounts; ++k) {
			DoubleMatrix yhat = allYhat.getRange(0, allYhat.rows, k * c, (k+1) * c);
			q2Yhat[k] = QualityStatistics.q2(yhat, yTest);
			q2YhatVars[k] = QualityStatistics.q2PerColumn(yhat, yTest);
			if (Double.isNaN(q2Yhat[k]) && QualityStatistics.countCompleteRows(yhat) == 0) {
				logger.warn("No held-out predictions with {} orthogonal components; Q2 is missing", k);
			}
		}
		logger.debug("CV over {} rounds: {} of {} cells failed, Q2Yhat {}", numRounds, failures.size(), cellYhat.length, Arrays.toString(q2Yhat));
		return new CrossValidationResult(cvSet, maxOcomp, c, allYhat, yTest, q2Yhat, q2YhatVars, failures);
	}

}
