package tberg.kopls.predict;

import java.util.Arrays;
import java.util.List;

import org.jblas.DoubleMatrix;

import tberg.kopls.ConfigurationException;
import tberg.kopls.arrays.a;
import tberg.kopls.fusion.BlockFusion;
import tberg.kopls.math.m;
import tberg.kopls.model.ConsensusModel;
import tberg.kopls.model.DataBlock;
import tberg.kopls.model.ModelType;
import tberg.kopls.regressor.KernelOPLSPrediction;

/**
 * Projects new blocks onto a fitted consensus model, using the kernel, the
 * block norms and the RV weights frozen at fit time.
 */
public class ConsensusPredictor {

	private final int numThreads;

	public ConsensusPredictor(int numThreads) {
		this.numThreads = numThreads;
	}

	public ConsensusPrediction predict(ConsensusModel model, List<DataBlock> newBlocks) {
		List<DataBlock> trainBlocks = model.getBlocks();
		checkBlocks(trainBlocks, newBlocks);
		DoubleMatrix KteTr = new BlockFusion(model.getKernelParams(), numThreads).fuseTest(newBlocks, trainBlocks, model.getRVWeights(), model.getFrobeniusNorms());
		KernelOPLSPrediction pred = model.getKoplsModel().predict(KteTr, model.getNOcomp());
		double[][] yhat = pred.getYhat().toArray2();
		if (model.getModelType() != ModelType.DISCRIMINANT) {
			return new ConsensusPrediction(yhat, pred.getPredictiveScores().toArray2(), pred.getOrthogonalScores().toArray2(), null, null, null);
		}
		String[] classNames = model.getClassNames();
		String[] predictedClass = new String[yhat.length];
		double[] margin = new double[yhat.length];
		double[][] probabilities = new double[yhat.length][];
		for (int i=0; i<yhat.length; ++i) {
			int best = a.argmax(yhat[i]);
			predictedClass[i] = classNames[best];
			margin[i] = margin(yhat[i], best);
			probabilities[i] = m.softmax(yhat[i]);
		}
		return new ConsensusPrediction(yhat, pred.getPredictiveScores().toArray2(), pred.getOrthogonalScores().toArray2(), predictedClass, margin, probabilities);
	}

	private static double margin(double[] scores, int best) {
		if (scores.length == 1) return scores[0];
		double second = Double.NEGATIVE_INFINITY;
		for (int j=0; j<scores.length; ++j) {
			if (j != best && scores[j] > second) second = scores[j];
		}
		return scores[best] - second;
	}

	static void checkBlocks(List<DataBlock> trainBlocks, List<DataBlock> newBlocks) {
		if (newBlocks == null || newBlocks.size() != trainBlocks.size()) {
			throw new ConfigurationException("Model was fitted on "+trainBlocks.size()+" blocks, got "+(newBlocks == null ? 0 : newBlocks.size()));
		}
		int rows = newBlocks.get(0).numRows();
		for (int b=0; b<trainBlocks.size(); ++b) {
			DataBlock train = trainBlocks.get(b);
			DataBlock test = newBlocks.get(b);
			if (!train.getName().equals(test.getName())) {
				throw new ConfigurationException("Block "+b+" is `"+test.getName()+"`, model expects `"+train.getName()+"`");
			}
			if (train.numColumns() != test.numColumns()) {
				throw new ConfigurationException("Block `"+train.getName()+"` has "+test.numColumns()+" variables, model expects "+train.numColumns());
			}
			String[] trainVars = train.getVariableNames();
			String[] testVars = test.getVariableNames();
			if (trainVars != null && testVars != null && !Arrays.equals(trainVars, testVars)) {
				throw new ConfigurationException("Block `"+train.getName()+"` variables do not match the fitted ones");
			}
			if (test.numRows() != rows) {
				throw new ConfigurationException("New blocks disagree on the sample count: "+test.numRows()+" vs "+rows);
			}
		}
	}

}
