package tberg.kopls.contribution;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jblas.DoubleMatrix;

import tberg.kopls.fusion.FusionResult;
import tberg.kopls.model.DataBlock;
import tberg.kopls.regressor.KernelOPLSModel;
import tberg.kopls.threading.BetterThreader;

/**
 * Splits the latent components of the final model over the data blocks.
 */
public class ContributionDecomposer {

	private static final Logger logger = LogManager.getLogger(ContributionDecomposer.class);

	private final int numThreads;

	public ContributionDecomposer(int numThreads) {
		this.numThreads = numThreads;
	}

	public static String[] componentLabels(int numPredictive, int numOrthogonal) {
		String[] labels = new String[numPredictive + numOrthogonal];
		for (int a=0; a<numPredictive; ++a) labels[a] = "p_"+(a+1);
		for (int o=0; o<numOrthogonal; ++o) labels[numPredictive+o] = "o_"+(o+1);
		return labels;
	}

	/** Predictive scores followed by orthogonal scores, n x (A + nox). */
	public static DoubleMatrix scores(KernelOPLSModel model) {
		if (model.numOrthogonal() == 0) return model.getPredictiveScores();
		return DoubleMatrix.concatHorizontally(model.getPredictiveScores(), model.getOrthogonalScores());
	}

	public BlockContribution decompose(final List<DataBlock> blocks, final FusionResult fusion, KernelOPLSModel model) {
		final int numBlocks = blocks.size();
		final DoubleMatrix T = scores(model);
		final int numComponents = T.columns;
		// diag(T'T)^-1
		final DoubleMatrix invNorms = T.mul(T).columnSums().rdivi(1.0);
		final double[][] lambda = new double[numBlocks][];
		final double[][][] loadings = new double[numBlocks][][];

		BetterThreader.forEachIndex(numBlocks, numThreads, new BetterThreader.Function<Integer,Integer>(){public void call(Integer b, Integer threadId){
			DoubleMatrix Kb = fusion.getNormalizedKernel(b);
			lambda[b] = T.mul(Kb.mmul(T)).columnSums().toArray();
			DoubleMatrix P = blocks.get(b).toMatrix().transpose().mmul(T).muliRowVector(invNorms);
			loadings[b] = P.toArray2();
		}});

		double[][] contribution = new double[numBlocks][numComponents];
		for (int t=0; t<numComponents; ++t) {
			double sum = 0.0;
			for (int b=0; b<numBlocks; ++b) sum += lambda[b][t];
			if (sum == 0.0) logger.warn("Component {} has zero lambda over all blocks", t);
			for (int b=0; b<numBlocks; ++b) contribution[b][t] = lambda[b][t] / sum;
		}
		return new BlockContribution(fusion.getBlockNames(), componentLabels(model.numPredictive(), model.numOrthogonal()), lambda, contribution, loadings);
	}

}
