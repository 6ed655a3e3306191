package tberg.kopls.permutation;

import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import tberg.kopls.ConsensusOPLSException;
import tberg.kopls.ConsensusPipeline;
import tberg.kopls.arrays.a;
import tberg.kopls.math.m;
import tberg.kopls.model.DataBlock;
import tberg.kopls.model.FitOptions;
import tberg.kopls.model.Response;
import tberg.kopls.threading.BetterThreader;

/**
 * Refits the whole pipeline with permuted response rows to build null
 * distributions of R2Y, Q2Y and DQ2Y.
 *
 * Permutations come from their own generator so that the number of
 * permutations never changes the unpermuted model.
 */
public class PermutationValidator {

	private static final Logger logger = LogManager.getLogger(PermutationValidator.class);

	public static final long PERMUTATION_SEED_MIX = 0x9E3779B97F4A7C15L;

	private final FitOptions options;

	/**
	 * @param options options of the unpermuted fit, with maxOcomp already clamped
	 */
	public PermutationValidator(FitOptions options) {
		this.options = options;
	}

	public PermutationStats run(final List<DataBlock> blocks, final Response response, ConsensusPipeline.Result observed) {
		final int nperm = options.getNperm();
		final int n = response.numSamples();
		Random rand = new Random(options.getSeed() ^ PERMUTATION_SEED_MIX);
		final int[][] perms = new int[nperm][];
		for (int r=0; r<nperm; ++r) perms[r] = a.permutation(n, rand);

		final double[] r2Y = new double[nperm+1];
		final double[] q2Y = new double[nperm+1];
		final double[] dq2Y = new double[nperm+1];
		final double[] corr = new double[nperm+1];
		r2Y[0] = observed.r2Y();
		q2Y[0] = observed.q2Y();
		dq2Y[0] = observed.dq2Y();
		corr[0] = 1.0;

		final double[] original = responseVector(response);
		final FitOptions roundOptions = options.with(options.getMaxOcomp(), 1, 0);
		final boolean[] failed = new boolean[nperm];
		BetterThreader.forEachIndex(nperm, options.getNumWorkers(), new BetterThreader.Function<Integer,Integer>(){public void call(Integer r, Integer threadId){
			Response permuted = response.permute(perms[r]);
			corr[r+1] = m.correlation(original, responseVector(permuted));
			try {
				ConsensusPipeline.Result result = ConsensusPipeline.run(blocks, permuted, roundOptions, ConsensusPipeline.partition(roundOptions, permuted));
				r2Y[r+1] = result.r2Y();
				q2Y[r+1] = result.q2Y();
				dq2Y[r+1] = result.dq2Y();
			} catch (ConsensusOPLSException e) {
				logger.warn("Permutation round {} failed: {}", r+1, e.getMessage());
				failed[r] = true;
				r2Y[r+1] = Double.NaN;
				q2Y[r+1] = Double.NaN;
				dq2Y[r+1] = Double.NaN;
			}
		}});

		int numFailed = 0;
		for (boolean f : failed) if (f) numFailed++;
		PermutationStats stats = new PermutationStats(r2Y, q2Y, dq2Y, corr, numFailed);
		logger.info("{} permutations ({} failed): p(R2Y)={}, p(Q2Y)={}, p(DQ2Y)={}", nperm, numFailed, stats.r2YPValue(), stats.q2YPValue(), stats.dq2YPValue());
		return stats;
	}

	// class index for categorical responses, first column otherwise
	private static double[] responseVector(Response response) {
		int n = response.numSamples();
		double[] result = new double[n];
		if (response.isCategorical()) {
			int[] classIndex = response.getClassIndex();
			for (int i=0; i<n; ++i) result[i] = classIndex[i];
		} else {
			double[][] values = response.getValues();
			for (int i=0; i<n; ++i) result[i] = values[i][0];
		}
		return result;
	}

}
