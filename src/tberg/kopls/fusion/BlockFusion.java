package tberg.kopls.fusion;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jblas.DoubleMatrix;

import tberg.kopls.NumericalDegeneracyException;
import tberg.kopls.kernel.KernelMatrixBuilder;
import tberg.kopls.kernel.KernelParams;
import tberg.kopls.math.m;
import tberg.kopls.model.DataBlock;
import tberg.kopls.threading.BetterThreader;

/**
 * Builds one kernel per block, scales it to unit Frobenius norm, weights it by
 * its rescaled RV coefficient with the response and sums the weighted kernels.
 *
 * Blocks are processed in parallel; the sum always runs in ascending block
 * order so the consensus kernel does not depend on the worker count.
 */
public class BlockFusion {

	private static final Logger logger = LogManager.getLogger(BlockFusion.class);

	private final KernelParams kernelParams;
	private final int numThreads;

	public BlockFusion(KernelParams kernelParams, int numThreads) {
		this.kernelParams = kernelParams;
		this.numThreads = numThreads;
	}

	/**
	 * @param blocks data blocks sharing rows
	 * @param Yc response similarity source: the dummy matrix for discriminant
	 * models, the mean-centred response for regression
	 */
	public FusionResult fuse(final List<DataBlock> blocks, final DoubleMatrix Yc) {
		final int numBlocks = blocks.size();
		final String[] names = new String[numBlocks];
		final double[] rv = new double[numBlocks];
		final double[] norms = new double[numBlocks];
		final DoubleMatrix[] normalized = new DoubleMatrix[numBlocks];
		final KernelMatrixBuilder kernelBuilder = kernelParams.builder();

		BetterThreader.forEachIndex(numBlocks, numThreads, new BetterThreader.Function<Integer,Integer>(){public void call(Integer b, Integer threadId){
			DataBlock block = blocks.get(b);
			DoubleMatrix x = block.toMatrix();
			DoubleMatrix K = kernelBuilder.build(x, x);
			double norm = m.frobeniusNorm(K);
			if (!(norm > 0.0) || Double.isInfinite(norm)) {
				throw new NumericalDegeneracyException("Kernel of block `"+block.getName()+"` has Frobenius norm "+norm);
			}
			K.divi(norm);
			names[b] = block.getName();
			norms[b] = norm;
			normalized[b] = K;
			rv[b] = RVCoefficient.rescaled(RVCoefficient.modified(K, Yc));
		}});

		DoubleMatrix fused = DoubleMatrix.zeros(Yc.rows, Yc.rows);
		for (int b=0; b<numBlocks; ++b) {
			fused.addi(normalized[b].mul(rv[b]));
			logger.debug("Block {}: RV weight {}, kernel norm {}", names[b], rv[b], norms[b]);
		}
		return new FusionResult(names, rv, norms, normalized, fused);
	}

	/**
	 * Test-by-training consensus kernel for new samples, using the training
	 * blocks, Frobenius norms and RV weights frozen at fit time.
	 */
	public DoubleMatrix fuseTest(final List<DataBlock> newBlocks, final List<DataBlock> trainBlocks, final double[] rvWeights, final double[] frobeniusNorms) {
		final int numBlocks = newBlocks.size();
		final DoubleMatrix[] weighted = new DoubleMatrix[numBlocks];
		final KernelMatrixBuilder kernelBuilder = kernelParams.builder();
		BetterThreader.forEachIndex(numBlocks, numThreads, new BetterThreader.Function<Integer,Integer>(){public void call(Integer b, Integer threadId){
			DoubleMatrix KteTr = kernelBuilder.build(newBlocks.get(b).toMatrix(), trainBlocks.get(b).toMatrix());
			weighted[b] = KteTr.muli(rvWeights[b] / frobeniusNorms[b]);
		}});
		DoubleMatrix fused = DoubleMatrix.zeros(newBlocks.get(0).numRows(), trainBlocks.get(0).numRows());
		for (int b=0; b<numBlocks; ++b) fused.addi(weighted[b]);
		return fused;
	}

}
