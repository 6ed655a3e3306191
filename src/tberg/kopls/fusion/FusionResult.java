package tberg.kopls.fusion;

import org.jblas.DoubleMatrix;

import tberg.kopls.arrays.a;

/**
 * Output of block fusion: the RV-weighted consensus kernel plus the per-block
 * quantities needed later for contributions and prediction.
 */
public final class FusionResult {

	private final String[] blockNames;
	private final double[] rvWeights;
	private final double[] frobeniusNorms;
	private final DoubleMatrix[] normalizedKernels;
	private final DoubleMatrix fusedKernel;

	FusionResult(String[] blockNames, double[] rvWeights, double[] frobeniusNorms, DoubleMatrix[] normalizedKernels, DoubleMatrix fusedKernel) {
		this.blockNames = blockNames;
		this.rvWeights = rvWeights;
		this.frobeniusNorms = frobeniusNorms;
		this.normalizedKernels = normalizedKernels;
		this.fusedKernel = fusedKernel;
	}

	public int numBlocks() {
		return rvWeights.length;
	}

	public String[] getBlockNames() {
		return a.copy(blockNames);
	}

	/** (RV + 1) / 2 per block, in block order. */
	public double[] getRVWeights() {
		return a.copy(rvWeights);
	}

	public double[] getFrobeniusNorms() {
		return a.copy(frobeniusNorms);
	}

	public DoubleMatrix getNormalizedKernel(int block) {
		return normalizedKernels[block].dup();
	}

	public DoubleMatrix getFusedKernel() {
		return fusedKernel.dup();
	}

}
