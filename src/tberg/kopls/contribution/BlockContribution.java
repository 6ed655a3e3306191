package tberg.kopls.contribution;

import tberg.kopls.arrays.a;

/**
 * Per-block share of each latent component and per-block loadings. Component
 * columns are p_1..p_A followed by o_1..o_nox.
 */
public final class BlockContribution {

	private final String[] blockNames;
	private final String[] componentLabels;
	private final double[][] lambda;
	private final double[][] contribution;
	private final double[][][] loadings;

	BlockContribution(String[] blockNames, String[] componentLabels, double[][] lambda, double[][] contribution, double[][][] loadings) {
		this.blockNames = blockNames;
		this.componentLabels = componentLabels;
		this.lambda = lambda;
		this.contribution = contribution;
		this.loadings = loadings;
	}

	public String[] getBlockNames() {
		return a.copy(blockNames);
	}

	public String[] getComponentLabels() {
		return a.copy(componentLabels);
	}

	/** Raw t' K_b t per block (rows) and component (columns). */
	public double[][] getLambda() {
		return a.copy(lambda);
	}

	/** lambda normalized so every component column sums to one over blocks. */
	public double[][] getContribution() {
		return a.copy(contribution);
	}

	/** Loadings of block b: variables (rows) by components (columns). */
	public double[][] getLoadings(int block) {
		return a.copy(loadings[block]);
	}

	public int numBlocks() {
		return blockNames.length;
	}

}
