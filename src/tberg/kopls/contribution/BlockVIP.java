package tberg.kopls.contribution;

import tberg.kopls.arrays.a;

/**
 * Variable importance in projection of one block's variables.
 */
public final class BlockVIP {

	private final String blockName;
	private final double[] predictive;
	private final double[] orthogonal;
	private final double[] total;

	BlockVIP(String blockName, double[] predictive, double[] orthogonal, double[] total) {
		this.blockName = blockName;
		this.predictive = predictive;
		this.orthogonal = orthogonal;
		this.total = total;
	}

	public String getBlockName() {
		return blockName;
	}

	public double[] getPredictive() {
		return a.copy(predictive);
	}

	public double[] getOrthogonal() {
		return a.copy(orthogonal);
	}

	public double[] getTotal() {
		return a.copy(total);
	}

}
