package tberg.kopls.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jblas.DoubleMatrix;

import tberg.kopls.arrays.a;
import tberg.kopls.contribution.BlockContribution;
import tberg.kopls.contribution.BlockVIP;
import tberg.kopls.contribution.ContributionDecomposer;
import tberg.kopls.cv.CrossValidationResult;
import tberg.kopls.kernel.KernelParams;
import tberg.kopls.permutation.PermutationStats;
import tberg.kopls.regressor.KernelOPLSModel;
import tberg.kopls.selection.SelectionResult;

/**
 * A fitted consensus kernel-OPLS model. Immutable; assembled once by
 * {@link Builder} at the end of a fit. Array and matrix accessors return copies.
 */
public final class ConsensusModel {

	private final ModelType modelType;
	private final Response response;
	private final KernelParams kernelParams;
	private final List<DataBlock> blocks;
	private final int nPcomp;
	private final int maxOcomp;
	private final int nOcomp;
	private final double[] rvWeights;
	private final double[] frobeniusNorms;
	private final DoubleMatrix[] normalizedKernels;
	private final KernelOPLSModel koplsModel;
	private final BlockContribution contribution;
	private final BlockVIP[] vip;
	private final CrossValidationResult cv;
	private final SelectionResult selection;
	private final PermutationStats permutationStats;

	private ConsensusModel(Builder b) {
		this.modelType = b.modelType;
		this.response = b.response;
		this.kernelParams = b.kernelParams;
		this.blocks = Collections.unmodifiableList(new ArrayList<DataBlock>(b.blocks));
		this.nPcomp = b.nPcomp;
		this.maxOcomp = b.maxOcomp;
		this.nOcomp = b.nOcomp;
		this.rvWeights = a.copy(b.rvWeights);
		this.frobeniusNorms = a.copy(b.frobeniusNorms);
		this.normalizedKernels = new DoubleMatrix[b.normalizedKernels.length];
		for (int i=0; i<normalizedKernels.length; ++i) normalizedKernels[i] = b.normalizedKernels[i].dup();
		this.koplsModel = b.koplsModel;
		this.contribution = b.contribution;
		this.vip = b.vip.clone();
		this.cv = b.cv;
		this.selection = b.selection;
		this.permutationStats = b.permutationStats;
	}

	public static Builder builder() {
		return new Builder();
	}

	public ModelType getModelType() {
		return modelType;
	}

	public Response getResponse() {
		return response;
	}

	/** Class names in dummy-column order; null for regression. */
	public String[] getClassNames() {
		return response.getClassNames();
	}

	public KernelParams getKernelParams() {
		return kernelParams;
	}

	/** Copies of the training blocks, in fit order. */
	public List<DataBlock> getBlocks() {
		return blocks;
	}

	public String[] getBlockNames() {
		String[] names = new String[blocks.size()];
		for (int i=0; i<names.length; ++i) names[i] = blocks.get(i).getName();
		return names;
	}

	public int numBlocks() {
		return blocks.size();
	}

	public int getNPcomp() {
		return nPcomp;
	}

	/** maxOcomp after clamping to what the data allows. */
	public int getMaxOcomp() {
		return maxOcomp;
	}

	public int getNOcomp() {
		return nOcomp;
	}

	/** Rescaled RV coefficient of every block with the response. */
	public double[] getRVWeights() {
		return a.copy(rvWeights);
	}

	public double[] getFrobeniusNorms() {
		return a.copy(frobeniusNorms);
	}

	public DoubleMatrix getNormalizedKernel(int block) {
		return normalizedKernels[block].dup();
	}

	public KernelOPLSModel getKoplsModel() {
		return koplsModel;
	}

	public String[] getComponentLabels() {
		return contribution.getComponentLabels();
	}

	/** Predictive scores followed by orthogonal scores. */
	public DoubleMatrix getScores() {
		return ContributionDecomposer.scores(koplsModel);
	}

	public double[][] getLambda() {
		return contribution.getLambda();
	}

	/** Blocks (rows) by components (columns); every column sums to one. */
	public double[][] getBlockContribution() {
		return contribution.getContribution();
	}

	public double[][] getLoadings(int block) {
		return contribution.getLoadings(block);
	}

	public double[][] getLoadings(String blockName) {
		return getLoadings(blockIndex(blockName));
	}

	public BlockVIP getVIP(int block) {
		return vip[block];
	}

	public BlockVIP getVIP(String blockName) {
		return vip[blockIndex(blockName)];
	}

	/** R2X per model size 0..nOcomp. */
	public double[] getR2X() {
		return koplsModel.getR2X();
	}

	/** R2 of the fitted response per model size 0..nOcomp. */
	public double[] getR2Y() {
		return koplsModel.getR2Yhat();
	}

	/** Cross-validated Q2 per orthogonal count 0..maxOcomp. */
	public double[] getQ2() {
		return cv.getQ2Yhat();
	}

	/** Cross-validated DQ2 per orthogonal count 0..maxOcomp; null for regression. */
	public double[] getDQ2() {
		return selection.getDQ2Yhat();
	}

	public double getR2YOpt() {
		return koplsModel.getR2Yhat()[nOcomp];
	}

	public double getQ2Opt() {
		return cv.getQ2Yhat()[nOcomp];
	}

	/** NaN for regression. */
	public double getDQ2Opt() {
		double[] dq2 = selection.getDQ2Yhat();
		return dq2 == null ? Double.NaN : dq2[nOcomp];
	}

	/** True when the final fit fell back below the count chosen from the cross-validated curve. */
	public boolean isNOcompSteppedDown() {
		return selection.isSteppedDown();
	}

	public CrossValidationResult getCrossValidation() {
		return cv;
	}

	public SelectionResult getSelection() {
		return selection;
	}

	public boolean hasPermutationStats() {
		return permutationStats != null;
	}

	/** Null when the fit ran without permutations. */
	public PermutationStats getPermutationStats() {
		return permutationStats;
	}

	private int blockIndex(String blockName) {
		for (int i=0; i<blocks.size(); ++i) {
			if (blocks.get(i).getName().equals(blockName)) return i;
		}
		throw new IllegalArgumentException("No block named `"+blockName+"`");
	}

	public static final class Builder {

		private ModelType modelType;
		private Response response;
		private KernelParams kernelParams;
		private List<DataBlock> blocks;
		private int nPcomp;
		private int maxOcomp;
		private int nOcomp;
		private double[] rvWeights;
		private double[] frobeniusNorms;
		private DoubleMatrix[] normalizedKernels;
		private KernelOPLSModel koplsModel;
		private BlockContribution contribution;
		private BlockVIP[] vip;
		private CrossValidationResult cv;
		private SelectionResult selection;
		private PermutationStats permutationStats;

		private Builder() {
		}

		public Builder modelType(ModelType modelType) {
			this.modelType = modelType;
			return this;
		}

		public Builder response(Response response) {
			this.response = response;
			return this;
		}

		public Builder kernelParams(KernelParams kernelParams) {
			this.kernelParams = kernelParams;
			return this;
		}

		public Builder blocks(List<DataBlock> blocks) {
			this.blocks = blocks;
			return this;
		}

		public Builder components(int nPcomp, int maxOcomp, int nOcomp) {
			this.nPcomp = nPcomp;
			this.maxOcomp = maxOcomp;
			this.nOcomp = nOcomp;
			return this;
		}

		public Builder fusion(double[] rvWeights, double[] frobeniusNorms, DoubleMatrix[] normalizedKernels) {
			this.rvWeights = rvWeights;
			this.frobeniusNorms = frobeniusNorms;
			this.normalizedKernels = normalizedKernels;
			return this;
		}

		public Builder koplsModel(KernelOPLSModel koplsModel) {
			this.koplsModel = koplsModel;
			return this;
		}

		public Builder contribution(BlockContribution contribution, BlockVIP[] vip) {
			this.contribution = contribution;
			this.vip = vip;
			return this;
		}

		public Builder crossValidation(CrossValidationResult cv, SelectionResult selection) {
			this.cv = cv;
			this.selection = selection;
			return this;
		}

		public Builder permutationStats(PermutationStats permutationStats) {
			this.permutationStats = permutationStats;
			return this;
		}

		public ConsensusModel build() {
			if (modelType == null || response == null || kernelParams == null || blocks == null || rvWeights == null
					|| frobeniusNorms == null || normalizedKernels == null || koplsModel == null || contribution == null
					|| vip == null || cv == null || selection == null) {
				throw new IllegalStateException("Consensus model is missing a fit stage");
			}
			if (koplsModel.numOrthogonal() != nOcomp || koplsModel.numPredictive() != nPcomp) {
				throw new IllegalStateException("Final model has "+koplsModel.numPredictive()+"+"+koplsModel.numOrthogonal()+" components, expected "+nPcomp+"+"+nOcomp);
			}
			return new ConsensusModel(this);
		}

	}

}
