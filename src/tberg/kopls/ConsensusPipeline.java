package tberg.kopls;

import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jblas.DoubleMatrix;

import tberg.kopls.contribution.BlockContribution;
import tberg.kopls.contribution.BlockVIP;
import tberg.kopls.contribution.ContributionDecomposer;
import tberg.kopls.contribution.VariableImportance;
import tberg.kopls.cv.CrossValidationController;
import tberg.kopls.cv.CrossValidationPartitioner;
import tberg.kopls.cv.CrossValidationResult;
import tberg.kopls.cv.CrossValidationSet;
import tberg.kopls.fusion.BlockFusion;
import tberg.kopls.fusion.FusionResult;
import tberg.kopls.model.DataBlock;
import tberg.kopls.model.FitOptions;
import tberg.kopls.model.ModelType;
import tberg.kopls.model.Response;
import tberg.kopls.regressor.KernelOPLSModel;
import tberg.kopls.regressor.KernelOPLSRegressor;
import tberg.kopls.selection.ComponentSelector;
import tberg.kopls.selection.SelectionResult;

/**
 * One pass of fusion, cross-validation, component selection, final fit and
 * block decomposition. Inputs are expected to be validated already and
 * {@code options.getMaxOcomp()} to be clamped.
 */
public class ConsensusPipeline {

	private static final Logger logger = LogManager.getLogger(ConsensusPipeline.class);

	public static final class Result {

		public final FusionResult fusion;
		public final CrossValidationResult cv;
		public final SelectionResult selection;
		public final KernelOPLSModel koplsModel;
		public final BlockContribution contribution;
		public final BlockVIP[] vip;

		Result(FusionResult fusion, CrossValidationResult cv, SelectionResult selection, KernelOPLSModel koplsModel, BlockContribution contribution, BlockVIP[] vip) {
			this.fusion = fusion;
			this.cv = cv;
			this.selection = selection;
			this.koplsModel = koplsModel;
			this.contribution = contribution;
			this.vip = vip;
		}

		public int nOcompOpt() {
			return selection.getNOcompOpt();
		}

		public double r2Y() {
			return koplsModel.getR2Yhat()[nOcompOpt()];
		}

		public double q2Y() {
			return cv.getQ2Yhat()[nOcompOpt()];
		}

		public double dq2Y() {
			double[] dq2 = selection.getDQ2Yhat();
			return dq2 == null ? Double.NaN : dq2[nOcompOpt()];
		}

	}

	/**
	 * Cross-validation rounds for the given options and (encoded) response. Random
	 * schemes draw from a generator seeded with {@code options.getSeed()}.
	 */
	public static CrossValidationSet partition(FitOptions options, Response response) {
		int n = response.numSamples();
		switch (options.getCvType()) {
			case NFOLD:
				return CrossValidationPartitioner.nfold(n, options.getNfold());
			case MCCV:
				return CrossValidationPartitioner.mccv(n, options.getNMC(), options.getCvFrac(), new Random(options.getSeed()));
			case MCCVB:
				if (!response.isCategorical()) throw new InputValidationException("cvType `mccvb` needs a discriminant model");
				return CrossValidationPartitioner.mccvb(response.getClassIndex(), response.getClassNames().length, options.getNMC(), options.getCvFrac(), new Random(options.getSeed()));
			default:
				throw new InputValidationException("Unsupported cvType "+options.getCvType());
		}
	}

	/** Response similarity source for RV weighting. */
	static DoubleMatrix rvResponse(ModelType modelType, DoubleMatrix Y) {
		if (modelType == ModelType.DISCRIMINANT) return Y;
		return Y.subRowVector(Y.columnMeans());
	}

	/**
	 * Final fit at the selected count. A count whose curve entry is missing, or
	 * whose fit runs out of orthogonal variance, is replaced by the largest
	 * smaller count that fits; zero orthogonal components is the floor.
	 */
	static KernelOPLSModel fitSelected(DoubleMatrix K, DoubleMatrix Y, int maxPcomp, double[] curve, int selected) {
		int k = selected;
		while (k > 0 && Double.isNaN(curve[k])) k--;
		while (true) {
			try {
				KernelOPLSModel model = new KernelOPLSRegressor(maxPcomp, k).train(K, Y);
				if (k < selected) logger.warn("Stepped down from {} to {} orthogonal components", selected, k);
				return model;
			} catch (ConvergenceException e) {
				if (k == 0) throw e;
				logger.warn("Final fit with {} orthogonal components failed: {}", k, e.getMessage());
				k = Math.min(k - 1, e.getComponent() - 1);
			}
		}
	}

	public static Result run(List<DataBlock> blocks, Response response, FitOptions options, CrossValidationSet cvSet) {
		int workers = options.getNumWorkers();
		int maxPcomp = options.getMaxPcomp();
		int maxOcomp = options.getMaxOcomp();
		DoubleMatrix Y = response.toMatrix();

		FusionResult fusion = new BlockFusion(options.getKernelParams(), workers).fuse(blocks, rvResponse(options.getModelType(), Y));
		DoubleMatrix K = fusion.getFusedKernel();

		CrossValidationResult cv = new CrossValidationController(maxPcomp, maxOcomp, workers).run(K, Y, cvSet);
		SelectionResult selection = new ComponentSelector(options.getModelType(), maxPcomp, maxOcomp, workers).select(cv);
		logger.debug("Selected {} orthogonal components out of {}", selection.getNOcompOpt(), maxOcomp);

		KernelOPLSModel model = fitSelected(K, Y, maxPcomp, selection.getCurve(), selection.getNOcompOpt());
		if (model.numOrthogonal() != selection.getNOcompOpt()) selection = selection.withFittedCount(model.numOrthogonal());
		BlockContribution contribution = new ContributionDecomposer(workers).decompose(blocks, fusion, model);
		BlockVIP[] vip = VariableImportance.compute(contribution, model, Y);
		return new Result(fusion, cv, selection, model, contribution, vip);
	}

}
