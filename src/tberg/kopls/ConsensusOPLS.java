package tberg.kopls;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jblas.DoubleMatrix;

import tberg.kopls.cv.CrossValidationSet;
import tberg.kopls.cv.CrossValidationType;
import tberg.kopls.model.ConsensusModel;
import tberg.kopls.model.DataBlock;
import tberg.kopls.model.FitOptions;
import tberg.kopls.model.ModelType;
import tberg.kopls.model.Response;
import tberg.kopls.permutation.PermutationStats;
import tberg.kopls.permutation.PermutationValidator;
import tberg.kopls.predict.ConsensusPrediction;
import tberg.kopls.predict.ConsensusPredictor;

/**
 * Consensus kernel-OPLS: RV-weighted fusion of several data blocks sharing their
 * samples, kernel OPLS with a cross-validated number of orthogonal components,
 * block contributions and an optional permutation test.
 *
 * <pre>
 * ConsensusModel model = ConsensusOPLS.fit(blocks, Response.labels(classes),
 *     FitOptions.builder().maxOcomp(3).nfold(5).kernel(KernelParams.linear()).build());
 * ConsensusPrediction pred = ConsensusOPLS.predict(model, newBlocks);
 * </pre>
 */
public class ConsensusOPLS {

	private static final Logger logger = LogManager.getLogger(ConsensusOPLS.class);

	/**
	 * Fits a consensus model. Input problems raise {@link InputValidationException}
	 * or {@link ConfigurationException} before any kernel is computed; numerical
	 * failures inside cross-validation cells or permutation rounds only degrade
	 * the corresponding statistics.
	 */
	public static ConsensusModel fit(List<DataBlock> blocks, Response response, FitOptions options) {
		if (options == null) throw new InputValidationException("options are required");
		List<DataBlock> data = checkBlocks(blocks);
		Response encoded = checkResponse(data, response, options);
		FitOptions clamped = clampOrthogonal(data, options);
		CrossValidationSet cvSet = ConsensusPipeline.partition(clamped, encoded);

		logger.info("Fitting consensus kernel-OPLS on {} blocks, {} samples: {}", data.size(), encoded.numSamples(), clamped);
		ConsensusPipeline.Result result = ConsensusPipeline.run(data, encoded, clamped, cvSet);

		PermutationStats permutationStats = null;
		if (clamped.getNperm() > 0) {
			permutationStats = new PermutationValidator(clamped).run(data, encoded, result);
		}

		int nOcomp = result.nOcompOpt();
		DoubleMatrix[] normalizedKernels = new DoubleMatrix[data.size()];
		for (int b=0; b<normalizedKernels.length; ++b) normalizedKernels[b] = result.fusion.getNormalizedKernel(b);
		ConsensusModel model = ConsensusModel.builder()
			.modelType(clamped.getModelType())
			.response(encoded)
			.kernelParams(clamped.getKernelParams())
			.blocks(data)
			.components(clamped.getMaxPcomp(), clamped.getMaxOcomp(), nOcomp)
			.fusion(result.fusion.getRVWeights(), result.fusion.getFrobeniusNorms(), normalizedKernels)
			.koplsModel(result.koplsModel)
			.contribution(result.contribution, result.vip)
			.crossValidation(result.cv, result.selection)
			.permutationStats(permutationStats)
			.build();
		logger.info("Selected {} predictive and {} orthogonal components: R2Y={}, Q2={}, DQ2={}", model.getNPcomp(), nOcomp, model.getR2YOpt(), model.getQ2Opt(), model.getDQ2Opt());
		return model;
	}

	public static ConsensusPrediction predict(ConsensusModel model, List<DataBlock> newBlocks) {
		return predict(model, newBlocks, 1);
	}

	public static ConsensusPrediction predict(ConsensusModel model, List<DataBlock> newBlocks, int numWorkers) {
		if (model == null) throw new ConfigurationException("No model to predict with");
		return new ConsensusPredictor(numWorkers).predict(model, newBlocks);
	}

	static List<DataBlock> checkBlocks(List<DataBlock> blocks) {
		if (blocks == null || blocks.isEmpty()) throw new InputValidationException("At least one data block is required");
		List<DataBlock> data = new ArrayList<DataBlock>(blocks);
		Set<String> names = new HashSet<String>();
		int rows = -1;
		String[] sampleNames = null;
		for (DataBlock block : data) {
			if (block == null) throw new InputValidationException("Data blocks must not be null");
			if (!names.add(block.getName())) throw new InputValidationException("Duplicate block name `"+block.getName()+"`");
			if (rows < 0) {
				rows = block.numRows();
			} else if (block.numRows() != rows) {
				throw new InputValidationException("Block `"+block.getName()+"` has "+block.numRows()+" rows, expected "+rows+" like `"+data.get(0).getName()+"`");
			}
			String[] s = block.getSampleNames();
			if (s != null) {
				if (sampleNames == null) sampleNames = s;
				else if (!Arrays.equals(sampleNames, s)) throw new InputValidationException("Block `"+block.getName()+"` lists its samples in a different order");
			}
		}
		return data;
	}

	static Response checkResponse(List<DataBlock> data, Response response, FitOptions options) {
		if (response == null) throw new InputValidationException("A response is required");
		int n = data.get(0).numRows();
		if (response.numSamples() != n) {
			throw new InputValidationException("Response has "+response.numSamples()+" rows, blocks have "+n);
		}
		Response encoded = response.encode(options.getModelType());
		if (options.getModelType() == ModelType.DISCRIMINANT) {
			int[] counts = encoded.classCounts();
			String[] classNames = encoded.getClassNames();
			if (counts.length < 2) throw new InputValidationException("A discriminant model needs at least two classes");
			for (int c=0; c<counts.length; ++c) {
				if (counts[c] < 2) throw new InputValidationException("Class `"+classNames[c]+"` has "+counts[c]+" sample(s); every class needs at least two, or use modelType `reg`");
			}
			if (options.getMaxPcomp() > counts.length - 1) {
				throw new InputValidationException("maxPcomp "+options.getMaxPcomp()+" exceeds the "+(counts.length-1)+" predictive directions of "+counts.length+" classes");
			}
		} else {
			if (options.getMaxPcomp() > encoded.numColumns()) {
				throw new InputValidationException("maxPcomp "+options.getMaxPcomp()+" exceeds the "+encoded.numColumns()+" response column(s)");
			}
			if (options.getCvType() == CrossValidationType.MCCVB) {
				throw new InputValidationException("cvType `mccvb` needs a discriminant model");
			}
		}
		if (options.getMaxPcomp() >= n) {
			throw new InputValidationException("maxPcomp "+options.getMaxPcomp()+" needs more than "+n+" samples");
		}
		return encoded;
	}

	/** maxOcomp limited to min(samples - maxPcomp, smallest block width). */
	static FitOptions clampOrthogonal(List<DataBlock> data, FitOptions options) {
		int n = data.get(0).numRows();
		int minVars = Integer.MAX_VALUE;
		for (DataBlock block : data) minVars = Math.min(minVars, block.numColumns());
		int limit = Math.max(0, Math.min(n - options.getMaxPcomp(), minVars));
		if (options.getMaxOcomp() <= limit) return options;
		logger.info("Clamping maxOcomp from {} to {}", options.getMaxOcomp(), limit);
		return options.with(limit, options.getNumWorkers(), options.getNperm());
	}

}
