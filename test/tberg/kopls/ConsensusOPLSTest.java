package tberg.kopls;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import tberg.kopls.cv.CrossValidationType;
import tberg.kopls.kernel.KernelParams;
import tberg.kopls.model.ConsensusModel;
import tberg.kopls.model.DataBlock;
import tberg.kopls.model.FitOptions;
import tberg.kopls.model.ModelType;
import tberg.kopls.model.Response;

public class ConsensusOPLSTest {

	private static FitOptions.Builder scenarioOptions() {
		return FitOptions.builder().maxPcomp(1).maxOcomp(3).nfold(5).kernel(KernelParams.linear());
	}

	private static Response scenarioResponse() {
		return Response.labels(TestData.twoClassLabels(20));
	}

	@Test
	public void threeBlockDiscriminantFit() {
		ConsensusModel model = ConsensusOPLS.fit(TestData.scenarioBlocks(), scenarioResponse(), scenarioOptions().build());
		int nOcomp = model.getNOcomp();
		assertThat(nOcomp).isBetween(0, 3);
		assertThat(model.getMaxOcomp()).isEqualTo(3);
		assertThat(model.getNPcomp()).isEqualTo(1);
		assertThat(model.getClassNames()).containsExactly("A", "B");

		double[][] contribution = model.getBlockContribution();
		assertThat(contribution).hasNumberOfRows(3);
		for (double[] row : contribution) assertThat(row).hasSize(1 + nOcomp);
		for (int t=0; t<1+nOcomp; ++t) {
			double sum = 0.0;
			for (int b=0; b<3; ++b) {
				assertThat(contribution[b][t]).isGreaterThanOrEqualTo(-1e-12);
				sum += contribution[b][t];
			}
			assertThat(Math.abs(sum - 1.0)).isLessThan(1e-9);
		}
		assertThat(model.getComponentLabels()[0]).isEqualTo("p_1");

		assertThat(model.getDQ2()).hasSize(4);
		for (double dq2 : model.getDQ2()) {
			if (!Double.isNaN(dq2)) assertThat(dq2).isBetween(-1.0, 1.0);
		}
		assertThat(model.getDQ2Opt()).isGreaterThan(0.0);
		assertThat(model.getQ2()).hasSize(4);
		assertThat(model.getR2YOpt()).isBetween(0.0, 1.0);
		assertThat(model.getScores().rows).isEqualTo(20);
		assertThat(model.getScores().columns).isEqualTo(1 + nOcomp);
		assertThat(model.getRVWeights()).hasSize(3);
		for (double rv : model.getRVWeights()) assertThat(rv).isBetween(0.0, 1.0);
		assertThat(model.getLoadings("block2")).hasNumberOfRows(30);
		assertThat(model.getVIP("block1").getPredictive()).hasSize(50);
		assertThat(model.hasPermutationStats()).isFalse();
		assertThat(model.isNOcompSteppedDown()).isFalse();
	}

	@Test
	public void informativeVariablesHaveHighPredictiveVIP() {
		ConsensusModel model = ConsensusOPLS.fit(TestData.scenarioBlocks(), scenarioResponse(), scenarioOptions().build());
		double[] vip = model.getVIP("block1").getPredictive();
		double signal = (vip[0] + vip[1] + vip[2]) / 3;
		double noise = 0.0;
		for (int j=3; j<vip.length; ++j) noise += vip[j];
		noise /= vip.length - 3;
		assertThat(signal).isGreaterThan(noise);
	}

	@Test
	public void mismatchedRowCountsAreRejected() {
		List<DataBlock> blocks = new ArrayList<DataBlock>(TestData.scenarioBlocks());
		blocks.set(1, new DataBlock("block2", TestData.randomMatrix(19, 30, 1L)));
		assertThatThrownBy(() -> ConsensusOPLS.fit(blocks, scenarioResponse(), scenarioOptions().build()))
			.isInstanceOf(InputValidationException.class)
			.hasMessageContaining("block2");
	}

	@Test
	public void responseValidation() {
		List<DataBlock> blocks = TestData.scenarioBlocks();
		String[] oneB = TestData.twoClassLabels(20);
		for (int i=0; i<20; ++i) oneB[i] = "A";
		oneB[7] = "B";
		assertThatThrownBy(() -> ConsensusOPLS.fit(blocks, Response.labels(oneB), scenarioOptions().build()))
			.isInstanceOf(InputValidationException.class)
			.hasMessageContaining("`B`");
		assertThatThrownBy(() -> ConsensusOPLS.fit(blocks, Response.labels(TestData.twoClassLabels(18)), scenarioOptions().build()))
			.isInstanceOf(InputValidationException.class);
		assertThatThrownBy(() -> ConsensusOPLS.fit(blocks, scenarioResponse(), scenarioOptions().modelType(ModelType.REGRESSION).build()))
			.isInstanceOf(InputValidationException.class);
		assertThatThrownBy(() -> ConsensusOPLS.fit(blocks, scenarioResponse(), scenarioOptions().maxPcomp(2).build()))
			.isInstanceOf(InputValidationException.class);
	}

	@Test
	public void duplicateBlockNamesAreRejected() {
		List<DataBlock> blocks = new ArrayList<DataBlock>(TestData.scenarioBlocks());
		blocks.set(2, new DataBlock("block1", TestData.randomMatrix(20, 10, 2L)));
		assertThatThrownBy(() -> ConsensusOPLS.fit(blocks, scenarioResponse(), scenarioOptions().build()))
			.isInstanceOf(InputValidationException.class)
			.hasMessageContaining("Duplicate");
	}

	@Test
	public void orthogonalComponentsAreClamped() {
		String[] labels = TestData.twoClassLabels(8);
		List<DataBlock> blocks = TestData.classBlocks(labels, new int[] {30, 25}, 2.0, 3L);
		FitOptions options = FitOptions.builder().maxOcomp(20).nfold(4).kernel(KernelParams.linear()).build();
		ConsensusModel model = ConsensusOPLS.fit(blocks, Response.labels(labels), options);
		assertThat(model.getMaxOcomp()).isEqualTo(7);
		assertThat(model.getQ2()).hasSize(8);
		assertThat(model.getNOcomp()).isBetween(0, 7);
	}

	@Test
	public void rankOneKernelFallsBackToNoOrthogonalComponents() {
		String[] labels = TestData.twoClassLabels(20);
		List<DataBlock> blocks = TestData.classBlocks(labels, new int[] {1}, 2.0, 13L);
		ConsensusModel model = ConsensusOPLS.fit(blocks, Response.labels(labels), scenarioOptions().build());
		assertThat(model.getMaxOcomp()).isEqualTo(1);
		assertThat(model.getNOcomp()).isZero();
		assertThat(model.isNOcompSteppedDown()).isTrue();
		assertThat(model.getSelection().getGreedyNOcomp()).isEqualTo(1);
		assertThat(model.getQ2()[1]).isNaN();
		assertThat(model.getBlockContribution()[0]).containsExactly(1.0);
		assertThat(ConsensusOPLS.predict(model, blocks).getPredictiveScores()[0]).hasSize(1);
	}

	@Test
	public void fitIsReproducible() {
		FitOptions options = scenarioOptions().cvType(CrossValidationType.MCCV).nMC(6).seed(7L).build();
		ConsensusModel first = ConsensusOPLS.fit(TestData.scenarioBlocks(), scenarioResponse(), options);
		ConsensusModel second = ConsensusOPLS.fit(TestData.scenarioBlocks(), scenarioResponse(), options.with(options.getMaxOcomp(), 4, 0));
		assertThat(second.getNOcomp()).isEqualTo(first.getNOcomp());
		assertThat(second.getQ2()).containsExactly(first.getQ2());
		assertThat(second.getDQ2()).containsExactly(first.getDQ2());
		assertThat(second.getScores().toArray()).containsExactly(first.getScores().toArray());
		assertThat(second.getBlockContribution()).isDeepEqualTo(first.getBlockContribution());
	}

	@Test
	public void permutationsLeaveTheModelUnchanged() {
		ConsensusModel plain = ConsensusOPLS.fit(TestData.scenarioBlocks(), scenarioResponse(), scenarioOptions().build());
		ConsensusModel permuted = ConsensusOPLS.fit(TestData.scenarioBlocks(), scenarioResponse(), scenarioOptions().nperm(3).numWorkers(2).build());
		assertThat(permuted.getNOcomp()).isEqualTo(plain.getNOcomp());
		assertThat(permuted.getDQ2()).containsExactly(plain.getDQ2());
		assertThat(permuted.getScores().toArray()).containsExactly(plain.getScores().toArray());
		assertThat(permuted.hasPermutationStats()).isTrue();
		assertThat(permuted.getPermutationStats().numPermutations()).isEqualTo(3);
		assertThat(permuted.getPermutationStats().getDQ2Y()[0]).isEqualTo(plain.getDQ2Opt());
	}

	@Test
	public void regressionFit() {
		double[] y = new double[24];
		List<DataBlock> blocks = TestData.regressionBlocks(24, new int[] {8, 5}, 21L, y);
		FitOptions options = FitOptions.builder().modelType(ModelType.REGRESSION).maxOcomp(2).nfold(4).kernel(KernelParams.linear()).build();
		ConsensusModel model = ConsensusOPLS.fit(blocks, Response.numeric(y), options);
		assertThat(model.getDQ2()).isNull();
		assertThat(model.getDQ2Opt()).isNaN();
		assertThat(model.getQ2Opt()).isGreaterThan(0.0);
		assertThat(model.getClassNames()).isNull();
		assertThat(model.getBlockContribution()[0][0]).isGreaterThan(model.getBlockContribution()[1][0]);
	}

	@Test
	public void balancedMonteCarloNeedsClasses() {
		double[] y = new double[12];
		List<DataBlock> blocks = TestData.regressionBlocks(12, new int[] {4}, 2L, y);
		FitOptions options = FitOptions.builder().modelType(ModelType.REGRESSION).cvType(CrossValidationType.MCCVB).maxOcomp(1).build();
		assertThatThrownBy(() -> ConsensusOPLS.fit(blocks, Response.numeric(y), options)).isInstanceOf(InputValidationException.class);

		FitOptions da = scenarioOptions().cvType(CrossValidationType.MCCVB).nMC(5).build();
		ConsensusModel model = ConsensusOPLS.fit(TestData.scenarioBlocks(), scenarioResponse(), da);
		assertThat(model.getCrossValidation().numRounds()).isEqualTo(5);
	}

}
