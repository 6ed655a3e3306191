package tberg.kopls.contribution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;

import org.jblas.DoubleMatrix;
import org.junit.jupiter.api.Test;

import tberg.kopls.TestData;
import tberg.kopls.fusion.BlockFusion;
import tberg.kopls.fusion.FusionResult;
import tberg.kopls.kernel.KernelParams;
import tberg.kopls.model.DataBlock;
import tberg.kopls.model.ModelType;
import tberg.kopls.model.Response;
import tberg.kopls.regressor.KernelOPLSModel;
import tberg.kopls.regressor.KernelOPLSRegressor;

public class ContributionDecomposerTest {

	@Test
	public void contributionsSumToOnePerComponent() {
		List<DataBlock> blocks = TestData.scenarioBlocks();
		DoubleMatrix Y = Response.labels(TestData.twoClassLabels(20)).encode(ModelType.DISCRIMINANT).toMatrix();
		FusionResult fusion = new BlockFusion(KernelParams.linear(), 1).fuse(blocks, Y);
		KernelOPLSModel model = new KernelOPLSRegressor(1, 2).train(fusion.getFusedKernel(), Y);
		BlockContribution contribution = new ContributionDecomposer(2).decompose(blocks, fusion, model);

		assertThat(contribution.getComponentLabels()).containsExactly("p_1", "o_1", "o_2");
		double[][] c = contribution.getContribution();
		for (int t=0; t<3; ++t) assertThat(c[0][t] + c[1][t] + c[2][t]).isCloseTo(1.0, within(1e-9));
		assertThat(contribution.getLoadings(0)).hasNumberOfRows(50);
		assertThat(contribution.getLoadings(0)[0]).hasSize(3);

		BlockVIP[] vip = VariableImportance.compute(contribution, model, Y);
		assertThat(vip).hasSize(3);
		assertThat(vip[2].getTotal()).hasSize(10);
		for (BlockVIP v : vip) {
			double sumSq = 0.0;
			for (double x : v.getPredictive()) sumSq += x * x;
			// mean squared VIP is one
			assertThat(sumSq / v.getPredictive().length).isCloseTo(1.0, within(1e-9));
		}
	}

	@Test
	public void noisyBlockContributesLittleToPredictiveComponent() {
		String[] labels = TestData.twoClassLabels(20);
		List<DataBlock> blocks = new ArrayList<DataBlock>(TestData.classBlocks(labels, new int[] {20}, 3.0, 6L));
		blocks.add(new DataBlock("noise", TestData.randomMatrix(20, 20, 77L)));
		DoubleMatrix Y = Response.labels(labels).encode(ModelType.DISCRIMINANT).toMatrix();
		FusionResult fusion = new BlockFusion(KernelParams.linear(), 1).fuse(blocks, Y);
		KernelOPLSModel model = new KernelOPLSRegressor(1, 0).train(fusion.getFusedKernel(), Y);
		double[][] c = new ContributionDecomposer(1).decompose(blocks, fusion, model).getContribution();
		assertThat(c[0][0]).isGreaterThan(c[1][0]);
		assertThat(ContributionDecomposer.scores(model).columns).isEqualTo(1);
	}

}
