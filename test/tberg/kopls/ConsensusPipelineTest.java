package tberg.kopls;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.jblas.DoubleMatrix;
import org.junit.jupiter.api.Test;

import tberg.kopls.kernel.KernelParams;
import tberg.kopls.model.ModelType;
import tberg.kopls.model.Response;
import tberg.kopls.regressor.KernelOPLSModel;

public class ConsensusPipelineTest {

	private static DoubleMatrix rankOneKernel() {
		double[][] v = new double[10][1];
		for (int i=0; i<10; ++i) v[i][0] = i * 0.7 - 2.0 + (i % 3);
		DoubleMatrix x = new DoubleMatrix(v);
		return KernelParams.linear().builder().build(x, x);
	}

	private static DoubleMatrix dummy() {
		return Response.labels(TestData.twoClassLabels(10)).encode(ModelType.DISCRIMINANT).toMatrix();
	}

	@Test
	public void exhaustedFinalFitStepsDown() {
		KernelOPLSModel model = ConsensusPipeline.fitSelected(rankOneKernel(), dummy(), 1, new double[] {0.5, 0.6, 0.7}, 2);
		assertThat(model.numOrthogonal()).isZero();
		assertThat(model.numPredictive()).isEqualTo(1);
	}

	@Test
	public void missingCurveEntriesAreSkipped() {
		String[] labels = TestData.twoClassLabels(16);
		DoubleMatrix x = TestData.classBlocks(labels, new int[] {12}, 1.5, 5L).get(0).toMatrix();
		DoubleMatrix K = KernelParams.linear().builder().build(x, x);
		DoubleMatrix Y = Response.labels(labels).encode(ModelType.DISCRIMINANT).toMatrix();
		KernelOPLSModel model = ConsensusPipeline.fitSelected(K, Y, 1, new double[] {0.2, 0.4, Double.NaN, Double.NaN}, 3);
		assertThat(model.numOrthogonal()).isEqualTo(1);
		assertThat(ConsensusPipeline.fitSelected(K, Y, 1, new double[] {0.2, 0.4, 0.5}, 2).numOrthogonal()).isEqualTo(2);
	}

	@Test
	public void predictiveFailureStillPropagates() {
		DoubleMatrix K = rankOneKernel();
		DoubleMatrix y = dummy().getColumn(0);
		assertThatThrownBy(() -> ConsensusPipeline.fitSelected(K, y, 2, new double[] {0.1}, 0)).isInstanceOf(NumericalDegeneracyException.class);
	}

}
