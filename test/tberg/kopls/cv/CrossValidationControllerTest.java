package tberg.kopls.cv;

import static org.assertj.core.api.Assertions.assertThat;

import org.jblas.DoubleMatrix;
import org.junit.jupiter.api.Test;

import tberg.kopls.TestData;
import tberg.kopls.kernel.KernelParams;
import tberg.kopls.model.ModelType;
import tberg.kopls.model.Response;

public class CrossValidationControllerTest {

	@Test
	public void heldOutPredictionsCoverEverySample() {
		String[] labels = TestData.twoClassLabels(20);
		DoubleMatrix x = TestData.classBlocks(labels, new int[] {15}, 2.0, 4L).get(0).toMatrix();
		DoubleMatrix K = KernelParams.linear().builder().build(x, x);
		DoubleMatrix Y = Response.labels(labels).encode(ModelType.DISCRIMINANT).toMatrix();
		CrossValidationResult cv = new CrossValidationController(1, 2, 3).run(K, Y, CrossValidationPartitioner.nfold(20, 5));
		assertThat(cv.getAllYhat().rows).isEqualTo(20);
		assertThat(cv.getAllYhat().columns).isEqualTo(3 * 2);
		assertThat(cv.getFailures()).isEmpty();
		assertThat(cv.getQ2Yhat()).hasSize(3);
		assertThat(cv.getQ2Yhat()[0]).isGreaterThan(0.0);
		assertThat(cv.getYhat(1).columns).isEqualTo(2);
		int[] testIndex = cv.getTestIndex();
		DoubleMatrix yTest = cv.getYTest();
		for (int r=0; r<testIndex.length; ++r) assertThat(yTest.getRow(r).toArray()).containsExactly(Y.getRow(testIndex[r]).toArray());
	}

	@Test
	public void workerCountDoesNotChangeResults() {
		String[] labels = TestData.twoClassLabels(16);
		DoubleMatrix x = TestData.classBlocks(labels, new int[] {9}, 1.0, 8L).get(0).toMatrix();
		DoubleMatrix K = KernelParams.polynomial(2).builder().build(x, x);
		DoubleMatrix Y = Response.labels(labels).encode(ModelType.DISCRIMINANT).toMatrix();
		CrossValidationSet set = CrossValidationPartitioner.nfold(16, 4);
		CrossValidationResult one = new CrossValidationController(1, 3, 1).run(K, Y, set);
		CrossValidationResult many = new CrossValidationController(1, 3, 5).run(K, Y, set);
		assertThat(many.getAllYhat().toArray()).containsExactly(one.getAllYhat().toArray());
		assertThat(many.getQ2Yhat()).containsExactly(one.getQ2Yhat());
	}

	@Test
	public void failedCellsBecomeMissingPredictions() {
		double[][] v = new double[10][1];
		for (int i=0; i<10; ++i) v[i][0] = i * 0.7 - 2.0 + (i % 3);
		DoubleMatrix x = new DoubleMatrix(v);
		DoubleMatrix K = KernelParams.linear().builder().build(x, x);
		DoubleMatrix Y = Response.labels(TestData.twoClassLabels(10)).encode(ModelType.DISCRIMINANT).toMatrix();
		CrossValidationResult cv = new CrossValidationController(1, 1, 2).run(K, Y, CrossValidationPartitioner.nfold(10, 5));
		assertThat(cv.getFailures()).hasSize(5);
		for (CellFailure f : cv.getFailures()) assertThat(f.getNumOrthogonal()).isEqualTo(1);
		assertThat(Double.isNaN(cv.getQ2Yhat()[0])).isFalse();
		assertThat(cv.getQ2Yhat()[1]).isNaN();
		for (double value : cv.getYhat(1).toArray()) assertThat(value).isNaN();
	}

}
