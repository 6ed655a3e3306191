package tberg.kopls.kernel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.HashMap;
import java.util.Map;

import org.jblas.DoubleMatrix;
import org.junit.jupiter.api.Test;

import tberg.kopls.ConfigurationException;
import tberg.kopls.TestData;

public class KernelMatrixBuilderTest {

	private static final DoubleMatrix X = new DoubleMatrix(new double[][] {{1, 2}, {0, 1}, {3, -1}});

	@Test
	public void linearIsInnerProduct() {
		DoubleMatrix K = KernelParams.linear().builder().build(X, X);
		assertThat(K.get(0, 0)).isEqualTo(5.0);
		assertThat(K.get(0, 2)).isEqualTo(1.0);
		assertThat(K.get(1, 2)).isEqualTo(-1.0);
	}

	@Test
	public void polynomialOrderOneIsShiftedLinear() {
		DoubleMatrix lin = KernelParams.linear().builder().build(X, X);
		DoubleMatrix poly = KernelParams.polynomial(1).builder().build(X, X);
		assertThat(poly.sub(lin).sub(1.0).normmax()).isLessThan(1e-12);
		DoubleMatrix poly2 = KernelParams.polynomial(2).builder().build(X, X);
		assertThat(poly2.get(0, 2)).isCloseTo(4.0, within(1e-12));
		assertThat(poly2.get(1, 2)).isCloseTo(0.0, within(1e-12));
	}

	@Test
	public void gaussianHasUnitDiagonal() {
		double sigma = 1.5;
		DoubleMatrix K = KernelParams.gaussian(sigma).builder().build(X, X);
		for (int i=0; i<X.rows; ++i) assertThat(K.get(i, i)).isCloseTo(1.0, within(1e-12));
		double d2 = 4 + 9;
		assertThat(K.get(0, 2)).isCloseTo(Math.exp(-d2 / (2 * sigma * sigma)), within(1e-12));
		assertThat(K.sub(K.transpose()).normmax()).isLessThan(1e-12);
	}

	@Test
	public void testByTrainingShape() {
		DoubleMatrix train = new DoubleMatrix(TestData.randomMatrix(6, 4, 1L));
		DoubleMatrix test = new DoubleMatrix(TestData.randomMatrix(2, 4, 2L));
		for (KernelParams p : new KernelParams[] {KernelParams.linear(), KernelParams.polynomial(2), KernelParams.gaussian(1)}) {
			DoubleMatrix K = p.builder().build(test, train);
			assertThat(K.rows).isEqualTo(2);
			assertThat(K.columns).isEqualTo(6);
		}
	}

	@Test
	public void paramsFromTags() {
		Map<String,Double> params = new HashMap<String,Double>();
		params.put(KernelParams.ORDER, 3.0);
		params.put(KernelParams.SIGMA, 0.5);
		assertThat(KernelParams.of("l", params)).isEqualTo(KernelParams.linear());
		assertThat(KernelParams.of("p", params)).isEqualTo(KernelParams.polynomial(3));
		assertThat(KernelParams.of("g", params).getSigma()).isEqualTo(0.5);
	}

	@Test
	public void badKernelSettingsAreConfigurationErrors() {
		assertThatThrownBy(() -> KernelParams.of("x", null)).isInstanceOf(ConfigurationException.class);
		assertThatThrownBy(() -> KernelParams.of("g", new HashMap<String,Double>())).isInstanceOf(ConfigurationException.class).hasMessageContaining("sigma");
		assertThatThrownBy(() -> KernelParams.of("p", null)).isInstanceOf(ConfigurationException.class).hasMessageContaining("order");
		assertThatThrownBy(() -> KernelParams.gaussian(0)).isInstanceOf(ConfigurationException.class);
		assertThatThrownBy(() -> KernelParams.polynomial(-1)).isInstanceOf(ConfigurationException.class);
	}

	@Test
	public void centredTrainingKernelHasZeroMargins() {
		DoubleMatrix x = new DoubleMatrix(TestData.randomMatrix(7, 3, 3L));
		DoubleMatrix K = KernelParams.polynomial(2).builder().build(x, x);
		KernelCentering centering = new KernelCentering(K);
		DoubleMatrix Kc = centering.centerTrain(K);
		assertThat(Kc.rowSums().normmax()).isLessThan(1e-9);
		assertThat(Kc.columnSums().normmax()).isLessThan(1e-9);
		assertThat(centering.centerTest(K).sub(Kc).normmax()).isLessThan(1e-9);
	}

}
