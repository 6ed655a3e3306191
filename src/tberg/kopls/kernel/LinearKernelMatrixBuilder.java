package tberg.kopls.kernel;

import org.jblas.DoubleMatrix;

public class LinearKernelMatrixBuilder implements KernelMatrixBuilder {

	public DoubleMatrix build(DoubleMatrix x1, DoubleMatrix x2) {
		return x1.mmul(x2.transpose());
	}

}
