package tberg.kopls.kernel;

import org.jblas.DoubleMatrix;
import org.jblas.MatrixFunctions;

public class PolynomialKernelMatrixBuilder implements KernelMatrixBuilder {

	double order;
	double c;

	public PolynomialKernelMatrixBuilder(double order, double c) {
		this.order = order;
		this.c = c;
	}

	public DoubleMatrix build(DoubleMatrix x1, DoubleMatrix x2) {
		DoubleMatrix K = x1.mmul(x2.transpose());
		if (c != 0.0) K.addi(c);
		if (order == 2.0)
			K.muli(K);
		else if (order != 1.0)
			MatrixFunctions.powi(K, order);
		return K;
	}

}
