package tberg.kopls.kernel;

import org.jblas.DoubleMatrix;
import org.jblas.MatrixFunctions;

/**
 * Gaussian kernel exp(-|x1 - x2|^2 / (2 var)).
 */
public class RBFKernelMatrixBuilder implements KernelMatrixBuilder {

	double var;

	public RBFKernelMatrixBuilder(double var) {
		this.var = var;
	}

	public DoubleMatrix build(DoubleMatrix x1, DoubleMatrix x2) {
		DoubleMatrix K = x1.mmul(x2.transpose());
		K.muli(-2.0);
		K.addiColumnVector(x1.mul(x1).rowSums());
		K.addiRowVector(x2.mul(x2).rowSums().transpose());
		// cancellation can leave tiny negative squared distances
		K.maxi(0.0);
		K.muli(-0.5 / var);
		MatrixFunctions.expi(K);
		return K;
	}

}
