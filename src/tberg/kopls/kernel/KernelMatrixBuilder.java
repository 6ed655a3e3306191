package tberg.kopls.kernel;

import org.jblas.DoubleMatrix;

public interface KernelMatrixBuilder {

	/**
	 * Kernel between the rows of x1 and the rows of x2: a x1.rows by x2.rows
	 * matrix. Neither argument is modified.
	 */
	public DoubleMatrix build(DoubleMatrix x1, DoubleMatrix x2);

}
