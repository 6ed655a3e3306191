package tberg.kopls.kernel;

import org.jblas.DoubleMatrix;

/**
 * Mean-centring of kernels in feature space. The training statistics are the
 * column sums and grand sum of the uncentred training kernel.
 */
public class KernelCentering {

	final DoubleMatrix Kcolsum;
	final double Ksum;
	final int n;

	public KernelCentering(DoubleMatrix Ktrain) {
		this.n = Ktrain.rows;
		this.Kcolsum = Ktrain.columnSums();
		this.Ksum = Kcolsum.sum();
	}

	/** (I - 11'/n) K (I - 11'/n) for the training kernel this was built from. */
	public DoubleMatrix centerTrain(DoubleMatrix Ktrain) {
		DoubleMatrix K = Ktrain.dup();
		K.addiColumnVector(Ktrain.rowSums().muli(-1.0/n));
		K.addiRowVector(Kcolsum.mul(-1.0/n));
		K.addi(Ksum/((double) n*n));
		return K;
	}

	/**
	 * (KteTr - 1 1' Ktrain / n)(I - 11'/n) for a test-by-training kernel.
	 */
	public DoubleMatrix centerTest(DoubleMatrix KteTr) {
		if (KteTr.columns != n) throw new IllegalArgumentException("Test kernel has "+KteTr.columns+" columns, training kernel has "+n);
		DoubleMatrix K = KteTr.dup();
		K.addiColumnVector(KteTr.rowSums().muli(-1.0/n));
		K.addiRowVector(Kcolsum.mul(-1.0/n));
		K.addi(Ksum/((double) n*n));
		return K;
	}

	public int numTrain() {
		return n;
	}

}
