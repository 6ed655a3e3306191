package tberg.kopls.regressor;

import java.util.ArrayList;
import java.util.List;

import org.jblas.DoubleMatrix;
import org.jblas.Singular;
import org.jblas.Solve;
import org.jblas.exceptions.LapackException;

import tberg.kopls.ConvergenceException;
import tberg.kopls.NumericalDegeneracyException;
import tberg.kopls.kernel.KernelCentering;
import tberg.kopls.math.m;

/**
 * Kernel OPLS (Rantalainen et al., J. Chemometrics 2007). Extracts A
 * predictive components and nox Y-orthogonal components from a training kernel,
 * deflating the kernel by each orthogonal score before the next step.
 */
public class KernelOPLSRegressor {

	public static final double DEFAULT_TOL = 1e-12;

	int numPredictive;
	int numOrthogonal;
	boolean centerKernel;
	boolean centerResponse;
	double tol;

	public KernelOPLSRegressor(int numPredictive, int numOrthogonal) {
		this(numPredictive, numOrthogonal, true, true, DEFAULT_TOL);
	}

	public KernelOPLSRegressor(int numPredictive, int numOrthogonal, boolean centerKernel, boolean centerResponse, double tol) {
		if (numPredictive < 1) throw new IllegalArgumentException("Need at least one predictive component, got "+numPredictive);
		if (numOrthogonal < 0) throw new IllegalArgumentException("Negative orthogonal component count "+numOrthogonal);
		this.numPredictive = numPredictive;
		this.numOrthogonal = numOrthogonal;
		this.centerKernel = centerKernel;
		this.centerResponse = centerResponse;
		this.tol = tol;
	}

	/**
	 * @param Kraw n x n training kernel, uncentred
	 * @param Yraw n x c training response, uncentred
	 */
	public KernelOPLSModel train(DoubleMatrix Kraw, DoubleMatrix Yraw) {
		int n = Kraw.rows;
		if (Kraw.columns != n) throw new IllegalArgumentException("Kernel must be square, got "+Kraw.rows+"x"+Kraw.columns);
		if (Yraw.rows != n) throw new IllegalArgumentException("Kernel has "+n+" rows, response has "+Yraw.rows);
		int A = numPredictive;
		int c = Yraw.columns;
		if (A > c) throw new NumericalDegeneracyException("Cannot extract "+A+" predictive components from a "+c+"-column response");

		KernelCentering centering = centerKernel ? new KernelCentering(Kraw) : null;
		DoubleMatrix K = centering != null ? centering.centerTrain(Kraw) : Kraw.dup();
		DoubleMatrix yMean = centerResponse ? Yraw.columnMeans() : DoubleMatrix.zeros(1, c);
		DoubleMatrix Y = Yraw.subRowVector(yMean);

		DoubleMatrix YKY = Y.transpose().mmul(K).mmul(Y);
		DoubleMatrix[] usv = svd(YKY);
		DoubleMatrix Cp = usv[0].getRange(0, c, 0, A);
		DoubleMatrix Sp = usv[1].getRange(0, A, 0, 1);
		double spMax = Sp.get(0);
		for (int a=0; a<A; ++a) {
			if (!(Sp.get(a) > tol * spMax) || !(spMax > 0.0)) {
				throw new NumericalDegeneracyException("Y'KY has rank below "+A+"; predictive component "+(a+1)+" has singular value "+Sp.get(a));
			}
		}
		DoubleMatrix Up = Y.mmul(Cp);
		DoubleMatrix SpInvSqrt = DoubleMatrix.zeros(A, A);
		for (int a=0; a<A; ++a) SpInvSqrt.put(a, a, 1.0 / Math.sqrt(Sp.get(a)));
		DoubleMatrix W = Up.mmul(SpInvSqrt);

		double ssTotK = m.trace(K);
		double ssTotY = m.sumSquares(Y);

		List<DoubleMatrix> Tp = new ArrayList<DoubleMatrix>();
		List<DoubleMatrix> Bt = new ArrayList<DoubleMatrix>();
		List<DoubleMatrix> K1 = new ArrayList<DoubleMatrix>();
		List<DoubleMatrix> KK = new ArrayList<DoubleMatrix>();
		List<DoubleMatrix> co = new ArrayList<DoubleMatrix>();
		double[] so = new double[numOrthogonal];
		double[] toNorm = new double[numOrthogonal];
		DoubleMatrix To = DoubleMatrix.zeros(n, numOrthogonal);

		DoubleMatrix K1i = K;
		DoubleMatrix Kii = K;
		for (int i=0; i<numOrthogonal; ++i) {
			K1.add(K1i);
			KK.add(Kii);
			DoubleMatrix Tpi = K1i.transpose().mmul(W);
			Tp.add(Tpi);
			Bt.add(regress(Tpi, Y));

			DoubleMatrix E = Kii.sub(Tpi.mmul(Tpi.transpose()));
			DoubleMatrix ETp = E.mmul(Tpi);
			DoubleMatrix[] csv = svd(Tpi.transpose().mmul(ETp));
			double soi = csv[1].get(0);
			if (!(soi > tol * ssTotK * ssTotK)) {
				throw new ConvergenceException(i+1, "Orthogonal component "+(i+1)+" has no variance left (so="+soi+")");
			}
			DoubleMatrix coi = csv[0].getColumn(0);
			DoubleMatrix toi = ETp.mmul(coi).muli(1.0 / Math.sqrt(soi));
			double norm = toi.norm2();
			if (!(norm > Math.sqrt(tol * Math.abs(ssTotK))) || Double.isInfinite(norm)) {
				throw new ConvergenceException(i+1, "Orthogonal score "+(i+1)+" has near-zero norm "+norm);
			}
			toi.divi(norm);
			co.add(coi);
			so[i] = soi;
			toNorm[i] = norm;
			To.putColumn(i, toi);

			DoubleMatrix D = m.deflator(toi);
			K1i = K1i.mmul(D);
			Kii = D.mmul(Kii).mmul(D);
		}
		K1.add(K1i);
		KK.add(Kii);
		DoubleMatrix TpLast = K1i.transpose().mmul(W);
		Tp.add(TpLast);
		Bt.add(regress(TpLast, Y));

		double[] R2X = new double[numOrthogonal+1];
		double[] R2XO = new double[numOrthogonal+1];
		double[] R2XC = new double[numOrthogonal+1];
		double[] R2Yhat = new double[numOrthogonal+1];
		for (int i=0; i<=numOrthogonal; ++i) {
			DoubleMatrix TT = Tp.get(i).mmul(Tp.get(i).transpose());
			R2X[i] = 1.0 - m.trace(KK.get(i).sub(TT)) / ssTotK;
			R2XC[i] = 1.0 - m.trace(K.sub(TT)) / ssTotK;
			R2XO[i] = 1.0 - m.trace(KK.get(i)) / ssTotK;
			DoubleMatrix resid = Tp.get(i).mmul(Bt.get(i)).subi(Y);
			R2Yhat[i] = 1.0 - m.sumSquares(resid) / ssTotY;
		}
		DoubleMatrix F = Y.sub(Up.mmul(Cp.transpose()));
		double R2Y = 1.0 - m.sumSquares(F) / ssTotY;

		return new KernelOPLSModel(A, numOrthogonal, centering, yMean, Cp, Sp, Up, W, Tp, Bt, K1, KK, co, so, toNorm, To, ssTotK, ssTotY, R2X, R2XO, R2XC, R2Y, R2Yhat);
	}

	/** (T'T)^-1 T'Y */
	static DoubleMatrix regress(DoubleMatrix T, DoubleMatrix Y) {
		DoubleMatrix result;
		try {
			result = Solve.solve(T.transpose().mmul(T), T.transpose().mmul(Y));
		} catch (LapackException e) {
			throw new NumericalDegeneracyException("Score cross-product T'T is singular", e);
		}
		if (!m.isFinite(result)) throw new NumericalDegeneracyException("Score cross-product T'T is singular");
		return result;
	}

	static DoubleMatrix[] svd(DoubleMatrix x) {
		if (!m.isFinite(x)) throw new NumericalDegeneracyException("Non-finite values in kernel cross-product");
		try {
			return Singular.fullSVD(x);
		} catch (LapackException e) {
			throw new NumericalDegeneracyException("SVD failed on a "+x.rows+"x"+x.columns+" cross-product", e);
		}
	}

	public int numPredictive() {
		return numPredictive;
	}

	public int numOrthogonal() {
		return numOrthogonal;
	}

}
