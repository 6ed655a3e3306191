package tberg.kopls.contribution;

import org.jblas.DoubleMatrix;

import tberg.kopls.math.m;
import tberg.kopls.regressor.KernelOPLSModel;

/**
 * VIP per block variable from the block loadings. Predictive components are
 * weighted by the response variance they explain, orthogonal components by the
 * block variance they explain.
 */
public class VariableImportance {

	public static BlockVIP[] compute(BlockContribution contribution, KernelOPLSModel model, DoubleMatrix Y) {
		int A = model.numPredictive();
		int nox = model.numOrthogonal();
		DoubleMatrix Tp = model.getPredictiveScores();
		DoubleMatrix To = model.getOrthogonalScores();
		DoubleMatrix Yc = Y.subRowVector(Y.columnMeans());

		double[] ssy = new double[A];
		for (int i=0; i<A; ++i) {
			DoubleMatrix t = Tp.getColumn(i);
			double tt = t.dot(t);
			DoubleMatrix ci = Yc.transpose().mmul(t).divi(tt);
			ssy[i] = tt * ci.dot(ci);
		}
		String[] names = contribution.getBlockNames();
		BlockVIP[] result = new BlockVIP[names.length];
		for (int b=0; b<names.length; ++b) {
			DoubleMatrix P = new DoubleMatrix(contribution.getLoadings(b));
			int p = P.rows;
			double[] sso = new double[nox];
			for (int o=0; o<nox; ++o) {
				DoubleMatrix t = To.getColumn(o);
				DoubleMatrix po = P.getColumn(A+o);
				sso[o] = t.dot(t) * po.dot(po);
			}
			double[] vipP = new double[p];
			double[] vipO = new double[p];
			double[] vipT = new double[p];
			double sumP = sum(ssy);
			double sumO = sum(sso);
			DoubleMatrix norms = m.columnSquaredNorms(P);
			for (int j=0; j<p; ++j) {
				double accP = 0.0;
				for (int i=0; i<A; ++i) accP += ssy[i] * weight(P, j, i, norms);
				double accO = 0.0;
				for (int o=0; o<nox; ++o) accO += sso[o] * weight(P, j, A+o, norms);
				vipP[j] = Math.sqrt(p * accP / sumP);
				vipO[j] = nox == 0 ? 0.0 : Math.sqrt(p * accO / sumO);
				vipT[j] = Math.sqrt(p * (accP + accO) / (sumP + sumO));
			}
			result[b] = new BlockVIP(names[b], vipP, vipO, vipT);
		}
		return result;
	}

	// squared loading of variable j in component col, normalized by the column norm
	private static double weight(DoubleMatrix P, int j, int col, DoubleMatrix norms) {
		double v = P.get(j, col);
		return v * v / norms.get(col);
	}

	private static double sum(double[] x) {
		double result = 0.0;
		for (double v : x) result += v;
		return result;
	}

}
