package tberg.kopls.cv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import tberg.kopls.InputValidationException;
import tberg.kopls.arrays.a;

/**
 * Generates the rounds of a cross-validation scheme. Random schemes draw every
 * split from the given generator, in round order.
 */
public class CrossValidationPartitioner {

	public static CrossValidationSet nfold(int numSamples, int nfold) {
		if (nfold < 2 || nfold > numSamples) {
			throw new InputValidationException("nfold must be between 2 and the sample count "+numSamples+", got "+nfold);
		}
		int[][] train = new int[nfold][];
		int[][] test = new int[nfold][];
		for (int r=0; r<nfold; ++r) {
			List<Integer> tr = new ArrayList<Integer>();
			List<Integer> te = new ArrayList<Integer>();
			for (int i=0; i<numSamples; ++i) {
				if (i % nfold == r) te.add(i);
				else tr.add(i);
			}
			train[r] = toArray(tr);
			test[r] = toArray(te);
		}
		return new CrossValidationSet(CrossValidationType.NFOLD, numSamples, train, test);
	}

	public static CrossValidationSet mccv(int numSamples, int nMC, double cvFrac, Random rand) {
		checkRounds(nMC);
		int nmod = trainingSize(numSamples, cvFrac);
		if (nmod < 1 || nmod >= numSamples) {
			throw new InputValidationException("cvFrac "+cvFrac+" leaves no training or no test samples out of "+numSamples);
		}
		int[][] train = new int[nMC][];
		int[][] test = new int[nMC][];
		for (int r=0; r<nMC; ++r) {
			int[] perm = a.permutation(numSamples, rand);
			train[r] = Arrays.copyOfRange(perm, 0, nmod);
			test[r] = Arrays.copyOfRange(perm, nmod, numSamples);
		}
		return new CrossValidationSet(CrossValidationType.MCCV, numSamples, train, test);
	}

	/**
	 * @param classIndex class of every sample, 0..numClasses-1
	 */
	public static CrossValidationSet mccvb(int[] classIndex, int numClasses, int nMC, double cvFrac, Random rand) {
		checkRounds(nMC);
		int numSamples = classIndex.length;
		List<List<Integer>> members = new ArrayList<List<Integer>>();
		for (int c=0; c<numClasses; ++c) members.add(new ArrayList<Integer>());
		for (int i=0; i<numSamples; ++i) members.get(classIndex[i]).add(i);

		int[][] train = new int[nMC][];
		int[][] test = new int[nMC][];
		for (int r=0; r<nMC; ++r) {
			List<Integer> tr = new ArrayList<Integer>();
			List<Integer> te = new ArrayList<Integer>();
			for (List<Integer> cls : members) {
				if (cls.isEmpty()) continue;
				int nmod = trainingSize(cls.size(), cvFrac);
				int[] perm = a.permutation(cls.size(), rand);
				for (int i=0; i<perm.length; ++i) {
					if (i < nmod) tr.add(cls.get(perm[i]));
					else te.add(cls.get(perm[i]));
				}
			}
			if (tr.isEmpty() || te.isEmpty()) {
				throw new InputValidationException("cvFrac "+cvFrac+" leaves no training or no test samples in a class-balanced split");
			}
			train[r] = toArray(tr);
			test[r] = toArray(te);
		}
		return new CrossValidationSet(CrossValidationType.MCCVB, numSamples, train, test);
	}

	// training size rounds half to even
	static int trainingSize(int n, double cvFrac) {
		if (!(cvFrac > 0.0 && cvFrac < 1.0)) throw new InputValidationException("cvFrac must be in (0, 1), got "+cvFrac);
		return (int) Math.rint(cvFrac * n);
	}

	private static void checkRounds(int nMC) {
		if (nMC < 1) throw new InputValidationException("nMC must be positive, got "+nMC);
	}

	private static int[] toArray(List<Integer> list) {
		int[] result = new int[list.size()];
		for (int i=0; i<result.length; ++i) result[i] = list.get(i);
		return result;
	}

}
