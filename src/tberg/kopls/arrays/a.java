package tberg.kopls.arrays;

import java.util.Arrays;
import java.util.Random;

public class a {

	public static double[] copy(double[] x) {
		return x == null ? null : Arrays.copyOf(x, x.length);
	}

	public static double[][] copy(double[][] x) {
		if (x == null) return null;
		double[][] result = new double[x.length][];
		for (int i=0; i<x.length; ++i) result[i] = copy(x[i]);
		return result;
	}

	public static int[] copy(int[] x) {
		return x == null ? null : Arrays.copyOf(x, x.length);
	}

	public static int[][] copy(int[][] x) {
		if (x == null) return null;
		int[][] result = new int[x.length][];
		for (int i=0; i<x.length; ++i) result[i] = copy(x[i]);
		return result;
	}

	public static String[] copy(String[] x) {
		return x == null ? null : Arrays.copyOf(x, x.length);
	}

	public static int[] append(int[] x, int[] y) {
		int[] result = Arrays.copyOf(x, x.length + y.length);
		System.arraycopy(y, 0, result, x.length, y.length);
		return result;
	}

	public static int[] range(int n) {
		int[] result = new int[n];
		for (int i=0; i<n; ++i) result[i] = i;
		return result;
	}

	public static int argmax(double[] x) {
		int best = 0;
		for (int i=1; i<x.length; ++i) {
			if (x[i] > x[best]) best = i;
		}
		return best;
	}

	public static double mean(double[] x) {
		double sum = 0.0;
		int count = 0;
		for (double v : x) {
			if (!Double.isNaN(v)) {
				sum += v;
				count++;
			}
		}
		return count == 0 ? Double.NaN : sum / count;
	}

	/** Fisher-Yates shuffle of 0..n-1. */
	public static int[] permutation(int n, Random rand) {
		int[] result = range(n);
		for (int i=n-1; i>0; --i) {
			int j = rand.nextInt(i+1);
			int tmp = result[i];
			result[i] = result[j];
			result[j] = tmp;
		}
		return result;
	}

	public static String toString(double[] x) {
		return Arrays.toString(x);
	}

}
