package tberg.kopls.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jblas.DoubleMatrix;

import tberg.kopls.InputValidationException;
import tberg.kopls.arrays.a;

/**
 * The response of a fit: either a numeric n x c matrix, or per-sample class
 * labels that are dummy-coded into an n x c indicator matrix with one column
 * per class.
 */
public final class Response {

	private final double[][] values;
	private final String[] labels;
	private final String[] classNames;
	private final int[] classIndex;

	private Response(double[][] values, String[] labels, String[] classNames, int[] classIndex) {
		this.values = values;
		this.labels = labels;
		this.classNames = classNames;
		this.classIndex = classIndex;
	}

	public static Response numeric(double[] y) {
		if (y == null || y.length == 0) throw new InputValidationException("Response is empty");
		double[][] values = new double[y.length][1];
		for (int i=0; i<y.length; ++i) values[i][0] = y[i];
		return numeric(values);
	}

	public static Response numeric(double[][] y) {
		if (y == null || y.length == 0) throw new InputValidationException("Response is empty");
		int cols = y[0].length;
		if (cols == 0) throw new InputValidationException("Response has no columns");
		for (int i=0; i<y.length; ++i) {
			if (y[i].length != cols) throw new InputValidationException("Response is ragged at row "+i);
			for (double v : y[i]) {
				if (Double.isNaN(v) || Double.isInfinite(v)) throw new InputValidationException("Response has a non-finite value in row "+i);
			}
		}
		return new Response(a.copy(y), null, null, null);
	}

	public static Response labels(String... labels) {
		if (labels == null || labels.length == 0) throw new InputValidationException("Response is empty");
		for (int i=0; i<labels.length; ++i) {
			if (labels[i] == null) throw new InputValidationException("Response label "+i+" is missing");
		}
		String[] classNames = sortedClasses(labels);
		int[] classIndex = new int[labels.length];
		double[][] dummy = new double[labels.length][classNames.length];
		List<String> classList = Arrays.asList(classNames);
		for (int i=0; i<labels.length; ++i) {
			classIndex[i] = classList.indexOf(labels[i]);
			dummy[i][classIndex[i]] = 1.0;
		}
		return new Response(dummy, a.copy(labels), classNames, classIndex);
	}

	public static Response labels(int... labels) {
		String[] result = new String[labels.length];
		for (int i=0; i<labels.length; ++i) result[i] = Integer.toString(labels[i]);
		return labels(result);
	}

	private static String[] sortedClasses(String[] labels) {
		Set<String> distinct = new LinkedHashSet<String>(Arrays.asList(labels));
		List<String> classes = new ArrayList<String>(distinct);
		boolean numeric = true;
		for (String c : classes) {
			try {
				Double.parseDouble(c);
			} catch (NumberFormatException e) {
				numeric = false;
				break;
			}
		}
		if (numeric) {
			Collections.sort(classes, new Comparator<String>() {
				public int compare(String c1, String c2) {
					return Double.compare(Double.parseDouble(c1), Double.parseDouble(c2));
				}
			});
		} else {
			Collections.sort(classes);
		}
		return classes.toArray(new String[0]);
	}

	/**
	 * The response as the given model type consumes it. A discriminant model
	 * turns a single numeric column into labels and reads a multi-column
	 * numeric matrix as an already dummy-coded one.
	 */
	public Response encode(ModelType modelType) {
		if (modelType == ModelType.REGRESSION) {
			if (isCategorical()) throw new InputValidationException("A categorical response needs modelType `da`");
			return this;
		}
		if (isCategorical()) return this;
		if (numColumns() == 1) {
			String[] result = new String[values.length];
			for (int i=0; i<values.length; ++i) {
				double v = values[i][0];
				result[i] = v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
			}
			return labels(result);
		}
		String[] classNames = new String[numColumns()];
		for (int j=0; j<classNames.length; ++j) classNames[j] = Integer.toString(j+1);
		int[] classIndex = new int[values.length];
		String[] result = new String[values.length];
		for (int i=0; i<values.length; ++i) {
			classIndex[i] = a.argmax(values[i]);
			result[i] = classNames[classIndex[i]];
		}
		return new Response(a.copy(values), result, classNames, classIndex);
	}

	/** Response with row i taken from row perm[i] of this one. */
	public Response permute(int[] perm) {
		if (perm.length != values.length) throw new InputValidationException("Permutation has "+perm.length+" entries for "+values.length+" samples");
		double[][] v = new double[perm.length][];
		String[] l = labels == null ? null : new String[perm.length];
		int[] c = classIndex == null ? null : new int[perm.length];
		for (int i=0; i<perm.length; ++i) {
			v[i] = a.copy(values[perm[i]]);
			if (l != null) l[i] = labels[perm[i]];
			if (c != null) c[i] = classIndex[perm[i]];
		}
		return new Response(v, l, a.copy(classNames), c);
	}

	public boolean isCategorical() {
		return classNames != null;
	}

	public int numSamples() {
		return values.length;
	}

	public int numColumns() {
		return values[0].length;
	}

	public DoubleMatrix toMatrix() {
		return new DoubleMatrix(values);
	}

	public double[][] getValues() {
		return a.copy(values);
	}

	public String[] getLabels() {
		return a.copy(labels);
	}

	public String[] getClassNames() {
		return a.copy(classNames);
	}

	public int[] getClassIndex() {
		return a.copy(classIndex);
	}

	/** Number of samples in each class, in class order. */
	public int[] classCounts() {
		if (!isCategorical()) throw new IllegalStateException("Numeric response has no classes");
		int[] counts = new int[classNames.length];
		for (int c : classIndex) counts[c]++;
		return counts;
	}

}
