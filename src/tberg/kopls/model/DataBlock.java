package tberg.kopls.model;

import org.jblas.DoubleMatrix;

import tberg.kopls.InputValidationException;
import tberg.kopls.arrays.a;

/**
 * One named data table: rows are samples, columns are variables. The values
 * are copied in and copied out.
 */
public final class DataBlock {

	private final String name;
	private final double[][] values;
	private final String[] variableNames;
	private final String[] sampleNames;

	public DataBlock(String name, double[][] values) {
		this(name, values, null, null);
	}

	public DataBlock(String name, double[][] values, String[] variableNames, String[] sampleNames) {
		if (name == null || name.isEmpty()) throw new InputValidationException("Data block needs a name");
		if (values == null || values.length == 0) throw new InputValidationException("Data block `"+name+"` has no rows");
		int cols = values[0].length;
		if (cols == 0) throw new InputValidationException("Data block `"+name+"` has no columns");
		for (int i=0; i<values.length; ++i) {
			if (values[i].length != cols) {
				throw new InputValidationException("Data block `"+name+"` is ragged: row "+i+" has "+values[i].length+" columns, expected "+cols);
			}
			for (double v : values[i]) {
				if (Double.isNaN(v) || Double.isInfinite(v)) {
					throw new InputValidationException("Data block `"+name+"` has a non-finite value in row "+i);
				}
			}
		}
		if (variableNames != null && variableNames.length != cols) {
			throw new InputValidationException("Data block `"+name+"` has "+cols+" columns but "+variableNames.length+" variable names");
		}
		if (sampleNames != null && sampleNames.length != values.length) {
			throw new InputValidationException("Data block `"+name+"` has "+values.length+" rows but "+sampleNames.length+" sample names");
		}
		this.name = name;
		this.values = a.copy(values);
		this.variableNames = a.copy(variableNames);
		this.sampleNames = a.copy(sampleNames);
	}

	public String getName() {
		return name;
	}

	public int numRows() {
		return values.length;
	}

	public int numColumns() {
		return values[0].length;
	}

	public double[][] getValues() {
		return a.copy(values);
	}

	public DoubleMatrix toMatrix() {
		return new DoubleMatrix(values);
	}

	/** Variable names, or null when the block was built without them. */
	public String[] getVariableNames() {
		return a.copy(variableNames);
	}

	/** Sample names, or null when the block was built without them. */
	public String[] getSampleNames() {
		return a.copy(sampleNames);
	}

	public String toString() {
		return "DataBlock("+name+", "+numRows()+"x"+numColumns()+")";
	}

}
