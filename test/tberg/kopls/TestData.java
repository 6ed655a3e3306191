package tberg.kopls;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import tberg.kopls.model.DataBlock;

/**
 * Synthetic multi-block data with a class or regression signal in the first
 * few variables of every block.
 */
public class TestData {

	/** 10/10 two-class split, class "B" shifted by {@code shift} in the first 3 variables of each block. */
	public static String[] twoClassLabels(int n) {
		String[] labels = new String[n];
		for (int i=0; i<n; ++i) labels[i] = i < n/2 ? "A" : "B";
		return labels;
	}

	public static List<DataBlock> classBlocks(String[] labels, int[] widths, double shift, long seed) {
		Random rand = new Random(seed);
		List<DataBlock> blocks = new ArrayList<DataBlock>();
		for (int b=0; b<widths.length; ++b) {
			double[][] x = new double[labels.length][widths[b]];
			for (int i=0; i<labels.length; ++i) {
				for (int j=0; j<widths[b]; ++j) {
					x[i][j] = rand.nextGaussian();
					if (j < 3 && labels[i].equals("B")) x[i][j] += shift;
				}
			}
			blocks.add(new DataBlock("block"+(b+1), x));
		}
		return blocks;
	}

	public static List<DataBlock> scenarioBlocks() {
		return classBlocks(twoClassLabels(20), new int[] {50, 30, 10}, 2.0, 42L);
	}

	/** Blocks plus a response y = sum of the first 2 variables of block 1 plus noise. */
	public static List<DataBlock> regressionBlocks(int n, int[] widths, long seed, double[] yOut) {
		Random rand = new Random(seed);
		List<DataBlock> blocks = new ArrayList<DataBlock>();
		for (int b=0; b<widths.length; ++b) {
			double[][] x = new double[n][widths[b]];
			for (int i=0; i<n; ++i) {
				for (int j=0; j<widths[b]; ++j) x[i][j] = rand.nextGaussian();
			}
			blocks.add(new DataBlock("block"+(b+1), x));
		}
		double[][] x1 = blocks.get(0).getValues();
		for (int i=0; i<n; ++i) yOut[i] = 2.0 * x1[i][0] - x1[i][1] + 0.1 * rand.nextGaussian();
		return blocks;
	}

	public static double[][] randomMatrix(int rows, int cols, long seed) {
		Random rand = new Random(seed);
		double[][] x = new double[rows][cols];
		for (int i=0; i<rows; ++i) {
			for (int j=0; j<cols; ++j) x[i][j] = rand.nextGaussian();
		}
		return x;
	}

}
