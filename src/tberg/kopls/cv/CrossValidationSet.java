package tberg.kopls.cv;

import tberg.kopls.arrays.a;

/**
 * Ordered (training, test) index pairs, one per cross-validation round.
 */
public final class CrossValidationSet {

	private final CrossValidationType type;
	private final int numSamples;
	private final int[][] trainingIndex;
	private final int[][] testIndex;

	public CrossValidationSet(CrossValidationType type, int numSamples, int[][] trainingIndex, int[][] testIndex) {
		if (trainingIndex.length != testIndex.length) throw new IllegalArgumentException("Training and test round counts differ");
		this.type = type;
		this.numSamples = numSamples;
		this.trainingIndex = a.copy(trainingIndex);
		this.testIndex = a.copy(testIndex);
	}

	public CrossValidationType getType() {
		return type;
	}

	public int numSamples() {
		return numSamples;
	}

	public int numRounds() {
		return testIndex.length;
	}

	public int[] getTrainingIndex(int round) {
		return a.copy(trainingIndex[round]);
	}

	public int[] getTestIndex(int round) {
		return a.copy(testIndex[round]);
	}

	/** Test indices of all rounds, concatenated in round order. */
	public int[] getConcatenatedTestIndex() {
		int[] result = new int[0];
		for (int[] test : testIndex) result = a.append(result, test);
		return result;
	}

}
