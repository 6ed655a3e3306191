package tberg.kopls.threading;

/**
 * Splits a total worker budget between an outer loop and a nested inner loop
 * so that outer * inner never exceeds the budget.
 */
public class WorkerAllocation {

	private final int outer;
	private final int inner;

	private WorkerAllocation(int outer, int inner) {
		this.outer = outer;
		this.inner = inner;
	}

	/**
	 * sqrt split: the inner loop gets at most sqrt of the usable workers (and
	 * never more than it has items), the outer loop gets what is left.
	 */
	public static WorkerAllocation sqrtSplit(int totalWorkers, int outerItems, int innerItems) {
		int total = Math.max(1, totalWorkers);
		int mc = Math.max(1, Math.min(outerItems * innerItems, total));
		int inner = Math.max(1, Math.min((int) Math.floor(Math.sqrt(mc)), innerItems));
		int outer = Math.max(total / inner, 1);
		return new WorkerAllocation(outer, inner);
	}

	public int outer() {
		return outer;
	}

	public int inner() {
		return inner;
	}

	public String toString() {
		return "WorkerAllocation(outer="+outer+", inner="+inner+")";
	}

}
