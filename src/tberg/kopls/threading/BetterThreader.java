package tberg.kopls.threading;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size pool of worker threads draining a shared list of function
 * arguments. Each worker owns a thread argument (typically its index) that is
 * passed to every call it makes.
 *
 * Callers write results into pre-sized containers indexed by the function
 * argument and reduce them after {@link #run()} returns, so the reduction
 * order never depends on scheduling.
 */
public class BetterThreader<A,B> {

	public static interface Function<A, B> {
		public void call(A a, B b);
	}

	boolean locked;
	Function<A,B> func;
	List<A> funcArguments;
	Thread[] pool;
	RuntimeException failure;

	public BetterThreader(Function<A,B> func, int numThreads) {
		if (numThreads < 1) throw new IllegalArgumentException("Need at least one thread, got "+numThreads);
		funcArguments = new ArrayList<A>();
		this.func = func;
		this.pool = new Thread[numThreads];
		for (int t=0; t<numThreads; ++t) {
			this.pool[t] = new ThreaderThread();
		}
		locked = false;
	}

	/**
	 * Runs every queued argument and blocks until all workers are done.
	 * An unchecked exception escaping a call stops that worker; it is re-thrown
	 * here once the remaining workers have drained the queue.
	 */
	public void run() {
		synchronized (funcArguments) {
			if (locked) throw new IllegalStateException("Better threader already ran.");
			locked = true;
		}
		if (pool.length == 1) {
			A a = null;
			B b = ((ThreaderThread) pool[0]).getArgument();
			while ((a = popWork()) != null) {
				func.call(a, b);
			}
		} else {
			for (Thread t : pool) t.start();
			for (Thread t : pool) {
				try {
					t.join();
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new IllegalStateException("Interrupted while waiting for worker "+t.getName(), e);
				}
			}
			synchronized (funcArguments) {
				if (failure != null) throw failure;
			}
		}
	}

	public int numThreads() {
		return pool.length;
	}

	public void addFunctionArgument(A a) {
		synchronized (funcArguments) {
			if (!locked) funcArguments.add(a);
			else throw new IllegalStateException("Better threader is locked.");
		}
	}

	public void setThreadArgument(int t, B b) {
		synchronized (funcArguments) {
			if (!locked) ((ThreaderThread) pool[t]).setArgument(b);
			else throw new IllegalStateException("Better threader is locked.");
		}
	}

	private A popWork() {
		synchronized (funcArguments) {
			if (funcArguments.isEmpty()) return null;
			else return funcArguments.remove(0);
		}
	}

	private class ThreaderThread extends Thread {
		B b = null;

		public B getArgument() {
			return b;
		}

		public void setArgument(B b) {
			this.b = b;
		}

		public void run() {
			A a = null;
			try {
				while ((a = popWork()) != null) {
					func.call(a, b);
				}
			} catch (RuntimeException e) {
				synchronized (funcArguments) {
					if (failure == null) failure = e;
				}
			}
		}
	}

	/**
	 * Runs {@code task} once for each index in {@code [0, count)} on
	 * {@code numThreads} workers. The thread argument is the worker index.
	 */
	public static void forEachIndex(int count, int numThreads, Function<Integer,Integer> task) {
		if (count == 0) return;
		BetterThreader<Integer,Integer> threader = new BetterThreader<Integer,Integer>(task, Math.max(1, Math.min(numThreads, count)));
		for (int t=0; t<threader.numThreads(); ++t) threader.setThreadArgument(t, t);
		for (int i=0; i<count; ++i) threader.addFunctionArgument(i);
		threader.run();
	}

}
