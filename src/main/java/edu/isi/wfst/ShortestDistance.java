package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

/**
 * Single source shortest distance over any of the semirings, by generic relaxation:
 * each queued state passes the weight it received since it was last visited on to
 * its successors, until no distance changes by more than delta.
 * <p>
 * One instance can be run from several sources in turn; only the states touched by
 * the previous run are reset.
 */
public class ShortestDistance {
	private final Fst fst;
	private final Semiring sr;
	private final TrFilter filter;
	private final float delta;
	private final StateQueue queue;
	private final float[] distance;
	// weight added to a state's distance since it was last dequeued
	private final float[] residual;
	private final boolean[] enqueued;
	private final TIntArrayList touched;

	ShortestDistance(Fst fst, TrFilter filter, QueueType qtype, float delta) {
		this.fst = fst;
		this.sr = fst.getSemiring();
		this.filter = filter;
		this.delta = delta;
		int n = fst.numStates();
		distance = new float[n];
		residual = new float[n];
		enqueued = new boolean[n];
		for (int s = 0; s < n; s++)
			distance[s] = residual[s] = sr.ZERO();
		touched = new TIntArrayList();
		queue = makeQueue(fst, filter, qtype, distance);
	}

	static StateQueue makeQueue(Fst fst, TrFilter filter, QueueType qtype, float[] distance) {
		boolean debug = false;
		if (qtype == QueueType.AUTO || qtype == QueueType.TOP_ORDER) {
			Scc scc = Scc.compute(fst, filter);
			if (!scc.cyclic) {
				if (debug) Debug.debug(debug, "Using top order queue");
				return new TopOrderQueue(scc.scc);
			}
			if (qtype == QueueType.TOP_ORDER)
				throw new IllegalArgumentException("Top order queue requested for a cyclic automaton");
			qtype = fst.getSemiring().hasPathProperty() ? QueueType.SHORTEST_FIRST : QueueType.FIFO;
		}
		if (debug) Debug.debug(debug, "Using "+qtype+" queue");
		switch (qtype) {
		case SHORTEST_FIRST:
			return new ShortestFirstQueue(distance);
		case LIFO:
			return new LifoQueue();
		default:
			return new FifoQueue();
		}
	}

	// distances from source; the array is reused by the next run
	float[] compute(int source) {
		for (int i = 0; i < touched.size(); i++) {
			int s = touched.get(i);
			distance[s] = residual[s] = sr.ZERO();
			enqueued[s] = false;
		}
		touched.resetQuick();
		queue.clear();
		if (source == Fst.NO_STATE_ID)
			return distance;
		distance[source] = residual[source] = sr.ONE();
		touched.add(source);
		queue.enqueue(source);
		enqueued[source] = true;
		while (!queue.isEmpty()) {
			int s = queue.dequeue();
			enqueued[s] = false;
			float r = residual[s];
			residual[s] = sr.ZERO();
			for (Tr tr : fst.trsOf(s)) {
				if (!filter.accept(tr))
					continue;
				int t = tr.nextstate;
				float w = sr.times(r, tr.weight);
				float nd = sr.plus(distance[t], w);
				if (sr.isZero(distance[t]) && sr.isZero(residual[t]))
					touched.add(t);
				if (!sr.approxEqual(distance[t], nd, delta)) {
					distance[t] = nd;
					residual[t] = sr.plus(residual[t], w);
					if (!enqueued[t]) {
						queue.enqueue(t);
						enqueued[t] = true;
					}
					else
						queue.update(t);
				}
			}
		}
		return distance;
	}

	public static float[] shortestDistance(Fst fst) {
		return shortestDistance(fst, false, Semiring.KSHORTESTDELTA);
	}
	public static float[] shortestDistance(Fst fst, boolean reverse) {
		return shortestDistance(fst, reverse, Semiring.KSHORTESTDELTA);
	}

	// from the start to every state, or, reversed, from every state to the finals.
	// Unreachable states get ZERO
	public static float[] shortestDistance(Fst fst, boolean reverse, float delta) {
		if (!reverse)
			return new ShortestDistance(fst, TrFilter.ANY, QueueType.AUTO, delta).compute(fst.start()).clone();
		float[] ret = new float[fst.numStates()];
		for (int s = 0; s < ret.length; s++)
			ret[s] = fst.getSemiring().ZERO();
		if (fst.start() == Fst.NO_STATE_ID)
			return ret;
		VectorFst rfst = Reverse.reverse(fst);
		float[] rdist = new ShortestDistance(rfst, TrFilter.ANY, QueueType.AUTO, delta).compute(rfst.start());
		// state s of the original is state s+1 of the reversal
		for (int s = 0; s < ret.length; s++)
			ret[s] = fst.getSemiring().reverse(rdist[s+1]);
		return ret;
	}

	// weight of all accepting paths together
	public static float shortestDistanceTotal(Fst fst) {
		Semiring sr = fst.getSemiring();
		float[] d = shortestDistance(fst);
		float tot = sr.ZERO();
		for (int s = 0; s < d.length; s++)
			tot = sr.plus(tot, sr.times(d[s], fst.finalOf(s)));
		return tot;
	}
}
