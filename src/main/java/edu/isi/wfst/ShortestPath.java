package edu.isi.wfst;

import gnu.trove.list.array.TFloatArrayList;
import gnu.trove.list.array.TIntArrayList;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.PriorityQueue;

// the best paths of an automaton, as an automaton. Needs a semiring with the path property
public class ShortestPath {

	public static VectorFst shortestPath(Fst fst) throws UnusualConditionException {
		return shortestPath(fst, new ShortestPathConfig());
	}

	public static VectorFst shortestPath(Fst fst, ShortestPathConfig config) throws UnusualConditionException {
		if (!fst.getSemiring().hasPathProperty())
			throw new UnusualConditionException("Shortest path needs a semiring with the path property, not "+
					fst.getSemiring().getName());
		if (config.getNShortest() <= 0) {
			VectorFst out = new VectorFst(fst.getSemiring());
			out.setSymbols(fst);
			return out;
		}
		if (config.getNShortest() == 1)
			return singleShortestPath(fst, config.getDelta());
		Fst src = fst;
		if (config.isUnique())
			src = uniqueStrings(fst, config.getDelta());
		return nShortestPath(src, config.getNShortest(), config.getDelta());
	}

	// best path found by a shortest first search, then read back from the final state it ends at.
	// Of equally good paths the first one found is kept
	private static VectorFst singleShortestPath(Fst fst, float delta) {
		boolean debug = false;
		Semiring sr = fst.getSemiring();
		VectorFst out = new VectorFst(sr);
		out.setSymbols(fst);
		int start = fst.start();
		if (start == Fst.NO_STATE_ID)
			return out;
		int n = fst.numStates();
		float[] distance = new float[n];
		// state and transition position each state was best reached through
		int[] parent = new int[n];
		int[] parentTr = new int[n];
		boolean[] enqueued = new boolean[n];
		for (int s = 0; s < n; s++) {
			distance[s] = sr.ZERO();
			parent[s] = Fst.NO_STATE_ID;
		}
		StateQueue queue = ShortestDistance.makeQueue(fst, TrFilter.ANY, QueueType.AUTO, distance);
		distance[start] = sr.ONE();
		queue.enqueue(start);
		enqueued[start] = true;
		int fParent = Fst.NO_STATE_ID;
		float fDistance = sr.ZERO();
		while (!queue.isEmpty()) {
			int s = queue.dequeue();
			enqueued[s] = false;
			float sd = distance[s];
			if (fst.hasFinal(s)) {
				float plus = sr.plus(fDistance, sr.times(sd, fst.finalOf(s)));
				if (!sr.approxEqual(plus, fDistance, delta)) {
					fDistance = plus;
					fParent = s;
				}
			}
			int pos = 0;
			for (Tr tr : fst.trsOf(s)) {
				int t = tr.nextstate;
				float nd = sr.plus(distance[t], sr.times(sd, tr.weight));
				if (!sr.approxEqual(nd, distance[t], delta)) {
					distance[t] = nd;
					parent[t] = s;
					parentTr[t] = pos;
					if (!enqueued[t]) {
						queue.enqueue(t);
						enqueued[t] = true;
					}
					else
						queue.update(t);
				}
				pos++;
			}
		}
		if (fParent == Fst.NO_STATE_ID)
			return out;
		// walk back to the start, then lay the path out from state 0
		TIntArrayList states = new TIntArrayList();
		for (int s = fParent; s != start; s = parent[s])
			states.add(s);
		states.add(start);
		states.reverse();
		out.addStates(states.size());
		out.setStartInternal(0);
		for (int i = 1; i < states.size(); i++) {
			int s = states.get(i);
			Tr tr = fst.trsOf(parent[s]).get(parentTr[s]);
			out.addTrInternal(i-1, tr.withNextstate(i));
		}
		out.setFinalInternal(states.size()-1, fst.finalOf(fParent));
		if (debug) Debug.debug(debug, "Best path has "+(states.size()-1)+" transitions and weight "+fDistance);
		return out;
	}

	// label-distinct version: epsilons removed, then determinized with labels encoded as pairs
	private static Fst uniqueStrings(Fst fst, float delta) throws UnusualConditionException {
		VectorFst copy = new VectorFst(fst);
		RmEpsilon.rmEpsilon(copy);
		EncodeTable table = Encode.encode(copy, EnumSet.of(EncodeType.ENCODE_LABELS));
		VectorFst det = Determinize.determinize(copy, new DeterminizeConfig(DeterminizeType.FUNCTIONAL, delta));
		Encode.decode(det, table);
		return det;
	}

	/**
	 * n best paths by best first search over the reversed automaton, from the finals back
	 * to the start, with the forward shortest distance as the (exact) heuristic. Each popped
	 * search node becomes an output state with one transition toward the finals, so the
	 * output holds the n paths as a tree hanging off the final state, entered from a new
	 * start through epsilon transitions.
	 */
	private static VectorFst nShortestPath(Fst fst, int nshortest, float delta) {
		boolean debug = false;
		final Semiring sr = fst.getSemiring();
		VectorFst out = new VectorFst(sr);
		out.setSymbols(fst);
		if (fst.start() == Fst.NO_STATE_ID)
			return out;
		float[] fdist = ShortestDistance.shortestDistance(fst, false, delta);
		VectorFst rfst = Reverse.reverse(fst);
		// distance of reversed state r is that of original state r-1; state 0 gets the total
		float total = sr.ZERO();
		for (Tr rtr : rfst.trsOf(0))
			total = sr.plus(total, sr.times(sr.reverse(rtr.weight), fdist[rtr.nextstate-1]));
		final float[] distance = new float[fdist.length+1];
		distance[0] = total;
		System.arraycopy(fdist, 0, distance, 1, fdist.length);

		// search node of each output state: reversed state (NO_STATE_ID once the path is
		// complete) and weight from the finals so far
		final TIntArrayList pairState = new TIntArrayList();
		final TFloatArrayList pairWeight = new TFloatArrayList();
		final float d = delta;
		Comparator<Integer> order = new Comparator<Integer>() {
			public int compare(Integer x, Integer y) {
				int px = pairState.get(x);
				int py = pairState.get(y);
				float wx = sr.times(px == Fst.NO_STATE_ID ? sr.ONE() : distance[px], pairWeight.get(x));
				float wy = sr.times(py == Fst.NO_STATE_ID ? sr.ONE() : distance[py], pairWeight.get(y));
				boolean close = sr.approxEqual(wx, wy, d);
				// complete paths lose close calls, so inexact weights can't reorder them
				if (px == Fst.NO_STATE_ID && py != Fst.NO_STATE_ID && close)
					return 1;
				if (py == Fst.NO_STATE_ID && px != Fst.NO_STATE_ID && close)
					return -1;
				if (sr.better(wx, wy))
					return -1;
				if (sr.better(wy, wx))
					return 1;
				return Integer.compare(x, y);
			}
		};
		PriorityQueue<Integer> heap = new PriorityQueue<Integer>(11, order);

		int ostart = out.addState();
		out.setStartInternal(ostart);
		int finalState = out.addState();
		out.setFinalInternal(finalState, sr.ONE());
		pairState.add(Fst.NO_STATE_ID);
		pairWeight.add(sr.ZERO());
		pairState.add(rfst.start());
		pairWeight.add(sr.ONE());
		heap.add(finalState);
		// times each reversed state has been popped; slot 0 counts complete paths
		int[] popped = new int[rfst.numStates()+1];
		while (!heap.isEmpty()) {
			int state = heap.poll();
			int ps = pairState.get(state);
			float pw = pairWeight.get(state);
			popped[ps+1]++;
			if (ps == Fst.NO_STATE_ID) {
				out.addTrInternal(ostart, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, sr.ONE(), state));
				if (popped[0] == nshortest)
					break;
				continue;
			}
			if (popped[ps+1] > nshortest)
				continue;
			for (Tr rtr : rfst.trsOf(ps)) {
				float w = sr.reverse(rtr.weight);
				int next = out.addState();
				pairState.add(rtr.nextstate);
				pairWeight.add(sr.times(pw, w));
				out.addTrInternal(next, new Tr(rtr.ilabel, rtr.olabel, w, state));
				heap.add(next);
			}
			float fw = sr.reverse(rfst.finalOf(ps));
			if (!sr.isZero(fw)) {
				int next = out.addState();
				pairState.add(Fst.NO_STATE_ID);
				pairWeight.add(sr.times(pw, fw));
				out.addTrInternal(next, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, fw, state));
				heap.add(next);
			}
		}
		if (debug) Debug.debug(debug, "Found "+popped[0]+" of "+nshortest+" paths using "+out.numStates()+" states");
		return Connect.connect(out);
	}
}
