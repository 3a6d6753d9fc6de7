package edu.isi.wfst;

import gnu.trove.map.hash.TObjectIntHashMap;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.ArrayList;
import java.util.Arrays;

// removes transitions whose input and output labels are both epsilon
public class RmEpsilon {

	// labels and destination of a transition produced by the expansion
	private static class TrKey {
		final int ilabel;
		final int olabel;
		final int nextstate;
		TrKey(Tr tr) {
			ilabel = tr.ilabel;
			olabel = tr.olabel;
			nextstate = tr.nextstate;
		}
		public boolean equals(Object o) {
			if (!(o instanceof TrKey))
				return false;
			TrKey k = (TrKey)o;
			return ilabel == k.ilabel && olabel == k.olabel && nextstate == k.nextstate;
		}
		public int hashCode() {
			return (ilabel*31 + olabel)*31 + nextstate;
		}
	}

	// in place. Every kept state gets the non-epsilon transitions and the final weights of its
	// epsilon closure, weighted by the closure distance; states entered only by epsilons disappear
	public static VectorFst rmEpsilon(VectorFst fst) {
		boolean debug = false;
		int start = fst.start();
		if (start == Fst.NO_STATE_ID)
			return fst;
		Semiring sr = fst.getSemiring();
		int n = fst.numStates();
		// states with a non-epsilon incoming transition, and the start
		boolean[] nonEpsIn = new boolean[n];
		nonEpsIn[start] = true;
		for (int s = 0; s < n; s++)
			for (Tr tr : fst.trsOf(s))
				if (!tr.isEpsilon())
					nonEpsIn[tr.nextstate] = true;

		ShortestDistance closure = new ShortestDistance(fst, TrFilter.EPSILON, QueueType.AUTO, Semiring.KSHORTESTDELTA);
		ArrayList<ArrayList<Tr>> newTrs = new ArrayList<ArrayList<Tr>>(n);
		for (int s = 0; s < n; s++)
			newTrs.add(null);
		float[] newFinals = new float[n];
		Arrays.fill(newFinals, sr.ZERO());
		boolean[] visited = new boolean[n];
		TIntArrayStack todo = new TIntArrayStack();
		TIntArrayStack seen = new TIntArrayStack();
		TObjectIntHashMap<TrKey> position = new TObjectIntHashMap<TrKey>();
		for (int source = 0; source < n; source++) {
			if (!nonEpsIn[source])
				continue;
			float[] d = closure.compute(source);
			ArrayList<Tr> trs = new ArrayList<Tr>();
			float fw = sr.ZERO();
			position.clear();
			todo.push(source);
			while (todo.size() > 0) {
				int s = todo.pop();
				if (visited[s])
					continue;
				visited[s] = true;
				seen.push(s);
				for (Tr tr : fst.trsOf(s)) {
					if (tr.isEpsilon()) {
						if (!visited[tr.nextstate])
							todo.push(tr.nextstate);
						continue;
					}
					Tr wtr = tr.withWeight(sr.times(d[s], tr.weight));
					TrKey key = new TrKey(wtr);
					if (position.containsKey(key)) {
						int p = position.get(key);
						Tr old = trs.get(p);
						trs.set(p, old.withWeight(sr.plus(old.weight, wtr.weight)));
					}
					else {
						position.put(key, trs.size());
						trs.add(wtr);
					}
				}
				fw = sr.plus(fw, sr.times(d[s], fst.finalOf(s)));
			}
			while (seen.size() > 0)
				visited[seen.pop()] = false;
			// closure order is depth first; applied back to front
			ArrayList<Tr> rev = new ArrayList<Tr>(trs.size());
			for (int i = trs.size()-1; i >= 0; i--)
				rev.add(trs.get(i));
			newTrs.set(source, rev);
			newFinals[source] = fw;
		}
		for (int s = 0; s < n; s++) {
			if (nonEpsIn[s]) {
				fst.setTrsInternal(s, newTrs.get(s));
				fst.setFinalInternal(s, newFinals[s]);
			}
			else
				fst.setTrsInternal(s, new ArrayList<Tr>());
		}
		if (debug) Debug.debug(debug, "Epsilon removal over "+n+" states");
		return Connect.connect(fst);
	}
}
