package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

// decides whether two automata are the same up to state renumbering.
// States are paired breadth first from the starts; transitions of paired states are
// matched after sorting by (ilabel, olabel, weight)
public class Isomorphic {

	private static final Comparator<Tr> LABELS_WEIGHT_ORDER = new Comparator<Tr>() {
		public int compare(Tr a, Tr b) {
			if (a.ilabel != b.ilabel)
				return Integer.compare(a.ilabel, b.ilabel);
			if (a.olabel != b.olabel)
				return Integer.compare(a.olabel, b.olabel);
			return Float.compare(a.weight, b.weight);
		}
	};

	public static boolean isomorphic(Fst a, Fst b) throws UnusualConditionException {
		return isomorphic(a, b, Semiring.KDELTA);
	}

	// throws when a state has two transitions that can't be told apart, since the
	// pairing would then have to guess
	public static boolean isomorphic(Fst a, Fst b, float delta) throws UnusualConditionException {
		boolean debug = false;
		if (!a.getSemiring().equals(b.getSemiring()))
			throw new UnusualConditionException("Can't compare automata over "+a.getSemiring().getName()+
					" and "+b.getSemiring().getName()+" semirings");
		Semiring sr = a.getSemiring();
		if (a.numStates() != b.numStates())
			return false;
		if (a.start() == Fst.NO_STATE_ID || b.start() == Fst.NO_STATE_ID)
			return a.start() == b.start();
		int n = a.numStates();
		int[] atob = new int[n];
		int[] btoa = new int[n];
		for (int s = 0; s < n; s++)
			atob[s] = btoa[s] = Fst.NO_STATE_ID;
		TIntArrayList queue = new TIntArrayList();
		atob[a.start()] = b.start();
		btoa[b.start()] = a.start();
		queue.add(a.start());
		int head = 0;
		while (head < queue.size()) {
			int s1 = queue.get(head++);
			int s2 = atob[s1];
			if (!sr.approxEqual(a.finalOf(s1), b.finalOf(s2), delta))
				return false;
			List<Tr> trs1 = sorted(a.trsOf(s1));
			List<Tr> trs2 = sorted(b.trsOf(s2));
			if (trs1.size() != trs2.size())
				return false;
			for (int i = 0; i < trs1.size(); i++) {
				Tr t1 = trs1.get(i);
				Tr t2 = trs2.get(i);
				if (i > 0) {
					Tr prev = trs1.get(i-1);
					if (prev.ilabel == t1.ilabel && prev.olabel == t1.olabel &&
							sr.approxEqual(prev.weight, t1.weight, delta))
						throw new UnusualConditionException("State "+s1+" has indistinguishable transitions "+prev+" and "+t1+
								"; isomorphism can't be decided for non-deterministic automata");
				}
				if (t1.ilabel != t2.ilabel || t1.olabel != t2.olabel || !sr.approxEqual(t1.weight, t2.weight, delta))
					return false;
				int m = atob[t1.nextstate];
				if (m == Fst.NO_STATE_ID) {
					if (btoa[t2.nextstate] != Fst.NO_STATE_ID)
						return false;
					atob[t1.nextstate] = t2.nextstate;
					btoa[t2.nextstate] = t1.nextstate;
					queue.add(t1.nextstate);
				}
				else if (m != t2.nextstate)
					return false;
			}
		}
		if (debug) Debug.debug(debug, "Paired "+queue.size()+" states");
		return true;
	}

	private static List<Tr> sorted(List<Tr> trs) {
		ArrayList<Tr> l = new ArrayList<Tr>(trs);
		Collections.sort(l, LABELS_WEIGHT_ORDER);
		return l;
	}
}
