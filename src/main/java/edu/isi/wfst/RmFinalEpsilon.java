package edu.isi.wfst;

import java.util.ArrayList;

// folds epsilon transitions into final states that lead nowhere else into final weights
public class RmFinalEpsilon {
	// in place, and connected afterwards
	public static VectorFst rmFinalEpsilon(VectorFst fst) {
		Semiring sr = fst.getSemiring();
		Scc scc = Scc.compute(fst);
		int n = fst.numStates();
		// final states with no way on to another final state
		boolean[] finals = new boolean[n];
		for (int s = 0; s < n; s++) {
			if (!fst.hasFinal(s))
				continue;
			finals[s] = true;
			for (Tr tr : fst.trsOf(s)) {
				if (scc.coaccess[tr.nextstate]) {
					finals[s] = false;
					break;
				}
			}
		}
		for (int s = 0; s < n; s++) {
			ArrayList<Tr> trs = fst.trsForUpdate(s);
			ArrayList<Tr> kept = new ArrayList<Tr>(trs.size());
			float w = fst.finalOf(s);
			boolean folded = false;
			for (Tr tr : trs) {
				if (finals[tr.nextstate] && tr.isEpsilon()) {
					w = sr.plus(w, sr.times(tr.weight, fst.finalOf(tr.nextstate)));
					folded = true;
				}
				else
					kept.add(tr);
			}
			if (!folded)
				continue;
			fst.setTrsInternal(s, kept);
			if (!sr.isZero(w))
				fst.setFinalInternal(s, w);
		}
		return Connect.connect(fst);
	}
}
