package edu.isi.wfst;

// renumbers an acyclic automaton so every transition goes to a higher state id
public class TopSort {
	// in place; a cyclic automaton is left untouched
	public static VectorFst topSort(VectorFst fst) throws UnusualConditionException {
		Scc scc = Scc.compute(fst);
		if (scc.cyclic)
			throw new UnusualConditionException("Can't topologically sort a cyclic automaton");
		// acyclic, so every component is one state and component ids are a topological order
		stateSort(fst, scc.scc);
		return fst;
	}

	// moves state s to newid[s]. newid must be a permutation
	static void stateSort(VectorFst fst, int[] newid) {
		int n = fst.numStates();
		VectorFst out = new VectorFst(fst.getSemiring());
		out.addStates(n);
		for (int s = 0; s < n; s++) {
			out.setFinalInternal(newid[s], fst.finalOf(s));
			for (Tr tr : fst.trsOf(s))
				out.addTrInternal(newid[s], tr.withNextstate(newid[tr.nextstate]));
		}
		if (fst.start() != Fst.NO_STATE_ID)
			out.setStartInternal(newid[fst.start()]);
		out.setSymbols(fst);
		fst.assign(out);
	}
}
