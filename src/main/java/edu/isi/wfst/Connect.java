package edu.isi.wfst;

// trims an automaton to the states that lie on some path from the start to a final state
public class Connect {
	// in place. Returns its argument
	public static VectorFst connect(VectorFst fst) {
		boolean debug = false;
		Scc scc = Scc.compute(fst);
		int n = fst.numStates();
		boolean[] dead = new boolean[n];
		int ndead = 0;
		for (int s = 0; s < n; s++) {
			if (!scc.access[s] || !scc.coaccess[s]) {
				dead[s] = true;
				ndead++;
			}
		}
		if (debug) Debug.debug(debug, "Removing "+ndead+" useless states of "+n);
		if (ndead == n)
			fst.deleteStates();
		else
			fst.deleteStatesInternal(dead);
		return fst;
	}
}
