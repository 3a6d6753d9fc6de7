package edu.isi.wfst;

// automaton accepting the reversal of every accepted pair of strings.
// State 0 of the result is a new start; state s of the input becomes s+1
public class Reverse {
	public static VectorFst reverse(Fst fst) {
		Semiring sr = fst.getSemiring();
		VectorFst out = new VectorFst(sr);
		out.setSymbols(fst);
		if (fst.start() == Fst.NO_STATE_ID)
			return out;
		int n = fst.numStates();
		out.addStates(n+1);
		out.setStartInternal(0);
		for (int s = 0; s < n; s++) {
			if (fst.hasFinal(s))
				out.addTrInternal(0, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, sr.reverse(fst.finalOf(s)), s+1));
			for (Tr tr : fst.trsOf(s))
				out.addTrInternal(tr.nextstate+1, new Tr(tr.ilabel, tr.olabel, sr.reverse(tr.weight), s+1));
		}
		out.setFinalInternal(fst.start()+1, sr.ONE());
		return out;
	}
}
