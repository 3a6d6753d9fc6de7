package edu.isi.wfst;

// Kleene closure, in place. Every final state loops back to the start with its final weight;
// the star closure also gets a new final start state so the empty string is accepted
public class Closure {
	public static VectorFst closure(VectorFst fst, ClosureType type) {
		Semiring sr = fst.getSemiring();
		int start = fst.start();
		if (start != Fst.NO_STATE_ID) {
			for (int s = 0; s < fst.numStates(); s++)
				if (fst.hasFinal(s))
					fst.addTrInternal(s, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, fst.finalOf(s), start));
		}
		if (type == ClosureType.CLOSURE_STAR) {
			int nstart = fst.addState();
			fst.setFinalInternal(nstart, sr.ONE());
			if (start != Fst.NO_STATE_ID)
				fst.addTrInternal(nstart, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, sr.ONE(), start));
			fst.setStartInternal(nstart);
		}
		return fst;
	}
}
