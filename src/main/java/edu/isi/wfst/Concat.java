package edu.isi.wfst;

import java.util.List;

// paths of the first automaton followed by paths of the second. The first argument is changed
public class Concat {
	public static VectorFst concat(VectorFst fst1, Fst fst2) throws UnusualConditionException {
		Semiring sr = fst1.getSemiring();
		if (!sr.equals(fst2.getSemiring()))
			throw new UnusualConditionException("Can't concatenate automata over different semirings: "+
					sr.getName()+" and "+fst2.getSemiring().getName());
		if (fst1.start() == Fst.NO_STATE_ID)
			return fst1;
		int n1 = fst1.numStates();
		int offset = Union.appendStates(fst1, fst2);
		int start2 = fst2.start();
		// each final of the first bridges into the second with its final weight
		for (int s = 0; s < n1; s++) {
			if (!fst1.hasFinal(s))
				continue;
			if (start2 != Fst.NO_STATE_ID)
				fst1.addTrInternal(s, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, fst1.finalOf(s), start2+offset));
			fst1.setFinalInternal(s, sr.ZERO());
		}
		return fst1;
	}

	public static VectorFst concatList(VectorFst fst1, List<? extends Fst> others) throws UnusualConditionException {
		for (Fst f : others)
			concat(fst1, f);
		return fst1;
	}
}
