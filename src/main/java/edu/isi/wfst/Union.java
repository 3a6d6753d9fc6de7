package edu.isi.wfst;

import java.util.List;

// adds the paths of one automaton to another. The first argument is changed; the second is only read
public class Union {
	public static VectorFst union(VectorFst fst1, Fst fst2) throws UnusualConditionException {
		Semiring sr = fst1.getSemiring();
		if (!sr.equals(fst2.getSemiring()))
			throw new UnusualConditionException("Can't join automata over different semirings: "+
					sr.getName()+" and "+fst2.getSemiring().getName());
		int start2 = fst2.start();
		if (start2 == Fst.NO_STATE_ID)
			return fst1;
		// checked before fst1 grows
		boolean initialAcyclic = FstProperties.isInitialAcyclic(fst1);
		int offset = appendStates(fst1, fst2);
		int start1 = fst1.start();
		if (start1 == Fst.NO_STATE_ID) {
			fst1.setStartInternal(start2+offset);
			return fst1;
		}
		if (initialAcyclic)
			fst1.addTrInternal(start1, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, sr.ONE(), start2+offset));
		else {
			int nstart = fst1.addState();
			fst1.addTrInternal(nstart, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, sr.ONE(), start1));
			fst1.addTrInternal(nstart, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, sr.ONE(), start2+offset));
			fst1.setStartInternal(nstart);
		}
		return fst1;
	}

	// union of the first automaton with each of the others, in order
	public static VectorFst unionList(VectorFst fst1, List<? extends Fst> others) throws UnusualConditionException {
		for (Fst f : others)
			union(fst1, f);
		return fst1;
	}

	// copies every state of src after the states of dst; returns the offset of src's states in dst
	static int appendStates(VectorFst dst, Fst src) {
		int offset = dst.numStates();
		// src may be dst itself
		int n = src.numStates();
		dst.addStates(n);
		for (int s = 0; s < n; s++) {
			if (src.hasFinal(s))
				dst.setFinalInternal(s+offset, src.finalOf(s));
			for (Tr tr : src.trsOf(s))
				dst.addTrInternal(s+offset, tr.withNextstate(tr.nextstate+offset));
		}
		return offset;
	}
}
