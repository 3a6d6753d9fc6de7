package edu.isi.wfst;

import gnu.trove.set.hash.TIntHashSet;

import java.util.List;

// structural properties, computed on demand from the automaton itself
public class FstProperties {

	public static boolean isAcceptor(Fst fst) {
		for (int s = 0; s < fst.numStates(); s++)
			for (Tr tr : fst.trsOf(s))
				if (tr.ilabel != tr.olabel)
					return false;
		return true;
	}

	// no state has two transitions with the same input label
	public static boolean isIDeterministic(Fst fst) {
		return isDeterministic(fst, true);
	}
	public static boolean isODeterministic(Fst fst) {
		return isDeterministic(fst, false);
	}
	private static boolean isDeterministic(Fst fst, boolean input) {
		TIntHashSet seen = new TIntHashSet();
		for (int s = 0; s < fst.numStates(); s++) {
			seen.clear();
			for (Tr tr : fst.trsOf(s))
				if (!seen.add(input ? tr.ilabel : tr.olabel))
					return false;
		}
		return true;
	}

	// any transition with both labels epsilon
	public static boolean hasEpsilons(Fst fst) {
		for (int s = 0; s < fst.numStates(); s++)
			for (Tr tr : fst.trsOf(s))
				if (tr.isEpsilon())
					return true;
		return false;
	}
	public static boolean hasInputEpsilons(Fst fst) {
		for (int s = 0; s < fst.numStates(); s++)
			if (fst.countInputEpsilons(s) > 0)
				return true;
		return false;
	}
	public static boolean hasOutputEpsilons(Fst fst) {
		for (int s = 0; s < fst.numStates(); s++)
			if (fst.countOutputEpsilons(s) > 0)
				return true;
		return false;
	}

	public static boolean isILabelSorted(Fst fst) {
		for (int s = 0; s < fst.numStates(); s++) {
			List<Tr> trs = fst.trsOf(s);
			for (int i = 1; i < trs.size(); i++)
				if (trs.get(i-1).ilabel > trs.get(i).ilabel)
					return false;
		}
		return true;
	}
	public static boolean isOLabelSorted(Fst fst) {
		for (int s = 0; s < fst.numStates(); s++) {
			List<Tr> trs = fst.trsOf(s);
			for (int i = 1; i < trs.size(); i++)
				if (trs.get(i-1).olabel > trs.get(i).olabel)
					return false;
		}
		return true;
	}

	// any weight other than ONE, or a final weight other than ONE and ZERO
	public static boolean isWeighted(Fst fst) {
		Semiring sr = fst.getSemiring();
		for (int s = 0; s < fst.numStates(); s++) {
			float fw = fst.finalOf(s);
			if (!sr.isZero(fw) && !sr.isOne(fw))
				return true;
			for (Tr tr : fst.trsOf(s))
				if (!sr.isOne(tr.weight))
					return true;
		}
		return false;
	}

	public static boolean isAcyclic(Fst fst) {
		return !Scc.compute(fst).cyclic;
	}

	// the start state lies on no cycle
	public static boolean isInitialAcyclic(Fst fst) {
		int start = fst.start();
		if (start == Fst.NO_STATE_ID)
			return true;
		Scc scc = Scc.compute(fst);
		for (Tr tr : fst.trsOf(start))
			if (tr.nextstate == start)
				return false;
		for (int s = 0; s < fst.numStates(); s++)
			if (s != start && scc.scc[s] == scc.scc[start])
				return false;
		return true;
	}

	// every transition on a cycle has weight ONE
	public static boolean hasUnweightedCycles(Fst fst) {
		Semiring sr = fst.getSemiring();
		Scc scc = Scc.compute(fst);
		for (int s = 0; s < fst.numStates(); s++)
			for (Tr tr : fst.trsOf(s))
				if (scc.scc[s] == scc.scc[tr.nextstate] && !sr.isOne(tr.weight))
					return false;
		return true;
	}

	public static boolean isAccessible(Fst fst) {
		boolean[] a = Scc.compute(fst).access;
		for (boolean b : a)
			if (!b)
				return false;
		return true;
	}
	public static boolean isCoaccessible(Fst fst) {
		boolean[] c = Scc.compute(fst).coaccess;
		for (boolean b : c)
			if (!b)
				return false;
		return true;
	}

	// every transition goes to a higher state id
	public static boolean isTopSorted(Fst fst) {
		for (int s = 0; s < fst.numStates(); s++)
			for (Tr tr : fst.trsOf(s))
				if (tr.nextstate <= s)
					return false;
		return true;
	}

	// one line per property, for the command line info summary
	public static String summary(Fst fst) {
		StringBuffer sb = new StringBuffer();
		sb.append("semiring\t"+fst.getSemiring().getName()+"\n");
		sb.append("# of states\t"+fst.numStates()+"\n");
		sb.append("# of transitions\t"+fst.numTrs()+"\n");
		sb.append("start state\t"+fst.start()+"\n");
		sb.append("acceptor\t"+isAcceptor(fst)+"\n");
		sb.append("input deterministic\t"+isIDeterministic(fst)+"\n");
		sb.append("output deterministic\t"+isODeterministic(fst)+"\n");
		sb.append("epsilons\t"+hasEpsilons(fst)+"\n");
		sb.append("input label sorted\t"+isILabelSorted(fst)+"\n");
		sb.append("output label sorted\t"+isOLabelSorted(fst)+"\n");
		sb.append("weighted\t"+isWeighted(fst)+"\n");
		sb.append("acyclic\t"+isAcyclic(fst)+"\n");
		sb.append("initial acyclic\t"+isInitialAcyclic(fst)+"\n");
		sb.append("accessible\t"+isAccessible(fst)+"\n");
		sb.append("coaccessible\t"+isCoaccessible(fst)+"\n");
		return sb.toString();
	}
}
