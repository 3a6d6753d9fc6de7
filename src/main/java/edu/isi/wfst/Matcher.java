package edu.isi.wfst;

import java.util.List;

// finds the transitions of one automaton that carry a given label on the matched side
abstract class Matcher {
	// priority of a state whose matches must come from this side
	static final int REQUIRE_PRIORITY = Integer.MAX_VALUE;

	protected final Fst fst;
	// matching input labels, or else output labels
	protected final boolean matchInput;

	Matcher(Fst fst, boolean matchInput) {
		this.fst = fst;
		this.matchInput = matchInput;
	}

	Fst getFst() {
		return fst;
	}
	boolean matchesInput() {
		return matchInput;
	}
	// whether lookups can be done on this side at all
	abstract boolean canMatch();
	// whether every lookup has to be done on this side
	boolean requireMatch() {
		return false;
	}
	// lower is cheaper to iterate over
	int priority(int s) {
		return fst.trsOf(s).size();
	}
	/**
	 * Transitions of state s matching label. EPS_LABEL also yields the implicit epsilon
	 * self-loop of s first; NO_LABEL (the loop of the other side) matches the real
	 * epsilon transitions only.
	 */
	abstract List<Tr> find(int s, int label) throws UnusualConditionException;

	// the implicit self-loop, with NO_LABEL on the matched side
	Tr loop(int s) {
		Semiring sr = fst.getSemiring();
		return matchInput ? new Tr(Tr.NO_LABEL, Tr.EPS_LABEL, sr.ONE(), s) : new Tr(Tr.EPS_LABEL, Tr.NO_LABEL, sr.ONE(), s);
	}
	int labelOf(Tr tr) {
		return matchInput ? tr.ilabel : tr.olabel;
	}
}
