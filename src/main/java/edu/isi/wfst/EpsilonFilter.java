package edu.isi.wfst;

/**
 * Decides which pairs of matched transitions composition may follow. The filter state is a
 * small int carried in each composed state; BLOCKED rejects the pair. An epsilon move of one
 * automaton is paired with an implicit self-loop of the other, whose label on the matched
 * side is NO_LABEL.
 */
abstract class EpsilonFilter {
	static final int BLOCKED = -1;

	protected final Fst fst1;
	protected final Fst fst2;
	protected int fs;

	EpsilonFilter(Fst fst1, Fst fst2) {
		this.fst1 = fst1;
		this.fst2 = fst2;
	}

	static EpsilonFilter create(ComposeFilter type, Fst fst1, Fst fst2) {
		switch (type) {
		case NULL:
			return new NullFilter(fst1, fst2);
		case TRIVIAL:
			return new TrivialFilter(fst1, fst2);
		case ALT_SEQUENCE:
			return new AltSequenceFilter(fst1, fst2);
		case MATCH:
			return new MatchFilter(fst1, fst2);
		case NO_MATCH:
			return new NoMatchFilter(fst1, fst2);
		default:
			return new SequenceFilter(fst1, fst2);
		}
	}

	int start() {
		return 0;
	}
	void setState(int s1, int s2, int fs) {
		this.fs = fs;
	}
	// tr1 from the first automaton, tr2 from the second
	abstract int filter(Tr tr1, Tr tr2);

	// a state that can only move on by output epsilons (of the first automaton)
	// or input epsilons (of the second)
	static boolean allEpsilons(Fst fst, int s, boolean output) {
		int ne = output ? fst.countOutputEpsilons(s) : fst.countInputEpsilons(s);
		return ne == fst.trsOf(s).size() && !fst.hasFinal(s);
	}
	static boolean noEpsilons(Fst fst, int s, boolean output) {
		return (output ? fst.countOutputEpsilons(s) : fst.countInputEpsilons(s)) == 0;
	}

	static class NullFilter extends EpsilonFilter {
		NullFilter(Fst fst1, Fst fst2) {
			super(fst1, fst2);
		}
		int filter(Tr tr1, Tr tr2) {
			return tr1.olabel == Tr.NO_LABEL || tr2.ilabel == Tr.NO_LABEL ? BLOCKED : 0;
		}
	}

	static class TrivialFilter extends EpsilonFilter {
		TrivialFilter(Fst fst1, Fst fst2) {
			super(fst1, fst2);
		}
		int filter(Tr tr1, Tr tr2) {
			return 0;
		}
	}

	static class NoMatchFilter extends EpsilonFilter {
		NoMatchFilter(Fst fst1, Fst fst2) {
			super(fst1, fst2);
		}
		int filter(Tr tr1, Tr tr2) {
			return tr1.olabel == Tr.EPS_LABEL && tr2.ilabel == Tr.EPS_LABEL ? BLOCKED : 0;
		}
	}

	// state 1: the first automaton has moved on an output epsilon, so the second may not
	// move on an input epsilon until a real label is read
	static class SequenceFilter extends EpsilonFilter {
		private boolean alleps1;
		private boolean noeps1;
		SequenceFilter(Fst fst1, Fst fst2) {
			super(fst1, fst2);
		}
		void setState(int s1, int s2, int fs) {
			super.setState(s1, s2, fs);
			alleps1 = allEpsilons(fst1, s1, true);
			noeps1 = noEpsilons(fst1, s1, true);
		}
		int filter(Tr tr1, Tr tr2) {
			if (tr1.olabel == Tr.NO_LABEL) {
				if (alleps1)
					return BLOCKED;
				return noeps1 ? 0 : 1;
			}
			if (tr2.ilabel == Tr.NO_LABEL)
				return fs != 0 ? BLOCKED : 0;
			return tr1.olabel == Tr.EPS_LABEL ? BLOCKED : 0;
		}
	}

	static class AltSequenceFilter extends EpsilonFilter {
		private boolean alleps2;
		private boolean noeps2;
		AltSequenceFilter(Fst fst1, Fst fst2) {
			super(fst1, fst2);
		}
		void setState(int s1, int s2, int fs) {
			super.setState(s1, s2, fs);
			alleps2 = allEpsilons(fst2, s2, false);
			noeps2 = noEpsilons(fst2, s2, false);
		}
		int filter(Tr tr1, Tr tr2) {
			if (tr2.ilabel == Tr.NO_LABEL) {
				if (alleps2)
					return BLOCKED;
				return noeps2 ? 0 : 1;
			}
			if (tr1.olabel == Tr.NO_LABEL)
				return fs == 1 ? BLOCKED : 0;
			return tr1.olabel == Tr.EPS_LABEL ? BLOCKED : 0;
		}
	}

	// state 1: the first automaton is waiting while the second reads epsilons;
	// state 2: the other way round. Real epsilon pairs are matched directly
	static class MatchFilter extends EpsilonFilter {
		private boolean alleps1;
		private boolean alleps2;
		private boolean noeps1;
		private boolean noeps2;
		MatchFilter(Fst fst1, Fst fst2) {
			super(fst1, fst2);
		}
		void setState(int s1, int s2, int fs) {
			super.setState(s1, s2, fs);
			alleps1 = allEpsilons(fst1, s1, true);
			alleps2 = allEpsilons(fst2, s2, false);
			noeps1 = noEpsilons(fst1, s1, true);
			noeps2 = noEpsilons(fst2, s2, false);
		}
		int filter(Tr tr1, Tr tr2) {
			if (tr2.ilabel == Tr.NO_LABEL) {
				if (fs == 0) {
					if (noeps2)
						return 0;
					return alleps2 ? BLOCKED : 1;
				}
				return fs == 1 ? 1 : BLOCKED;
			}
			if (tr1.olabel == Tr.NO_LABEL) {
				if (fs == 0) {
					if (noeps1)
						return 0;
					return alleps1 ? BLOCKED : 2;
				}
				return fs == 2 ? 2 : BLOCKED;
			}
			if (tr1.olabel == Tr.EPS_LABEL)
				return fs == 0 ? 0 : BLOCKED;
			return 0;
		}
	}
}
