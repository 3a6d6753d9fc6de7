package edu.isi.wfst;

import java.util.ArrayList;
import java.util.List;

// sorted matcher where the sigma label stands for every non-epsilon label. Sigma
// transitions match in addition to the transitions with the label itself
class SigmaMatcher extends Matcher {
	private final SortedMatcher inner;
	private final MatcherConfig config;
	private final boolean rewriteBoth;

	SigmaMatcher(Fst fst, boolean matchInput, MatcherConfig config) {
		super(fst, matchInput);
		inner = new SortedMatcher(fst, matchInput);
		this.config = config;
		switch (config.getRewriteMode()) {
		case ALWAYS:
			rewriteBoth = true;
			break;
		case NEVER:
			rewriteBoth = false;
			break;
		default:
			rewriteBoth = FstProperties.isAcceptor(fst);
		}
	}

	boolean canMatch() {
		return inner.canMatch();
	}
	boolean requireMatch() {
		return true;
	}
	int priority(int s) {
		return hasSigma(s) ? REQUIRE_PRIORITY : inner.priority(s);
	}

	private boolean hasSigma(int s) {
		return !inner.find(s, config.getSigmaLabel()).isEmpty();
	}

	List<Tr> find(int s, int label) throws UnusualConditionException {
		int sigma = config.getSigmaLabel();
		if (label == sigma)
			throw new UnusualConditionException("Sigma label "+sigma+" can't be looked up in a sigma matcher");
		List<Tr> exact = inner.find(s, label);
		boolean real = label != Tr.EPS_LABEL && label != Tr.NO_LABEL;
		if (!real || !config.allows(label))
			return exact;
		List<Tr> sigmas = inner.find(s, sigma);
		if (sigmas.isEmpty())
			return exact;
		ArrayList<Tr> ret = new ArrayList<Tr>(exact);
		for (Tr tr : sigmas)
			ret.add(rewrite(tr, label));
		return ret;
	}

	private Tr rewrite(Tr tr, int label) {
		int sigma = config.getSigmaLabel();
		if (rewriteBoth)
			return tr.withLabels(tr.ilabel == sigma ? label : tr.ilabel, tr.olabel == sigma ? label : tr.olabel);
		return matchInput ? tr.withLabels(label, tr.olabel) : tr.withLabels(tr.ilabel, label);
	}
}
