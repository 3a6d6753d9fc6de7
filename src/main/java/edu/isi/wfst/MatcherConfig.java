package edu.isi.wfst;

import gnu.trove.set.hash.TIntHashSet;

/**
 * Makes one side of a composition treat a label as sigma: a transition with that label
 * matches any non-epsilon label of the other automaton, optionally only the labels of an
 * allow-list. The matched label is written over sigma on the result.
 */
public class MatcherConfig {
	private final int sigmaLabel;
	private final MatcherRewriteMode rewriteMode;
	// null allows every label
	private final TIntHashSet sigmaAllowedMatches;

	public MatcherConfig(int sigmaLabel) throws ConfigureException {
		this(sigmaLabel, MatcherRewriteMode.AUTO, null);
	}
	public MatcherConfig(int sigmaLabel, MatcherRewriteMode rewriteMode) throws ConfigureException {
		this(sigmaLabel, rewriteMode, null);
	}
	public MatcherConfig(int sigmaLabel, MatcherRewriteMode rewriteMode, int[] sigmaAllowedMatches) throws ConfigureException {
		if (sigmaLabel == Tr.EPS_LABEL)
			throw new ConfigureException("Epsilon can't be used as the sigma label");
		if (sigmaLabel < 0)
			throw new ConfigureException("Bad sigma label "+sigmaLabel);
		this.sigmaLabel = sigmaLabel;
		this.rewriteMode = rewriteMode;
		this.sigmaAllowedMatches = sigmaAllowedMatches == null ? null : new TIntHashSet(sigmaAllowedMatches);
	}

	public int getSigmaLabel() {
		return sigmaLabel;
	}
	public MatcherRewriteMode getRewriteMode() {
		return rewriteMode;
	}
	public boolean allows(int label) {
		return sigmaAllowedMatches == null || sigmaAllowedMatches.contains(label);
	}
	public String toString() {
		return "sigma="+sigmaLabel+" rewrite="+rewriteMode+(sigmaAllowedMatches == null ? "" : " allowed="+sigmaAllowedMatches);
	}
}
