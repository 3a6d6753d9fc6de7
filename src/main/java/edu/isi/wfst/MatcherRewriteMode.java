package edu.isi.wfst;

// whether a sigma match rewrites both labels of the sigma transition or only the matched one
public enum MatcherRewriteMode {
	// both when the automaton is an acceptor
	AUTO,
	ALWAYS,
	NEVER;

	public static MatcherRewriteMode get(String s) throws ConfigureException {
		if (s.equals("auto"))
			return AUTO;
		else if (s.equals("always"))
			return ALWAYS;
		else if (s.equals("never"))
			return NEVER;
		throw new ConfigureException("Unexpected rewrite mode: "+s+"; valid values are auto, always, never");
	}
}
