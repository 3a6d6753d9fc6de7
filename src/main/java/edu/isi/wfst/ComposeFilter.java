package edu.isi.wfst;

// how composition treats epsilon moves of the two automata against each other
public enum ComposeFilter {
	// the sequence filter
	AUTO,
	// no epsilon moves at all
	NULL,
	// every combination; redundant epsilon paths are kept
	TRIVIAL,
	// output epsilons of the first automaton before input epsilons of the second
	SEQUENCE,
	// input epsilons of the second automaton before output epsilons of the first
	ALT_SEQUENCE,
	// epsilons matched to each other where possible
	MATCH,
	// only real epsilon against real epsilon is forbidden
	NO_MATCH;

	public static ComposeFilter get(String s) throws ConfigureException {
		if (s.equals("auto"))
			return AUTO;
		else if (s.equals("null"))
			return NULL;
		else if (s.equals("trivial"))
			return TRIVIAL;
		else if (s.equals("sequence"))
			return SEQUENCE;
		else if (s.equals("alt_sequence"))
			return ALT_SEQUENCE;
		else if (s.equals("match"))
			return MATCH;
		else if (s.equals("no_match"))
			return NO_MATCH;
		throw new ConfigureException("Unexpected compose filter: "+s+"; valid values are auto, null, trivial, "+
				"sequence, alt_sequence, match, no_match");
	}
}
