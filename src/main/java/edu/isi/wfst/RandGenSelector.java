package edu.isi.wfst;

// how randgen picks among the transitions of a state and its finality
public enum RandGenSelector {
	// every candidate equally likely
	UNIFORM,
	// weights read as negative log probabilities
	LOG_PROB;

	public static RandGenSelector get(String s) throws ConfigureException {
		if (s.equals("uniform"))
			return UNIFORM;
		else if (s.equals("log_prob"))
			return LOG_PROB;
		throw new ConfigureException("Unexpected selector: "+s+"; valid values are uniform, log_prob");
	}
}
