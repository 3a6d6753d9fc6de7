package edu.isi.wfst;

// what determinization does when a state is reached with different output strings
public enum DeterminizeType {
	// input must be functional; different strings are an error
	FUNCTIONAL,
	// different strings are kept apart
	NON_FUNCTIONAL,
	// only the best string is kept
	DISAMBIGUATE;

	public static DeterminizeType get(String s) throws ConfigureException {
		if (s.equals("functional"))
			return FUNCTIONAL;
		else if (s.equals("nonfunctional"))
			return NON_FUNCTIONAL;
		else if (s.equals("disambiguate"))
			return DISAMBIGUATE;
		throw new ConfigureException("Unexpected determinization type: "+s+"; valid values are functional, nonfunctional, disambiguate");
	}
}
