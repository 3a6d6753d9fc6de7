package edu.isi.wfst;

// zero or more repetitions (star) or one or more (plus)
public enum ClosureType {
	CLOSURE_STAR,
	CLOSURE_PLUS;

	public static ClosureType get(String s) throws ConfigureException {
		if (s.equals("star"))
			return CLOSURE_STAR;
		else if (s.equals("plus"))
			return CLOSURE_PLUS;
		throw new ConfigureException("Unexpected closure type: "+s+"; valid values are star, plus");
	}
}
