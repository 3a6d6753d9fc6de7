package edu.isi.wfst;

// transition and final weight rewrites done by TrMap
public enum MapType {
	IDENTITY,
	INPUT_EPSILON,
	OUTPUT_EPSILON,
	INVERT,
	// plus a constant weight
	PLUS,
	// times a constant weight
	TIMES,
	// round to a multiple of a delta
	QUANTIZE,
	// every non-zero weight becomes ONE
	RMWEIGHT;

	public static MapType get(String s) throws ConfigureException {
		if (s.equals("identity"))
			return IDENTITY;
		else if (s.equals("input_epsilon"))
			return INPUT_EPSILON;
		else if (s.equals("output_epsilon"))
			return OUTPUT_EPSILON;
		else if (s.equals("invert"))
			return INVERT;
		else if (s.equals("plus"))
			return PLUS;
		else if (s.equals("times"))
			return TIMES;
		else if (s.equals("quantize"))
			return QUANTIZE;
		else if (s.equals("rmweight"))
			return RMWEIGHT;
		throw new ConfigureException("Unexpected map type: "+s+"; valid values are identity, input_epsilon, "+
				"output_epsilon, invert, plus, times, quantize, rmweight");
	}
}
