package edu.isi.wfst;

// direction weights (and labels) are pushed in
public enum ReweightType {
	REWEIGHT_TO_INITIAL,
	REWEIGHT_TO_FINAL;

	public static ReweightType get(String s) throws ConfigureException {
		if (s.equals("initial"))
			return REWEIGHT_TO_INITIAL;
		else if (s.equals("final"))
			return REWEIGHT_TO_FINAL;
		throw new ConfigureException("Unexpected reweight type: "+s+"; valid values are initial, final");
	}
}
