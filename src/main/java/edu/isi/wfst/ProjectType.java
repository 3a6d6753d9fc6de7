package edu.isi.wfst;

// which side of each transition a projection keeps
public enum ProjectType {
	PROJECT_INPUT,
	PROJECT_OUTPUT;

	public static ProjectType get(String s) throws ConfigureException {
		if (s.equals("input"))
			return PROJECT_INPUT;
		else if (s.equals("output"))
			return PROJECT_OUTPUT;
		throw new ConfigureException("Unexpected project type: "+s+"; valid values are input, output");
	}
}
