package edu.isi.wfst;

// operations the command line tool can run, with the number of input files each takes
public enum FstCommand {
	CONNECT("connect", 1),
	TOPSORT("topsort", 1),
	TRSORT("trsort", 1),
	TR_UNIQUE("tr_unique", 1),
	TR_SUM("tr_sum", 1),
	RMEPSILON("rmepsilon", 1),
	SHORTESTPATH("shortestpath", 1),
	SHORTESTDISTANCE("shortestdistance", 1),
	PUSH("push", 1),
	DETERMINIZE("determinize", 1),
	MINIMIZE("minimize", 1),
	OPTIMIZE("optimize", 1),
	INVERT("invert", 1),
	PROJECT("project", 1),
	REVERSE("reverse", 1),
	CLOSURE("closure", 1),
	UNION("union", 2),
	CONCAT("concat", 2),
	COMPOSE("compose", 2),
	MAP("map", 1),
	RMFINALEPSILON("rmfinalepsilon", 1),
	RANDGEN("randgen", 1),
	INFO("info", 1);

	private static final String list;
	static {
		StringBuffer sb = new StringBuffer();
		for (FstCommand c : FstCommand.values()) {
			if (sb.length() > 0)
				sb.append(", ");
			sb.append(c.name);
		}
		list = sb.toString();
	}

	private final String name;
	private final int arity;

	private FstCommand(String name, int arity) {
		this.name = name;
		this.arity = arity;
	}

	public String getName() {
		return name;
	}
	public int getArity() {
		return arity;
	}
	public static String getList() {
		return list;
	}

	public static FstCommand get(String s) throws ConfigureException {
		for (FstCommand c : FstCommand.values())
			if (c.name.equals(s))
				return c;
		throw new ConfigureException("Unexpected command: "+s+"; valid values are "+list);
	}
}
