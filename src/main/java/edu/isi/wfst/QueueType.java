package edu.isi.wfst;

// order in which shortest distance relaxes states
public enum QueueType {
	FIFO,
	LIFO,
	SHORTEST_FIRST,
	TOP_ORDER,
	// top order when acyclic, shortest first with the path property, else fifo
	AUTO;

	public static QueueType get(String s) throws ConfigureException {
		if (s.equals("fifo"))
			return FIFO;
		else if (s.equals("lifo"))
			return LIFO;
		else if (s.equals("shortest"))
			return SHORTEST_FIRST;
		else if (s.equals("top"))
			return TOP_ORDER;
		else if (s.equals("auto"))
			return AUTO;
		throw new ConfigureException("Unexpected queue type: "+s+"; valid values are fifo, lifo, shortest, top, auto");
	}
}
