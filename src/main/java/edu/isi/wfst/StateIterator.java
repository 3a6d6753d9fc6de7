package edu.isi.wfst;

// forward walk over the state ids of an automaton
public class StateIterator {
	private final int numStates;
	private int s;

	StateIterator(int numStates) {
		this.numStates = numStates;
		s = 0;
	}

	public boolean done() {
		return s >= numStates;
	}
	public void next() {
		s++;
	}
	public void reset() {
		s = 0;
	}
	public int value() {
		if (done())
			throw new IllegalStateException("State iterator is past the last state");
		return s;
	}
}
