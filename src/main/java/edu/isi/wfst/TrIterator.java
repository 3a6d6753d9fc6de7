package edu.isi.wfst;

import java.util.List;

// forward, read-only walk over the transitions of one state
public class TrIterator {
	protected final List<Tr> trs;
	protected int pos;

	TrIterator(List<Tr> trs) {
		this.trs = trs;
		pos = 0;
	}

	public boolean done() {
		return pos >= trs.size();
	}
	public void next() {
		pos++;
	}
	public void reset() {
		pos = 0;
	}
	public int position() {
		return pos;
	}
	public Tr value() {
		if (done())
			throw new IllegalStateException("Transition iterator is past the last transition");
		return trs.get(pos);
	}
}
