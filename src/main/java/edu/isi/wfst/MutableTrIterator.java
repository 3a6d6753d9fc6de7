package edu.isi.wfst;

import java.util.ArrayList;

// transition iterator that can replace the transition it points at
public class MutableTrIterator extends TrIterator {
	private final VectorFst fst;
	private final ArrayList<Tr> live;

	MutableTrIterator(VectorFst fst, ArrayList<Tr> trs) {
		super(trs);
		this.fst = fst;
		this.live = trs;
	}

	public void setValue(Tr tr) throws StateOutOfRangeException, DataFormatException {
		if (done())
			throw new IllegalStateException("Transition iterator is past the last transition");
		fst.checkState(tr.nextstate);
		fst.checkWeight(tr.weight);
		live.set(pos, tr);
	}
}
