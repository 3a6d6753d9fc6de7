package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

// lazily walks every accepting path of an automaton, depth first
public class StringPathsIterator implements Iterator<StringPath> {

	private static class PartialPath {
		int state;
		TIntArrayList ilabels;
		TIntArrayList olabels;
		float weight;
		PartialPath(int state, TIntArrayList il, TIntArrayList ol, float weight) {
			this.state = state;
			this.ilabels = il;
			this.olabels = ol;
			this.weight = weight;
		}
	}

	private final Fst fst;
	private final Semiring sr;
	private final ArrayDeque<PartialPath> stack;
	private StringPath pending;

	StringPathsIterator(Fst fst) {
		this.fst = fst;
		this.sr = fst.getSemiring();
		stack = new ArrayDeque<PartialPath>();
		if (fst.start() != Fst.NO_STATE_ID)
			stack.push(new PartialPath(fst.start(), new TIntArrayList(), new TIntArrayList(), sr.ONE()));
		pending = null;
	}

	private void advance() {
		while (pending == null && !stack.isEmpty()) {
			PartialPath p = stack.pop();
			// push in reverse so the first transition is explored first
			List<Tr> trs = fst.trsOf(p.state);
			for (int i = trs.size()-1; i >= 0; i--) {
				Tr tr = trs.get(i);
				TIntArrayList il = new TIntArrayList(p.ilabels);
				TIntArrayList ol = new TIntArrayList(p.olabels);
				if (tr.ilabel != Tr.EPS_LABEL)
					il.add(tr.ilabel);
				if (tr.olabel != Tr.EPS_LABEL)
					ol.add(tr.olabel);
				stack.push(new PartialPath(tr.nextstate, il, ol, sr.times(p.weight, tr.weight)));
			}
			if (fst.hasFinal(p.state))
				pending = new StringPath(p.ilabels, p.olabels, sr.times(p.weight, fst.finalOf(p.state)),
						fst.getInputSymbols(), fst.getOutputSymbols());
		}
	}

	public boolean hasNext() {
		advance();
		return pending != null;
	}
	public StringPath next() {
		advance();
		if (pending == null)
			throw new NoSuchElementException();
		StringPath ret = pending;
		pending = null;
		return ret;
	}
	public void remove() {
		throw new UnsupportedOperationException();
	}
}
