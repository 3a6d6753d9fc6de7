package edu.isi.wfst;

import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.Arrays;

// lays output strings out as chains of epsilon-input transitions in an automaton under
// construction. Chain states are shared between strings with the same destination and the
// same remaining labels; final strings end in one shared final state
class StringFactor {
	private final VectorFst out;
	private final TObjectIntHashMap<String> chains = new TObjectIntHashMap<String>();
	private int superFinal = Fst.NO_STATE_ID;

	StringFactor(VectorFst out) {
		this.out = out;
	}

	// transition from s reading ilabel, writing labels and ending at dest.
	// The first transition of the chain carries the weight
	void addTr(int s, int ilabel, int[] labels, float weight, int dest) {
		if (labels.length == 0)
			out.addTrInternal(s, new Tr(ilabel, Tr.EPS_LABEL, weight, dest));
		else if (labels.length == 1)
			out.addTrInternal(s, new Tr(ilabel, labels[0], weight, dest));
		else
			out.addTrInternal(s, new Tr(ilabel, labels[0], weight, chain(dest, labels, 1)));
	}

	// final weight of s with a non-empty string still to be written
	void addFinal(int s, int[] labels, float weight) {
		if (superFinal == Fst.NO_STATE_ID) {
			superFinal = out.addState();
			out.setFinalInternal(superFinal, out.getSemiring().ONE());
		}
		addTr(s, Tr.EPS_LABEL, labels, weight, superFinal);
	}

	// state that writes labels[from..] and then goes to dest
	private int chain(int dest, int[] labels, int from) {
		String key = dest+":"+Arrays.toString(Arrays.copyOfRange(labels, from, labels.length));
		if (chains.containsKey(key))
			return chains.get(key);
		int s = out.addState();
		chains.put(key, s);
		int next = from == labels.length-1 ? dest : chain(dest, labels, from+1);
		out.addTrInternal(s, new Tr(Tr.EPS_LABEL, labels[from], out.getSemiring().ONE(), next));
		return s;
	}
}
