package edu.isi.wfst;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;

/**
 * Bijection between (input label, output label, weight) triples and labels counted from 1,
 * built up by {@link Encode#encode} and used to undo it. Parts that aren't encoded are
 * stored as 0 (labels) and ONE (weights). The table also keeps the symbol tables of the
 * automaton it was made from.
 */
public class EncodeTable {
	private final EnumSet<EncodeType> type;
	// entry i has label i+1; nextstate is unused
	private final ArrayList<Tr> entries = new ArrayList<Tr>();
	private final HashMap<Tr, Integer> labels = new HashMap<Tr, Integer>();
	SymbolTable isyms;
	SymbolTable osyms;

	EncodeTable(EnumSet<EncodeType> type) {
		this.type = EnumSet.copyOf(type);
	}

	public boolean encodesLabels() {
		return type.contains(EncodeType.ENCODE_LABELS);
	}
	public boolean encodesWeights() {
		return type.contains(EncodeType.ENCODE_WEIGHTS);
	}
	public int size() {
		return entries.size();
	}

	// label for the triple, assigning the next one if it is new
	int encode(int ilabel, int olabel, float weight, Semiring sr) {
		Tr key = new Tr(ilabel, encodesLabels() ? olabel : Tr.EPS_LABEL,
				encodesWeights() ? weight : sr.ONE(), Fst.NO_STATE_ID);
		Integer label = labels.get(key);
		if (label != null)
			return label;
		entries.add(key);
		labels.put(key, entries.size());
		return entries.size();
	}

	// triple behind a label
	public Tr decode(int label) throws UnusualConditionException {
		if (label < 1 || label > entries.size())
			throw new UnusualConditionException("Label "+label+" is not in the encoding table of "+entries.size()+" entries");
		return entries.get(label-1);
	}
}
