package edu.isi.wfst;

import java.util.ArrayList;
import java.util.EnumSet;

// turns a transducer into an acceptor over encoded labels and back
public class Encode {

	// in place. With weights encoded every transition weighs ONE and final weights
	// become transitions into a new final state
	public static EncodeTable encode(VectorFst fst, EnumSet<EncodeType> type) {
		boolean debug = false;
		Semiring sr = fst.getSemiring();
		EncodeTable table = new EncodeTable(type);
		table.isyms = fst.getInputSymbols();
		table.osyms = fst.getOutputSymbols();
		int n = fst.numStates();
		for (int s = 0; s < n; s++) {
			ArrayList<Tr> trs = fst.trsForUpdate(s);
			for (int i = 0; i < trs.size(); i++) {
				Tr tr = trs.get(i);
				int label = table.encode(tr.ilabel, tr.olabel, tr.weight, sr);
				trs.set(i, new Tr(label, table.encodesLabels() ? label : tr.olabel,
						table.encodesWeights() ? sr.ONE() : tr.weight, tr.nextstate));
			}
		}
		if (table.encodesWeights()) {
			int superFinal = Fst.NO_STATE_ID;
			for (int s = 0; s < n; s++) {
				if (!fst.hasFinal(s))
					continue;
				if (superFinal == Fst.NO_STATE_ID) {
					superFinal = fst.addState();
					fst.setFinalInternal(superFinal, sr.ONE());
				}
				int label = table.encode(Tr.EPS_LABEL, Tr.EPS_LABEL, fst.finalOf(s), sr);
				fst.addTrInternal(s, new Tr(label, table.encodesLabels() ? label : Tr.EPS_LABEL, sr.ONE(), superFinal));
				fst.setFinalInternal(s, sr.ZERO());
			}
		}
		// the encoded labels mean nothing to the old tables
		fst.setInputSymbols(null);
		if (table.encodesLabels())
			fst.setOutputSymbols(null);
		if (debug) Debug.debug(debug, "Encoded "+fst.numTrs()+" transitions with "+table.size()+" labels");
		return table;
	}

	// in place. Transitions into a final state that has nothing else to do become
	// final weights again
	public static void decode(VectorFst fst, EncodeTable table) throws UnusualConditionException {
		Semiring sr = fst.getSemiring();
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Tr> trs = fst.trsForUpdate(s);
			for (int i = 0; i < trs.size(); i++) {
				Tr tr = trs.get(i);
				Tr entry = table.decode(tr.ilabel);
				trs.set(i, new Tr(entry.ilabel, table.encodesLabels() ? entry.olabel : tr.olabel,
						table.encodesWeights() ? sr.times(tr.weight, entry.weight) : tr.weight, tr.nextstate));
			}
		}
		fst.setInputSymbols(table.isyms);
		fst.setOutputSymbols(table.osyms);
		RmFinalEpsilon.rmFinalEpsilon(fst);
	}
}
