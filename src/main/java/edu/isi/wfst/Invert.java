package edu.isi.wfst;

import java.util.ArrayList;

// swaps the input and output side of every transition, and the symbol tables. In place
public class Invert {
	public static VectorFst invert(VectorFst fst) {
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Tr> trs = fst.trsForUpdate(s);
			for (int i = 0; i < trs.size(); i++) {
				Tr tr = trs.get(i);
				trs.set(i, tr.withLabels(tr.olabel, tr.ilabel));
			}
		}
		SymbolTable isyms = fst.getInputSymbols();
		fst.setInputSymbols(fst.getOutputSymbols());
		fst.setOutputSymbols(isyms);
		return fst;
	}
}
