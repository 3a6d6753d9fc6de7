package edu.isi.wfst;

import java.util.ArrayList;

// turns a transducer into the acceptor of its input or its output side. In place
public class Project {
	public static VectorFst project(VectorFst fst, ProjectType type) {
		boolean input = type == ProjectType.PROJECT_INPUT;
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Tr> trs = fst.trsForUpdate(s);
			for (int i = 0; i < trs.size(); i++) {
				Tr tr = trs.get(i);
				int label = input ? tr.ilabel : tr.olabel;
				trs.set(i, tr.withLabels(label, label));
			}
		}
		if (input)
			fst.setOutputSymbols(fst.getInputSymbols());
		else
			fst.setInputSymbols(fst.getOutputSymbols());
		return fst;
	}
}
