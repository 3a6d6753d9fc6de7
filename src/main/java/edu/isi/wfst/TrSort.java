package edu.isi.wfst;

import java.util.Collections;
import java.util.Comparator;

// stable sort of each state's transitions
public class TrSort {
	// by input label if ilabel, else by output label
	public static VectorFst trSort(VectorFst fst, boolean ilabel) {
		return trSort(fst, ilabel ? Tr.ILABEL_ORDER : Tr.OLABEL_ORDER);
	}

	public static VectorFst trSort(VectorFst fst, Comparator<Tr> order) {
		for (int s = 0; s < fst.numStates(); s++)
			Collections.sort(fst.trsForUpdate(s), order);
		return fst;
	}
}
