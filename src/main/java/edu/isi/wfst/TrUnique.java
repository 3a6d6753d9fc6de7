package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;

// removes duplicate transitions of each state. Only exact duplicates go; transitions
// that differ in nothing but weight are all kept
public class TrUnique {

	private static final Comparator<Tr> LABELS_NEXTSTATE_WEIGHT_ORDER = new Comparator<Tr>() {
		public int compare(Tr a, Tr b) {
			int c = Tr.LABELS_NEXTSTATE_ORDER.compare(a, b);
			if (c != 0)
				return c;
			return Float.compare(a.weight, b.weight);
		}
	};

	public static VectorFst trUnique(VectorFst fst) {
		boolean debug = false;
		int removed = 0;
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Tr> trs = fst.trsForUpdate(s);
			if (trs.size() < 2)
				continue;
			Collections.sort(trs, LABELS_NEXTSTATE_WEIGHT_ORDER);
			ArrayList<Tr> kept = new ArrayList<Tr>(trs.size());
			for (Tr tr : trs) {
				if (kept.isEmpty() || !kept.get(kept.size()-1).equals(tr))
					kept.add(tr);
				else
					removed++;
			}
			fst.setTrsInternal(s, kept);
		}
		if (debug) Debug.debug(debug, "Removed "+removed+" duplicate transitions");
		return fst;
	}
}
