package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;

// merges parallel transitions (same labels, same destination) of each state, adding their weights
public class TrSum {
	public static VectorFst trSum(VectorFst fst) {
		Semiring sr = fst.getSemiring();
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Tr> trs = fst.trsForUpdate(s);
			if (trs.size() < 2)
				continue;
			Collections.sort(trs, Tr.LABELS_NEXTSTATE_ORDER);
			ArrayList<Tr> summed = new ArrayList<Tr>(trs.size());
			for (Tr tr : trs) {
				int last = summed.size()-1;
				if (last >= 0 && Tr.LABELS_NEXTSTATE_ORDER.compare(summed.get(last), tr) == 0)
					summed.set(last, tr.withWeight(sr.plus(summed.get(last).weight, tr.weight)));
				else
					summed.add(tr);
			}
			fst.setTrsInternal(s, summed);
		}
		return fst;
	}
}
