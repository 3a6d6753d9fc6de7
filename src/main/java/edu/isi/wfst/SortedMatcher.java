package edu.isi.wfst;

import java.util.ArrayList;
import java.util.List;

// binary search over transitions sorted on the matched side
class SortedMatcher extends Matcher {
	private final boolean sorted;

	SortedMatcher(Fst fst, boolean matchInput) {
		super(fst, matchInput);
		sorted = matchInput ? FstProperties.isILabelSorted(fst) : FstProperties.isOLabelSorted(fst);
	}

	boolean canMatch() {
		return sorted;
	}

	List<Tr> find(int s, int label) {
		ArrayList<Tr> ret = new ArrayList<Tr>();
		if (label == Tr.EPS_LABEL)
			ret.add(loop(s));
		int target = label == Tr.NO_LABEL ? Tr.EPS_LABEL : label;
		List<Tr> trs = fst.trsOf(s);
		// first position with a label no less than the target
		int lo = 0;
		int hi = trs.size();
		while (lo < hi) {
			int mid = (lo + hi) >>> 1;
			if (labelOf(trs.get(mid)) < target)
				lo = mid + 1;
			else
				hi = mid;
		}
		for (int i = lo; i < trs.size() && labelOf(trs.get(i)) == target; i++)
			ret.add(trs.get(i));
		return ret;
	}
}
