package edu.isi.wfst;

import java.util.EnumSet;

// what a push moves; combined as an EnumSet
public enum PushType {
	PUSH_WEIGHTS,
	PUSH_LABELS,
	REMOVE_TOTAL_WEIGHT,
	REMOVE_COMMON_AFFIX;

	public static EnumSet<PushType> of(boolean pushWeights, boolean pushLabels,
			boolean removeTotalWeight, boolean removeCommonAffix) {
		EnumSet<PushType> set = EnumSet.noneOf(PushType.class);
		if (pushWeights)
			set.add(PUSH_WEIGHTS);
		if (pushLabels)
			set.add(PUSH_LABELS);
		if (removeTotalWeight)
			set.add(REMOVE_TOTAL_WEIGHT);
		if (removeCommonAffix)
			set.add(REMOVE_COMMON_AFFIX);
		return set;
	}
}
