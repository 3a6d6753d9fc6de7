package edu.isi.wfst;

// what encoding folds into a single label; combined as an EnumSet
public enum EncodeType {
	ENCODE_LABELS,
	ENCODE_WEIGHTS;
}
