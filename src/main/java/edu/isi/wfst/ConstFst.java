package edu.isi.wfst;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

// immutable automaton with all transitions packed in one array
public class ConstFst extends Fst {
	private final int start;
	private final float[] finals;
	// transitions of state s are trs[offsets[s]] .. trs[offsets[s+1]-1]
	private final int[] offsets;
	private final Tr[] trs;

	public ConstFst(Fst other) {
		super(other.getSemiring());
		int n = other.numStates();
		start = other.start();
		finals = new float[n];
		offsets = new int[n+1];
		for (int s = 0; s < n; s++) {
			finals[s] = other.finalOf(s);
			offsets[s+1] = offsets[s] + other.trsOf(s).size();
		}
		trs = new Tr[offsets[n]];
		for (int s = 0; s < n; s++) {
			int i = offsets[s];
			for (Tr tr : other.trsOf(s))
				trs[i++] = tr;
		}
		isyms = other.getInputSymbols();
		osyms = other.getOutputSymbols();
		other.shareSymbols();
	}

	public int start() {
		return start;
	}
	public int numStates() {
		return finals.length;
	}
	float finalOf(int s) {
		return finals[s];
	}
	List<Tr> trsOf(int s) {
		return Collections.unmodifiableList(Arrays.asList(trs).subList(offsets[s], offsets[s+1]));
	}
	public int numTrs() {
		return trs.length;
	}
	public ConstFst toConstFst() {
		return this;
	}

	public static ConstFst read(File f) throws IOException, DataFormatException {
		return FstSerializer.read(f).toConstFst();
	}
	public static ConstFst fromBytes(byte[] data) throws DataFormatException {
		return FstSerializer.fromBytes(data).toConstFst();
	}
}
