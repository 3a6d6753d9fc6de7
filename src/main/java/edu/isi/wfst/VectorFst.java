package edu.isi.wfst;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable, vector-backed automaton. Every public mutator range-checks the states
 * it is given; the package-private variants are for algorithms that already know
 * their states are valid.
 */
public class VectorFst extends Fst {

	private static class VectorState {
		float finalWeight;
		ArrayList<Tr> trs;
		VectorState(float fw) {
			finalWeight = fw;
			trs = new ArrayList<Tr>();
		}
	}

	private ArrayList<VectorState> states;
	private int start;
	// symbol tables are shared until changed through this automaton
	private boolean ownIsyms = false;
	private boolean ownOsyms = false;

	public VectorFst() {
		this(new TropicalSemiring());
	}
	public VectorFst(Semiring semiring) {
		super(semiring);
		states = new ArrayList<VectorState>();
		start = NO_STATE_ID;
	}
	// copy of any automaton
	public VectorFst(Fst other) {
		super(other.getSemiring());
		states = new ArrayList<VectorState>(other.numStates());
		for (int s = 0; s < other.numStates(); s++) {
			VectorState vs = new VectorState(other.finalOf(s));
			vs.trs.addAll(other.trsOf(s));
			states.add(vs);
		}
		start = other.start();
		isyms = other.isyms;
		osyms = other.osyms;
		other.shareSymbols();
	}

	public VectorFst copy() {
		return new VectorFst(this);
	}

	public int start() {
		return start;
	}
	public int numStates() {
		return states.size();
	}
	float finalOf(int s) {
		return states.get(s).finalWeight;
	}
	List<Tr> trsOf(int s) {
		return Collections.unmodifiableList(states.get(s).trs);
	}

	// construction

	public int addState() {
		states.add(new VectorState(semiring.ZERO()));
		return states.size()-1;
	}
	// id of the first of n new states
	public int addStates(int n) {
		int first = states.size();
		states.ensureCapacity(first+n);
		for (int i = 0; i < n; i++)
			states.add(new VectorState(semiring.ZERO()));
		return first;
	}
	public void reserveStates(int n) {
		states.ensureCapacity(n);
	}

	public void setStart(int s) throws StateOutOfRangeException {
		checkState(s);
		start = s;
	}
	public void setFinal(int s, float w) throws StateOutOfRangeException, DataFormatException {
		checkState(s);
		checkWeight(w);
		setFinalInternal(s, w);
	}
	public void setFinal(int s) throws StateOutOfRangeException {
		checkState(s);
		setFinalInternal(s, semiring.ONE());
	}
	public void unsetFinal(int s) throws StateOutOfRangeException {
		checkState(s);
		setFinalInternal(s, semiring.ZERO());
	}
	public void addTr(int s, Tr tr) throws StateOutOfRangeException, DataFormatException {
		checkState(s);
		checkState(tr.nextstate);
		checkWeight(tr.weight);
		states.get(s).trs.add(tr);
	}
	public void setTrs(int s, List<Tr> trs) throws StateOutOfRangeException, DataFormatException {
		checkState(s);
		for (Tr tr : trs) {
			checkState(tr.nextstate);
			checkWeight(tr.weight);
		}
		states.get(s).trs = new ArrayList<Tr>(trs);
	}
	public void deleteTrs(int s) throws StateOutOfRangeException {
		checkState(s);
		states.get(s).trs.clear();
	}
	public MutableTrIterator mutableTrIterator(int s) throws StateOutOfRangeException {
		checkState(s);
		return new MutableTrIterator(this, states.get(s).trs);
	}

	// removes everything, including the start
	public void deleteStates() {
		states.clear();
		start = NO_STATE_ID;
	}
	// removes the given states, renumbering the rest densely. Transitions into
	// removed states go too
	public void deleteStates(int[] dstates) throws StateOutOfRangeException {
		for (int s : dstates)
			checkState(s);
		boolean[] dead = new boolean[numStates()];
		for (int s : dstates)
			dead[s] = true;
		deleteStatesInternal(dead);
	}

	void deleteStatesInternal(boolean[] dead) {
		boolean debug = false;
		int[] newid = new int[numStates()];
		int n = 0;
		for (int s = 0; s < numStates(); s++) {
			if (dead[s])
				newid[s] = NO_STATE_ID;
			else
				newid[s] = n++;
		}
		if (n == numStates())
			return;
		ArrayList<VectorState> kept = new ArrayList<VectorState>(n);
		for (int s = 0; s < numStates(); s++) {
			if (dead[s])
				continue;
			VectorState vs = states.get(s);
			ArrayList<Tr> trs = new ArrayList<Tr>(vs.trs.size());
			for (Tr tr : vs.trs) {
				int t = newid[tr.nextstate];
				if (t == NO_STATE_ID)
					continue;
				trs.add(t == tr.nextstate ? tr : tr.withNextstate(t));
			}
			vs.trs = trs;
			kept.add(vs);
		}
		if (debug) Debug.debug(debug, "Deleting "+(numStates()-n)+" of "+numStates()+" states");
		states = kept;
		start = start == NO_STATE_ID ? NO_STATE_ID : newid[start];
	}

	// unchecked mutators

	void setStartInternal(int s) {
		start = s;
	}
	void setFinalInternal(int s, float w) {
		states.get(s).finalWeight = w;
	}
	void addTrInternal(int s, Tr tr) {
		states.get(s).trs.add(tr);
	}
	// the live list; callers may change it in place
	ArrayList<Tr> trsForUpdate(int s) {
		return states.get(s).trs;
	}
	void setTrsInternal(int s, ArrayList<Tr> trs) {
		states.get(s).trs = trs;
	}
	void setSemiring(Semiring sr) {
		semiring = sr;
	}
	// takes over the content of another automaton
	void assign(VectorFst other) {
		states = other.states;
		start = other.start;
		semiring = other.semiring;
		isyms = other.isyms;
		osyms = other.osyms;
		ownIsyms = false;
		ownOsyms = false;
	}

	void checkWeight(float w) throws DataFormatException {
		if (!semiring.isMember(w))
			throw new DataFormatException("Weight "+w+" is not a member of the "+semiring.getName()+" semiring");
	}

	// a copy now holds the tables too, so the next change through this automaton clones them
	void shareSymbols() {
		ownIsyms = false;
		ownOsyms = false;
	}

	// symbol tables

	public void setInputSymbols(SymbolTable st) {
		isyms = st;
		ownIsyms = false;
	}
	public void setOutputSymbols(SymbolTable st) {
		osyms = st;
		ownOsyms = false;
	}
	public void setSymbols(Fst other) {
		setInputSymbols(other.getInputSymbols());
		setOutputSymbols(other.getOutputSymbols());
	}
	// copies a shared table before the first change
	public SymbolTable mutableInputSymbols() {
		if (isyms == null)
			isyms = new SymbolTable();
		else if (!ownIsyms)
			isyms = new SymbolTable(isyms);
		ownIsyms = true;
		return isyms;
	}
	public SymbolTable mutableOutputSymbols() {
		if (osyms == null)
			osyms = new SymbolTable();
		else if (!ownOsyms)
			osyms = new SymbolTable(osyms);
		ownOsyms = true;
		return osyms;
	}

	// I/O

	public static VectorFst read(File f) throws IOException, DataFormatException {
		return FstSerializer.read(f).toVectorFst();
	}
	public static VectorFst fromBytes(byte[] data) throws DataFormatException {
		return FstSerializer.fromBytes(data).toVectorFst();
	}
	public VectorFst toVectorFst() {
		return copy();
	}
}
