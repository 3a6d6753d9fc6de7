package edu.isi.wfst;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Read-only view of a weighted finite-state transducer. States are dense ids in
 * [0, numStates()); a final weight of ZERO means the state is not final. There are
 * exactly two kinds: the mutable {@link VectorFst} and the compact, immutable
 * {@link ConstFst}.
 */
public abstract class Fst {
	public static final int NO_STATE_ID = -1;

	protected Semiring semiring;
	protected SymbolTable isyms = null;
	protected SymbolTable osyms = null;

	// only the two kinds in this package
	Fst(Semiring semiring) {
		this.semiring = semiring;
	}

	// NO_STATE_ID if the automaton has no start
	public abstract int start();
	public abstract int numStates();
	// unchecked accessors for the algorithms
	abstract float finalOf(int s);
	abstract List<Tr> trsOf(int s);

	public Semiring getSemiring() {
		return semiring;
	}
	public SymbolTable getInputSymbols() {
		return isyms;
	}
	public SymbolTable getOutputSymbols() {
		return osyms;
	}

	// called when a copy starts sharing this automaton's symbol tables
	void shareSymbols() {
	}

	void checkState(int s) throws StateOutOfRangeException {
		if (s < 0 || s >= numStates())
			throw new StateOutOfRangeException("State "+s+" out of range [0, "+numStates()+")");
	}

	public float finalWeight(int s) throws StateOutOfRangeException {
		checkState(s);
		return finalOf(s);
	}
	public boolean isFinal(int s) throws StateOutOfRangeException {
		checkState(s);
		return !semiring.isZero(finalOf(s));
	}
	public int numTrs(int s) throws StateOutOfRangeException {
		checkState(s);
		return trsOf(s).size();
	}
	// unmodifiable
	public List<Tr> getTrs(int s) throws StateOutOfRangeException {
		checkState(s);
		return trsOf(s);
	}
	public int numInputEpsilons(int s) throws StateOutOfRangeException {
		checkState(s);
		return countInputEpsilons(s);
	}
	public int numOutputEpsilons(int s) throws StateOutOfRangeException {
		checkState(s);
		return countOutputEpsilons(s);
	}
	int countInputEpsilons(int s) {
		int n = 0;
		for (Tr tr : trsOf(s))
			if (tr.ilabel == Tr.EPS_LABEL)
				n++;
		return n;
	}
	int countOutputEpsilons(int s) {
		int n = 0;
		for (Tr tr : trsOf(s))
			if (tr.olabel == Tr.EPS_LABEL)
				n++;
		return n;
	}
	boolean hasFinal(int s) {
		return !semiring.isZero(finalOf(s));
	}

	// total number of transitions
	public int numTrs() {
		int n = 0;
		for (int s = 0; s < numStates(); s++)
			n += trsOf(s).size();
		return n;
	}

	public TrIterator trIterator(int s) throws StateOutOfRangeException {
		checkState(s);
		return new TrIterator(trsOf(s));
	}
	public StateIterator stateIterator() {
		return new StateIterator(numStates());
	}
	// accepting paths. Only finite for path-finite automata
	public StringPathsIterator paths() {
		return new StringPathsIterator(this);
	}

	public boolean isomorphic(Fst other) throws UnusualConditionException {
		return Isomorphic.isomorphic(this, other, Semiring.KDELTA);
	}

	public VectorFst toVectorFst() {
		return new VectorFst(this);
	}
	public ConstFst toConstFst() {
		return new ConstFst(this);
	}

	public void write(File f) throws IOException {
		FstSerializer.write(this, f);
	}
	public byte[] toBytes() {
		return FstSerializer.toBytes(this);
	}
	// AT&T text form
	public String toText() {
		return FstText.print(this);
	}

	// structural equality: same semiring, start, finals, transitions in order and symbol tables
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Fst))
			return false;
		Fst f = (Fst)o;
		if (!semiring.equals(f.semiring) || start() != f.start() || numStates() != f.numStates())
			return false;
		if (isyms == null ? f.isyms != null : !isyms.equals(f.isyms))
			return false;
		if (osyms == null ? f.osyms != null : !osyms.equals(f.osyms))
			return false;
		for (int s = 0; s < numStates(); s++) {
			if (Float.compare(finalOf(s), f.finalOf(s)) != 0)
				return false;
			if (!trsOf(s).equals(f.trsOf(s)))
				return false;
		}
		return true;
	}
	public int hashCode() {
		int h = start();
		for (int s = 0; s < numStates(); s++) {
			h = h*31 + Float.floatToIntBits(finalOf(s));
			h = h*31 + trsOf(s).hashCode();
		}
		return h;
	}
	public String toString() {
		return toText();
	}
}
