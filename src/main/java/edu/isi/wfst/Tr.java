package edu.isi.wfst;

import java.util.Comparator;

// a single labeled, weighted transition. Immutable; algorithms build new ones
public class Tr {
	public static final int EPS_LABEL = 0;
	// label of the implicit self-loops used while matching
	public static final int NO_LABEL = -1;

	public final int ilabel;
	public final int olabel;
	public final float weight;
	public final int nextstate;

	public Tr(int ilabel, int olabel, float weight, int nextstate) {
		this.ilabel = ilabel;
		this.olabel = olabel;
		this.weight = weight;
		this.nextstate = nextstate;
	}

	public Tr withLabels(int il, int ol) {
		return new Tr(il, ol, weight, nextstate);
	}
	public Tr withWeight(float w) {
		return new Tr(ilabel, olabel, w, nextstate);
	}
	public Tr withNextstate(int n) {
		return new Tr(ilabel, olabel, weight, n);
	}

	public boolean isEpsilon() {
		return ilabel == EPS_LABEL && olabel == EPS_LABEL;
	}

	public boolean equals(Object o) {
		if (!(o instanceof Tr))
			return false;
		Tr t = (Tr)o;
		return ilabel == t.ilabel && olabel == t.olabel && nextstate == t.nextstate
			&& Float.compare(weight, t.weight) == 0;
	}
	public int hashCode() {
		int h = ilabel;
		h = h*31 + olabel;
		h = h*31 + nextstate;
		h = h*31 + Float.floatToIntBits(weight);
		return h;
	}
	public String toString() {
		return "("+ilabel+", "+olabel+", "+weight+", "+nextstate+")";
	}

	public static final Comparator<Tr> ILABEL_ORDER = new Comparator<Tr>() {
		public int compare(Tr a, Tr b) {
			return Integer.compare(a.ilabel, b.ilabel);
		}
	};
	public static final Comparator<Tr> OLABEL_ORDER = new Comparator<Tr>() {
		public int compare(Tr a, Tr b) {
			return Integer.compare(a.olabel, b.olabel);
		}
	};
	// order used to find parallel transitions
	public static final Comparator<Tr> LABELS_NEXTSTATE_ORDER = new Comparator<Tr>() {
		public int compare(Tr a, Tr b) {
			if (a.ilabel != b.ilabel)
				return Integer.compare(a.ilabel, b.ilabel);
			if (a.olabel != b.olabel)
				return Integer.compare(a.olabel, b.olabel);
			return Integer.compare(a.nextstate, b.nextstate);
		}
	};
	// total order used when comparing automata
	public static final Comparator<Tr> LABELS_WEIGHT_NEXTSTATE_ORDER = new Comparator<Tr>() {
		public int compare(Tr a, Tr b) {
			if (a.ilabel != b.ilabel)
				return Integer.compare(a.ilabel, b.ilabel);
			if (a.olabel != b.olabel)
				return Integer.compare(a.olabel, b.olabel);
			if (a.weight != b.weight)
				return Float.compare(a.weight, b.weight);
			return Integer.compare(a.nextstate, b.nextstate);
		}
	};
}
