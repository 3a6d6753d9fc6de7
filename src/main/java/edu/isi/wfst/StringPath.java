package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

// the non-epsilon labels and total weight of one accepting path
public class StringPath {
	private final int[] ilabels;
	private final int[] olabels;
	private final float weight;
	private final SymbolTable isyms;
	private final SymbolTable osyms;

	StringPath(TIntArrayList ilabels, TIntArrayList olabels, float weight, SymbolTable isyms, SymbolTable osyms) {
		this.ilabels = ilabels.toArray();
		this.olabels = olabels.toArray();
		this.weight = weight;
		this.isyms = isyms;
		this.osyms = osyms;
	}

	public int[] getILabels() {
		return ilabels.clone();
	}
	public int[] getOLabels() {
		return olabels.clone();
	}
	public float getWeight() {
		return weight;
	}

	public String istring() throws UnusualConditionException {
		return render(ilabels, isyms);
	}
	public String ostring() throws UnusualConditionException {
		return render(olabels, osyms);
	}

	// symbols through the table if there is one, else the labels themselves
	private static String render(int[] labels, SymbolTable st) throws UnusualConditionException {
		StringBuffer sb = new StringBuffer();
		for (int i = 0; i < labels.length; i++) {
			if (i > 0)
				sb.append(' ');
			if (st == null)
				sb.append(labels[i]);
			else {
				String sym = st.find(labels[i]);
				if (sym == null)
					throw new UnusualConditionException("Label "+labels[i]+" missing from symbol table");
				sb.append(sym);
			}
		}
		return sb.toString();
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		for (int l : ilabels)
			sb.append(l).append(' ');
		sb.append(": ");
		for (int l : olabels)
			sb.append(l).append(' ');
		sb.append("/ ").append(weight);
		return sb.toString();
	}
}
