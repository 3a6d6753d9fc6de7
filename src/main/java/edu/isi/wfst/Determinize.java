package edu.isi.wfst;

import gnu.trove.map.hash.TIntObjectHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Weighted subset construction. Each state of the result stands for a set of input
 * states, each with the output string and weight still owed to it (its residuals).
 * Transitions leaving a subset are grouped by input label; the group's transition
 * carries the sum of the weights and, for transducers, the output label every
 * residual string starts with, and the rest is left in the residuals of the next subset.
 * <p>
 * Output strings still owed at a final subset are written out on epsilon-input
 * transitions into one shared final state.
 */
public class Determinize {
	private static final int[] EMPTY = new int[0];

	// input state with what is still owed to it
	private static class Element {
		final int state;
		final int[] residual;
		final float weight;
		Element(int state, int[] residual, float weight) {
			this.state = state;
			this.residual = residual;
			this.weight = weight;
		}
	}

	private static final Comparator<Element> ELEMENT_ORDER = new Comparator<Element>() {
		public int compare(Element a, Element b) {
			if (a.state != b.state)
				return a.state < b.state ? -1 : 1;
			return compareStrings(a.residual, b.residual);
		}
	};

	// sorted elements of one result state
	private static class Subset {
		final Element[] elements;
		private final int hash;
		Subset(ArrayList<Element> l) {
			elements = l.toArray(new Element[l.size()]);
			int h = 0;
			for (Element e : elements)
				h = (h*31 + e.state)*31 + Arrays.hashCode(e.residual) + Float.floatToIntBits(e.weight);
			hash = h;
		}
		public int hashCode() {
			return hash;
		}
		public boolean equals(Object o) {
			if (!(o instanceof Subset))
				return false;
			Subset other = (Subset)o;
			if (other.hash != hash || other.elements.length != elements.length)
				return false;
			for (int i = 0; i < elements.length; i++) {
				Element a = elements[i];
				Element b = other.elements[i];
				if (a.state != b.state || a.weight != b.weight || !Arrays.equals(a.residual, b.residual))
					return false;
			}
			return true;
		}
	}

	public static VectorFst determinize(Fst fst) throws UnusualConditionException {
		return determinize(fst, new DeterminizeConfig());
	}

	public static VectorFst determinize(Fst fst, DeterminizeConfig config) throws UnusualConditionException {
		return new Determinize(fst, config).run();
	}

	private final Fst fst;
	private final Semiring sr;
	private final DeterminizeType type;
	private final float delta;
	private final boolean acceptor;
	private final VectorFst out;
	private final StringFactor factor;
	private final HashMap<Subset, Integer> table = new HashMap<Subset, Integer>();
	// subset of each result state; states of the output chains have none
	private final TIntObjectHashMap<Subset> subsets = new TIntObjectHashMap<Subset>();

	private Determinize(Fst fst, DeterminizeConfig config) throws UnusualConditionException {
		this.fst = fst;
		sr = fst.getSemiring();
		acceptor = FstProperties.isAcceptor(fst);
		// acceptors never owe strings
		type = acceptor ? DeterminizeType.FUNCTIONAL : config.getType();
		delta = config.getDelta();
		if (type == DeterminizeType.DISAMBIGUATE && !sr.hasPathProperty())
			throw new UnusualConditionException("Disambiguating determinization needs a semiring with the path property, not "+sr.getName());
		out = new VectorFst(sr);
		out.setSymbols(fst);
		factor = new StringFactor(out);
	}

	private VectorFst run() throws UnusualConditionException {
		boolean debug = false;
		if (fst.start() == Fst.NO_STATE_ID)
			return out;
		ArrayList<Element> first = new ArrayList<Element>();
		first.add(new Element(fst.start(), EMPTY, sr.ONE()));
		out.setStartInternal(findState(new Subset(first)));
		// chain states are added along the way too; they have no subset and nothing to expand
		for (int q = 0; q < out.numStates(); q++) {
			Subset subset = subsets.get(q);
			if (subset != null)
				expand(q, subset);
		}
		if (debug) Debug.debug(debug, "Determinized "+fst.numStates()+" states into "+out.numStates());
		return out;
	}

	private int findState(Subset subset) {
		Integer id = table.get(subset);
		if (id != null)
			return id;
		int s = out.addState();
		table.put(subset, s);
		subsets.put(s, subset);
		return s;
	}

	private void expand(int q, Subset subset) throws UnusualConditionException {
		TreeMap<Integer, ArrayList<Element>> byLabel = new TreeMap<Integer, ArrayList<Element>>();
		for (Element e : subset.elements) {
			for (Tr tr : fst.trsOf(e.state)) {
				int[] residual = acceptor || tr.olabel == Tr.EPS_LABEL ? e.residual : Push.concat(e.residual, new int[] { tr.olabel });
				ArrayList<Element> l = byLabel.get(tr.ilabel);
				if (l == null) {
					l = new ArrayList<Element>();
					byLabel.put(tr.ilabel, l);
				}
				l.add(new Element(tr.nextstate, residual, sr.times(e.weight, tr.weight)));
			}
		}
		for (Map.Entry<Integer, ArrayList<Element>> entry : byLabel.entrySet()) {
			int label = entry.getKey();
			ArrayList<Element> l = entry.getValue();
			float w = sr.ZERO();
			int[] prefix = null;
			for (Element e : l) {
				w = sr.plus(w, e.weight);
				prefix = commonLabel(prefix, e.residual);
			}
			// nothing with a usable weight reads this label
			if (sr.isZero(w))
				continue;
			ArrayList<Element> next = new ArrayList<Element>();
			for (Element e : merge(l)) {
				if (sr.isZero(e.weight))
					continue;
				next.add(new Element(e.state, Arrays.copyOfRange(e.residual, prefix.length, e.residual.length),
						sr.quantize(sr.divide(e.weight, w), delta)));
			}
			Collections.sort(next, ELEMENT_ORDER);
			int olabel = acceptor ? label : prefix.length == 0 ? Tr.EPS_LABEL : prefix[0];
			out.addTrInternal(q, new Tr(label, olabel, w, findState(new Subset(next))));
		}
		addFinal(q, subset);
	}

	// combines elements for the same input state (the same state and string when
	// nonfunctional), in order of first appearance
	private ArrayList<Element> merge(ArrayList<Element> l) throws UnusualConditionException {
		ArrayList<Element> ret = new ArrayList<Element>();
		HashMap<String, Integer> position = new HashMap<String, Integer>();
		for (Element e : l) {
			String key = type == DeterminizeType.NON_FUNCTIONAL ? e.state+":"+Arrays.toString(e.residual) : String.valueOf(e.state);
			Integer p = position.get(key);
			if (p == null) {
				position.put(key, ret.size());
				ret.add(e);
			}
			else
				ret.set(p, combine(ret.get(p), e));
		}
		return ret;
	}

	private Element combine(Element a, Element b) throws UnusualConditionException {
		switch (type) {
		case DISAMBIGUATE:
			return prefer(a, b) ? a : b;
		case FUNCTIONAL:
			if (!Arrays.equals(a.residual, b.residual))
				throw new UnusualConditionException("Determinize: non-functional input; state "+a.state+" is reached with outputs "+
						Arrays.toString(a.residual)+" and "+Arrays.toString(b.residual));
			return new Element(a.state, a.residual, sr.plus(a.weight, b.weight));
		default:
			return new Element(a.state, a.residual, sr.plus(a.weight, b.weight));
		}
	}

	// a is kept over b: better weight, then smaller string
	private boolean prefer(Element a, Element b) {
		if (sr.better(a.weight, b.weight))
			return true;
		if (sr.better(b.weight, a.weight))
			return false;
		return compareStrings(a.residual, b.residual) <= 0;
	}

	private void addFinal(int q, Subset subset) throws UnusualConditionException {
		ArrayList<Element> finals = new ArrayList<Element>();
		for (Element e : subset.elements) {
			if (!fst.hasFinal(e.state))
				continue;
			float w = sr.times(e.weight, fst.finalOf(e.state));
			if (!sr.isZero(w))
				finals.add(new Element(Fst.NO_STATE_ID, e.residual, w));
		}
		if (finals.isEmpty())
			return;
		// all final outputs meet in one pseudo state, so merging compares the strings
		ArrayList<Element> merged;
		if (type == DeterminizeType.NON_FUNCTIONAL) {
			merged = merge(finals);
			Collections.sort(merged, ELEMENT_ORDER);
		}
		else {
			Element best = finals.get(0);
			for (int i = 1; i < finals.size(); i++)
				best = combine(best, finals.get(i));
			merged = new ArrayList<Element>();
			merged.add(best);
		}
		for (Element e : merged) {
			if (e.residual.length == 0)
				out.setFinalInternal(q, e.weight);
			else
				factor.addFinal(q, e.residual, e.weight);
		}
	}

	// the leading label all strings so far share; null before the first string
	private static int[] commonLabel(int[] prefix, int[] s) {
		if (prefix == null)
			return s.length == 0 ? EMPTY : new int[] { s[0] };
		if (prefix.length == 0 || s.length == 0 || s[0] != prefix[0])
			return EMPTY;
		return prefix;
	}

	// lexicographic; a proper prefix comes first
	static int compareStrings(int[] a, int[] b) {
		for (int i = 0; i < a.length && i < b.length; i++)
			if (a[i] != b[i])
				return a[i] < b[i] ? -1 : 1;
		return a.length - b.length;
	}
}
