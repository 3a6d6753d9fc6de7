package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;

/**
 * Weight and label pushing. Weights are moved with the shortest distance as the
 * potential of each state; labels with the longest common prefix (toward the initial
 * state) or suffix (toward the finals) of the output strings through each state.
 */
public class Push {
	private static final int[] EMPTY = new int[0];

	// a transition whose output is a string of labels, before factoring
	private static class StringTr {
		final int ilabel;
		int[] out;
		float weight;
		final int nextstate;
		StringTr(int ilabel, int[] out, float weight, int nextstate) {
			this.ilabel = ilabel;
			this.out = out;
			this.weight = weight;
			this.nextstate = nextstate;
		}
	}

	public static VectorFst push(Fst fst, boolean toFinal, boolean pushWeights, boolean pushLabels,
			boolean removeTotalWeight, boolean removeCommonAffix) throws UnusualConditionException {
		return push(fst, toFinal ? ReweightType.REWEIGHT_TO_FINAL : ReweightType.REWEIGHT_TO_INITIAL,
				PushType.of(pushWeights, pushLabels, removeTotalWeight, removeCommonAffix), Semiring.KDELTA);
	}
	public static VectorFst push(Fst fst, ReweightType rtype, EnumSet<PushType> ptype) throws UnusualConditionException {
		return push(fst, rtype, ptype, Semiring.KDELTA);
	}

	// new automaton; the input is untouched
	public static VectorFst push(Fst fst, ReweightType rtype, EnumSet<PushType> ptype, float delta) throws UnusualConditionException {
		if (ptype.contains(PushType.PUSH_LABELS))
			return pushLabels(fst, rtype, ptype, delta);
		VectorFst out = new VectorFst(fst);
		if (ptype.contains(PushType.PUSH_WEIGHTS))
			pushWeights(out, rtype, ptype.contains(PushType.REMOVE_TOTAL_WEIGHT), delta);
		return out;
	}

	// in place
	public static void pushWeights(VectorFst fst, ReweightType rtype, boolean removeTotalWeight, float delta) throws UnusualConditionException {
		boolean toInitial = rtype == ReweightType.REWEIGHT_TO_INITIAL;
		float[] d = ShortestDistance.shortestDistance(fst, toInitial, delta);
		float total = totalWeight(fst, d, toInitial);
		reweight(fst, d, rtype);
		if (removeTotalWeight)
			removeWeight(fst, total, !toInitial);
	}

	// weight of all paths, taken at the start (to initial) or summed over the finals (to final)
	private static float totalWeight(Fst fst, float[] d, boolean toInitial) {
		Semiring sr = fst.getSemiring();
		if (toInitial)
			return fst.start() == Fst.NO_STATE_ID ? sr.ZERO() : d[fst.start()];
		float sum = sr.ZERO();
		for (int s = 0; s < d.length; s++)
			sum = sr.plus(sum, sr.times(d[s], fst.finalOf(s)));
		return sum;
	}

	private static void removeWeight(VectorFst fst, float w, boolean atFinal) throws UnusualConditionException {
		Semiring sr = fst.getSemiring();
		if (sr.isOne(w) || sr.isZero(w))
			return;
		if (atFinal) {
			for (int s = 0; s < fst.numStates(); s++)
				if (fst.hasFinal(s))
					fst.setFinalInternal(s, sr.divide(fst.finalOf(s), w));
		}
		else if (fst.start() != Fst.NO_STATE_ID) {
			int start = fst.start();
			ArrayList<Tr> trs = fst.trsForUpdate(start);
			for (int i = 0; i < trs.size(); i++)
				trs.set(i, trs.get(i).withWeight(sr.divide(trs.get(i).weight, w)));
			if (fst.hasFinal(start))
				fst.setFinalInternal(start, sr.divide(fst.finalOf(start), w));
		}
	}

	/**
	 * Reweights every transition with the given state potentials, in place. Toward the
	 * initial state a transition s->t becomes d[s]^-1 w d[t]; toward the finals d[s] w d[t]^-1.
	 * The potential of the start is put on the start's transitions when the start is on
	 * no cycle, otherwise on an epsilon transition from a new start.
	 */
	public static void reweight(VectorFst fst, float[] potentials, ReweightType rtype) throws UnusualConditionException {
		reweight(fst, potentials, rtype, false);
	}

	// with startOnFinals, a start on a cycle passes its potential to every final weight instead
	// of getting a new start state. Every path ends in exactly one final, so this needs Times to commute
	static void reweight(VectorFst fst, float[] potentials, ReweightType rtype, boolean startOnFinals) throws UnusualConditionException {
		Semiring sr = fst.getSemiring();
		int n = fst.numStates();
		if (n == 0)
			return;
		boolean toInitial = rtype == ReweightType.REWEIGHT_TO_INITIAL;
		for (int s = 0; s < n; s++) {
			float ds = potential(potentials, s, sr);
			if (sr.isZero(ds))
				continue;
			ArrayList<Tr> trs = fst.trsForUpdate(s);
			for (int i = 0; i < trs.size(); i++) {
				Tr tr = trs.get(i);
				float dt = potential(potentials, tr.nextstate, sr);
				if (sr.isZero(dt))
					continue;
				float w = toInitial ? sr.divide(sr.times(tr.weight, dt), ds) : sr.divide(sr.times(ds, tr.weight), dt);
				trs.set(i, tr.withWeight(w));
			}
		}
		for (int s = 0; s < n; s++) {
			if (!fst.hasFinal(s))
				continue;
			float ds = potential(potentials, s, sr);
			if (!toInitial)
				fst.setFinalInternal(s, sr.times(fst.finalOf(s), ds));
			else if (!sr.isZero(ds))
				fst.setFinalInternal(s, sr.divide(fst.finalOf(s), ds));
		}
		int start = fst.start();
		if (start == Fst.NO_STATE_ID)
			return;
		float ds = potential(potentials, start, sr);
		if (sr.isOne(ds) || sr.isZero(ds))
			return;
		float w = toInitial ? ds : sr.divide(sr.ONE(), ds);
		if (FstProperties.isInitialAcyclic(fst)) {
			ArrayList<Tr> trs = fst.trsForUpdate(start);
			for (int i = 0; i < trs.size(); i++)
				trs.set(i, trs.get(i).withWeight(sr.times(w, trs.get(i).weight)));
			if (fst.hasFinal(start))
				fst.setFinalInternal(start, sr.times(w, fst.finalOf(start)));
		}
		else if (startOnFinals) {
			for (int s = 0; s < n; s++)
				if (fst.hasFinal(s))
					fst.setFinalInternal(s, sr.times(fst.finalOf(s), w));
		}
		else {
			int ns = fst.addState();
			fst.addTrInternal(ns, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, w, start));
			fst.setStartInternal(ns);
		}
	}

	// states past the end of the potentials have potential ZERO
	private static float potential(float[] potentials, int s, Semiring sr) {
		return s < potentials.length ? potentials[s] : sr.ZERO();
	}

	// label pushing, with weight pushing if asked for
	private static VectorFst pushLabels(Fst ifst, ReweightType rtype, EnumSet<PushType> ptype, float delta) throws UnusualConditionException {
		boolean debug = false;
		Semiring sr = ifst.getSemiring();
		boolean toInitial = rtype == ReweightType.REWEIGHT_TO_INITIAL;
		boolean pushWeights = ptype.contains(PushType.PUSH_WEIGHTS);
		int n = ifst.numStates();
		// without weight pushing every potential is ONE
		float[] d = new float[n];
		if (pushWeights)
			d = ShortestDistance.shortestDistance(ifst, toInitial, delta);
		else
			Arrays.fill(d, sr.ONE());
		int[][] p = toInitial ? prefixPotentials(ifst) : suffixPotentials(ifst);

		ArrayList<ArrayList<StringTr>> trs = new ArrayList<ArrayList<StringTr>>(n);
		float[] finals = new float[n];
		int[][] finalStrings = new int[n][];
		for (int s = 0; s < n; s++) {
			ArrayList<StringTr> l = new ArrayList<StringTr>();
			for (Tr tr : ifst.trsOf(s))
				l.add(new StringTr(tr.ilabel, tr.olabel == Tr.EPS_LABEL ? EMPTY : new int[] { tr.olabel }, tr.weight, tr.nextstate));
			trs.add(l);
			finals[s] = ifst.finalOf(s);
			finalStrings[s] = EMPTY;
		}
		float totalW = totalWeight(ifst, d, toInitial);
		int[] totalS = null;

		for (int s = 0; s < n; s++) {
			for (StringTr tr : trs.get(s)) {
				int t = tr.nextstate;
				if (p[s] != null && p[t] != null) {
					if (toInitial)
						tr.out = leftDivide(p[s], concat(tr.out, p[t]));
					else
						tr.out = rightDivide(concat(p[s], tr.out), p[t]);
				}
				if (!sr.isZero(d[s]) && !sr.isZero(d[t]))
					tr.weight = toInitial ? sr.divide(sr.times(tr.weight, d[t]), d[s]) : sr.divide(sr.times(d[s], tr.weight), d[t]);
			}
			if (sr.isZero(finals[s]))
				continue;
			if (toInitial) {
				if (!sr.isZero(d[s]))
					finals[s] = sr.divide(finals[s], d[s]);
			}
			else {
				finals[s] = sr.times(finals[s], d[s]);
				if (p[s] != null) {
					finalStrings[s] = p[s];
					totalS = totalS == null ? p[s] : lcs(totalS, p[s]);
				}
			}
		}

		// what is left over at the start
		int start = ifst.start();
		int newStart = start;
		VectorFst out = new VectorFst(sr);
		out.setSymbols(ifst);
		if (start == Fst.NO_STATE_ID)
			return out;
		int[] startS = EMPTY;
		float startW = sr.ONE();
		if (toInitial) {
			if (!ptype.contains(PushType.REMOVE_COMMON_AFFIX) && p[start] != null)
				startS = p[start];
			if (!ptype.contains(PushType.REMOVE_TOTAL_WEIGHT) && !sr.isZero(d[start]))
				startW = d[start];
		}
		else if (!sr.isZero(d[start]))
			startW = sr.divide(sr.ONE(), d[start]);
		if (startS.length > 0 || !sr.isOne(startW)) {
			if (FstProperties.isInitialAcyclic(ifst)) {
				for (StringTr tr : trs.get(start)) {
					tr.out = concat(startS, tr.out);
					tr.weight = sr.times(startW, tr.weight);
				}
				if (!sr.isZero(finals[start])) {
					finalStrings[start] = concat(startS, finalStrings[start]);
					finals[start] = sr.times(startW, finals[start]);
				}
			}
			else {
				ArrayList<StringTr> l = new ArrayList<StringTr>();
				l.add(new StringTr(Tr.EPS_LABEL, startS, startW, start));
				trs.add(l);
				finals = Arrays.copyOf(finals, n+1);
				finals[n] = sr.ZERO();
				finalStrings = Arrays.copyOf(finalStrings, n+1);
				finalStrings[n] = EMPTY;
				newStart = n;
			}
		}
		if (!toInitial) {
			boolean dropW = ptype.contains(PushType.REMOVE_TOTAL_WEIGHT) && !sr.isZero(totalW) && !sr.isOne(totalW);
			boolean dropS = ptype.contains(PushType.REMOVE_COMMON_AFFIX) && totalS != null && totalS.length > 0;
			for (int s = 0; s < finals.length; s++) {
				if (sr.isZero(finals[s]))
					continue;
				if (dropW)
					finals[s] = sr.divide(finals[s], totalW);
				if (dropS)
					finalStrings[s] = rightDivide(finalStrings[s], totalS);
			}
		}
		if (debug) Debug.debug(debug, "Pushed labels over "+n+" states");
		factor(trs, finals, finalStrings, newStart, out);
		return out;
	}

	// turns string outputs into chains of single-label transitions
	private static void factor(ArrayList<ArrayList<StringTr>> trs, float[] finals, int[][] finalStrings,
			int start, VectorFst out) {
		Semiring sr = out.getSemiring();
		int n = trs.size();
		out.addStates(n);
		out.setStartInternal(start);
		StringFactor factor = new StringFactor(out);
		for (int s = 0; s < n; s++) {
			for (StringTr tr : trs.get(s))
				factor.addTr(s, tr.ilabel, tr.out, tr.weight, tr.nextstate);
			if (sr.isZero(finals[s]))
				continue;
			if (finalStrings[s].length == 0)
				out.setFinalInternal(s, finals[s]);
			else
				factor.addFinal(s, finalStrings[s], finals[s]);
		}
	}

	// longest common prefix of the output strings from each state to a final state;
	// null where no final state is reachable
	static int[][] prefixPotentials(Fst fst) {
		int n = fst.numStates();
		int[][] p = new int[n][];
		boolean changed = true;
		while (changed) {
			changed = false;
			for (int s = n-1; s >= 0; s--) {
				int[] cur = fst.hasFinal(s) ? EMPTY : null;
				for (Tr tr : fst.trsOf(s)) {
					int[] pt = p[tr.nextstate];
					if (pt == null)
						continue;
					int[] c = tr.olabel == Tr.EPS_LABEL ? pt : concat(new int[] { tr.olabel }, pt);
					cur = cur == null ? c : lcp(cur, c);
				}
				if (cur != null && (p[s] == null || !Arrays.equals(cur, p[s]))) {
					p[s] = cur;
					changed = true;
				}
			}
		}
		return p;
	}

	// longest common suffix of the output strings from the start to each state;
	// null where the state isn't reachable
	static int[][] suffixPotentials(Fst fst) {
		int n = fst.numStates();
		int[][] p = new int[n][];
		if (fst.start() == Fst.NO_STATE_ID)
			return p;
		p[fst.start()] = EMPTY;
		boolean changed = true;
		while (changed) {
			changed = false;
			int[][] next = new int[n][];
			next[fst.start()] = EMPTY;
			for (int s = 0; s < n; s++) {
				if (p[s] == null)
					continue;
				for (Tr tr : fst.trsOf(s)) {
					int[] c = tr.olabel == Tr.EPS_LABEL ? p[s] : concat(p[s], new int[] { tr.olabel });
					int t = tr.nextstate;
					next[t] = next[t] == null ? c : lcs(next[t], c);
				}
			}
			for (int s = 0; s < n; s++) {
				if (next[s] != null && (p[s] == null || !Arrays.equals(next[s], p[s]))) {
					changed = true;
				}
			}
			p = next;
		}
		return p;
	}

	static int[] concat(int[] a, int[] b) {
		if (a.length == 0)
			return b;
		if (b.length == 0)
			return a;
		TIntArrayList l = new TIntArrayList(a.length+b.length);
		l.add(a);
		l.add(b);
		return l.toArray();
	}
	static int[] lcp(int[] a, int[] b) {
		int i = 0;
		while (i < a.length && i < b.length && a[i] == b[i])
			i++;
		return i == a.length ? a : Arrays.copyOf(a, i);
	}
	static int[] lcs(int[] a, int[] b) {
		int i = 0;
		while (i < a.length && i < b.length && a[a.length-1-i] == b[b.length-1-i])
			i++;
		return i == a.length ? a : Arrays.copyOfRange(a, a.length-i, a.length);
	}
	// b with the prefix a removed
	private static int[] leftDivide(int[] a, int[] b) throws UnusualConditionException {
		if (a.length > b.length || !Arrays.equals(a, Arrays.copyOf(b, a.length)))
			throw new UnusualConditionException("String "+Arrays.toString(a)+" isn't a prefix of "+Arrays.toString(b));
		return Arrays.copyOfRange(b, a.length, b.length);
	}
	// a with the suffix b removed
	private static int[] rightDivide(int[] a, int[] b) throws UnusualConditionException {
		if (b.length > a.length || !Arrays.equals(b, Arrays.copyOfRange(a, a.length-b.length, a.length)))
			throw new UnusualConditionException("String "+Arrays.toString(b)+" isn't a suffix of "+Arrays.toString(a));
		return Arrays.copyOf(a, a.length-b.length);
	}
}
