package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TLongIntHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Composition of two transducers: a path reading x and writing y in the first, joined
 * with a path reading y and writing z in the second, gives a path reading x and
 * writing z whose weight is the product of the two. States of the result are triples of
 * a state of each automaton and a filter state, numbered in the order they are reached.
 * <p>
 * At each state the side with fewer transitions is iterated and the other side is searched,
 * so the first automaton must be sorted on output labels or the second on input labels.
 */
public class Compose {

	public static VectorFst compose(Fst fst1, Fst fst2) throws UnusualConditionException {
		return compose(fst1, fst2, new ComposeConfig());
	}

	public static VectorFst compose(Fst fst1, Fst fst2, ComposeConfig config) throws UnusualConditionException {
		return new Compose(fst1, fst2, config).run();
	}

	private final Fst fst1;
	private final Fst fst2;
	private final Semiring sr;
	private final boolean connect;
	private final Matcher matcher1;
	private final Matcher matcher2;
	private final EpsilonFilter filter;
	// where lookups may be done
	private final boolean lookup1;
	private final boolean lookup2;
	private final VectorFst out;
	// state triples, by result state
	private final TIntArrayList states1 = new TIntArrayList();
	private final TIntArrayList states2 = new TIntArrayList();
	private final TIntArrayList filterStates = new TIntArrayList();
	private final TLongIntHashMap table = new TLongIntHashMap();

	private Compose(Fst fst1, Fst fst2, ComposeConfig config) throws UnusualConditionException {
		if (!fst1.getSemiring().equals(fst2.getSemiring()))
			throw new UnusualConditionException("Can't compose automata over different semirings: "+
					fst1.getSemiring().getName()+" and "+fst2.getSemiring().getName());
		this.fst1 = fst1;
		this.fst2 = fst2;
		sr = fst1.getSemiring();
		connect = config.isConnect();
		matcher1 = config.getMatcher1() == null ? new SortedMatcher(fst1, false) : new SigmaMatcher(fst1, false, config.getMatcher1());
		matcher2 = config.getMatcher2() == null ? new SortedMatcher(fst2, true) : new SigmaMatcher(fst2, true, config.getMatcher2());
		if (matcher1.requireMatch() && !matcher1.canMatch())
			throw new UnusualConditionException("Compose: 1st argument cannot perform required matching (sort?)");
		if (matcher2.requireMatch() && !matcher2.canMatch())
			throw new UnusualConditionException("Compose: 2nd argument cannot perform required matching (sort?)");
		lookup1 = matcher1.canMatch();
		lookup2 = matcher2.canMatch();
		if (!lookup1 && !lookup2)
			throw new UnusualConditionException("Compose: 1st argument cannot match on output labels and "+
					"2nd argument cannot match on input labels (sort?)");
		filter = EpsilonFilter.create(config.getFilter(), fst1, fst2);
		out = new VectorFst(sr);
		out.setInputSymbols(fst1.getInputSymbols());
		out.setOutputSymbols(fst2.getOutputSymbols());
	}

	private VectorFst run() throws UnusualConditionException {
		boolean debug = false;
		if (fst1.start() == Fst.NO_STATE_ID || fst2.start() == Fst.NO_STATE_ID)
			return out;
		out.setStartInternal(findState(fst1.start(), fst2.start(), filter.start()));
		for (int q = 0; q < out.numStates(); q++)
			expand(q);
		if (debug) Debug.debug(debug, "Composition has "+out.numStates()+" states before trimming");
		if (connect)
			Connect.connect(out);
		return out;
	}

	private int findState(int s1, int s2, int fs) {
		// filter states are 0, 1 or 2
		long key = ((long)s1 * fst2.numStates() + s2) * 3 + fs;
		if (table.containsKey(key))
			return table.get(key);
		int q = out.addState();
		table.put(key, q);
		states1.add(s1);
		states2.add(s2);
		filterStates.add(fs);
		return q;
	}

	// true to iterate over the first automaton and search the second
	private boolean matchInput(int s1, int s2) throws UnusualConditionException {
		if (!lookup1)
			return true;
		if (!lookup2)
			return false;
		int p1 = matcher1.priority(s1);
		int p2 = matcher2.priority(s2);
		if (p1 == Matcher.REQUIRE_PRIORITY && p2 == Matcher.REQUIRE_PRIORITY)
			throw new UnusualConditionException("Compose: both sides require matching at states "+s1+" and "+s2);
		if (p1 == Matcher.REQUIRE_PRIORITY)
			return false;
		if (p2 == Matcher.REQUIRE_PRIORITY)
			return true;
		return p1 <= p2;
	}

	private void expand(int q) throws UnusualConditionException {
		int s1 = states1.get(q);
		int s2 = states2.get(q);
		filter.setState(s1, s2, filterStates.get(q));
		if (matchInput(s1, s2)) {
			List<Tr> trs = withLoop(fst1.trsOf(s1), new Tr(Tr.EPS_LABEL, Tr.NO_LABEL, sr.ONE(), s1));
			for (Tr tr1 : trs)
				for (Tr tr2 : matcher2.find(s2, tr1.olabel))
					addTr(q, tr1, tr2);
		}
		else {
			List<Tr> trs = withLoop(fst2.trsOf(s2), new Tr(Tr.NO_LABEL, Tr.EPS_LABEL, sr.ONE(), s2));
			for (Tr tr2 : trs)
				for (Tr tr1 : matcher1.find(s1, tr2.ilabel))
					addTr(q, tr1, tr2);
		}
		if (fst1.hasFinal(s1) && fst2.hasFinal(s2))
			out.setFinalInternal(q, sr.times(fst1.finalOf(s1), fst2.finalOf(s2)));
	}

	private static List<Tr> withLoop(List<Tr> trs, Tr loop) {
		ArrayList<Tr> ret = new ArrayList<Tr>(trs.size()+1);
		ret.add(loop);
		ret.addAll(trs);
		return ret;
	}

	private void addTr(int q, Tr tr1, Tr tr2) {
		int fs = filter.filter(tr1, tr2);
		if (fs == EpsilonFilter.BLOCKED)
			return;
		int next = findState(tr1.nextstate, tr2.nextstate, fs);
		out.addTrInternal(q, new Tr(tr1.ilabel, tr2.olabel, sr.times(tr1.weight, tr2.weight), next));
	}
}
