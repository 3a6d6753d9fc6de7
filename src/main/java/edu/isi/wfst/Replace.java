package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

/**
 * Recursive substitution of automata for non-terminals. Each automaton is registered under
 * a label; a transition whose output label is a registered label is replaced by a call into
 * that automaton, and its finals return to the transition's destination.
 * <p>
 * The result is built by expanding tuples of (call stack, automaton, state) from the root's
 * start, numbered in the order they are reached. Call stacks are interned: each one is its
 * parent stack with one more (automaton, return state) frame on top.
 */
public class Replace {

	// one call: the caller's stack, the caller and where to come back to
	private static class Frame {
		final int parent;
		final int fst;
		final int returnState;
		Frame(int parent, int fst, int returnState) {
			this.parent = parent;
			this.fst = fst;
			this.returnState = returnState;
		}
		public boolean equals(Object o) {
			if (!(o instanceof Frame))
				return false;
			Frame f = (Frame)o;
			return parent == f.parent && fst == f.fst && returnState == f.returnState;
		}
		public int hashCode() {
			return (parent*31 + fst)*31 + returnState;
		}
	}

	private static class Tuple {
		final int prefix;
		final int fst;
		final int state;
		Tuple(int prefix, int fst, int state) {
			this.prefix = prefix;
			this.fst = fst;
			this.state = state;
		}
		public boolean equals(Object o) {
			if (!(o instanceof Tuple))
				return false;
			Tuple t = (Tuple)o;
			return prefix == t.prefix && fst == t.fst && state == t.state;
		}
		public int hashCode() {
			return (prefix*31 + fst)*31 + state;
		}
	}

	// fsts maps each non-terminal to its automaton; the root must be one of them.
	// With epsilonOnReplace, call transitions have no labels; otherwise they keep the input label
	public static VectorFst replace(int rootLabel, Map<Integer, ? extends Fst> fsts, boolean epsilonOnReplace)
	throws ConfigureException, UnusualConditionException {
		return new Replace(rootLabel, fsts, epsilonOnReplace).run();
	}

	private final Fst[] fsts;
	// automaton index of each registered label
	private final TIntIntHashMap index = new TIntIntHashMap();
	private final int root;
	private final boolean epsilonOnReplace;
	private final Semiring sr;
	private final VectorFst out;
	// prefix 0 is the empty stack and has no frame
	private final ArrayList<Frame> frames = new ArrayList<Frame>();
	private final HashMap<Frame, Integer> prefixes = new HashMap<Frame, Integer>();
	private final ArrayList<Tuple> tuples = new ArrayList<Tuple>();
	private final HashMap<Tuple, Integer> table = new HashMap<Tuple, Integer>();

	private Replace(int rootLabel, Map<Integer, ? extends Fst> map, boolean epsilonOnReplace)
	throws ConfigureException, UnusualConditionException {
		if (!map.containsKey(rootLabel))
			throw new ConfigureException("Replace: root label "+rootLabel+" has no automaton");
		fsts = new Fst[map.size()];
		int i = 0;
		for (Map.Entry<Integer, ? extends Fst> e : map.entrySet()) {
			fsts[i] = e.getValue();
			index.put(e.getKey(), i);
			i++;
		}
		root = index.get(rootLabel);
		sr = fsts[root].getSemiring();
		for (Fst f : fsts)
			if (!f.getSemiring().equals(sr))
				throw new UnusualConditionException("Can't replace with automata over different semirings: "+
						sr.getName()+" and "+f.getSemiring().getName());
		this.epsilonOnReplace = epsilonOnReplace;
		checkDependencies();
		out = new VectorFst(sr);
		out.setSymbols(fsts[root]);
		frames.add(null);
	}

	// the expansion only terminates if no non-terminal reachable from the root calls itself
	private void checkDependencies() throws UnusualConditionException {
		int n = fsts.length;
		TIntArrayList[] calls = new TIntArrayList[n];
		for (int f = 0; f < n; f++) {
			calls[f] = new TIntArrayList();
			for (int s = 0; s < fsts[f].numStates(); s++)
				for (Tr tr : fsts[f].trsOf(s))
					if (index.containsKey(tr.olabel) && !calls[f].contains(index.get(tr.olabel)))
						calls[f].add(index.get(tr.olabel));
		}
		// 0 unvisited, 1 on the stack, 2 done
		int[] color = new int[n];
		TIntArrayStack stack = new TIntArrayStack();
		TIntArrayStack next = new TIntArrayStack();
		stack.push(root);
		next.push(0);
		color[root] = 1;
		while (stack.size() > 0) {
			int f = stack.peek();
			int p = next.pop();
			if (p == calls[f].size()) {
				color[f] = 2;
				stack.pop();
				continue;
			}
			next.push(p+1);
			int g = calls[f].get(p);
			if (color[g] == 1)
				throw new UnusualConditionException("Replace: cyclic dependency between non-terminals through automaton "+g);
			if (color[g] == 0) {
				color[g] = 1;
				stack.push(g);
				next.push(0);
			}
		}
	}

	private VectorFst run() {
		boolean debug = false;
		Fst rootFst = fsts[root];
		if (rootFst.start() == Fst.NO_STATE_ID)
			return out;
		out.setStartInternal(findState(0, root, rootFst.start()));
		for (int q = 0; q < out.numStates(); q++)
			expand(q);
		if (debug) Debug.debug(debug, "Replace built "+out.numStates()+" states using "+(frames.size()-1)+" call frames");
		return out;
	}

	private int findState(int prefix, int fst, int state) {
		Tuple t = new Tuple(prefix, fst, state);
		Integer id = table.get(t);
		if (id != null)
			return id;
		int q = out.addState();
		table.put(t, q);
		tuples.add(t);
		return q;
	}

	private int findPrefix(Frame f) {
		Integer id = prefixes.get(f);
		if (id != null)
			return id;
		int p = frames.size();
		frames.add(f);
		prefixes.put(f, p);
		return p;
	}

	private void expand(int q) {
		Tuple t = tuples.get(q);
		Fst fst = fsts[t.fst];
		if (fst.hasFinal(t.state)) {
			if (t.prefix == 0)
				out.setFinalInternal(q, fst.finalOf(t.state));
			else {
				Frame top = frames.get(t.prefix);
				int ret = findState(top.parent, top.fst, top.returnState);
				out.addTrInternal(q, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, fst.finalOf(t.state), ret));
			}
		}
		for (Tr tr : fst.trsOf(t.state)) {
			if (!index.containsKey(tr.olabel)) {
				out.addTrInternal(q, tr.withNextstate(findState(t.prefix, t.fst, tr.nextstate)));
				continue;
			}
			int callee = index.get(tr.olabel);
			int calleeStart = fsts[callee].start();
			// nothing to call into
			if (calleeStart == Fst.NO_STATE_ID)
				continue;
			int prefix = findPrefix(new Frame(t.prefix, t.fst, tr.nextstate));
			int next = findState(prefix, callee, calleeStart);
			int ilabel = epsilonOnReplace ? Tr.EPS_LABEL : tr.ilabel;
			out.addTrInternal(q, new Tr(ilabel, Tr.EPS_LABEL, tr.weight, next));
		}
	}
}
