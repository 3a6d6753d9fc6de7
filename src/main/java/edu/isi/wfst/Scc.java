package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.List;

// strongly connected components, accessibility and coaccessibility of an automaton.
// Components are found with an iterative Tarjan search starting at the start state
// and then at every unvisited state; ids are in topological order
class Scc {
	// component of each state
	final int[] scc;
	final int nscc;
	final boolean[] access;
	final boolean[] coaccess;
	final boolean cyclic;

	private Scc(int[] scc, int nscc, boolean[] access, boolean[] coaccess, boolean cyclic) {
		this.scc = scc;
		this.nscc = nscc;
		this.access = access;
		this.coaccess = coaccess;
		this.cyclic = cyclic;
	}

	static Scc compute(Fst fst) {
		return compute(fst, TrFilter.ANY);
	}

	// only transitions accepted by the filter are followed
	static Scc compute(Fst fst, TrFilter filter) {
		int n = fst.numStates();
		int[] idx = new int[n];
		int[] low = new int[n];
		int[] comp = new int[n];
		boolean[] onStack = new boolean[n];
		boolean cyclic = false;
		for (int s = 0; s < n; s++)
			idx[s] = -1;
		int index = 0;
		int ncomp = 0;
		TIntArrayStack stack = new TIntArrayStack();
		TIntArrayList callStates = new TIntArrayList();
		TIntArrayList callPos = new TIntArrayList();
		int start = fst.start();
		for (int r = -1; r < n; r++) {
			int root = r == -1 ? start : r;
			if (root == Fst.NO_STATE_ID || idx[root] != -1)
				continue;
			idx[root] = low[root] = index++;
			stack.push(root);
			onStack[root] = true;
			callStates.add(root);
			callPos.add(0);
			while (!callStates.isEmpty()) {
				int top = callStates.size()-1;
				int v = callStates.get(top);
				int p = callPos.get(top);
				List<Tr> trs = fst.trsOf(v);
				if (p < trs.size()) {
					callPos.set(top, p+1);
					Tr tr = trs.get(p);
					if (!filter.accept(tr))
						continue;
					int w = tr.nextstate;
					if (w == v)
						cyclic = true;
					if (idx[w] == -1) {
						idx[w] = low[w] = index++;
						stack.push(w);
						onStack[w] = true;
						callStates.add(w);
						callPos.add(0);
					}
					else if (onStack[w]) {
						low[v] = Math.min(low[v], idx[w]);
					}
				}
				else {
					callStates.removeAt(top);
					callPos.removeAt(top);
					if (low[v] == idx[v]) {
						int size = 0;
						int w;
						do {
							w = stack.pop();
							onStack[w] = false;
							comp[w] = ncomp;
							size++;
						} while (w != v);
						if (size > 1)
							cyclic = true;
						ncomp++;
					}
					if (!callStates.isEmpty()) {
						int u = callStates.get(callStates.size()-1);
						low[u] = Math.min(low[u], low[v]);
					}
				}
			}
		}
		// Tarjan finishes sinks first
		for (int s = 0; s < n; s++)
			comp[s] = ncomp - 1 - comp[s];
		return new Scc(comp, ncomp, accessible(fst, filter), coaccessible(fst, filter), cyclic);
	}

	private static boolean[] accessible(Fst fst, TrFilter filter) {
		boolean[] seen = new boolean[fst.numStates()];
		if (fst.start() == Fst.NO_STATE_ID)
			return seen;
		TIntArrayStack todo = new TIntArrayStack();
		todo.push(fst.start());
		seen[fst.start()] = true;
		while (todo.size() > 0) {
			int s = todo.pop();
			for (Tr tr : fst.trsOf(s)) {
				if (filter.accept(tr) && !seen[tr.nextstate]) {
					seen[tr.nextstate] = true;
					todo.push(tr.nextstate);
				}
			}
		}
		return seen;
	}

	private static boolean[] coaccessible(Fst fst, TrFilter filter) {
		int n = fst.numStates();
		TIntArrayList[] preds = new TIntArrayList[n];
		for (int s = 0; s < n; s++)
			preds[s] = new TIntArrayList();
		for (int s = 0; s < n; s++)
			for (Tr tr : fst.trsOf(s))
				if (filter.accept(tr))
					preds[tr.nextstate].add(s);
		boolean[] seen = new boolean[n];
		TIntArrayStack todo = new TIntArrayStack();
		for (int s = 0; s < n; s++) {
			if (fst.hasFinal(s)) {
				seen[s] = true;
				todo.push(s);
			}
		}
		while (todo.size() > 0) {
			int s = todo.pop();
			for (int i = 0; i < preds[s].size(); i++) {
				int p = preds[s].get(i);
				if (!seen[p]) {
					seen[p] = true;
					todo.push(p);
				}
			}
		}
		return seen;
	}
}
