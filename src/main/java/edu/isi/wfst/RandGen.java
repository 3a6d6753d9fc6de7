package edu.isi.wfst;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Random paths through an automaton. All npath samples start together at the start state;
 * at each state every sample picks a transition (or stopping, at a final state), and the
 * samples that picked the same one move on together. This gives a tree of sample counts.
 * Unweighted output is one linear path per sample that stopped; weighted output is the tree
 * itself, each branch weighted by the negative log of the share of samples that took it.
 */
public class RandGen {

	// a node of the sample tree
	private static class Sample {
		final int state;
		final int nsamples;
		final int length;
		Sample(int state, int nsamples, int length) {
			this.state = state;
			this.nsamples = nsamples;
			this.length = length;
		}
	}

	public static VectorFst randGen(Fst fst) throws UnusualConditionException {
		return randGen(fst, new RandGenConfig());
	}

	public static VectorFst randGen(Fst fst, RandGenConfig config) throws UnusualConditionException {
		boolean debug = false;
		Semiring sr = fst.getSemiring();
		VectorFst out = new VectorFst(sr);
		out.setSymbols(fst);
		if (fst.start() == Fst.NO_STATE_ID || config.getNPath() <= 0)
			return out;
		Random rand = config.getSeed() == 0 ? new Random() : new Random(config.getSeed());
		int npath = config.getNPath();
		boolean weighted = config.isWeighted();

		VectorFst tree = weighted ? out : new VectorFst(sr);
		ArrayList<Sample> samples = new ArrayList<Sample>();
		samples.add(new Sample(fst.start(), npath, 0));
		tree.setStartInternal(tree.addState());
		// unweighted only: every stopped sample is a transition into this state
		int superfinal = Fst.NO_STATE_ID;
		for (int q = 0; q < samples.size(); q++) {
			Sample r = samples.get(q);
			if (r.state == Fst.NO_STATE_ID)
				continue;
			List<Tr> trs = fst.trsOf(r.state);
			boolean isFinal = fst.hasFinal(r.state);
			if ((trs.isEmpty() && !isFinal) || r.length == config.getMaxLength())
				continue;
			// position trs.size() stands for stopping
			TreeMap<Integer, Integer> counts = new TreeMap<Integer, Integer>();
			for (int i = 0; i < r.nsamples; i++) {
				int pos = select(fst, r.state, config.getSelector(), rand);
				Integer c = counts.get(pos);
				counts.put(pos, c == null ? 1 : c+1);
			}
			for (Map.Entry<Integer, Integer> e : counts.entrySet()) {
				int pos = e.getKey();
				int count = e.getValue();
				float prob = (float)count / r.nsamples;
				if (pos < trs.size()) {
					Tr tr = trs.get(pos);
					samples.add(new Sample(tr.nextstate, count, r.length+1));
					int child = tree.addState();
					float w = weighted ? (float)-Math.log(prob) : sr.ONE();
					tree.addTrInternal(q, new Tr(tr.ilabel, tr.olabel, w, child));
				}
				else if (weighted) {
					float w = config.removeTotalWeight() ? (float)-Math.log(prob) : (float)-Math.log(prob * npath);
					tree.setFinalInternal(q, w);
				}
				else {
					if (superfinal == Fst.NO_STATE_ID) {
						superfinal = tree.addState();
						tree.setFinalInternal(superfinal, sr.ONE());
						// keeps sample and tree numbering aligned
						samples.add(new Sample(Fst.NO_STATE_ID, 0, 0));
					}
					for (int i = 0; i < count; i++)
						tree.addTrInternal(q, new Tr(Tr.EPS_LABEL, Tr.EPS_LABEL, sr.ONE(), superfinal));
				}
			}
		}
		if (debug) Debug.debug(debug, "Sample tree has "+tree.numStates()+" states");
		if (weighted)
			return Connect.connect(out);
		writePaths(tree, superfinal, out);
		return out;
	}

	// index of the picked transition; the number of transitions for stopping
	private static int select(Fst fst, int s, RandGenSelector selector, Random rand) {
		List<Tr> trs = fst.trsOf(s);
		int n = fst.hasFinal(s) ? trs.size()+1 : trs.size();
		if (selector == RandGenSelector.UNIFORM)
			return rand.nextInt(n);
		double[] p = new double[n];
		double total = 0;
		for (int i = 0; i < n; i++) {
			float w = i < trs.size() ? trs.get(i).weight : fst.finalOf(s);
			p[i] = Math.exp(-w);
			total += p[i];
		}
		double x = rand.nextDouble() * total;
		for (int i = 0; i < n; i++) {
			x -= p[i];
			if (x < 0)
				return i;
		}
		return n-1;
	}

	// depth first over the tree: every transition into the superfinal writes out the labels
	// on the way there as a linear path from the shared start
	private static void writePaths(VectorFst tree, int superfinal, VectorFst out) {
		if (superfinal == Fst.NO_STATE_ID)
			return;
		Semiring sr = out.getSemiring();
		int ostart = out.addState();
		out.setStartInternal(ostart);
		// tree states on the way down, and the transition taken out of each
		TIntArrayStack states = new TIntArrayStack();
		TIntArrayList positions = new TIntArrayList();
		ArrayList<Tr> path = new ArrayList<Tr>();
		states.push(tree.start());
		positions.add(0);
		while (states.size() > 0) {
			int s = states.peek();
			int pos = positions.get(positions.size()-1);
			List<Tr> trs = tree.trsOf(s);
			if (pos == trs.size()) {
				states.pop();
				positions.removeAt(positions.size()-1);
				if (!path.isEmpty() && states.size() > 0)
					path.remove(path.size()-1);
				continue;
			}
			positions.set(positions.size()-1, pos+1);
			Tr tr = trs.get(pos);
			if (tr.nextstate == superfinal) {
				int src = ostart;
				for (Tr ptr : path) {
					int dest = out.addState();
					out.addTrInternal(src, new Tr(ptr.ilabel, ptr.olabel, sr.ONE(), dest));
					src = dest;
				}
				out.setFinalInternal(src, sr.ONE());
				continue;
			}
			path.add(tr);
			states.push(tr.nextstate);
			positions.add(0);
		}
	}
}
