package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;

/**
 * Minimization of deterministic automata, and of non-deterministic ones over idempotent
 * semirings when allowed. Weights (and, for transducers, output labels) are pushed
 * toward the start, then each transition is encoded as one label so that the weighted
 * problem becomes the unweighted acceptor one, solved by partition refinement.
 */
public class Minimize {

	public static void minimize(VectorFst fst) throws UnusualConditionException {
		minimize(fst, new MinimizeConfig());
	}

	// in place; the input is untouched on failure
	public static void minimize(VectorFst fst, MinimizeConfig config) throws UnusualConditionException {
		boolean debug = false;
		Semiring sr = fst.getSemiring();
		if (!FstProperties.isIDeterministic(fst)) {
			if (!sr.isIdempotent())
				throw new UnusualConditionException("Can't minimize a non-deterministic automaton over the non-idempotent "+
						sr.getName()+" semiring");
			if (!config.allowNondet())
				throw new UnusualConditionException("Refusing to minimize a non-deterministic automaton without allowing it");
		}
		int before = fst.numStates();
		float delta = config.getDelta();
		VectorFst work;
		if (!FstProperties.isAcceptor(fst)) {
			work = Push.push(fst, ReweightType.REWEIGHT_TO_INITIAL,
					EnumSet.of(PushType.PUSH_WEIGHTS, PushType.PUSH_LABELS), delta);
			minimizeEncoded(work, delta);
		}
		else if (FstProperties.isWeighted(fst)) {
			work = new VectorFst(fst);
			float[] d = ShortestDistance.shortestDistance(work, true, delta);
			Push.reweight(work, d, ReweightType.REWEIGHT_TO_INITIAL, true);
			minimizeEncoded(work, delta);
		}
		else {
			work = new VectorFst(fst);
			acceptorMinimize(work);
		}
		// output strings left over by label pushing can cost states; the trimmed input is then smaller
		VectorFst trimmed = Connect.connect(new VectorFst(fst));
		if (work.numStates() > trimmed.numStates()) {
			if (debug) Debug.debug(debug, "Minimized form has "+work.numStates()+" states; keeping the "+trimmed.numStates()+" of the input");
			work = trimmed;
		}
		fst.assign(work);
		if (debug) Debug.debug(debug, "Minimized "+before+" states to "+fst.numStates());
	}

	private static void minimizeEncoded(VectorFst fst, float delta) throws UnusualConditionException {
		TrMap.trMap(fst, MapType.QUANTIZE, delta);
		EncodeTable table = Encode.encode(fst, EnumSet.of(EncodeType.ENCODE_LABELS, EncodeType.ENCODE_WEIGHTS));
		acceptorMinimize(fst);
		Encode.decode(fst, table);
	}

	// states are split by their final weight, then again and again by where their
	// transitions lead, until no class splits. Each class becomes one state
	static void acceptorMinimize(VectorFst fst) {
		Connect.connect(fst);
		int n = fst.numStates();
		if (n == 0)
			return;
		int[] cls = new int[n];
		HashMap<Float, Integer> byFinal = new HashMap<Float, Integer>();
		for (int s = 0; s < n; s++) {
			Integer c = byFinal.get(fst.finalOf(s));
			if (c == null) {
				c = byFinal.size();
				byFinal.put(fst.finalOf(s), c);
			}
			cls[s] = c;
		}
		int nclasses = byFinal.size();
		while (true) {
			HashMap<String, Integer> bySignature = new HashMap<String, Integer>();
			int[] next = new int[n];
			for (int s = 0; s < n; s++) {
				String sig = signature(fst, s, cls);
				Integer c = bySignature.get(sig);
				if (c == null) {
					c = bySignature.size();
					bySignature.put(sig, c);
				}
				next[s] = c;
			}
			cls = next;
			if (bySignature.size() == nclasses)
				break;
			nclasses = bySignature.size();
		}
		mergeStates(fst, cls, nclasses);
	}

	// own class, then the distinct transitions with destinations replaced by their classes
	private static String signature(Fst fst, int s, int[] cls) {
		ArrayList<Tr> trs = new ArrayList<Tr>(fst.trsOf(s).size());
		for (Tr tr : fst.trsOf(s))
			trs.add(tr.withNextstate(cls[tr.nextstate]));
		Collections.sort(trs, Tr.LABELS_WEIGHT_NEXTSTATE_ORDER);
		StringBuffer sb = new StringBuffer();
		sb.append(cls[s]);
		Tr last = null;
		for (Tr tr : trs) {
			if (tr.equals(last))
				continue;
			sb.append(' ').append(tr.ilabel).append(',').append(tr.olabel).append(',')
				.append(Float.floatToIntBits(tr.weight)).append(',').append(tr.nextstate);
			last = tr;
		}
		return sb.toString();
	}

	private static void mergeStates(VectorFst fst, int[] cls, int nclasses) {
		VectorFst out = new VectorFst(fst.getSemiring());
		out.setSymbols(fst);
		out.addStates(nclasses);
		for (int s = 0; s < fst.numStates(); s++) {
			int c = cls[s];
			out.setFinalInternal(c, fst.finalOf(s));
			for (Tr tr : fst.trsOf(s))
				out.addTrInternal(c, tr.withNextstate(cls[tr.nextstate]));
		}
		out.setStartInternal(cls[fst.start()]);
		TrUnique.trUnique(out);
		fst.assign(out);
	}
}
