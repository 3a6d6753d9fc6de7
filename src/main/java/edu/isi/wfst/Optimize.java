package edu.isi.wfst;

import java.util.EnumSet;

// epsilon removal, determinization and minimization, as far as the semiring and
// the automaton allow
public class Optimize {

	// in place
	public static void optimize(VectorFst fst) throws UnusualConditionException {
		boolean debug = false;
		boolean acceptor = FstProperties.isAcceptor(fst);
		if (FstProperties.hasEpsilons(fst))
			RmEpsilon.rmEpsilon(fst);
		TrSum.trSum(fst);
		boolean idempotent = fst.getSemiring().isIdempotent();
		if (FstProperties.isIDeterministic(fst)) {
			if (debug) Debug.debug(debug, "Already deterministic; minimizing");
			Minimize.minimize(fst);
			return;
		}
		boolean acyclic = FstProperties.isAcyclic(fst);
		if (!idempotent) {
			// determinization need not terminate on cycles
			if (!acyclic)
				return;
			if (acceptor)
				determinizeMinimize(fst);
			else
				encodeDeterminizeMinimize(fst, EnumSet.of(EncodeType.ENCODE_LABELS));
			return;
		}
		boolean weightedCycles = !acyclic && FstProperties.isWeighted(fst) && !FstProperties.hasUnweightedCycles(fst);
		if (weightedCycles) {
			// labels are encoded too so the encoded automaton is an acceptor
			encodeDeterminizeMinimize(fst, EnumSet.of(EncodeType.ENCODE_LABELS, EncodeType.ENCODE_WEIGHTS));
			TrSum.trSum(fst);
		}
		else if (acceptor)
			determinizeMinimize(fst);
		else
			encodeDeterminizeMinimize(fst, EnumSet.of(EncodeType.ENCODE_LABELS));
	}

	// converts to the log semiring for the optimization and back
	public static void optimizeInLog(VectorFst fst) throws UnusualConditionException {
		Semiring sr = fst.getSemiring();
		VectorFst log = WeightConvert.weightConvert(fst, new LogSemiring());
		optimize(log);
		fst.assign(WeightConvert.weightConvert(log, sr));
	}

	private static void determinizeMinimize(VectorFst fst) throws UnusualConditionException {
		fst.assign(Determinize.determinize(fst));
		Minimize.minimize(fst);
	}

	private static void encodeDeterminizeMinimize(VectorFst fst, EnumSet<EncodeType> type) throws UnusualConditionException {
		EncodeTable table = Encode.encode(fst, type);
		determinizeMinimize(fst);
		Encode.decode(fst, table);
	}
}
