package edu.isi.wfst;

import java.util.ArrayList;

// rewrites every transition, and the weight of every final state, the same way
public class TrMap {

	public static VectorFst trMap(VectorFst fst, MapType type) {
		return trMap(fst, type, type == MapType.QUANTIZE ? Semiring.KDELTA : fst.getSemiring().ONE());
	}

	// in place. The argument is the constant of PLUS and TIMES and the delta of QUANTIZE;
	// other types ignore it
	public static VectorFst trMap(VectorFst fst, MapType type, float arg) {
		if (type == MapType.IDENTITY)
			return fst;
		Semiring sr = fst.getSemiring();
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Tr> trs = fst.trsForUpdate(s);
			for (int i = 0; i < trs.size(); i++) {
				Tr tr = trs.get(i);
				switch (type) {
				case INPUT_EPSILON:
					trs.set(i, tr.withLabels(Tr.EPS_LABEL, tr.olabel));
					break;
				case OUTPUT_EPSILON:
					trs.set(i, tr.withLabels(tr.ilabel, Tr.EPS_LABEL));
					break;
				case INVERT:
					trs.set(i, tr.withLabels(tr.olabel, tr.ilabel));
					break;
				default:
					trs.set(i, tr.withWeight(mapWeight(sr, type, arg, tr.weight)));
				}
			}
			if (fst.hasFinal(s))
				fst.setFinalInternal(s, mapWeight(sr, type, arg, fst.finalOf(s)));
		}
		if (type == MapType.INVERT) {
			SymbolTable isyms = fst.getInputSymbols();
			fst.setInputSymbols(fst.getOutputSymbols());
			fst.setOutputSymbols(isyms);
		}
		return fst;
	}

	private static float mapWeight(Semiring sr, MapType type, float arg, float w) {
		switch (type) {
		case PLUS:
			return sr.plus(w, arg);
		case TIMES:
			return sr.times(w, arg);
		case QUANTIZE:
			return sr.quantize(w, arg);
		case RMWEIGHT:
			return sr.isZero(w) ? w : sr.ONE();
		default:
			return w;
		}
	}
}
