package edu.isi.wfst;

// the same automaton with its weights read in another semiring
public class WeightConvert {
	public static VectorFst weightConvert(Fst fst, Semiring sr) {
		VectorFst out = new VectorFst(fst);
		out.setSemiring(sr);
		return out;
	}
}
