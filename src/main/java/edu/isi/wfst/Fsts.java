package edu.isi.wfst;

import java.util.regex.Pattern;

// linear automata built from strings of symbols
public class Fsts {
	private static final Pattern SEP = Pattern.compile("\\s+");

	public static VectorFst acceptor(int[] labels, Semiring sr) {
		return transducer(labels, labels, sr.ONE(), sr);
	}

	// space separated symbols of the table, or label numbers if the table is null
	public static VectorFst acceptor(String s, SymbolTable syms) throws ConfigureException {
		VectorFst fst = acceptor(labels(s, syms), new TropicalSemiring());
		fst.setInputSymbols(syms);
		fst.setOutputSymbols(syms);
		return fst;
	}

	// one transition per position; the shorter side is padded with epsilons.
	// The weight goes on the final state
	public static VectorFst transducer(int[] ilabels, int[] olabels, float weight, Semiring sr) {
		VectorFst fst = new VectorFst(sr);
		int n = Math.max(ilabels.length, olabels.length);
		fst.addStates(n+1);
		fst.setStartInternal(0);
		for (int i = 0; i < n; i++) {
			int il = i < ilabels.length ? ilabels[i] : Tr.EPS_LABEL;
			int ol = i < olabels.length ? olabels[i] : Tr.EPS_LABEL;
			fst.addTrInternal(i, new Tr(il, ol, sr.ONE(), i+1));
		}
		fst.setFinalInternal(n, weight);
		return fst;
	}

	public static VectorFst transducer(String in, String out, SymbolTable isyms, SymbolTable osyms) throws ConfigureException {
		Semiring sr = new TropicalSemiring();
		VectorFst fst = transducer(labels(in, isyms), labels(out, osyms), sr.ONE(), sr);
		fst.setInputSymbols(isyms);
		fst.setOutputSymbols(osyms);
		return fst;
	}

	static int[] labels(String s, SymbolTable syms) throws ConfigureException {
		String t = s.trim();
		if (t.length() == 0)
			return new int[0];
		String[] toks = SEP.split(t);
		int[] ret = new int[toks.length];
		for (int i = 0; i < toks.length; i++) {
			if (syms == null) {
				try {
					ret[i] = Integer.parseInt(toks[i]);
				}
				catch (NumberFormatException e) {
					throw new ConfigureException("Expected a label number without a symbol table, not "+toks[i], e);
				}
				if (ret[i] < 0)
					throw new ConfigureException("Negative label "+toks[i]);
			}
			else {
				ret[i] = syms.find(toks[i]);
				if (ret[i] < 0)
					throw new ConfigureException("Unknown symbol "+toks[i]);
			}
		}
		return ret;
	}
}
