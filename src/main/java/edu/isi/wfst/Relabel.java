package edu.isi.wfst;

import gnu.trove.map.hash.TIntIntHashMap;

import java.util.ArrayList;

// rewrites transition labels by explicit (old, new) pairs or by moving between symbol tables. In place
public class Relabel {

	// labels without a pair are left as they are
	public static VectorFst relabelPairs(VectorFst fst, int[][] ipairs, int[][] opairs) throws ConfigureException {
		TIntIntHashMap imap = toMap(ipairs);
		TIntIntHashMap omap = toMap(opairs);
		relabel(fst, imap, omap);
		return fst;
	}

	// each label is mapped to the label its symbol has in the new table, and the new tables
	// are attached. A null pair of tables leaves that side alone
	public static VectorFst relabelTables(VectorFst fst, SymbolTable oldIsyms, SymbolTable newIsyms,
			SymbolTable oldOsyms, SymbolTable newOsyms) throws ConfigureException {
		TIntIntHashMap imap = oldIsyms == null || newIsyms == null ? new TIntIntHashMap() : tableMap(oldIsyms, newIsyms, "input");
		TIntIntHashMap omap = oldOsyms == null || newOsyms == null ? new TIntIntHashMap() : tableMap(oldOsyms, newOsyms, "output");
		relabel(fst, imap, omap);
		if (oldIsyms != null && newIsyms != null)
			fst.setInputSymbols(newIsyms);
		if (oldOsyms != null && newOsyms != null)
			fst.setOutputSymbols(newOsyms);
		return fst;
	}

	private static void relabel(VectorFst fst, TIntIntHashMap imap, TIntIntHashMap omap) {
		for (int s = 0; s < fst.numStates(); s++) {
			ArrayList<Tr> trs = fst.trsForUpdate(s);
			for (int i = 0; i < trs.size(); i++) {
				Tr tr = trs.get(i);
				int il = imap.containsKey(tr.ilabel) ? imap.get(tr.ilabel) : tr.ilabel;
				int ol = omap.containsKey(tr.olabel) ? omap.get(tr.olabel) : tr.olabel;
				if (il != tr.ilabel || ol != tr.olabel)
					trs.set(i, tr.withLabels(il, ol));
			}
		}
	}

	private static TIntIntHashMap toMap(int[][] pairs) throws ConfigureException {
		TIntIntHashMap map = new TIntIntHashMap();
		if (pairs == null)
			return map;
		for (int[] p : pairs) {
			if (p.length != 2)
				throw new ConfigureException("Relabeling pair with "+p.length+" labels");
			if (map.containsKey(p[0]))
				throw new ConfigureException("Label "+p[0]+" is present twice in the relabeling pairs");
			map.put(p[0], p[1]);
		}
		return map;
	}

	private static TIntIntHashMap tableMap(SymbolTable oldSyms, SymbolTable newSyms, String side) throws ConfigureException {
		TIntIntHashMap map = new TIntIntHashMap();
		for (int label : oldSyms.labels()) {
			String sym = oldSyms.find(label);
			int nl = newSyms.find(sym);
			if (nl < 0)
				throw new ConfigureException("Relabel: "+side+" symbol "+sym+" is missing from the new table");
			map.put(label, nl);
		}
		return map;
	}
}
