package edu.isi.wfst;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.regex.Pattern;

// AT&T text form of an automaton:
//   src dst ilabel olabel [weight]
//   state [weight]
// the start state's lines come first; weights equal to ONE are left off
public class FstText {
	private static final Pattern SEP = Pattern.compile("\\s+");

	public static String print(Fst fst) {
		StringBuffer sb = new StringBuffer();
		Semiring sr = fst.getSemiring();
		int start = fst.start();
		if (start != Fst.NO_STATE_ID)
			printState(fst, start, sr, sb);
		for (int s = 0; s < fst.numStates(); s++)
			if (s != start)
				printState(fst, s, sr, sb);
		return sb.toString();
	}

	private static void printState(Fst fst, int s, Semiring sr, StringBuffer sb) {
		for (Tr tr : fst.trsOf(s)) {
			sb.append(s).append('\t').append(tr.nextstate).append('\t');
			sb.append(tr.ilabel).append('\t').append(tr.olabel);
			if (!sr.isOne(tr.weight))
				sb.append('\t').append(sr.internalToPrint(tr.weight));
			sb.append('\n');
		}
		if (fst.hasFinal(s)) {
			sb.append(s);
			float fw = fst.finalOf(s);
			if (!sr.isOne(fw))
				sb.append('\t').append(sr.internalToPrint(fw));
			sb.append('\n');
		}
	}

	public static VectorFst parse(String text, Semiring sr) throws DataFormatException {
		try {
			return parse(new StringReader(text), sr, "string");
		}
		catch (IOException e) {
			throw new DataFormatException("Couldn't read automaton from string", e);
		}
	}

	public static VectorFst parse(File f, Semiring sr, String encoding) throws IOException, DataFormatException {
		Reader r = new InputStreamReader(new FileInputStream(f), encoding);
		try {
			return parse(r, sr, f.getName());
		}
		finally {
			r.close();
		}
	}
	public static VectorFst parse(File f, Semiring sr) throws IOException, DataFormatException {
		return parse(f, sr, Debug.getEncoding());
	}

	private static VectorFst parse(Reader r, Semiring sr, String name) throws IOException, DataFormatException {
		boolean debug = false;
		BufferedReader br = new BufferedReader(r);
		VectorFst fst = new VectorFst(sr);
		// collected first so the state count is known before anything is added
		ArrayList<int[]> trLines = new ArrayList<int[]>();
		ArrayList<Float> trWeights = new ArrayList<Float>();
		ArrayList<int[]> finalStates = new ArrayList<int[]>();
		ArrayList<Float> finalWeights = new ArrayList<Float>();
		int start = Fst.NO_STATE_ID;
		int maxState = -1;
		String line;
		int lineno = 0;
		while ((line = br.readLine()) != null) {
			lineno++;
			String t = line.trim();
			if (t.length() == 0 || t.startsWith("#"))
				continue;
			String[] toks = SEP.split(t);
			int[] ints;
			float w;
			switch (toks.length) {
			case 1:
			case 2:
				ints = new int[] { state(toks[0], name, lineno) };
				w = toks.length == 2 ? weight(sr, toks[1], name, lineno) : sr.ONE();
				finalStates.add(ints);
				finalWeights.add(w);
				break;
			case 4:
			case 5:
				ints = new int[4];
				ints[0] = state(toks[0], name, lineno);
				ints[1] = state(toks[1], name, lineno);
				ints[2] = label(toks[2], name, lineno);
				ints[3] = label(toks[3], name, lineno);
				w = toks.length == 5 ? weight(sr, toks[4], name, lineno) : sr.ONE();
				trLines.add(ints);
				trWeights.add(w);
				maxState = Math.max(maxState, ints[1]);
				break;
			default:
				throw new DataFormatException(name+":"+lineno+": expected 1, 2, 4 or 5 fields but saw "+toks.length);
			}
			maxState = Math.max(maxState, ints[0]);
			if (start == Fst.NO_STATE_ID)
				start = ints[0];
		}
		if (debug) Debug.debug(debug, "Read "+trLines.size()+" transitions over "+(maxState+1)+" states from "+name);
		fst.addStates(maxState+1);
		if (start != Fst.NO_STATE_ID)
			fst.setStartInternal(start);
		for (int i = 0; i < trLines.size(); i++) {
			int[] l = trLines.get(i);
			fst.addTrInternal(l[0], new Tr(l[2], l[3], trWeights.get(i), l[1]));
		}
		for (int i = 0; i < finalStates.size(); i++)
			fst.setFinalInternal(finalStates.get(i)[0], finalWeights.get(i));
		return fst;
	}

	private static int state(String tok, String name, int lineno) throws DataFormatException {
		int s = integer(tok, name, lineno);
		if (s < 0)
			throw new DataFormatException(name+":"+lineno+": negative state id "+tok);
		return s;
	}
	private static int label(String tok, String name, int lineno) throws DataFormatException {
		int l = integer(tok, name, lineno);
		if (l < 0)
			throw new DataFormatException(name+":"+lineno+": negative label "+tok);
		return l;
	}
	private static int integer(String tok, String name, int lineno) throws DataFormatException {
		try {
			return Integer.parseInt(tok);
		}
		catch (NumberFormatException e) {
			throw new DataFormatException(name+":"+lineno+": expected an integer but saw "+tok, e);
		}
	}
	private static float weight(Semiring sr, String tok, String name, int lineno) throws DataFormatException {
		try {
			return sr.printToInternal(tok);
		}
		catch (DataFormatException e) {
			throw new DataFormatException(name+":"+lineno+": "+e.getMessage(), e);
		}
	}
}
