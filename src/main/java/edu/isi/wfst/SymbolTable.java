package edu.isi.wfst;

import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.StringReader;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

// bidirectional mapping between labels and strings. 0 is always the epsilon symbol.
// Tables are shared between automata; VectorFst copies a table before changing it
public class SymbolTable implements Iterable<String> {
	public static final String EPS_SYMBOL = "<eps>";

	private TObjectIntHashMap<String> sym2id;
	private TIntObjectHashMap<String> id2sym;
	// next label handed out by addSymbol
	private int available;

	public SymbolTable() {
		sym2id = new TObjectIntHashMap<String>();
		id2sym = new TIntObjectHashMap<String>();
		available = 0;
		addSymbol(EPS_SYMBOL);
	}

	public SymbolTable(SymbolTable other) {
		sym2id = new TObjectIntHashMap<String>(other.sym2id);
		id2sym = new TIntObjectHashMap<String>(other.id2sym);
		available = other.available;
	}

	// <eps> at 0, then the given symbols in order. A repeated symbol keeps its first label
	public static SymbolTable fromSymbols(String... symbols) {
		SymbolTable st = new SymbolTable();
		for (String s : symbols)
			st.addSymbol(s);
		return st;
	}

	// no symbols at all, not even <eps>
	static SymbolTable emptyTable() {
		SymbolTable st = new SymbolTable();
		st.sym2id.clear();
		st.id2sym.clear();
		st.available = 0;
		return st;
	}

	public int addSymbol(String symbol) {
		if (sym2id.containsKey(symbol))
			return sym2id.get(symbol);
		int id = available++;
		sym2id.put(symbol, id);
		id2sym.put(id, symbol);
		return id;
	}

	// binds symbol to an explicit label, as read from a file
	public void addSymbol(String symbol, int id) throws DataFormatException {
		if (id < 0)
			throw new DataFormatException("Negative label "+id+" for symbol "+symbol);
		if (sym2id.containsKey(symbol) && sym2id.get(symbol) != id)
			throw new DataFormatException("Symbol "+symbol+" bound to both "+sym2id.get(symbol)+" and "+id);
		if (id2sym.containsKey(id) && !id2sym.get(id).equals(symbol))
			throw new DataFormatException("Label "+id+" bound to both "+id2sym.get(id)+" and "+symbol);
		sym2id.put(symbol, id);
		id2sym.put(id, symbol);
		if (id >= available)
			available = id+1;
	}

	public void addTable(SymbolTable other) {
		for (String s : other)
			addSymbol(s);
	}

	// -1 if not present
	public int find(String symbol) {
		if (!sym2id.containsKey(symbol))
			return -1;
		return sym2id.get(symbol);
	}
	// null if not present
	public String find(int id) {
		return id2sym.get(id);
	}
	public boolean contains(String symbol) {
		return sym2id.containsKey(symbol);
	}
	public boolean contains(int id) {
		return id2sym.containsKey(id);
	}
	public int size() {
		return sym2id.size();
	}
	public int getAvailableKey() {
		return available;
	}

	// labels in increasing order
	public int[] labels() {
		int[] ids = id2sym.keys();
		Arrays.sort(ids);
		return ids;
	}

	// symbols in label order
	public Iterator<String> iterator() {
		final int[] ids = labels();
		return new Iterator<String>() {
			private int pos = 0;
			public boolean hasNext() {
				return pos < ids.length;
			}
			public String next() {
				if (pos >= ids.length)
					throw new NoSuchElementException();
				return id2sym.get(ids[pos++]);
			}
			public void remove() {
				throw new UnsupportedOperationException();
			}
		};
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof SymbolTable))
			return false;
		SymbolTable st = (SymbolTable)o;
		return id2sym.equals(st.id2sym);
	}
	public int hashCode() {
		return id2sym.hashCode();
	}

	// one "symbol<TAB>label" line per symbol, in label order
	public String toString() {
		StringBuffer sb = new StringBuffer();
		for (int id : labels())
			sb.append(id2sym.get(id)+"\t"+id+"\n");
		return sb.toString();
	}

	public static SymbolTable readText(File f, String encoding) throws IOException, DataFormatException {
		BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
		try {
			return readText(br, f.getName());
		}
		finally {
			br.close();
		}
	}
	public static SymbolTable readText(File f) throws IOException, DataFormatException {
		return readText(f, "utf-8");
	}
	public static SymbolTable readText(String text) throws DataFormatException {
		try {
			return readText(new StringReader(text), "string");
		}
		catch (IOException e) {
			throw new DataFormatException("Unreadable symbol table text", e);
		}
	}

	private static SymbolTable readText(Reader r, String name) throws IOException, DataFormatException {
		boolean debug = false;
		BufferedReader br = r instanceof BufferedReader ? (BufferedReader)r : new BufferedReader(r);
		SymbolTable st = emptyTable();
		String line;
		int lineno = 0;
		while ((line = br.readLine()) != null) {
			lineno++;
			if (line.trim().length() == 0)
				continue;
			String[] fields = line.trim().split("\\s+");
			if (fields.length != 2)
				throw new DataFormatException(name+":"+lineno+": expected 'symbol label', got "+line);
			int id;
			try {
				id = Integer.parseInt(fields[1]);
			}
			catch (NumberFormatException e) {
				throw new DataFormatException(name+":"+lineno+": bad label "+fields[1], e);
			}
			st.addSymbol(fields[0], id);
		}
		if (debug) Debug.debug(debug, "Read "+st.size()+" symbols from "+name);
		return st;
	}

	public void writeText(File f, String encoding) throws IOException {
		BufferedWriter w = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(f), encoding));
		try {
			w.write(toString());
		}
		finally {
			w.close();
		}
	}
	public void writeText(File f) throws IOException {
		writeText(f, "utf-8");
	}
}
