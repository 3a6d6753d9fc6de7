package edu.isi.wfst;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

// binary form of an automaton:
//   magic, version, semiring name, kind, symbol table flags and tables,
//   start, state count, then per state its final weight and transitions
class FstSerializer {
	static final int MAGIC = 0x7eb2fdd6;
	static final int VERSION = 1;
	private static final String VECTOR_KIND = "vector";
	private static final String CONST_KIND = "const";
	private static final int HAS_ISYMS = 1;
	private static final int HAS_OSYMS = 2;

	static byte[] toBytes(Fst fst) {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try {
			write(fst, bytes);
		}
		catch (IOException e) {
			// in-memory streams don't fail
			throw new IllegalStateException(e);
		}
		return bytes.toByteArray();
	}

	static void write(Fst fst, File f) throws IOException {
		OutputStream os = new FileOutputStream(f);
		try {
			write(fst, os);
		}
		finally {
			os.close();
		}
	}

	private static void write(Fst fst, OutputStream os) throws IOException {
		DataOutputStream out = new DataOutputStream(os);
		out.writeInt(MAGIC);
		out.writeInt(VERSION);
		out.writeUTF(fst.getSemiring().getName());
		out.writeUTF(fst instanceof ConstFst ? CONST_KIND : VECTOR_KIND);
		int flags = 0;
		if (fst.getInputSymbols() != null)
			flags |= HAS_ISYMS;
		if (fst.getOutputSymbols() != null)
			flags |= HAS_OSYMS;
		out.writeInt(flags);
		if (fst.getInputSymbols() != null)
			writeSymbols(fst.getInputSymbols(), out);
		if (fst.getOutputSymbols() != null)
			writeSymbols(fst.getOutputSymbols(), out);
		out.writeInt(fst.start());
		out.writeInt(fst.numStates());
		for (int s = 0; s < fst.numStates(); s++) {
			out.writeFloat(fst.finalOf(s));
			out.writeInt(fst.trsOf(s).size());
			for (Tr tr : fst.trsOf(s)) {
				out.writeInt(tr.ilabel);
				out.writeInt(tr.olabel);
				out.writeFloat(tr.weight);
				out.writeInt(tr.nextstate);
			}
		}
		out.flush();
	}

	private static void writeSymbols(SymbolTable st, DataOutputStream out) throws IOException {
		int[] labels = st.labels();
		out.writeInt(labels.length);
		for (int l : labels) {
			out.writeInt(l);
			out.writeUTF(st.find(l));
		}
	}

	static Fst read(File f) throws IOException, DataFormatException {
		InputStream is = new FileInputStream(f);
		try {
			return read(is, f.getName());
		}
		finally {
			is.close();
		}
	}

	static Fst fromBytes(byte[] data) throws DataFormatException {
		try {
			return read(new ByteArrayInputStream(data), "byte array");
		}
		catch (IOException e) {
			throw new DataFormatException("Couldn't read automaton from byte array", e);
		}
	}

	private static Fst read(InputStream is, String name) throws IOException, DataFormatException {
		DataInputStream in = new DataInputStream(is);
		try {
			if (in.readInt() != MAGIC)
				throw new DataFormatException(name+" is not a binary automaton (bad magic number)");
			int version = in.readInt();
			if (version != VERSION)
				throw new DataFormatException(name+": unsupported version "+version);
			Semiring sr;
			try {
				sr = Semiring.get(in.readUTF());
			}
			catch (ConfigureException e) {
				throw new DataFormatException(name+": "+e.getMessage(), e);
			}
			String kind = in.readUTF();
			if (!kind.equals(VECTOR_KIND) && !kind.equals(CONST_KIND))
				throw new DataFormatException(name+": unknown automaton kind "+kind);
			int flags = in.readInt();
			VectorFst fst = new VectorFst(sr);
			if ((flags & HAS_ISYMS) != 0)
				fst.setInputSymbols(readSymbols(in, name));
			if ((flags & HAS_OSYMS) != 0)
				fst.setOutputSymbols(readSymbols(in, name));
			int start = in.readInt();
			int n = in.readInt();
			if (n < 0 || start < Fst.NO_STATE_ID || start >= n)
				throw new DataFormatException(name+": start "+start+" inconsistent with "+n+" states");
			fst.addStates(n);
			fst.setStartInternal(start);
			for (int s = 0; s < n; s++) {
				fst.setFinalInternal(s, in.readFloat());
				int ntrs = in.readInt();
				if (ntrs < 0)
					throw new DataFormatException(name+": negative transition count at state "+s);
				for (int i = 0; i < ntrs; i++) {
					int il = in.readInt();
					int ol = in.readInt();
					float w = in.readFloat();
					int next = in.readInt();
					if (next < 0 || next >= n)
						throw new DataFormatException(name+": transition from "+s+" to missing state "+next);
					fst.addTrInternal(s, new Tr(il, ol, w, next));
				}
			}
			if (in.read() != -1)
				throw new DataFormatException(name+": trailing data after automaton");
			if (kind.equals(CONST_KIND))
				return new ConstFst(fst);
			return fst;
		}
		catch (EOFException e) {
			throw new DataFormatException(name+": truncated automaton", e);
		}
	}

	private static SymbolTable readSymbols(DataInputStream in, String name) throws IOException, DataFormatException {
		int n = in.readInt();
		if (n < 0)
			throw new DataFormatException(name+": negative symbol table size");
		SymbolTable st = SymbolTable.emptyTable();
		for (int i = 0; i < n; i++) {
			int id = in.readInt();
			st.addSymbol(in.readUTF(), id);
		}
		return st;
	}
}
