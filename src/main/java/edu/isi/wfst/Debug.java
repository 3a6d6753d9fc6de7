package edu.isi.wfst;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;

// debugging and progress messages, all to stderr
public class Debug {

	private static String encoding = "utf-8";
	private static OutputStreamWriter w = null;
	// timing messages at or below this level are printed
	private static int dblevel = 0;

	public static void setEncoding(String s) {
		encoding = s;
		initializeStream();
	}
	public static String getEncoding() {
		return encoding;
	}
	public static void setDbLevel(int i) {
		dblevel = i;
	}

	private static void initializeStream() {
		try {
			w = new OutputStreamWriter(System.err, encoding);
		}
		catch (UnsupportedEncodingException e) {
			System.err.println("Warning: encoding "+encoding+" not supported; using default");
			w = new OutputStreamWriter(System.err);
		}
	}

	private static synchronized void emit(String s) {
		if (w == null)
			initializeStream();
		try {
			w.write(s);
			w.write("\n");
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}

	// stuff we always print
	public static void prettyDebug(String s) {
		emit(s);
	}

	// true debugging stuff, prefixed with the calling class and method
	public static void debug(boolean d, String s) {
		if (d)
			debug(0, caller(), s);
	}
	public static void debug(boolean d, int indent, String s) {
		if (d)
			debug(indent, caller(), s);
	}
	private static void debug(int indent, String caller, String s) {
		StringBuffer sb = new StringBuffer();
		for (int x = 0; x < indent; x++)
			sb.append(' ');
		sb.append(caller).append(" : ").append(s);
		emit(sb.toString());
	}
	private static String caller() {
		StackTraceElement e = new Throwable().getStackTrace()[2];
		return e.getClassName()+":"+e.getMethodName();
	}

	// print time debug info if the level is proper
	public static void dbtime(int currlevel, int needlevel, Date pta, Date ptb, String msg) {
		if (currlevel < needlevel)
			return;
		emit(msg+": "+(ptb.getTime() - pta.getTime())+" ms");
	}
	// global version of dbtime
	public static void dbtime(int needlevel, Date pta, String msg) {
		dbtime(dblevel, needlevel, pta, new Date(), msg);
	}
}
