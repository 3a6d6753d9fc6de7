package edu.isi.wfst;
/** for state ids that do not name a state of the automaton */
public class StateOutOfRangeException extends Exception {
	/** Constructs a new exception with null as its detail message. */
	public StateOutOfRangeException() { super(); }
	/** Constructs a new exception with the specified detail message. */
	public StateOutOfRangeException(String message) { super(message); }
	/** Constructs a new exception with the specified detail message and cause. */
	public StateOutOfRangeException(String message, Throwable cause) { super(message, cause); }
	/** Constructs a new exception with the specified cause. */
	public StateOutOfRangeException(Throwable cause) { super(cause); }
}
