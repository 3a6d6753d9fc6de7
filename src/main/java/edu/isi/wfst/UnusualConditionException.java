package edu.isi.wfst;
/** for operations whose preconditions are not met by their input automata */
public class UnusualConditionException extends Exception {
	/** Constructs a new exception with null as its detail message. */
	public UnusualConditionException() { super(); }
	/** Constructs a new exception with the specified detail message. */
	public UnusualConditionException(String message) { super(message); }
	/** Constructs a new exception with the specified detail message and cause. */
	public UnusualConditionException(String message, Throwable cause) { super(message, cause); }
	/** Constructs a new exception with the specified cause. */
	public UnusualConditionException(Throwable cause) { super(cause); }
}
