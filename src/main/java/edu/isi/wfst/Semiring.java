package edu.isi.wfst;

import java.io.Serializable;

// the general semiring over float weights. Subclasses do the operations
public abstract class Semiring implements Serializable {
	// default tolerance of weight comparisons
	public static final float KDELTA = 1.0f / 1024.0f;
	// tolerance of shortest distance computations
	public static final float KSHORTESTDELTA = 1e-6f;

	public abstract float plus(float a, float b);
	public abstract float times(float a, float b);
	public abstract float ONE();
	public abstract float ZERO();
	// semiring name as used in files and on the command line
	public abstract String getName();
	public abstract boolean isIdempotent();
	public abstract boolean hasPathProperty();

	public boolean isCommutative() {
		return true;
	}

	// left and right division coincide in commutative semirings
	public float divide(float a, float b) throws UnusualConditionException {
		if (isZero(b))
			throw new UnusualConditionException("Division by zero weight in "+getName()+" semiring");
		if (isZero(a))
			return ZERO();
		return a - b;
	}

	// better means "lower cost"
	public boolean better(float a, float b) {
		return a < b;
	}
	public boolean betteroreq(float a, float b) {
		return a <= b;
	}
	public boolean isZero(float a) {
		return a == ZERO();
	}
	public boolean isOne(float a) {
		return a == ONE();
	}

	public boolean approxEqual(float a, float b, float delta) {
		if (a == b)
			return true;
		return a <= b + delta && b <= a + delta;
	}

	public float quantize(float a, float delta) {
		if (Float.isInfinite(a) || Float.isNaN(a))
			return a;
		return (float)(Math.floor(a / delta + 0.5f) * delta);
	}

	// weights of the reversed automaton
	public float reverse(float a) {
		return a;
	}

	// only weights that are numbers or +inf belong to these semirings
	public boolean isMember(float a) {
		return !Float.isNaN(a) && a != Float.NEGATIVE_INFINITY;
	}

	public String internalToPrint(float a) {
		if (a == Float.POSITIVE_INFINITY)
			return "Infinity";
		if (a == (long)a && Math.abs(a) < 1e7)
			return Long.toString((long)a);
		return Float.toString(a);
	}

	public float printToInternal(String s) throws DataFormatException {
		String t = s.trim();
		if (t.equalsIgnoreCase("inf") || t.equalsIgnoreCase("infinity") || t.equals("+inf"))
			return ZERO();
		float v;
		try {
			v = Float.parseFloat(t);
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("Malformed weight: "+s, e);
		}
		if (!isMember(v))
			throw new DataFormatException("Weight "+s+" is not a member of the "+getName()+" semiring");
		return v;
	}

	public boolean equals(Object o) {
		return o != null && o.getClass() == getClass();
	}
	public int hashCode() {
		return getName().hashCode();
	}
	public String toString() {
		return getName();
	}

	public static Semiring get(String name) throws ConfigureException {
		if (name.equals("tropical") || name.equals("standard"))
			return new TropicalSemiring();
		else if (name.equals("log"))
			return new LogSemiring();
		throw new ConfigureException("Unexpected semiring type: "+name+"; valid values are tropical, log");
	}
}
