package edu.isi.wfst;

// tropical is min, +, +INF, 0
public class TropicalSemiring extends Semiring {
	public float plus(float a, float b) {
		return Math.min(a, b);
	}
	public float times(float a, float b) {
		if (isZero(a) || isZero(b))
			return ZERO();
		return a+b;
	}
	public float ZERO() {
		return Float.POSITIVE_INFINITY;
	}
	public float ONE() {
		return 0;
	}
	public String getName() {
		return "tropical";
	}
	// plus picks one of its arguments
	public boolean isIdempotent() {
		return true;
	}
	public boolean hasPathProperty() {
		return true;
	}
}
