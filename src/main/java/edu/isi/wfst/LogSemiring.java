package edu.isi.wfst;

// log is -log(e^-a + e^-b), +, +INF, 0
public class LogSemiring extends Semiring {
	public float plus(float a, float b) {
		if (isZero(a))
			return b;
		if (isZero(b))
			return a;
		float min = Math.min(a, b);
		return (float)(min - Math.log1p(Math.exp(-Math.abs(a - b))));
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
		return "log";
	}
	public boolean isIdempotent() {
		return false;
	}
	public boolean hasPathProperty() {
		return false;
	}
}
