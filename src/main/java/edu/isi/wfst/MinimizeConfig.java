package edu.isi.wfst;

public class MinimizeConfig {
	private final float delta;
	// minimize input that isn't deterministic (idempotent semirings only)
	private final boolean allowNondet;

	public MinimizeConfig() {
		this(Semiring.KSHORTESTDELTA, false);
	}
	public MinimizeConfig(float delta, boolean allowNondet) {
		this.delta = delta;
		this.allowNondet = allowNondet;
	}

	public float getDelta() {
		return delta;
	}
	public boolean allowNondet() {
		return allowNondet;
	}
	public String toString() {
		return "delta="+delta+" allowNondet="+allowNondet;
	}
}
