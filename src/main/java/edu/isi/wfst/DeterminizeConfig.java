package edu.isi.wfst;

public class DeterminizeConfig {
	private final DeterminizeType type;
	private final float delta;

	public DeterminizeConfig() {
		this(DeterminizeType.FUNCTIONAL, Semiring.KDELTA);
	}
	public DeterminizeConfig(DeterminizeType type) {
		this(type, Semiring.KDELTA);
	}
	public DeterminizeConfig(DeterminizeType type, float delta) {
		this.type = type;
		this.delta = delta;
	}

	public DeterminizeType getType() {
		return type;
	}
	// residual weights are quantized to this
	public float getDelta() {
		return delta;
	}
	public String toString() {
		return "type="+type+" delta="+delta;
	}
}
