package edu.isi.wfst;

// how many paths, whether their label sequences must differ, and the weight tolerance
public class ShortestPathConfig {
	private final int nshortest;
	private final boolean unique;
	private final float delta;

	public ShortestPathConfig() {
		this(1, false, Semiring.KSHORTESTDELTA);
	}
	public ShortestPathConfig(int nshortest, boolean unique) {
		this(nshortest, unique, Semiring.KSHORTESTDELTA);
	}
	public ShortestPathConfig(int nshortest, boolean unique, float delta) {
		this.nshortest = nshortest;
		this.unique = unique;
		this.delta = delta;
	}

	public int getNShortest() {
		return nshortest;
	}
	public boolean isUnique() {
		return unique;
	}
	public float getDelta() {
		return delta;
	}
	public String toString() {
		return "nshortest="+nshortest+" unique="+unique+" delta="+delta;
	}
}
