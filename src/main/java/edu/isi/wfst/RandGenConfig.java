package edu.isi.wfst;

/**
 * Settings for random path generation.
 * <ul>
 * <li>npath: number of paths drawn</li>
 * <li>seed: seed of the generator; 0 seeds from the clock</li>
 * <li>maxLength: paths reaching this many transitions are dropped</li>
 * <li>weighted: output the tree of samples, weighted by how often each branch was drawn,
 * instead of the drawn paths themselves</li>
 * <li>removeTotalWeight: in the weighted tree, leave out the factor of npath</li>
 * </ul>
 */
public class RandGenConfig {
	private final int npath;
	private final long seed;
	private final int maxLength;
	private final boolean weighted;
	private final boolean removeTotalWeight;
	private final RandGenSelector selector;

	public RandGenConfig() {
		this(1, 0);
	}
	public RandGenConfig(int npath, long seed) {
		this(npath, seed, Integer.MAX_VALUE, false, false, RandGenSelector.UNIFORM);
	}
	public RandGenConfig(int npath, long seed, int maxLength, boolean weighted, boolean removeTotalWeight,
			RandGenSelector selector) {
		this.npath = npath;
		this.seed = seed;
		this.maxLength = maxLength;
		this.weighted = weighted;
		this.removeTotalWeight = removeTotalWeight;
		this.selector = selector;
	}

	public int getNPath() {
		return npath;
	}
	public long getSeed() {
		return seed;
	}
	public int getMaxLength() {
		return maxLength;
	}
	public boolean isWeighted() {
		return weighted;
	}
	public boolean removeTotalWeight() {
		return removeTotalWeight;
	}
	public RandGenSelector getSelector() {
		return selector;
	}
}
