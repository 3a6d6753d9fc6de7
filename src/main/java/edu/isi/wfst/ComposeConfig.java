package edu.isi.wfst;

public class ComposeConfig {
	private final ComposeFilter filter;
	// trim the result
	private final boolean connect;
	// sigma handling of each side, or null
	private final MatcherConfig matcher1;
	private final MatcherConfig matcher2;

	public ComposeConfig() {
		this(ComposeFilter.AUTO, true, null, null);
	}
	public ComposeConfig(ComposeFilter filter, boolean connect) {
		this(filter, connect, null, null);
	}
	public ComposeConfig(ComposeFilter filter, boolean connect, MatcherConfig matcher1, MatcherConfig matcher2) {
		this.filter = filter;
		this.connect = connect;
		this.matcher1 = matcher1;
		this.matcher2 = matcher2;
	}

	public ComposeFilter getFilter() {
		return filter;
	}
	public boolean isConnect() {
		return connect;
	}
	public MatcherConfig getMatcher1() {
		return matcher1;
	}
	public MatcherConfig getMatcher2() {
		return matcher2;
	}
	public String toString() {
		return "filter="+filter+" connect="+connect+" matcher1=("+matcher1+") matcher2=("+matcher2+")";
	}
}
