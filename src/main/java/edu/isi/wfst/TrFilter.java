package edu.isi.wfst;

// which transitions a traversal may follow
interface TrFilter {
	boolean accept(Tr tr);

	TrFilter ANY = new TrFilter() {
		public boolean accept(Tr tr) {
			return true;
		}
	};
	TrFilter EPSILON = new TrFilter() {
		public boolean accept(Tr tr) {
			return tr.isEpsilon();
		}
	};
}
