package edu.isi.wfst;

// fixture automata shared by the tests. All tropical
public class TestFsts {

	// builds an automaton from (src, dst, ilabel, olabel, weight) rows; state 0 is the start
	static VectorFst build(int nstates, float[][] trs, float[][] finals) throws StateOutOfRangeException, DataFormatException {
		VectorFst fst = new VectorFst();
		fst.addStates(nstates);
		fst.setStart(0);
		for (float[] t : trs)
			fst.addTr((int)t[0], new Tr((int)t[2], (int)t[3], t[4], (int)t[1]));
		for (float[] f : finals)
			fst.setFinal((int)f[0], f[1]);
		return fst;
	}

	// five states: 4 is unreachable (loops on itself and into 1), 3 is a dead end
	static VectorFst connectInput() throws StateOutOfRangeException, DataFormatException {
		return build(5, new float[][] {
				{ 0, 1, 3, 4, 2f },
				{ 1, 2, 4, 5, 3f },
				{ 0, 2, 7, 8, 5f },
				{ 1, 3, 5, 6, 1f },
				{ 4, 4, 1, 1, 1f },
				{ 4, 1, 2, 2, 1f },
		}, new float[][] { { 2, 0f } });
	}

	// shortest path 0 -1:1/3-> 1 -3:3/4-> 3 with final 2; the other branch costs 14
	static VectorFst shortestPathInput() throws StateOutOfRangeException, DataFormatException {
		return build(4, new float[][] {
				{ 0, 1, 1, 1, 3f },
				{ 0, 2, 2, 2, 5f },
				{ 1, 3, 3, 3, 4f },
				{ 2, 3, 3, 3, 7f },
		}, new float[][] { { 3, 2f } });
	}

	// 2 and 3 are reached by epsilons only; 2 has three epsilon branches to 3
	static VectorFst rmEpsilonInput() throws StateOutOfRangeException, DataFormatException {
		return build(4, new float[][] {
				{ 0, 2, 0, 0, 1f },
				{ 0, 1, 0, 2, 4f },
				{ 1, 0, 1, 0, 3f },
				{ 2, 3, 0, 0, 2f },
				{ 2, 3, 0, 0, 5f },
				{ 2, 3, 0, 0, 9f },
		}, new float[][] { { 1, 6f }, { 3, 8f } });
	}

	static VectorFst composeLeft() throws StateOutOfRangeException, DataFormatException {
		return build(3, new float[][] {
				{ 0, 1, 1, 2, 1f },
				{ 0, 2, 1, 4, 2f },
				{ 1, 1, 3, 5, 2f },
		}, new float[][] { { 1, 0f }, { 2, 0f } });
	}

	static VectorFst composeRight() throws StateOutOfRangeException, DataFormatException {
		return build(3, new float[][] {
				{ 0, 1, 2, 6, 1f },
				{ 1, 2, 5, 7, 2.5f },
				{ 2, 2, 5, 8, 1.5f },
				{ 0, 2, 4, 9, 3f },
		}, new float[][] { { 2, 0f } });
	}

	static VectorFst optimizeInput() throws StateOutOfRangeException, DataFormatException {
		return build(4, new float[][] {
				{ 0, 1, 1, 2, 1f },
				{ 0, 2, 1, 3, 2f },
				{ 1, 3, 0, 0, 3f },
				{ 1, 3, 4, 6, 4f },
				{ 2, 3, 7, 8, 5f },
		}, new float[][] { { 3, 0f } });
	}

	static VectorFst projectInput() throws StateOutOfRangeException, DataFormatException {
		return build(3, new float[][] {
				{ 0, 1, 1, 2, 1f },
				{ 0, 1, 3, 4, 2f },
				{ 1, 2, 4, 5, 3f },
		}, new float[][] { { 2, 0f } });
	}

	// two equal-length branches that end the same way
	static VectorFst minimizeInput() throws StateOutOfRangeException, DataFormatException {
		return build(5, new float[][] {
				{ 0, 1, 1, 1, 0f },
				{ 0, 2, 2, 2, 0f },
				{ 1, 3, 3, 3, 0f },
				{ 2, 4, 3, 3, 0f },
		}, new float[][] { { 3, 0f }, { 4, 0f } });
	}
}
