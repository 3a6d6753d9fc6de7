package edu.isi.wfst;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class OptimizeTest {

	static VectorFst expected() throws Exception {
		return TestFsts.build(4, new float[][] {
				{ 0, 1, 1, 2, 4f },
				{ 0, 2, 1, 3, 7f },
				{ 1, 3, 4, 6, 1f },
				{ 2, 3, 7, 8, 0f },
		}, new float[][] { { 1, 0f }, { 3, 0f } });
	}

	@Test
	public void testOptimize() throws Exception {
		VectorFst fst = TestFsts.optimizeInput();
		Optimize.optimize(fst);
		assertThat(fst.numStates(), is(4));
		assertThat(Isomorphic.isomorphic(fst, expected()), is(true));
	}

	@Test
	public void testOptimizeInLog() throws Exception {
		VectorFst fst = TestFsts.optimizeInput();
		Optimize.optimizeInLog(fst);
		assertThat(fst.getSemiring().getName(), is("tropical"));
		assertThat(fst.numStates(), is(4));
		assertThat(FstProperties.hasEpsilons(fst), is(false));
	}

	@Test
	public void testDeterministicInput() throws Exception {
		VectorFst fst = TestFsts.minimizeInput();
		Optimize.optimize(fst);
		assertThat(fst.numStates(), is(3));
	}

	@Test
	public void testAcceptor() throws Exception {
		// same string twice, different weights
		VectorFst fst = TestFsts.build(3, new float[][] {
				{ 0, 1, 1, 1, 2f },
				{ 0, 2, 1, 1, 1f },
				{ 1, 2, 0, 0, 0f },
		}, new float[][] { { 2, 0f } });
		Optimize.optimize(fst);
		assertThat(FstProperties.isIDeterministic(fst), is(true));
		assertThat(ShortestDistance.shortestDistanceTotal(fst), is(1f));
		assertThat(fst.numTrs(), is(1));
	}
}
