package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class MinimizeTest {

	@Test
	public void testUnweightedAcceptor() throws Exception {
		VectorFst fst = TestFsts.minimizeInput();
		Minimize.minimize(fst);
		assertThat(fst.numStates(), is(3));
		assertThat(fst.numTrs(), is(3));
		assertThat(new HashSet<String>(TopSortTest.paths(fst)), is(new HashSet<String>(TopSortTest.paths(TestFsts.minimizeInput()))));
	}

	@Test
	public void testWeightedAcceptor() throws Exception {
		// the two branches differ only in where the weight sits
		VectorFst fst = TestFsts.build(5, new float[][] {
				{ 0, 1, 1, 1, 1f },
				{ 0, 2, 2, 2, 0f },
				{ 1, 3, 3, 3, 0f },
				{ 2, 4, 3, 3, 1f },
		}, new float[][] { { 3, 0f }, { 4, 0f } });
		Minimize.minimize(fst);
		assertThat(fst.numStates(), is(3));
		assertThat(ShortestDistance.shortestDistanceTotal(fst), is(1f));
		for (String p : TopSortTest.paths(fst))
			assertThat(p.endsWith("/ 1.0"), is(true));
	}

	@Test
	public void testTransducerKeepsPaths() throws Exception {
		VectorFst in = TestFsts.build(5, new float[][] {
				{ 0, 1, 1, 3, 0f },
				{ 0, 2, 2, 3, 0f },
				{ 1, 3, 2, 4, 0f },
				{ 2, 4, 2, 4, 0f },
		}, new float[][] { { 3, 0f }, { 4, 0f } });
		VectorFst fst = in.copy();
		Minimize.minimize(fst);
		assertThat(fst.numStates() < in.numStates(), is(true));
		assertThat(new HashSet<String>(TopSortTest.paths(fst)), is(new HashSet<String>(TopSortTest.paths(in))));
	}

	@Test
	public void testNondeterministic() throws Exception {
		VectorFst in = TestFsts.build(3, new float[][] {
				{ 0, 1, 1, 1, 0f },
				{ 0, 2, 1, 1, 0f },
		}, new float[][] { { 1, 0f }, { 2, 0f } });
		VectorFst fst = in.copy();
		try {
			Minimize.minimize(fst);
			fail("non-deterministic input was minimized");
		}
		catch (UnusualConditionException e) {
			assertThat(fst, is(in));
		}
		Minimize.minimize(fst, new MinimizeConfig(Semiring.KDELTA, true));
		assertThat(fst.numStates(), is(2));
	}

	@Test(expected = UnusualConditionException.class)
	public void testNondeterministicLog() throws Exception {
		VectorFst in = TestFsts.build(3, new float[][] {
				{ 0, 1, 1, 1, 0f },
				{ 0, 2, 1, 1, 0f },
		}, new float[][] { { 1, 0f }, { 2, 0f } });
		Minimize.minimize(WeightConvert.weightConvert(in, new LogSemiring()), new MinimizeConfig(Semiring.KDELTA, true));
	}

	// outputs and weights for one input string, as "ostring / weight" lines
	static List<String> outputs(Fst fst, int... input) throws Exception {
		VectorFst in = Fsts.acceptor(input, fst.getSemiring());
		List<String> ret = new ArrayList<String>();
		for (Iterator<StringPath> it = Compose.compose(in, fst).paths(); it.hasNext(); ) {
			StringPath p = it.next();
			ret.add(p.ostring()+" / "+Math.round(p.getWeight()*1000)/1000.0);
		}
		Collections.sort(ret);
		return ret;
	}

	@Test
	public void testCyclicStartGetsNoNewState() throws Exception {
		VectorFst in = TestFsts.build(2, new float[][] {
				{ 0, 1, 1, 1, 1f },
				{ 1, 0, 2, 2, 2f },
		}, new float[][] { { 1, 0.5f } });
		VectorFst fst = in.copy();
		Minimize.minimize(fst);
		assertThat(fst.numStates(), is(2));
		int[][] inputs = { { 1 }, { 1, 2, 1 }, { 1, 2, 1, 2, 1 }, { 1, 2 } };
		for (int[] input : inputs)
			assertThat(outputs(fst, input), is(outputs(in, input)));
		assertThat(outputs(fst, 1, 2, 1), contains("1 2 1 / 4.5"));
	}

	@Test
	public void testTransducerNeverGrows() throws Exception {
		// the start is on a cycle and every path out of it begins with output 5
		VectorFst in = TestFsts.build(2, new float[][] {
				{ 0, 1, 1, 5, 0f },
				{ 1, 0, 2, 6, 1f },
		}, new float[][] { { 1, 0f } });
		VectorFst fst = in.copy();
		Minimize.minimize(fst);
		assertThat(fst.numStates() <= in.numStates(), is(true));
		int[][] inputs = { { 1 }, { 1, 2, 1 }, { 1, 2, 1, 2, 1 }, { 2 } };
		for (int[] input : inputs)
			assertThat(outputs(fst, input), is(outputs(in, input)));
		assertThat(outputs(fst, 1, 2, 1), contains("5 6 5 / 1.0"));
	}
}
