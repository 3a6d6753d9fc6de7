package edu.isi.wfst;

import java.util.Arrays;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class UnionTest {

	static VectorFst first() throws Exception {
		return TestFsts.build(3, new float[][] {
				{ 0, 1, 1, 2, 1f },
				{ 0, 1, 3, 4, 2f },
				{ 1, 2, 4, 5, 3f },
		}, new float[][] { { 2, 0f } });
	}

	static VectorFst second() throws Exception {
		return TestFsts.build(2, new float[][] {
				{ 0, 1, 1, 2, 1f },
				{ 1, 1, 3, 4, 2.5f },
		}, new float[][] { { 1, 0.2f } });
	}

	@Test
	public void testUnion() throws Exception {
		VectorFst fst = Union.union(first(), second());
		VectorFst expected = TestFsts.build(5, new float[][] {
				{ 0, 1, 1, 2, 1f },
				{ 0, 1, 3, 4, 2f },
				{ 1, 2, 4, 5, 3f },
				{ 0, 3, 0, 0, 0f },
				{ 3, 4, 1, 2, 1f },
				{ 4, 4, 3, 4, 2.5f },
		}, new float[][] { { 2, 0f }, { 4, 0.2f } });
		assertThat(fst, is(expected));
	}

	@Test
	public void testCyclicStart() throws Exception {
		// the start of the first automaton is on a cycle, so a new start is made
		VectorFst a = TestFsts.build(1, new float[][] { { 0, 0, 1, 1, 0f } }, new float[][] { { 0, 0f } });
		VectorFst fst = Union.union(a, second());
		assertThat(fst.numStates(), is(4));
		assertThat(fst.start(), is(3));
		assertThat(fst.getTrs(3), contains(new Tr(0, 0, 0f, 0), new Tr(0, 0, 0f, 1)));
	}

	@Test
	public void testEmptyFirst() throws Exception {
		VectorFst fst = Union.union(new VectorFst(), second());
		assertThat(fst, is(second()));
	}

	@Test
	public void testWithItself() throws Exception {
		VectorFst fst = second();
		Union.union(fst, fst);
		assertThat(fst.numStates(), is(4));
		assertThat(TopSortTest.paths(RmEpsilon.rmEpsilon(fst.copy())).size() > 0, is(true));
	}

	@Test
	public void testUnionList() throws Exception {
		VectorFst fst = Union.unionList(first(), Arrays.asList(second(), second()));
		assertThat(fst.numStates(), is(7));
		assertThat(fst.numTrs(0), is(4));
	}

	@Test(expected = UnusualConditionException.class)
	public void testMixedSemirings() throws Exception {
		Union.union(first(), WeightConvert.weightConvert(second(), new LogSemiring()));
	}
}
