package edu.isi.wfst;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;

public class ConcatTest {

	static VectorFst first() throws Exception {
		return TestFsts.build(2, new float[][] { { 0, 1, 1, 1, 1f } }, new float[][] { { 1, 0.2f } });
	}

	static VectorFst second() throws Exception {
		return TestFsts.build(2, new float[][] { { 0, 1, 2, 2, 2f } }, new float[][] { { 1, 1.5f } });
	}

	@Test
	public void testConcat() throws Exception {
		VectorFst fst = Concat.concat(first(), second());
		VectorFst expected = TestFsts.build(4, new float[][] {
				{ 0, 1, 1, 1, 1f },
				{ 1, 2, 0, 0, 0.2f },
				{ 2, 3, 2, 2, 2f },
		}, new float[][] { { 3, 1.5f } });
		assertThat(fst, is(expected));
	}

	@Test
	public void testConcatList() throws Exception {
		VectorFst fst = Concat.concatList(first(), Arrays.asList(second(), second()));
		assertThat(fst.numStates(), is(6));
		List<StringPath> paths = DeterminizeTest.pathList(fst);
		assertThat(paths.size(), is(1));
		assertThat(paths.get(0).istring(), is("1 2 2"));
		assertThat((double)paths.get(0).getWeight(), closeTo(8.2, 1e-4));
	}

	@Test
	public void testEmptySecond() throws Exception {
		// nothing to continue with, so nothing is accepted
		VectorFst fst = Concat.concat(first(), new VectorFst());
		assertThat(TopSortTest.paths(fst).isEmpty(), is(true));
	}

	@Test
	public void testEmptyFirst() throws Exception {
		VectorFst fst = Concat.concat(new VectorFst(), second());
		assertThat(fst.numStates(), is(0));
	}
}
