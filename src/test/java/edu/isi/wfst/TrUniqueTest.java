package edu.isi.wfst;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.is;

public class TrUniqueTest {

	static VectorFst input() throws Exception {
		return TestFsts.build(3, new float[][] {
				{ 0, 1, 1, 2, 1f },
				{ 0, 1, 1, 2, 1f },
				{ 0, 1, 1, 2, 2f },
				{ 0, 2, 1, 2, 1f },
				{ 0, 1, 3, 4, 1f },
		}, new float[][] { { 1, 0f }, { 2, 0f } });
	}

	@Test
	public void testTrUnique() throws Exception {
		VectorFst fst = TrUnique.trUnique(input());
		assertThat(fst.numTrs(0), is(4));
		assertThat(fst.getTrs(0), containsInAnyOrder(new Tr(1, 2, 1f, 1), new Tr(1, 2, 2f, 1),
				new Tr(1, 2, 1f, 2), new Tr(3, 4, 1f, 1)));
	}

	@Test
	public void testTrSum() throws Exception {
		VectorFst fst = TrSum.trSum(input());
		assertThat(fst.numTrs(0), is(3));
		assertThat(fst.getTrs(0), containsInAnyOrder(new Tr(1, 2, 1f, 1), new Tr(1, 2, 1f, 2), new Tr(3, 4, 1f, 1)));
	}

	@Test
	public void testTrSumLog() throws Exception {
		VectorFst fst = TestFsts.build(2, new float[][] {
				{ 0, 1, 1, 1, 0.5f },
				{ 0, 1, 1, 1, 0.5f },
		}, new float[][] { { 1, 0f } });
		fst = WeightConvert.weightConvert(fst, new LogSemiring());
		TrSum.trSum(fst);
		assertThat(fst.numTrs(0), is(1));
		float w = fst.getTrs(0).get(0).weight;
		assertThat(Math.abs(w - (0.5f - (float)Math.log(2))) < 1e-5, is(true));
	}

	@Test
	public void testNothingToRemove() throws Exception {
		VectorFst fst = TrUnique.trUnique(TestFsts.composeLeft());
		assertThat(fst.getTrs(1), contains(new Tr(3, 5, 2f, 1)));
		assertThat(fst.numTrs(), is(3));
	}
}
