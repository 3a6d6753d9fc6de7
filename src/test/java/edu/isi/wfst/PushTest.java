package edu.isi.wfst;

import java.util.EnumSet;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class PushTest {

	static VectorFst input() throws Exception {
		return TestFsts.build(2, new float[][] {
				{ 0, 1, 1, 1, 1f },
				{ 0, 1, 2, 2, 3f },
		}, new float[][] { { 1, 2f } });
	}

	@Test
	public void testPushToInitial() throws Exception {
		VectorFst in = input();
		VectorFst fst = Push.push(in, ReweightType.REWEIGHT_TO_INITIAL, EnumSet.of(PushType.PUSH_WEIGHTS));
		assertThat(fst.getTrs(0), contains(new Tr(1, 1, 3f, 1), new Tr(2, 2, 5f, 1)));
		assertThat(fst.finalWeight(1), is(0f));
		// the input is untouched
		assertThat(in, is(input()));
	}

	@Test
	public void testRemoveTotalWeight() throws Exception {
		VectorFst fst = Push.push(input(), ReweightType.REWEIGHT_TO_INITIAL,
				EnumSet.of(PushType.PUSH_WEIGHTS, PushType.REMOVE_TOTAL_WEIGHT));
		assertThat(fst.getTrs(0), contains(new Tr(1, 1, 0f, 1), new Tr(2, 2, 2f, 1)));
		assertThat(fst.finalWeight(1), is(0f));
	}

	@Test
	public void testPushToFinal() throws Exception {
		VectorFst fst = Push.push(input(), true, true, false, false, false);
		assertThat(fst.getTrs(0), contains(new Tr(1, 1, 0f, 1), new Tr(2, 2, 2f, 1)));
		assertThat(fst.finalWeight(1), is(3f));
	}

	@Test
	public void testPushLabelsKeepsPaths() throws Exception {
		// both outputs out of state 1 start with 7
		VectorFst in = TestFsts.build(3, new float[][] {
				{ 0, 1, 1, 0, 0f },
				{ 1, 2, 2, 7, 0f },
				{ 1, 2, 3, 7, 0f },
		}, new float[][] { { 2, 0f } });
		VectorFst fst = Push.push(in, ReweightType.REWEIGHT_TO_INITIAL, EnumSet.of(PushType.PUSH_LABELS));
		assertThat(fst.getTrs(0), contains(new Tr(1, 7, 0f, 1)));
		assertThat(TopSortTest.paths(fst), is(TopSortTest.paths(in)));
	}

	@Test
	public void testPushTypeOf() {
		assertThat(PushType.of(true, false, true, false), is(EnumSet.of(PushType.PUSH_WEIGHTS, PushType.REMOVE_TOTAL_WEIGHT)));
	}
}
