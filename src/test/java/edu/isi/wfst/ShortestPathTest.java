package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.fail;

public class ShortestPathTest {

	static List<Float> weights(Fst fst) {
		List<Float> ret = new ArrayList<Float>();
		for (Iterator<StringPath> it = fst.paths(); it.hasNext(); )
			ret.add(it.next().getWeight());
		Collections.sort(ret);
		return ret;
	}

	@Test
	public void testSingle() throws Exception {
		VectorFst fst = ShortestPath.shortestPath(TestFsts.shortestPathInput());
		VectorFst expected = TestFsts.build(3, new float[][] {
				{ 0, 1, 1, 1, 3f },
				{ 1, 2, 3, 3, 4f },
		}, new float[][] { { 2, 2f } });
		assertThat(fst, is(expected));
	}

	@Test
	public void testNBest() throws Exception {
		VectorFst fst = ShortestPath.shortestPath(TestFsts.shortestPathInput(), new ShortestPathConfig(2, false));
		assertThat(weights(fst), contains(9f, 14f));
		fst = ShortestPath.shortestPath(TestFsts.shortestPathInput(), new ShortestPathConfig(5, false));
		assertThat(weights(fst), contains(9f, 14f));
	}

	@Test
	public void testUnique() throws Exception {
		// two paths spell 1 1; the unique run keeps only the better one
		VectorFst input = TestFsts.build(3, new float[][] {
				{ 0, 1, 1, 1, 1f },
				{ 0, 1, 1, 1, 2f },
				{ 1, 2, 1, 1, 1f },
				{ 1, 2, 2, 2, 5f },
		}, new float[][] { { 2, 0f } });
		VectorFst all = ShortestPath.shortestPath(input, new ShortestPathConfig(2, false));
		assertThat(weights(all), contains(2f, 3f));
		VectorFst unique = ShortestPath.shortestPath(input, new ShortestPathConfig(2, true));
		assertThat(weights(unique), contains(2f, 6f));
	}

	@Test
	public void testZero() throws Exception {
		VectorFst fst = ShortestPath.shortestPath(TestFsts.shortestPathInput(), new ShortestPathConfig(0, false));
		assertThat(fst.numStates(), is(0));
	}

	@Test
	public void testNoFinal() throws Exception {
		VectorFst fst = ShortestPath.shortestPath(TestFsts.build(2, new float[][] { { 0, 1, 1, 1, 1f } }, new float[0][]));
		assertThat(fst.numStates(), is(0));
	}

	@Test(expected = UnusualConditionException.class)
	public void testNeedsPathProperty() throws Exception {
		ShortestPath.shortestPath(WeightConvert.weightConvert(TestFsts.shortestPathInput(), new LogSemiring()));
	}

	// the one best path weighs what the shortest distance to the finals says
	@Test
	public void testBestPathWeighsTheTotalDistance() throws Exception {
		VectorFst[] inputs = { TestFsts.shortestPathInput(), TestFsts.composeRight(), TestFsts.rmEpsilonInput(),
				TestFsts.optimizeInput(), TestFsts.connectInput() };
		float[] expected = { 9f, 3f, 10f, 4f, 5f };
		for (int i = 0; i < inputs.length; i++) {
			VectorFst best = ShortestPath.shortestPath(inputs[i]);
			List<Float> w = weights(best);
			assertThat(w.size(), is(1));
			assertThat((double)w.get(0), closeTo(expected[i], 1e-4));
			assertThat((double)w.get(0), closeTo(ShortestDistance.shortestDistanceTotal(inputs[i]), 1e-4));
			assertThat((double)ShortestDistance.shortestDistanceTotal(best), closeTo(w.get(0), 1e-4));
		}
	}

	// log weights have no best path, but the log total never exceeds the best tropical path
	@Test
	public void testLogTotalBoundedByBestPath() throws Exception {
		VectorFst[] inputs = { TestFsts.shortestPathInput(), TestFsts.composeRight() };
		for (VectorFst in : inputs) {
			float best = weights(ShortestPath.shortestPath(in)).get(0);
			VectorFst log = WeightConvert.weightConvert(in, new LogSemiring());
			assertThat((double)ShortestDistance.shortestDistanceTotal(log), lessThanOrEqualTo((double)best));
			try {
				ShortestPath.shortestPath(log);
				fail("log weights accepted");
			}
			catch (UnusualConditionException e) {
				// expected
			}
		}
	}
}
