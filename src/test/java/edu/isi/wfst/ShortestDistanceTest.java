package edu.isi.wfst;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;

public class ShortestDistanceTest {

	@Test
	public void testForward() throws Exception {
		float[] d = ShortestDistance.shortestDistance(TestFsts.shortestPathInput());
		assertThat(d.length, is(4));
		assertThat(d[0], is(0f));
		assertThat(d[1], is(3f));
		assertThat(d[2], is(5f));
		assertThat(d[3], is(7f));
	}

	@Test
	public void testReverse() throws Exception {
		float[] d = ShortestDistance.shortestDistance(TestFsts.shortestPathInput(), true);
		assertThat(d[0], is(9f));
		assertThat(d[1], is(6f));
		assertThat(d[2], is(9f));
		assertThat(d[3], is(2f));
	}

	@Test
	public void testUnreachable() throws Exception {
		float[] d = ShortestDistance.shortestDistance(TestFsts.connectInput());
		assertThat(d[4], is(Float.POSITIVE_INFINITY));
		assertThat(d[2], is(5f));
	}

	@Test
	public void testTotal() throws Exception {
		assertThat(ShortestDistance.shortestDistanceTotal(TestFsts.shortestPathInput()), is(9f));
		VectorFst log = WeightConvert.weightConvert(TestFsts.shortestPathInput(), new LogSemiring());
		// -log(e^-9 + e^-14)
		double expected = -Math.log(Math.exp(-9) + Math.exp(-14));
		assertThat((double)ShortestDistance.shortestDistanceTotal(log), closeTo(expected, 1e-4));
	}

	@Test
	public void testCyclicLog() throws Exception {
		// geometric sum over a self loop: 0 -> 1 with 1 looping at weight ln 2
		VectorFst fst = new VectorFst(new LogSemiring());
		fst.addStates(2);
		fst.setStart(0);
		fst.addTr(0, new Tr(1, 1, 0f, 1));
		fst.addTr(1, new Tr(2, 2, (float)Math.log(2), 1));
		fst.setFinal(1, 0f);
		// sum of 2^-k for k >= 0 is 2
		assertThat((double)ShortestDistance.shortestDistanceTotal(fst), closeTo(-Math.log(2), 1e-3));
	}

	@Test
	public void testQueueDisciplines() throws Exception {
		VectorFst fst = TestFsts.composeRight();
		QueueType[] types = { QueueType.FIFO, QueueType.LIFO, QueueType.SHORTEST_FIRST, QueueType.AUTO };
		for (QueueType qt : types) {
			float[] d = new ShortestDistance(fst, TrFilter.ANY, qt, Semiring.KSHORTESTDELTA).compute(0);
			assertThat(qt.toString(), d, is(new float[] { 0f, 1f, 3f }));
		}
		assertThat(QueueType.get("lifo"), is(QueueType.LIFO));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTopOrderOnCycle() throws Exception {
		new ShortestDistance(TestFsts.composeRight(), TrFilter.ANY, QueueType.TOP_ORDER, Semiring.KSHORTESTDELTA);
	}
}
