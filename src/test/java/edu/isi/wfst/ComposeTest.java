package edu.isi.wfst;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ComposeTest {

	static VectorFst expected() throws Exception {
		return TestFsts.build(4, new float[][] {
				{ 0, 1, 1, 6, 2f },
				{ 0, 2, 1, 9, 5f },
				{ 1, 3, 3, 7, 4.5f },
				{ 3, 3, 3, 8, 3.5f },
		}, new float[][] { { 2, 0f }, { 3, 0f } });
	}

	@Test
	public void testCompose() throws Exception {
		VectorFst fst = Compose.compose(TestFsts.composeLeft(), TestFsts.composeRight());
		assertThat(fst, is(expected()));
	}

	@Test
	public void testTrivialFilter() throws Exception {
		VectorFst fst = Compose.compose(TestFsts.composeLeft(), TestFsts.composeRight(),
				new ComposeConfig(ComposeFilter.TRIVIAL, true));
		assertThat(fst, is(expected()));
	}

	@Test
	public void testEpsilons() throws Exception {
		// 1:eps then 2:3 against 3:4; the first automaton's epsilon output is followed alone
		VectorFst a = TestFsts.build(3, new float[][] {
				{ 0, 1, 1, 0, 1f },
				{ 1, 2, 2, 3, 1f },
		}, new float[][] { { 2, 0f } });
		VectorFst b = TestFsts.build(2, new float[][] {
				{ 0, 1, 3, 4, 1f },
		}, new float[][] { { 1, 0f } });
		VectorFst fst = Compose.compose(a, b);
		assertThat(TopSortTest.paths(fst), is(java.util.Arrays.asList("1 2 : 4 / 3.0")));
		VectorFst trivial = Compose.compose(a, b, new ComposeConfig(ComposeFilter.TRIVIAL, true));
		assertThat(TopSortTest.paths(trivial), is(java.util.Arrays.asList("1 2 : 4 / 3.0")));
	}

	@Test
	public void testRedundantEpsilonPaths() throws Exception {
		// eps output against eps input can be matched, or taken one after the other
		VectorFst a = TestFsts.build(2, new float[][] { { 0, 1, 1, 0, 0f } }, new float[][] { { 1, 0f } });
		VectorFst b = TestFsts.build(2, new float[][] { { 0, 1, 0, 2, 0f } }, new float[][] { { 1, 0f } });
		assertThat(TopSortTest.paths(Compose.compose(a, b)).size(), is(1));
		assertThat(TopSortTest.paths(Compose.compose(a, b, new ComposeConfig(ComposeFilter.TRIVIAL, true))).size() > 1, is(true));
	}

	static SymbolTable table() {
		return SymbolTable.fromSymbols("<eps>", "play", "david", "queen", "please", "<sigma>", "bowie", "radiohead");
	}

	@Test
	public void testSigma() throws Exception {
		SymbolTable st = table();
		int sigma = st.find("<sigma>");
		VectorFst pattern = Fsts.acceptor("play <sigma> please", st);
		VectorFst query = Fsts.acceptor("play queen please", st);
		ComposeConfig config = new ComposeConfig(ComposeFilter.AUTO, true, null, new MatcherConfig(sigma));
		VectorFst fst = Compose.compose(query, pattern, config);
		assertThat(fst, is(query));
	}

	@Test
	public void testSigmaAllowedMatches() throws Exception {
		SymbolTable st = table();
		int sigma = st.find("<sigma>");
		VectorFst pattern = Fsts.acceptor("play <sigma> please", st);
		ComposeConfig config = new ComposeConfig(ComposeFilter.AUTO, true, null,
				new MatcherConfig(sigma, MatcherRewriteMode.AUTO, new int[] { st.find("queen"), st.find("bowie") }));
		assertThat(Compose.compose(Fsts.acceptor("play queen please", st), pattern, config).numStates(), is(4));
		assertThat(Compose.compose(Fsts.acceptor("play bowie please", st), pattern, config).numStates(), is(4));
		assertThat(Compose.compose(Fsts.acceptor("play radiohead please", st), pattern, config).numStates(), is(0));
	}

	@Test(expected = ConfigureException.class)
	public void testEpsilonSigma() throws Exception {
		new MatcherConfig(Tr.EPS_LABEL);
	}

	@Test(expected = UnusualConditionException.class)
	public void testUnsorted() throws Exception {
		VectorFst a = TestFsts.build(2, new float[][] {
				{ 0, 1, 1, 4, 0f },
				{ 0, 1, 1, 2, 0f },
		}, new float[][] { { 1, 0f } });
		VectorFst b = TestFsts.build(2, new float[][] {
				{ 0, 1, 4, 1, 0f },
				{ 0, 1, 2, 1, 0f },
		}, new float[][] { { 1, 0f } });
		Compose.compose(a, b);
	}

	@Test(expected = UnusualConditionException.class)
	public void testMixedSemirings() throws Exception {
		Compose.compose(TestFsts.composeLeft(), WeightConvert.weightConvert(TestFsts.composeRight(), new LogSemiring()));
	}

	@Test
	public void testComposeFilterNames() throws Exception {
		assertThat(ComposeFilter.get("alt_sequence"), is(ComposeFilter.ALT_SEQUENCE));
		assertThat(ComposeFilter.get("no_match"), is(ComposeFilter.NO_MATCH));
	}
}
