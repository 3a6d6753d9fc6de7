package edu.isi.wfst;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.sameInstance;

public class RelabelTest {

	@Test
	public void testRelabelTables() throws Exception {
		VectorFst fst = TestFsts.build(2, new float[][] { { 0, 1, 1, 2, 0f } }, new float[][] { { 1, 0f } });
		SymbolTable oldSyms = SymbolTable.fromSymbols("a", "b");
		SymbolTable newSyms = SymbolTable.fromSymbols("b", "a");
		Relabel.relabelTables(fst, oldSyms, newSyms, oldSyms, newSyms);
		assertThat(fst.getTrs(0), contains(new Tr(2, 1, 0f, 1)));
		assertThat(fst.getInputSymbols(), sameInstance(newSyms));
		assertThat(fst.getOutputSymbols(), sameInstance(newSyms));
	}

	@Test
	public void testOneSide() throws Exception {
		VectorFst fst = TestFsts.build(2, new float[][] { { 0, 1, 1, 2, 0f } }, new float[][] { { 1, 0f } });
		Relabel.relabelTables(fst, SymbolTable.fromSymbols("a", "b"), SymbolTable.fromSymbols("x", "b", "a"), null, null);
		assertThat(fst.getTrs(0), contains(new Tr(3, 2, 0f, 1)));
	}

	@Test(expected = ConfigureException.class)
	public void testMissingSymbol() throws Exception {
		VectorFst fst = TestFsts.composeLeft();
		Relabel.relabelTables(fst, SymbolTable.fromSymbols("a", "b"), SymbolTable.fromSymbols("a"), null, null);
	}

	@Test
	public void testRelabelPairs() throws Exception {
		VectorFst fst = TestFsts.composeLeft();
		Relabel.relabelPairs(fst, new int[][] { { 1, 10 }, { 3, 30 } }, new int[][] { { 4, 40 } });
		assertThat(fst.getTrs(0), contains(new Tr(10, 2, 1f, 1), new Tr(10, 40, 2f, 2)));
		assertThat(fst.getTrs(1), contains(new Tr(30, 5, 2f, 1)));
	}

	@Test(expected = ConfigureException.class)
	public void testDuplicatePair() throws Exception {
		Relabel.relabelPairs(TestFsts.composeLeft(), new int[][] { { 1, 10 }, { 1, 11 } }, null);
	}
}
