package edu.isi.wfst;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class StringPathsIteratorTest {

	@Test
	public void testPaths() throws Exception {
		List<StringPath> paths = DeterminizeTest.pathList(TestFsts.shortestPathInput());
		assertThat(paths.size(), is(2));
		assertThat(paths.get(0).getILabels(), is(new int[] { 1, 3 }));
		assertThat(paths.get(0).getWeight(), is(9f));
		assertThat(paths.get(1).getOLabels(), is(new int[] { 2, 3 }));
		assertThat(paths.get(1).getWeight(), is(14f));
	}

	@Test
	public void testEpsilonsSkipped() throws Exception {
		List<StringPath> paths = DeterminizeTest.pathList(TestFsts.build(3, new float[][] {
				{ 0, 1, 0, 4, 1f },
				{ 1, 2, 5, 0, 1f },
		}, new float[][] { { 2, 0f } }));
		assertThat(paths.get(0).getILabels(), is(new int[] { 5 }));
		assertThat(paths.get(0).getOLabels(), is(new int[] { 4 }));
	}

	@Test
	public void testSymbols() throws Exception {
		SymbolTable st = SymbolTable.fromSymbols("a", "b", "c");
		VectorFst fst = Fsts.acceptor("a c", st);
		StringPath p = fst.paths().next();
		assertThat(p.istring(), is("a c"));
		assertThat(p.toString(), is("1 3 : 1 3 / 0.0"));
	}

	@Test(expected = UnusualConditionException.class)
	public void testLabelMissingFromTable() throws Exception {
		VectorFst fst = Fsts.acceptor("7", null);
		fst.setInputSymbols(SymbolTable.fromSymbols("a"));
		fst.paths().next().istring();
	}

	@Test(expected = NoSuchElementException.class)
	public void testExhausted() throws Exception {
		Iterator<StringPath> it = new VectorFst().paths();
		assertThat(it.hasNext(), is(false));
		it.next();
	}
}
