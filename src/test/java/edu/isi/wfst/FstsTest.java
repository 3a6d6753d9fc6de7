package edu.isi.wfst;

import java.util.List;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class FstsTest {

	@Test
	public void testAcceptor() throws Exception {
		SymbolTable st = SymbolTable.fromSymbols("hello", "world");
		VectorFst fst = Fsts.acceptor("hello world", st);
		assertThat(fst.numStates(), is(3));
		assertThat(fst.getTrs(0), contains(new Tr(1, 1, 0f, 1)));
		assertThat(fst.getTrs(1), contains(new Tr(2, 2, 0f, 2)));
		assertThat(fst.finalWeight(2), is(0f));
		List<StringPath> paths = DeterminizeTest.pathList(fst);
		assertThat(paths.get(0).istring(), is("hello world"));
	}

	@Test
	public void testLabelNumbers() throws Exception {
		VectorFst fst = Fsts.acceptor("4 5 6", null);
		assertThat(fst.numStates(), is(4));
		assertThat(fst.getTrs(2), contains(new Tr(6, 6, 0f, 3)));
	}

	@Test
	public void testTransducer() throws Exception {
		VectorFst fst = Fsts.transducer(new int[] { 1, 2, 3 }, new int[] { 4 }, 1.5f, new LogSemiring());
		assertThat(fst.numStates(), is(4));
		assertThat(fst.getTrs(0), contains(new Tr(1, 4, 0f, 1)));
		assertThat(fst.getTrs(2), contains(new Tr(3, 0, 0f, 3)));
		assertThat(fst.finalWeight(3), is(1.5f));
		assertThat(fst.getSemiring().getName(), is("log"));
	}

	@Test
	public void testTransducerSymbols() throws Exception {
		SymbolTable in = SymbolTable.fromSymbols("a", "b");
		SymbolTable out = SymbolTable.fromSymbols("x");
		VectorFst fst = Fsts.transducer("a b", "x", in, out);
		assertThat(DeterminizeTest.pathList(fst).get(0).ostring(), is("x"));
	}

	@Test
	public void testEmptyString() throws Exception {
		VectorFst fst = Fsts.acceptor("", null);
		assertThat(fst.numStates(), is(1));
		assertThat(fst.isFinal(0), is(true));
	}

	@Test(expected = ConfigureException.class)
	public void testUnknownSymbol() throws Exception {
		Fsts.acceptor("hello there", SymbolTable.fromSymbols("hello"));
	}

	@Test(expected = ConfigureException.class)
	public void testBadNumber() throws Exception {
		Fsts.acceptor("1 two", null);
	}
}
