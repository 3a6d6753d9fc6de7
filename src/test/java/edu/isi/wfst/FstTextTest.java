package edu.isi.wfst;

import java.io.File;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class FstTextTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testParse() throws Exception {
		VectorFst fst = FstText.parse("0\t1\t3\t4\t2.5\n1\t2\t5\t6\n2\n1\t1.5\n", new TropicalSemiring());
		assertThat(fst.numStates(), is(3));
		assertThat(fst.start(), is(0));
		assertThat(fst.getTrs(0), contains(new Tr(3, 4, 2.5f, 1)));
		assertThat(fst.getTrs(1), contains(new Tr(5, 6, 0f, 2)));
		assertThat(fst.finalWeight(2), is(0f));
		assertThat(fst.finalWeight(1), is(1.5f));
		assertThat(fst.isFinal(0), is(false));
	}

	@Test
	public void testStartIsFirstLine() throws Exception {
		VectorFst fst = FstText.parse("2 0 1 1\n0 1 2 2\n1\n", new TropicalSemiring());
		assertThat(fst.start(), is(2));
		assertThat(fst.numStates(), is(3));
	}

	@Test
	public void testEmpty() throws Exception {
		VectorFst fst = FstText.parse("", new TropicalSemiring());
		assertThat(fst.numStates(), is(0));
		assertThat(fst.start(), is(Fst.NO_STATE_ID));
		assertThat(fst.toText(), is(""));
	}

	@Test
	public void testPrintRoundTrip() throws Exception {
		VectorFst fst = TestFsts.composeRight();
		assertThat(FstText.parse(fst.toText(), new TropicalSemiring()), is(fst));
		VectorFst rm = TestFsts.rmEpsilonInput();
		assertThat(FstText.parse(FstText.print(rm), new TropicalSemiring()), is(rm));
	}

	@Test
	public void testFile() throws Exception {
		File f = folder.newFile("fst.txt");
		java.nio.file.Files.write(f.toPath(), "0 1 1 1 0.5\n1\n".getBytes("utf-8"));
		VectorFst fst = FstText.parse(f, new LogSemiring());
		assertThat(fst.getSemiring().getName(), is("log"));
		assertThat(fst.getTrs(0), contains(new Tr(1, 1, 0.5f, 1)));
	}

	@Test(expected = DataFormatException.class)
	public void testBadWeight() throws Exception {
		FstText.parse("0 1 1 1 heavy\n", new TropicalSemiring());
	}

	@Test(expected = DataFormatException.class)
	public void testBadFieldCount() throws Exception {
		FstText.parse("0 1 1\n", new TropicalSemiring());
	}

	@Test(expected = DataFormatException.class)
	public void testNegativeLabel() throws Exception {
		FstText.parse("0 1 -3 1\n", new TropicalSemiring());
	}
}
