package edu.isi.wfst;

import java.util.EnumSet;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class EncodeTest {

	@Test
	public void testEncodeLabels() throws Exception {
		VectorFst fst = TestFsts.composeLeft();
		fst.setInputSymbols(SymbolTable.fromSymbols("a", "b", "c"));
		VectorFst orig = fst.copy();
		EncodeTable table = Encode.encode(fst, EnumSet.of(EncodeType.ENCODE_LABELS));
		assertThat(table.size(), is(3));
		assertThat(FstProperties.isAcceptor(fst), is(true));
		assertThat(fst.getInputSymbols(), nullValue());
		// weights stay where they were
		assertThat(fst.getTrs(0).get(1).weight, is(2f));
		Encode.decode(fst, table);
		assertThat(fst, is(orig));
	}

	@Test
	public void testEncodeWeights() throws Exception {
		VectorFst fst = TestFsts.composeRight();
		VectorFst orig = fst.copy();
		EncodeTable table = Encode.encode(fst, EnumSet.of(EncodeType.ENCODE_LABELS, EncodeType.ENCODE_WEIGHTS));
		assertThat(FstProperties.isWeighted(fst), is(false));
		// one new final state
		assertThat(fst.numStates(), is(4));
		assertThat(table.decode(fst.getTrs(0).get(0).ilabel), is(new Tr(2, 6, 1f, Fst.NO_STATE_ID)));
		Encode.decode(fst, table);
		assertThat(fst, is(orig));
	}

	@Test(expected = UnusualConditionException.class)
	public void testUnknownLabel() throws Exception {
		VectorFst fst = TestFsts.composeLeft();
		EncodeTable table = Encode.encode(fst, EnumSet.of(EncodeType.ENCODE_LABELS));
		fst.addTr(0, new Tr(42, 42, 0f, 1));
		Encode.decode(fst, table);
	}

	@Test
	public void testSharedEntries() throws Exception {
		VectorFst fst = TestFsts.build(3, new float[][] {
				{ 0, 1, 1, 2, 1f },
				{ 1, 2, 1, 2, 5f },
		}, new float[][] { { 2, 0f } });
		EncodeTable table = Encode.encode(fst, EnumSet.of(EncodeType.ENCODE_LABELS));
		assertThat(table.size(), is(1));
		assertThat(fst.getTrs(0).get(0).ilabel, is(fst.getTrs(1).get(0).ilabel));
	}
}
