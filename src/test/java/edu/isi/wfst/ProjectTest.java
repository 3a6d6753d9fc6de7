package edu.isi.wfst;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

public class ProjectTest {

	@Test
	public void testProjectInput() throws Exception {
		VectorFst fst = Project.project(TestFsts.projectInput(), ProjectType.PROJECT_INPUT);
		assertThat(fst.getTrs(0), contains(new Tr(1, 1, 1f, 1), new Tr(3, 3, 2f, 1)));
		assertThat(fst.getTrs(1), contains(new Tr(4, 4, 3f, 2)));
		assertThat(FstProperties.isAcceptor(fst), is(true));
	}

	@Test
	public void testProjectOutput() throws Exception {
		VectorFst fst = Project.project(TestFsts.projectInput(), ProjectType.PROJECT_OUTPUT);
		assertThat(fst.getTrs(0), contains(new Tr(2, 2, 1f, 1), new Tr(4, 4, 2f, 1)));
		assertThat(fst.getTrs(1), contains(new Tr(5, 5, 3f, 2)));
	}

	@Test
	public void testProjectSymbols() throws Exception {
		VectorFst fst = TestFsts.projectInput();
		SymbolTable osyms = SymbolTable.fromSymbols("x", "y");
		fst.setInputSymbols(SymbolTable.fromSymbols("a"));
		fst.setOutputSymbols(osyms);
		Project.project(fst, ProjectType.PROJECT_OUTPUT);
		assertThat(fst.getInputSymbols(), sameInstance(osyms));
		assertThat(fst.getOutputSymbols(), sameInstance(osyms));
	}

	@Test
	public void testInvert() throws Exception {
		VectorFst fst = TestFsts.projectInput();
		SymbolTable isyms = SymbolTable.fromSymbols("a");
		fst.setInputSymbols(isyms);
		Invert.invert(fst);
		assertThat(fst.getTrs(0), contains(new Tr(2, 1, 1f, 1), new Tr(4, 3, 2f, 1)));
		assertThat(fst.getOutputSymbols(), sameInstance(isyms));
		Invert.invert(fst);
		assertThat(fst.getTrs(0), is(TestFsts.projectInput().getTrs(0)));
		assertThat(fst.getInputSymbols(), sameInstance(isyms));
	}

	@Test
	public void testProjectType() throws Exception {
		assertThat(ProjectType.get("output"), is(ProjectType.PROJECT_OUTPUT));
	}
}
