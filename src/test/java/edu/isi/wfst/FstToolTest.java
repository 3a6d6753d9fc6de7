package edu.isi.wfst;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPResult;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class FstToolTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static JSAPResult parse(String... argv) throws Exception {
		return FstTool.processParameters(new JSAP(), argv);
	}

	@Test
	public void testDefaults() throws Exception {
		JSAPResult config = parse("connect", "a.fst");
		assertThat(config.success(), is(true));
		assertThat(config.getString("command"), is("connect"));
		assertThat(config.getFileArray("infiles").length, is(1));
		assertThat(config.getString("srtype"), is("tropical"));
		assertThat(config.getInt("nshortest"), is(1));
		assertThat(config.getBoolean("binary"), is(false));
	}

	@Test(expected = ConfigureException.class)
	public void testWrongArity() throws Exception {
		parse("union", "a.fst");
	}

	@Test(expected = ConfigureException.class)
	public void testUnknownCommand() throws Exception {
		parse("frobnicate", "a.fst");
	}

	@Test(expected = ConfigureException.class)
	public void testBinaryNeedsOutfile() throws Exception {
		parse("-b", "connect", "a.fst");
	}

	@Test(expected = ConfigureException.class)
	public void testMapNeedsWeight() throws Exception {
		parse("--map-type", "plus", "map", "a.fst");
	}

	@Test(expected = ConfigureException.class)
	public void testUnknownFilter() throws Exception {
		parse("--compose-filter", "bogus", "compose", "a.fst", "b.fst");
	}

	@Test
	public void testConnect() throws Exception {
		JSAPResult config = parse("connect", "a.fst");
		Object out = FstTool.runCommand(FstCommand.CONNECT, new VectorFst[] { TestFsts.connectInput() }, config);
		assertThat((VectorFst)out, is(ConnectTest.expected()));
	}

	@Test
	public void testInfo() throws Exception {
		JSAPResult config = parse("info", "a.fst");
		Object out = FstTool.runCommand(FstCommand.INFO, new VectorFst[] { TestFsts.composeLeft() }, config);
		assertThat(out.toString(), containsString("# of states\t3"));
	}

	@Test
	public void testShortestDistance() throws Exception {
		JSAPResult config = parse("shortestdistance", "a.fst");
		Object out = FstTool.runCommand(FstCommand.SHORTESTDISTANCE, new VectorFst[] { TestFsts.shortestPathInput() }, config);
		assertThat(out.toString(), is("0\t0\n1\t3\n2\t5\n3\t7\n"));
	}

	@Test
	public void testMapTimes() throws Exception {
		JSAPResult config = parse("--map-type", "times", "-w", "2", "map", "a.fst");
		VectorFst out = (VectorFst)FstTool.runCommand(FstCommand.MAP, new VectorFst[] { TestFsts.composeLeft() }, config);
		assertThat(out.getTrs(0).get(0).weight, is(3f));
	}

	@Test
	public void testReadWithSymbols() throws Exception {
		File fst = folder.newFile("a.txt");
		Files.write(fst.toPath(), "0\t1\t1\t2\n1\n".getBytes(StandardCharsets.UTF_8));
		File syms = folder.newFile("syms.txt");
		Files.write(syms.toPath(), "<eps>\t0\na\t1\nb\t2\n".getBytes(StandardCharsets.UTF_8));
		JSAPResult config = parse("--isymbols", syms.getPath(), "--osymbols", syms.getPath(), "invert", fst.getPath());
		VectorFst in = FstTool.readFst(fst, new TropicalSemiring(), config);
		assertThat(in.getInputSymbols().find(2), is("b"));
		VectorFst out = (VectorFst)FstTool.runCommand(FstCommand.INVERT, new VectorFst[] { in }, config);
		StringPath p = out.paths().next();
		assertThat(p.istring(), is("b"));
		assertThat(p.ostring(), is("a"));
	}
}
