package edu.isi.wfst;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.util.Date;
import java.util.EnumSet;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.FloatStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.LongStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class FstTool {
	static final String VERSION = "1.0";

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		// OPTIONS REGARDING THE FUNDAMENTALS OF DATA INPUT

		// format of the input (and output data) - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// semiring type: how do we combine the numbers?
		FlaggedOption semiringtype =
			new FlaggedOption("srtype",
					EnumeratedStringParser.getParser("tropical; log"),
					"tropical",
					true,
					'm',
					"semiring",
			"type of weights: tropical (min, +) or log (-log(e^-a + e^-b), +). Weights are costs in both");
		jsap.registerParameter(semiringtype);

		// binary in and out
		Switch binarysw = new Switch("binary",
				'b',
				"binary",
		"read and write automata in the binary format instead of the AT&T text format");
		jsap.registerParameter(binarysw);

		FlaggedOption isymopt = new FlaggedOption("isymbols",
				FileStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"isymbols",
		"symbol table for input labels, attached to the automata read from text");
		jsap.registerParameter(isymopt);

		FlaggedOption osymopt = new FlaggedOption("osymbols",
				FileStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"osymbols",
		"symbol table for output labels, attached to the automata read from text");
		jsap.registerParameter(osymopt);

		// OPTIONS REGARDING THE OPERATIONS TO PERFORM

		FlaggedOption deltaopt = new FlaggedOption("delta",
				FloatStringParser.getParser(),
				null,
				false,
				'd',
				"delta",
		"tolerance for comparing weights. Each command has its own default");
		jsap.registerParameter(deltaopt);

		FlaggedOption nshortestopt = new FlaggedOption("nshortest",
				IntegerStringParser.getParser(),
				"1",
				true,
				'n',
				"nshortest",
		"shortestpath: number of paths to return");
		jsap.registerParameter(nshortestopt);

		Switch uniquesw = new Switch("unique",
				'u',
				"unique",
		"shortestpath: return paths with distinct label sequences only");
		jsap.registerParameter(uniquesw);

		FlaggedOption dettypeopt = new FlaggedOption("dettype",
				EnumeratedStringParser.getParser("functional; nonfunctional; disambiguate"),
				"functional",
				true,
				JSAP.NO_SHORTFLAG,
				"det-type",
		"determinize: functional, nonfunctional or disambiguate");
		jsap.registerParameter(dettypeopt);

		Switch nondetsw = new Switch("allownondet",
				JSAP.NO_SHORTFLAG,
				"allow-nondet",
		"minimize: accept non-deterministic input (idempotent semirings only)");
		jsap.registerParameter(nondetsw);

		FlaggedOption sorttypeopt = new FlaggedOption("sorttype",
				EnumeratedStringParser.getParser("ilabel; olabel"),
				"ilabel",
				true,
				JSAP.NO_SHORTFLAG,
				"sort-type",
		"trsort: sort transitions by input (ilabel) or output (olabel) labels");
		jsap.registerParameter(sorttypeopt);

		Switch projoutsw = new Switch("projectoutput",
				JSAP.NO_SHORTFLAG,
				"project-output",
		"project: keep the output side instead of the input side");
		jsap.registerParameter(projoutsw);

		Switch tofinalsw = new Switch("tofinal",
				JSAP.NO_SHORTFLAG,
				"to-final",
		"push, shortestdistance: toward the final states instead of the initial state");
		jsap.registerParameter(tofinalsw);

		Switch pushweightssw = new Switch("pushweights",
				JSAP.NO_SHORTFLAG,
				"push-weights",
		"push: push weights");
		jsap.registerParameter(pushweightssw);

		Switch pushlabelssw = new Switch("pushlabels",
				JSAP.NO_SHORTFLAG,
				"push-labels",
		"push: push output labels");
		jsap.registerParameter(pushlabelssw);

		Switch removetotalsw = new Switch("removetotalweight",
				JSAP.NO_SHORTFLAG,
				"remove-total-weight",
		"push, randgen: divide out the total weight");
		jsap.registerParameter(removetotalsw);

		Switch removeaffixsw = new Switch("removecommonaffix",
				JSAP.NO_SHORTFLAG,
				"remove-common-affix",
		"push: drop the output prefix (or suffix) common to every path");
		jsap.registerParameter(removeaffixsw);

		FlaggedOption filteropt = new FlaggedOption("composefilter",
				StringStringParser.getParser(),
				"auto",
				true,
				JSAP.NO_SHORTFLAG,
				"compose-filter",
		"compose: epsilon filter, one of auto, null, trivial, sequence, alt_sequence, match, no_match");
		jsap.registerParameter(filteropt);

		FlaggedOption maptypeopt = new FlaggedOption("maptype",
				StringStringParser.getParser(),
				"identity",
				true,
				JSAP.NO_SHORTFLAG,
				"map-type",
				"map: one of identity, input_epsilon, output_epsilon, invert, plus, times, quantize, rmweight. "+
		"plus and times use --weight, quantize uses --delta");
		jsap.registerParameter(maptypeopt);

		FlaggedOption weightopt = new FlaggedOption("weight",
				FloatStringParser.getParser(),
				null,
				false,
				'w',
				"weight",
		"map: weight added (plus) or multiplied (times) into every weight");
		jsap.registerParameter(weightopt);

		FlaggedOption closureopt = new FlaggedOption("closuretype",
				EnumeratedStringParser.getParser("star; plus"),
				"star",
				true,
				JSAP.NO_SHORTFLAG,
				"closure-type",
		"closure: star (zero or more) or plus (one or more)");
		jsap.registerParameter(closureopt);

		FlaggedOption npathopt = new FlaggedOption("npath",
				IntegerStringParser.getParser(),
				"1",
				true,
				JSAP.NO_SHORTFLAG,
				"npath",
		"randgen: number of paths to draw");
		jsap.registerParameter(npathopt);

		FlaggedOption seedopt = new FlaggedOption("seed",
				LongStringParser.getParser(),
				"0",
				true,
				JSAP.NO_SHORTFLAG,
				"seed",
		"randgen: random seed; 0 seeds from the clock");
		jsap.registerParameter(seedopt);

		Switch weightedsw = new Switch("weighted",
				JSAP.NO_SHORTFLAG,
				"weighted",
		"randgen: write the weighted tree of samples instead of the sampled paths");
		jsap.registerParameter(weightedsw);

		// print timing information to stderr. number determines level of information
		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"timedebug",
				"Print timing information to stderr at a variety of levels: 0+ for "+
		"total operation, 1+ for each processing stage");
		jsap.registerParameter(timeopt);

		// output file - if specified, whatever is written is written here. otherwise to stdout
		FlaggedOption outfileopt =
			new FlaggedOption("outfile",
					FileStringParser.getParser(),
					null,
					false,
					'o',
					"outputfile",
					"file to write the resulting automaton or summary. If absent, writing is done "+
			"to stdout (text only)");
		jsap.registerParameter(outfileopt);

		UnflaggedOption commandopt = new UnflaggedOption("command",
				StringStringParser.getParser(),
				null,
				true,
				false,
				"operation to perform: "+FstCommand.getList());
		jsap.registerParameter(commandopt);

		UnflaggedOption infileopt = new UnflaggedOption("infiles",
				FileStringParser.getParser(),
				null,
				true,
				true,
				"input automata. union, concat and compose take two; everything else takes one");
		jsap.registerParameter(infileopt);

		JSAPResult config = jsap.parse(argv);
		if (config.getBoolean("help") || !config.success())
			return config;

		FstCommand command = FstCommand.get(config.getString("command"));
		File[] infiles = config.getFileArray("infiles");
		if (infiles.length != command.getArity())
			throw new ConfigureException(command.getName()+" takes "+command.getArity()+" input files, not "+infiles.length);
		if (config.getBoolean("binary") && !config.contains("outfile"))
			throw new ConfigureException("Binary output needs an output file (-o)");
		// validated here so the failure comes before any file is read
		ComposeFilter.get(config.getString("composefilter"));
		MapType mt = MapType.get(config.getString("maptype"));
		if ((mt == MapType.PLUS || mt == MapType.TIMES) && !config.contains("weight"))
			throw new ConfigureException("Map type "+config.getString("maptype")+" needs a weight (-w)");
		if (config.getInt("nshortest") < 0)
			throw new ConfigureException("Can't ask for a negative number of paths: "+config.getInt("nshortest"));
		return config;
	}

	// reads an automaton in the configured format and attaches any symbol tables given
	static VectorFst readFst(File f, Semiring sr, JSAPResult config) throws IOException, DataFormatException, UnusualConditionException {
		VectorFst fst;
		if (config.getBoolean("binary")) {
			fst = VectorFst.read(f);
			if (!fst.getSemiring().equals(sr))
				throw new UnusualConditionException(f.getName()+" has "+fst.getSemiring().getName()+" weights, not "+sr.getName());
		}
		else
			fst = FstText.parse(f, sr);
		if (config.contains("isymbols"))
			fst.setInputSymbols(SymbolTable.readText(config.getFile("isymbols")));
		if (config.contains("osymbols"))
			fst.setOutputSymbols(SymbolTable.readText(config.getFile("osymbols")));
		return fst;
	}

	// runs one command. The result is an automaton or, for info and shortestdistance, text
	static Object runCommand(FstCommand command, VectorFst[] fsts, JSAPResult config)
	throws ConfigureException, UnusualConditionException {
		boolean debug = false;
		if (debug) Debug.debug(debug, "Running "+command.getName()+" over "+fsts.length+" automata");
		VectorFst fst = fsts[0];
		boolean hasDelta = config.contains("delta");
		switch (command) {
		case CONNECT:
			return Connect.connect(fst);
		case TOPSORT:
			return TopSort.topSort(fst);
		case TRSORT:
			return TrSort.trSort(fst, config.getString("sorttype").equals("ilabel"));
		case TR_UNIQUE:
			return TrUnique.trUnique(fst);
		case TR_SUM:
			return TrSum.trSum(fst);
		case RMEPSILON:
			return RmEpsilon.rmEpsilon(fst);
		case SHORTESTPATH:
			return ShortestPath.shortestPath(fst, new ShortestPathConfig(config.getInt("nshortest"), config.getBoolean("unique"),
					hasDelta ? config.getFloat("delta") : Semiring.KSHORTESTDELTA));
		case SHORTESTDISTANCE: {
			float[] d = ShortestDistance.shortestDistance(fst, config.getBoolean("tofinal"),
					hasDelta ? config.getFloat("delta") : Semiring.KSHORTESTDELTA);
			StringBuffer sb = new StringBuffer();
			for (int s = 0; s < d.length; s++)
				sb.append(s).append('\t').append(fst.getSemiring().internalToPrint(d[s])).append('\n');
			return sb.toString();
		}
		case PUSH: {
			EnumSet<PushType> ptype = PushType.of(config.getBoolean("pushweights"), config.getBoolean("pushlabels"),
					config.getBoolean("removetotalweight"), config.getBoolean("removecommonaffix"));
			ReweightType rtype = config.getBoolean("tofinal") ? ReweightType.REWEIGHT_TO_FINAL : ReweightType.REWEIGHT_TO_INITIAL;
			return Push.push(fst, rtype, ptype, hasDelta ? config.getFloat("delta") : Semiring.KDELTA);
		}
		case DETERMINIZE:
			return Determinize.determinize(fst, new DeterminizeConfig(DeterminizeType.get(config.getString("dettype")),
					hasDelta ? config.getFloat("delta") : Semiring.KDELTA));
		case MINIMIZE:
			Minimize.minimize(fst, new MinimizeConfig(hasDelta ? config.getFloat("delta") : Semiring.KSHORTESTDELTA,
					config.getBoolean("allownondet")));
			return fst;
		case OPTIMIZE:
			Optimize.optimize(fst);
			return fst;
		case INVERT:
			return Invert.invert(fst);
		case PROJECT:
			return Project.project(fst, config.getBoolean("projectoutput") ? ProjectType.PROJECT_OUTPUT : ProjectType.PROJECT_INPUT);
		case REVERSE:
			return Reverse.reverse(fst);
		case CLOSURE:
			return Closure.closure(fst, ClosureType.get(config.getString("closuretype")));
		case UNION:
			return Union.union(fst, fsts[1]);
		case CONCAT:
			return Concat.concat(fst, fsts[1]);
		case COMPOSE:
			return Compose.compose(fst, fsts[1], new ComposeConfig(ComposeFilter.get(config.getString("composefilter")), true, null, null));
		case MAP: {
			MapType mt = MapType.get(config.getString("maptype"));
			if (mt == MapType.QUANTIZE)
				return TrMap.trMap(fst, mt, hasDelta ? config.getFloat("delta") : Semiring.KDELTA);
			if (mt == MapType.PLUS || mt == MapType.TIMES)
				return TrMap.trMap(fst, mt, config.getFloat("weight"));
			return TrMap.trMap(fst, mt);
		}
		case RMFINALEPSILON:
			return RmFinalEpsilon.rmFinalEpsilon(fst);
		case RANDGEN:
			return RandGen.randGen(fst, new RandGenConfig(config.getInt("npath"), config.getLong("seed"), Integer.MAX_VALUE,
					config.getBoolean("weighted"), config.getBoolean("removetotalweight"), RandGenSelector.UNIFORM));
		case INFO:
			return FstProperties.summary(fst);
		default:
			throw new ConfigureException("Unhandled command "+command.getName());
		}
	}

	public static void main(String argv[]) {
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		String encoding = "utf-8";
		int timeLevel = 0;
		Semiring sr = null;
		FstCommand command = null;

		// 1) Set up all parameters. Die on bad combinations.

		Date registerAllParametersTime = new Date();
		try {
			config = processParameters(jsap, argv);
			if (config.success() && !config.getBoolean("help")) {
				encoding = config.getString("encoding");
				Debug.setEncoding(encoding);
				if (config.contains("time")) {
					timeLevel = config.getInt("time", -1);
					Debug.setDbLevel(timeLevel);
				}
				sr = Semiring.get(config.getString("srtype"));
				command = FstCommand.get(config.getString("command"));
			}
		}
		catch (JSAPException e) {
			System.err.println("fsttool options improperly configured: "+e.getMessage());
			System.err.println("Try 'fsttool -h` for a detailed help message");
			System.exit(1);
		}
		catch (ConfigureException e) {
			System.err.println("fsttool options improperly configured: "+e.getMessage());
			System.err.println("Try 'fsttool -h` for a detailed help message");
			System.exit(1);
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("fsttool "+VERSION);
			Debug.prettyDebug("Usage: fsttool ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			System.exit(0);
		}

		if (!config.success()) {
			for (java.util.Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext();)
				Debug.prettyDebug("Error: " + errs.next());
			Debug.prettyDebug("Usage: fsttool ");
			Debug.prettyDebug("             "+jsap.getUsage());
			System.exit(1);
		}
		Date configureParametersTime = new Date();
		Debug.dbtime(timeLevel, 2, registerAllParametersTime, configureParametersTime, "register and configure parameters");

		// 2) Read the automata, run the command, write the result

		try {
			Date preLoadTime = new Date();
			File[] infiles = config.getFileArray("infiles");
			VectorFst[] fsts = new VectorFst[infiles.length];
			for (int i = 0; i < infiles.length; i++)
				fsts[i] = readFst(infiles[i], sr, config);
			Date postLoadTime = new Date();
			Debug.dbtime(timeLevel, 1, preLoadTime, postLoadTime, "loaded files");

			Object result = runCommand(command, fsts, config);
			Date postRunTime = new Date();
			Debug.dbtime(timeLevel, 1, postLoadTime, postRunTime, command.getName());

			File outfile = config.getFile("outfile");
			if (result instanceof VectorFst && config.getBoolean("binary"))
				((VectorFst)result).write(outfile);
			else {
				String text = result instanceof VectorFst ? ((VectorFst)result).toText() : result.toString();
				OutputStreamWriter w = outfile == null ? new OutputStreamWriter(System.out, encoding)
						: new OutputStreamWriter(new FileOutputStream(outfile), encoding);
				w.write(text);
				w.close();
			}
			Debug.dbtime(timeLevel, 1, postRunTime, new Date(), "wrote output");
			Debug.dbtime(timeLevel, 0, registerAllParametersTime, new Date(), "total operation");
		}
		catch (ConfigureException e) {
			System.err.println("fsttool options improperly configured: "+e.getMessage());
			System.exit(1);
		}
		catch (DataFormatException e) {
			System.err.println("Malformed input: "+e.getMessage());
			System.exit(1);
		}
		catch (UnusualConditionException e) {
			System.err.println(command.getName()+" failed: "+e.getMessage());
			System.exit(1);
		}
		catch (IOException e) {
			System.err.println("I/O problem: "+e.getMessage());
			System.exit(1);
		}
	}
}
