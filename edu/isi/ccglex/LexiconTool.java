package edu.isi.ccglex;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.StringReader;
import java.util.Date;
import java.util.Iterator;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line front end: load a lexicon and print it, its start category, a summary, or some words
public class LexiconTool {
	// version number. change this when updating!
	static final String VERSION = "1.0";

	// summary of a lexicon, one count per line
	private static void getLexiconCheck(StringBuilder buffer, String name, Lexicon lex) {
		int numCats = 0;
		for (String word : lex.words())
			numCats += lex.categories(word).size();
		buffer.append("Lexicon info for "+name+":\n");
		buffer.append("\t"+lex.primitives().size()+" primitive categories\n");
		buffer.append("\t"+lex.families().size()+" families\n");
		buffer.append("\t"+lex.words().size()+" words\n");
		buffer.append("\t"+numCats+" word categories\n");
		buffer.append("\tstart category "+lex.start()+"\n");
	}

	// everything having to do with the JSAP parameters and config exceptions based on them
	private static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

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

		// OPTIONS REGARDING WHAT IS PRINTED

		FlaggedOption wordopt = new FlaggedOption("word",
				StringStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				'w',
				"word",
				"print the categories of this word as 'word => cat | cat'. May be given more than once. "+
		"Words not in the lexicon print with nothing after the arrow");
		wordopt.setAllowMultipleDeclarations(true);
		jsap.registerParameter(wordopt);

		Switch startsw = new Switch("start",
				's',
				"start",
		"print the start category of the lexicon");
		jsap.registerParameter(startsw);

		Switch csw = new Switch("check",
				'c',
				"check",
		"print the number of primitives, families, words and categories, and the start category");
		jsap.registerParameter(csw);

		Switch samplesw = new Switch("sample",
				JSAP.NO_SHORTFLAG,
				"sample",
		"use the bundled openccg tinytiny lexicon instead of input files");
		jsap.registerParameter(samplesw);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				't',
				"time",
		"print timing information to stderr. Higher levels print more");
		jsap.registerParameter(timeopt);

		// output file - if specified, whatever is written is written here. otherwise to stdout
		FlaggedOption outfileopt = 
			new FlaggedOption("outfile", 
					FileStringParser.getParser(), 
					JSAP.NO_DEFAULT,
					false,
					'o',
					"outputfile",
			"file to write output to. If absent, writing is done to stdout");
		jsap.registerParameter(outfileopt);

		// lexicon files are read in order as one source
		UnflaggedOption infileopt = new UnflaggedOption("infiles",
				FileStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				true,
				"list of lexicon files, read in order as if they were one file. The special symbol '-' "+
		"(no quote) may be specified up to one time to indicate reading from STDIN");
		jsap.registerParameter(infileopt);

		JSAPResult config = jsap.parse(argv);
		if (!config.success() || config.getBoolean("help"))
			return config;

		boolean hasFiles = config.contains("infiles") && config.getFileArray("infiles").length > 0;
		if (config.getBoolean("sample") && hasFiles)
			throw new ConfigureException("Can't use --sample together with input files");
		if (!config.getBoolean("sample") && !hasFiles)
			throw new ConfigureException("No input files given; name some or use --sample");

		int numActive = 0;
		if (config.getBoolean("start"))
			numActive++;
		if (config.getBoolean("check"))
			numActive++;
		if (config.contains("word"))
			numActive++;
		if (numActive > 1)
			throw new ConfigureException("Can have at most one of -s, -c, -w arguments!");
		return config;
	}

	// read all files into one source text. detect stdin here and prevent multiple stdins.
	private static String loadFiles(File[] infiles, String encoding) throws ConfigureException, FileNotFoundException, 
	IOException {
		boolean debug = false;
		StringBuilder text = new StringBuilder();
		boolean seenstdin = false;
		for (File f : infiles) {
			BufferedReader br = null;
			if (f.getName().equals("-")) {
				if (seenstdin)
					throw new ConfigureException("Can only reference stdin (-) once in the list of files");
				seenstdin = true;
				Debug.debug(debug, "Reading from stdin");
				br = new BufferedReader(new InputStreamReader(System.in, encoding));
			}
			else {
				Debug.debug(debug, "Reading from "+f.getName());
				br = new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
			}
			try {
				String line;
				while ((line = br.readLine()) != null)
					text.append(line).append('\n');
			}
			finally {
				if (!f.getName().equals("-"))
					br.close();
			}
		}
		return text.toString();
	}

	// what the options ask for, as text
	private static String render(Lexicon lex, String name, JSAPResult config) {
		StringBuilder out = new StringBuilder();
		if (config.getBoolean("start"))
			out.append(lex.start()).append('\n');
		else if (config.getBoolean("check"))
			getLexiconCheck(out, name, lex);
		else if (config.contains("word")) {
			for (String word : config.getStringArray("word"))
				out.append(lex.entryString(word)).append('\n');
		}
		else {
			String all = lex.toString();
			if (all.length() > 0)
				out.append(all).append('\n');
		}
		return out.toString();
	}

	public static void main(String argv[]) {
		System.exit(run(argv));
	}

	/** does the work of main, returning the exit status instead of exiting */
	public static int run(String argv[]) {
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		try {
			config = processParameters(jsap, argv);
		}
		catch (JSAPException e) {
			System.err.println("Options improperly configured: "+e.getMessage());
			System.err.println("Try 'ccglex -h' for a detailed help message");
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("Options improperly configured: "+e.getMessage());
			System.err.println("Try 'ccglex -h' for a detailed help message");
			return 1;
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("This is ccglex, version "+VERSION);
			Debug.prettyDebug("Usage: ccglex ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return 0;
		}

		if (!config.success()) {
			for (Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: ccglex ");
			Debug.prettyDebug("             "+jsap.getUsage());
			return 1;
		}

		String encoding = config.getString("encoding");
		Debug.setEncoding(encoding);
		if (config.contains("time"))
			Debug.setDbLevel(config.getInt("time"));

		try {
			Date preReadTime = new Date();
			Lexicon lex = null;
			String name = null;
			if (config.getBoolean("sample")) {
				name = SampleLexicons.TINYTINY;
				lex = SampleLexicons.openccgTinyTiny();
			}
			else {
				File[] infiles = config.getFileArray("infiles");
				name = infiles.length == 1 ? infiles[0].getName() : infiles.length+" files";
				lex = LexiconBuilder.fromReader(new BufferedReader(new StringReader(loadFiles(infiles, encoding))));
			}
			Debug.dbtime(1, preReadTime, "loaded "+name);

			OutputStreamWriter w = null;
			File outfile = config.getFile("outfile");
			if (outfile != null)
				w = new OutputStreamWriter(new FileOutputStream(outfile), encoding);
			else
				w = new OutputStreamWriter(System.out, encoding);
			w.write(render(lex, name, config));
			if (outfile != null)
				w.close();
			else
				w.flush();
		}
		catch (FileNotFoundException e) {
			System.err.println("File not found: "+e.getMessage());
			return 1;
		}
		catch (DataFormatException e) {
			System.err.println("Improper data specified: "+e.getMessage());
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("Options improperly configured: "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			System.err.println("Couldn't read or write: "+e.getMessage());
			return 1;
		}
		return 0;
	}
}
