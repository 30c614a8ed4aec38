package edu.isi.ccglex;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads lexicon source, one entry per line:
 * <pre>
 * :- S,NP,N            # primitive categories; the first ever declared is the start
 * Det :: NP/N          # family definition
 * the => NP[sg]/N[sg]  # word entry; -> and --> work as well
 * </pre>
 * Everything from a <code>#</code> to the end of the line is a comment. The
 * first bad line aborts the whole build.
 */
public class LexiconBuilder {

	// declares primitive categories
	private static final String PRIMITIVES_PREFIX = ":-";
	private static final String FAMILY_SEPARATOR = "::";

	// identifier, separator, category
	private static Pattern entryPat = Pattern.compile("([\\w_]+)\\s*(::|[-=]+>)\\s*(.+)", 
			Pattern.UNICODE_CHARACTER_CLASS);

	// text before the first comment character
	private static Pattern commentStripPat = Pattern.compile("([^#]*)(?:#.*)?", Pattern.DOTALL);

	// report progress on big files at this interval
	private static final int REP_SIZE = 10000;

	private final List<String> primitives = new ArrayList<String>();
	private final Map<String, Family> families = new LinkedHashMap<String, Family>();
	private final Map<String, List<Category>> entries = new LinkedHashMap<String, List<Category>>();
	private int lineNumber = 0;
	private int entryCount = 0;
	private boolean didPrintWarning = false;

	private LexiconBuilder() {}

	/** builds a lexicon from source text held in memory */
	public static Lexicon fromString(String text) throws DataFormatException {
		try {
			return fromReader(new BufferedReader(new StringReader(text)));
		}
		catch (IOException e) {
			throw new IllegalStateException("IOException reading from a string", e);
		}
	}

	public static Lexicon fromFile(String filename, String encoding) throws FileNotFoundException, IOException, DataFormatException {
		return fromReader(new BufferedReader(new InputStreamReader(new FileInputStream(filename), encoding)));
	}

	/** builds a lexicon from every line of br, closing it when done */
	public static Lexicon fromReader(BufferedReader br) throws IOException, DataFormatException {
		Date readTime = new Date();
		LexiconBuilder builder = new LexiconBuilder();
		try {
			String line;
			while ((line = br.readLine()) != null)
				builder.readLine(line);
		}
		finally {
			br.close();
		}
		Lexicon lex = builder.build();
		if (builder.didPrintWarning)
			Debug.prettyDebug("Done reading large lexicon");
		Debug.dbtime(1, readTime, "read lexicon of "+builder.entryCount+" entries");
		return lex;
	}

	// process one raw line of source
	private void readLine(String line) throws DataFormatException {
		boolean debug = false;
		lineNumber++;
		Matcher commentStripMatch = commentStripPat.matcher(line);
		if (!commentStripMatch.matches())
			throw new MalformedLexiconLineException(lineNumber, line);
		String text = commentStripMatch.group(1).trim();
		if (text.length() == 0) {
			if (debug) Debug.debug(debug, "Ignoring comment/whitespace: "+line);
			return;
		}

		if (text.startsWith(PRIMITIVES_PREFIX)) {
			for (String prim : text.substring(PRIMITIVES_PREFIX.length()).trim().split(",", -1))
				primitives.add(prim.trim());
			if (debug) Debug.debug(debug, "Primitives now "+primitives);
			return;
		}

		Matcher entryMatch = entryPat.matcher(text);
		if (!entryMatch.matches())
			throw new MalformedLexiconLineException(lineNumber, text);
		String ident = entryMatch.group(1);
		String sep = entryMatch.group(2);
		String catText = entryMatch.group(3);

		Pair<Category, UnificationVariable> parsed = parseCategory(catText, text);
		if (sep.equals(FAMILY_SEPARATOR)) {
			// redefinition replaces the old family
			families.put(ident, new Family(ident, parsed.l(), parsed.r()));
			if (debug) Debug.debug(debug, "Family "+ident+" is "+parsed.l());
		}
		else {
			List<Category> cats = entries.get(ident);
			if (cats == null) {
				cats = new ArrayList<Category>();
				entries.put(ident, cats);
			}
			cats.add(parsed.l());
			if (debug) Debug.debug(debug, "Word "+ident+" gets "+parsed.l());
		}
		entryCount++;
		if (entryCount % REP_SIZE == 0) {
			if (!didPrintWarning) {
				Debug.prettyDebug("Lexicon is large (>"+REP_SIZE+" entries) so progress will be reported below");
				didPrintWarning = true;
			}
			Debug.prettyDebug("Read "+entryCount+" entries");
		}
	}

	// parse with a fresh binding, putting the line into any error message
	private Pair<Category, UnificationVariable> parseCategory(String catText, String text) throws DataFormatException {
		String where = "line "+lineNumber+": "+text+", ";
		try {
			return CategoryParser.augParseCategory(catText, primitives, families, null);
		}
		catch (MalformedCategoryException e) {
			throw new MalformedCategoryException(where+e.getMessage(), e);
		}
		catch (UnknownCategoryNameException e) {
			throw new UnknownCategoryNameException(where+e.getMessage(), e);
		}
	}

	private Lexicon build() throws NoPrimitivesDeclaredException {
		if (primitives.isEmpty())
			throw new NoPrimitivesDeclaredException();
		return new Lexicon(primitives.get(0), primitives, families, entries);
	}
}
