package edu.isi.ccglex;

import java.util.Collection;
import java.util.Map;

/**
 * Recursive descent reader for category strings such as
 * <code>(S\NP[sg])/NP</code>. Names resolve against the declared primitives
 * and the families defined so far; the special name <code>var</code> is a
 * unification variable shared by every use within one category string.
 */
public class CategoryParser {

	public static final String VAR = "var";

	/** Parses text into a category, dropping the variable binding */
	public static Category parseCategory(String text, Collection<String> primitives, 
			Map<String, Family> families) throws DataFormatException {
		return augParseCategory(text, primitives, families, null).l();
	}

	/**
	 * Parses text into a category, threading the variable binding through
	 * every term. Pass null for binding to start unbound.
	 *
	 * @return the category and the binding after the parse, which is null
	 *         if neither <code>var</code> nor a family carrying a variable was used
	 */
	public static Pair<Category, UnificationVariable> augParseCategory(String text, Collection<String> primitives, 
			Map<String, Family> families, UnificationVariable binding) throws DataFormatException {
		boolean debug = false;
		if (debug) Debug.debug(debug, "parsing "+text);
		Pair<String, String> next = CategoryTokenizer.nextCategory(text);
		Pair<Category, UnificationVariable> term = parseTerm(next.l(), primitives, families, binding);
		Category res = term.l();
		binding = term.r();
		String rest = next.r();

		// fold further arguments in from the left: A/B/C is (A/B)/C
		while (rest.length() > 0) {
			Pair<Direction, String> app = CategoryTokenizer.nextApplication(rest);
			next = CategoryTokenizer.nextCategory(app.r());
			term = parseTerm(next.l(), primitives, families, binding);
			binding = term.r();
			res = new FunctionalCategory(res, term.l(), app.l());
			rest = next.r();
		}
		if (debug) Debug.debug(debug, "parsed "+text+" as "+res);
		return new Pair<Category, UnificationVariable>(res, binding);
	}

	// a single atom: a parenthesized group is parsed again without its parens
	private static Pair<Category, UnificationVariable> parseTerm(String atom, Collection<String> primitives, 
			Map<String, Family> families, UnificationVariable binding) throws DataFormatException {
		if (atom.startsWith("("))
			return augParseCategory(atom.substring(1, atom.length()-1), primitives, families, binding);
		Pair<String, String> chunks = CategoryTokenizer.splitPrimitive(atom);
		return parsePrimitiveCategory(chunks.l(), chunks.r(), primitives, families, binding);
	}

	/**
	 * Resolves a name, in order, as the variable <code>var</code>, a family,
	 * or a declared primitive.
	 *
	 * @param subscripts bracketed subscript text, or null
	 * @throws UnknownCategoryNameException if the name is none of these
	 */
	static Pair<Category, UnificationVariable> parsePrimitiveCategory(String name, String subscripts, 
			Collection<String> primitives, Map<String, Family> families, UnificationVariable binding) 
	throws UnknownCategoryNameException {
		boolean debug = false;
		if (VAR.equals(name) && subscripts == null) {
			if (binding == null) {
				binding = new UnificationVariable();
				if (debug) Debug.debug(debug, "bound new variable "+binding);
			}
			return new Pair<Category, UnificationVariable>(binding, binding);
		}

		Family fam = families.get(name);
		if (fam != null) {
			Category cat = fam.category();
			// first variable seen in this parse is adopted; later ones are renamed to it
			if (binding == null)
				binding = fam.variable();
			else if (fam.variable() != null)
				cat = cat.substitute(fam.variable(), binding);
			if (debug) Debug.debug(debug, "expanded family "+name+" to "+cat);
			return new Pair<Category, UnificationVariable>(cat, binding);
		}

		if (primitives.contains(name))
			return new Pair<Category, UnificationVariable>(
					new PrimitiveCategory(name, CategoryTokenizer.parseSubscripts(subscripts)), binding);
		throw new UnknownCategoryNameException(name);
	}
}
