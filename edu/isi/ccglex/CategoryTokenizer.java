package edu.isi.ccglex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// splits category text into atoms (primitive with subscripts, or a parenthesized group)
// and the application operators between them
public class CategoryTokenizer {

	// a primitive name and its optional bracketed subscripts
	private static Pattern primPat = Pattern.compile("([A-Za-z]+)(\\[[A-Za-z,]+\\])?");

	// the next primitive atom, then whatever is left
	private static Pattern nextPrimPat = Pattern.compile("([A-Za-z]+(?:\\[[A-Za-z,]+\\])?)(.*)", Pattern.DOTALL);

	// slash, up to two modifiers, then whatever is left
	private static Pattern appPat = Pattern.compile("([\\\\/])([.,]?)([.,]?)(.*)", Pattern.DOTALL);

	/**
	 * Next atom of a category string and the text after it. An atom is
	 * either a whole parenthesized group, parens included, or a primitive
	 * like <code>NP[sg,pl]</code>.
	 */
	public static Pair<String, String> nextCategory(String text) throws MalformedCategoryException {
		if (text.startsWith("("))
			return BracketMatcher.match(text);
		Matcher m = nextPrimPat.matcher(text);
		if (!m.matches()) {
			if (text.length() == 0)
				throw new MalformedCategoryException("Expected a category but reached the end of the text");
			throw new MalformedCategoryException("Expected a primitive category or '(' at '"+text+"'");
		}
		return new Pair<String, String>(m.group(1), m.group(2));
	}

	/**
	 * Splits a primitive atom into its name and bracketed subscript text.
	 * The subscript half is null when there are no brackets.
	 */
	public static Pair<String, String> splitPrimitive(String atom) throws MalformedCategoryException {
		Matcher m = primPat.matcher(atom);
		if (!m.matches())
			throw new MalformedCategoryException("Not a primitive category: '"+atom+"'");
		return new Pair<String, String>(m.group(1), m.group(2));
	}

	/** Reads the application operator at the head of text; returns its direction and the rest */
	public static Pair<Direction, String> nextApplication(String text) throws MalformedCategoryException {
		Matcher m = appPat.matcher(text);
		if (!m.matches())
			throw new MalformedCategoryException("Expected '/' or '\\' at '"+text+"'");
		Direction dir = new Direction(Direction.Slash.get(m.group(1).charAt(0)), m.group(2)+m.group(3));
		return new Pair<Direction, String>(dir, m.group(4));
	}

	/** subscripts of a primitive, e.g. <code>[sg,pl]</code>, in the order written. null gives an empty list */
	public static List<String> parseSubscripts(String bracketed) {
		if (bracketed == null || bracketed.length() == 0)
			return Collections.emptyList();
		return new ArrayList<String>(Arrays.asList(bracketed.substring(1, bracketed.length()-1).split(",", -1)));
	}
}
