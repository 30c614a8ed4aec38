package edu.isi.ccglex;

// separates a parenthesized group from the text that follows it
public class BracketMatcher {

	/**
	 * Splits text starting with <code>(</code> into the group through its
	 * matching <code>)</code>, inclusive, and the remainder after it.
	 *
	 * @throws MalformedCategoryException if the group is never closed
	 */
	public static Pair<String, String> match(String text) throws MalformedCategoryException {
		if (text == null || !text.startsWith("("))
			throw new MalformedCategoryException("Expected '(' at start of '"+text+"'");
		int close = findClose(text, 0);
		return new Pair<String, String>(text.substring(0, close+1), text.substring(close+1));
	}

	// index of the ')' closing the '(' at open. nested groups are skipped by recursion
	private static int findClose(String text, int open) throws MalformedCategoryException {
		boolean debug = false;
		int i = open+1;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == ')') {
				if (debug) Debug.debug(debug, "closed "+open+" at "+i+" in "+text);
				return i;
			}
			if (c == '(')
				i = findClose(text, i);
			i++;
		}
		throw new MalformedCategoryException("Unmatched bracket in string '"+text.substring(open)+"'");
	}
}
