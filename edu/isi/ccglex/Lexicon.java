package edu.isi.ccglex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The words of a categorial grammar with the categories each may take, the
 * declared primitives, the families, and the start category a parse must
 * reduce to. Built once by {@link LexiconBuilder}; read-only afterwards.
 */
public class Lexicon {
	private final PrimitiveCategory start;
	private final List<String> primitives;
	private final Map<String, Family> families;
	private final Map<String, List<Category>> entries;

	public Lexicon(String start, List<String> primitives, Map<String, Family> families, 
			Map<String, List<Category>> entries) {
		this.start = new PrimitiveCategory(start);
		this.primitives = Collections.unmodifiableList(new ArrayList<String>(primitives));
		this.families = Collections.unmodifiableMap(new LinkedHashMap<String, Family>(families));
		LinkedHashMap<String, List<Category>> copy = new LinkedHashMap<String, List<Category>>();
		for (Map.Entry<String, List<Category>> e : entries.entrySet())
			copy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<Category>(e.getValue())));
		this.entries = Collections.unmodifiableMap(copy);
	}

	/** All categories of a word, in the order they were defined. Unknown words give an empty list */
	public List<Category> categories(String word) {
		List<Category> cats = entries.get(word);
		if (cats == null)
			return Collections.emptyList();
		return cats;
	}

	/** the target category for the parser */
	public PrimitiveCategory start() { return start; }

	public List<String> primitives() { return primitives; }
	public Map<String, Family> families() { return families; }
	public Family family(String name) { return families.get(name); }
	public Set<String> words() { return entries.keySet(); }

	// one "word => cat | cat" line per word. used for debugging
	public String toString() {
		StringBuilder sb = new StringBuilder();
		boolean first = true;
		for (Map.Entry<String, List<Category>> e : entries.entrySet()) {
			if (!first)
				sb.append("\n");
			first = false;
			sb.append(entryString(e.getKey(), e.getValue()));
		}
		return sb.toString();
	}

	/** the debug line for a single word; unknown words render with an empty right side */
	public String entryString(String word) {
		return entryString(word, categories(word));
	}
	private static String entryString(String word, List<Category> cats) {
		StringBuilder sb = new StringBuilder(word).append(" => ");
		for (int i = 0; i < cats.size(); i++) {
			if (i > 0)
				sb.append(" | ");
			sb.append(cats.get(i));
		}
		return sb.toString();
	}
}
