package edu.isi.ccglex;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

// lexicons bundled with the library, read from the classpath
public class SampleLexicons {
	public static final String TINYTINY = "openccg_tinytiny.ccg";

	/** small lexicon after the openccg "tinytiny" grammar: determiners, pronouns, nouns and verbs in sg/pl */
	public static Lexicon openccgTinyTiny() throws IOException, DataFormatException {
		return LexiconBuilder.fromReader(open(TINYTINY));
	}

	static BufferedReader open(String name) throws IOException {
		InputStream in = SampleLexicons.class.getResourceAsStream(name);
		if (in == null)
			throw new IOException("Missing bundled lexicon "+name);
		return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
	}
}
