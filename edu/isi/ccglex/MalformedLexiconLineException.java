package edu.isi.ccglex;
/** a lexicon line that is neither a primitive declaration nor an ident/separator/category line */
public class MalformedLexiconLineException extends DataFormatException {
    private final int lineNumber;
    public MalformedLexiconLineException(int lineNumber, String line) {
	super("line "+lineNumber+": incorrect entry format: "+line);
	this.lineNumber = lineNumber;
    }
    public int getLineNumber() { return lineNumber; }
}
