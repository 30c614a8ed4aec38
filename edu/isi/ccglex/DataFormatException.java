package edu.isi.ccglex;
/** for errors in the format of lexicon source text. Subclasses say which part of the text was at fault */

public class DataFormatException extends Exception {
    /**      Constructs a new exception with the specified detail message. */
    public DataFormatException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public DataFormatException(String message, Throwable cause) { super(message, cause); }
}
