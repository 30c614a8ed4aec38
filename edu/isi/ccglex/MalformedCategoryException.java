package edu.isi.ccglex;
/** a category string that can't be tokenized: unbalanced brackets, a bad primitive, 
    or a missing application operator or argument */
public class MalformedCategoryException extends DataFormatException {
    public MalformedCategoryException(String message) { super(message); }
    public MalformedCategoryException(String message, Throwable cause) { super(message, cause); }
}
