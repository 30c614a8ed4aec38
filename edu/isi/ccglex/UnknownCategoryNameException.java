package edu.isi.ccglex;
/** a name used in a category that is neither a declared primitive nor a defined family */
public class UnknownCategoryNameException extends DataFormatException {
    private final String name;
    public UnknownCategoryNameException(String name) {
	super("String '"+name+"' is neither a family nor primitive category");
	this.name = name;
    }
    public UnknownCategoryNameException(String message, UnknownCategoryNameException cause) {
	super(message, cause);
	this.name = cause.getName();
    }
    /** the offending name */
    public String getName() { return name; }
}
