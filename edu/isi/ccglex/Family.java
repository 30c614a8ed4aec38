package edu.isi.ccglex;

/** a named category template, e.g. <code>Det :: NP/N</code>, with the variable live when it was defined (may be null) */
public class Family {
	private final String name;
	private final Category category;
	private final UnificationVariable variable;

	public Family(String name, Category category, UnificationVariable variable) {
		this.name = name;
		this.category = category;
		this.variable = variable;
	}
	public String name() { return name; }
	public Category category() { return category; }
	public UnificationVariable variable() { return variable; }

	public String toString() {
		return name+" :: "+category;
	}
}
