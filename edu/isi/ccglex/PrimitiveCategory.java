package edu.isi.ccglex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** an atomic category with its subscripts, in the order written, e.g. <code>N[sg]</code> */
public class PrimitiveCategory extends Category {
	private final String name;
	private final List<String> subscripts;

	public PrimitiveCategory(String name) {
		this(name, Collections.<String>emptyList());
	}
	public PrimitiveCategory(String name, List<String> subscripts) {
		if (name == null)
			throw new NullPointerException("primitive category needs a name");
		this.name = name;
		this.subscripts = Collections.unmodifiableList(new ArrayList<String>(subscripts));
	}

	public String name() { return name; }
	public List<String> subscripts() { return subscripts; }

	public boolean isPrimitive() { return true; }

	// nothing below a primitive to replace
	public Category substitute(UnificationVariable from, Category to) {
		return this;
	}

	public String toString() {
		if (subscripts.isEmpty())
			return name;
		return name+"["+String.join(",", subscripts)+"]";
	}
	public boolean equals(Object o) {
		if (!(o instanceof PrimitiveCategory))
			return false;
		PrimitiveCategory p = (PrimitiveCategory)o;
		return name.equals(p.name) && subscripts.equals(p.subscripts);
	}
	public int hashCode() {
		return 31*name.hashCode()+subscripts.hashCode();
	}
}
