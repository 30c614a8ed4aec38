package edu.isi.ccglex;

/**
 * A syntactic category: a primitive like <code>NP[sg]</code>, a function
 * like <code>S\NP</code>, or a unification variable standing in for a
 * primitive that isn't known yet. Categories are immutable; operations that
 * "change" a category build a new tree and share untouched subtrees.
 */
public abstract class Category {
	public boolean isPrimitive() { return false; }
	public boolean isFunction() { return false; }
	public boolean isVariable() { return false; }

	/**
	 * Copy of this category with every occurrence of <code>from</code>
	 * replaced by <code>to</code>. The receiver is left untouched, so a
	 * category stored in a family can be substituted into any number of times.
	 *
	 * @param from the variable to replace; if null nothing is replaced
	 * @param to   the replacement
	 */
	public abstract Category substitute(UnificationVariable from, Category to);

	// text of this category when it appears inside another one
	String toTermString() {
		return toString();
	}

	public abstract String toString();
	public abstract boolean equals(Object o);
	public abstract int hashCode();
}
