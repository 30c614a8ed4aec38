package edu.isi.ccglex;

/**
 * A category that takes an argument in the given direction and yields the
 * result, e.g. <code>S\NP</code>. Chains are left associative, so
 * <code>A/B/C</code> has result <code>A/B</code> and argument <code>C</code>.
 */
public class FunctionalCategory extends Category {
	private final Category result;
	private final Category argument;
	private final Direction direction;

	public FunctionalCategory(Category result, Category argument, Direction direction) {
		if (result == null || argument == null || direction == null)
			throw new NullPointerException("functional category needs result, argument and direction");
		this.result = result;
		this.argument = argument;
		this.direction = direction;
	}

	public Category result() { return result; }
	public Category argument() { return argument; }
	public Direction direction() { return direction; }

	public boolean isFunction() { return true; }

	public Category substitute(UnificationVariable from, Category to) {
		Category res = result.substitute(from, to);
		Category arg = argument.substitute(from, to);
		if (res == result && arg == argument)
			return this;
		return new FunctionalCategory(res, arg, direction);
	}

	String toTermString() {
		return "("+toString()+")";
	}
	public String toString() {
		return result.toTermString()+direction+argument.toTermString();
	}
	public boolean equals(Object o) {
		if (!(o instanceof FunctionalCategory))
			return false;
		FunctionalCategory f = (FunctionalCategory)o;
		return direction.equals(f.direction) && result.equals(f.result) && argument.equals(f.argument);
	}
	public int hashCode() {
		int h = result.hashCode();
		h = 31*h+argument.hashCode();
		return 31*h+direction.hashCode();
	}
}
