package edu.isi.ccglex;

/**
 * Slash of a functional category plus its restriction modifiers. A
 * <code>.</code> forbids composition and a <code>,</code> forbids crossing
 * at this application site.
 */
public class Direction {
	public enum Slash { 
		FORWARD('/'), BACKWARD('\\');
		private final char c;
		Slash(char c) { this.c = c; }
		public char getChar() { return c; }
		public static Slash get(char c) {
			for (Slash s : Slash.values())
				if (s.c == c)
					return s;
			throw new IllegalArgumentException("Not a slash: "+c);
		}
	}

	private final Slash slash;
	// kept as written: order and repeats matter for printing
	private final String restrictions;

	public Direction(Slash slash, String restrictions) {
		if (slash == null)
			throw new NullPointerException("direction needs a slash");
		if (restrictions == null)
			restrictions = "";
		if (restrictions.length() > 2 || !restrictions.matches("[.,]*"))
			throw new IllegalArgumentException("Bad restrictions '"+restrictions+"'; expected up to two of '.' and ','");
		this.slash = slash;
		this.restrictions = restrictions;
	}

	public Slash slash() { return slash; }
	public String restrictions() { return restrictions; }
	public boolean isForward() { return slash == Slash.FORWARD; }
	public boolean isBackward() { return slash == Slash.BACKWARD; }
	public boolean canCompose() { return restrictions.indexOf('.') < 0; }
	public boolean canCross() { return restrictions.indexOf(',') < 0; }

	public String toString() {
		return slash.getChar()+restrictions;
	}
	public boolean equals(Object o) {
		if (!(o instanceof Direction))
			return false;
		Direction d = (Direction)o;
		return slash == d.slash && restrictions.equals(d.restrictions);
	}
	public int hashCode() {
		return 31*slash.hashCode()+restrictions.hashCode();
	}
}
