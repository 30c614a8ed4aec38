package edu.isi.ccglex;

import java.util.Objects;

// immutable tuple, used to hand back a parsed piece together with the unparsed rest
public class Pair<A, B> {
	private final A _a;
	private final B _b;
	public A l() { return _a; }
	public B r() { return _b; }
	public Pair (A a, B b) {_a = a; _b = b; }
	public String toString() { return "<"+_a+", "+_b+">"; }
	public boolean equals(Object o) {
		if (!(o instanceof Pair))
			return false;
		Pair<?, ?> p = (Pair<?, ?>)o;
		return Objects.equals(_a, p._a) && Objects.equals(_b, p._b);
	}
	public int hashCode() {
		return Objects.hash(_a, _b);
	}
}
