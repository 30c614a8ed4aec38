package edu.isi.ccglex;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Placeholder for a primitive that is filled in later. Two variables are
 * only equal if they are the same object; the id is just for printing.
 */
public class UnificationVariable extends Category {
	private static final AtomicInteger nextId = new AtomicInteger();

	private final int id;

	public UnificationVariable() {
		id = nextId.getAndIncrement();
	}

	public int id() { return id; }

	public boolean isVariable() { return true; }

	public Category substitute(UnificationVariable from, Category to) {
		return this == from ? to : this;
	}

	public String toString() {
		return "_var"+id;
	}
	public boolean equals(Object o) {
		return this == o;
	}
	public int hashCode() {
		return System.identityHashCode(this);
	}
}
