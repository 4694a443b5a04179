package com.github.karol11.church;

/**
 * Root of every failure raised while parsing, binding or rewriting lambda expressions.
 * All of them are deterministic: retrying the same call fails the same way.
 */
public class ChurchError extends RuntimeException {
	private static final long serialVersionUID = 1L;
	ChurchError(String s) { super(s); }
}
