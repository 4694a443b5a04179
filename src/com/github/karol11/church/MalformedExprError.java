package com.github.karol11.church;

/**
 * Internal consistency violation: a broken construction contract, not bad user input.
 */
public class MalformedExprError extends ChurchError {
	private static final long serialVersionUID = 1L;
	MalformedExprError(String s) { super("Malformed expression: " + s); }

	static <T> T check(T value, String what) {
		if (value == null)
			throw new MalformedExprError(what + " should not be null");
		return value;
	}
}
