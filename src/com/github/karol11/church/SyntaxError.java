package com.github.karol11.church;

/**
 * No parser transition for the token at hand.
 */
public class SyntaxError extends ChurchError {
	private static final long serialVersionUID = 1L;
	/** The unexpected token as text, e.g. {@code ')'} or {@code end of input}. */
	public final String unexpected;
	public final int pos;
	final Token token;

	SyntaxError(Token token) {
		super("Error at " + token.pos + ": unexpected " + token);
		this.unexpected = token.toString();
		this.pos = token.pos;
		this.token = token;
	}
}
