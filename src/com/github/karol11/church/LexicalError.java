package com.github.karol11.church;

/**
 * A character outside the accepted alphabet.
 */
public class LexicalError extends ChurchError {
	private static final long serialVersionUID = 1L;
	public final int codePoint;
	public final int pos;

	LexicalError(int codePoint, int pos) {
		super("Error at " + pos + ": invalid character '" + new String(Character.toChars(codePoint)) + "'");
		this.codePoint = codePoint;
		this.pos = pos;
	}
}
