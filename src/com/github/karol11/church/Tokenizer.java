package com.github.karol11.church;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;

enum TokenType {
	// terminals
	ID("identifier"), LEFT("'('"), RIGHT("')'"), SLASH("'\\'"), DOT("'.'"), END("end of input"),
	// nonterminals, pushed back by reductions
	ATOM("atom"), EXPR("expression"), NAMES("names"), COMPLETE("complete expression");

	final String text;
	TokenType(String text) { this.text = text; }
}

class Token {
	final TokenType type;
	final Object value;
	final int pos;

	Token(TokenType type, Object value, int pos) {
		this.type = type;
		this.value = value;
		this.pos = pos;
	}

	public String toString() {
		return type == TokenType.ID ? "identifier '" + value + "'" : type.text;
	}
}

/**
 * Token source with a push-back buffer, so a reduction can hand its result
 * back as if it were the next input token.
 */
class TokenStream {
	private final Iterator<Token> tail;
	private final ArrayDeque<Token> head = new ArrayDeque<>();

	TokenStream(Iterable<Token> tokens) {
		tail = tokens.iterator();
	}

	Token next() {
		if (!head.isEmpty())
			return head.pop();
		if (!tail.hasNext())
			throw new ChurchError("Error: token stream ended without end of input");
		return tail.next();
	}
	void push(Token t) {
		head.push(t);
	}
	Token peek() {
		Token t = next();
		push(t);
		return t;
	}
}

/**
 * Lexer: a two-state machine, either inside an identifier or not.
 * Identifiers are runs of lowercase letters and underscores; {@code ( ) \ .} are
 * single-character tokens; spaces and newlines separate. The sequence ends with exactly one END token.
 */
class Tokenizer implements Iterable<Token> {
	final String source;

	public Tokenizer(String source) {
		this.source = MalformedExprError.check(source, "source");
	}

	static boolean isIdChar(char c) { return (c >= 'a' && c <= 'z') || c == '_'; }
	static boolean isSpace(char c) { return c == ' ' || c == '\n'; }

	static TokenType single(char c) {
		switch (c) {
		case '(': return TokenType.LEFT;
		case ')': return TokenType.RIGHT;
		case '\\': return TokenType.SLASH;
		case '.': return TokenType.DOT;
		default: return null;
		}
	}

	@Override
	public Iterator<Token> iterator() {
		return new Iterator<Token>() {
			int pos;
			boolean ended;

			public boolean hasNext() { return !ended; }

			public Token next() {
				if (ended)
					throw new NoSuchElementException();
				for (;;) {
					if (pos == source.length()) {
						ended = true;
						return new Token(TokenType.END, null, pos);
					}
					char c = source.charAt(pos);
					if (isIdChar(c)) {
						int start = pos;
						while (pos < source.length() && isIdChar(source.charAt(pos)))
							pos++;
						return new Token(TokenType.ID, source.substring(start, pos), start);
					}
					TokenType t = single(c);
					if (t != null)
						return new Token(t, null, pos++);
					if (!isSpace(c))
						throw new LexicalError(source.codePointAt(pos), pos);
					pos++;
				}
			}
		};
	}
}
