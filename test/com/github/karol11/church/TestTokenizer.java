package com.github.karol11.church;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Test;

public class TestTokenizer extends Util {

	static List<TokenType> types(String source) {
		List<TokenType> r = new ArrayList<>();
		for (Token t: new Tokenizer(source))
			r.add(t.type);
		return r;
	}

	@Test
	public void lexesEveryTerminal() {
		assertThat(types("\\x.(f_ y)"), is(Arrays.asList(
			TokenType.SLASH, TokenType.ID, TokenType.DOT, TokenType.LEFT,
			TokenType.ID, TokenType.ID, TokenType.RIGHT, TokenType.END)));
	}

	@Test
	public void identifiersAreGreedy() {
		Iterator<Token> i = new Tokenizer("abc_d\nef").iterator();
		Token first = i.next();
		assertThat(first.value, is((Object) "abc_d"));
		assertThat(first.pos, is(0));
		Token second = i.next();
		assertThat(second.value, is((Object) "ef"));
		assertThat(second.pos, is(6));
		assertThat(i.next().type, is(TokenType.END));
	}

	@Test
	public void whitespaceOnlyYieldsEnd() {
		assertThat(types(" \n \n"), is(Arrays.asList(TokenType.END)));
		assertThat(types(""), is(Arrays.asList(TokenType.END)));
	}

	@Test
	public void endIsEmittedOnce() {
		Iterator<Token> i = new Tokenizer("x").iterator();
		i.next();
		assertThat(i.next().type, is(TokenType.END));
		assertFalse(i.hasNext());
		try {
			i.next();
			fail("token after end of input");
		} catch (NoSuchElementException expected) {
		}
	}

	@Test
	public void restartable() {
		Tokenizer t = new Tokenizer("f (g x)");
		List<String> first = new ArrayList<>();
		for (Token k: t)
			first.add(k.toString());
		List<String> second = new ArrayList<>();
		for (Token k: t)
			second.add(k.toString());
		assertThat(second, is(first));
	}

	@Test
	public void rejectsUnknownCharacter() {
		Iterator<Token> i = new Tokenizer("ab$").iterator();
		assertThat(i.next().value, is((Object) "ab"));
		LexicalError e = assertThrows(LexicalError.class, i::next);
		assertThat(e.codePoint, is((int) '$'));
		assertThat(e.pos, is(2));
		assertThat(e.getMessage(), is("Error at 2: invalid character '$'"));
	}

	@Test
	public void onlySpaceAndNewlineSeparate() {
		assertThat(assertThrows(LexicalError.class, () -> types("x\ty")).pos, is(1));
		assertThat(assertThrows(LexicalError.class, () -> types("x\r")).codePoint, is((int) '\r'));
	}

	@Test
	public void reportsWholeCodePoint() {
		String smiley = new String(Character.toChars(0x1F600));
		LexicalError e = assertThrows(LexicalError.class, () -> types("x " + smiley));
		assertThat(e.codePoint, is(0x1F600));
		assertThat(e.pos, is(2));
		assertThat(e.getMessage(), is("Error at 2: invalid character '" + smiley + "'"));
	}

	@Test
	public void rejectsUppercaseAndDigits() {
		assertThrows(LexicalError.class, () -> types("X"));
		assertThrows(LexicalError.class, () -> types("x1"));
	}
}
