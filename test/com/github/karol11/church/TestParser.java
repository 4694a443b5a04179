package com.github.karol11.church;

import static com.github.karol11.church.Ast.apply;
import static com.github.karol11.church.Ast.function;
import static com.github.karol11.church.Ast.name;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class TestParser extends Util {

	@Test
	public void singleName() {
		assertThat(parse("x"), is(name("x")));
		assertThat(parse(" \n x \n"), is(name("x")));
	}

	@Test
	public void applicationIsLeftAssociative() {
		assertThat(parse("f a b"), is(apply(apply(name("f"), name("a")), name("b"))));
		assertThat(parse("f (g a) b"), is(apply(apply(name("f"), apply(name("g"), name("a"))), name("b"))));
	}

	@Test
	public void lambdaBodyExtendsRight() {
		assertThat(parse("\\x. a b"), is(function("x", apply(name("a"), name("b")))));
		assertThat(parse("f \\x. x y"), is(apply(name("f"), function("x", apply(name("x"), name("y"))))));
		assertThat(parse("\\x.\\y.x"), is(function("x", function("y", name("x")))));
	}

	@Test
	public void parenthesesBoundLambdaBody() {
		assertThat(parse("(\\x.x) y"), is(apply(function("x", name("x")), name("y"))));
		assertThat(parse("f (\\x.x) y"), is(apply(apply(name("f"), function("x", name("x"))), name("y"))));
	}

	@Test
	public void parenthesesOnlyGroup() {
		assertThat(parse("(x)"), is(name("x")));
		assertThat(parse("((f))(a)"), is(apply(name("f"), name("a"))));
		assertThat(parse("(\\x.(x))"), is(function("x", name("x"))));
	}

	@Test
	public void multiNameLambdaNestsRightmostInnermost() {
		assertThat(parse("\\x y z. x"), is(function("x", function("y", function("z", name("x"))))));
	}

	@Test
	public void rejectsEmptyInput() {
		SyntaxError e = assertThrows(SyntaxError.class, () -> parse(""));
		assertThat(e.token.type, is(TokenType.END));
	}

	@Test
	public void rejectsUnclosedParenthesis() {
		SyntaxError e = assertThrows(SyntaxError.class, () -> parse("(x"));
		assertThat(e.token.type, is(TokenType.END));
		assertThat(e.getMessage(), is("Error at 2: unexpected end of input"));
	}

	@Test
	public void rejectsUnbalancedClose() {
		SyntaxError e = assertThrows(SyntaxError.class, () -> parse("x)"));
		assertThat(e.token.type, is(TokenType.RIGHT));
		assertThat(assertThrows(SyntaxError.class, () -> parse("()")).token.type, is(TokenType.RIGHT));
	}

	@Test
	public void rejectsDanglingLambda() {
		assertThat(assertThrows(SyntaxError.class, () -> parse("\\x.")).token.type, is(TokenType.END));
		assertThat(assertThrows(SyntaxError.class, () -> parse("\\x")).token.type, is(TokenType.END));
		assertThat(assertThrows(SyntaxError.class, () -> parse("\\.x")).token.type, is(TokenType.DOT));
		assertThat(assertThrows(SyntaxError.class, () -> parse("\\")).token.type, is(TokenType.END));
	}

	@Test
	public void rejectsStrayDot() {
		SyntaxError e = assertThrows(SyntaxError.class, () -> parse("x . y"));
		assertThat(e.token.type, is(TokenType.DOT));
		assertThat(e.token.pos, is(2));
		assertThat(e.pos, is(2));
		assertThat(e.unexpected, is("'.'"));
	}

	@Test
	public void lexicalErrorsPropagate() {
		assertThrows(LexicalError.class, () -> parse("$"));
		assertThrows(LexicalError.class, () -> parse("\\x. x # y"));
		assertThrows(LexicalError.class, () -> parse("\\x.\tx"));
		assertThrows(LexicalError.class, () -> parse("x\r"));
	}

	@Test
	public void parserIsReusable() {
		Parser p = new Parser();
		assertThrows(SyntaxError.class, () -> p.parse("(x"));
		assertThat(p.parse("a b"), is(apply(name("a"), name("b"))));
	}

	@Test
	public void deepNestingDoesNotUseCallStack() {
		int depth = 100000;
		StringBuilder src = new StringBuilder();
		for (int i = 0; i < depth; i++)
			src.append("\\a.(");
		src.append('a');
		for (int i = 0; i < depth; i++)
			src.append(')');
		Ast expected = name("a");
		for (int i = 0; i < depth; i++)
			expected = function("a", expected);
		assertThat(parse(src.toString()), is(expected));
	}
}
