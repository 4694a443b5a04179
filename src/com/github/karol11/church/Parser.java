package com.github.karol11.church;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Shift-reduce parser for lambda expressions, written as an explicit state machine.
 *
 * <pre>
 * names    -> ID | names ID
 * atom     -> ID | "(" complete ")" | "\" names "." complete
 * expr     -> atom | expr atom
 * complete -> expr
 * </pre>
 *
 * The goal is {@code complete END}. The {@code complete} rule forces an expression to reduce
 * fully before it is closed by ")" or wrapped as a lambda body, which keeps the state table small.
 * Application is left associative and lambda bodies extend as far right as possible.
 * A reduction pops its right-hand side and pushes the left-hand side back into the token stream.
 */
public class Parser {
	enum State {
		// Shift states. BEGIN, LEFT and DOT differ only in where a COMPLETE leads.
		BEGIN, LEFT, DOT, EXPR, BEGIN_COMPLETE, LEFT_COMPLETE, SLASH, SLASH_NAMES,
		// Reduce states, with the length of the rule's right-hand side.
		ID(1), NAMES(1), NAMES_ID(2), ATOM(1), EXPR_ATOM(2), LEFT_COMPLETE_RIGHT(3), LAMBDA(4), COMPLETE(1),
		ACCEPT;

		final int arity;
		State() { this(0); }
		State(int arity) { this.arity = arity; }
	}

	TokenStream tokens;
	ArrayDeque<Token> values = new ArrayDeque<>();
	ArrayDeque<State> states = new ArrayDeque<>();
	State state;
	Token token;

	public Ast parse(String source) {
		return parse(new Tokenizer(source));
	}

	Ast parse(Iterable<Token> source) {
		tokens = new TokenStream(source);
		values.clear();
		states.clear();
		state = State.BEGIN;
		for (;;) {
			switch (state) {
			case BEGIN:
			case LEFT:
			case DOT:
				token = tokens.next();
				switch (token.type) {
				case ID: shift(State.ID); break;
				case LEFT: shift(State.LEFT); break;
				case SLASH: shift(State.SLASH); break;
				case ATOM: shift(State.ATOM); break;
				case EXPR:
					TokenType follower = tokens.peek().type;
					shift(follower == TokenType.END || follower == TokenType.RIGHT ? State.COMPLETE : State.EXPR);
					break;
				case COMPLETE:
					shift(state == State.BEGIN ? State.BEGIN_COMPLETE :
						state == State.LEFT ? State.LEFT_COMPLETE :
						State.LAMBDA);
					break;
				default:
					throw unexpected();
				}
				break;
			case EXPR:
				token = tokens.next();
				switch (token.type) {
				case ID: shift(State.ID); break;
				case LEFT: shift(State.LEFT); break;
				case SLASH: shift(State.SLASH); break;
				case ATOM: shift(State.EXPR_ATOM); break;
				default: throw unexpected();
				}
				break;
			case BEGIN_COMPLETE:
				expect(TokenType.END, State.ACCEPT);
				break;
			case LEFT_COMPLETE:
				expect(TokenType.RIGHT, State.LEFT_COMPLETE_RIGHT);
				break;
			case SLASH:
				token = tokens.next();
				switch (token.type) {
				case ID: shift(State.NAMES); break;
				case NAMES: shift(State.SLASH_NAMES); break;
				default: throw unexpected();
				}
				break;
			case SLASH_NAMES:
				token = tokens.next();
				switch (token.type) {
				case ID: shift(State.NAMES_ID); break;
				case DOT: shift(State.DOT); break;
				default: throw unexpected();
				}
				break;

			case ID: { // atom -> ID
				Token[] rhs = reduce();
				produce(TokenType.ATOM, new Name((String) rhs[0].value), rhs);
				break;
			}
			case NAMES: { // names -> ID
				Token[] rhs = reduce();
				List<String> names = new ArrayList<>();
				names.add((String) rhs[0].value);
				produce(TokenType.NAMES, names, rhs);
				break;
			}
			case NAMES_ID: { // names -> names ID
				Token[] rhs = reduce();
				List<String> names = names(rhs[0]);
				names.add((String) rhs[1].value);
				produce(TokenType.NAMES, names, rhs);
				break;
			}
			case ATOM: { // expr -> atom
				Token[] rhs = reduce();
				produce(TokenType.EXPR, rhs[0].value, rhs);
				break;
			}
			case EXPR_ATOM: { // expr -> expr atom
				Token[] rhs = reduce();
				produce(TokenType.EXPR, new Apply((Ast) rhs[0].value, (Ast) rhs[1].value), rhs);
				break;
			}
			case LEFT_COMPLETE_RIGHT: { // atom -> "(" complete ")"
				Token[] rhs = reduce();
				produce(TokenType.ATOM, rhs[1].value, rhs);
				break;
			}
			case LAMBDA: { // atom -> "\" names "." complete
				Token[] rhs = reduce();
				List<String> names = names(rhs[1]);
				Ast body = (Ast) rhs[3].value;
				// rightmost name binds innermost
				for (int i = names.size(); --i >= 0;)
					body = new Function(names.get(i), body);
				produce(TokenType.ATOM, body, rhs);
				break;
			}
			case COMPLETE: { // complete -> expr
				Token[] rhs = reduce();
				produce(TokenType.COMPLETE, rhs[0].value, rhs);
				break;
			}

			case ACCEPT:
				values.pop();
				return (Ast) values.pop().value;
			}
		}
	}

	private void shift(State next) {
		states.push(state);
		values.push(token);
		state = next;
	}

	private void expect(TokenType type, State next) {
		token = tokens.next();
		if (token.type != type)
			throw unexpected();
		shift(next);
	}

	/**
	 * Pops the right-hand side of the current state's rule and returns to the state it started in.
	 */
	private Token[] reduce() {
		Token[] rhs = new Token[state.arity];
		for (int i = rhs.length; --i >= 0;) {
			rhs[i] = values.pop();
			state = states.pop();
		}
		return rhs;
	}

	private void produce(TokenType type, Object value, Token[] rhs) {
		tokens.push(new Token(type, value, rhs[0].pos));
	}

	@SuppressWarnings("unchecked")
	private static List<String> names(Token t) {
		return (List<String>) t.value;
	}

	private SyntaxError unexpected() {
		return new SyntaxError(token);
	}
}
