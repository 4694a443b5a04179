package com.github.karol11.church;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Pre-order walk over a tree driven by an explicit to-do stack instead of call recursion,
 * so the depth of the tree is limited by heap only.
 *
 * Subclasses describe each node in {@link #expand} as an ordered list of pieces:
 * events to yield as they are and child nodes to expand in their place.
 */
abstract class Walk<N, E> implements Iterator<E> {
	private static final class Step<N, E> {
		final N node;
		final E event;
		Step(N node, E event) {
			this.node = node;
			this.event = event;
		}
	}

	private final ArrayDeque<Step<N, E>> toDo = new ArrayDeque<>();
	private final List<Step<N, E>> pieces = new ArrayList<>();
	private E next;

	Walk(N root) {
		toDo.push(new Step<N, E>(MalformedExprError.check(root, "root"), null));
	}

	abstract void expand(N node);

	final void emit(E event) {
		pieces.add(new Step<N, E>(null, event));
	}
	final void descend(N node) {
		pieces.add(new Step<N, E>(MalformedExprError.check(node, "child"), null));
	}

	@Override
	public boolean hasNext() {
		while (next == null && !toDo.isEmpty()) {
			Step<N, E> s = toDo.pop();
			if (s.event != null) {
				next = s.event;
				break;
			}
			expand(s.node);
			for (int i = pieces.size(); --i >= 0;)
				toDo.push(pieces.get(i));
			pieces.clear();
		}
		return next != null;
	}

	@Override
	public E next() {
		if (!hasNext())
			throw new NoSuchElementException();
		E r = next;
		next = null;
		return r;
	}
}
