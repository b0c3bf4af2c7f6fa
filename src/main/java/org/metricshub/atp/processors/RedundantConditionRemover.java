package org.metricshub.atp.processors;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * ATP
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.ast.NodeType;

/**
 * Removes the conditions that always hold because an enclosing condition of
 * the same kind already implies them, e.g.
 *
 * <pre>
 * if_flag [A] {                  if_flag [A] {
 *   if_flag [A, B] { X }   -&gt;      X
 * }                              }
 * </pre>
 *
 * An "any of" guard is implied by an enclosing guard that is a subset of it;
 * a "none of" or "all of" guard by an enclosing guard that is a superset of
 * it. The enclosing body must not be able to falsify the nested guard.
 */
public class RedundantConditionRemover extends Processor {

	private final Deque<Node> enclosing = new ArrayDeque<Node>();

	@Override
	public Node run(Node node) {
		enclosing.clear();
		return process(node);
	}

	@Override
	protected Node process(Node node) {
		NodeType type = node.getType();
		if (!type.isGuarded()) {
			return processChildren(node);
		}
		for (Node outer : enclosing) {
			if (implies(outer, node)) {
				// the else branch can never run
				return NodeFactory.temp(processAll(node.getBody()));
			}
		}
		enclosing.push(node);
		List<Node> children = processAll(node.getBody());
		enclosing.pop();
		Node otherwise = node.getElse();
		if (otherwise != null) {
			children = new ArrayList<Node>(children);
			children.add(processChildren(otherwise));
		}
		return node.updated(children);
	}

	private static boolean implies(Node outer, Node inner) {
		NodeType kind = inner.getType();
		if (outer.getType() != kind) {
			return false;
		}
		List<String> outerGuard = outer.getGuard();
		List<String> innerGuard = inner.getGuard();
		boolean covered;
		if (kind.isNoneOf() || kind.isAllOf()) {
			covered = outerGuard.containsAll(innerGuard);
		} else {
			covered = innerGuard.containsAll(outerGuard);
		}
		return covered && !FlowAnalysis.canFalsify(kind, innerGuard, outer.getBody());
	}
}
