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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.ast.NodeType;

/**
 * Combines adjacent conditions on the same guard:
 *
 * <pre>
 * if_flag [F] { A }            if_flag [F] { A } else { B }
 * unless_flag [F] { B }   -&gt;
 * </pre>
 *
 * The pair is only combined when {@code A} cannot change the outcome of the
 * guard, and only for kinds whose negation is an exact complement. Adjacent
 * conditions with the same kind and guard are merged as well.
 */
public class AdjacentIfCombiner extends Processor {

	@Override
	protected List<Node> processAll(List<Node> nodes) {
		List<Node> processed = super.processAll(nodes);
		List<Node> result = new ArrayList<Node>(processed.size());
		for (Node node : processed) {
			Node previous = result.isEmpty() ? null : result.get(result.size() - 1);
			Node combined = previous == null ? null : combine(previous, node);
			if (combined != null) {
				result.set(result.size() - 1, combined);
			} else {
				result.add(node);
			}
		}
		return result;
	}

	private Node combine(Node first, Node second) {
		NodeType kind = first.getType();
		if (!kind.isGuarded()
				|| !second.getType().isGuarded()
				|| !first.getGuard().equals(second.getGuard())
				|| first.getElse() != null
				|| second.getElse() != null) {
			return null;
		}
		List<String> guard = first.getGuard();
		if (second.getType() == kind) {
			if (FlowAnalysis.canFalsify(kind, guard, first.getBody())) {
				return null;
			}
			List<Node> body = new ArrayList<Node>(first.getChildren());
			body.addAll(second.getChildren());
			return first.updated(processAll(body));
		}
		if (second.getType() != kind.negate()
				|| !FlowAnalysis.hasExactComplement(kind)
				|| FlowAnalysis.modifies(kind, guard, first.getBody())) {
			return null;
		}
		Node positive = kind.isNoneOf() ? second : first;
		Node negative = kind.isNoneOf() ? first : second;
		List<Node> children = new ArrayList<Node>(positive.getChildren());
		children.add(NodeFactory.elseNode(negative.getChildren()));
		return positive.updated(children);
	}
}
