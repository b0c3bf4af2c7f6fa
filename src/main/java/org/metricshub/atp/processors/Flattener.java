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
 * Turns a flow into a flat list of nodes, each wrapped in the full chain of
 * conditions that applied to it:
 *
 * <pre>
 * if_enabled [a] {               if_enabled [a] { if_job [p1] { test t1 } }
 *   if_job [p1] { test t1 }  -&gt;  if_enabled [a] { test t2 }
 *   test t2
 * }
 * </pre>
 *
 * Groups are unwrapped after their pass/fail actions have been applied with
 * {@link ApplyPostGroupActions}. The else branches must have been removed
 * beforehand.
 * <p>
 * A condition whose body can make its own guard false, e.g.
 * {@code if_enabled [v] { disable v; test t }}, is emitted whole under its
 * enclosing chain: splitting it would skip the nodes following that change.
 */
public class Flattener extends Processor {

	/**
	 * A condition to apply to the nodes below it.
	 */
	private static final class Wrapper {
		private final NodeType kind;
		private final List<String> guard;

		private Wrapper(NodeType kind, List<String> guard) {
			this.kind = kind;
			this.guard = guard;
		}
	}

	@Override
	public Node run(Node node) {
		Node flow = new ApplyPostGroupActions().run(node);
		List<Node> children = new ArrayList<Node>();
		List<Wrapper> chain = new ArrayList<Wrapper>();
		for (Node child : flow.getChildren()) {
			NodeType type = child.getType();
			if (type == NodeType.NAME || type == NodeType.VOLATILE) {
				children.add(child);
			} else {
				flatten(child, chain, children);
			}
		}
		return flow.updated(children);
	}

	private static void flatten(Node node, List<Wrapper> chain, List<Node> output) {
		NodeType type = node.getType();
		if (type == NodeType.GROUP) {
			for (Node member : FlowAnalysis.groupBody(node)) {
				flatten(member, chain, output);
			}
		} else if (type == NodeType.TEMP) {
			for (Node child : node.getChildren()) {
				flatten(child, chain, output);
			}
		} else if (type.isGuarded()) {
			if (node.getElse() != null) {
				throw new IllegalStateException("Else branches must be removed before a flow is flattened");
			}
			if (FlowAnalysis.canFalsify(type, node.getGuard(), node.getBody())) {
				output.add(wrap(node, chain));
				return;
			}
			List<Wrapper> inner = new ArrayList<Wrapper>(chain);
			inner.add(new Wrapper(type, node.getGuard()));
			for (Node child : node.getChildren()) {
				flatten(child, inner, output);
			}
		} else {
			output.add(wrap(node, chain));
		}
	}

	private static Node wrap(Node node, List<Wrapper> chain) {
		Node wrapped = node;
		for (int i = chain.size() - 1; i >= 0; i--) {
			Wrapper wrapper = chain.get(i);
			wrapped = NodeFactory.condition(wrapper.kind, wrapper.guard, wrapped);
		}
		return wrapped;
	}
}
