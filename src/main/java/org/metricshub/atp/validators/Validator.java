package org.metricshub.atp.validators;

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
import java.util.Deque;
import java.util.Iterator;
import org.metricshub.atp.Flow;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;

/**
 * Base class of the checks run on a flow tree before it is processed.
 * <p>
 * A validator walks the tree depth first, calling {@link #enter(Node)} before
 * the children of a node are visited and {@link #leave(Node)} after. It keeps
 * track of the path to the current node so that errors can tell where they
 * were found. Validators never modify the tree; they throw a
 * {@link ValidationException} on the first error.
 */
public abstract class Validator {

	private final Flow flow;
	private final Deque<String> path = new ArrayDeque<String>();

	/**
	 * @param flow the flow being validated, named in the error messages
	 */
	protected Validator(Flow flow) {
		this.flow = flow;
	}

	/**
	 * Validates the given tree.
	 *
	 * @param ast the tree to check
	 * @throws ValidationException on the first error found
	 */
	public void run(Node ast) {
		path.clear();
		visit(ast);
	}

	private void visit(Node node) {
		String segment = segment(node);
		if (segment != null) {
			path.addLast(segment);
		}
		enter(node);
		for (Node child : node.getChildren()) {
			visit(child);
		}
		leave(node);
		if (segment != null) {
			path.removeLast();
		}
	}

	/**
	 * Called before the children of a node are visited.
	 *
	 * @param node the current node
	 */
	protected abstract void enter(Node node);

	/**
	 * Called after the children of a node have been visited.
	 *
	 * @param node the current node
	 */
	protected void leave(Node node) {
		// nothing by default
	}

	protected String getFlowName() {
		return flow.getName();
	}

	/**
	 * @return the path of the current node, e.g. {@code flow/group[RAM]/test[t2]}
	 */
	protected String getPath() {
		StringBuilder sb = new StringBuilder();
		Iterator<String> it = path.iterator();
		while (it.hasNext()) {
			sb.append(it.next());
			if (it.hasNext()) {
				sb.append('/');
			}
		}
		return sb.toString();
	}

	private static String segment(Node node) {
		NodeType type = node.getType();
		switch (type) {
		case TEST:
		case SUB_TEST:
			return type.getName() + '[' + label(node) + ']';
		case GROUP:
			Node name = node.find(NodeType.NAME);
			return name == null ? type.getName() : type.getName() + '[' + name.getStringValue() + ']';
		default:
			if (type.isGuarded()) {
				return type.getName() + '[' + String.join(",", node.getGuard()) + ']';
			}
			// leaves are not part of the path
			return node.getChildren().isEmpty() ? null : type.getName();
		}
	}

	private static String label(Node test) {
		String id = test.getId();
		if (id != null) {
			return id;
		}
		for (NodeType type : new NodeType[] { NodeType.NAME, NodeType.OBJECT }) {
			Node child = test.find(type);
			if (child != null) {
				return child.getStringValue();
			}
		}
		return "?";
	}
}
