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
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.ast.NodeType;

/**
 * Normalizes and simplifies the condition nodes of a tree:
 * <ul>
 * <li>duplicate guard values are dropped;</li>
 * <li>a condition nested in an identical condition is replaced by its body,
 * unless the enclosing body may falsify the guard;</li>
 * <li>adjacent conditions with the same kind and guard are merged, unless the
 * first body may falsify the guard;</li>
 * <li>adjacent groups with the same name are merged when neither has pass or
 * fail actions and the second group's ID is not referenced.</li>
 * </ul>
 */
public class Condition extends Processor {

	private final Set<String> referencedIds = new HashSet<String>();

	@Override
	public Node run(Node node) {
		referencedIds.clear();
		collectReferences(node);
		return process(node);
	}

	private void collectReferences(Node node) {
		if (node.getType().isRelationship()) {
			referencedIds.addAll(node.getGuard());
		}
		for (Node child : node.getChildren()) {
			collectReferences(child);
		}
	}

	@Override
	protected Node process(Node node) {
		NodeType type = node.getType();
		if (!type.isGuarded()) {
			return processChildren(node);
		}
		List<String> guard = new ArrayList<String>(new LinkedHashSet<String>(node.getGuard()));
		List<Node> children = processAll(node.getChildren());
		Node condition = NodeFactory.condition(type, guard, children);
		if (!FlowAnalysis.canFalsify(type, guard, condition.getBody())) {
			List<Node> body = removeNested(type, condition.getGuard(), condition.getBody());
			if (condition.getElse() != null) {
				body.add(condition.getElse());
			}
			condition = condition.updated(body);
		}
		return condition;
	}

	/**
	 * Replaces the conditions identical to the enclosing one by their body.
	 * Their else branch can never run and is dropped.
	 */
	private static List<Node> removeNested(NodeType kind, List<String> guard, List<Node> nodes) {
		List<Node> result = new ArrayList<Node>(nodes.size());
		for (Node node : nodes) {
			if (node.getType() == kind && node.getGuard().equals(guard)) {
				result.addAll(removeNested(kind, guard, node.getBody()));
			} else if (node.getChildren().isEmpty()) {
				result.add(node);
			} else {
				result.add(node.updated(removeNested(kind, guard, node.getChildren())));
			}
		}
		return result;
	}

	@Override
	protected List<Node> processAll(List<Node> nodes) {
		return merge(super.processAll(nodes));
	}

	private List<Node> merge(List<Node> nodes) {
		List<Node> result = new ArrayList<Node>(nodes.size());
		for (Node node : nodes) {
			Node previous = result.isEmpty() ? null : result.get(result.size() - 1);
			Node merged = previous == null ? null : merge(previous, node);
			if (merged != null) {
				result.set(result.size() - 1, merged);
			} else {
				result.add(node);
			}
		}
		return result;
	}

	/**
	 * @return the merged node, or {@code null} if the nodes cannot be merged
	 */
	private Node merge(Node first, Node second) {
		NodeType type = first.getType();
		if (type != second.getType()) {
			return null;
		}
		if (type.isGuarded()) {
			if (!first.getGuard().equals(second.getGuard())
					|| first.getElse() != null
					|| second.getElse() != null
					|| FlowAnalysis.canFalsify(type, first.getGuard(), first.getBody())) {
				return null;
			}
			List<Node> body = new ArrayList<Node>(first.getChildren());
			body.addAll(second.getChildren());
			// the bodies may now hold mergeable neighbours
			return process(first.updated(body));
		}
		if (type == NodeType.GROUP && canMergeGroups(first, second)) {
			List<Node> body = FlowAnalysis.groupBody(first);
			body.addAll(FlowAnalysis.groupBody(second));
			return FlowAnalysis.withGroupBody(first, merge(body));
		}
		return null;
	}

	private boolean canMergeGroups(Node first, Node second) {
		if (!first.find(NodeType.NAME).equals(second.find(NodeType.NAME))) {
			return false;
		}
		for (Node group : new Node[] { first, second }) {
			if (group.find(NodeType.ON_FAIL) != null || group.find(NodeType.ON_PASS) != null) {
				return false;
			}
		}
		// a referenced ID would end up naming the members of both groups
		return !isReferenced(first) && !isReferenced(second);
	}

	private boolean isReferenced(Node group) {
		String id = group.getId();
		return id != null && referencedIds.contains(id);
	}
}
