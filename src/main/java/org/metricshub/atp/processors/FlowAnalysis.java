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
 * Questions the passes ask about a tree: can running these nodes change the
 * outcome of that condition, where does a group's body start ...
 */
final class FlowAnalysis {

	private FlowAnalysis() {
		// utility class
	}

	/**
	 * Returns {@code true} if executing the given nodes may change the outcome
	 * of a condition, in either direction.
	 *
	 * @param kind condition kind
	 * @param guard condition guard
	 * @param nodes the nodes that may execute
	 * @return whether the outcome may change
	 */
	static boolean modifies(NodeType kind, List<String> guard, List<Node> nodes) {
		for (Node node : nodes) {
			if (modifies(kind, guard, node)) {
				return true;
			}
		}
		return false;
	}

	private static boolean modifies(NodeType kind, List<String> guard, Node node) {
		NodeType type = node.getType();
		if (kind.isFlagCondition() && type == NodeType.SET_FLAG) {
			return guard.contains(node.getStringValue());
		}
		if (kind.isEnableCondition() && (type == NodeType.ENABLE || type == NodeType.DISABLE)) {
			return guard.contains(node.getStringValue());
		}
		if (kind.isRelationship() && isTestOrGroup(type) && guard.contains(node.getId())) {
			return true;
		}
		return modifies(kind, guard, node.getChildren());
	}

	/**
	 * Returns {@code true} if executing the given nodes may turn a condition
	 * that holds into one that does not. Flags are never cleared and jobs never
	 * change, so {@code if_flag} and the job conditions cannot be falsified.
	 *
	 * @param kind condition kind
	 * @param guard condition guard
	 * @param nodes the nodes that may execute
	 * @return whether the condition may stop holding
	 */
	static boolean canFalsify(NodeType kind, List<String> guard, List<Node> nodes) {
		switch (kind) {
		case IF_FLAG:
		case IF_JOB:
		case UNLESS_JOB:
		case IF_RAN:
			return false;
		case IF_ENABLED:
			return contains(nodes, NodeType.DISABLE, guard);
		case UNLESS_ENABLED:
			return contains(nodes, NodeType.ENABLE, guard);
		case UNLESS_FLAG:
			return contains(nodes, NodeType.SET_FLAG, guard);
		default:
			return modifies(kind, guard, nodes);
		}
	}

	private static boolean contains(List<Node> nodes, NodeType type, List<String> values) {
		for (Node node : nodes) {
			if (node.getType() == type && values.contains(node.getStringValue())) {
				return true;
			}
			if (contains(node.getChildren(), type, values)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Returns {@code true} when {@code negate(kind)} holds exactly when
	 * {@code kind} does not. Pass/fail conditions are excluded: both are false
	 * when the referenced test did not run.
	 *
	 * @param kind a guarded condition kind
	 * @return whether the negation is an exact complement
	 */
	static boolean hasExactComplement(NodeType kind) {
		return !kind.isRelationship() || kind == NodeType.IF_RAN || kind == NodeType.UNLESS_RAN;
	}

	static boolean isTestOrGroup(NodeType type) {
		return type == NodeType.TEST || type == NodeType.SUB_TEST || type == NodeType.GROUP;
	}

	/**
	 * @param type a child type of a test or group
	 * @return {@code true} for the children that describe a group rather than
	 *         being executed as part of it
	 */
	static boolean isGroupHeader(NodeType type) {
		return type == NodeType.NAME || type == NodeType.ID || type == NodeType.ON_FAIL || type == NodeType.ON_PASS;
	}

	/**
	 * @param group a group node
	 * @return the members of the group
	 */
	static List<Node> groupBody(Node group) {
		List<Node> body = new ArrayList<Node>();
		for (Node child : group.getChildren()) {
			if (!isGroupHeader(child.getType())) {
				body.add(child);
			}
		}
		return body;
	}

	/**
	 * Replaces the members of a group, keeping its header.
	 *
	 * @param group a group node
	 * @param body the new members
	 * @return the updated group
	 */
	static Node withGroupBody(Node group, List<Node> body) {
		List<Node> children = new ArrayList<Node>();
		for (Node child : group.getChildren()) {
			if (isGroupHeader(child.getType())) {
				children.add(child);
			}
		}
		children.addAll(body);
		return group.updated(children);
	}

	/**
	 * Adds an action to the {@code on_fail} or {@code on_pass} child of a test
	 * or group, creating it if needed. An action equal to one already present
	 * is not added again.
	 *
	 * @param owner a test or group
	 * @param branch {@link NodeType#ON_FAIL} or {@link NodeType#ON_PASS}
	 * @param action the action to add
	 * @return the updated owner
	 */
	static Node addAction(Node owner, NodeType branch, Node action) {
		Node actions = owner.find(branch);
		if (actions != null) {
			if (actions.getChildren().contains(action)) {
				return owner;
			}
			return owner.replaceChild(actions, actions.addChildren(action));
		}
		Node created = branch == NodeType.ON_FAIL ? NodeFactory.onFail(action) : NodeFactory.onPass(action);
		List<Node> children = new ArrayList<Node>(owner.getChildren());
		children.add(insertionPoint(owner, branch), created);
		return owner.updated(children);
	}

	/**
	 * Finds where a new {@code on_fail} or {@code on_pass} child goes: an
	 * {@code on_fail} before any {@code on_pass}, both after the header of a
	 * group and at the end of a test.
	 */
	private static int insertionPoint(Node owner, NodeType branch) {
		List<Node> children = owner.getChildren();
		int index = 0;
		for (int i = 0; i < children.size(); i++) {
			NodeType type = children.get(i).getType();
			if (branch == NodeType.ON_FAIL && type == NodeType.ON_PASS) {
				return i;
			}
			if (owner.getType() != NodeType.GROUP || isGroupHeader(type)) {
				index = i + 1;
			} else {
				break;
			}
		}
		return index;
	}

	/**
	 * @param actions an {@code on_fail} or {@code on_pass} node, may be {@code null}
	 * @return the names of the flags it sets
	 */
	static List<String> flagsSet(Node actions) {
		List<String> flags = new ArrayList<String>();
		if (actions != null) {
			for (Node action : actions.findAll(NodeType.SET_FLAG)) {
				flags.add(action.getStringValue());
			}
		}
		return flags;
	}

	/**
	 * @param node a set_flag node
	 * @return {@code true} if the flag was synthesized by a pass
	 */
	static boolean isAutoGenerated(Node node) {
		return node.getType() == NodeType.SET_FLAG && node.getValues().contains(NodeFactory.AUTO_GENERATED);
	}

	/**
	 * @param node a test or group
	 * @return its ID
	 * @throws IllegalStateException if it has none
	 */
	static String requireId(Node node) {
		String id = node.getId();
		if (id == null) {
			throw new IllegalStateException("A " + node.getType().getName() + " node has no ID, AddIds must run first");
		}
		return id;
	}
}
