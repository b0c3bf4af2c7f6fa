package org.metricshub.atp.frontend;

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
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.metricshub.atp.FlowDefinitionException;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.ast.NodeType;

/**
 * Turns nested, block style construction calls into a properly nested tree.
 * <p>
 * The assembler owns a last-in-first-out list of open frames. The bottom frame
 * is the {@code flow} node; opening a block (group, condition, on_fail ...)
 * pushes a frame, closing it pops the frame and hands the populated node back
 * to the caller, which then appends it to the frame below.
 * <p>
 * Frames are immutable nodes: appending to a frame replaces it with an updated
 * copy.
 */
public class FlowAssembler {

	private final List<Node> pipeline = new ArrayList<Node>();

	/**
	 * The node that received the previous statement, or the innermost condition
	 * wrapped around it. Compared by identity.
	 */
	private Node lastAppend;

	/**
	 * @param root the bottom frame, normally a {@code flow} node
	 */
	public FlowAssembler(Node root) {
		pipeline.add(root);
	}

	/**
	 * @return the number of currently open frames, including the root
	 */
	public int getDepth() {
		return pipeline.size();
	}

	/**
	 * @return the frame that receives the next appended node
	 */
	public Node getTop() {
		return pipeline.get(pipeline.size() - 1);
	}

	/**
	 * Replaces the bottom frame, e.g. to register volatile flags on the flow.
	 *
	 * @param root the new root frame
	 */
	public void replaceRoot(Node root) {
		Node old = pipeline.get(0);
		pipeline.set(0, root);
		if (lastAppend == old) {
			lastAppend = root;
		}
	}

	/**
	 * @return the root frame
	 */
	public Node getRoot() {
		return pipeline.get(0);
	}

	/**
	 * Appends a node to the top frame.
	 *
	 * @param node node to append
	 * @return the updated top frame
	 */
	public Node append(Node node) {
		Node top = pipeline.remove(pipeline.size() - 1);
		Node updated = top.addChildren(node);
		pipeline.add(updated);
		if (!node.getType().isCondition() || lastAppend == top) {
			lastAppend = updated;
		}
		return updated;
	}

	/**
	 * Opens {@code node} as a new frame, runs the block (which appends into
	 * it) and returns the populated frame. The frame is not appended anywhere.
	 *
	 * @param node the frame to open
	 * @param block construction calls to run inside the frame
	 * @return the populated node
	 */
	public Node appendTo(Node node, Runnable block) {
		pipeline.add(node);
		block.run();
		return pipeline.remove(pipeline.size() - 1);
	}

	/**
	 * Builds a node and appends it, wrapped in the given conditions.
	 * <p>
	 * The first condition is the outermost wrapper. When {@code currentContext}
	 * is set, the conditions are ignored and the node is appended next to the
	 * previous statement instead, so that it picks up exactly the same
	 * condition context.
	 *
	 * @param conditions canonical condition kinds with their guards
	 * @param currentContext {@code true} to reuse the previous statement's context
	 * @param body builds the node to append
	 * @return the node built by {@code body}, or its outermost condition wrapper
	 */
	public Node applyConditions(List<Map.Entry<NodeType, Object>> conditions, boolean currentContext, Supplier<Node> body) {
		if (currentContext) {
			Node node = body.get();
			appendToCurrentContext(node);
			return node;
		}
		Node node = body.get();
		boolean updateLastAppend = !node.getType().isCondition();
		for (int i = conditions.size() - 1; i >= 0; i--) {
			Map.Entry<NodeType, Object> condition = conditions.get(i);
			node = wrap(condition.getKey(), condition.getValue(), node);
			if (updateLastAppend) {
				lastAppend = node;
				updateLastAppend = false;
			}
		}
		append(node);
		return node;
	}

	/**
	 * Wraps a node in one condition.
	 *
	 * @param kind canonical condition kind
	 * @param guard guard value
	 * @param node node to wrap
	 * @return the condition node
	 */
	public static Node wrap(NodeType kind, Object guard, Node node) {
		if (kind == NodeType.GROUP) {
			return NodeFactory.group(guard, node);
		}
		checkSingleId(kind, guard);
		return NodeFactory.condition(kind, guard, node);
	}

	/**
	 * Rejects a list of IDs for the conditions that only accept one.
	 *
	 * @param kind canonical condition kind
	 * @param guard guard value as given by the caller
	 * @throws FlowDefinitionException if several IDs were given where one is expected
	 */
	public static void checkSingleId(NodeType kind, Object guard) {
		if (guard instanceof Collection || guard instanceof Object[]) {
			if (kind == NodeType.IF_PASSED) {
				throw new FlowDefinitionException(
						"if_passed only accepts one ID, use if_any_passed or if_all_passed for multiple IDs");
			}
			if (kind == NodeType.IF_FAILED) {
				throw new FlowDefinitionException(
						"if_failed only accepts one ID, use if_any_failed or if_all_failed for multiple IDs");
			}
		}
	}

	private void appendToCurrentContext(Node node) {
		if (lastAppend == null) {
			throw new FlowDefinitionException("There is no previous statement whose context could be reused");
		}
		for (int i = pipeline.size() - 1; i >= 0; i--) {
			Node frame = pipeline.get(i);
			List<Integer> path = new ArrayList<Integer>();
			if (locate(frame, lastAppend, path)) {
				Node[] anchor = new Node[1];
				pipeline.set(i, appendAt(frame, path, 0, node, anchor));
				lastAppend = anchor[0];
				return;
			}
		}
		throw new FlowDefinitionException("The context of the previous statement is no longer open");
	}

	private static boolean locate(Node current, Node target, List<Integer> path) {
		if (current == target) {
			return true;
		}
		List<Node> children = current.getChildren();
		for (int i = 0; i < children.size(); i++) {
			path.add(i);
			if (locate(children.get(i), target, path)) {
				return true;
			}
			path.remove(path.size() - 1);
		}
		return false;
	}

	private static Node appendAt(Node current, List<Integer> path, int depth, Node node, Node[] anchor) {
		if (depth == path.size()) {
			anchor[0] = current.addChildren(node);
			return anchor[0];
		}
		Node child = current.getChildren().get(path.get(depth));
		return current.replaceChild(child, appendAt(child, path, depth + 1, node, anchor));
	}

	/**
	 * Folds the open frames into one tree. The frames stay open.
	 *
	 * @return the root node with every open frame nested in its parent
	 */
	public Node raw() {
		Node n = null;
		for (int i = pipeline.size() - 1; i >= 0; i--) {
			Node node = pipeline.get(i);
			n = n == null ? node : node.addChildren(n);
		}
		return n;
	}
}
