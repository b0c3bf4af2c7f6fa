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
 * Replaces the pass/fail actions of a group by flag checks after the group,
 * for targets that have no notion of a group result.
 * <p>
 * Every test of the group sets {@code <group id>_FAILED} when it fails, and
 * the group is followed by
 *
 * <pre>
 * if_flag [g1_FAILED] { fail actions }
 * unless_flag [g1_FAILED] { pass actions }
 * </pre>
 *
 * A {@code continue} among the fail actions is given to every test of the
 * group instead.
 */
public class ApplyPostGroupActions extends Processor {

	@Override
	protected Node process(Node node) {
		Node processed = processChildren(node);
		if (node.getType() != NodeType.GROUP) {
			return processed;
		}
		Node onFail = processed.find(NodeType.ON_FAIL);
		Node onPass = processed.find(NodeType.ON_PASS);
		if (onFail == null && onPass == null) {
			return processed;
		}
		String id = FlowAnalysis.requireId(processed);
		String flag = id + Relationship.FAILED;
		boolean continueOnFail = onFail != null && onFail.find(NodeType.CONTINUE) != null;

		List<Node> header = new ArrayList<Node>();
		for (Node child : processed.getChildren()) {
			if (child.getType() == NodeType.NAME || child.getType() == NodeType.ID) {
				header.add(child);
			}
		}
		List<Node> members = new ArrayList<Node>();
		for (Node member : FlowAnalysis.groupBody(processed)) {
			members.add(flagFailures(member, flag, continueOnFail));
		}
		header.addAll(members);

		List<Node> nodes = new ArrayList<Node>();
		nodes.add(processed.updated(header));
		if (onFail != null) {
			List<Node> actions = new ArrayList<Node>();
			for (Node action : onFail.getChildren()) {
				if (action.getType() == NodeType.CONTINUE
						|| action.getType() == NodeType.SET_FLAG && flag.equals(action.getStringValue())) {
					continue;
				}
				actions.add(action);
			}
			nodes.add(NodeFactory.condition(NodeType.IF_FLAG, flag, actions));
		}
		if (onPass != null) {
			nodes.add(NodeFactory.condition(NodeType.UNLESS_FLAG, flag, onPass.getChildren()));
		}
		return NodeFactory.temp(nodes);
	}

	/**
	 * Makes every test below the given node set the group's flag on failure.
	 */
	private static Node flagFailures(Node node, String flag, boolean continueOnFail) {
		if (node.getType() == NodeType.TEST) {
			Node updated = FlowAnalysis.addAction(node, NodeType.ON_FAIL, NodeFactory.setFlag(flag, true));
			if (continueOnFail) {
				updated = FlowAnalysis.addAction(updated, NodeType.ON_FAIL, NodeFactory.continueNode());
			}
			return updated;
		}
		if (node.getChildren().isEmpty() || node.getType() == NodeType.ON_FAIL || node.getType() == NodeType.ON_PASS) {
			return node;
		}
		List<Node> children = new ArrayList<Node>(node.getChildren().size());
		for (Node child : node.getChildren()) {
			children.add(flagFailures(child, flag, continueOnFail));
		}
		return node.updated(children);
	}
}
