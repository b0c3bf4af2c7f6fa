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
import java.util.Collections;
import java.util.List;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.ast.NodeType;

/**
 * Moves the content of the {@code on_fail} and {@code on_pass} branches of
 * tests and groups out to following {@code if_failed} and {@code if_passed}
 * nodes, for targets that can only bin, set a flag or continue in those
 * branches.
 * <p>
 * A branch holding nothing but {@code set_result}, {@code set_flag} and
 * {@code continue} actions is left in place. Otherwise its actions move, in
 * order, and only a {@code continue} stays behind.
 */
public class OnPassFailRemover extends Processor {

	@Override
	protected Node process(Node node) {
		Node processed = processChildren(node);
		if (!FlowAnalysis.isTestOrGroup(node.getType()) || node.getType() == NodeType.SUB_TEST) {
			return processed;
		}
		Node onFail = processed.find(NodeType.ON_FAIL);
		Node onPass = processed.find(NodeType.ON_PASS);
		boolean moveFail = needsMove(onFail);
		boolean movePass = needsMove(onPass);
		if (!moveFail && !movePass) {
			return processed;
		}
		String id = FlowAnalysis.requireId(processed);
		List<Node> nodes = new ArrayList<Node>();
		Node updated = processed;
		Node ifFailed = null;
		Node ifPassed = null;
		if (moveFail) {
			updated = strip(updated, onFail);
			ifFailed = NodeFactory.condition(NodeType.IF_FAILED, id, moved(onFail));
		}
		if (movePass) {
			updated = strip(updated, updated.find(NodeType.ON_PASS));
			ifPassed = NodeFactory.condition(NodeType.IF_PASSED, id, moved(onPass));
		}
		nodes.add(updated);
		if (ifFailed != null) {
			nodes.add(ifFailed);
		}
		if (ifPassed != null) {
			nodes.add(ifPassed);
		}
		return NodeFactory.temp(nodes);
	}

	private static boolean needsMove(Node actions) {
		if (actions == null) {
			return false;
		}
		for (Node action : actions.getChildren()) {
			NodeType type = action.getType();
			if (type != NodeType.SET_RESULT && type != NodeType.SET_FLAG && type != NodeType.CONTINUE) {
				return true;
			}
		}
		return false;
	}

	private static List<Node> moved(Node actions) {
		List<Node> moved = new ArrayList<Node>();
		for (Node action : actions.getChildren()) {
			if (action.getType() != NodeType.CONTINUE) {
				moved.add(action);
			}
		}
		return moved;
	}

	/**
	 * Empties a branch, keeping its {@code continue} if it has one.
	 */
	private static Node strip(Node owner, Node actions) {
		if (actions.find(NodeType.CONTINUE) != null) {
			return owner.replaceChild(actions, actions.updated(Collections.singletonList(NodeFactory.continueNode())));
		}
		List<Node> children = new ArrayList<Node>(owner.getChildren());
		children.remove(actions);
		return owner.updated(children);
	}
}
