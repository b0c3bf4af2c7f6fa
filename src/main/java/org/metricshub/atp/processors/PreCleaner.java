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
 * Tidies up a raw tree before it is validated: leftover {@code temp}
 * wrappers are spliced, repeated {@code on_fail}/{@code on_pass} children of
 * a test or group are merged into the first one, empty {@code on_fail},
 * {@code on_pass}, {@code meta} and {@code else} nodes are dropped and IDs are
 * trimmed, including those referenced by conditions.
 */
public class PreCleaner extends Processor {

	@Override
	protected Node process(Node node) {
		NodeType type = node.getType();
		switch (type) {
		case ID:
			return NodeFactory.id(node.getStringValue().trim());
		case ON_FAIL:
		case ON_PASS:
		case META:
		case ELSE:
			Node cleaned = processChildren(node);
			return cleaned.getChildren().isEmpty() ? null : cleaned;
		case TEST:
		case SUB_TEST:
		case GROUP:
			return mergeActions(processChildren(node));
		default:
			if (type.isRelationship()) {
				return NodeFactory.condition(type, trim(node.getGuard()), processAll(node.getChildren()));
			}
			return processChildren(node);
		}
	}

	private static List<String> trim(List<String> ids) {
		List<String> trimmed = new ArrayList<String>(ids.size());
		for (String id : ids) {
			trimmed.add(id.trim());
		}
		return trimmed;
	}

	private static Node mergeActions(Node node) {
		if (node.findAll(NodeType.ON_FAIL).size() < 2 && node.findAll(NodeType.ON_PASS).size() < 2) {
			return node;
		}
		List<Node> children = new ArrayList<Node>();
		int onFail = -1;
		int onPass = -1;
		for (Node child : node.getChildren()) {
			if (child.getType() == NodeType.ON_FAIL && onFail >= 0) {
				children.set(onFail, children.get(onFail).addChildren(child.getChildren()));
			} else if (child.getType() == NodeType.ON_PASS && onPass >= 0) {
				children.set(onPass, children.get(onPass).addChildren(child.getChildren()));
			} else {
				if (child.getType() == NodeType.ON_FAIL) {
					onFail = children.size();
				} else if (child.getType() == NodeType.ON_PASS) {
					onPass = children.size();
				}
				children.add(child);
			}
		}
		return node.updated(children);
	}
}
