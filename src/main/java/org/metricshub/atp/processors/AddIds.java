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
import java.util.List;
import java.util.Set;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.ast.NodeType;

/**
 * Gives an ID to every test, sub test and group that has none:
 * {@code t1}, {@code t2} ... for tests and {@code g1}, {@code g2} ... for
 * groups, in flow order, skipping the IDs the flow already uses.
 * <p>
 * Running it on a tree where everything has an ID returns an equal tree.
 */
public class AddIds extends Processor {

	private final Set<String> used = new HashSet<String>();
	private int testCount;
	private int groupCount;

	@Override
	public Node run(Node node) {
		used.clear();
		testCount = 0;
		groupCount = 0;
		collect(node);
		return process(node);
	}

	private void collect(Node node) {
		if (node.getType() == NodeType.ID) {
			used.add(node.getStringValue());
		}
		for (Node child : node.getChildren()) {
			collect(child);
		}
	}

	@Override
	protected Node process(Node node) {
		switch (node.getType()) {
		case TEST:
		case SUB_TEST:
			return addId(node, "t", NodeType.OBJECT, NodeType.NAME, NodeType.NUMBER);
		case GROUP:
			return addId(node, "g", NodeType.NAME);
		default:
			return processChildren(node);
		}
	}

	/**
	 * Inserts the ID after the children of the given types. A test is numbered
	 * before its sub tests.
	 */
	private Node addId(Node node, String prefix, NodeType... before) {
		if (node.getId() != null) {
			return processChildren(node);
		}
		String id = nextId(prefix);
		Node processed = processChildren(node);
		List<Node> children = new ArrayList<Node>(processed.getChildren());
		int index = 0;
		for (int i = 0; i < children.size(); i++) {
			for (NodeType type : before) {
				if (children.get(i).getType() == type) {
					index = i + 1;
				}
			}
		}
		children.add(index, NodeFactory.id(id));
		return processed.updated(children);
	}

	private String nextId(String prefix) {
		String id;
		do {
			if ("t".equals(prefix)) {
				id = prefix + (++testCount);
			} else {
				id = prefix + (++groupCount);
			}
		} while (used.contains(id));
		used.add(id);
		return id;
	}
}
