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
import org.metricshub.atp.ast.NodeType;

/**
 * Base class of the passes that rewrite a flow tree.
 * <p>
 * A pass never modifies its input: {@link #run(Node)} returns a new tree. The
 * default {@link #process(Node)} rebuilds a node from its processed children;
 * passes override it and switch on the node type.
 * <p>
 * When {@link #process(Node)} returns a {@code temp} node, its children take
 * its place in the parent. When it returns {@code null}, the node is removed.
 */
public abstract class Processor {

	/**
	 * Runs this pass on a tree.
	 *
	 * @param node root of the tree, normally a {@code flow} node
	 * @return the rewritten tree
	 */
	public Node run(Node node) {
		return process(node);
	}

	/**
	 * Processes one node.
	 *
	 * @param node the node to process
	 * @return the replacement node, a {@code temp} node holding several
	 *         replacements, or {@code null} to remove the node
	 */
	protected Node process(Node node) {
		return processChildren(node);
	}

	/**
	 * @param node the node whose children to process
	 * @return the node rebuilt with its processed children
	 */
	protected Node processChildren(Node node) {
		if (node.getChildren().isEmpty()) {
			return node;
		}
		return node.updated(processAll(node.getChildren()));
	}

	/**
	 * Processes a list of nodes, splicing {@code temp} results and dropping
	 * {@code null} ones.
	 *
	 * @param nodes the nodes to process
	 * @return the processed nodes
	 */
	protected List<Node> processAll(List<Node> nodes) {
		List<Node> result = new ArrayList<Node>(nodes.size());
		for (Node node : nodes) {
			splice(process(node), result);
		}
		return result;
	}

	/**
	 * Adds a node to a list, replacing a {@code temp} node by its children.
	 *
	 * @param node node to add, ignored if {@code null}
	 * @param list list to add to
	 */
	protected static void splice(Node node, List<Node> list) {
		if (node == null) {
			return;
		}
		if (node.getType() == NodeType.TEMP) {
			for (Node child : node.getChildren()) {
				splice(child, list);
			}
		} else {
			list.add(node);
		}
	}
}
