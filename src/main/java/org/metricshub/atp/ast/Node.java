package org.metricshub.atp.ast;

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

import java.io.PrintStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An immutable node of an ATP syntax tree.
 * <p>
 * A node is a {@link NodeType} tag, an ordered list of scalar values and an
 * ordered list of child nodes. Nodes never reference their parent and are
 * never modified: every structural change produces a new node (see
 * {@link #updated(List)}), so a tree can be shared freely between passes and
 * threads.
 * <p>
 * Two nodes are equal when their type, values and children are recursively
 * equal.
 *
 * @see NodeFactory
 */
public final class Node implements Serializable {

	private static final long serialVersionUID = -3216043865171846590L;

	private final NodeType type;
	private final List<Object> values;
	private final List<Node> children;
	private transient int hash;

	/**
	 * Creates a node. Prefer the {@link NodeFactory} methods, which coerce and
	 * check the values of each node kind.
	 *
	 * @param type kind of the node
	 * @param values scalar values, may be empty
	 * @param children child nodes, may be empty
	 */
	public Node(NodeType type, List<?> values, List<Node> children) {
		if (type == null) {
			throw new IllegalArgumentException("Node type must not be null");
		}
		this.type = type;
		this.values = freeze(values);
		this.children = freeze(children);
		for (Node child : this.children) {
			if (child == null) {
				throw new IllegalArgumentException("A " + type.getName() + " node cannot have a null child");
			}
		}
	}

	private static <T> List<T> freeze(List<? extends T> list) {
		if (list == null || list.isEmpty()) {
			return Collections.emptyList();
		}
		return Collections.unmodifiableList(new ArrayList<T>(list));
	}

	public NodeType getType() {
		return type;
	}

	/**
	 * @return the scalar values of this node, never {@code null}
	 */
	public List<Object> getValues() {
		return values;
	}

	/**
	 * @return the first scalar value, or {@code null} if this node has none
	 */
	public Object getValue() {
		return values.isEmpty() ? null : values.get(0);
	}

	/**
	 * @return the first scalar value as a string, or {@code null}
	 */
	public String getStringValue() {
		Object value = getValue();
		return value == null ? null : value.toString();
	}

	/**
	 * @return the child nodes, never {@code null}
	 */
	public List<Node> getChildren() {
		return children;
	}

	/**
	 * Returns the guard of a condition node: the list of enable words, test
	 * IDs, jobs or flags it checks.
	 *
	 * @return the guard values
	 * @throws IllegalStateException if this is not a guarded condition node
	 */
	@SuppressWarnings("unchecked")
	public List<String> getGuard() {
		if (!type.isGuarded()) {
			throw new IllegalStateException("A " + type.getName() + " node has no guard");
		}
		return (List<String>) values.get(0);
	}

	/**
	 * Returns the children of a condition node that execute when the guard
	 * holds, that is all children except a trailing {@code else} node.
	 *
	 * @return the body of this node
	 */
	public List<Node> getBody() {
		if (!children.isEmpty() && children.get(children.size() - 1).getType() == NodeType.ELSE) {
			return children.subList(0, children.size() - 1);
		}
		return children;
	}

	/**
	 * @return the trailing {@code else} child, or {@code null}
	 */
	public Node getElse() {
		if (!children.isEmpty() && children.get(children.size() - 1).getType() == NodeType.ELSE) {
			return children.get(children.size() - 1);
		}
		return null;
	}

	/**
	 * @return the value of the {@code id} child, or {@code null}
	 */
	public String getId() {
		Node id = find(NodeType.ID);
		return id == null ? null : id.getStringValue();
	}

	/**
	 * @param childType type to look for
	 * @return the first direct child of the given type, or {@code null}
	 */
	public Node find(NodeType childType) {
		for (Node child : children) {
			if (child.type == childType) {
				return child;
			}
		}
		return null;
	}

	/**
	 * @param childType type to look for
	 * @return all direct children of the given type, in order
	 */
	public List<Node> findAll(NodeType childType) {
		List<Node> result = new ArrayList<Node>();
		for (Node child : children) {
			if (child.type == childType) {
				result.add(child);
			}
		}
		return result;
	}

	/**
	 * @param nodeType type to look for
	 * @return {@code true} if this node or any descendant has the given type
	 */
	public boolean contains(NodeType nodeType) {
		if (type == nodeType) {
			return true;
		}
		for (Node child : children) {
			if (child.contains(nodeType)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @param newChildren the children of the new node
	 * @return a node of the same type and values with the given children
	 */
	public Node updated(List<Node> newChildren) {
		return new Node(type, values, newChildren);
	}

	/**
	 * @param newType the type of the new node
	 * @return a node of the given type with the same values and children
	 */
	public Node updated(NodeType newType) {
		return new Node(newType, values, children);
	}

	/**
	 * @param newType type of the new node
	 * @param newValues values of the new node
	 * @param newChildren children of the new node
	 * @return a new node, this node is left untouched
	 */
	public Node updated(NodeType newType, List<?> newValues, List<Node> newChildren) {
		return new Node(newType, newValues, newChildren);
	}

	/**
	 * @param extra nodes to append
	 * @return a copy of this node with the given nodes appended to its children
	 */
	public Node addChildren(Node... extra) {
		return addChildren(Arrays.asList(extra));
	}

	/**
	 * @param extra nodes to append
	 * @return a copy of this node with the given nodes appended to its children
	 */
	public Node addChildren(List<Node> extra) {
		List<Node> newChildren = new ArrayList<Node>(children.size() + extra.size());
		newChildren.addAll(children);
		newChildren.addAll(extra);
		return updated(newChildren);
	}

	/**
	 * @param oldChild child to replace, compared by identity
	 * @param newChild replacement
	 * @return a copy of this node with the child replaced
	 */
	public Node replaceChild(Node oldChild, Node newChild) {
		List<Node> newChildren = new ArrayList<Node>(children);
		for (int i = 0; i < newChildren.size(); i++) {
			if (newChildren.get(i) == oldChild) {
				newChildren.set(i, newChild);
				return updated(newChildren);
			}
		}
		throw new IllegalArgumentException("Node is not a child of this " + type.getName() + " node");
	}

	/**
	 * @param childType type of the children to remove
	 * @return a copy of this node without any direct child of the given type
	 */
	public Node remove(NodeType childType) {
		List<Node> newChildren = new ArrayList<Node>(children.size());
		for (Node child : children) {
			if (child.type != childType) {
				newChildren.add(child);
			}
		}
		return updated(newChildren);
	}

	/**
	 * Dump an indented text representation of this tree to the given stream.
	 *
	 * @param ps stream to print to
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder line = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			line.append("  ");
		}
		line.append(type.getName());
		for (Object value : values) {
			line.append(' ');
			appendValue(line, value);
		}
		ps.println(line);
		for (Node child : children) {
			child.dump(ps, lvl + 1);
		}
	}

	/**
	 * @return an s-expression such as {@code (test (object "t1") (id "t1"))}
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		appendTo(sb);
		return sb.toString();
	}

	private void appendTo(StringBuilder sb) {
		sb.append('(').append(type.getName());
		for (Object value : values) {
			sb.append(' ');
			appendValue(sb, value);
		}
		for (Node child : children) {
			sb.append(' ');
			child.appendTo(sb);
		}
		sb.append(')');
	}

	private static void appendValue(StringBuilder sb, Object value) {
		if (value instanceof String) {
			sb.append('"').append(value).append('"');
		} else if (value instanceof List) {
			sb.append('[');
			boolean first = true;
			for (Object item : (List<?>) value) {
				if (!first) {
					sb.append(", ");
				}
				appendValue(sb, item);
				first = false;
			}
			sb.append(']');
		} else {
			sb.append(value);
		}
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Node)) {
			return false;
		}
		Node node = (Node) other;
		return type == node.type
				&& hashCode() == node.hashCode()
				&& values.equals(node.values)
				&& children.equals(node.children);
	}

	@Override
	public int hashCode() {
		int h = hash;
		if (h == 0) {
			h = type.ordinal() + 1;
			h = 31 * h + values.hashCode();
			h = 31 * h + children.hashCode();
			hash = h;
		}
		return h;
	}
}
