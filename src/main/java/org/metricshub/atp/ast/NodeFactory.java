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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Stateless factory for well formed nodes of every kind.
 * <p>
 * The factory only coerces its arguments: text becomes a {@link String},
 * numbers become a {@link Long}. Semantic checks are left to the validators.
 * Calling a factory method twice with the same arguments yields two equal
 * nodes.
 */
public final class NodeFactory {

	/**
	 * Second value of a {@code set_flag} node whose flag was synthesized by a
	 * processor rather than named by the user.
	 */
	public static final String AUTO_GENERATED = "auto_generated";

	/** {@code set_result} type of a failing result. */
	public static final String FAIL = "fail";

	/** {@code set_result} type of a passing result. */
	public static final String PASS = "pass";

	private NodeFactory() {
		// utility class
	}

	/**
	 * Generic constructor for a node with values and no children.
	 *
	 * @param type node kind
	 * @param values scalar values
	 * @return the new node
	 */
	public static Node n(NodeType type, Object... values) {
		return new Node(type, Arrays.asList(values), Collections.<Node>emptyList());
	}

	/**
	 * Generic constructor for a node without values.
	 *
	 * @param type node kind
	 * @param children child nodes
	 * @return the new node
	 */
	public static Node n0(NodeType type, Node... children) {
		return new Node(type, Collections.emptyList(), Arrays.asList(children));
	}

	public static Node flow(String name) {
		return n0(NodeType.FLOW, name(name));
	}

	public static Node name(Object name) {
		return n(NodeType.NAME, text(name));
	}

	/**
	 * @param name test name
	 * @return a bare {@code test} node holding only a name
	 */
	public static Node test(Object name) {
		return n0(NodeType.TEST, name(name));
	}

	public static Node id(Object id) {
		return n(NodeType.ID, text(id));
	}

	public static Node object(Object instance) {
		return n(NodeType.OBJECT, text(instance));
	}

	public static Node number(Object value) {
		return n(NodeType.NUMBER, integer(value));
	}

	public static Node bin(Object value) {
		return n(NodeType.BIN, integer(value));
	}

	public static Node bin(Object value, String description) {
		if (description == null) {
			return bin(value);
		}
		return n(NodeType.BIN, integer(value), description);
	}

	public static Node softbin(Object value) {
		return n(NodeType.SOFTBIN, integer(value));
	}

	public static Node softbin(Object value, String description) {
		if (description == null) {
			return softbin(value);
		}
		return n(NodeType.SOFTBIN, integer(value), description);
	}

	public static Node continueNode() {
		return n0(NodeType.CONTINUE);
	}

	/**
	 * @param name pattern name
	 * @param path optional pattern path
	 * @return a {@code pattern} node
	 */
	public static Node pattern(Object name, Object path) {
		if (path == null) {
			return n(NodeType.PATTERN, text(name));
		}
		return n(NodeType.PATTERN, text(name), text(path));
	}

	public static Node attribute(Object name, Object value) {
		return n(NodeType.ATTRIBUTE, text(name), scalar(value));
	}

	public static Node meta(List<Node> attributes) {
		return new Node(NodeType.META, null, attributes);
	}

	/**
	 * @param name level name, e.g. {@code vdd}
	 * @param value level value
	 * @param units optional units
	 * @return a {@code level} node
	 */
	public static Node level(Object name, Object value, Object units) {
		if (units == null) {
			return n(NodeType.LEVEL, text(name), scalar(value));
		}
		return n(NodeType.LEVEL, text(name), scalar(value), text(units));
	}

	/**
	 * @param value limit value
	 * @param rule comparison rule, e.g. {@code gte}
	 * @param units optional units
	 * @return a {@code limit} node
	 */
	public static Node limit(Object value, Object rule, Object units) {
		if (units == null) {
			return n(NodeType.LIMIT, scalar(value), text(rule));
		}
		return n(NodeType.LIMIT, scalar(value), text(rule), text(units));
	}

	public static Node pin(Object name) {
		return n(NodeType.PIN, text(name));
	}

	/**
	 * Builds a {@code set_result} node.
	 *
	 * @param type {@link #PASS} or {@link #FAIL}
	 * @param bin bin number, may be {@code null}
	 * @param binDescription may be {@code null}
	 * @param softbin soft bin number, may be {@code null}
	 * @param softbinDescription may be {@code null}
	 * @return the node
	 */
	public static Node setResult(String type, Object bin, String binDescription, Object softbin, String softbinDescription) {
		List<Node> children = new ArrayList<Node>(2);
		if (bin != null) {
			children.add(bin(bin, binDescription));
		}
		if (softbin != null) {
			children.add(softbin(softbin, softbinDescription));
		}
		return new Node(NodeType.SET_RESULT, Collections.singletonList(type), children);
	}

	public static Node setFlag(Object flag) {
		return n(NodeType.SET_FLAG, text(flag));
	}

	/**
	 * @param flag flag name
	 * @param autoGenerated {@code true} if the flag was synthesized by a processor
	 * @return a {@code set_flag} node
	 */
	public static Node setFlag(Object flag, boolean autoGenerated) {
		if (autoGenerated) {
			return n(NodeType.SET_FLAG, text(flag), AUTO_GENERATED);
		}
		return setFlag(flag);
	}

	public static Node onFail(Node... actions) {
		return n0(NodeType.ON_FAIL, actions);
	}

	public static Node onFail(List<Node> actions) {
		return new Node(NodeType.ON_FAIL, null, actions);
	}

	public static Node onPass(Node... actions) {
		return n0(NodeType.ON_PASS, actions);
	}

	public static Node onPass(List<Node> actions) {
		return new Node(NodeType.ON_PASS, null, actions);
	}

	/**
	 * Builds a condition node.
	 *
	 * @param kind a guarded condition kind
	 * @param guard a single value or a collection of values
	 * @param body nodes executed when the guard holds
	 * @return the node
	 */
	public static Node condition(NodeType kind, Object guard, Node... body) {
		return condition(kind, guard, Arrays.asList(body));
	}

	/**
	 * Builds a condition node.
	 *
	 * @param kind a guarded condition kind
	 * @param guard a single value or a collection of values
	 * @param body nodes executed when the guard holds, optionally followed by
	 *        an {@code else} node
	 * @return the node
	 */
	public static Node condition(NodeType kind, Object guard, List<Node> body) {
		if (!kind.isGuarded()) {
			throw new IllegalArgumentException(kind.getName() + " is not a guarded condition");
		}
		return new Node(kind, Collections.singletonList(guard(guard)), body);
	}

	public static Node elseNode(Node... body) {
		return n0(NodeType.ELSE, body);
	}

	public static Node elseNode(List<Node> body) {
		return new Node(NodeType.ELSE, null, body);
	}

	/**
	 * @param name group name
	 * @param members the name is prepended to these children
	 * @return a {@code group} node
	 */
	public static Node group(Object name, Node... members) {
		List<Node> children = new ArrayList<Node>(members.length + 1);
		children.add(name(name));
		children.addAll(Arrays.asList(members));
		return new Node(NodeType.GROUP, null, children);
	}

	public static Node log(Object message) {
		return n(NodeType.LOG, text(message));
	}

	public static Node enable(Object var) {
		return n(NodeType.ENABLE, text(var));
	}

	public static Node disable(Object var) {
		return n(NodeType.DISABLE, text(var));
	}

	public static Node render(Object content) {
		return n(NodeType.RENDER, text(content));
	}

	public static Node cz(Object setup, Node... children) {
		return new Node(NodeType.CZ, Collections.singletonList(text(setup)), Arrays.asList(children));
	}

	public static Node volatileNode(List<Node> flags) {
		return new Node(NodeType.VOLATILE, null, flags);
	}

	public static Node flag(Object name) {
		return n(NodeType.FLAG, text(name));
	}

	public static Node temp(List<Node> children) {
		return new Node(NodeType.TEMP, null, children);
	}

	/**
	 * Normalizes a guard value: a collection (or array) becomes a list of
	 * strings, anything else a one element list.
	 *
	 * @param guard the guard value
	 * @return an unmodifiable, non empty list of strings
	 */
	public static List<String> guard(Object guard) {
		List<String> list = new ArrayList<String>();
		if (guard instanceof Collection) {
			for (Object item : (Collection<?>) guard) {
				list.add(text(item));
			}
		} else if (guard instanceof Object[]) {
			for (Object item : (Object[]) guard) {
				list.add(text(item));
			}
		} else {
			list.add(text(guard));
		}
		if (list.isEmpty()) {
			throw new IllegalArgumentException("A condition needs at least one value");
		}
		return Collections.unmodifiableList(list);
	}

	static String text(Object value) {
		if (value == null) {
			throw new IllegalArgumentException("A text value is required");
		}
		return String.valueOf(value);
	}

	/**
	 * Coerces a number (or a numeric string) to a {@link Long}.
	 *
	 * @param value value to coerce
	 * @return the value as a long
	 * @throws IllegalArgumentException if the value is not numeric
	 */
	public static Long integer(Object value) {
		if (value instanceof Number) {
			return Long.valueOf(((Number) value).longValue());
		}
		if (value instanceof String) {
			try {
				return Long.valueOf(((String) value).trim());
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("'" + value + "' is not an integer", e);
			}
		}
		throw new IllegalArgumentException("Expected an integer value but got " + value);
	}

	private static Object scalar(Object value) {
		if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return Long.valueOf(((Number) value).longValue());
		}
		if (value instanceof Float) {
			return Double.valueOf(((Float) value).doubleValue());
		}
		if (value instanceof Number || value instanceof Boolean || value instanceof String) {
			return value;
		}
		return text(value);
	}
}
