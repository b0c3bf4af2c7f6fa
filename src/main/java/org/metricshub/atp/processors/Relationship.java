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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.ast.NodeType;

/**
 * Lowers the relationship conditions to flags.
 * <p>
 * Every test or group referenced by a relationship condition sets a flag
 * describing its outcome: {@code <id>_FAILED} (and continues) when it fails,
 * {@code <id>_PASSED} when it passes, {@code <id>_RAN} once it has run. The
 * conditions are then rewritten to check those flags:
 *
 * <pre>
 * if_failed [t1]          -&gt; if_flag [t1_FAILED]
 * if_any_failed [t1, t2]  -&gt; if_flag [t1_FAILED, t2_FAILED]
 * if_all_failed [t1, t2]  -&gt; if_flag [t1_FAILED] { if_flag [t2_FAILED] }
 * if_ran [t1]             -&gt; if_flag [t1_RAN]
 * unless_ran [t1]         -&gt; unless_flag [t1_RAN]
 * </pre>
 *
 * and likewise for the passed conditions. The else branch of an
 * {@code if_all_*} condition is repeated at every level of the nesting.
 */
public class Relationship extends Processor {

	public static final String FAILED = "_FAILED";
	public static final String PASSED = "_PASSED";
	public static final String RAN = "_RAN";

	private final Set<String> failed = new HashSet<String>();
	private final Set<String> passed = new HashSet<String>();
	private final Set<String> ran = new HashSet<String>();

	@Override
	public Node run(Node node) {
		failed.clear();
		passed.clear();
		ran.clear();
		collect(node);
		return process(node);
	}

	private void collect(Node node) {
		switch (node.getType()) {
		case IF_FAILED:
		case IF_ANY_FAILED:
		case IF_ALL_FAILED:
			failed.addAll(node.getGuard());
			break;
		case IF_PASSED:
		case IF_ANY_PASSED:
		case IF_ALL_PASSED:
			passed.addAll(node.getGuard());
			break;
		case IF_RAN:
		case UNLESS_RAN:
			ran.addAll(node.getGuard());
			break;
		default:
			break;
		}
		for (Node child : node.getChildren()) {
			collect(child);
		}
	}

	@Override
	protected Node process(Node node) {
		NodeType type = node.getType();
		if (FlowAnalysis.isTestOrGroup(type)) {
			return processTestResults(processChildren(node));
		}
		switch (type) {
		case IF_FAILED:
		case IF_ANY_FAILED:
			return NodeFactory.condition(NodeType.IF_FLAG, flags(node.getGuard(), FAILED), processAll(node.getChildren()));
		case IF_PASSED:
		case IF_ANY_PASSED:
			return NodeFactory.condition(NodeType.IF_FLAG, flags(node.getGuard(), PASSED), processAll(node.getChildren()));
		case IF_ALL_FAILED:
			return nest(flags(node.getGuard(), FAILED), processAll(node.getBody()), elseBody(node));
		case IF_ALL_PASSED:
			return nest(flags(node.getGuard(), PASSED), processAll(node.getBody()), elseBody(node));
		case IF_RAN:
			return NodeFactory.condition(NodeType.IF_FLAG, flags(node.getGuard(), RAN), processAll(node.getChildren()));
		case UNLESS_RAN:
			return NodeFactory.condition(NodeType.UNLESS_FLAG, flags(node.getGuard(), RAN), processAll(node.getChildren()));
		default:
			return processChildren(node);
		}
	}

	private Node elseBody(Node node) {
		Node otherwise = node.getElse();
		return otherwise == null ? null : processChildren(otherwise);
	}

	/**
	 * Builds one {@code if_flag} per flag, each nested in the previous one.
	 */
	private static Node nest(List<String> flags, List<Node> body, Node otherwise) {
		List<Node> children = new ArrayList<Node>(body);
		for (int i = flags.size() - 1; i >= 0; i--) {
			if (otherwise != null) {
				children.add(otherwise);
			}
			Node node = NodeFactory.condition(NodeType.IF_FLAG, flags.get(i), children);
			children = new ArrayList<Node>(Collections.singletonList(node));
		}
		return children.get(0);
	}

	private static List<String> flags(List<String> ids, String suffix) {
		List<String> flags = new ArrayList<String>(ids.size());
		for (String id : ids) {
			flags.add(id + suffix);
		}
		return flags;
	}

	private Node processTestResults(Node node) {
		String id = node.getId();
		if (id == null) {
			return node;
		}
		Node result = node;
		if (failed.contains(id)) {
			result = FlowAnalysis.addAction(result, NodeType.ON_FAIL, NodeFactory.setFlag(id + FAILED, true));
			result = FlowAnalysis.addAction(result, NodeType.ON_FAIL, NodeFactory.continueNode());
		}
		if (passed.contains(id)) {
			result = FlowAnalysis.addAction(result, NodeType.ON_PASS, NodeFactory.setFlag(id + PASSED, true));
		}
		if (ran.contains(id)) {
			return NodeFactory.temp(Arrays.asList(result, NodeFactory.setFlag(id + RAN, true)));
		}
		return result;
	}
}
