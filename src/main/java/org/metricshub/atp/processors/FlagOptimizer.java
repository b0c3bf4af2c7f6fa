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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;
import org.metricshub.atp.util.AtpLogger;
import org.slf4j.Logger;

/**
 * Removes the auto-generated flags that a conditional branch target does not
 * need.
 * <p>
 * When a test (or group) sets an auto-generated flag that is checked only by
 * the {@code if_flag} nodes directly following it, the bodies of those nodes
 * are moved into the test's {@code on_fail} or {@code on_pass} branch and the
 * flag disappears:
 *
 * <pre>
 * test t1 on_pass { set_flag t1_PASSED }
 * if_flag [t1_PASSED] { test t2 }
 * </pre>
 *
 * becomes
 *
 * <pre>
 * test t1 on_pass { test t2 }
 * </pre>
 *
 * A branch that continues the flow keeps its flag unless the optimizer is
 * told otherwise, since the target then runs the checks after the test.
 * Auto-generated flags that nothing checks are then removed. Volatile flags
 * and flags named by the user are left alone. No flag is ever shared between
 * two tests.
 */
public class FlagOptimizer extends Processor {

	private static final Logger LOG = AtpLogger.getLogger(FlagOptimizer.class);

	private final Map<String, Integer> setters = new HashMap<String, Integer>();
	private final Map<String, Integer> checks = new HashMap<String, Integer>();
	private final Set<String> volatileFlags = new HashSet<String>();
	private final boolean optimizeWhenContinue;
	private boolean removing;

	public FlagOptimizer() {
		this(false);
	}

	/**
	 * @param optimizeWhenContinue {@code true} to also inline flags set in a
	 *        branch holding a {@code continue}
	 */
	public FlagOptimizer(boolean optimizeWhenContinue) {
		this.optimizeWhenContinue = optimizeWhenContinue;
	}

	@Override
	public Node run(Node node) {
		setters.clear();
		checks.clear();
		volatileFlags.clear();
		Node volatileNode = node.find(NodeType.VOLATILE);
		if (volatileNode != null) {
			for (Node flag : volatileNode.getChildren()) {
				volatileFlags.add(flag.getStringValue());
			}
		}
		count(node);
		removing = false;
		Node inlined = process(node);

		checks.clear();
		setters.clear();
		count(inlined);
		removing = true;
		return process(inlined);
	}

	private void count(Node node) {
		if (node.getType() == NodeType.SET_FLAG) {
			setters.merge(node.getStringValue(), 1, Integer::sum);
		} else if (node.getType().isFlagCondition()) {
			for (String flag : node.getGuard()) {
				checks.merge(flag, 1, Integer::sum);
			}
		}
		for (Node child : node.getChildren()) {
			count(child);
		}
	}

	@Override
	protected Node process(Node node) {
		if (removing && FlowAnalysis.isAutoGenerated(node)) {
			String flag = node.getStringValue();
			if (!volatileFlags.contains(flag) && !checks.containsKey(flag)) {
				LOG.debug("Removing unused flag {}", flag);
				return null;
			}
		}
		return processChildren(node);
	}

	@Override
	protected List<Node> processAll(List<Node> nodes) {
		List<Node> processed = super.processAll(nodes);
		if (removing) {
			return processed;
		}
		List<Node> result = new ArrayList<Node>(processed.size());
		int i = 0;
		while (i < processed.size()) {
			Node node = processed.get(i);
			i++;
			if (!FlowAnalysis.isTestOrGroup(node.getType())) {
				result.add(node);
				continue;
			}
			for (NodeType branch : new NodeType[] { NodeType.ON_FAIL, NodeType.ON_PASS }) {
				Node actions = node.find(branch);
				if (actions == null || !optimizeWhenContinue && actions.find(NodeType.CONTINUE) != null) {
					continue;
				}
				for (Node setFlag : actions.findAll(NodeType.SET_FLAG)) {
					int last = followingChecks(processed, i, setFlag);
					if (last > i) {
						node = inline(node, actions, setFlag, processed.subList(i, last));
						actions = node.find(branch);
						i = last;
					}
				}
			}
			result.add(node);
		}
		return result;
	}

	/**
	 * Returns the end of the run of {@code if_flag} nodes starting at
	 * {@code from} that check only the given flag, or {@code from} if the flag
	 * cannot be inlined into them.
	 */
	private int followingChecks(List<Node> nodes, int from, Node setFlag) {
		String flag = setFlag.getStringValue();
		if (!FlowAnalysis.isAutoGenerated(setFlag)
				|| volatileFlags.contains(flag)
				|| setters.getOrDefault(flag, 0) != 1) {
			return from;
		}
		int end = from;
		while (end < nodes.size() && isCheckOf(nodes.get(end), flag)) {
			end++;
		}
		if (end - from != checks.getOrDefault(flag, 0)) {
			return from;
		}
		return end;
	}

	private static boolean isCheckOf(Node node, String flag) {
		return node.getType() == NodeType.IF_FLAG
				&& node.getElse() == null
				&& node.getGuard().size() == 1
				&& node.getGuard().get(0).equals(flag);
	}

	private Node inline(Node owner, Node actions, Node setFlag, List<Node> checkNodes) {
		String flag = setFlag.getStringValue();
		LOG.debug("Inlining flag {} into {}", flag, owner.getId());
		List<Node> children = new ArrayList<Node>(actions.getChildren());
		children.remove(setFlag);
		for (Node check : checkNodes) {
			children.addAll(check.getChildren());
		}
		checks.remove(flag);
		setters.remove(flag);
		return owner.replaceChild(actions, actions.updated(children));
	}
}
