package org.metricshub.atp.processors;

import static org.junit.Assert.*;
import static org.metricshub.atp.AstTestSupport.*;
import static org.metricshub.atp.ast.NodeFactory.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Test;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;

public class RelationshipTest {

	@Test
	public void testIfFailed() {
		Node input = f(t("t1", onFail(failBin(5))), condition(NodeType.IF_FAILED, "t1", t("t2")));
		Node expected = f(
				t("t1", onFail(failBin(5), autoFlag("t1_FAILED"), continueNode())),
				ifFlag("t1_FAILED", t("t2")));
		assertEquals(expected, new Relationship().run(input));
	}

	@Test
	public void testIfPassed() {
		Node input = f(t("t1"), condition(NodeType.IF_PASSED, "t1", t("t2")));
		Node expected = f(t("t1", onPass(autoFlag("t1_PASSED"))), ifFlag("t1_PASSED", t("t2")));
		assertEquals(expected, new Relationship().run(input));
	}

	@Test
	public void testIfAnyFailed() {
		Node input = f(t("t1"), t("t2"), condition(NodeType.IF_ANY_FAILED, Arrays.asList("t1", "t2"), log("x")));
		Node expected = f(
				t("t1", onFail(autoFlag("t1_FAILED"), continueNode())),
				t("t2", onFail(autoFlag("t2_FAILED"), continueNode())),
				ifFlag(Arrays.asList("t1_FAILED", "t2_FAILED"), log("x")));
		assertEquals(expected, new Relationship().run(input));
	}

	@Test
	public void testIfAllPassedWithElse() {
		Node input = f(
				t("t1"),
				t("t2"),
				condition(NodeType.IF_ALL_PASSED, Arrays.asList("t1", "t2"), log("x"), elseNode(log("y"))));
		Node expected = f(
				t("t1", onPass(autoFlag("t1_PASSED"))),
				t("t2", onPass(autoFlag("t2_PASSED"))),
				ifFlag("t1_PASSED", ifFlag("t2_PASSED", log("x"), elseNode(log("y"))), elseNode(log("y"))));
		assertEquals(expected, new Relationship().run(input));
	}

	@Test
	public void testIfRan() {
		Node input = f(t("t1"), condition(NodeType.IF_RAN, "t1", log("x")), condition(NodeType.UNLESS_RAN, "t1", log("y")));
		Node expected = f(
				t("t1"),
				autoFlag("t1_RAN"),
				ifFlag("t1_RAN", log("x")),
				unlessFlag("t1_RAN", log("y")));
		assertEquals(expected, new Relationship().run(input));
	}

	@Test
	public void testGroupReference() {
		Node input = f(group("G", id("g1"), t("t3")), condition(NodeType.IF_FAILED, "g1", log("x")));
		Node expected = f(
				group("G", id("g1"), onFail(autoFlag("g1_FAILED"), continueNode()), t("t3")),
				ifFlag("g1_FAILED", log("x")));
		assertEquals(expected, new Relationship().run(input));
	}

	@Test
	public void testUnreferencedTestUntouched() {
		Node input = f(t("t1", onFail(failBin(5))), t("t2"));
		assertEquals(input, new Relationship().run(input));
	}

	@Test
	public void testLoweringPreservesOutcomes() {
		Node input = f(
				t("t1"),
				t("t2"),
				condition(NodeType.IF_FAILED, "t1", log("t1 failed")),
				condition(NodeType.IF_PASSED, "t2", log("t2 passed")),
				condition(NodeType.IF_ANY_FAILED, Arrays.asList("t1", "t2"), log("any failed")),
				condition(NodeType.IF_ALL_FAILED, Arrays.asList("t1", "t2"), log("all failed"), elseNode(log("not all failed"))),
				condition(NodeType.IF_ANY_PASSED, Arrays.asList("t1", "t2"), log("any passed")),
				condition(NodeType.IF_ALL_PASSED, Arrays.asList("t1", "t2"), log("all passed")),
				condition(NodeType.IF_RAN, "t2", log("t2 ran")),
				condition(NodeType.UNLESS_RAN, "t3", log("t3 did not run")));
		Node lowered = new Relationship().run(input);

		for (boolean t1 : new boolean[] { true, false }) {
			for (boolean t2 : new boolean[] { true, false }) {
				Map<String, Boolean> outcomes = new HashMap<String, Boolean>();
				outcomes.put("t1", t1);
				outcomes.put("t2", t2);
				assertEquals(
						"t1 passed: " + t1 + ", t2 passed: " + t2,
						new Trace(outcomes).run(input),
						new Trace(outcomes).run(lowered));
			}
		}
	}

	/**
	 * Executes a flow against fixed test outcomes and records the log
	 * messages it reaches.
	 */
	private static class Trace {

		private final Map<String, Boolean> outcomes;
		private final Set<String> flags = new HashSet<String>();
		private final Set<String> ran = new HashSet<String>();
		private final List<String> messages = new ArrayList<String>();

		Trace(Map<String, Boolean> outcomes) {
			this.outcomes = outcomes;
		}

		List<String> run(Node flow) {
			execute(flow.getChildren());
			return messages;
		}

		private void execute(List<Node> nodes) {
			for (Node node : nodes) {
				execute(node);
			}
		}

		private void execute(Node node) {
			NodeType type = node.getType();
			switch (type) {
			case TEST:
				String id = node.getId();
				ran.add(id);
				Node actions = node.find(passed(id) ? NodeType.ON_PASS : NodeType.ON_FAIL);
				if (actions != null) {
					execute(actions.getChildren());
				}
				return;
			case SET_FLAG:
				flags.add(node.getStringValue());
				return;
			case LOG:
				messages.add(node.getStringValue());
				return;
			default:
				break;
			}
			if (type.isGuarded()) {
				if (holds(type, node.getGuard())) {
					execute(node.getBody());
				} else if (node.getElse() != null) {
					execute(node.getElse().getChildren());
				}
			}
		}

		private boolean passed(String id) {
			return !outcomes.containsKey(id) || outcomes.get(id).booleanValue();
		}

		private boolean failed(String id) {
			return ran.contains(id) && !passed(id);
		}

		private boolean holds(NodeType type, List<String> guard) {
			int count = 0;
			for (String value : guard) {
				boolean match;
				switch (type) {
				case IF_FLAG:
				case UNLESS_FLAG:
					match = flags.contains(value);
					break;
				case IF_FAILED:
				case IF_ANY_FAILED:
				case IF_ALL_FAILED:
					match = failed(value);
					break;
				case IF_PASSED:
				case IF_ANY_PASSED:
				case IF_ALL_PASSED:
					match = ran.contains(value) && passed(value);
					break;
				case IF_RAN:
				case UNLESS_RAN:
					match = ran.contains(value);
					break;
				default:
					throw new IllegalArgumentException("Unexpected condition " + type);
				}
				if (match) {
					count++;
				}
			}
			switch (type) {
			case UNLESS_FLAG:
			case UNLESS_RAN:
				return count == 0;
			case IF_ALL_FAILED:
			case IF_ALL_PASSED:
				return count == guard.size();
			default:
				return count > 0;
			}
		}
	}
}
