package org.metricshub.atp.processors;

import static org.junit.Assert.*;
import static org.metricshub.atp.AstTestSupport.*;
import static org.metricshub.atp.ast.NodeFactory.*;

import org.junit.Test;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;

public class EmptyBranchRemoverTest {

	@Test
	public void testRemoveEmpty() {
		Node input = f(
				t("t1", onFail(), onPass(log("x"))),
				ifFlag("F"),
				condition(NodeType.IF_ENABLED, "a", elseNode(log("y"))),
				group("G", id("g1")),
				ifFlag("F", ifFlag("G")),
				group("H", id("g2"), onFail(continueNode())));
		Node expected = f(
				t("t1", onPass(log("x"))),
				condition(NodeType.UNLESS_ENABLED, "a", log("y")));
		Node once = new EmptyBranchRemover().run(input);
		assertEquals(expected, once);
		assertEquals(once, new EmptyBranchRemover().run(once));
	}

	@Test
	public void testNonEmptyUntouched() {
		Node input = f(t("t1", onFail(failBin(5))), ifFlag("F", log("x"), elseNode(log("y"))));
		assertEquals(input, new EmptyBranchRemover().run(input));
	}

	@Test
	public void testRelationshipWithOnlyElseKept() {
		Node input = f(t("t1"), condition(NodeType.IF_FAILED, "t1", elseNode(log("not failed"))));
		assertEquals(input, new EmptyBranchRemover().run(input));
	}

	@Test
	public void testRanWithOnlyElseNegated() {
		Node input = f(condition(NodeType.IF_RAN, "t1", elseNode(log("skipped"))));
		Node expected = f(condition(NodeType.UNLESS_RAN, "t1", log("skipped")));
		assertEquals(expected, new EmptyBranchRemover().run(input));
	}
}
