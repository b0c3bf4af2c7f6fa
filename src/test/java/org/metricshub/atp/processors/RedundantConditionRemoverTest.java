package org.metricshub.atp.processors;

import static org.junit.Assert.*;
import static org.metricshub.atp.AstTestSupport.*;
import static org.metricshub.atp.ast.NodeFactory.*;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;

public class RedundantConditionRemoverTest {

	@Test
	public void testImpliedAnyOf() {
		Node input = f(ifFlag("A", ifFlag(Arrays.asList("A", "B"), log("x"))));
		Node expected = f(ifFlag("A", log("x")));
		assertEquals(expected, new RedundantConditionRemover().run(input));
	}

	@Test
	public void testNotImplied() {
		Node input = f(ifFlag(Arrays.asList("A", "B"), ifFlag("A", log("x"))));
		assertEquals(input, new RedundantConditionRemover().run(input));
	}

	@Test
	public void testImpliedNoneOf() {
		Node input = f(unlessFlag(Arrays.asList("A", "B"), unlessFlag("A", log("x"))));
		Node expected = f(unlessFlag(Arrays.asList("A", "B"), log("x")));
		assertEquals(expected, new RedundantConditionRemover().run(input));
	}

	@Test
	public void testOuterBodyChangesGuard() {
		Node input = f(unlessFlag("A", setFlag("A"), unlessFlag("A", log("x"))));
		assertEquals(input, new RedundantConditionRemover().run(input));
	}

	@Test
	public void testDeepImplicationDropsElse() {
		Node input = f(condition(NodeType.IF_ENABLED, "a",
				condition(NodeType.IF_JOB, "p1",
						condition(NodeType.IF_ENABLED, "a", log("x"), elseNode(log("y"))))));
		Node expected = f(condition(NodeType.IF_ENABLED, "a", condition(NodeType.IF_JOB, "p1", log("x"))));
		assertEquals(expected, new RedundantConditionRemover().run(input));
	}

	@Test
	public void testElseBranchNotImplied() {
		Node input = f(ifFlag("A", log("a"), elseNode(ifFlag("A", log("x")))));
		assertEquals(input, new RedundantConditionRemover().run(input));
	}
}
