package org.metricshub.atp.processors;

import static org.junit.Assert.*;
import static org.metricshub.atp.AstTestSupport.*;
import static org.metricshub.atp.ast.NodeFactory.*;

import org.junit.Test;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;

public class AdjacentIfCombinerTest {

	@Test
	public void testIfThenUnless() {
		Node input = f(ifFlag("F", log("a")), unlessFlag("F", log("b")));
		Node expected = f(ifFlag("F", log("a"), elseNode(log("b"))));
		assertEquals(expected, new AdjacentIfCombiner().run(input));
	}

	@Test
	public void testUnlessThenIf() {
		Node input = f(
				condition(NodeType.UNLESS_ENABLED, "v", log("b")),
				condition(NodeType.IF_ENABLED, "v", log("a")));
		Node expected = f(condition(NodeType.IF_ENABLED, "v", log("a"), elseNode(log("b"))));
		assertEquals(expected, new AdjacentIfCombiner().run(input));
	}

	@Test
	public void testSameKindMerged() {
		Node input = f(condition(NodeType.IF_JOB, "p1", log("a")), condition(NodeType.IF_JOB, "p1", log("b")));
		Node expected = f(condition(NodeType.IF_JOB, "p1", log("a"), log("b")));
		assertEquals(expected, new AdjacentIfCombiner().run(input));
	}

	@Test
	public void testFirstBodyChangesGuard() {
		Node input = f(unlessFlag("F", setFlag("F")), ifFlag("F", log("a")));
		assertEquals(input, new AdjacentIfCombiner().run(input));
	}

	@Test
	public void testNoExactComplement() {
		Node input = f(condition(NodeType.IF_FAILED, "t1", log("a")), condition(NodeType.IF_PASSED, "t1", log("b")));
		assertEquals(input, new AdjacentIfCombiner().run(input));
	}

	@Test
	public void testDifferentGuards() {
		Node input = f(ifFlag("F", log("a")), unlessFlag("G", log("b")));
		assertEquals(input, new AdjacentIfCombiner().run(input));
	}
}
