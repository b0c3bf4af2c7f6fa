package org.metricshub.atp.processors;

import static org.junit.Assert.*;
import static org.metricshub.atp.AstTestSupport.*;
import static org.metricshub.atp.ast.NodeFactory.*;

import org.junit.Test;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;

public class ElseRemoverTest {

	@Test
	public void testElseRemoved() {
		Node input = f(condition(NodeType.IF_ENABLED, "v", t("t1"), elseNode(t("t2"))));
		Node expected = f(
				condition(NodeType.IF_ENABLED, "v", t("t1")),
				condition(NodeType.UNLESS_ENABLED, "v", t("t2")));
		assertEquals(expected, new ElseRemover().run(input));
	}

	@Test
	public void testBodyChangesGuard() {
		Node input = f(ifFlag("F", setFlag("F"), elseNode(log("y"))));
		Node expected = f(unlessFlag("F", log("y")), ifFlag("F", setFlag("F")));
		assertEquals(expected, new ElseRemover().run(input));
	}

	@Test
	public void testNestedElse() {
		Node input = f(condition(NodeType.IF_JOB, "p1",
				log("x"),
				elseNode(ifFlag("F", log("y"), elseNode(log("z"))))));
		Node expected = f(
				condition(NodeType.IF_JOB, "p1", log("x")),
				condition(NodeType.UNLESS_JOB, "p1", ifFlag("F", log("y")), unlessFlag("F", log("z"))));
		Node actual = new ElseRemover().run(input);
		assertEquals(expected, actual);
		assertFalse(actual.contains(NodeType.ELSE));
	}
}
