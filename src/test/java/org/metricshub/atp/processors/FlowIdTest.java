package org.metricshub.atp.processors;

import static org.junit.Assert.*;
import static org.metricshub.atp.AstTestSupport.*;
import static org.metricshub.atp.ast.NodeFactory.*;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;

public class FlowIdTest {

	@Test
	public void testSuffix() {
		Node input = f(
				t("t1"),
				condition(NodeType.IF_ANY_FAILED, Arrays.asList("t1", "t2"), t("t2")),
				ifFlag("t1", log("flags are not IDs")));
		Node expected = f(
				new Node(NodeType.TEST, null, Arrays.asList(object("t1"), id("t1_abc"))),
				condition(NodeType.IF_ANY_FAILED, Arrays.asList("t1_abc", "t2_abc"),
						new Node(NodeType.TEST, null, Arrays.asList(object("t2"), id("t2_abc")))),
				ifFlag("t1", log("flags are not IDs")));
		assertEquals(expected, new FlowId("abc").run(input));
	}
}
