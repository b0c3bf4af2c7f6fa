package org.metricshub.atp.frontend;

import static org.junit.Assert.*;
import static org.metricshub.atp.ast.NodeFactory.*;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.metricshub.atp.FlowDefinitionException;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;

public class FlowAssemblerTest {

	private static final List<Map.Entry<NodeType, Object>> NONE = Collections.emptyList();

	private static Map.Entry<NodeType, Object> entry(NodeType kind, Object value) {
		return new SimpleImmutableEntry<NodeType, Object>(kind, value);
	}

	@Test
	public void testAppend() {
		FlowAssembler assembler = new FlowAssembler(flow("f"));
		assembler.append(log("a"));
		assembler.append(log("b"));
		assertEquals(flow("f").addChildren(log("a"), log("b")), assembler.raw());
		assertEquals(1, assembler.getDepth());
	}

	@Test
	public void testAppendTo() {
		FlowAssembler assembler = new FlowAssembler(flow("f"));
		Node group = assembler.appendTo(group("G"), () -> {
			assertEquals(2, assembler.getDepth());
			assembler.append(log("inside"));
		});
		assertEquals(1, assembler.getDepth());
		assertEquals(group("G", log("inside")), group);
		assertEquals("The frame is not appended anywhere", flow("f"), assembler.raw());
	}

	@Test
	public void testRawFoldsOpenFrames() {
		FlowAssembler assembler = new FlowAssembler(flow("f"));
		assembler.appendTo(group("G"), () -> {
			assembler.append(log("inside"));
			assertEquals(flow("f").addChildren(group("G", log("inside"))), assembler.raw());
		});
	}

	@Test
	public void testFirstConditionIsOutermost() {
		FlowAssembler assembler = new FlowAssembler(flow("f"));
		List<Map.Entry<NodeType, Object>> conditions = Arrays.asList(
				entry(NodeType.IF_JOB, "p1"),
				entry(NodeType.IF_ENABLED, "bitmap"),
				entry(NodeType.GROUP, "G"));
		assembler.applyConditions(conditions, false, () -> log("x"));
		Node expected = flow("f").addChildren(
				condition(NodeType.IF_JOB, "p1",
						condition(NodeType.IF_ENABLED, "bitmap",
								group("G", log("x")))));
		assertEquals(expected, assembler.raw());
	}

	@Test
	public void testCurrentContext() {
		FlowAssembler assembler = new FlowAssembler(flow("f"));
		assembler.applyConditions(
				Arrays.asList(entry(NodeType.IF_JOB, "p1"), entry(NodeType.IF_ENABLED, "bitmap")),
				false,
				() -> log("first"));
		assembler.applyConditions(NONE, true, () -> log("second"));
		assembler.applyConditions(NONE, true, () -> log("third"));
		Node expected = flow("f").addChildren(
				condition(NodeType.IF_JOB, "p1",
						condition(NodeType.IF_ENABLED, "bitmap", log("first"), log("second"), log("third"))));
		assertEquals(expected, assembler.raw());
	}

	@Test
	public void testCurrentContextWithoutConditions() {
		FlowAssembler assembler = new FlowAssembler(flow("f"));
		assembler.appendTo(group("G"), () -> {
			assembler.append(log("a"));
			assembler.applyConditions(NONE, true, () -> log("b"));
		});
		assertEquals(flow("f"), assembler.raw());
		assembler.append(log("c"));
		assembler.applyConditions(NONE, true, () -> log("d"));
		assertEquals(flow("f").addChildren(log("c"), log("d")), assembler.raw());
	}

	@Test
	public void testCurrentContextInClosedFrame() {
		FlowAssembler assembler = new FlowAssembler(flow("f"));
		Node group = assembler.appendTo(group("G"), () -> assembler.append(log("a")));
		assembler.append(group);
		assembler.applyConditions(NONE, true, () -> log("b"));
		assertEquals(flow("f").addChildren(group("G", log("a"), log("b"))), assembler.raw());
	}

	@Test(expected = FlowDefinitionException.class)
	public void testCurrentContextFirst() {
		new FlowAssembler(flow("f")).applyConditions(NONE, true, () -> log("x"));
	}

	@Test
	public void testSingleId() {
		FlowAssembler.checkSingleId(NodeType.IF_FAILED, "t1");
		FlowAssembler.checkSingleId(NodeType.IF_ANY_FAILED, Arrays.asList("t1", "t2"));
		try {
			FlowAssembler.checkSingleId(NodeType.IF_PASSED, Arrays.asList("t1", "t2"));
			fail("if_passed takes a single ID");
		} catch (FlowDefinitionException e) {
			assertEquals("if_passed only accepts one ID, use if_any_passed or if_all_passed for multiple IDs", e.getMessage());
		}
	}
}
