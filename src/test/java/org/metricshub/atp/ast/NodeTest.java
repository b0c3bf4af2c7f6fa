package org.metricshub.atp.ast;

import static org.junit.Assert.*;
import static org.metricshub.atp.ast.NodeFactory.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class NodeTest {

	private static Node sample() {
		return condition(
				NodeType.IF_ENABLED,
				"bitmap",
				test("t1").addChildren(id("t1"), onFail(setResult(FAIL, 5, null, null, null))),
				elseNode(log("disabled")));
	}

	@Test
	public void testStructuralEquality() {
		Node a = sample();
		Node b = sample();
		assertNotSame(a, b);
		assertEquals("Same construction gives equal trees", a, b);
		assertEquals("Equal trees have equal hash codes", a.hashCode(), b.hashCode());
		assertNotEquals(a, condition(NodeType.IF_ENABLED, "other", a.getChildren()));
		assertNotEquals(a, a.updated(NodeType.UNLESS_ENABLED));
	}

	@Test
	public void testBodyAndElse() {
		Node node = sample();
		assertEquals(1, node.getBody().size());
		assertEquals(NodeType.TEST, node.getBody().get(0).getType());
		assertEquals(elseNode(log("disabled")), node.getElse());
		assertEquals(Arrays.asList("bitmap"), node.getGuard());

		Node noElse = condition(NodeType.IF_FLAG, "F", log("x"));
		assertNull(noElse.getElse());
		assertEquals(noElse.getChildren(), noElse.getBody());
	}

	@Test(expected = IllegalStateException.class)
	public void testGuardOfPlainNode() {
		log("x").getGuard();
	}

	@Test
	public void testFind() {
		Node test = test("t1").addChildren(id("t1"), pin("A"), pin("B"));
		assertEquals("t1", test.getId());
		assertEquals(pin("A"), test.find(NodeType.PIN));
		assertEquals(2, test.findAll(NodeType.PIN).size());
		assertNull(test.find(NodeType.ON_FAIL));
		assertTrue(sample().contains(NodeType.SET_RESULT));
		assertFalse(sample().contains(NodeType.SET_FLAG));
		assertNull(test("t2").getId());
	}

	@Test
	public void testImmutability() {
		Node node = test("t1");
		Node updated = node.addChildren(id("t1"));
		assertEquals("The original node is untouched", 1, node.getChildren().size());
		assertEquals(2, updated.getChildren().size());
		try {
			updated.getChildren().add(id("t2"));
			fail("Children must not be modifiable");
		} catch (UnsupportedOperationException e) {
			// expected
		}
	}

	@Test
	public void testReplaceChildByIdentity() {
		Node first = log("same");
		Node second = log("same");
		Node parent = flow("f").addChildren(first, second);
		Node updated = parent.replaceChild(parent.getChildren().get(2), log("new"));
		assertEquals(flow("f").addChildren(log("same"), log("new")), updated);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testReplaceMissingChild() {
		flow("f").replaceChild(log("x"), log("y"));
	}

	@Test
	public void testRemove() {
		Node test = test("t1").addChildren(onFail(continueNode()), id("t1"));
		assertEquals(test("t1").addChildren(id("t1")), test.remove(NodeType.ON_FAIL));
	}

	@Test
	public void testToString() {
		assertEquals("(test (name \"t1\") (id \"t1\"))", test("t1").addChildren(id("t1")).toString());
		assertEquals("(if_flag [\"A\", \"B\"] (log \"x\"))",
				condition(NodeType.IF_FLAG, Arrays.asList("A", "B"), log("x")).toString());
		assertEquals("(bin 5)", bin(5).toString());
	}

	@Test
	public void testDump() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		sample().dump(new PrintStream(out, true));
		String[] lines = new String(out.toByteArray(), StandardCharsets.UTF_8).split("\\R");
		assertEquals("if_enabled [\"bitmap\"]", lines[0]);
		assertEquals("  test", lines[1]);
		assertEquals("    name \"t1\"", lines[2]);
	}

	@Test
	public void testSerialization() throws Exception {
		Node node = sample();
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
			out.writeObject(node);
		}
		try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
			Node copy = (Node) in.readObject();
			assertEquals(node, copy);
			assertEquals(node.hashCode(), copy.hashCode());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullChild() {
		List<Node> children = Arrays.asList(name("x"), null);
		new Node(NodeType.TEST, null, children);
	}
}
