package org.metricshub.atp.validators;

import static org.junit.Assert.*;

import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.atp.Flow;
import org.metricshub.atp.Program;
import org.metricshub.atp.ast.NodeType;
import org.metricshub.atp.options.GroupOptions;
import org.metricshub.atp.options.TestOptions;

public class MissingIdsTest {

	private Flow flow;

	@Before
	public void setUp() {
		flow = new Program("prog").flow("sort1");
	}

	@Test
	public void testKnownIds() {
		flow.test("t1", new TestOptions().id("t1"));
		flow.group("G", new GroupOptions().id("g1"), () -> flow.test("t2"));
		flow.test("t3", new TestOptions().ifAnyFailed(Arrays.asList("t1", "g1")));
		flow.ifRan("t1", () -> flow.log("ran"));
		new MissingIds(flow).run(flow.raw());
	}

	@Test
	public void testReferenceBeforeDefinition() {
		flow.ifPassed("t2", () -> flow.log("t2 passed"));
		flow.test("t2", new TestOptions().id("t2"));
		new MissingIds(flow).run(flow.raw());
	}

	@Test
	public void testMissingId() {
		flow.test("t1", new TestOptions().id("t1"));
		flow.test("t2", new TestOptions().ifFailed("t9"));
		try {
			new MissingIds(flow).run(flow.raw());
			fail("t9 is not defined");
		} catch (MissingIdException e) {
			assertEquals(NodeType.IF_FAILED, e.getNodeType());
			assertEquals("flow/if_failed[t9]", e.getPath());
			assertTrue(e.getMessage().contains("t9"));
		}
	}

	@Test
	public void testFlagsAreNotIds() {
		flow.test("t1", new TestOptions().ifFlag("UNKNOWN_FLAG"));
		new MissingIds(flow).run(flow.raw());
	}
}
