package org.metricshub.atp.validators;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;
import org.metricshub.atp.Flow;
import org.metricshub.atp.Program;
import org.metricshub.atp.ast.NodeType;
import org.metricshub.atp.options.GroupOptions;
import org.metricshub.atp.options.TestOptions;

public class DuplicateIdsTest {

	private Flow flow;

	@Before
	public void setUp() {
		flow = new Program("prog").flow("sort1");
	}

	@Test
	public void testUniqueIds() {
		flow.test("t1", new TestOptions().id("t1"));
		flow.group("G", new GroupOptions().id("g1"), () -> flow.test("t2", new TestOptions().id("t2")));
		new DuplicateIds(flow).run(flow.raw());
	}

	@Test
	public void testDuplicateId() {
		flow.test("t1", new TestOptions().id("t1"));
		flow.group("RAM", new GroupOptions(), () -> flow.test("t2", new TestOptions().id("t1")));
		try {
			new DuplicateIds(flow).run(flow.raw());
			fail("The second t1 must be reported");
		} catch (DuplicateIdException e) {
			assertEquals("sort1", e.getFlowName());
			assertEquals(NodeType.ID, e.getNodeType());
			assertEquals("flow/group[RAM]/test[t1]", e.getPath());
			assertTrue(e.getMessage().contains("ID t1 is used more than once"));
		}
	}

	@Test(expected = DuplicateIdException.class)
	public void testTestAndGroupShareId() {
		flow.test("t1", new TestOptions().id("x"));
		flow.group("G", new GroupOptions().id("x"), () -> flow.test("t2"));
		new DuplicateIds(flow).run(flow.raw());
	}
}
