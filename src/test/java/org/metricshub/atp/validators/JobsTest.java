package org.metricshub.atp.validators;

import static org.junit.Assert.*;

import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.atp.Flow;
import org.metricshub.atp.Program;
import org.metricshub.atp.options.ControlOptions;
import org.metricshub.atp.options.TestOptions;

public class JobsTest {

	private Flow flow;

	@Before
	public void setUp() {
		flow = new Program("prog").flow("sort1");
	}

	private void validate() {
		new Jobs(flow).run(flow.raw());
	}

	@Test
	public void testValidNesting() {
		flow.ifJob(Arrays.asList("p1", "p2"), () -> {
			flow.test("t1", new TestOptions().ifJob("P1"));
			flow.unlessJob("p2", () -> flow.test("t2"));
		});
		flow.unlessJob("fr", () -> flow.test("t3", new TestOptions().ifJob("p1")));
		validate();
	}

	@Test
	public void testNegatedJob() {
		flow.test("t1", new TestOptions().ifJob("!p1"));
		try {
			validate();
			fail("Negated job names must be rejected");
		} catch (JobConflictException e) {
			assertTrue(e.getMessage().contains("unless_job"));
			assertEquals("flow/if_job[!p1]", e.getPath());
		}
	}

	@Test(expected = JobConflictException.class)
	public void testNestedIfJobOutsideEnclosing() {
		flow.ifJob("p1", () -> flow.test("t1", new TestOptions().ifJob("p2")));
		validate();
	}

	@Test(expected = JobConflictException.class)
	public void testIfJobExcluded() {
		flow.unlessJob("p1", () -> flow.test("t1", new TestOptions().ifJob(Arrays.asList("p1", "p2"))));
		validate();
	}

	@Test(expected = JobConflictException.class)
	public void testUnlessJobExcludesEverything() {
		flow.ifJob(Arrays.asList("p1", "p2"), () -> flow.unlessJob(Arrays.asList("P2", "p1"), () -> flow.test("t1")));
		validate();
	}

	@Test
	public void testElseBranch() {
		flow.ifJob("p1", new ControlOptions()
				.then(() -> flow.test("t1"))
				.otherwise(() -> flow.test("t2", new TestOptions().ifJob("p2"))), null);
		validate();
	}

	@Test(expected = JobConflictException.class)
	public void testElseBranchExcludesJob() {
		flow.ifJob("p1", new ControlOptions()
				.then(() -> flow.test("t1"))
				.otherwise(() -> flow.test("t2", new TestOptions().ifJob("p1"))), null);
		validate();
	}
}
