package org.metricshub.atp.processors;

import static org.junit.Assert.*;
import static org.metricshub.atp.AstTestSupport.*;
import static org.metricshub.atp.ast.NodeFactory.*;

import org.junit.Test;
import org.metricshub.atp.ast.Node;

public class ApplyPostGroupActionsTest {

	@Test
	public void testGroupActions() {
		Node input = f(group("G",
				id("g1"),
				onFail(failBin(10), continueNode()),
				onPass(log("pass")),
				t("t1", onFail(failBin(1))),
				ifFlag("X", t("t2"))));
		Node expected = f(
				group("G",
						id("g1"),
						t("t1", onFail(failBin(1), autoFlag("g1_FAILED"), continueNode())),
						ifFlag("X", t("t2", onFail(autoFlag("g1_FAILED"), continueNode())))),
				ifFlag("g1_FAILED", failBin(10)),
				unlessFlag("g1_FAILED", log("pass")));
		assertEquals(expected, new ApplyPostGroupActions().run(input));
	}

	@Test
	public void testWithoutContinue() {
		Node input = f(group("G", id("g1"), onFail(failBin(10)), t("t1")));
		Node expected = f(
				group("G", id("g1"), t("t1", onFail(autoFlag("g1_FAILED")))),
				ifFlag("g1_FAILED", failBin(10)));
		assertEquals(expected, new ApplyPostGroupActions().run(input));
	}

	@Test
	public void testGroupWithoutActions() {
		Node input = f(group("G", id("g1"), t("t1")));
		assertEquals(input, new ApplyPostGroupActions().run(input));
	}
}
