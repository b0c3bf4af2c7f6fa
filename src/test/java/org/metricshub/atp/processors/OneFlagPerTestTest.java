package org.metricshub.atp.processors;

import static org.junit.Assert.*;
import static org.metricshub.atp.AstTestSupport.*;
import static org.metricshub.atp.ast.NodeFactory.*;

import org.junit.Test;
import org.metricshub.atp.ast.Node;

public class OneFlagPerTestTest {

	@Test
	public void testPrimaryFlagSynthesized() {
		Node input = f(t("t1", onFail(setFlag("A"), setFlag("B"))));
		Node expected = f(
				t("t1", onFail(autoFlag("t1_FAILED"))),
				ifFlag("t1_FAILED", setFlag("A"), setFlag("B")));
		assertEquals(expected, new OneFlagPerTest().run(input));
	}

	@Test
	public void testExistingPrimaryFlag() {
		Node input = f(t("t1", onFail(autoFlag("t1_FAILED"), setFlag("B"), continueNode())));
		Node expected = f(
				t("t1", onFail(autoFlag("t1_FAILED"), continueNode())),
				ifFlag("t1_FAILED", setFlag("B")));
		assertEquals(expected, new OneFlagPerTest().run(input));
	}

	@Test
	public void testOnPass() {
		Node input = f(t("t1", onPass(setFlag("A"), setFlag("B"))));
		Node expected = f(
				t("t1", onPass(autoFlag("t1_PASSED"))),
				ifFlag("t1_PASSED", setFlag("A"), setFlag("B")));
		assertEquals(expected, new OneFlagPerTest().run(input));
	}

	@Test
	public void testSingleFlagUntouched() {
		Node input = f(t("t1", onFail(setFlag("A"))), t("t2", onPass(setFlag("B"))));
		assertEquals(input, new OneFlagPerTest().run(input));
	}
}
