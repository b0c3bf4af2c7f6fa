package org.metricshub.atp;

import static org.junit.Assert.*;
import static org.metricshub.atp.AstTestSupport.*;
import static org.metricshub.atp.ast.NodeFactory.condition;
import static org.metricshub.atp.ast.NodeFactory.continueNode;
import static org.metricshub.atp.ast.NodeFactory.elseNode;
import static org.metricshub.atp.ast.NodeFactory.group;
import static org.metricshub.atp.ast.NodeFactory.id;
import static org.metricshub.atp.ast.NodeFactory.log;
import static org.metricshub.atp.ast.NodeFactory.object;
import static org.metricshub.atp.ast.NodeFactory.onFail;
import static org.metricshub.atp.ast.NodeFactory.render;

import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;
import org.metricshub.atp.options.ActionOptions;
import org.metricshub.atp.options.ControlOptions;
import org.metricshub.atp.options.GroupOptions;
import org.metricshub.atp.options.TestOptions;
import org.metricshub.atp.processors.EmptyBranchRemover;
import org.metricshub.atp.util.AstSettings;
import org.metricshub.atp.util.Optimization;
import org.metricshub.atp.validators.DuplicateIdException;
import org.metricshub.atp.validators.MissingIdException;

public class FlowAstTest {

	private Flow flow;
	private AstSettings settings;

	@Before
	public void setUp() {
		flow = new Program("prog").flow("f");
		settings = new AstSettings();
	}

	private void failedDependency() {
		flow.test("t1", new TestOptions().id("t1").onFail(new ActionOptions().bin(5)));
		flow.test("t2", new TestOptions().ifFailed("t1").bin(6));
	}

	private void mixedFlow() {
		flow.group("G", new GroupOptions().id("g1").onFail(new ActionOptions().bin(10)), () -> {
			flow.test("t1", new TestOptions().id("t1"));
		});
		flow.ifEnabled("v", new ControlOptions()
				.then(() -> flow.test("t2", new TestOptions().id("t2")))
				.otherwise(() -> flow.test("t3", new TestOptions().id("t3"))), null);
		flow.test("t4", new TestOptions().id("t4").onFail(new ActionOptions().render("x")));
	}

	@Test
	public void testNone() {
		failedDependency();
		Node expected = f(
				t("t1", onFail(failBin(5))),
				condition(NodeType.IF_FAILED, "t1", t("t2", onFail(failBin(6)))));
		assertEquals(expected, flow.ast(settings));
	}

	@Test
	public void testSmt() {
		failedDependency();
		settings.setOptimization(Optimization.SMT);
		Node expected = f(
				t("t1", onFail(failBin(5), autoFlag("t1_FAILED"), continueNode())),
				ifFlag("t1_FAILED", t("t2", onFail(failBin(6)))));
		Node ast = flow.ast(settings);
		assertEquals(expected, ast);
		assertFalse(ast.contains(NodeType.IF_FAILED));
	}

	@Test
	public void testSmtWithoutRelationships() {
		failedDependency();
		settings.setOptimization(Optimization.SMT);
		settings.setApplyRelationships(false);
		assertTrue(flow.ast(settings).contains(NodeType.IF_FAILED));
	}

	@Test
	public void testSmtRemovesAllRelationships() {
		flow.test("t1", new TestOptions().id("t1"));
		flow.test("t2", new TestOptions().id("t2"));
		flow.ifPassed("t1", () -> flow.log("passed"));
		flow.ifAllFailed(Arrays.asList("t1", "t2"), () -> flow.log("all failed"));
		flow.ifAnyPassed(Arrays.asList("t1", "t2"), () -> flow.log("any passed"));
		flow.ifRan("t2", () -> flow.log("ran"));
		flow.unlessRan("t1", () -> flow.log("not ran"));
		settings.setOptimization(Optimization.SMT);

		Node ast = flow.ast(settings);
		for (NodeType type : NodeType.values()) {
			if (type.isRelationship()) {
				assertFalse(type.getName(), ast.contains(type));
			}
		}
	}

	@Test
	public void testIgxl() {
		mixedFlow();
		settings.setOptimization(Optimization.IGXL);
		Node expected = f(
				group("G", id("g1"), t("t1", onFail(autoFlag("g1_FAILED")))),
				ifFlag("g1_FAILED", failBin(10)),
				condition(NodeType.IF_ENABLED, "v", t("t2")),
				condition(NodeType.UNLESS_ENABLED, "v", t("t3")),
				t("t4", onFail(autoFlag("t4_FAILED"), continueNode())),
				ifFlag("t4_FAILED", render("x")));
		Node ast = flow.ast(settings);
		assertEquals(expected, ast);
		assertFalse(ast.contains(NodeType.ELSE));
	}

	@Test
	public void testFlat() {
		mixedFlow();
		settings.setOptimization(Optimization.FLAT);
		Node expected = f(
				t("t1", onFail(autoFlag("g1_FAILED"))),
				ifFlag("g1_FAILED", failBin(10)),
				condition(NodeType.IF_ENABLED, "v", t("t2")),
				condition(NodeType.UNLESS_ENABLED, "v", t("t3")),
				t("t4"),
				condition(NodeType.IF_FAILED, "t4", render("x")));
		Node ast = flow.ast(settings);
		assertEquals(expected, ast);

		for (Node child : ast.getChildren().subList(1, ast.getChildren().size())) {
			Node node = child;
			while (node.getType().isGuarded()) {
				assertEquals(1, node.getChildren().size());
				node = node.getChildren().get(0);
			}
			assertNotEquals(NodeType.GROUP, node.getType());
		}
	}

	@Test
	public void testUniqueId() {
		failedDependency();
		settings.setUniqueId("u");
		Node ast = flow.ast(settings);
		Node expected = f(
				new Node(NodeType.TEST, null, Arrays.asList(
						object("t1"),
						id("t1_u"),
						onFail(failBin(5)))),
				condition(NodeType.IF_FAILED, "t1_u", new Node(NodeType.TEST, null, Arrays.asList(
						object("t2"),
						id("t2_u"),
						onFail(failBin(6))))));
		assertEquals(expected, ast);
	}

	@Test
	public void testWithoutIds() {
		flow.test("a");
		settings.setAddIds(false);
		assertEquals(f(bare("a")), flow.ast(settings));
	}

	@Test
	public void testRawUntouched() {
		mixedFlow();
		Node raw = flow.raw();
		settings.setOptimization(Optimization.IGXL);
		flow.ast(settings);
		assertEquals(raw, flow.raw());
	}

	@Test
	public void testEmptyBranchesRemoved() {
		flow.ifEnabled("v", () -> {});
		flow.group("G", () -> {});
		flow.log("end");
		for (Optimization optimization : Optimization.values()) {
			settings.setOptimization(optimization);
			Node ast = flow.ast(settings);
			assertEquals(optimization.name(), f(log("end")), ast);
			assertEquals(ast, new EmptyBranchRemover().run(ast));
		}
	}

	@Test
	public void testIfElseCombinedBySmt() {
		flow.ifEnabled("v", new ControlOptions()
				.then(() -> flow.log("on"))
				.otherwise(() -> flow.log("off")), null);
		settings.setOptimization(Optimization.SMT);
		Node expected = f(condition(NodeType.IF_ENABLED, "v", log("on"), elseNode(log("off"))));
		assertEquals(expected, flow.ast(settings));
	}

	@Test(expected = DuplicateIdException.class)
	public void testDuplicateId() {
		flow.test("a", new TestOptions().id("t1"));
		flow.test("b", new TestOptions().id("t1"));
		flow.ast(settings);
	}

	@Test(expected = MissingIdException.class)
	public void testMissingId() {
		flow.test("a", new TestOptions().ifFailed("nope"));
		flow.ast(settings);
	}

	@Test
	public void testElseOnlyRelationshipAcrossPipelines() {
		flow.test("t1", new TestOptions().id("t1").ifEnabled("x"));
		flow.ifFailed("t1", new ControlOptions().otherwise(() -> flow.log("not failed")), null);

		Node none = flow.ast(settings);
		assertEquals(
				f(
						condition(NodeType.IF_ENABLED, "x", t("t1")),
						condition(NodeType.IF_FAILED, "t1", elseNode(log("not failed")))),
				none);

		settings.setOptimization(Optimization.SMT);
		assertEquals(
				f(
						condition(NodeType.IF_ENABLED, "x", t("t1", onFail(autoFlag("t1_FAILED"), continueNode()))),
						unlessFlag("t1_FAILED", log("not failed"))),
				flow.ast(settings));
	}

	@Test
	public void testNoInexactNegationIntroduced() {
		flow.test("t1", new TestOptions().id("t1").ifEnabled("x"));
		flow.test("t2", new TestOptions().id("t2"));
		flow.ifFailed("t1", new ControlOptions().otherwise(() -> flow.log("a")), null);
		flow.ifAnyFailed(Arrays.asList("t1", "t2"), new ControlOptions().otherwise(() -> flow.log("b")), null);
		flow.ifAllFailed(Arrays.asList("t1", "t2"), new ControlOptions().otherwise(() -> flow.log("c")), null);
		Node raw = flow.raw();

		for (Optimization optimization : new Optimization[] { Optimization.NONE, Optimization.SMT }) {
			settings.setOptimization(optimization);
			Node ast = flow.ast(settings);
			for (NodeType type : NodeType.values()) {
				if (type.isRelationship() && type != NodeType.IF_RAN && type != NodeType.UNLESS_RAN) {
					assertFalse(
							optimization + " introduced " + type.getName(),
							ast.contains(type) && !raw.contains(type));
				}
			}
		}
	}

	@Test
	public void testReferencedGroupsKeptApartAcrossPipelines() {
		flow.group("G", new GroupOptions().id("g1"), () -> flow.test("t1", new TestOptions().id("t1")));
		flow.group("G", new GroupOptions().id("g2"), () -> flow.test("t2", new TestOptions().id("t2")));
		flow.ifFailed("g1", () -> flow.log("g1 failed"));

		for (Optimization optimization : new Optimization[] { Optimization.NONE, Optimization.SMT }) {
			settings.setOptimization(optimization);
			Node ast = flow.ast(settings);
			assertEquals(optimization.name(), 2, ast.findAll(NodeType.GROUP).size());
		}
	}
}
