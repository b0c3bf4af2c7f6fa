package org.metricshub.atp.frontend;

import static org.junit.Assert.*;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.metricshub.atp.ConditionConflictException;
import org.metricshub.atp.FlowDefinitionException;
import org.metricshub.atp.ast.NodeType;

public class ConditionTableTest {

	private static Map.Entry<String, Object> entry(String alias, Object value) {
		return new SimpleImmutableEntry<String, Object>(alias, value);
	}

	@Test
	public void testAliasCount() {
		assertEquals(37, ConditionTable.getAliases().size());
		assertEquals(15, ConditionTable.getKinds().size());
	}

	@Test
	public void testResolve() {
		assertEquals(NodeType.IF_ENABLED, ConditionTable.resolve("enabled"));
		assertEquals(NodeType.IF_ENABLED, ConditionTable.resolve("enable_flag"));
		assertEquals(NodeType.UNLESS_ENABLED, ConditionTable.resolve("disabled"));
		assertEquals(NodeType.IF_FAILED, ConditionTable.resolve("unless_passed"));
		assertEquals(NodeType.IF_PASSED, ConditionTable.resolve("unless_failed"));
		assertEquals(NodeType.IF_ALL_PASSED, ConditionTable.resolve("unless_any_failed"));
		assertEquals(NodeType.IF_RAN, ConditionTable.resolve("if_executed"));
		assertEquals(NodeType.IF_JOB, ConditionTable.resolve("jobs"));
		assertEquals(NodeType.UNLESS_JOB, ConditionTable.resolve("unless_jobs"));
		assertEquals(NodeType.GROUP, ConditionTable.resolve("group"));
		assertTrue(ConditionTable.isAlias("if_flag"));
		assertFalse(ConditionTable.isAlias("if_flags"));
	}

	@Test(expected = FlowDefinitionException.class)
	public void testUnknownAlias() {
		ConditionTable.resolve("when");
	}

	@Test
	public void testExtractKeepsOrder() {
		List<Map.Entry<String, Object>> conditions = Arrays.asList(entry("job", "p1"), entry("enabled", "bitmap"));
		List<Map.Entry<NodeType, Object>> kinds = ConditionTable.extract(conditions);
		assertEquals(2, kinds.size());
		assertEquals(NodeType.IF_JOB, kinds.get(0).getKey());
		assertEquals("p1", kinds.get(0).getValue());
		assertEquals(NodeType.IF_ENABLED, kinds.get(1).getKey());
	}

	@Test
	public void testConflictingAliases() {
		List<Map.Entry<String, Object>> conditions = new ArrayList<Map.Entry<String, Object>>();
		conditions.add(entry("enabled", "a"));
		conditions.add(entry("if_enabled", "b"));
		try {
			ConditionTable.extract(conditions);
			fail("Two aliases of the same kind must be rejected");
		} catch (ConditionConflictException e) {
			assertEquals(NodeType.IF_ENABLED, e.getKind());
			assertEquals("Multiple values assigned to flow condition if_enabled", e.getMessage());
		}
	}
}
