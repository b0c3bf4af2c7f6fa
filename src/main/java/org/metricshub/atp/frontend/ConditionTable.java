package org.metricshub.atp.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * ATP
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.atp.ConditionConflictException;
import org.metricshub.atp.FlowDefinitionException;
import org.metricshub.atp.ast.NodeType;

/**
 * Maps every user-facing condition alias to its canonical condition kind.
 * <p>
 * The table is checked once, when a flow construction call is made; the rest
 * of the compiler only ever sees the canonical kinds.
 */
public final class ConditionTable {

	private static final Map<String, NodeType> ALIASES;

	static {
		Map<String, NodeType> aliases = new LinkedHashMap<String, NodeType>();
		alias(aliases, NodeType.IF_ENABLED, "if_enabled", "if_enable", "enabled", "enable_flag", "enable");
		alias(aliases, NodeType.UNLESS_ENABLED, "unless_enabled", "not_enabled", "disabled", "disable", "unless_enable");
		alias(aliases, NodeType.IF_FAILED, "if_failed", "unless_passed", "failed");
		alias(aliases, NodeType.IF_PASSED, "if_passed", "unless_failed", "passed");
		alias(aliases, NodeType.IF_ANY_FAILED, "if_any_failed", "unless_all_passed");
		alias(aliases, NodeType.IF_ALL_FAILED, "if_all_failed", "unless_any_passed");
		alias(aliases, NodeType.IF_ANY_PASSED, "if_any_passed", "unless_all_failed");
		alias(aliases, NodeType.IF_ALL_PASSED, "if_all_passed", "unless_any_failed");
		alias(aliases, NodeType.IF_RAN, "if_ran", "if_executed");
		alias(aliases, NodeType.UNLESS_RAN, "unless_ran", "unless_executed");
		alias(aliases, NodeType.IF_JOB, "job", "jobs", "if_job", "if_jobs");
		alias(aliases, NodeType.UNLESS_JOB, "unless_job", "unless_jobs");
		alias(aliases, NodeType.IF_FLAG, "if_flag");
		alias(aliases, NodeType.UNLESS_FLAG, "unless_flag");
		alias(aliases, NodeType.GROUP, "group");
		ALIASES = Collections.unmodifiableMap(aliases);
	}

	private ConditionTable() {
		// utility class
	}

	private static void alias(Map<String, NodeType> aliases, NodeType kind, String... names) {
		for (String name : names) {
			aliases.put(name, kind);
		}
	}

	/**
	 * @return every alias with its canonical kind, in declaration order
	 */
	public static Map<String, NodeType> getAliases() {
		return ALIASES;
	}

	/**
	 * @return the canonical condition kinds
	 */
	public static Set<NodeType> getKinds() {
		return EnumSet.copyOf(ALIASES.values());
	}

	/**
	 * @param alias a condition alias, e.g. {@code enabled}
	 * @return {@code true} if the alias is known
	 */
	public static boolean isAlias(String alias) {
		return ALIASES.containsKey(alias);
	}

	/**
	 * @param alias a condition alias, e.g. {@code enabled}
	 * @return the canonical kind, e.g. {@link NodeType#IF_ENABLED}
	 * @throws FlowDefinitionException if the alias is unknown
	 */
	public static NodeType resolve(String alias) {
		NodeType kind = ALIASES.get(alias);
		if (kind == null) {
			throw new FlowDefinitionException("Unknown flow condition '" + alias + "'");
		}
		return kind;
	}

	/**
	 * Resolves the condition aliases of one construction call, keeping the order
	 * in which they were supplied.
	 *
	 * @param conditions alias and guard pairs
	 * @return canonical kind and guard pairs
	 * @throws ConditionConflictException if two aliases resolve to the same kind
	 */
	public static List<Map.Entry<NodeType, Object>> extract(List<Map.Entry<String, Object>> conditions) {
		List<Map.Entry<NodeType, Object>> result = new ArrayList<Map.Entry<NodeType, Object>>(conditions.size());
		Set<NodeType> seen = EnumSet.noneOf(NodeType.class);
		for (Map.Entry<String, Object> condition : conditions) {
			NodeType kind = resolve(condition.getKey());
			if (!seen.add(kind)) {
				throw new ConditionConflictException(kind);
			}
			result.add(new SimpleImmutableEntry<NodeType, Object>(kind, condition.getValue()));
		}
		return result;
	}
}
