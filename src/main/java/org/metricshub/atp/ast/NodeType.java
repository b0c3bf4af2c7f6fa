package org.metricshub.atp.ast;

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

import java.util.Locale;

/**
 * The closed set of node kinds an ATP syntax tree is made of.
 * <p>
 * Besides the structural kinds (flow, test, group, ...) the set contains the
 * canonical condition kinds, i.e. the nodes that gate the execution of their
 * body on a guard.
 *
 * @see Node
 */
public enum NodeType {
	FLOW,
	NAME,
	TEST,
	OBJECT,
	NUMBER,
	ID,
	LEVEL,
	LIMIT,
	PIN,
	PATTERN,
	META,
	ATTRIBUTE,
	SUB_TEST,
	ON_FAIL,
	ON_PASS,
	GROUP,
	LOG,
	ENABLE,
	DISABLE,
	RENDER,
	CONTINUE,
	SET_FLAG,
	SET_RESULT,
	BIN,
	SOFTBIN,
	CZ,
	VOLATILE,
	FLAG,

	IF_ENABLED,
	UNLESS_ENABLED,
	IF_FAILED,
	IF_PASSED,
	IF_ANY_FAILED,
	IF_ALL_FAILED,
	IF_ANY_PASSED,
	IF_ALL_PASSED,
	IF_RAN,
	UNLESS_RAN,
	IF_JOB,
	UNLESS_JOB,
	IF_FLAG,
	UNLESS_FLAG,

	ELSE,
	TEMP;

	/**
	 * @return the lower case name used in dumps and in the condition alias table,
	 *         e.g. {@code if_enabled}
	 */
	public String getName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Returns {@code true} for every kind that wraps other nodes in a condition,
	 * including {@link #GROUP} which may be applied like a condition.
	 *
	 * @return whether nodes of this kind are condition nodes
	 */
	public boolean isCondition() {
		return this == GROUP || isGuarded();
	}

	/**
	 * @return {@code true} for condition kinds that carry a guard value
	 *         (every condition kind except {@link #GROUP})
	 */
	public boolean isGuarded() {
		switch (this) {
		case IF_ENABLED:
		case UNLESS_ENABLED:
		case IF_FAILED:
		case IF_PASSED:
		case IF_ANY_FAILED:
		case IF_ALL_FAILED:
		case IF_ANY_PASSED:
		case IF_ALL_PASSED:
		case IF_RAN:
		case UNLESS_RAN:
		case IF_JOB:
		case UNLESS_JOB:
		case IF_FLAG:
		case UNLESS_FLAG:
			return true;
		default:
			return false;
		}
	}

	/**
	 * @return {@code true} for condition kinds whose guard names the ID of a
	 *         test or group, e.g. {@code if_failed}
	 */
	public boolean isRelationship() {
		switch (this) {
		case IF_FAILED:
		case IF_PASSED:
		case IF_ANY_FAILED:
		case IF_ALL_FAILED:
		case IF_ANY_PASSED:
		case IF_ALL_PASSED:
		case IF_RAN:
		case UNLESS_RAN:
			return true;
		default:
			return false;
		}
	}

	/**
	 * @return {@code true} for {@code if_flag} and {@code unless_flag}
	 */
	public boolean isFlagCondition() {
		return this == IF_FLAG || this == UNLESS_FLAG;
	}

	/**
	 * @return {@code true} for {@code if_enabled} and {@code unless_enabled}
	 */
	public boolean isEnableCondition() {
		return this == IF_ENABLED || this == UNLESS_ENABLED;
	}

	/**
	 * @return {@code true} for {@code if_job} and {@code unless_job}
	 */
	public boolean isJobCondition() {
		return this == IF_JOB || this == UNLESS_JOB;
	}

	/**
	 * Returns {@code true} when a list guard of this kind requires every member
	 * to hold, {@code false} when any member is enough (or, for the
	 * {@code unless} kinds, when none may hold).
	 *
	 * @return whether the guard list is a conjunction
	 */
	public boolean isAllOf() {
		return this == IF_ALL_FAILED || this == IF_ALL_PASSED;
	}

	/**
	 * @return {@code true} for the kinds that hold when none of their guard
	 *         members hold
	 */
	public boolean isNoneOf() {
		switch (this) {
		case UNLESS_ENABLED:
		case UNLESS_RAN:
		case UNLESS_JOB:
		case UNLESS_FLAG:
			return true;
		default:
			return false;
		}
	}

	/**
	 * Returns the condition kind that holds exactly when this one does not, for
	 * the same guard.
	 * <p>
	 * The pass/fail kinds assume the referenced test ran, which is how a row
	 * based target interprets an else branch.
	 *
	 * @return the negated condition kind
	 * @throws IllegalStateException if this kind is not a guarded condition
	 */
	public NodeType negate() {
		switch (this) {
		case IF_ENABLED:
			return UNLESS_ENABLED;
		case UNLESS_ENABLED:
			return IF_ENABLED;
		case IF_FAILED:
			return IF_PASSED;
		case IF_PASSED:
			return IF_FAILED;
		case IF_ANY_FAILED:
			return IF_ALL_PASSED;
		case IF_ALL_FAILED:
			return IF_ANY_PASSED;
		case IF_ANY_PASSED:
			return IF_ALL_FAILED;
		case IF_ALL_PASSED:
			return IF_ANY_FAILED;
		case IF_RAN:
			return UNLESS_RAN;
		case UNLESS_RAN:
			return IF_RAN;
		case IF_JOB:
			return UNLESS_JOB;
		case UNLESS_JOB:
			return IF_JOB;
		case IF_FLAG:
			return UNLESS_FLAG;
		case UNLESS_FLAG:
			return IF_FLAG;
		default:
			throw new IllegalStateException("Node type " + getName() + " cannot be negated");
		}
	}

	/**
	 * @param name lower case node type name, e.g. {@code if_flag}
	 * @return the matching node type
	 * @throws IllegalArgumentException if no node type has this name
	 */
	public static NodeType fromName(String name) {
		return valueOf(name.toUpperCase(Locale.ROOT));
	}
}
