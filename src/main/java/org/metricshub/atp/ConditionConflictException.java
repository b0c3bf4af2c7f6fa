package org.metricshub.atp;

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

import org.metricshub.atp.ast.NodeType;

/**
 * Raised when one options structure supplies two condition aliases that
 * resolve to the same canonical condition kind, e.g. {@code enabled} and
 * {@code if_enabled}.
 */
public class ConditionConflictException extends FlowDefinitionException {

	private static final long serialVersionUID = 1L;

	private final NodeType kind;

	/**
	 * @param kind the canonical condition kind given twice
	 */
	public ConditionConflictException(NodeType kind) {
		super("Multiple values assigned to flow condition " + kind.getName());
		this.kind = kind;
	}

	/**
	 * @return the canonical condition kind given twice
	 */
	public NodeType getKind() {
		return kind;
	}
}
