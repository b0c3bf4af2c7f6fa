package org.metricshub.atp.validators;

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

import org.metricshub.atp.AtpException;
import org.metricshub.atp.ast.NodeType;

/**
 * Raised when a flow tree breaks one of the rules checked before it is
 * processed. The exception tells which flow and which node is at fault.
 */
public class ValidationException extends AtpException {

	private static final long serialVersionUID = 1L;

	private final String flowName;
	private final NodeType nodeType;
	private final String path;

	/**
	 * @param message what is wrong
	 * @param flowName name of the flow being validated
	 * @param nodeType type of the offending node
	 * @param path location of the offending node, e.g. {@code flow/group[RAM]/test[t2]}
	 */
	public ValidationException(String message, String flowName, NodeType nodeType, String path) {
		super(message + " (flow " + flowName + ", at " + path + ")");
		this.flowName = flowName;
		this.nodeType = nodeType;
		this.path = path;
	}

	public String getFlowName() {
		return flowName;
	}

	public NodeType getNodeType() {
		return nodeType;
	}

	public String getPath() {
		return path;
	}
}
