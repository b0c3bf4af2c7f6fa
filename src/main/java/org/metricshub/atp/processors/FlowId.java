package org.metricshub.atp.processors;

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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.ast.NodeType;

/**
 * Appends a suffix to every ID of a flow, and to every ID named by a
 * relationship condition, so that IDs stay unique when several flows are
 * combined in one program.
 */
public class FlowId extends Processor {

	private final String suffix;

	/**
	 * @param uniqueId the suffix, appended as {@code <id>_<uniqueId>}
	 */
	public FlowId(String uniqueId) {
		this.suffix = "_" + uniqueId;
	}

	@Override
	protected Node process(Node node) {
		NodeType type = node.getType();
		if (type == NodeType.ID) {
			return NodeFactory.id(node.getStringValue() + suffix);
		}
		if (type.isRelationship()) {
			List<String> ids = new ArrayList<String>();
			for (String id : node.getGuard()) {
				ids.add(id + suffix);
			}
			return NodeFactory.condition(type, ids, processAll(node.getChildren()));
		}
		return processChildren(node);
	}
}
