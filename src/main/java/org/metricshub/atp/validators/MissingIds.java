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

import java.util.HashSet;
import java.util.Set;
import org.metricshub.atp.Flow;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;

/**
 * Checks that every ID referenced by a relationship condition
 * ({@code if_failed}, {@code if_ran} ...) belongs to a test or group of the
 * flow.
 */
public class MissingIds extends Validator {

	private final Set<String> ids = new HashSet<String>();

	public MissingIds(Flow flow) {
		super(flow);
	}

	@Override
	public void run(Node ast) {
		ids.clear();
		collect(ast);
		super.run(ast);
	}

	private void collect(Node node) {
		NodeType type = node.getType();
		if (type == NodeType.TEST || type == NodeType.SUB_TEST || type == NodeType.GROUP) {
			String id = node.getId();
			if (id != null) {
				ids.add(id);
			}
		}
		for (Node child : node.getChildren()) {
			collect(child);
		}
	}

	@Override
	protected void enter(Node node) {
		if (!node.getType().isRelationship()) {
			return;
		}
		for (String id : node.getGuard()) {
			if (!ids.contains(id)) {
				throw new MissingIdException(
						node.getType().getName() + " references ID " + id + " which is not defined by any test or group",
						getFlowName(),
						node.getType(),
						getPath());
			}
		}
	}
}
