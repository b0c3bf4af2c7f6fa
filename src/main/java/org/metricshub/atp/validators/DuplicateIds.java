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

import java.util.HashMap;
import java.util.Map;
import org.metricshub.atp.Flow;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;

/**
 * Checks that no two tests or groups carry the same ID.
 */
public class DuplicateIds extends Validator {

	private final Map<String, String> ids = new HashMap<String, String>();

	public DuplicateIds(Flow flow) {
		super(flow);
	}

	@Override
	public void run(Node ast) {
		ids.clear();
		super.run(ast);
	}

	@Override
	protected void enter(Node node) {
		if (node.getType() != NodeType.ID) {
			return;
		}
		String id = node.getStringValue();
		String first = ids.get(id);
		if (first != null) {
			throw new DuplicateIdException(
					"ID " + id + " is used more than once, first by " + first,
					getFlowName(),
					NodeType.ID,
					getPath());
		}
		ids.put(id, getPath());
	}
}
