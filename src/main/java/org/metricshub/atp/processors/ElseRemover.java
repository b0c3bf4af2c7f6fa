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

import java.util.Arrays;
import java.util.List;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.util.AtpLogger;
import org.slf4j.Logger;

/**
 * Removes the else branches, which row based targets cannot express:
 *
 * <pre>
 * if_enabled [v] { X } else { Y }   -&gt;   if_enabled [v] { X }
 *                                        unless_enabled [v] { Y }
 * </pre>
 *
 * When {@code X} may change the outcome of the guard and {@code Y} may not,
 * the negated condition is emitted first.
 */
public class ElseRemover extends Processor {

	private static final Logger LOG = AtpLogger.getLogger(ElseRemover.class);

	@Override
	protected Node process(Node node) {
		if (!node.getType().isGuarded() || node.getElse() == null) {
			return processChildren(node);
		}
		List<String> guard = node.getGuard();
		List<Node> body = processAll(node.getBody());
		List<Node> otherwise = processAll(node.getElse().getChildren());
		Node positive = NodeFactory.condition(node.getType(), guard, body);
		Node negative = NodeFactory.condition(node.getType().negate(), guard, otherwise);

		boolean bodyModifies = FlowAnalysis.modifies(node.getType(), guard, body);
		boolean elseModifies = FlowAnalysis.modifies(node.getType(), guard, otherwise);
		if (bodyModifies && !elseModifies) {
			return NodeFactory.temp(Arrays.asList(negative, positive));
		}
		if (bodyModifies) {
			LOG.warn("Both branches of {} {} change its outcome, the else branch may not run as expected",
					node.getType().getName(), guard);
		}
		return NodeFactory.temp(Arrays.asList(positive, negative));
	}
}
