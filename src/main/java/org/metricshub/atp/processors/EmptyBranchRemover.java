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

import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.ast.NodeType;

/**
 * Removes what a pass may have left empty: {@code on_fail}, {@code on_pass}
 * and {@code else} nodes without children, conditions without a body and
 * groups without members. A condition with an empty body but a non empty else
 * branch becomes the negated condition over the else body, when that negation
 * is exact. A relationship condition such as {@code if_failed} is kept as it
 * is, since {@code if_passed} does not hold for a test that did not run.
 * <p>
 * Running it twice gives the same tree as running it once.
 */
public class EmptyBranchRemover extends Processor {

	@Override
	protected Node process(Node node) {
		Node processed = processChildren(node);
		NodeType type = processed.getType();
		switch (type) {
		case ON_FAIL:
		case ON_PASS:
		case ELSE:
			return processed.getChildren().isEmpty() ? null : processed;
		case GROUP:
			return FlowAnalysis.groupBody(processed).isEmpty() ? null : processed;
		default:
			if (!type.isGuarded() || !processed.getBody().isEmpty()) {
				return processed;
			}
			Node otherwise = processed.getElse();
			if (otherwise == null) {
				return null;
			}
			if (!FlowAnalysis.hasExactComplement(type)) {
				return processed;
			}
			return NodeFactory.condition(type.negate(), processed.getGuard(), otherwise.getChildren());
		}
	}
}
