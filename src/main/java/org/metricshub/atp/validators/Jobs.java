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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.metricshub.atp.Flow;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeType;

/**
 * Checks the job conditions of a flow: job names must not be negated, and a
 * nested job condition must not contradict the job conditions around it, which
 * would make its body unreachable.
 * <p>
 * Job names are compared ignoring case.
 */
public class Jobs extends Validator {

	/**
	 * The jobs that may be active at some point of the tree: {@code allowed}
	 * is {@code null} when no enclosing {@code if_job} restricts them.
	 */
	private static final class Scope {
		private final Set<String> allowed;
		private final Set<String> excluded;

		private Scope(Set<String> allowed, Set<String> excluded) {
			this.allowed = allowed;
			this.excluded = excluded;
		}
	}

	private final Deque<Scope> scopes = new ArrayDeque<Scope>();
	private final Map<Node, Scope> elseScopes = new IdentityHashMap<Node, Scope>();
	private final Set<Node> enteredElses = Collections.newSetFromMap(new IdentityHashMap<Node, Boolean>());

	public Jobs(Flow flow) {
		super(flow);
	}

	@Override
	public void run(Node ast) {
		scopes.clear();
		elseScopes.clear();
		enteredElses.clear();
		scopes.push(new Scope(null, new LinkedHashSet<String>()));
		super.run(ast);
	}

	@Override
	protected void enter(Node node) {
		NodeType type = node.getType();
		if (type == NodeType.ELSE) {
			Scope scope = elseScopes.remove(node);
			if (scope != null) {
				scopes.push(scope);
				enteredElses.add(node);
			}
			return;
		}
		if (!type.isJobCondition()) {
			return;
		}
		Set<String> jobs = new LinkedHashSet<String>();
		for (String job : node.getGuard()) {
			if (job.startsWith("!")) {
				throw error(node, "Job names must not be negated, use unless_job instead of " + type.getName() + " " + job);
			}
			jobs.add(job.toUpperCase(Locale.ROOT));
		}
		Scope scope = scopes.peek();
		Scope body;
		Scope otherwise;
		if (type == NodeType.IF_JOB) {
			if (scope.allowed != null && !scope.allowed.containsAll(jobs)) {
				throw error(node, "if_job " + String.join(", ", jobs)
						+ " names jobs outside of the enclosing if_job " + String.join(", ", scope.allowed));
			}
			for (String job : jobs) {
				if (scope.excluded.contains(job)) {
					throw error(node, "if_job " + job + " is excluded by an enclosing unless_job");
				}
			}
			body = new Scope(jobs, scope.excluded);
			otherwise = new Scope(scope.allowed, union(scope.excluded, jobs));
		} else {
			Set<String> excluded = union(scope.excluded, jobs);
			if (scope.allowed != null && excluded.containsAll(scope.allowed)) {
				throw error(node, "unless_job " + String.join(", ", jobs)
						+ " excludes every job allowed by the enclosing if_job " + String.join(", ", scope.allowed));
			}
			body = new Scope(scope.allowed, excluded);
			Set<String> allowed = new LinkedHashSet<String>(jobs);
			if (scope.allowed != null) {
				allowed.retainAll(scope.allowed);
			}
			otherwise = new Scope(allowed, scope.excluded);
		}
		Node elseNode = node.getElse();
		if (elseNode != null) {
			elseScopes.put(elseNode, otherwise);
		}
		scopes.push(body);
	}

	@Override
	protected void leave(Node node) {
		if (node.getType().isJobCondition() || node.getType() == NodeType.ELSE && enteredElses.remove(node)) {
			scopes.pop();
		}
	}

	private static Set<String> union(Set<String> a, Set<String> b) {
		Set<String> result = new LinkedHashSet<String>(a);
		result.addAll(b);
		return result;
	}

	private JobConflictException error(Node node, String message) {
		return new JobConflictException(message, getFlowName(), node.getType(), getPath());
	}
}
