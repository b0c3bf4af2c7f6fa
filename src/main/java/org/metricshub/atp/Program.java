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

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A test program: a named set of flows.
 * <p>
 * Flows are created on first access and cached by name.
 */
public class Program implements Serializable {

	private static final long serialVersionUID = -6280743591302861227L;

	private final String name;
	private final Map<String, Flow> flows = new LinkedHashMap<String, Flow>();

	public Program(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	/**
	 * Returns the flow of the given name, creating it if needed.
	 *
	 * @param flowName flow name
	 * @return the flow
	 */
	public Flow flow(String flowName) {
		Flow flow = flows.get(flowName);
		if (flow == null) {
			flow = new Flow(this, flowName);
			flows.put(flowName, flow);
		}
		return flow;
	}

	/**
	 * @return the flows created so far, by name, in creation order
	 */
	public Map<String, Flow> getFlows() {
		return Collections.unmodifiableMap(flows);
	}
}
