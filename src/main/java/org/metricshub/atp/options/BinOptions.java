package org.metricshub.atp.options;

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

import org.metricshub.atp.ast.NodeFactory;

/**
 * Options of the {@code bin} and {@code pass} calls. The inherited
 * {@link #description(String)} is the bin description.
 */
public class BinOptions extends FlowOptions<BinOptions> {

	private String type;
	private Object softbin;
	private String softbinDescription;

	@Override
	protected BinOptions self() {
		return this;
	}

	/**
	 * Sets the result type; defaults to {@code fail}.
	 *
	 * @param resultType {@link NodeFactory#PASS} or {@link NodeFactory#FAIL}
	 * @return these options
	 */
	public BinOptions type(String resultType) {
		if (!NodeFactory.PASS.equals(resultType) && !NodeFactory.FAIL.equals(resultType)) {
			throw new IllegalArgumentException("A result type must be pass or fail, not " + resultType);
		}
		this.type = resultType;
		return this;
	}

	public BinOptions softbin(Object number) {
		this.softbin = number;
		return this;
	}

	public BinOptions softbinDescription(String text) {
		this.softbinDescription = text;
		return this;
	}

	public String getType() {
		return type == null ? NodeFactory.FAIL : type;
	}

	public Object getSoftbin() {
		return softbin;
	}

	public String getSoftbinDescription() {
		return softbinDescription;
	}
}
