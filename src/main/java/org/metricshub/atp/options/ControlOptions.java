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

/**
 * Options of the flow control calls ({@code if_enabled}, {@code if_failed}
 * ...) when they are not given a block: the {@code then} and
 * {@code otherwise} branches.
 */
public class ControlOptions extends FlowOptions<ControlOptions> {

	private Runnable then;
	private Runnable otherwise;
	private boolean or;

	@Override
	protected ControlOptions self() {
		return this;
	}

	public ControlOptions then(Runnable block) {
		this.then = block;
		return this;
	}

	/**
	 * @param block construction calls that become the {@code else} branch
	 * @return these options
	 */
	public ControlOptions otherwise(Runnable block) {
		this.otherwise = block;
		return this;
	}

	/**
	 * Legacy override of the enable conditions: when {@code true} the block
	 * runs unconditionally.
	 *
	 * @param value override flag
	 * @return these options
	 */
	public ControlOptions or(boolean value) {
		this.or = value;
		return this;
	}

	public Runnable getThen() {
		return then;
	}

	public Runnable getOtherwise() {
		return otherwise;
	}

	public boolean isOr() {
		return or;
	}
}
