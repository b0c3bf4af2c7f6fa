package org.metricshub.atp.util;

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
 * A simple container for the parameters of a single tree extraction.
 * These values have defaults, which may be changed through the setters
 * before calling {@link org.metricshub.atp.Flow#ast(AstSettings)}.
 */
public class AstSettings {

	/**
	 * Whether to lower the relationship conditions ({@code if_failed},
	 * {@code if_ran} ...) to flags; {@code true} by default.
	 */
	private boolean applyRelationships = true;

	/**
	 * Suffix appended to every ID to make them unique across flows;
	 * {@code null} (no suffix) by default.
	 */
	private String uniqueId;

	/**
	 * The target pipeline; {@link Optimization#NONE} by default.
	 */
	private Optimization optimization = Optimization.NONE;

	/**
	 * Whether to give an ID to every test and group that has none;
	 * {@code true} by default.
	 */
	private boolean addIds = true;

	/**
	 * Whether a test may set only one flag per outcome (row based targets);
	 * {@code false} by default.
	 */
	private boolean oneFlagPerTest;

	/**
	 * Whether to inline and remove auto-generated flags in the {@link Optimization#SMT}
	 * pipeline; {@code true} by default.
	 */
	private boolean optimizeFlags = true;

	public boolean isApplyRelationships() {
		return applyRelationships;
	}

	public void setApplyRelationships(boolean applyRelationships) {
		this.applyRelationships = applyRelationships;
	}

	public String getUniqueId() {
		return uniqueId;
	}

	public void setUniqueId(String uniqueId) {
		this.uniqueId = uniqueId;
	}

	public Optimization getOptimization() {
		return optimization;
	}

	/**
	 * @param optimization the target pipeline, must not be {@code null}
	 */
	public void setOptimization(Optimization optimization) {
		if (optimization == null) {
			throw new IllegalArgumentException("Optimization must not be null");
		}
		this.optimization = optimization;
	}

	public boolean isAddIds() {
		return addIds;
	}

	public void setAddIds(boolean addIds) {
		this.addIds = addIds;
	}

	public boolean isOneFlagPerTest() {
		return oneFlagPerTest;
	}

	public void setOneFlagPerTest(boolean oneFlagPerTest) {
		this.oneFlagPerTest = oneFlagPerTest;
	}

	public boolean isOptimizeFlags() {
		return optimizeFlags;
	}

	public void setOptimizeFlags(boolean optimizeFlags) {
		this.optimizeFlags = optimizeFlags;
	}

	/**
	 * Gives a multi-line description of the settings, one
	 * {@code name = value} line per parameter, for debug logging.
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("optimization = ").append(getOptimization()).append(newLine);
		desc.append("applyRelationships = ").append(isApplyRelationships()).append(newLine);
		desc.append("uniqueId = ").append(getUniqueId()).append(newLine);
		desc.append("addIds = ").append(isAddIds()).append(newLine);
		desc.append("oneFlagPerTest = ").append(isOneFlagPerTest()).append(newLine);
		desc.append("optimizeFlags = ").append(isOptimizeFlags()).append(newLine);

		return desc.toString();
	}
}
