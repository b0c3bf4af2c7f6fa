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
 * Options of the {@code group} call.
 */
public class GroupOptions extends FlowOptions<GroupOptions> {

	private String id;
	private ActionOptions onFail;
	private Runnable onFailBlock;
	private ActionOptions onPass;
	private Runnable onPassBlock;

	@Override
	protected GroupOptions self() {
		return this;
	}

	public GroupOptions id(String groupId) {
		this.id = groupId;
		return this;
	}

	public GroupOptions onFail(ActionOptions actions) {
		this.onFail = actions;
		return this;
	}

	/**
	 * @param block construction calls to run when any member fails
	 * @return these options
	 */
	public GroupOptions onFail(Runnable block) {
		this.onFailBlock = block;
		return this;
	}

	public GroupOptions onPass(ActionOptions actions) {
		this.onPass = actions;
		return this;
	}

	/**
	 * @param block construction calls to run when every member passes
	 * @return these options
	 */
	public GroupOptions onPass(Runnable block) {
		this.onPassBlock = block;
		return this;
	}

	public String getId() {
		return id;
	}

	public ActionOptions getOnFail() {
		return onFail;
	}

	public Runnable getOnFailBlock() {
		return onFailBlock;
	}

	public ActionOptions getOnPass() {
		return onPass;
	}

	public Runnable getOnPassBlock() {
		return onPassBlock;
	}
}
