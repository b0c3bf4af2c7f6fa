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
 * Actions to take when a test or group passes or fails: assign a bin, set a
 * flag, continue the flow or render some content.
 */
public class ActionOptions {

	private Object bin;
	private String binDescription;
	private Object softbin;
	private String softbinDescription;
	private String setFlag;
	private boolean continueFlow;
	private String render;

	public ActionOptions bin(Object number) {
		this.bin = number;
		return this;
	}

	public ActionOptions binDescription(String text) {
		this.binDescription = text;
		return this;
	}

	public ActionOptions softbin(Object number) {
		this.softbin = number;
		return this;
	}

	public ActionOptions softbinDescription(String text) {
		this.softbinDescription = text;
		return this;
	}

	/**
	 * @param flag flag to set, also known as the run flag
	 * @return these options
	 */
	public ActionOptions setFlag(String flag) {
		this.setFlag = flag;
		return this;
	}

	public ActionOptions continueFlow() {
		this.continueFlow = true;
		return this;
	}

	public ActionOptions render(String content) {
		this.render = content;
		return this;
	}

	/**
	 * @return {@code true} if none of the actions is set
	 */
	public boolean isEmpty() {
		return bin == null && softbin == null && setFlag == null && !continueFlow && render == null;
	}

	ActionOptions copy() {
		ActionOptions copy = new ActionOptions();
		copy.bin = bin;
		copy.binDescription = binDescription;
		copy.softbin = softbin;
		copy.softbinDescription = softbinDescription;
		copy.setFlag = setFlag;
		copy.continueFlow = continueFlow;
		copy.render = render;
		return copy;
	}

	public Object getBin() {
		return bin;
	}

	public String getBinDescription() {
		return binDescription;
	}

	public Object getSoftbin() {
		return softbin;
	}

	public String getSoftbinDescription() {
		return softbinDescription;
	}

	public String getSetFlag() {
		return setFlag;
	}

	public boolean isContinueFlow() {
		return continueFlow;
	}

	public String getRender() {
		return render;
	}
}
