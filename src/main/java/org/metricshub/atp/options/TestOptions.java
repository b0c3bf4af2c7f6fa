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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.atp.FlowDefinitionException;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.ast.NodeType;

/**
 * Options of the {@code test}, {@code sub_test} and {@code cz} calls.
 * <p>
 * The {@code bin}, {@code softbin}, {@code continueOnFail} and
 * {@code flagFail} shortcuts describe what to do when the test fails and are
 * merged into the {@code on_fail} actions; {@code flagPass} is merged into the
 * {@code on_pass} actions.
 */
public class TestOptions extends FlowOptions<TestOptions> {

	private String name;
	private Object number;
	private String id;
	private final List<Node> levels = new ArrayList<Node>();
	private final List<Node> limits = new ArrayList<Node>();
	private final List<Node> pins = new ArrayList<Node>();
	private final List<Node> patterns = new ArrayList<Node>();
	private final Map<String, Object> meta = new LinkedHashMap<String, Object>();
	private final List<Node> subTests = new ArrayList<Node>();
	private ActionOptions onFail;
	private Runnable onFailBlock;
	private ActionOptions onPass;
	private Runnable onPassBlock;
	private Object bin;
	private String binDescription;
	private Object softbin;
	private String softbinDescription;
	private boolean continueOnFail;
	private String flagPass;
	private String flagFail;

	@Override
	protected TestOptions self() {
		return this;
	}

	/**
	 * @param testName overrides the name given by the test instance
	 * @return these options
	 */
	public TestOptions name(String testName) {
		this.name = testName;
		return this;
	}

	/**
	 * @param testNumber overrides the number given by the test instance
	 * @return these options
	 */
	public TestOptions number(Object testNumber) {
		this.number = testNumber;
		return this;
	}

	public TestOptions id(String testId) {
		this.id = testId;
		return this;
	}

	public TestOptions level(String levelName, Object value) {
		return level(levelName, value, null);
	}

	public TestOptions level(String levelName, Object value, String units) {
		levels.add(NodeFactory.level(levelName, value, units));
		return this;
	}

	public TestOptions limit(Object value, String rule) {
		return limit(value, rule, null);
	}

	public TestOptions limit(Object value, String rule, String units) {
		limits.add(NodeFactory.limit(value, rule, units));
		return this;
	}

	public TestOptions pin(String pinName) {
		pins.add(NodeFactory.pin(pinName));
		return this;
	}

	public TestOptions pattern(String patternName) {
		return pattern(patternName, null);
	}

	public TestOptions pattern(String patternName, String path) {
		patterns.add(NodeFactory.pattern(patternName, path));
		return this;
	}

	/**
	 * Adds a free form attribute, kept in insertion order in the test's
	 * {@code meta} node.
	 *
	 * @param key attribute name
	 * @param value attribute value
	 * @return these options
	 */
	public TestOptions meta(String key, Object value) {
		meta.put(key, value);
		return this;
	}

	/**
	 * @param subTest a node built by {@link org.metricshub.atp.Flow#subTest}, or
	 *        any test node
	 * @return these options
	 */
	public TestOptions subTest(Node subTest) {
		if (subTest.getType() != NodeType.SUB_TEST && subTest.getType() != NodeType.TEST) {
			throw new FlowDefinitionException("A sub test must be a test node, not " + subTest.getType().getName());
		}
		subTests.add(subTest.updated(NodeType.SUB_TEST));
		return this;
	}

	public TestOptions onFail(ActionOptions actions) {
		this.onFail = actions;
		return this;
	}

	public TestOptions onFail(Runnable block) {
		this.onFailBlock = block;
		return this;
	}

	public TestOptions onPass(ActionOptions actions) {
		this.onPass = actions;
		return this;
	}

	public TestOptions onPass(Runnable block) {
		this.onPassBlock = block;
		return this;
	}

	public TestOptions bin(Object binNumber) {
		this.bin = binNumber;
		return this;
	}

	public TestOptions binDescription(String text) {
		this.binDescription = text;
		return this;
	}

	public TestOptions softbin(Object softbinNumber) {
		this.softbin = softbinNumber;
		return this;
	}

	public TestOptions softbinDescription(String text) {
		this.softbinDescription = text;
		return this;
	}

	public TestOptions continueOnFail() {
		this.continueOnFail = true;
		return this;
	}

	public TestOptions flagPass(String flag) {
		this.flagPass = flag;
		return this;
	}

	public TestOptions flagFail(String flag) {
		this.flagFail = flag;
		return this;
	}

	public String getName() {
		return name;
	}

	public Object getNumber() {
		return number;
	}

	public String getId() {
		return id;
	}

	public List<Node> getLevels() {
		return Collections.unmodifiableList(levels);
	}

	public List<Node> getLimits() {
		return Collections.unmodifiableList(limits);
	}

	public List<Node> getPins() {
		return Collections.unmodifiableList(pins);
	}

	public List<Node> getPatterns() {
		return Collections.unmodifiableList(patterns);
	}

	public Map<String, Object> getMeta() {
		return Collections.unmodifiableMap(meta);
	}

	public List<Node> getSubTests() {
		return Collections.unmodifiableList(subTests);
	}

	public Runnable getOnFailBlock() {
		return onFailBlock;
	}

	public Runnable getOnPassBlock() {
		return onPassBlock;
	}

	/**
	 * Returns the {@code on_fail} actions with the top level shortcuts applied.
	 *
	 * @return the actions, or {@code null} if there are none
	 * @throws FlowDefinitionException if shortcuts are combined with an
	 *         {@code on_fail} block
	 */
	public ActionOptions getOnFail() {
		boolean shortcuts = bin != null || binDescription != null || softbin != null || softbinDescription != null
				|| continueOnFail || flagFail != null;
		if (!shortcuts) {
			return onFail;
		}
		if (onFailBlock != null) {
			throw new FlowDefinitionException("Fail actions cannot be combined with an on_fail block");
		}
		ActionOptions actions = onFail == null ? new ActionOptions() : onFail.copy();
		if (bin != null) {
			actions.bin(bin);
		}
		if (binDescription != null) {
			actions.binDescription(binDescription);
		}
		if (softbin != null) {
			actions.softbin(softbin);
		}
		if (softbinDescription != null) {
			actions.softbinDescription(softbinDescription);
		}
		if (continueOnFail) {
			actions.continueFlow();
		}
		if (flagFail != null) {
			actions.setFlag(flagFail);
		}
		return actions;
	}

	/**
	 * Returns the {@code on_pass} actions with the {@code flagPass} shortcut
	 * applied.
	 *
	 * @return the actions, or {@code null} if there are none
	 */
	public ActionOptions getOnPass() {
		if (flagPass == null) {
			return onPass;
		}
		if (onPassBlock != null) {
			throw new FlowDefinitionException("Pass actions cannot be combined with an on_pass block");
		}
		ActionOptions actions = onPass == null ? new ActionOptions() : onPass.copy();
		return actions.setFlag(flagPass);
	}
}
