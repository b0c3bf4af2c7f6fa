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

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.metricshub.atp.frontend.ConditionTable;

/**
 * Options shared by every flow construction call: the flow conditions to wrap
 * the new node in, the {@code context: :current} switch and the source
 * metadata of the call.
 * <p>
 * Conditions are kept in the order they are supplied; the first one becomes
 * the outermost wrapper.
 *
 * @param <T> concrete options type, returned by the fluent setters
 */
public abstract class FlowOptions<T extends FlowOptions<T>> {

	private final List<Map.Entry<String, Object>> conditions = new ArrayList<Map.Entry<String, Object>>();
	private boolean currentContext;
	private String sourceFile;
	private Integer sourceLineNumber;
	private String description;

	protected abstract T self();

	/**
	 * Adds a flow condition by any of its aliases, e.g. {@code enabled} or
	 * {@code if_enable}.
	 *
	 * @param alias condition alias
	 * @param guard an ID, flag, job or enable word, or a collection of them
	 * @return these options
	 * @throws org.metricshub.atp.FlowDefinitionException if the alias is unknown
	 */
	public T condition(String alias, Object guard) {
		ConditionTable.resolve(alias);
		conditions.add(new SimpleImmutableEntry<String, Object>(alias, guard));
		return self();
	}

	public T ifEnabled(Object words) {
		return condition("if_enabled", words);
	}

	public T unlessEnabled(Object words) {
		return condition("unless_enabled", words);
	}

	public T ifFailed(Object id) {
		return condition("if_failed", id);
	}

	public T ifPassed(Object id) {
		return condition("if_passed", id);
	}

	public T ifAnyFailed(Object ids) {
		return condition("if_any_failed", ids);
	}

	public T ifAllFailed(Object ids) {
		return condition("if_all_failed", ids);
	}

	public T ifAnyPassed(Object ids) {
		return condition("if_any_passed", ids);
	}

	public T ifAllPassed(Object ids) {
		return condition("if_all_passed", ids);
	}

	public T ifRan(Object id) {
		return condition("if_ran", id);
	}

	public T unlessRan(Object id) {
		return condition("unless_ran", id);
	}

	public T ifJob(Object jobs) {
		return condition("if_job", jobs);
	}

	public T unlessJob(Object jobs) {
		return condition("unless_job", jobs);
	}

	public T ifFlag(Object flags) {
		return condition("if_flag", flags);
	}

	public T unlessFlag(Object flags) {
		return condition("unless_flag", flags);
	}

	/**
	 * Wraps the new node in a group of the given name.
	 *
	 * @param name group name
	 * @return these options
	 */
	public T inGroup(String name) {
		return condition("group", name);
	}

	/**
	 * Appends the new node next to the previous statement, inside exactly the
	 * same condition context. Other conditions of these options are ignored.
	 *
	 * @return these options
	 */
	public T currentContext() {
		this.currentContext = true;
		return self();
	}

	public T sourceFile(String file) {
		this.sourceFile = file;
		return self();
	}

	public T sourceLineNumber(int line) {
		this.sourceLineNumber = Integer.valueOf(line);
		return self();
	}

	public T description(String text) {
		this.description = text;
		return self();
	}

	/**
	 * Adds the conditions, the context flag and the source metadata of other
	 * options to these ones, e.g. to turn control options into group options.
	 *
	 * @param other the options to copy from
	 * @return these options
	 */
	public T inherit(FlowOptions<?> other) {
		conditions.addAll(other.conditions);
		currentContext |= other.currentContext;
		if (other.sourceFile != null) {
			sourceFile = other.sourceFile;
		}
		if (other.sourceLineNumber != null) {
			sourceLineNumber = other.sourceLineNumber;
		}
		if (other.description != null) {
			description = other.description;
		}
		return self();
	}

	/**
	 * @return the supplied condition aliases with their guards, in order
	 */
	public List<Map.Entry<String, Object>> getConditions() {
		return Collections.unmodifiableList(conditions);
	}

	public boolean isCurrentContext() {
		return currentContext;
	}

	public String getSourceFile() {
		return sourceFile;
	}

	public Integer getSourceLineNumber() {
		return sourceLineNumber;
	}

	public String getDescription() {
		return description;
	}
}
