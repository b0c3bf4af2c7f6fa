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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.metricshub.atp.ast.Node;
import org.metricshub.atp.ast.NodeFactory;
import org.metricshub.atp.ast.NodeType;
import org.metricshub.atp.frontend.ConditionTable;
import org.metricshub.atp.frontend.FlowAssembler;
import org.metricshub.atp.options.ActionOptions;
import org.metricshub.atp.options.BinOptions;
import org.metricshub.atp.options.ControlOptions;
import org.metricshub.atp.options.FlowOptions;
import org.metricshub.atp.options.GroupOptions;
import org.metricshub.atp.options.Options;
import org.metricshub.atp.options.TestOptions;
import org.metricshub.atp.processors.AdjacentIfCombiner;
import org.metricshub.atp.processors.AddIds;
import org.metricshub.atp.processors.ApplyPostGroupActions;
import org.metricshub.atp.processors.Condition;
import org.metricshub.atp.processors.ElseRemover;
import org.metricshub.atp.processors.EmptyBranchRemover;
import org.metricshub.atp.processors.FlagOptimizer;
import org.metricshub.atp.processors.Flattener;
import org.metricshub.atp.processors.FlowId;
import org.metricshub.atp.processors.OnPassFailRemover;
import org.metricshub.atp.processors.OneFlagPerTest;
import org.metricshub.atp.processors.PreCleaner;
import org.metricshub.atp.processors.Processor;
import org.metricshub.atp.processors.RedundantConditionRemover;
import org.metricshub.atp.processors.Relationship;
import org.metricshub.atp.util.AstSettings;
import org.metricshub.atp.util.AtpLogger;
import org.metricshub.atp.validators.DuplicateIds;
import org.metricshub.atp.validators.Jobs;
import org.metricshub.atp.validators.MissingIds;
import org.slf4j.Logger;

/**
 * Describes one test program flow.
 * <p>
 * A flow is built by calling the construction methods ({@link #test},
 * {@link #bin}, {@link #group}, {@link #ifEnabled} ...) in execution order.
 * Every call may be wrapped in flow conditions through its options. The
 * resulting tree is available unprocessed through {@link #raw()}, or
 * optimized for a given target through {@link #ast(AstSettings)}:
 *
 * <pre>
 * Flow flow = program.flow("sort1");
 * flow.test("t1", new TestOptions().id("t1").bin(5));
 * flow.test("t2", new TestOptions().ifFailed("t1").bin(6));
 * AstSettings settings = new AstSettings();
 * settings.setOptimization(Optimization.SMT);
 * Node ast = flow.ast(settings);
 * </pre>
 * <p>
 * Flows are serializable: the name, the program and the raw tree are written,
 * and a deserialized flow can be extended further.
 */
public class Flow implements Serializable {

	private static final long serialVersionUID = 5177232437436311094L;

	private static final Logger LOG = AtpLogger.getLogger(Flow.class);

	private String name;
	private Serializable program;
	private transient FlowAssembler assembler;
	private transient String sourceFile;
	private transient Integer sourceLineNumber;
	private transient String description;

	/**
	 * @param program the program this flow belongs to, written along with the
	 *        flow when it is serialized
	 * @param name the flow name
	 */
	public Flow(Serializable program, String name) {
		this.program = program;
		this.name = name;
		this.assembler = new FlowAssembler(NodeFactory.flow(name));
	}

	public String getName() {
		return name;
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The program is shared by all of its flows")
	public Serializable getProgram() {
		return program;
	}

	/**
	 * @return the source file given by the last construction call, if any
	 */
	public String getSourceFile() {
		return sourceFile;
	}

	/**
	 * @return the source line number given by the last construction call, if any
	 */
	public Integer getSourceLineNumber() {
		return sourceLineNumber;
	}

	/**
	 * @return the description given by the last construction call, if any
	 */
	public String getDescription() {
		return description;
	}

	/**
	 * Returns the unprocessed tree, as assembled from the construction calls so
	 * far. Calls still in progress (e.g. inside a group block) are folded in.
	 *
	 * @return the raw {@code flow} node
	 */
	public Node raw() {
		return assembler.raw();
	}

	/**
	 * Returns the tree processed and optimized for the target selected by the
	 * settings. The raw tree is left untouched.
	 *
	 * @param settings the pipeline parameters
	 * @return the processed {@code flow} node
	 * @throws org.metricshub.atp.validators.ValidationException if the flow
	 *         is not valid
	 */
	public Node ast(AstSettings settings) {
		if (LOG.isDebugEnabled()) {
			LOG.debug("Processing flow {} with settings:\n{}", name, settings.toDescriptionString());
		}

		// Common pre-processing and validation
		Node ast = run(new PreCleaner(), raw());
		new DuplicateIds(this).run(ast);
		new MissingIds(this).run(ast);
		new Jobs(this).run(ast);
		if (settings.isAddIds()) {
			ast = run(new AddIds(), ast);
		}
		if (settings.getUniqueId() != null) {
			ast = run(new FlowId(settings.getUniqueId()), ast);
		}

		switch (settings.getOptimization()) {
		case SMT:
			if (settings.isApplyRelationships()) {
				ast = run(new Relationship(), ast);
			}
			ast = run(new Condition(), ast);
			if (settings.isOptimizeFlags()) {
				ast = run(new FlagOptimizer(), ast);
			}
			ast = run(new AdjacentIfCombiner(), ast);
			break;
		case IGXL:
			ast = run(new ElseRemover(), ast);
			ast = run(new OnPassFailRemover(), ast);
			if (settings.isApplyRelationships()) {
				ast = run(new Relationship(), ast);
			}
			ast = run(new Condition(), ast);
			ast = run(new ApplyPostGroupActions(), ast);
			if (settings.isOneFlagPerTest()) {
				ast = run(new OneFlagPerTest(), ast);
			}
			ast = run(new RedundantConditionRemover(), ast);
			break;
		case FLAT:
			ast = run(new ElseRemover(), ast);
			ast = run(new OnPassFailRemover(), ast);
			ast = run(new Condition(), ast);
			ast = run(new Flattener(), ast);
			break;
		default:
			ast = run(new Condition(), ast);
			break;
		}

		// Common cleanup
		return run(new EmptyBranchRemover(), ast);
	}

	private Node run(Processor processor, Node ast) {
		LOG.debug("Running {} on flow {}", processor.getClass().getSimpleName(), name);
		return processor.run(ast);
	}

	/**
	 * Declares flags that may change at any time, so that the optimization
	 * passes leave them alone.
	 *
	 * @param flags flag names
	 */
	public void volatileFlags(String... flags) {
		assembler.replaceRoot(addVolatileFlags(assembler.getRoot(), flags));
	}

	private static Node addVolatileFlags(Node flow, String... flags) {
		List<Node> children = new ArrayList<Node>(flow.getChildren());
		Node flowName = children.remove(0);
		Node volatileNode;
		if (!children.isEmpty() && children.get(0).getType() == NodeType.VOLATILE) {
			volatileNode = children.remove(0);
		} else {
			volatileNode = NodeFactory.volatileNode(Collections.<Node>emptyList());
		}
		List<Node> members = new ArrayList<Node>(volatileNode.getChildren());
		for (String flag : flags) {
			Node flagNode = NodeFactory.flag(flag);
			if (!members.contains(flagNode)) {
				members.add(flagNode);
			}
		}
		children.add(0, flowName);
		children.add(1, volatileNode.updated(members));
		return flow.updated(children);
	}

	/**
	 * Groups all the nodes created by the given block.
	 *
	 * @param groupName the group name
	 * @param options group ID, pass/fail actions and conditions
	 * @param block construction calls making up the group
	 * @return the group node, or its outermost condition
	 */
	public Node group(String groupName, GroupOptions options, Runnable block) {
		return apply(options, () -> {
			List<Node> children = new ArrayList<Node>();
			if (options.getId() != null) {
				children.add(NodeFactory.id(options.getId()));
			}
			if (options.getOnFailBlock() != null) {
				children.add(assembler.appendTo(NodeFactory.onFail(), options.getOnFailBlock()));
			} else if (options.getOnFail() != null) {
				children.add(actions(NodeType.ON_FAIL, options.getOnFail()));
			}
			if (options.getOnPassBlock() != null) {
				children.add(assembler.appendTo(NodeFactory.onPass(), options.getOnPassBlock()));
			} else if (options.getOnPass() != null) {
				children.add(actions(NodeType.ON_PASS, options.getOnPass()));
			}
			return assembler.appendTo(NodeFactory.group(groupName, children.toArray(new Node[0])), block);
		});
	}

	public Node group(String groupName, Runnable block) {
		return group(groupName, new GroupOptions(), block);
	}

	/**
	 * Adds a test to the flow.
	 *
	 * @param instance the test instance, see {@link TestInstance}
	 * @param options test attributes, pass/fail actions and conditions
	 * @return the test node, or its outermost condition
	 */
	public Node test(Object instance, TestOptions options) {
		return apply(options, () -> buildTest(instance, options));
	}

	public Node test(Object instance) {
		return test(instance, new TestOptions());
	}

	/**
	 * Builds a {@code sub_test} node for inclusion in a test through
	 * {@link TestOptions#subTest(Node)}. Nothing is added to the flow.
	 *
	 * @param instance the test instance
	 * @param options test attributes; conditions are ignored
	 * @return the {@code sub_test} node
	 */
	public Node subTest(Object instance, TestOptions options) {
		recordMeta(options);
		return buildTest(instance, options).updated(NodeType.SUB_TEST);
	}

	private Node buildTest(Object instance, TestOptions options) {
		List<Node> children = new ArrayList<Node>();
		children.add(NodeFactory.object(objectName(instance)));

		String testName = options.getName();
		if (testName == null && instance instanceof TestInstance) {
			testName = ((TestInstance) instance).getName();
		}
		if (testName != null) {
			children.add(NodeFactory.name(testName));
		}

		Object number = options.getNumber();
		if (number == null && instance instanceof TestInstance) {
			number = ((TestInstance) instance).getNumber();
		}
		if (number != null) {
			children.add(NodeFactory.number(number));
		}

		if (options.getId() != null) {
			children.add(NodeFactory.id(options.getId()));
		}
		children.addAll(options.getLevels());
		children.addAll(options.getLimits());
		children.addAll(options.getPins());
		children.addAll(options.getPatterns());

		if (!options.getMeta().isEmpty()) {
			List<Node> attributes = new ArrayList<Node>();
			for (Map.Entry<String, Object> entry : options.getMeta().entrySet()) {
				attributes.add(NodeFactory.attribute(entry.getKey(), entry.getValue()));
			}
			children.add(NodeFactory.meta(attributes));
		}
		children.addAll(options.getSubTests());

		ActionOptions onFail = options.getOnFail();
		if (options.getOnFailBlock() != null) {
			children.add(assembler.appendTo(NodeFactory.onFail(), options.getOnFailBlock()));
		} else if (onFail != null) {
			children.add(actions(NodeType.ON_FAIL, onFail));
		}
		ActionOptions onPass = options.getOnPass();
		if (options.getOnPassBlock() != null) {
			children.add(assembler.appendTo(NodeFactory.onPass(), options.getOnPassBlock()));
		} else if (onPass != null) {
			children.add(actions(NodeType.ON_PASS, onPass));
		}
		return new Node(NodeType.TEST, null, children);
	}

	private static String objectName(Object instance) {
		if (instance instanceof TestInstance) {
			return ((TestInstance) instance).getName();
		}
		return String.valueOf(instance);
	}

	private static Node actions(NodeType type, ActionOptions options) {
		List<Node> children = new ArrayList<Node>();
		if (options.getBin() != null || options.getSoftbin() != null) {
			String resultType = type == NodeType.ON_FAIL ? NodeFactory.FAIL : NodeFactory.PASS;
			children.add(NodeFactory.setResult(
					resultType,
					options.getBin(),
					options.getBinDescription(),
					options.getSoftbin(),
					options.getSoftbinDescription()));
		}
		if (options.getSetFlag() != null) {
			children.add(NodeFactory.setFlag(options.getSetFlag()));
		}
		if (options.isContinueFlow()) {
			children.add(NodeFactory.continueNode());
		}
		if (options.getRender() != null) {
			children.add(NodeFactory.render(options.getRender()));
		}
		return type == NodeType.ON_FAIL ? NodeFactory.onFail(children) : NodeFactory.onPass(children);
	}

	/**
	 * Assigns a failing bin.
	 *
	 * @param number the bin number
	 * @param options result type, soft bin, descriptions and conditions
	 * @return the {@code set_result} node, or its outermost condition
	 * @throws FlowDefinitionException if {@code number} is an options structure
	 */
	public Node bin(Object number, BinOptions options) {
		return result(options.getType(), number, options);
	}

	public Node bin(Object number) {
		return bin(number, new BinOptions());
	}

	/**
	 * Assigns a passing bin.
	 *
	 * @param number the bin number
	 * @param options soft bin, descriptions and conditions
	 * @return the {@code set_result} node, or its outermost condition
	 */
	public Node pass(Object number, BinOptions options) {
		return result(NodeFactory.PASS, number, options);
	}

	public Node pass(Object number) {
		return pass(number, new BinOptions());
	}

	private Node result(String type, Object number, BinOptions options) {
		checkBinNumber(number);
		return apply(options, () -> NodeFactory.setResult(
				type,
				number,
				options.getDescription(),
				options.getSoftbin(),
				options.getSoftbinDescription()));
	}

	private static void checkBinNumber(Object number) {
		if (number instanceof FlowOptions || number instanceof ActionOptions || number instanceof Map) {
			throw new FlowDefinitionException("The bin number must be passed as the first argument");
		}
	}

	/**
	 * Adds a characterization of a test.
	 *
	 * @param instance the test instance
	 * @param setup the characterization setup name
	 * @param options test attributes and conditions; the conditions wrap the
	 *        {@code cz} node
	 * @return the {@code cz} node, or its outermost condition
	 */
	public Node cz(Object instance, String setup, TestOptions options) {
		return apply(options, () -> NodeFactory.cz(setup, buildTest(instance, options)));
	}

	public Node characterize(Object instance, String setup, TestOptions options) {
		return cz(instance, setup, options);
	}

	public Node log(Object message, Options options) {
		return apply(options, () -> NodeFactory.log(message));
	}

	public Node log(Object message) {
		return log(message, new Options());
	}

	/**
	 * Sets a flow control variable.
	 *
	 * @param var the variable to enable
	 * @param options conditions
	 * @return the {@code enable} node, or its outermost condition
	 */
	public Node enable(String var, Options options) {
		return apply(options, () -> NodeFactory.enable(var));
	}

	public Node enable(String var) {
		return enable(var, new Options());
	}

	/**
	 * Clears a flow control variable.
	 *
	 * @param var the variable to disable
	 * @param options conditions
	 * @return the {@code disable} node, or its outermost condition
	 */
	public Node disable(String var, Options options) {
		return apply(options, () -> NodeFactory.disable(var));
	}

	public Node disable(String var) {
		return disable(var, new Options());
	}

	public Node setFlag(String flag, Options options) {
		return apply(options, () -> NodeFactory.setFlag(flag));
	}

	public Node setFlag(String flag) {
		return setFlag(flag, new Options());
	}

	/**
	 * Inserts content to be rendered as is in the target program.
	 *
	 * @param content the content
	 * @param options conditions
	 * @return the {@code render} node, or its outermost condition
	 */
	public Node render(String content, Options options) {
		return apply(options, () -> NodeFactory.render(content));
	}

	public Node render(String content) {
		return render(content, new Options());
	}

	public Node continueFlow(Options options) {
		return apply(options, NodeFactory::continueNode);
	}

	public Node continueFlow() {
		return continueFlow(new Options());
	}

	/**
	 * Wraps the nodes created by a block in a flow condition given by one of its
	 * aliases, e.g. {@code enabled} or {@code unless_passed}.
	 *
	 * @param alias condition alias
	 * @param guard condition value
	 * @param options {@code then}/{@code otherwise} blocks and further conditions
	 * @param block construction calls to run under the condition, may be
	 *        {@code null} when the options carry a {@code then} or
	 *        {@code otherwise} block
	 * @return the condition node, or its outermost condition
	 * @throws FlowDefinitionException if the alias is unknown, or if a group
	 *         is given no members or an {@code otherwise} block
	 */
	public Node condition(String alias, Object guard, ControlOptions options, Runnable block) {
		NodeType kind = ConditionTable.resolve(alias);
		if (kind == NodeType.GROUP) {
			if (options.getOtherwise() != null) {
				throw new FlowDefinitionException("A group cannot have an otherwise block");
			}
			Runnable members = block != null ? block : options.getThen();
			if (members == null) {
				throw new FlowDefinitionException("You must supply a block when calling group like this!");
			}
			return group(String.valueOf(guard), new GroupOptions().inherit(options), members);
		}
		return flowControl(kind, guard, options, block);
	}

	public Node condition(String alias, Object guard, Runnable block) {
		return condition(alias, guard, new ControlOptions(), block);
	}

	/**
	 * Wraps the nodes created by a block in a flow condition.
	 *
	 * @param kind a guarded condition kind, e.g. {@link NodeType#IF_FAILED}
	 * @param guard condition value: an enable word, ID, job or flag, or a
	 *        collection of them
	 * @param options {@code then}/{@code otherwise} blocks and further conditions
	 * @param block construction calls to run under the condition, may be
	 *        {@code null} when the options carry a {@code then} or
	 *        {@code otherwise} block
	 * @return the condition node, or its outermost condition
	 * @throws FlowDefinitionException if there is nothing to run, or if several
	 *         IDs are given to {@code if_failed} or {@code if_passed}
	 */
	public Node flowControl(NodeType kind, Object guard, ControlOptions options, Runnable block) {
		if (kind.isEnableCondition() && options.isOr()) {
			recordMeta(options);
			if (block != null) {
				block.run();
			} else if (options.getThen() != null) {
				options.getThen().run();
			}
			return null;
		}
		FlowAssembler.checkSingleId(kind, guard);
		return apply(options, () -> {
			Node node = NodeFactory.condition(kind, guard);
			if (block != null) {
				return assembler.appendTo(node, block);
			}
			if (options.getThen() == null && options.getOtherwise() == null) {
				throw new FlowDefinitionException(
						"You must supply a then or otherwise block when calling " + kind.getName() + " like this!");
			}
			if (options.getThen() != null) {
				node = assembler.appendTo(node, options.getThen());
			}
			if (options.getOtherwise() != null) {
				node = node.addChildren(assembler.appendTo(NodeFactory.elseNode(), options.getOtherwise()));
			}
			return node;
		});
	}

	public Node ifEnabled(Object words, Runnable block) {
		return flowControl(NodeType.IF_ENABLED, words, new ControlOptions(), block);
	}

	public Node ifEnabled(Object words, ControlOptions options, Runnable block) {
		return flowControl(NodeType.IF_ENABLED, words, options, block);
	}

	public Node unlessEnabled(Object words, Runnable block) {
		return flowControl(NodeType.UNLESS_ENABLED, words, new ControlOptions(), block);
	}

	public Node unlessEnabled(Object words, ControlOptions options, Runnable block) {
		return flowControl(NodeType.UNLESS_ENABLED, words, options, block);
	}

	public Node ifFailed(Object id, Runnable block) {
		return flowControl(NodeType.IF_FAILED, id, new ControlOptions(), block);
	}

	public Node ifFailed(Object id, ControlOptions options, Runnable block) {
		return flowControl(NodeType.IF_FAILED, id, options, block);
	}

	public Node ifPassed(Object id, Runnable block) {
		return flowControl(NodeType.IF_PASSED, id, new ControlOptions(), block);
	}

	public Node ifPassed(Object id, ControlOptions options, Runnable block) {
		return flowControl(NodeType.IF_PASSED, id, options, block);
	}

	public Node ifAnyFailed(Object ids, Runnable block) {
		return flowControl(NodeType.IF_ANY_FAILED, ids, new ControlOptions(), block);
	}

	public Node ifAnyFailed(Object ids, ControlOptions options, Runnable block) {
		return flowControl(NodeType.IF_ANY_FAILED, ids, options, block);
	}

	public Node ifAllFailed(Object ids, Runnable block) {
		return flowControl(NodeType.IF_ALL_FAILED, ids, new ControlOptions(), block);
	}

	public Node ifAllFailed(Object ids, ControlOptions options, Runnable block) {
		return flowControl(NodeType.IF_ALL_FAILED, ids, options, block);
	}

	public Node ifAnyPassed(Object ids, Runnable block) {
		return flowControl(NodeType.IF_ANY_PASSED, ids, new ControlOptions(), block);
	}

	public Node ifAnyPassed(Object ids, ControlOptions options, Runnable block) {
		return flowControl(NodeType.IF_ANY_PASSED, ids, options, block);
	}

	public Node ifAllPassed(Object ids, Runnable block) {
		return flowControl(NodeType.IF_ALL_PASSED, ids, new ControlOptions(), block);
	}

	public Node ifAllPassed(Object ids, ControlOptions options, Runnable block) {
		return flowControl(NodeType.IF_ALL_PASSED, ids, options, block);
	}

	public Node ifRan(Object id, Runnable block) {
		return flowControl(NodeType.IF_RAN, id, new ControlOptions(), block);
	}

	public Node ifRan(Object id, ControlOptions options, Runnable block) {
		return flowControl(NodeType.IF_RAN, id, options, block);
	}

	public Node unlessRan(Object id, Runnable block) {
		return flowControl(NodeType.UNLESS_RAN, id, new ControlOptions(), block);
	}

	public Node unlessRan(Object id, ControlOptions options, Runnable block) {
		return flowControl(NodeType.UNLESS_RAN, id, options, block);
	}

	public Node ifJob(Object jobs, Runnable block) {
		return flowControl(NodeType.IF_JOB, jobs, new ControlOptions(), block);
	}

	public Node ifJob(Object jobs, ControlOptions options, Runnable block) {
		return flowControl(NodeType.IF_JOB, jobs, options, block);
	}

	public Node unlessJob(Object jobs, Runnable block) {
		return flowControl(NodeType.UNLESS_JOB, jobs, new ControlOptions(), block);
	}

	public Node unlessJob(Object jobs, ControlOptions options, Runnable block) {
		return flowControl(NodeType.UNLESS_JOB, jobs, options, block);
	}

	public Node ifFlag(Object flags, Runnable block) {
		return flowControl(NodeType.IF_FLAG, flags, new ControlOptions(), block);
	}

	public Node ifFlag(Object flags, ControlOptions options, Runnable block) {
		return flowControl(NodeType.IF_FLAG, flags, options, block);
	}

	public Node unlessFlag(Object flags, Runnable block) {
		return flowControl(NodeType.UNLESS_FLAG, flags, new ControlOptions(), block);
	}

	public Node unlessFlag(Object flags, ControlOptions options, Runnable block) {
		return flowControl(NodeType.UNLESS_FLAG, flags, options, block);
	}

	/**
	 * Records the source metadata of a call, resolves its conditions and hands
	 * the node to the assembler.
	 */
	private Node apply(FlowOptions<?> options, Supplier<Node> body) {
		recordMeta(options);
		List<Map.Entry<NodeType, Object>> conditions = ConditionTable.extract(options.getConditions());
		return assembler.applyConditions(conditions, options.isCurrentContext(), body);
	}

	private void recordMeta(FlowOptions<?> options) {
		sourceFile = options.getSourceFile();
		sourceLineNumber = options.getSourceLineNumber();
		description = options.getDescription();
	}

	private void writeObject(ObjectOutputStream out) throws IOException {
		out.writeObject(name);
		out.writeObject(program);
		out.writeObject(raw());
	}

	private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
		name = (String) in.readObject();
		program = (Serializable) in.readObject();
		assembler = new FlowAssembler((Node) in.readObject());
	}
}
