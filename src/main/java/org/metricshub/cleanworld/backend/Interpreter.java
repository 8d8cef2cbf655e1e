package org.metricshub.cleanworld.backend;


/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * CleanWorld
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.cleanworld.ast.AgentRef;
import org.metricshub.cleanworld.ast.AssignStmt;
import org.metricshub.cleanworld.ast.AstNode;
import org.metricshub.cleanworld.ast.AstVisitor;
import org.metricshub.cleanworld.ast.BinaryOp;
import org.metricshub.cleanworld.ast.BreakStmt;
import org.metricshub.cleanworld.ast.CallSite;
import org.metricshub.cleanworld.ast.CallStmt;
import org.metricshub.cleanworld.ast.FuncCallExpr;
import org.metricshub.cleanworld.ast.FuncDecl;
import org.metricshub.cleanworld.ast.Identifier;
import org.metricshub.cleanworld.ast.IfStmt;
import org.metricshub.cleanworld.ast.Literal;
import org.metricshub.cleanworld.ast.Name;
import org.metricshub.cleanworld.ast.Operator;
import org.metricshub.cleanworld.ast.Param;
import org.metricshub.cleanworld.ast.PrintStmt;
import org.metricshub.cleanworld.ast.Program;
import org.metricshub.cleanworld.ast.ReturnStmt;
import org.metricshub.cleanworld.ast.StmtList;
import org.metricshub.cleanworld.ast.UnaryOp;
import org.metricshub.cleanworld.ast.VarDecl;
import org.metricshub.cleanworld.ast.WhileStmt;
import org.metricshub.cleanworld.ast.WorldRef;
import org.metricshub.cleanworld.jrt.Agent;
import org.metricshub.cleanworld.jrt.CleanRuntimeException;
import org.metricshub.cleanworld.jrt.Direction;
import org.metricshub.cleanworld.jrt.World;
import org.metricshub.cleanworld.semantic.Builtin;
import org.metricshub.cleanworld.util.CleanLogger;
import org.metricshub.cleanworld.util.CleanSettings;
import org.slf4j.Logger;

/**
 * Tree-walking interpreter: executes a checked {@link Program} directly on
 * its abstract syntax tree.
 * <p>
 * Statements evaluate to null, expressions to their runtime value:
 * {@link Long} for <code>int</code>, {@link Boolean}, {@link String},
 * {@link Direction}, {@link World} or {@link Agent}. All the state of a run
 * lives in the {@link ExecutionContext} passed along the traversal, so one
 * interpreter can run several programs.
 * <p>
 * <code>break</code> and <code>return</code> do not unwind through Java
 * exceptions: they raise a flag (the break flag of the context, the return
 * slot of the runtime stack) which every statement list checks after each
 * statement.
 * <p>
 * Every failure is reported as a {@link CleanRuntimeException} carrying the
 * line of the statement being executed.
 */
public class Interpreter implements AstVisitor<Object, ExecutionContext> {

	private static final Logger LOG = CleanLogger.getLogger(Interpreter.class);

	/** Result of a call that produced no value. */
	private static final Object NO_VALUE = new Object() {
		@Override
		public String toString() {
			return "<no value>";
		}
	};

	private int currentLine = -1;

	/**
	 * Run the program with a fresh context.
	 *
	 * @param program checked program
	 * @param settings run settings
	 * @return the context of the finished run
	 * @throws CleanRuntimeException upon the first runtime error
	 */
	public ExecutionContext execute(Program program, CleanSettings settings) {
		ExecutionContext context = new ExecutionContext(settings);
		execute(program, context);
		return context;
	}

	/**
	 * Run the program in the given context.
	 *
	 * @param program checked program
	 * @param context state of the run
	 * @throws CleanRuntimeException upon the first runtime error
	 */
	public void execute(Program program, ExecutionContext context) {
		currentLine = program.getLineNumber();
		try {
			program.accept(this, context);
		} catch (CleanRuntimeException e) {
			context.getStack().popAllFrames();
			throw e;
		} catch (StackOverflowError e) {
			context.getStack().popAllFrames();
			throw new CleanRuntimeException(currentLine, "Stack overflow: recursion is too deep", e);
		} catch (RuntimeException re) {
			context.getStack().popAllFrames();
			throw new CleanRuntimeException(currentLine, re.getMessage(), re);
		} finally {
			context.getOutput().flush();
		}
	}

	private static CleanRuntimeException error(AstNode node, String msg) {
		return new CleanRuntimeException(node.getLineNumber(), msg);
	}

	private Object eval(AstNode node, ExecutionContext context) {
		return node.accept(this, context);
	}

	// DECLARATIONS

	@Override
	public Object visit(Program node, ExecutionContext context) {
		Map<String, FuncDecl> functions = context.getFunctionMap();
		for (FuncDecl func : node.getFunctions()) {
			functions.put(func.getName().getKey(), func);
		}
		for (VarDecl decl : node.getGlobals()) {
			decl.accept(this, context);
		}
		if (LOG.isDebugEnabled()) {
			LOG.debug("Running program {} ({} globals, {} functions)", node.getName(), context.getGlobalMap().size(), functions.size());
		}
		invoke(node.getMain(), new ArrayList<Object>(), context);
		LOG.debug("Program {} finished", node.getName());
		return null;
	}

	// globals start at 0
	@Override
	public Object visit(VarDecl node, ExecutionContext context) {
		for (Name name : node.getNames()) {
			context.getGlobalMap().put(name.getKey(), Long.valueOf(0));
		}
		return null;
	}

	@Override
	public Object visit(FuncDecl node, ExecutionContext context) {
		throw error(node, "Function '" + node.getName() + "' can only be executed through a call");
	}

	@Override
	public Object visit(Param node, ExecutionContext context) {
		throw error(node, "Parameter '" + node.getName() + "' cannot be evaluated");
	}

	/**
	 * Run the body of a user function in a new frame.
	 *
	 * @return the returned value, or {@link #NO_VALUE} when the body
	 *         finished without <code>return</code> or returned nothing
	 */
	private Object invoke(FuncDecl func, List<Object> args, ExecutionContext context) {
		Map<String, Object> locals = new LinkedHashMap<String, Object>();
		List<Param> params = func.getParams();
		for (int i = 0; i < params.size(); i++) {
			locals.put(params.get(i).getName().getKey(), args.get(i));
		}
		if (LOG.isTraceEnabled()) {
			LOG.trace("Calling {}{}", func.getName(), locals);
		}
		RuntimeStack stack = context.getStack();
		stack.pushFrame(locals);
		try {
			func.getBody().accept(this, context);
			if (!stack.isReturning()) {
				return NO_VALUE;
			}
			Object value = stack.takeReturnValue();
			return value == null ? NO_VALUE : value;
		} finally {
			stack.popFrame();
			if (stack.isReturning()) {
				stack.takeReturnValue();
			}
		}
	}

	// STATEMENTS

	@Override
	public Object visit(StmtList node, ExecutionContext context) {
		RuntimeStack stack = context.getStack();
		for (AstNode stmt : node.getStatements()) {
			currentLine = stmt.getLineNumber();
			stmt.accept(this, context);
			if (context.isBreaking() || stack.isReturning()) {
				break;
			}
		}
		return null;
	}

	@Override
	public Object visit(AssignStmt node, ExecutionContext context) {
		Object value = eval(node.getValue(), context);
		AstNode target = node.getTarget();
		switch (target.getKind()) {
		case WORLD_REF:
			if (!(value instanceof World)) {
				throw error(node, "world must be assigned a world value, got " + describe(value));
			}
			context.setWorld((World) value);
			break;
		case AGENT_REF:
			if (!(value instanceof Agent)) {
				throw error(node, "agent must be assigned an agent value, got " + describe(value));
			}
			context.setAgent((Agent) value);
			break;
		case IDENTIFIER:
			String key = ((Identifier) target).getName().getKey();
			RuntimeStack stack = context.getStack();
			if (stack.hasLocal(key)) {
				stack.setLocal(key, value);
			} else {
				context.getGlobalMap().put(key, value);
			}
			break;
		default:
			throw error(node, "Invalid assignment target: " + target);
		}
		return null;
	}

	@Override
	public Object visit(CallStmt node, ExecutionContext context) {
		call(node, node, context);
		return null;
	}

	@Override
	public Object visit(PrintStmt node, ExecutionContext context) {
		print(node, eval(node.getExpression(), context), context);
		return null;
	}

	private static void print(AstNode node, Object value, ExecutionContext context) {
		if (value instanceof World || value instanceof Agent || value == null || value == NO_VALUE) {
			throw error(node, "Cannot print " + describe(value));
		}
		context.getOutput().println(value);
	}

	@Override
	public Object visit(IfStmt node, ExecutionContext context) {
		if (condition(node.getCondition(), "If", context)) {
			node.getThenBranch().accept(this, context);
		} else if (node.getElseBranch() != null) {
			node.getElseBranch().accept(this, context);
		}
		return null;
	}

	@Override
	public Object visit(WhileStmt node, ExecutionContext context) {
		int maxIterations = context.getSettings().getMaxLoopIterations();
		int iterations = 0;
		RuntimeStack stack = context.getStack();
		while (condition(node.getCondition(), "While", context)) {
			if (iterations == maxIterations) {
				throw error(node, "While loop exceeded maximum iterations (" + maxIterations + "). Possible infinite loop.");
			}
			iterations++;
			node.getBody().accept(this, context);
			if (context.isBreaking()) {
				context.setBreaking(false);
				break;
			}
			if (stack.isReturning()) {
				break;
			}
		}
		return null;
	}

	private boolean condition(AstNode expr, String statement, ExecutionContext context) {
		Object value = eval(expr, context);
		if (!(value instanceof Boolean)) {
			throw error(expr, statement + " condition must be boolean, got " + describe(value));
		}
		return (Boolean) value;
	}

	@Override
	public Object visit(BreakStmt node, ExecutionContext context) {
		context.setBreaking(true);
		return null;
	}

	@Override
	public Object visit(ReturnStmt node, ExecutionContext context) {
		Object value = node.getValue() == null ? null : eval(node.getValue(), context);
		context.getStack().setReturnValue(value);
		return null;
	}

	// CALLS

	@Override
	public Object visit(FuncCallExpr node, ExecutionContext context) {
		Object value = call(node, node, context);
		if (value == NO_VALUE) {
			throw error(node, "Function '" + node.getName() + "' did not return a value");
		}
		return value;
	}

	private Object call(AstNode node, CallSite call, ExecutionContext context) {
		List<Object> args = new ArrayList<Object>();
		for (AstNode arg : call.getArguments()) {
			args.add(eval(arg, context));
		}
		Name name = call.getName();
		Builtin builtin = Builtin.lookup(name);
		if (builtin != null) {
			return callBuiltin(node, builtin, args, context);
		}
		FuncDecl func = context.getFunctionMap().get(name.getKey());
		if (func == null) {
			throw error(node, "Undeclared function: " + name);
		}
		if (args.size() != func.getParams().size()) {
			throw error(node, "Function " + name + " expects " + func.getParams().size() + " arguments, got " + args.size());
		}
		return invoke(func, args, context);
	}

	private Object callBuiltin(AstNode node, Builtin builtin, List<Object> args, ExecutionContext context) {
		String name = builtin.getFunctionName();
		if (args.size() != builtin.getSignature().getArity()) {
			throw error(node, "Function " + name + " expects " + builtin.getSignature().getArity() + " arguments, got " + args.size());
		}
		switch (builtin) {
		case INIT_WORLD:
			try {
				World world = new World(intArg(node, name, args, 0), intArg(node, name, args, 1), context.getRandom());
				return world;
			} catch (IllegalArgumentException e) {
				throw new CleanRuntimeException(node.getLineNumber(), name + ": " + e.getMessage(), e);
			}
		case SET_AGENT:
			return setAgent(node, args);
		case DIRT_REMAINING:
			return Long.valueOf(worldArg(node, name, args.get(0)).dirtRemaining());
		case IS_DIRTY:
			return Boolean.valueOf(agentArg(node, name, args.get(0)).isDirty());
		case CLEAN:
			agentArg(node, name, args.get(0)).clean();
			return NO_VALUE;
		case MOVE_FORWARD:
			agentArg(node, name, args.get(0)).moveForward();
			return NO_VALUE;
		case TURN_RIGHT:
			agentArg(node, name, args.get(0)).turnRight();
			return NO_VALUE;
		case FRONT_IS_BLOCKED:
			return Boolean.valueOf(agentArg(node, name, args.get(0)).frontIsBlocked());
		case PRINT:
			print(node, args.get(0), context);
			return NO_VALUE;
		default:
			throw error(node, "Unknown built-in function: " + name);
		}
	}

	// set_agent(world, x, y, dir): x is the row, y the column
	private Object setAgent(AstNode node, List<Object> args) {
		String name = Builtin.SET_AGENT.getFunctionName();
		World world = worldArg(node, name, args.get(0));
		int row = intArg(node, name, args, 1);
		int col = intArg(node, name, args, 2);
		Object dir = args.get(3);
		Direction direction;
		if (dir instanceof Direction) {
			direction = (Direction) dir;
		} else if (dir instanceof String) {
			try {
				direction = Direction.fromSymbol((String) dir);
			} catch (IllegalArgumentException e) {
				throw new CleanRuntimeException(node.getLineNumber(), name + ": " + e.getMessage(), e);
			}
		} else {
			throw error(node, name + ": argument 4 must be a direction, got " + describe(dir));
		}
		try {
			return new Agent(world, row, col, direction);
		} catch (IllegalArgumentException e) {
			throw new CleanRuntimeException(node.getLineNumber(), name + ": " + e.getMessage(), e);
		}
	}

	private static int intArg(AstNode node, String function, List<Object> args, int index) {
		Object value = args.get(index);
		if (!(value instanceof Long)) {
			throw error(node, function + ": argument " + (index + 1) + " must be an int, got " + describe(value));
		}
		long l = (Long) value;
		if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
			throw error(node, function + ": argument " + (index + 1) + " is out of range: " + l);
		}
		return (int) l;
	}

	private static World worldArg(AstNode node, String function, Object value) {
		if (!(value instanceof World)) {
			throw error(node, function + ": argument must be a world, got " + describe(value));
		}
		return (World) value;
	}

	private static Agent agentArg(AstNode node, String function, Object value) {
		if (!(value instanceof Agent)) {
			throw error(node, function + ": argument must be an agent, got " + describe(value));
		}
		return (Agent) value;
	}

	// EXPRESSIONS

	@Override
	public Object visit(BinaryOp node, ExecutionContext context) {
		// both operands are always evaluated, left first
		Object left = eval(node.getLeft(), context);
		Object right = eval(node.getRight(), context);
		Operator op = node.getOperator();
		if (op.isArithmetic()) {
			return arithmetic(node, op, left, right);
		}
		if (op.isRelational()) {
			return Boolean.valueOf(compare(node, op, left, right));
		}
		if (op == Operator.AND) {
			return Boolean.valueOf(truthy(left) && truthy(right));
		}
		return Boolean.valueOf(truthy(left) || truthy(right));
	}

	private static Long arithmetic(BinaryOp node, Operator op, Object left, Object right) {
		if (!(left instanceof Long) || !(right instanceof Long)) {
			throw error(node, "Operator " + op + " requires int operands, got " + describe(left) + " and " + describe(right));
		}
		long l = (Long) left;
		long r = (Long) right;
		try {
			switch (op) {
			case PLUS:
				return Math.addExact(l, r);
			case MINUS:
				return Math.subtractExact(l, r);
			case MULTIPLY:
				return Math.multiplyExact(l, r);
			case DIVIDE:
				if (r == 0) {
					throw error(node, "Division by zero");
				}
				if (l == Long.MIN_VALUE && r == -1) {
					throw new ArithmeticException("long overflow");
				}
				return Math.floorDiv(l, r);
			default:
				throw error(node, "Unknown arithmetic operator: " + op);
			}
		} catch (ArithmeticException e) {
			throw new CleanRuntimeException(node.getLineNumber(), "Integer overflow in " + l + " " + op + " " + r, e);
		}
	}

	@SuppressWarnings("unchecked")
	private static boolean compare(BinaryOp node, Operator op, Object left, Object right) {
		if (left == null || right == null || left.getClass() != right.getClass()) {
			throw error(node, "Operator " + op + " requires operands of the same type, got " + describe(left) + " and " + describe(right));
		}
		if (op == Operator.EQ) {
			return left.equals(right);
		}
		if (op == Operator.NEQ) {
			return !left.equals(right);
		}
		if (!(left instanceof Long || left instanceof String || left instanceof Boolean)) {
			throw error(node, "Operator " + op + " cannot order " + describe(left) + " values");
		}
		int c = ((Comparable<Object>) left).compareTo(right);
		switch (op) {
		case LT:
			return c < 0;
		case LE:
			return c <= 0;
		case GT:
			return c > 0;
		case GE:
			return c >= 0;
		default:
			throw error(node, "Unknown relational operator: " + op);
		}
	}

	private static boolean truthy(Object value) {
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		if (value instanceof Long) {
			return (Long) value != 0;
		}
		if (value instanceof String) {
			return !((String) value).isEmpty();
		}
		return value != null && value != NO_VALUE;
	}

	@Override
	public Object visit(UnaryOp node, ExecutionContext context) {
		Object value = eval(node.getOperand(), context);
		switch (node.getOperator()) {
		case NOT:
			return Boolean.valueOf(!truthy(value));
		case NEGATE:
			if (!(value instanceof Long)) {
				throw error(node, "Unary - requires an int, got " + describe(value));
			}
			try {
				return Math.negateExact((Long) value);
			} catch (ArithmeticException e) {
				throw new CleanRuntimeException(node.getLineNumber(), "Integer overflow in -" + value, e);
			}
		case PLUS:
			if (!(value instanceof Long)) {
				throw error(node, "Unary + requires an int, got " + describe(value));
			}
			return value;
		default:
			throw error(node, "Unknown unary operator: " + node.getOperator());
		}
	}

	@Override
	public Object visit(Literal node, ExecutionContext context) {
		String text = node.getText();
		switch (node.getLiteralKind()) {
		case INT:
			try {
				return Long.valueOf(text);
			} catch (NumberFormatException e) {
				throw new CleanRuntimeException(node.getLineNumber(), "Integer literal out of range: " + text, e);
			}
		case STRING:
			return text;
		case BOOL:
			return Boolean.valueOf("true".equalsIgnoreCase(text));
		case DIR:
			try {
				return Direction.fromSymbol(text);
			} catch (IllegalArgumentException e) {
				throw new CleanRuntimeException(node.getLineNumber(), e.getMessage(), e);
			}
		default:
			throw error(node, "Unknown literal kind: " + node.getLiteralKind());
		}
	}

	// innermost frame first, then globals
	@Override
	public Object visit(Identifier node, ExecutionContext context) {
		String key = node.getName().getKey();
		RuntimeStack stack = context.getStack();
		if (stack.hasLocal(key)) {
			return stack.getLocal(key);
		}
		Map<String, Object> globals = context.getGlobalMap();
		if (globals.containsKey(key)) {
			return globals.get(key);
		}
		throw error(node, "Undeclared variable: " + node.getName());
	}

	@Override
	public Object visit(WorldRef node, ExecutionContext context) {
		if (context.getWorld() == null) {
			throw error(node, "world not initialized");
		}
		return context.getWorld();
	}

	@Override
	public Object visit(AgentRef node, ExecutionContext context) {
		if (context.getAgent() == null) {
			throw error(node, "agent not initialized");
		}
		return context.getAgent();
	}

	private static String describe(Object value) {
		if (value == null || value == NO_VALUE) {
			return "no value";
		}
		if (value instanceof Long) {
			return "int " + value;
		}
		if (value instanceof Boolean) {
			return "bool " + value;
		}
		if (value instanceof String) {
			return "string \"" + value + "\"";
		}
		if (value instanceof Direction) {
			return "dir " + value;
		}
		return value.toString();
	}
}
