package org.metricshub.cleanworld.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.cleanworld.ast.AssignStmt;
import org.metricshub.cleanworld.ast.AstNode;
import org.metricshub.cleanworld.ast.BinaryOp;
import org.metricshub.cleanworld.ast.FuncDecl;
import org.metricshub.cleanworld.ast.IfStmt;
import org.metricshub.cleanworld.ast.Literal;
import org.metricshub.cleanworld.ast.NodeKind;
import org.metricshub.cleanworld.ast.Operator;
import org.metricshub.cleanworld.ast.PrintStmt;
import org.metricshub.cleanworld.ast.Program;
import org.metricshub.cleanworld.ast.SemanticType;
import org.metricshub.cleanworld.ast.StmtList;
import org.metricshub.cleanworld.ast.UnaryOp;
import org.metricshub.cleanworld.ast.UnaryOperator;
import org.metricshub.cleanworld.ast.WhileStmt;

public class CstToAstTest {

	private static Program transform(String source) {
		return new CstToAst().transform(new CleanParser(ScriptLexer.tokenize(source)).parse());
	}

	private static AstNode printed(String expression) {
		Program program = transform("program p begin func main() begin print(" + expression + "); end end");
		return ((PrintStmt) program.getMain().getBody().getStatements().get(0)).getExpression();
	}

	@Test
	public void testMultiplicationBindsTighter() {
		BinaryOp sum = (BinaryOp) printed("1 + 2 * 3");
		assertEquals(Operator.PLUS, sum.getOperator());
		assertEquals(NodeKind.LITERAL, sum.getLeft().getKind());
		assertEquals(Operator.MULTIPLY, ((BinaryOp) sum.getRight()).getOperator());
	}

	@Test
	public void testLeftAssociativity() {
		BinaryOp outer = (BinaryOp) printed("10 - 4 - 3");
		assertEquals(Operator.MINUS, outer.getOperator());
		BinaryOp inner = (BinaryOp) outer.getLeft();
		assertEquals("10", ((Literal) inner.getLeft()).getText());
		assertEquals("3", ((Literal) outer.getRight()).getText());
	}

	@Test
	public void testLogicalPrecedence() {
		BinaryOp or = (BinaryOp) printed("true || false && !true");
		assertEquals(Operator.OR, or.getOperator());
		BinaryOp and = (BinaryOp) or.getRight();
		assertEquals(Operator.AND, and.getOperator());
		assertEquals(UnaryOperator.NOT, ((UnaryOp) and.getRight()).getOperator());
	}

	@Test
	public void testParenthesesCollapse() {
		BinaryOp product = (BinaryOp) printed("(1 + 2) * 3");
		assertEquals(Operator.MULTIPLY, product.getOperator());
		assertEquals(Operator.PLUS, ((BinaryOp) product.getLeft()).getOperator());
		assertEquals(NodeKind.LITERAL, printed("((7))").getKind());
	}

	@Test
	public void testNestedUnary() {
		UnaryOp outer = (UnaryOp) printed("- -5");
		assertEquals(UnaryOperator.NEGATE, outer.getOperator());
		assertEquals(UnaryOperator.NEGATE, ((UnaryOp) outer.getOperand()).getOperator());
	}

	@Test
	public void testElseIfBecomesNestedIf() {
		Program program = transform(
				"program p begin func main() begin\n"
						+ "if true then print(1);\n"
						+ "else if false then print(2);\n"
						+ "else print(3); end\n"
						+ "end end");
		IfStmt first = (IfStmt) program.getMain().getBody().getStatements().get(0);
		StmtList elseBranch = first.getElseBranch();
		assertEquals(1, elseBranch.getStatements().size());
		IfStmt second = (IfStmt) elseBranch.getStatements().get(0);
		assertEquals(3, second.getLineNumber());
		assertEquals(3, elseBranch.getLineNumber());
		assertEquals(1, second.getElseBranch().getStatements().size());
	}

	@Test
	public void testIfWithoutElse() {
		Program program = transform("program p begin func main() begin if true then end end end");
		IfStmt stmt = (IfStmt) program.getMain().getBody().getStatements().get(0);
		assertNull(stmt.getElseBranch());
		assertTrue(stmt.getThenBranch().isEmpty());
	}

	@Test
	public void testDeclarations() {
		Program program = transform(
				"program Demo begin\n"
						+ "var a, b;\n"
						+ "func f(x: int, s: string): bool begin return true; end\n"
						+ "func g() begin end\n"
						+ "var c;\n"
						+ "func main() begin end\n"
						+ "end");
		assertEquals("Demo", program.getName().getText());
		assertEquals(2, program.getGlobals().size());
		assertEquals(2, program.getGlobals().get(0).getNames().size());
		FuncDecl f = program.getFunctions().get(0);
		assertEquals(SemanticType.BOOL, f.getReturnType());
		assertEquals(SemanticType.STRING, f.getParams().get(1).getDeclaredType());
		FuncDecl g = program.getFunctions().get(1);
		assertEquals(SemanticType.VOID, g.getReturnType());
		assertEquals(4, g.getBody().getLineNumber());
		assertEquals("main", program.getMain().getName().getText());
	}

	@Test
	public void testWorldAndAgentReferences() {
		Program program = transform(
				"program p begin func main() begin\n"
						+ "world = init_world(5, 5);\n"
						+ "Agent = set_agent(WORLD, 1, 1, N);\n"
						+ "end end");
		AssignStmt first = (AssignStmt) program.getMain().getBody().getStatements().get(0);
		assertEquals(NodeKind.WORLD_REF, first.getTarget().getKind());
		assertEquals(NodeKind.FUNC_CALL_EXPR, first.getValue().getKind());
		AssignStmt second = (AssignStmt) program.getMain().getBody().getStatements().get(1);
		assertEquals(NodeKind.AGENT_REF, second.getTarget().getKind());
		AstNode worldArg = second.getValue().getChildren().get(0);
		assertEquals(NodeKind.WORLD_REF, worldArg.getKind());
	}

	@Test
	public void testWhileBody() {
		Program program = transform("program p begin func main() begin while true do break; end end end");
		WhileStmt loop = (WhileStmt) program.getMain().getBody().getStatements().get(0);
		assertEquals(NodeKind.BREAK_STMT, loop.getBody().getStatements().get(0).getKind());
	}

	@Test
	public void testUnquote() {
		assertEquals("a\nb", CstToAst.unquote("\"a\\nb\""));
		assertEquals("tab\there", CstToAst.unquote("\"tab\\there\""));
		assertEquals("say \"hi\" \\", CstToAst.unquote("\"say \\\"hi\\\" \\\\\""));
		assertEquals("", CstToAst.unquote("\"\""));
	}

	@Test
	public void testStringLiteralIsDecoded() {
		Literal literal = (Literal) printed("\"x\\ty\"");
		assertEquals("x\ty", literal.getText());
	}

	@Test
	public void testRejectsForeignTree() {
		assertThrows(IllegalStateException.class, () -> new CstToAst().transform(new CstNode("expr")));
	}

	@Test
	public void testSameInputSameTree() {
		String source = "program p begin var x; func main() begin x = 1 + 2 * 3; print(x); end end";
		assertEquals(transform(source).toTreeString(), transform(source).toTreeString());
	}
}
