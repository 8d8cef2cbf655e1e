package org.metricshub.cleanworld;


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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.metricshub.cleanworld.ast.Program;
import org.metricshub.cleanworld.backend.ExecutionContext;
import org.metricshub.cleanworld.backend.Interpreter;
import org.metricshub.cleanworld.frontend.CleanParser;
import org.metricshub.cleanworld.frontend.CstNode;
import org.metricshub.cleanworld.frontend.CstToAst;
import org.metricshub.cleanworld.frontend.ScriptLexer;
import org.metricshub.cleanworld.frontend.Token;
import org.metricshub.cleanworld.semantic.SemanticAnalyzer;
import org.metricshub.cleanworld.util.CleanLogger;
import org.metricshub.cleanworld.util.CleanSettings;
import org.metricshub.cleanworld.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing, analysis and execution of a CleanWorld
 * program. This class is intended to be called from Java code, or from
 * {@link Cli}.
 * <p>
 * A program goes through the following stages:
 * <ul>
 * <li>Scan the program text into a token stream ({@link ScriptLexer}), or
 * read a token listing produced elsewhere.
 * <li>Parse the tokens into a concrete syntax tree ({@link CleanParser}).
 * <li>Transform the concrete syntax tree into an abstract syntax tree
 * ({@link CstToAst}).
 * <li>Check scopes and types and annotate the tree
 * ({@link SemanticAnalyzer}).
 * <li>Walk the tree to execute it ({@link Interpreter}).
 * </ul>
 * Each stage reports the first error it finds by throwing its own unchecked
 * exception, carrying a line number.
 */
public class CleanWorld {

	private static final Logger LOG = CleanLogger.getLogger(CleanWorld.class);

	/**
	 * The last concrete syntax tree produced during compilation.
	 */
	private CstNode lastCst;

	/**
	 * The last abstract syntax tree produced during compilation.
	 */
	private Program lastAst;

	/**
	 * Returns the last concrete syntax tree produced by {@link #parse(List)} or
	 * a <code>compile</code> method.
	 *
	 * @return the last {@link CstNode}, or {@code null} if no parse succeeded
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public CstNode getLastCst() {
		return lastCst;
	}

	/**
	 * Returns the last abstract syntax tree produced by a <code>compile</code>
	 * method, annotated with types when the semantic analysis succeeded.
	 *
	 * @return the last {@link Program}, or {@code null} if no compilation got
	 *         that far
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Program getLastAst() {
		return lastAst;
	}

	/**
	 * @param source program text
	 * @return the token stream of the program
	 */
	public List<Token> tokenize(String source) {
		List<Token> tokens = ScriptLexer.tokenize(source);
		LOG.debug("Scanned {} tokens", tokens.size());
		return tokens;
	}

	/**
	 * @param tokens token stream
	 * @return the concrete syntax tree of the program
	 * @throws org.metricshub.cleanworld.frontend.ParserException upon a syntax
	 *         error
	 */
	public CstNode parse(List<Token> tokens) {
		lastCst = null;
		CstNode cst = new CleanParser(tokens).parse();
		lastCst = cst;
		LOG.debug("Parsed {} tokens", tokens.size());
		return cst;
	}

	/**
	 * Parse, transform and check a token stream.
	 *
	 * @param tokens token stream
	 * @return the checked abstract syntax tree, ready to be invoked
	 * @throws org.metricshub.cleanworld.frontend.ParserException upon a syntax
	 *         error
	 * @throws org.metricshub.cleanworld.semantic.SemanticException upon a scope
	 *         or type error
	 */
	public Program compile(List<Token> tokens) {
		lastAst = null;
		CstNode cst = parse(tokens);
		Program program = new CstToAst().transform(cst);
		lastAst = program;
		LOG.debug("Built the syntax tree of program {}", program.getName());
		new SemanticAnalyzer().analyze(program);
		LOG.debug("Static semantics check of program {}: SUCCESS", program.getName());
		return program;
	}

	/**
	 * Scan, parse, transform and check a program.
	 *
	 * @param source program text
	 * @return the checked abstract syntax tree, ready to be invoked
	 */
	public Program compile(String source) {
		return compile(tokenize(source));
	}

	/**
	 * Scan, parse, transform and check a program.
	 *
	 * @param script program source
	 * @return the checked abstract syntax tree, ready to be invoked
	 * @throws IOException if the program cannot be read
	 */
	public Program compile(ScriptSource script) throws IOException {
		LOG.debug("Compiling {}", script.getDescription());
		return compile(script.readFully());
	}

	/**
	 * Execute a checked program.
	 *
	 * @param program program returned by a <code>compile</code> method
	 * @param settings run settings (output stream, loop cap, seed)
	 * @return the state of the finished run
	 * @throws org.metricshub.cleanworld.jrt.CleanRuntimeException upon a
	 *         runtime error
	 */
	public ExecutionContext invoke(Program program, CleanSettings settings) {
		return new Interpreter().execute(program, settings);
	}

	/**
	 * Compile and execute a program.
	 *
	 * @param script program source
	 * @param settings run settings
	 * @return the state of the finished run
	 * @throws IOException if the program cannot be read
	 */
	public ExecutionContext invoke(ScriptSource script, CleanSettings settings) throws IOException {
		return invoke(compile(script), settings);
	}

	/**
	 * Compile and execute a program with the default settings, and return what
	 * it printed.
	 *
	 * @param source program text
	 * @return the printed output
	 */
	public String run(String source) {
		return run(source, new CleanSettings());
	}

	/**
	 * Compile and execute a program and return what it printed.
	 * <p>
	 * The loop cap and seed are taken from the given settings; its output
	 * stream is left untouched and not written to.
	 *
	 * @param source program text
	 * @param settings run settings
	 * @return the printed output
	 */
	public String run(String source, CleanSettings settings) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		CleanSettings captured = new CleanSettings();
		captured.setMaxLoopIterations(settings.getMaxLoopIterations());
		captured.setRandomSeed(settings.getRandomSeed());
		captured.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8));
		invoke(compile(source), captured);
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}
}
