// File: src/main/java/com/juanpa/astviz/service/CompilerPipeline.java

package com.juanpa.astviz.service;

import com.juanpa.astviz.ast.Program;
import com.juanpa.astviz.lexer.LexError;
import com.juanpa.astviz.lexer.Lexer;
import com.juanpa.astviz.lexer.Token;
import com.juanpa.astviz.parser.ExpressionParser;
import com.juanpa.astviz.parser.ParseError;
import com.juanpa.astviz.semantics.AnalysisResult;
import com.juanpa.astviz.semantics.SemanticAnalyzer;
import com.juanpa.astviz.util.AstvizConfig;
import com.juanpa.astviz.util.Debug;
import com.juanpa.astviz.util.Diagnostic;
import com.juanpa.astviz.util.ErrorReporter;
import com.juanpa.astviz.visualization.TreeEnumerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point to the stages for callers that work with source text.
 * Each operation runs the stages it needs (Lexer, then ExpressionParser, then the
 * analyzer or the enumerator) and never throws for bad input: lexical and syntax errors,
 * and inputs over the configured limits, come back as a failed result carrying the message.
 * The forms taking an {@link ErrorReporter} also report the error there with its location.
 * <p>
 * A pipeline holds only its configuration, so one instance may serve any number of threads.
 */
public class CompilerPipeline
{
	private static final Logger logger = LoggerFactory.getLogger(CompilerPipeline.class);

	private final AstvizConfig config;
	private final InputGuard inputGuard;

	public CompilerPipeline()
	{
		this(AstvizConfig.defaults());
	}

	public CompilerPipeline(AstvizConfig config)
	{
		this.config = config;
		this.inputGuard = new InputGuard(config.getMaxSourceLength(), config.getMaxNestingDepth());
	}

	public AstvizConfig getConfig()
	{
		return config;
	}

	/**
	 * Splits the source into tokens, without the end-of-input marker.
	 */
	public TokenizeResult tokenize(String source)
	{
		return tokenize(source, new ErrorReporter());
	}

	public TokenizeResult tokenize(String source, ErrorReporter errorReporter)
	{
		try
		{
			inputGuard.checkSource(source);
			List<Token> tokens = new Lexer(source).tokenize();
			logger.debug("Tokenized {} character(s) into {} token(s)", source.length(), tokens.size());
			return TokenizeResult.success(tokens);
		}
		catch (InputRejectedException | LexError e)
		{
			return TokenizeResult.error(fail(e, errorReporter));
		}
	}

	/**
	 * Parses the source as a program of ';'-separated expressions.
	 */
	public ParseResult parse(String source)
	{
		return parse(source, new ErrorReporter());
	}

	public ParseResult parse(String source, ErrorReporter errorReporter)
	{
		try
		{
			return ParseResult.success(parseProgram(source));
		}
		catch (InputRejectedException | LexError | ParseError e)
		{
			return ParseResult.error(fail(e, errorReporter));
		}
	}

	/**
	 * Parses the source and flattens the tree into nodes and edges.
	 */
	public VisualizationResult visualize(String source)
	{
		return visualize(source, new ErrorReporter());
	}

	public VisualizationResult visualize(String source, ErrorReporter errorReporter)
	{
		try
		{
			Program program = parseProgram(source);
			return VisualizationResult.success(new TreeEnumerator().enumerate(program));
		}
		catch (InputRejectedException | LexError | ParseError e)
		{
			return VisualizationResult.error(fail(e, errorReporter));
		}
	}

	/**
	 * Parses the source and runs semantic analysis over it. Semantic problems do not fail
	 * the operation; they are part of the returned trace.
	 */
	public SemanticAnalysisResult analyze(String source)
	{
		return analyze(source, new ErrorReporter());
	}

	public SemanticAnalysisResult analyze(String source, ErrorReporter errorReporter)
	{
		Program program;
		try
		{
			program = parseProgram(source);
		}
		catch (InputRejectedException | LexError | ParseError e)
		{
			return SemanticAnalysisResult.error(fail(e, errorReporter));
		}

		AnalysisResult analysis = new SemanticAnalyzer(config.getScopeName()).analyze(program);
		logger.debug("Analysis produced {} step(s) and {} type check(s)", analysis.steps().size(), analysis.typeChecks().size());
		return SemanticAnalysisResult.success(analysis);
	}

	/**
	 * Runs the guard, the lexer and the parser, then checks the depth of the tree before
	 * anything walks it. Throws the first error of any of them.
	 */
	private Program parseProgram(String source)
	{
		inputGuard.checkSource(source);
		List<Token> tokens = new Lexer(source).scanTokens();
		inputGuard.checkNesting(tokens);
		try
		{
			Program program = new ExpressionParser(tokens).parseProgram();
			inputGuard.checkDepth(program);
			logger.debug("Parsed {} statement(s)", program.getStatements().size());
			return program;
		}
		finally
		{
			Debug.reset();
		}
	}

	/**
	 * Records the error and returns the message a failed result carries.
	 */
	private static String fail(RuntimeException e, ErrorReporter errorReporter)
	{
		errorReporter.report(toDiagnostic(e));
		return e.getMessage();
	}

	static Diagnostic toDiagnostic(RuntimeException e)
	{
		if (e instanceof LexError)
		{
			LexError error = (LexError) e;
			return new Diagnostic(Diagnostic.Stage.LEXER, error.getLine(), error.getColumn(), error.getPosition(), error.getMessage());
		}
		if (e instanceof ParseError)
		{
			ParseError error = (ParseError) e;
			return new Diagnostic(Diagnostic.Stage.PARSER, error.getLine(), error.getColumn(), error.getPosition(), error.getMessage());
		}
		if (e instanceof InputRejectedException)
		{
			return Diagnostic.unlocated(Diagnostic.Stage.INPUT, e.getMessage());
		}
		throw new IllegalArgumentException("Not an input error: " + e.getClass().getName(), e);
	}
}
