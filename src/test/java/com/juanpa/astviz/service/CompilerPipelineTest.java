package com.juanpa.astviz.service;

import com.juanpa.astviz.util.AstvizConfig;
import com.juanpa.astviz.util.Diagnostic;
import com.juanpa.astviz.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CompilerPipelineTest
{
	private final CompilerPipeline pipeline = new CompilerPipeline();

	private static CompilerPipeline withLimits(int maxLength, int maxDepth)
	{
		Properties props = new Properties();
		props.setProperty(AstvizConfig.MAX_SOURCE_LENGTH, String.valueOf(maxLength));
		props.setProperty(AstvizConfig.MAX_NESTING_DEPTH, String.valueOf(maxDepth));
		return new CompilerPipeline(new AstvizConfig(props));
	}

	@Test
	void tokenizeReportsCategoriesAndPositions()
	{
		TokenizeResult result = pipeline.tokenize("id2 = \"Mi nombre es Levi\"");

		assertTrue(result.success());
		assertNull(result.error());
		assertEquals(List.of(
						new TokenizeResult.TokenInfo("Identifier", "id2", 0, 1, 1),
						new TokenizeResult.TokenInfo("Operator", "=", 4, 1, 5),
						new TokenizeResult.TokenInfo("String", "\"Mi nombre es Levi\"", 6, 1, 7)),
				result.tokens());
	}

	@Test
	void tokenizeEmptyInput()
	{
		TokenizeResult result = pipeline.tokenize("");
		assertTrue(result.success());
		assertTrue(result.tokens().isEmpty());
	}

	@Test
	void tokenizeFailureCarriesTheMessage()
	{
		ErrorReporter errorReporter = new ErrorReporter();
		TokenizeResult result = pipeline.tokenize("a # b", errorReporter);

		assertFalse(result.success());
		assertEquals("Unexpected character '#' at position 2.", result.error());
		assertTrue(result.tokens().isEmpty());

		Diagnostic diagnostic = errorReporter.getDiagnostics().get(0);
		assertEquals(Diagnostic.Stage.LEXER, diagnostic.stage());
		assertEquals(1, diagnostic.line());
		assertEquals(3, diagnostic.column());
	}

	@Test
	void parseReturnsTheProgram()
	{
		ParseResult result = pipeline.parse("x = 5 + 3 * 2; y");

		assertTrue(result.success());
		assertEquals(2, result.ast().getStatements().size());
	}

	@Test
	void parseErrorIsAFailedResult()
	{
		ErrorReporter errorReporter = new ErrorReporter();
		ParseResult result = pipeline.parse("func(x,)", errorReporter);

		assertFalse(result.success());
		assertNull(result.ast());
		assertTrue(result.error().startsWith("Dangling ','"));
		assertEquals(Diagnostic.Stage.PARSER, errorReporter.getDiagnostics().get(0).stage());
	}

	@Test
	void lexErrorStopsParsing()
	{
		ParseResult result = pipeline.parse("x = 1 $");
		assertFalse(result.success());
		assertTrue(result.error().contains("'$'"));
	}

	@Test
	void visualizeBuildsTheGraph()
	{
		VisualizationResult result = pipeline.visualize("a > b && c <= d");

		assertTrue(result.success());
		assertEquals(7, result.nodes().size());
		assertEquals(6, result.edges().size());
		assertEquals("BinaryOp\n&&", result.nodes().get(0).label());
	}

	@Test
	void visualizeFailure()
	{
		VisualizationResult result = pipeline.visualize("(1 + 2");
		assertFalse(result.success());
		assertTrue(result.nodes().isEmpty());
		assertTrue(result.edges().isEmpty());
	}

	@Test
	void semanticProblemsDoNotFailAnalysis()
	{
		SemanticAnalysisResult result = pipeline.analyze("x = \"a\" + 1");

		assertTrue(result.success());
		assertNull(result.error());
		assertFalse(result.typeChecks().get(0).valid());
		assertEquals(List.of("x"), result.symbolTable().stream().map(SemanticAnalysisResult.SymbolInfo::name).collect(Collectors.toList()));
		assertNotNull(result.analysis());
	}

	@Test
	void analysisStepsAreFlattened()
	{
		SemanticAnalysisResult result = pipeline.analyze("x = 1 + 2");

		SemanticAnalysisResult.StepInfo check = result.steps().get(2);
		assertEquals(3, check.stepNumber());
		assertEquals("type_check", check.action());
		assertEquals("1 + 2: expected Number, found Number (valid)", check.typeCheck());

		SemanticAnalysisResult.SymbolInfo x = result.symbolTable().get(0);
		assertEquals(new SemanticAnalysisResult.SymbolInfo("x", "Variable", "Number", "global", 1), x);
	}

	@Test
	void analysisUsesTheConfiguredScope()
	{
		Properties props = new Properties();
		props.setProperty(AstvizConfig.SCOPE_NAME, "module");
		SemanticAnalysisResult result = new CompilerPipeline(new AstvizConfig(props)).analyze("x = 1");
		assertEquals("module", result.symbolTable().get(0).scope());
	}

	@Test
	void parseErrorPreventsAnalysis()
	{
		SemanticAnalysisResult result = pipeline.analyze("x = ");
		assertFalse(result.success());
		assertTrue(result.steps().isEmpty());
		assertEquals("Unexpected end of input, expected expression.", result.error());
	}

	@Test
	void oversizedSourceIsRejected()
	{
		ErrorReporter errorReporter = new ErrorReporter();
		ParseResult result = withLimits(5, 256).parse("123456", errorReporter);

		assertFalse(result.success());
		assertTrue(result.error().contains("limit of 5"));
		assertEquals(Diagnostic.Stage.INPUT, errorReporter.getDiagnostics().get(0).stage());
		assertFalse(errorReporter.getDiagnostics().get(0).hasLocation());

		assertFalse(withLimits(5, 256).tokenize("123456").success());
	}

	@Test
	void deepNestingIsRejected()
	{
		CompilerPipeline limited = withLimits(1000, 3);

		assertTrue(limited.parse("((1))").success());
		assertFalse(limited.parse("((((1))))").success());
		assertFalse(limited.analyze("- - - -1").success());
	}

	@Test
	void longAssignmentChainIsRejectedBeforeParsing()
	{
		String source = "a=".repeat(49_000) + "1";
		ErrorReporter errorReporter = new ErrorReporter();

		SemanticAnalysisResult result = pipeline.analyze(source, errorReporter);
		assertFalse(result.success());
		assertTrue(result.error().contains("limit of 256"));
		assertEquals(Diagnostic.Stage.INPUT, errorReporter.getDiagnostics().get(0).stage());

		assertFalse(pipeline.visualize(source).success());
		assertFalse(pipeline.parse(source).success());
	}

	@Test
	void longOperatorChainIsRejectedBeforeAnyWalk()
	{
		String source = "1" + "+1".repeat(49_000);

		VisualizationResult visualization = pipeline.visualize(source);
		assertFalse(visualization.success());
		assertEquals("Statement 1 is 49001 levels deep, more than the limit of 256.", visualization.error());

		assertFalse(pipeline.analyze(source).success());
		assertFalse(pipeline.parse(source).success());
		assertTrue(pipeline.tokenize(source).success());
	}

	@Test
	void chainsWithinTheLimitAreAnalyzed()
	{
		CompilerPipeline limited = withLimits(1000, 5);

		assertTrue(limited.analyze("a = b = c = 1").success());
		assertTrue(limited.visualize("1 - 2 - 3 - 4").success());
		assertFalse(limited.visualize("1 - 2 - 3 - 4 - 5 - 6").success());
		assertTrue(limited.analyze("x = 1; y = 2; z = 3; w = 4; v = 5; u = 6").success());
	}
}
