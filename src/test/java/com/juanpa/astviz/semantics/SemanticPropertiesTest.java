package com.juanpa.astviz.semantics;

import com.juanpa.astviz.ast.Program;
import com.juanpa.astviz.lexer.Lexer;
import com.juanpa.astviz.parser.ExpressionParser;
import com.juanpa.astviz.visualization.TreeEnumerator;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.StringLength;

import static org.junit.jupiter.api.Assertions.*;

class SemanticPropertiesTest
{
	private static Program parse(String source)
	{
		return new ExpressionParser(new Lexer(source).scanTokens()).parseProgram();
	}

	@Property(tries = 200)
	void stringPlusNumberIsAlwaysInvalid(@ForAll @AlphaChars @StringLength(max = 8) String text,
										 @ForAll @IntRange(min = 0, max = 100_000) int number,
										 @ForAll boolean stringFirst)
	{
		String literal = "\"" + text + "\"";
		String source = stringFirst ? literal + " + " + number : number + " + " + literal;

		AnalysisResult result = new SemanticAnalyzer().analyze(parse(source));

		assertEquals(1, result.typeChecks().size());
		assertFalse(result.typeChecks().get(0).valid());
	}

	@Property(tries = 200)
	void analysisIsDeterministic(@ForAll("programs") String source)
	{
		Program program = parse(source);
		AnalysisResult first = new SemanticAnalyzer().analyze(program);
		AnalysisResult second = new SemanticAnalyzer().analyze(parse(source));
		assertEquals(first, second);
	}

	@Property(tries = 200)
	void everyNodeGetsExactlyOneNumberedStep(@ForAll("programs") String source)
	{
		Program program = parse(source);
		AnalysisResult result = new SemanticAnalyzer().analyze(program);

		assertEquals(new TreeEnumerator().enumerate(program).nodes().size(), result.steps().size());
		for (int i = 0; i < result.steps().size(); i++)
		{
			assertEquals(i + 1, result.steps().get(i).stepNumber());
		}
	}

	@Provide
	Arbitrary<String> programs()
	{
		Arbitrary<String> operand = Arbitraries.of("1", "2.5", "\"s\"", "\"t\"", "a", "b", "f(a)", "g()");
		Arbitrary<String> operator = Arbitraries.of("+", "-", "*", "==", "<", "&&");
		Arbitrary<String> expression = Combinators.combine(operand, operator, operand).as((l, op, r) -> l + " " + op + " " + r);
		Arbitrary<String> statement = Arbitraries.oneOf(
				expression,
				Combinators.combine(Arbitraries.of("a", "b", "c"), expression).as((name, e) -> name + " = " + e));
		return statement.list().ofMinSize(1).ofMaxSize(5).map(list -> String.join("; ", list));
	}
}
