package com.juanpa.astviz.ast;

import com.juanpa.astviz.ast.expressions.Expression;
import com.juanpa.astviz.lexer.Lexer;
import com.juanpa.astviz.parser.ExpressionParser;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class ExpressionPrinterTest
{
	private final ExpressionPrinter printer = new ExpressionPrinter();

	private static Expression parse(String source)
	{
		return new ExpressionParser(new Lexer(source).scanTokens()).parse();
	}

	@Test
	void printsCanonicalLayout()
	{
		assertEquals("x = 5 + 3 * 2", printer.print(parse("x=5+3*2")));
		assertEquals("result = (a + b) * c", printer.print(parse("result=( a+b )*c")));
		assertEquals("func(x, y + 1)", printer.print(parse("func( x ,y+1 )")));
		assertEquals("-x - !y", printer.print(parse("- x-! y")));
		assertEquals("f()", printer.print(parse("f ( )")));
	}

	@Test
	void keepsNumbersAsWritten()
	{
		assertEquals("2.3e-4 + 4.", printer.print(parse("2.3e-4+4.")));
	}

	@Test
	void requotesStrings()
	{
		assertEquals("s = \"say \\\"hi\\\"\\n\"", printer.print(parse("s = \"say \\\"hi\\\"\\n\"")));
	}

	@Test
	void printsProgramsWithSeparators()
	{
		Program program = new ExpressionParser(new Lexer("a = 1;;b").scanTokens()).parseProgram();
		assertEquals("a = 1; b", printer.print(program));
	}

	@Test
	void memoizingPrinterReusesSubtreeText()
	{
		ExpressionPrinter memoizing = ExpressionPrinter.memoizing();
		Expression tree = parse("(a + 1) * f(\"x\", -b)");

		String text = memoizing.print(tree);
		assertEquals(printer.print(tree), text);
		assertSame(text, memoizing.print(tree));
	}

	@Property(tries = 300)
	void reparsingThePrintedTreeGivesAnEqualTree(@ForAll("expressions") String source)
	{
		Expression tree = parse(source);
		assertEquals(tree, parse(printer.print(tree)));
	}

	@Provide
	Arbitrary<String> expressions()
	{
		Arbitrary<String> nested = Arbitraries.integers().between(0, 4)
				.flatMap(depth -> Arbitraries.recursive(ExpressionPrinterTest::leaves, ExpressionPrinterTest::compose, depth));
		return Arbitraries.oneOf(nested, nested.map(e -> "y = " + e));
	}

	private static Arbitrary<String> leaves()
	{
		return Arbitraries.oneOf(
				Arbitraries.of("0", "7", "42", "3.5", "4.", "1e3", "2.5E-2"),
				Arbitraries.of("a", "b", "total", "_x1"),
				Arbitraries.of("\"\"", "\"hi\"", "\"a b\"", "\"q\\\"t\"", "\"tab\\t\""));
	}

	private static Arbitrary<String> compose(Arbitrary<String> inner)
	{
		Arbitrary<String> operators = Arbitraries.of("+", "-", "*", "/", "<", ">", "<=", ">=", "==", "!=", "&&", "||");
		return Arbitraries.oneOf(
				Combinators.combine(inner, operators, inner).as((l, op, r) -> l + " " + op + " " + r),
				inner.map(e -> "-" + e),
				inner.map(e -> "!" + e),
				inner.map(e -> "(" + e + ")"),
				inner.map(e -> "(v = " + e + ")"),
				inner.map(e -> "f(" + e + ")"),
				Combinators.combine(inner, inner).as((a, b) -> "g(" + a + ", " + b + ")"),
				Arbitraries.just("h()"));
	}
}
