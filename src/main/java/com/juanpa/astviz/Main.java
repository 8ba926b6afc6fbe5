// File: src/main/java/com/juanpa/astviz/Main.java

package com.juanpa.astviz;

import com.juanpa.astviz.ast.Program;
import com.juanpa.astviz.serialization.ResultSerializer;
import com.juanpa.astviz.service.CompilerPipeline;
import com.juanpa.astviz.service.ParseResult;
import com.juanpa.astviz.service.SemanticAnalysisResult;
import com.juanpa.astviz.service.TokenizeResult;
import com.juanpa.astviz.service.VisualizationResult;
import com.juanpa.astviz.util.AstvizConfig;
import com.juanpa.astviz.util.ConfigLoader;
import com.juanpa.astviz.util.Diagnostic;
import com.juanpa.astviz.util.ErrorReporter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 * astviz &lt;tokenize|parse|visualize|analyze&gt; [--json] (&lt;file&gt; | -e &lt;source&gt;)
 * </pre>
 * Exit status is 0 on success, 1 when the operation failed and 2 on a usage error.
 */
public class Main
{
	static final int EXIT_OK = 0;
	static final int EXIT_FAILED = 1;
	static final int EXIT_USAGE = 2;

	private static final String USAGE = "Usage: astviz <tokenize|parse|visualize|analyze> [--json] (<file> | -e <source>)";

	public static void main(String[] args)
	{
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * Runs one command, writing results to {@code out} and errors to {@code err}.
	 *
	 * @return The exit status.
	 */
	static int run(String[] args, PrintStream out, PrintStream err)
	{
		// 1. Argument parsing for flags
		boolean json = false;
		String inlineSource = null;
		List<String> mainArgs = new ArrayList<>();
		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			if (arg.equals("--json"))
			{
				json = true;
			}
			else if (arg.equals("-e"))
			{
				if (i + 1 >= args.length)
				{
					err.println("Error: -e needs a source argument.");
					err.println(USAGE);
					return EXIT_USAGE;
				}
				inlineSource = args[++i];
			}
			else
			{
				mainArgs.add(arg);
			}
		}

		int expectedArgs = inlineSource == null ? 2 : 1;
		if (mainArgs.size() != expectedArgs)
		{
			err.println(USAGE);
			return EXIT_USAGE;
		}

		String command = mainArgs.get(0);
		if (!List.of("tokenize", "parse", "visualize", "analyze").contains(command))
		{
			err.println("Error: Unknown command '" + command + "'.");
			err.println(USAGE);
			return EXIT_USAGE;
		}

		// 2. Load configuration
		AstvizConfig config;
		try
		{
			config = new ConfigLoader().load();
		}
		catch (IllegalArgumentException e)
		{
			err.println("Error: Invalid configuration: " + e.getMessage());
			return EXIT_USAGE;
		}

		// 3. Read the source
		String source = inlineSource;
		if (source == null)
		{
			Path inputPath = Paths.get(mainArgs.get(1));
			if (!Files.isRegularFile(inputPath))
			{
				err.println("Error: Input file not found: " + inputPath);
				return EXIT_USAGE;
			}
			try
			{
				source = Files.readString(inputPath, StandardCharsets.UTF_8);
			}
			catch (IOException e)
			{
				err.println("Error: Could not read " + inputPath + ": " + e.getMessage());
				return EXIT_FAILED;
			}
		}

		// 4. Run the operation
		CompilerPipeline pipeline = new CompilerPipeline(config);
		ErrorReporter errorReporter = new ErrorReporter();
		ResultSerializer serializer = new ResultSerializer(config.isPrettyJson());
		boolean success;
		switch (command)
		{
			case "tokenize":
			{
				TokenizeResult result = pipeline.tokenize(source, errorReporter);
				success = result.success();
				if (json)
					out.println(serializer.toJson(result));
				else if (success)
					printTokens(result, out);
				break;
			}
			case "parse":
			{
				ParseResult result = pipeline.parse(source, errorReporter);
				success = result.success();
				if (json)
					out.println(serializer.toJson(result));
				else if (success)
					printProgram(result.ast(), out);
				break;
			}
			case "visualize":
			{
				VisualizationResult result = pipeline.visualize(source, errorReporter);
				success = result.success();
				if (json)
					out.println(serializer.toJson(result));
				else if (success)
					printGraph(result, out);
				break;
			}
			default:
			{
				SemanticAnalysisResult result = pipeline.analyze(source, errorReporter);
				success = result.success();
				if (json)
					out.println(serializer.toJson(result));
				else if (success)
					printAnalysis(result, out);
				break;
			}
		}

		for (Diagnostic diagnostic : errorReporter.getDiagnostics())
		{
			err.println(diagnostic.format());
		}
		return success ? EXIT_OK : EXIT_FAILED;
	}

	private static void printTokens(TokenizeResult result, PrintStream out)
	{
		for (TokenizeResult.TokenInfo token : result.tokens())
		{
			out.printf("%-12s %-20s @%d (%d:%d)%n", token.tokenType(), token.rawValue(), token.position(), token.line(), token.column());
		}
		out.println(result.tokens().size() + " token(s)");
	}

	private static void printProgram(Program program, PrintStream out)
	{
		if (program.isEmpty())
		{
			out.println("(empty program)");
			return;
		}
		program.getStatements().forEach(out::println);
	}

	private static void printGraph(VisualizationResult result, PrintStream out)
	{
		out.println("Nodes:");
		result.nodes().forEach(node -> out.printf("  %-8s %-14s %s%n", node.id(), node.color(), node.label().replace("\n", " | ")));
		out.println("Edges:");
		result.edges().forEach(edge -> out.printf("  %s -> %s [%s]%n", edge.from(), edge.to(), edge.label()));
	}

	private static void printAnalysis(SemanticAnalysisResult result, PrintStream out)
	{
		out.println("--- Steps ---");
		for (SemanticAnalysisResult.StepInfo step : result.steps())
		{
			out.printf("[%d] %-10s %-13s %s%n", step.stepNumber(), step.action(), step.nodeType(), step.description());
			if (step.symbolAdded() != null)
				out.println("      + " + step.symbolAdded());
			if (step.typeCheck() != null)
				out.println("      check: " + step.typeCheck());
			if (step.error() != null)
				out.println("      error: " + step.error());
		}

		out.println("--- Symbol Table ---");
		for (SemanticAnalysisResult.SymbolInfo symbol : result.symbolTable())
		{
			out.printf("%-16s %-9s %-8s %-8s line %d%n", symbol.name(), symbol.symbolType(), symbol.dataType(), symbol.scope(), symbol.line());
		}

		out.println("--- Type Checks ---");
		for (SemanticAnalysisResult.TypeCheckInfo check : result.typeChecks())
		{
			out.printf("%s %s (expected %s, found %s)%s%n", check.valid() ? "OK " : "ERR", check.expression(),
					check.expectedType(), check.actualType(), check.errorMessage() != null ? ": " + check.errorMessage() : "");
		}
	}
}
