package com.juanpa.astviz.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the errors of one pipeline run and logs each as it is reported.
 */
public class ErrorReporter
{
	private static final Logger logger = LoggerFactory.getLogger(ErrorReporter.class);

	private final List<Diagnostic> diagnostics = new ArrayList<>();

	/**
	 * Reports an error.
	 *
	 * @param diagnostic The error, with its location when known.
	 */
	public void report(Diagnostic diagnostic)
	{
		diagnostics.add(diagnostic);
		logger.debug("{} ({})", diagnostic.format(), diagnostic.stage());
	}

	/**
	 * Reports an error at a location.
	 *
	 * @param stage    The stage reporting it.
	 * @param line     The line number where the error occurred.
	 * @param column   The column number where the error occurred.
	 * @param position The character offset where the error occurred.
	 * @param message  The error message.
	 */
	public void report(Diagnostic.Stage stage, int line, int column, int position, String message)
	{
		report(new Diagnostic(stage, line, column, position, message));
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return !diagnostics.isEmpty();
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	/**
	 * Forgets every reported error.
	 */
	public void reset()
	{
		diagnostics.clear();
	}
}
