package com.juanpa.astviz.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.juanpa.astviz.ast.Program;
import com.juanpa.astviz.ast.expressions.Expression;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Renders pipeline results as JSON. Property names are snake_case, and trees are written
 * through {@link AstJsonWriter}.
 */
public class ResultSerializer
{
	private final ObjectMapper mapper;
	private final boolean pretty;

	public ResultSerializer(boolean pretty)
	{
		this.pretty = pretty;
		SimpleModule astModule = new SimpleModule("astviz-ast");
		astModule.addSerializer(Program.class, new ProgramSerializer());
		astModule.addSerializer(Expression.class, new ExpressionSerializer());

		this.mapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.addModule(astModule)
				.build();
	}

	public ObjectMapper getMapper()
	{
		return mapper;
	}

	/**
	 * @param result Any result object of the pipeline, or a tree.
	 */
	public String toJson(Object result)
	{
		try
		{
			if (pretty)
			{
				return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
			}
			return mapper.writeValueAsString(result);
		}
		catch (JsonProcessingException e)
		{
			throw new UncheckedIOException("Could not serialize " + result.getClass().getSimpleName(), e);
		}
	}

	private static final class ProgramSerializer extends StdSerializer<Program>
	{
		ProgramSerializer()
		{
			super(Program.class);
		}

		@Override
		public void serialize(Program program, JsonGenerator gen, SerializerProvider provider) throws IOException
		{
			new AstJsonWriter().write(program).serialize(gen, provider);
		}
	}

	private static final class ExpressionSerializer extends StdSerializer<Expression>
	{
		ExpressionSerializer()
		{
			super(Expression.class);
		}

		@Override
		public void serialize(Expression expression, JsonGenerator gen, SerializerProvider provider) throws IOException
		{
			new AstJsonWriter().write(expression).serialize(gen, provider);
		}
	}
}
