package com.juanpa.astviz.service;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.juanpa.astviz.visualization.TreeGraph;

import java.util.List;

@JsonPropertyOrder({"nodes", "edges", "success", "error"})
public record VisualizationResult(boolean success, List<TreeGraph.Node> nodes, List<TreeGraph.Edge> edges, String error)
{
	public static VisualizationResult success(TreeGraph graph)
	{
		return new VisualizationResult(true, graph.nodes(), graph.edges(), null);
	}

	public static VisualizationResult error(String error)
	{
		return new VisualizationResult(false, List.of(), List.of(), error);
	}
}
