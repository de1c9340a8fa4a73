package com.gentoro.projectkit.ai.mcp;

/** An MCP server definition made available to agents. */
public record McpServer(String name, StdioMcpServer stdio) {}
