package com.gentoro.projectkit.ai.mcp;

import java.util.List;

/** Persistent store of MCP server definitions, sorted by name. */
public interface McpServerRepository {
  List<McpServer> getAll();

  void addMcpServer(McpServer server);

  void removeAll();
}
