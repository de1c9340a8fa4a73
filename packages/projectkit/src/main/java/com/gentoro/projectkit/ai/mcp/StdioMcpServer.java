package com.gentoro.projectkit.ai.mcp;

import com.gentoro.projectkit.utility.CollectionUtility;
import java.util.List;
import java.util.Map;

/** Launch description of an MCP server speaking over stdio. */
public record StdioMcpServer(
    String executablePath, List<String> arguments, Map<String, String> environmentVariables) {

  public StdioMcpServer {
    arguments = CollectionUtility.immutableList(arguments);
    environmentVariables = CollectionUtility.immutableMap(environmentVariables);
  }
}
