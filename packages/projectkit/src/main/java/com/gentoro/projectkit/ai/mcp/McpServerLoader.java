package com.gentoro.projectkit.ai.mcp;

import com.gentoro.projectkit.loader.FlatFileLoader;
import com.gentoro.projectkit.loader.ResourceKind;

/** Loads one {@link McpServer} per YAML file. */
public class McpServerLoader extends FlatFileLoader<McpServer> {

  public McpServerLoader() {
    super(ResourceKind.MCP_SERVER, McpServer.class, new McpServerValidator());
  }
}
