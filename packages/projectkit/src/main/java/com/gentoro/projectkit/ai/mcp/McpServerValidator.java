package com.gentoro.projectkit.ai.mcp;

import com.gentoro.projectkit.loader.ResourceValidator;
import com.gentoro.projectkit.loader.Violations;
import java.util.List;

public class McpServerValidator implements ResourceValidator<McpServer> {

  @Override
  public List<String> validate(McpServer server) {
    Violations v = new Violations();
    v.required("name", server.name());
    if (v.required("stdio", server.stdio())) {
      v.required("stdio.executablePath", server.stdio().executablePath());
    }
    return v.toList();
  }
}
