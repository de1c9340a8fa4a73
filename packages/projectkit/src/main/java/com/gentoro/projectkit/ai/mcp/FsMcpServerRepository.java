package com.gentoro.projectkit.ai.mcp;

import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.repository.JsonFsRepository;
import java.util.List;

public class FsMcpServerRepository implements McpServerRepository {
  private final JsonFsRepository<McpServer> store;

  public FsMcpServerRepository(SourceFs fs) {
    this.store =
        new JsonFsRepository<>(
            fs, McpServer.class, McpServer::name, JsonFsRepository.byKey(McpServer::name));
  }

  @Override
  public List<McpServer> getAll() {
    return store.getAll();
  }

  @Override
  public void addMcpServer(McpServer server) {
    store.add(server);
  }

  @Override
  public void removeAll() {
    store.removeAll();
  }
}
