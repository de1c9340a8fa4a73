package com.gentoro.projectkit.loader;

import com.gentoro.projectkit.exception.ExceptionUtil;
import com.gentoro.projectkit.exception.ProjectKitException;
import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.logging.LoggingService;
import com.gentoro.projectkit.source.SourceResolver;
import com.gentoro.projectkit.source.SourcesConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Loads one resource kind from every configured source, in order, and concatenates the results.
 *
 * <p>The first source that fails to resolve or load aborts the aggregation: later sources are not
 * touched and no partial list is returned. No sources at all yield an empty list.
 */
public class SourceAggregator {
  private static final Logger log = LoggingService.getLogger(SourceAggregator.class);

  private final SourceResolver resolver;

  public SourceAggregator(SourceResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  public <T> List<T> aggregate(ResourceKind kind, SourcesConfig config, ResourceLoader<T> loader) {
    return aggregate(kind, config == null ? List.of() : config.uris(), loader);
  }

  public <T> List<T> aggregate(ResourceKind kind, List<String> uris, ResourceLoader<T> loader) {
    List<T> result = new ArrayList<>();
    for (String uri : uris) {
      SourceFs fs;
      try {
        fs = resolver.resolve(uri);
      } catch (ProjectKitException e) {
        throw ExceptionUtil.wrap(
            "resolve " + kind.label() + " source " + uri, e, sourceContext(kind, uri));
      }

      List<T> loaded;
      try {
        loaded = loader.load(fs);
      } catch (ProjectKitException e) {
        throw ExceptionUtil.wrap(
            "load " + kind.label() + " from " + uri, e, sourceContext(kind, uri));
      }
      log.debug("Loaded {} {} from {}", loaded.size(), kind.label(), uri);
      result.addAll(loaded);
    }
    return List.copyOf(result);
  }

  private static Map<String, String> sourceContext(ResourceKind kind, String uri) {
    return Map.of("kind", kind.label(), "uri", String.valueOf(uri));
  }
}
