package com.gentoro.projectkit;

import com.gentoro.projectkit.action.UpdateAction;
import com.gentoro.projectkit.exception.ConfigException;
import com.gentoro.projectkit.fs.LocalSourceFs;
import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.loader.SourceAggregator;
import com.gentoro.projectkit.logging.LoggingService;
import com.gentoro.projectkit.project.ProjectConfig;
import com.gentoro.projectkit.project.ProjectConfigLoader;
import com.gentoro.projectkit.project.ProjectRepositories;
import com.gentoro.projectkit.source.DriverRegistry;
import com.gentoro.projectkit.source.DriverRegistryImpl;
import com.gentoro.projectkit.source.LocalDriver;
import com.gentoro.projectkit.source.SourceResolverImpl;
import java.io.PrintStream;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

/** Composition root: wires configuration, source drivers, loaders and repositories. */
public class ProjectKit {

  private static final org.slf4j.Logger log = LoggingService.getLogger(ProjectKit.class);

  static final String ROOT_KEY = "projectkit.root";
  static final String HOME_KEY = "projectkit.home";
  static final String EXECUTABLE_PATH_KEY = "projectkit.executable-path";
  static final String EXECUTABLE_PATH_ENV = "PROJECTKIT_BINARY_PATH";
  static final String DEFAULT_EXECUTABLE = "projectkit";

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private DriverRegistry driverRegistry;
  private SourceFs projectFs;

  public ProjectKit(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    Path root = projectRoot();
    this.projectFs = new LocalSourceFs(root);
    this.driverRegistry = new DriverRegistryImpl();
    driverRegistry.registerDriver(new LocalDriver(projectFs));
    log.debug("Project root {}, schemes {}", root, driverRegistry.supportedSchemes());
  }

  /** Execute the mode selected on the command line. */
  public void run() {
    switch (startupParameters.mode()) {
      case StartupParameters.MODE_UPDATE -> update();
      case StartupParameters.MODE_HELP -> printHelp(System.out);
      default -> throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  /** Reload every configured source into the project repositories. */
  public void update() {
    ProjectConfig config =
        new ProjectConfigLoader(
                projectFs,
                configuration().getString(HOME_KEY, System.getProperty("user.home")),
                projectRoot().toString())
            .load();

    new UpdateAction(
            config,
            new SourceAggregator(new SourceResolverImpl(driverRegistry)),
            new ProjectRepositories(projectFs),
            executablePath())
        .run();
    log.info("Project repositories updated");
  }

  Path projectRoot() {
    String configured = configuration().getString(ROOT_KEY, null);
    if (configured == null || configured.isBlank()) {
      return Path.of("").toAbsolutePath();
    }
    return Path.of(configured).toAbsolutePath().normalize();
  }

  /**
   * Command recorded for the self MCP server entry: the configured path, then the {@value
   * #EXECUTABLE_PATH_ENV} environment variable, then the command of the current process.
   */
  String executablePath() {
    String configured = configuration().getString(EXECUTABLE_PATH_KEY, null);
    if (configured != null && !configured.isBlank()) return configured;
    String fromEnv = System.getenv(EXECUTABLE_PATH_ENV);
    if (fromEnv != null && !fromEnv.isBlank()) return fromEnv;
    return ProcessHandle.current().info().command().orElse(DEFAULT_EXECUTABLE);
  }

  static void printHelp(PrintStream out) {
    out.println("Usage: projectkit [--mode update|help] [--config-file <location>]");
    out.println();
    out.println("  update  load every source listed in .projectkit.yaml and refresh");
    out.println("          the repositories under .projectkit/repository");
    out.println("  help    print this message");
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new ConfigException("ProjectKit not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }
}
