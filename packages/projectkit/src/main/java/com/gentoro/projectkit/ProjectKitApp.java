package com.gentoro.projectkit;

import com.gentoro.projectkit.exception.ExceptionUtil;
import com.gentoro.projectkit.exception.ProjectKitException;

public class ProjectKitApp {

  private static final org.slf4j.Logger log =
      com.gentoro.projectkit.logging.LoggingService.getLogger(ProjectKitApp.class);

  public static void main(String[] args) {
    try {
      ProjectKit app = new ProjectKit(args);
      app.initialize();
      app.run();
    } catch (ProjectKitException e) {
      log.error("ProjectKit failed: {}", ExceptionUtil.toErrorDetails(e));
      log.debug("Failure details", e);
      System.exit(1);
    } catch (Exception e) {
      log.error("ProjectKit failed", e);
      System.exit(1);
    }
  }
}
