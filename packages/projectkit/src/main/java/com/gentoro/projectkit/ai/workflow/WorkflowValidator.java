package com.gentoro.projectkit.ai.workflow;

import com.gentoro.projectkit.loader.ResourceValidator;
import com.gentoro.projectkit.loader.Violations;
import java.util.List;
import java.util.regex.Pattern;

public class WorkflowValidator implements ResourceValidator<Workflow> {
  /** Workflow ids double as repository file names. */
  public static final Pattern ID_PATTERN = Pattern.compile("^[a-zA-Z0-9-]+$");

  @Override
  public List<String> validate(Workflow workflow) {
    Violations v = new Violations();
    WorkflowMetadata metadata = workflow.metadata();
    if (v.required("metadata", metadata)) {
      if (v.required("metadata.id", metadata.id())) {
        v.matches("metadata.id", metadata.id(), ID_PATTERN, "alphanumeric with dashes");
      }
      v.required("metadata.name", metadata.name());
      v.required("metadata.description", metadata.description());
      if (v.required("metadata.version", metadata.version())) {
        v.semver("metadata.version", metadata.version());
      }
    }

    if (v.notEmpty("steps", workflow.steps())) {
      v.each(
          "steps",
          workflow.steps(),
          (path, step) -> {
            if (!v.required(path, step)) return;
            v.required(path + ".id", step.id());
            v.required(path + ".name", step.name());
            v.required(path + ".description", step.description());
            v.notEmpty(path + ".instructions", step.instructions());
          });
    }
    return v.toList();
  }
}
