package com.gentoro.projectkit.ai.workflow;

import com.gentoro.projectkit.loader.FlatFileLoader;
import com.gentoro.projectkit.loader.ResourceKind;

/** Loads one {@link Workflow} per YAML file. */
public class WorkflowLoader extends FlatFileLoader<Workflow> {

  public WorkflowLoader() {
    super(ResourceKind.WORKFLOW, Workflow.class, new WorkflowValidator());
  }
}
