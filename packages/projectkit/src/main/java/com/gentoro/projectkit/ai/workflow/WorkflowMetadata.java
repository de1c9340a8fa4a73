package com.gentoro.projectkit.ai.workflow;

public record WorkflowMetadata(String id, String name, String description, String version) {}
