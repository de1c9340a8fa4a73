package com.gentoro.projectkit.source;

/** One configured source location. */
public record SourceConfig(String uri) {}
