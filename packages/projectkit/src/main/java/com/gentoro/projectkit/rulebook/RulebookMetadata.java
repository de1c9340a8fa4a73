package com.gentoro.projectkit.rulebook;

import com.gentoro.projectkit.ai.AiConfig;
import com.gentoro.projectkit.doc.DocConfig;

/**
 * Contents of {@code rulebook.yaml}. Sources listed here use the {@code rulebook://} scheme and
 * point inside the rulebook itself.
 */
public record RulebookMetadata(AiConfig ai, DocConfig doc) {}
