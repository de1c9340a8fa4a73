package com.gentoro.projectkit.rulebook;

import com.gentoro.projectkit.fs.SourceFs;
import com.gentoro.projectkit.source.LocalDriver;

/** Serves {@code rulebook://<path>} URIs as directories relative to the rulebook root. */
public class RulebookDriver extends LocalDriver {
  public static final String SCHEME = "rulebook";

  public RulebookDriver(SourceFs rulebookFs) {
    super(SCHEME, rulebookFs);
  }
}
