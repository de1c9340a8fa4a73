package com.gentoro.projectkit.ai.instruction;

import com.gentoro.projectkit.utility.CollectionUtility;
import java.util.List;

/** A category of rules handed to AI agents, e.g. {@code category: git} with its commit rules. */
public record Instructions(String category, List<String> rules) {

  public Instructions {
    rules = CollectionUtility.immutableList(rules);
  }
}
