package com.gentoro.projectkit.ai.instruction;

import com.gentoro.projectkit.loader.FlatFileLoader;
import com.gentoro.projectkit.loader.ResourceKind;

/** Loads one {@link Instructions} set per YAML file. */
public class InstructionLoader extends FlatFileLoader<Instructions> {

  public InstructionLoader() {
    super(ResourceKind.INSTRUCTIONS, Instructions.class, new InstructionsValidator());
  }
}
