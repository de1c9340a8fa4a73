package com.gentoro.projectkit.ai.instruction;

import com.gentoro.projectkit.loader.ResourceValidator;
import com.gentoro.projectkit.loader.Violations;
import java.util.List;

public class InstructionsValidator implements ResourceValidator<Instructions> {

  @Override
  public List<String> validate(Instructions instructions) {
    Violations v = new Violations();
    v.required("category", instructions.category());
    v.notEmpty("rules", instructions.rules());
    return v.toList();
  }
}
