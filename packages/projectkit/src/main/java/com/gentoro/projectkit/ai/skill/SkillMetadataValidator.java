package com.gentoro.projectkit.ai.skill;

import com.gentoro.projectkit.loader.ResourceValidator;
import com.gentoro.projectkit.loader.Violations;
import java.util.List;

public class SkillMetadataValidator implements ResourceValidator<SkillMetadata> {
  static final int MAX_DESCRIPTION_LENGTH = 256;

  @Override
  public List<String> validate(SkillMetadata metadata) {
    Violations v = new Violations();
    v.required("name", metadata.name());
    if (v.required("description", metadata.description())) {
      v.maxLength("description", metadata.description(), MAX_DESCRIPTION_LENGTH);
    }
    return v.toList();
  }
}
