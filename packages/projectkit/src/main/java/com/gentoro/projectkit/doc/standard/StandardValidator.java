package com.gentoro.projectkit.doc.standard;

import com.gentoro.projectkit.loader.ResourceValidator;
import com.gentoro.projectkit.loader.Violations;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/** Structural rules of a documentation standard. */
public class StandardValidator implements ResourceValidator<Standard> {
  public static final Set<String> RULE_LEVELS =
      Set.of("must", "should", "may", "recommended", "optional");

  static final Pattern KEBAB_CASE = Pattern.compile("^[a-z0-9]+(?:-[a-z0-9]+)*$");
  static final Pattern ISO_639_1 = Pattern.compile("^[a-z]{2}$");
  static final Pattern NAME_FORMAT = Pattern.compile("^[a-zA-Z0-9\\s\\-]+$");

  private static final int TEXT_MIN = 10;
  private static final int TEXT_MAX = 500;

  @Override
  public List<String> validate(Standard standard) {
    Violations v = new Violations();
    if (v.required("metadata", standard.metadata())) {
      validateMetadata(v, standard.metadata());
    }
    if (v.required("specification", standard.specification())) {
      validateSpecification(v, standard.specification());
    }
    if (standard.definitions() != null) {
      validateDefinitions(v, standard.definitions());
    }
    if (v.required("requirements", standard.requirements())) {
      validateRequirements(v, standard.requirements());
    }
    if (standard.goldenPath() != null) {
      validateGoldenPath(v, standard.goldenPath());
    }
    if (v.required("examples", standard.examples())) {
      Standard.Examples examples = standard.examples();
      if (v.notEmpty("examples.good", examples.good())) {
        v.each("examples.good", examples.good(), (p, e) -> validateExample(v, p, e));
      }
      v.each("examples.bad", examples.bad(), (p, e) -> validateExample(v, p, e));
    }
    v.each(
        "references",
        standard.references(),
        (p, ref) -> {
          if (!v.required(p, ref)) return;
          text(v, p + ".title", ref.title(), 1, 200);
          text(v, p + ".type", ref.type(), 1, 50);
          if (v.required(p + ".uri", ref.uri())) v.url(p + ".uri", ref.uri());
        });
    return v.toList();
  }

  private void validateMetadata(Violations v, Standard.Metadata m) {
    if (v.required("metadata.id", m.id())) {
      v.matches("metadata.id", m.id(), KEBAB_CASE, "kebab-case");
      v.length("metadata.id", m.id(), 1, 100);
    }
    name(v, "metadata.name", m.name());
    if (v.required("metadata.version", m.version())) {
      v.semver("metadata.version", m.version());
    }
    if (v.notEmpty("metadata.tags", m.tags())) {
      v.each(
          "metadata.tags",
          m.tags(),
          (p, tag) -> {
            if (!v.required(p, tag)) return;
            v.matches(p, tag, KEBAB_CASE, "kebab-case");
            v.length(p, tag, 1, 50);
          });
    }
    if (v.required("metadata.scope", m.scope())) {
      Standard.Scope scope = m.scope();
      if (v.notEmpty("metadata.scope.languages", scope.languages())) {
        v.each(
            "metadata.scope.languages",
            scope.languages(),
            (p, lang) -> v.matches(p, lang, ISO_639_1, "an ISO 639-1 language code"));
      }
      v.each("metadata.scope.appliesTo", scope.appliesTo(), (p, s) -> v.length(p, s, 1, 100));
      v.each(
          "metadata.scope.notApplicableTo",
          scope.notApplicableTo(),
          (p, s) -> v.length(p, s, 1, 100));
    }
    if (v.required("metadata.relations", m.relations())) {
      v.each("metadata.relations.standard", m.relations().standard(), v::url);
    }
  }

  private void validateSpecification(Violations v, Standard.Specification s) {
    text(v, "specification.purpose", s.purpose(), TEXT_MIN, TEXT_MAX);
    if (v.notEmpty("specification.goals", s.goals())) {
      v.each("specification.goals", s.goals(), (p, g) -> v.length(p, g, TEXT_MIN, TEXT_MAX));
    }
    v.each("specification.nonGoals", s.nonGoals(), (p, g) -> v.length(p, g, TEXT_MIN, TEXT_MAX));
  }

  private void validateDefinitions(Violations v, Standard.Definitions d) {
    v.each(
        "definitions.fields",
        d.fields(),
        (p, f) -> {
          if (v.required(p, f)) name(v, p + ".fieldName", f.fieldName());
        });
    v.each(
        "definitions.terms",
        d.terms(),
        (p, t) -> {
          if (!v.required(p, t)) return;
          text(v, p + ".abbreviation", t.abbreviation(), 1, 50);
          name(v, p + ".term", t.term());
          text(v, p + ".meaning", t.meaning(), TEXT_MIN, TEXT_MAX);
        });
  }

  private void validateRequirements(Violations v, Standard.Requirements r) {
    if (!v.notEmpty("requirements.rules", r.rules())) return;
    v.each(
        "requirements.rules",
        r.rules(),
        (p, rule) -> {
          if (!v.required(p, rule)) return;
          if (v.required(p + ".level", rule.level())) {
            v.oneOf(p + ".level", rule.level(), RULE_LEVELS);
          }
          text(v, p + ".statement", rule.statement(), TEXT_MIN, TEXT_MAX);
          text(v, p + ".rationale", rule.rationale(), TEXT_MIN, TEXT_MAX);
          v.each(
              p + ".exceptions",
              rule.exceptions(),
              (ep, ex) -> {
                if (v.required(ep, ex)) text(v, ep + ".when", ex.when(), TEXT_MIN, TEXT_MAX);
              });
          v.each(
              p + ".verificationMethod",
              rule.verificationMethod(),
              (mp, method) -> {
                if (!v.required(mp, method)) return;
                text(v, mp + ".type", method.type(), TEXT_MIN, TEXT_MAX);
                text(v, mp + ".hint", method.hint(), TEXT_MIN, TEXT_MAX);
              });
        });
  }

  private void validateGoldenPath(Violations v, Standard.GoldenPath g) {
    steps(v, "goldenPath.steps", g.steps());
    v.each(
        "goldenPath.examples",
        g.examples(),
        (p, ex) -> {
          if (!v.required(p, ex)) return;
          name(v, p + ".name", ex.name());
          v.each(p + ".when", ex.when(), (wp, w) -> v.length(wp, w, TEXT_MIN, TEXT_MAX));
          steps(v, p + ".steps", ex.steps());
          v.each(
              p + ".examples",
              ex.examples(),
              (fp, file) -> {
                if (!v.required(fp, file)) return;
                text(v, fp + ".path", file.path(), 1, 500);
                v.required(fp + ".snippet", file.snippet());
              });
        });
  }

  private void validateExample(Violations v, String path, Standard.Example e) {
    if (!v.required(path, e)) return;
    text(v, path + ".title", e.title(), 1, 200);
    text(v, path + ".language", e.language(), 2, 10);
    v.required(path + ".snippet", e.snippet());
    text(v, path + ".reason", e.reason(), TEXT_MIN, TEXT_MAX);
  }

  private void steps(Violations v, String path, List<String> steps) {
    if (v.notEmpty(path, steps)) {
      v.each(path, steps, (p, s) -> v.length(p, s, TEXT_MIN, TEXT_MAX));
    }
  }

  private void name(Violations v, String path, String value) {
    if (v.required(path, value)) {
      v.matches(path, value, NAME_FORMAT, "letters, digits, spaces and dashes");
      v.length(path, value, 1, 200);
    }
  }

  private void text(Violations v, String path, String value, int min, int max) {
    if (v.required(path, value)) v.length(path, value, min, max);
  }
}
