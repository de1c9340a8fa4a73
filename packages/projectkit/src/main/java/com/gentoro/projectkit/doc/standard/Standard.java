package com.gentoro.projectkit.doc.standard;

import com.gentoro.projectkit.utility.CollectionUtility;
import java.util.List;

/**
 * A documentation standard: what it covers, the rules it imposes, a recommended way of following
 * it and good/bad examples. {@code definitions}, {@code goldenPath} and {@code references} are
 * optional.
 */
public record Standard(
    Metadata metadata,
    Specification specification,
    Definitions definitions,
    Requirements requirements,
    GoldenPath goldenPath,
    Examples examples,
    List<Reference> references) {

  public Standard {
    references = CollectionUtility.immutableList(references);
  }

  public record Metadata(
      String id,
      String name,
      String version,
      List<String> tags,
      Scope scope,
      Relations relations) {
    public Metadata {
      tags = CollectionUtility.immutableList(tags);
    }
  }

  public record Scope(
      List<String> languages, List<String> appliesTo, List<String> notApplicableTo) {
    public Scope {
      languages = CollectionUtility.immutableList(languages);
      appliesTo = CollectionUtility.immutableList(appliesTo);
      notApplicableTo = CollectionUtility.immutableList(notApplicableTo);
    }
  }

  /** URLs of related standards. */
  public record Relations(List<String> standard) {
    public Relations {
      standard = CollectionUtility.immutableList(standard);
    }
  }

  public record Specification(String purpose, List<String> goals, List<String> nonGoals) {
    public Specification {
      goals = CollectionUtility.immutableList(goals);
      nonGoals = CollectionUtility.immutableList(nonGoals);
    }
  }

  public record Definitions(List<FieldDefinition> fields, List<TermDefinition> terms) {
    public Definitions {
      fields = CollectionUtility.immutableList(fields);
      terms = CollectionUtility.immutableList(terms);
    }
  }

  public record FieldDefinition(String fieldName) {}

  public record TermDefinition(String abbreviation, String term, String meaning) {}

  public record Requirements(List<Rule> rules) {
    public Requirements {
      rules = CollectionUtility.immutableList(rules);
    }
  }

  /** A single requirement; {@code level} is one of {@link StandardValidator#RULE_LEVELS}. */
  public record Rule(
      String level,
      String statement,
      String rationale,
      List<RuleException> exceptions,
      List<VerificationMethod> verificationMethod) {
    public Rule {
      exceptions = CollectionUtility.immutableList(exceptions);
      verificationMethod = CollectionUtility.immutableList(verificationMethod);
    }
  }

  public record RuleException(String when) {}

  public record VerificationMethod(String type, String hint) {}

  public record GoldenPath(List<String> steps, List<GoldenPathExample> examples) {
    public GoldenPath {
      steps = CollectionUtility.immutableList(steps);
      examples = CollectionUtility.immutableList(examples);
    }
  }

  public record GoldenPathExample(
      String name, List<String> when, List<String> steps, List<GoldenPathFile> examples) {
    public GoldenPathExample {
      when = CollectionUtility.immutableList(when);
      steps = CollectionUtility.immutableList(steps);
      examples = CollectionUtility.immutableList(examples);
    }
  }

  public record GoldenPathFile(String path, String snippet) {}

  public record Examples(List<Example> good, List<Example> bad) {
    public Examples {
      good = CollectionUtility.immutableList(good);
      bad = CollectionUtility.immutableList(bad);
    }
  }

  public record Example(String title, String language, String snippet, String reason) {}

  public record Reference(String title, String type, String uri) {}
}
