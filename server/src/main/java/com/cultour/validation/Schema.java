package com.cultour.validation;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * A declarative list of field rules for one payload type. Field values are read through plain
 * accessors, so a schema reads like the payload it validates:
 *
 * <pre>
 * Schema&lt;BadgeWrite&gt; schema = Schema.&lt;BadgeWrite&gt;builder()
 *     .field("name", BadgeWrite::name, Rules.required(), Rules.max(100))
 *     .field("iconUrl", BadgeWrite::iconUrl, Rules.max(2048))
 *     .build();
 * </pre>
 *
 * <p>Validation never stops at the first failure. Every rule on every field runs and all
 * violations are returned together.
 *
 * @param <T> the payload type
 */
public final class Schema<T> {

  private final ImmutableList<FieldRules<T>> fields;

  private Schema(ImmutableList<FieldRules<T>> fields) {
    this.fields = fields;
  }

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  /** Validates one payload. A null payload is reported as a single violation. */
  @Nonnull
  public ValidationResult validate(T payload) {
    if (payload == null) {
      return ValidationResult.of(List.of(new Violation("payload", "required", "is required")));
    }
    List<Violation> violations = new ArrayList<>();
    collect(payload, "", violations);
    return ValidationResult.of(violations);
  }

  /**
   * Validates every element of a collection payload, naming violations by element index (for
   * example {@code [2].email}).
   */
  @Nonnull
  public ValidationResult validateAll(List<T> payloads) {
    List<Violation> violations = new ArrayList<>();
    for (int i = 0; i < payloads.size(); i++) {
      T payload = payloads.get(i);
      String prefix = "[" + i + "].";
      if (payload == null) {
        violations.add(new Violation(prefix + "payload", "required", "is required"));
        continue;
      }
      collect(payload, prefix, violations);
    }
    return ValidationResult.of(violations);
  }

  private void collect(T payload, String prefix, List<Violation> violations) {
    for (FieldRules<T> field : fields) {
      Object value = field.accessor().apply(payload);
      for (Rule rule : field.rules()) {
        Optional<String> message = rule.check(value);
        if (message.isPresent()) {
          violations.add(new Violation(prefix + field.name(), rule.name(), message.get()));
        }
      }
    }
  }

  private record FieldRules<T>(
      String name, Function<T, ?> accessor, ImmutableList<Rule> rules) {}

  /** Collects field rule lists in declaration order. */
  public static final class Builder<T> {
    private final ImmutableList.Builder<FieldRules<T>> fields = ImmutableList.builder();

    private Builder() {}

    public Builder<T> field(String name, Function<T, ?> accessor, Rule... rules) {
      fields.add(new FieldRules<>(name, accessor, ImmutableList.copyOf(rules)));
      return this;
    }

    public Schema<T> build() {
      return new Schema<>(fields.build());
    }
  }
}
