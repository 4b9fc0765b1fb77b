package com.cultour.validation;

import com.cultour.common.status.Status;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nonnull;

/** The complete list of violations found in a payload. Empty means the payload is valid. */
public final class ValidationResult {

  private static final ValidationResult VALID = new ValidationResult(ImmutableList.of());

  private final ImmutableList<Violation> violations;

  private ValidationResult(ImmutableList<Violation> violations) {
    this.violations = violations;
  }

  public static ValidationResult valid() {
    return VALID;
  }

  public static ValidationResult of(List<Violation> violations) {
    return violations.isEmpty() ? VALID : new ValidationResult(ImmutableList.copyOf(violations));
  }

  public boolean isValid() {
    return violations.isEmpty();
  }

  @Nonnull
  public ImmutableList<Violation> violations() {
    return violations;
  }

  /**
   * Folds every violation into one INVALID_ARGUMENT status, or OK when there are none.
   */
  @Nonnull
  public Status toStatus() {
    if (isValid()) {
      return Status.ok();
    }
    return Status.invalidArgument("validation failed: " + Joiner.on("; ").join(violations));
  }

  @Override
  public String toString() {
    return isValid() ? "valid" : Joiner.on("; ").join(violations);
  }
}
