package com.cultour.validation;

import java.util.Optional;

/** A single named check applied to one field value. */
public interface Rule {

  /** The rule name reported in violations, e.g. {@code "required"} or {@code "min"}. */
  String name();

  /**
   * Checks a field value.
   *
   * @param value the field value, possibly null
   * @return the violation message without the field name, or empty when the value passes
   */
  Optional<String> check(Object value);
}
