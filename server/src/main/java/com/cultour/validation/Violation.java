package com.cultour.validation;

/**
 * One failed rule on one field.
 *
 * @param field the field name, prefixed with {@code [i].} for elements of a collection
 * @param rule the failed rule name
 * @param message a human-readable description
 */
public record Violation(String field, String rule, String message) {

  @Override
  public String toString() {
    return field + " " + message;
  }
}
