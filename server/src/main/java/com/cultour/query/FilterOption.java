package com.cultour.query;

import com.cultour.common.status.Status;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * One predicate of a list query: {@code field operator value}.
 *
 * @param field the filtered field, by its external (snake_case) name
 * @param operator the comparison to apply
 * @param value the operand; a list for In and NotIn
 */
public record FilterOption(String field, FilterOperator operator, FilterValue value) {

  public static FilterOption equal(String field, String value) {
    return new FilterOption(field, FilterOperator.EQUAL, FilterValue.ofString(value));
  }

  public static FilterOption like(String field, String value) {
    return new FilterOption(field, FilterOperator.LIKE, FilterValue.ofString(value));
  }

  /** Validates the shape of this filter, reporting every problem at once. */
  @Nonnull
  public Status validate() {
    List<String> problems = problems();
    if (problems.isEmpty()) {
      return Status.ok();
    }
    return Status.invalidArgument(Joiner.on("; ").join(problems));
  }

  List<String> problems() {
    List<String> problems = new ArrayList<>();
    if (Strings.isNullOrEmpty(field) || field.trim().isEmpty()) {
      problems.add("filter field is required");
    }
    if (operator == null) {
      problems.add("filter operator is required");
    }
    String label = Strings.isNullOrEmpty(field) ? "filter" : "filter on " + field;
    if (value == null) {
      problems.add(label + " needs a value");
    } else if (operator != null) {
      if (operator.takesList() && !value.isList()) {
        problems.add(label + ": operator " + operator.token() + " needs a list value");
      } else if (!operator.takesList() && value.isList()) {
        problems.add(label + ": operator " + operator.token() + " needs a single value");
      }
    }
    return problems;
  }

  @Override
  public String toString() {
    return field + " " + (operator == null ? "?" : operator.token()) + " " + value;
  }
}
