package com.cultour.validation;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * The built-in field rules. Every rule except {@link #required()} passes on a null value or a
 * blank string, so an optional field is only checked when it is present.
 */
public final class Rules {

  private static final Pattern EMAIL_PATTERN =
      Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

  private static final UUID NIL_UUID = new UUID(0L, 0L);

  static final int MIN_PASSWORD_LENGTH = 8;

  private Rules() {}

  /**
   * Fails on the zero value of the field's type: null, a blank string, an empty collection or
   * map, or a zero number.
   */
  public static Rule required() {
    return new SimpleRule("required") {
      @Override
      public Optional<String> check(Object value) {
        return isZero(value) ? Optional.of("is required") : Optional.empty();
      }
    };
  }

  /** Minimum length for strings and collections, minimum value for numbers. */
  public static Rule min(long bound) {
    return new SimpleRule("min") {
      @Override
      public Optional<String> check(Object value) {
        if (isAbsent(value)) {
          return Optional.empty();
        }
        if (value instanceof Number) {
          return toDecimal((Number) value).compareTo(BigDecimal.valueOf(bound)) < 0
              ? Optional.of("must be at least " + bound)
              : Optional.empty();
        }
        Integer size = sizeOf(value);
        if (size != null && size < bound) {
          return Optional.of("must have a length of at least " + bound);
        }
        return Optional.empty();
      }
    };
  }

  /** Maximum length for strings and collections, maximum value for numbers. */
  public static Rule max(long bound) {
    return new SimpleRule("max") {
      @Override
      public Optional<String> check(Object value) {
        if (isAbsent(value)) {
          return Optional.empty();
        }
        if (value instanceof Number) {
          return toDecimal((Number) value).compareTo(BigDecimal.valueOf(bound)) > 0
              ? Optional.of("must be at most " + bound)
              : Optional.empty();
        }
        Integer size = sizeOf(value);
        if (size != null && size > bound) {
          return Optional.of("must have a length of at most " + bound);
        }
        return Optional.empty();
      }
    };
  }

  public static Rule email() {
    return new SimpleRule("email") {
      @Override
      public Optional<String> check(Object value) {
        if (isAbsent(value)) {
          return Optional.empty();
        }
        return EMAIL_PATTERN.matcher(value.toString()).matches()
            ? Optional.empty()
            : Optional.of("must be a valid email address");
      }
    };
  }

  /** Accepts a {@link UUID} or its string form, rejecting the all-zero identifier. */
  public static Rule identifier() {
    return new SimpleRule("identifier") {
      @Override
      public Optional<String> check(Object value) {
        if (isAbsent(value)) {
          return Optional.empty();
        }
        UUID uuid;
        if (value instanceof UUID) {
          uuid = (UUID) value;
        } else {
          try {
            uuid = UUID.fromString(value.toString());
          } catch (IllegalArgumentException e) {
            return Optional.of("must be a valid identifier");
          }
        }
        return NIL_UUID.equals(uuid)
            ? Optional.of("must not be the nil identifier")
            : Optional.empty();
      }
    };
  }

  /**
   * Password complexity. Every unmet requirement is listed in the one message, so the caller
   * learns all of them at once.
   */
  public static Rule password() {
    return new SimpleRule("password") {
      @Override
      public Optional<String> check(Object value) {
        if (isAbsent(value)) {
          return Optional.empty();
        }
        String password = value.toString();
        List<String> missing = new ArrayList<>();
        if (password.length() < MIN_PASSWORD_LENGTH) {
          missing.add("at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (password.chars().noneMatch(Character::isUpperCase)) {
          missing.add("one uppercase letter");
        }
        if (password.chars().noneMatch(Character::isLowerCase)) {
          missing.add("one lowercase letter");
        }
        if (password.chars().noneMatch(Character::isDigit)) {
          missing.add("one digit");
        }
        if (password.chars().noneMatch(Rules::isSymbol)) {
          missing.add("one symbol");
        }
        if (missing.isEmpty()) {
          return Optional.empty();
        }
        return Optional.of("must contain " + Joiner.on(", ").join(missing));
      }
    };
  }

  /** The value's string form must be one of {@code allowed}. */
  public static Rule oneOf(String... allowed) {
    ImmutableSet<String> values = ImmutableSet.copyOf(allowed);
    return new SimpleRule("oneof") {
      @Override
      public Optional<String> check(Object value) {
        if (isAbsent(value) || values.contains(value.toString())) {
          return Optional.empty();
        }
        return Optional.of("must be one of " + Joiner.on(", ").join(values));
      }
    };
  }

  static boolean isAbsent(Object value) {
    return value == null || (value instanceof CharSequence && value.toString().trim().isEmpty());
  }

  static boolean isZero(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof CharSequence) {
      return value.toString().trim().isEmpty();
    }
    if (value instanceof Collection) {
      return ((Collection<?>) value).isEmpty();
    }
    if (value instanceof Map) {
      return ((Map<?, ?>) value).isEmpty();
    }
    if (value instanceof Number) {
      return toDecimal((Number) value).signum() == 0;
    }
    return false;
  }

  private static Integer sizeOf(Object value) {
    if (value instanceof CharSequence) {
      return ((CharSequence) value).length();
    }
    if (value instanceof Collection) {
      return ((Collection<?>) value).size();
    }
    if (value instanceof Map) {
      return ((Map<?, ?>) value).size();
    }
    return null;
  }

  private static BigDecimal toDecimal(Number number) {
    if (number instanceof BigDecimal) {
      return (BigDecimal) number;
    }
    return new BigDecimal(number.toString());
  }

  private static boolean isSymbol(int c) {
    return !Character.isLetterOrDigit(c) && !Character.isWhitespace(c);
  }

  private abstract static class SimpleRule implements Rule {
    private final String name;

    SimpleRule(String name) {
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }
  }
}
