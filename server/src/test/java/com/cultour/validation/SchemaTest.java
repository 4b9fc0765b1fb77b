package com.cultour.validation;

import static org.junit.jupiter.api.Assertions.*;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusCode;
import com.cultour.model.BadgeWrite;
import com.cultour.model.UserWrite;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class SchemaTest {

  private record Signup(String email, String password) {}

  private static final Schema<Signup> SIGNUP =
      Schema.<Signup>builder()
          .field("email", Signup::email, Rules.required(), Rules.email())
          .field("password", Signup::password, Rules.required(), Rules.password())
          .build();

  @Test
  void validPayloadHasNoViolations() {
    ValidationResult result = SIGNUP.validate(new Signup("ana@cultour.id", "Str0ng!pass"));
    assertTrue(result.isValid());
    assertTrue(result.toStatus().isOk());
  }

  @Test
  void reportsEveryViolationAtOnce() {
    // Given a payload that breaks a rule on each field
    Signup payload = new Signup("nope", "");

    // When
    ValidationResult result = SIGNUP.validate(payload);

    // Then both fields are reported in one result
    assertFalse(result.isValid());
    assertEquals(2, result.violations().size());
    assertEquals("email", result.violations().get(0).field());
    assertEquals("email", result.violations().get(0).rule());
    assertEquals("password", result.violations().get(1).field());
    assertEquals("required", result.violations().get(1).rule());

    Status status = result.toStatus();
    assertEquals(StatusCode.INVALID_ARGUMENT, status.getCode());
    assertTrue(status.getMessage().contains("email"));
    assertTrue(status.getMessage().contains("password"));
  }

  @Test
  void nullPayloadIsOneViolation() {
    ValidationResult result = SIGNUP.validate(null);
    assertEquals(1, result.violations().size());
    assertEquals("payload", result.violations().get(0).field());
  }

  @Test
  void validateAllPrefixesElementIndex() {
    List<Signup> payloads =
        Arrays.asList(
            new Signup("ana@cultour.id", "Str0ng!pass"), null, new Signup("bad", "Str0ng!pass"));

    ValidationResult result = SIGNUP.validateAll(payloads);

    assertEquals(2, result.violations().size());
    assertEquals("[1].payload", result.violations().get(0).field());
    assertEquals("[2].email", result.violations().get(1).field());
  }

  @Test
  void updateSchemasAcceptBlankFields() {
    assertTrue(UserWrite.UPDATE_SCHEMA.validate(new UserWrite("", "", "", "")).isValid());
    assertTrue(BadgeWrite.UPDATE_SCHEMA.validate(new BadgeWrite("", "new text", null)).isValid());
    assertFalse(UserWrite.CREATE_SCHEMA.validate(new UserWrite("", "", null, null)).isValid());
  }
}
