package io.intellixity.jobly.server.web;

import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PatchSchemaTest {

  @Test
  void normalizesNumbersAndKeepsOrder() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("title", "Eng");
    body.put("salary", 1000L);
    body.put("equity", 0.5);

    Map<String, Object> out = JobController.PATCH.check(body).orElseThrow();

    assertEquals(List.of("title", "salary", "equity"), List.copyOf(out.keySet()));
    assertEquals(1000, out.get("salary"));
    assertEquals(new BigDecimal("0.5"), out.get("equity"));
  }

  @Test
  void nullableFieldsKeepNull() {
    Map<String, Object> body = new HashMap<>();
    body.put("salary", null);
    Map<String, Object> out = JobController.PATCH.check(body).orElseThrow();
    assertTrue(out.containsKey("salary"));
    assertNull(out.get("salary"));
  }

  @Test
  void reportsEveryViolation() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("title", 5);
    body.put("salary", 1.5);
    body.put("equity", 2);
    body.put("companyHandle", "x");

    Result<Map<String, Object>> r = JobController.PATCH.check(body);

    assertEquals(ErrorKind.INVALID_INPUT, r.error().kind());
    assertEquals("title: must be a string; salary: must be a whole number; "
        + "equity: must be less than or equal to 1; companyHandle: is not allowed", r.error().message());
  }

  @Test
  void textLimitsAndFormats() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("password", "abc");
    body.put("email", "not-an-email");
    body.put("firstName", null);

    String message = UserController.PATCH.check(body).error().message();

    assertTrue(message.contains("password: must be at least 5 characters"));
    assertTrue(message.contains("email: must be a valid email"));
    assertTrue(message.contains("firstName: must not be null"));
  }

  @Test
  void emptyBodyPassesThroughForTheCompilerToReject() {
    assertTrue(CompanyController.PATCH.check(null).orElseThrow().isEmpty());
  }
}
