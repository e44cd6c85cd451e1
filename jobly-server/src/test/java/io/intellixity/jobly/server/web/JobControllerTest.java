package io.intellixity.jobly.server.web;

import io.intellixity.jobly.store.Row;
import io.intellixity.jobly.store.StoreResult;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

final class JobControllerTest {
  private static final String NEW_JOB = """
      {"title": "Engineer", "salary": 100, "equity": 0.1, "companyHandle": "c1"}
      """;

  private static Row jobRow(int id) {
    return Row.of("id", id, "title", "Engineer", "salary", 100, "equity", new BigDecimal("0.1"), "companyHandle", "c1");
  }

  @Test
  void anonymousCreateIsUnauthorizedAndNeverTouchesStore() throws Exception {
    ScriptedStore store = new ScriptedStore();
    WebTestSupport.mvc(store)
        .perform(post("/jobs").contentType(MediaType.APPLICATION_JSON).content(NEW_JOB))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error.kind").value("UNAUTHORIZED"));
    assertTrue(store.executed.isEmpty());
  }

  @Test
  void nonAdminCannotCreateUpdateOrDelete() throws Exception {
    ScriptedStore store = new ScriptedStore();
    WebTestSupport.mvc(store)
        .perform(post("/jobs").header(CallerFilter.USER_HEADER, "u1")
            .contentType(MediaType.APPLICATION_JSON).content(NEW_JOB))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error.kind").value("FORBIDDEN"));
    WebTestSupport.mvc(store)
        .perform(patch("/jobs/1").header(CallerFilter.USER_HEADER, "u1")
            .contentType(MediaType.APPLICATION_JSON).content("{\"title\": \"New\"}"))
        .andExpect(status().isForbidden());
    WebTestSupport.mvc(store)
        .perform(delete("/jobs/1").header(CallerFilter.USER_HEADER, "u1"))
        .andExpect(status().isForbidden());
    assertTrue(store.executed.isEmpty());
  }

  @Test
  void adminCreateReturns201WithEnvelope() throws Exception {
    ScriptedStore store = new ScriptedStore()
        .then(StoreResult.of(Row.of("?column?", 1)))
        .then(StoreResult.of(jobRow(7)));

    WebTestSupport.mvc(store)
        .perform(post("/jobs")
            .header(CallerFilter.USER_HEADER, "admin").header(CallerFilter.ADMIN_HEADER, "true")
            .contentType(MediaType.APPLICATION_JSON).content(NEW_JOB))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.job.id").value(7))
        .andExpect(jsonPath("$.job.companyHandle").value("c1"));
    assertEquals(2, store.executed.size());
  }

  @Test
  void createForUnknownCompanyIsBadRequest() throws Exception {
    WebTestSupport.mvc(new ScriptedStore())
        .perform(post("/jobs")
            .header(CallerFilter.USER_HEADER, "admin").header(CallerFilter.ADMIN_HEADER, "true")
            .contentType(MediaType.APPLICATION_JSON).content(NEW_JOB))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error.kind").value("REFERENCE_NOT_FOUND"))
        .andExpect(jsonPath("$.error.message").value("Company 'c1' does not exist"));
  }

  @Test
  void hasEquityFalseStillFiltersOnEquity() throws Exception {
    ScriptedStore store = new ScriptedStore().then(StoreResult.of(jobRow(1)));

    WebTestSupport.mvc(store)
        .perform(get("/jobs").param("hasEquity", "false"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.jobs[0].title").value("Engineer"));
    assertTrue(store.executed.get(0).sql().endsWith(" WHERE equity > 0 ORDER BY company_handle, id"));
    assertTrue(store.executed.get(0).values().isEmpty());
  }

  @Test
  void nonNumericIdIsBadRequest() throws Exception {
    ScriptedStore store = new ScriptedStore();
    WebTestSupport.mvc(store)
        .perform(get("/jobs/abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error.message").value("Parameter 'id' has an invalid value"));
    assertTrue(store.executed.isEmpty());
  }

  @Test
  void adminDeleteReturnsId() throws Exception {
    WebTestSupport.mvc(new ScriptedStore().then(StoreResult.of(Row.of("id", 4))))
        .perform(delete("/jobs/4")
            .header(CallerFilter.USER_HEADER, "admin").header(CallerFilter.ADMIN_HEADER, "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted").value(4));
  }
}
