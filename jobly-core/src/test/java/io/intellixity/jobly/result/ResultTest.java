package io.intellixity.jobly.result;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ResultTest {

  @Test
  void successChains() {
    Result<Integer> r = Result.success(2).map(x -> x * 3).flatMap(x -> Result.success(x + 1));
    assertTrue(r.isSuccess());
    assertEquals(7, r.orElseThrow());
    assertThrows(IllegalStateException.class, r::error);
  }

  @Test
  void failureShortCircuits() {
    Result<Integer> failed = Result.failure(ErrorKind.NOT_FOUND, "No job: 9", "9");
    Result<String> chained = failed.map(x -> {
      throw new AssertionError("must not run");
    });
    assertTrue(chained.isFailure());
    assertEquals("No job: 9", chained.error().message());

    JoblyException ex = assertThrows(JoblyException.class, chained::orElseThrow);
    assertEquals(ErrorKind.NOT_FOUND, ex.kind());
    assertEquals("9", ex.error().subject());
  }

  @Test
  void onlyInternalIsNotClientCaused() {
    for (ErrorKind k : ErrorKind.values()) {
      assertEquals(k != ErrorKind.INTERNAL, k.clientCaused(), k.name());
    }
  }
}
