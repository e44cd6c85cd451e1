package io.intellixity.jobly.result;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a compiler, gate or repository call.
 *
 * <p>Either a {@link Success} carrying the value or a {@link Failure} carrying a {@link JoblyError}.
 * Callers branch on {@link #isSuccess()} or chain with {@link #map(Function)} and {@link #flatMap(Function)};
 * the transport layer unwraps with {@link #orElseThrow()}.</p>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

  boolean isSuccess();

  default boolean isFailure() {
    return !isSuccess();
  }

  /** Value of a success; throws {@link JoblyException} for a failure. */
  T orElseThrow();

  /** Error of a failure; throws {@link IllegalStateException} for a success. */
  JoblyError error();

  <U> Result<U> map(Function<? super T, ? extends U> fn);

  <U> Result<U> flatMap(Function<? super T, Result<U>> fn);

  record Success<T>(T value) implements Result<T> {
    @Override public boolean isSuccess() { return true; }
    @Override public T orElseThrow() { return value; }

    @Override
    public JoblyError error() {
      throw new IllegalStateException("Result is a success");
    }

    @Override
    public <U> Result<U> map(Function<? super T, ? extends U> fn) {
      return new Success<>(fn.apply(value));
    }

    @Override
    public <U> Result<U> flatMap(Function<? super T, Result<U>> fn) {
      return Objects.requireNonNull(fn.apply(value), "flatMap result");
    }
  }

  record Failure<T>(JoblyError error) implements Result<T> {
    public Failure {
      Objects.requireNonNull(error, "error");
    }

    @Override public boolean isSuccess() { return false; }

    @Override
    public T orElseThrow() {
      throw new JoblyException(error);
    }

    @Override
    public <U> Result<U> map(Function<? super T, ? extends U> fn) {
      return new Failure<>(error);
    }

    @Override
    public <U> Result<U> flatMap(Function<? super T, Result<U>> fn) {
      return new Failure<>(error);
    }
  }

  static <T> Result<T> success(T value) {
    return new Success<>(value);
  }

  static <T> Result<T> failure(JoblyError error) {
    return new Failure<>(error);
  }

  static <T> Result<T> failure(ErrorKind kind, String message) {
    return new Failure<>(JoblyError.of(kind, message));
  }

  static <T> Result<T> failure(ErrorKind kind, String message, String subject) {
    return new Failure<>(new JoblyError(kind, message, subject));
  }
}
