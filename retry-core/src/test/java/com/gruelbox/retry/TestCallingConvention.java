package com.gruelbox.retry;

import static com.gruelbox.retry.CallingConvention.ASYNC;
import static com.gruelbox.retry.CallingConvention.ASYNC_WITH_CONTEXT;
import static com.gruelbox.retry.CallingConvention.BLOCKING;
import static com.gruelbox.retry.CallingConvention.BLOCKING_WITH_CONTEXT;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class TestCallingConvention {

  private static final RetryDeclaration CONTEXT = RetryDeclaration.builder().context(true).build();

  private static OperationShape blocking() {
    return OperationShape.builder().name("op").parameter("first").parameter("second").build();
  }

  private static OperationShape async() {
    return OperationShape.builder().name("op").async(true).parameter("first").build();
  }

  @Test
  void selection() {
    assertEquals(BLOCKING, CallingConvention.select(blocking(), RetryDeclaration.DEFAULTS));
    assertEquals(BLOCKING_WITH_CONTEXT, CallingConvention.select(blocking(), CONTEXT));
    assertEquals(ASYNC, CallingConvention.select(async(), RetryDeclaration.DEFAULTS));
    assertEquals(ASYNC_WITH_CONTEXT, CallingConvention.select(async(), CONTEXT));
    assertTrue(ASYNC_WITH_CONTEXT.isWithContext());
    assertFalse(BLOCKING.isWithContext());
  }

  @Test
  void sharedReceiverAllowedWithContext() {
    OperationShape shape =
        OperationShape.builder().receiver(ReceiverKind.SHARED).parameter("value").build();
    assertEquals(BLOCKING_WITH_CONTEXT, CallingConvention.select(shape, CONTEXT));
  }

  @Test
  void asyncMayAdjust() {
    RetryDeclaration declaration =
        RetryDeclaration.builder().adjust((error, delay) -> Optional.empty()).build();
    assertEquals(ASYNC, CallingConvention.select(async(), declaration));
  }

  @Test
  void blockingMayNotAdjust() {
    RetryDeclaration declaration =
        RetryDeclaration.builder().adjust((error, delay) -> Optional.empty()).build();
    var error =
        assertThrows(
            InvalidRetryDeclarationException.class,
            () -> CallingConvention.select(blocking(), declaration));
    assertThat(error.getMessage(), containsString("adjust"));
  }

  @ParameterizedTest
  @EnumSource(
      value = ReceiverKind.class,
      names = {"EXCLUSIVE", "OWNED"})
  void unsupportedReceivers(ReceiverKind receiver) {
    OperationShape shape = OperationShape.builder().receiver(receiver).build();
    assertThrows(
        InvalidRetryDeclarationException.class,
        () -> CallingConvention.select(shape, RetryDeclaration.DEFAULTS));
    assertThrows(
        InvalidRetryDeclarationException.class, () -> CallingConvention.select(shape, CONTEXT));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "1abc", "a-b", "class", "_", "a b"})
  void parametersMustBeIdentifiers(String parameter) {
    OperationShape shape = OperationShape.builder().parameter(parameter).build();
    assertThrows(
        InvalidRetryDeclarationException.class,
        () -> CallingConvention.select(shape, RetryDeclaration.DEFAULTS));
  }

  @Test
  void parametersMustBeDistinct() {
    OperationShape shape = OperationShape.builder().parameters(List.of("a", "b", "a")).build();
    assertThrows(
        InvalidRetryDeclarationException.class,
        () -> CallingConvention.select(shape, RetryDeclaration.DEFAULTS));
  }

  @Test
  void sleeperMustMatchFlavour() {
    assertThrows(
        InvalidRetryDeclarationException.class,
        () ->
            CallingConvention.select(
                async(), RetryDeclaration.builder().sleeper(Sleeper.threadSleep()).build()));
    assertThrows(
        InvalidRetryDeclarationException.class,
        () ->
            CallingConvention.select(
                blocking(),
                RetryDeclaration.builder().asyncSleeper(AsyncSleeper.delayedExecutor()).build()));
  }

  @Test
  void shapeOfMethods() throws NoSuchMethodException {
    Method fetch = Shapes.class.getMethod("fetch", String.class);
    OperationShape shape = OperationShape.of(fetch);
    assertTrue(shape.isAsync());
    assertEquals(ReceiverKind.SHARED, shape.getReceiver());
    assertEquals(1, shape.getParameters().size());
    assertEquals("Shapes.fetch", shape.getName());

    OperationShape parse = OperationShape.of(Shapes.class.getMethod("parse", String.class));
    assertFalse(parse.isAsync());
    assertEquals(ReceiverKind.NONE, parse.getReceiver());
  }

  public static class Shapes {
    public CompletableFuture<String> fetch(String url) {
      return CompletableFuture.completedFuture(url);
    }

    public static int parse(String value) {
      return Integer.parseInt(value);
    }
  }
}
