package com.gruelbox.retry;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Describes the parts of an operation's signature which determine how it can be retried.
 *
 * @see CallingConvention#select(OperationShape, RetryDeclaration)
 */
@Value
@Builder
public class OperationShape {

  /**
   * @return A name for the operation, used in error messages.
   */
  @SuppressWarnings("JavaDoc")
  @Builder.Default
  String name = "operation";

  /**
   * @return True if the operation completes asynchronously.
   */
  @SuppressWarnings("JavaDoc")
  boolean async;

  /**
   * @return How the operation refers to the object it is invoked on.
   */
  @SuppressWarnings("JavaDoc")
  @Builder.Default
  ReceiverKind receiver = ReceiverKind.NONE;

  /**
   * @return The names the operation binds its arguments to, in order.
   */
  @SuppressWarnings("JavaDoc")
  @Singular
  List<String> parameters;

  /**
   * Derives the shape of a method. Methods returning a {@link CompletionStage} are asynchronous.
   * Instance methods have a {@link ReceiverKind#SHARED} receiver. Parameter names are only
   * available if the class was compiled with {@code -parameters}; otherwise the synthetic names
   * {@code arg0}, {@code arg1} and so on are used.
   *
   * @param method The method.
   * @return The shape.
   */
  public static OperationShape of(Method method) {
    return OperationShape.builder()
        .name(method.getDeclaringClass().getSimpleName() + "." + method.getName())
        .async(CompletionStage.class.isAssignableFrom(method.getReturnType()))
        .receiver(
            Modifier.isStatic(method.getModifiers()) ? ReceiverKind.NONE : ReceiverKind.SHARED)
        .parameters(
            Arrays.stream(method.getParameters())
                .map(Parameter::getName)
                .collect(Collectors.toList()))
        .build();
  }
}
