package com.gruelbox.retry;

import com.gruelbox.retry.spi.ProxyFactory;
import com.gruelbox.retry.spi.Utils;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Wraps an object so that calls to its methods are retried. The runtime equivalent of declaring
 * retry options on each method.
 *
 * <pre>
 * PaymentClient client = RetryProxies.wrap(
 *     PaymentClient.class,
 *     new HttpPaymentClient(http),
 *     RetryDeclaration.builder()
 *         .backoff(BackoffBuilder.exponential().maxTimes(5))
 *         .when(e -&gt; e instanceof IOException)
 *         .build());
 * </pre>
 *
 * <p>Every method is checked with {@link CallingConvention#select(OperationShape,
 * RetryDeclaration)} when the proxy is created, so invalid declarations fail fast. Methods which
 * return a {@link CompletionStage} are retried asynchronously. The target is shared by all attempts
 * and all concurrent calls, so must be safe for concurrent use if the proxy is used concurrently.
 * {@code equals}, {@code hashCode} and {@code toString} are never retried.
 */
@Slf4j
public final class RetryProxies {

  private static final ProxyFactory PROXY_FACTORY = new ProxyFactory();

  private RetryProxies() {}

  /**
   * Wraps an object, retrying all its methods with the same options.
   *
   * @param type The interface or class to proxy.
   * @param target The object to call.
   * @param declaration The retry options.
   * @param <T> The proxied type.
   * @return The proxy.
   * @throws InvalidRetryDeclarationException If the options can't be applied to any of the
   *     methods.
   */
  public static <T> T wrap(Class<T> type, T target, RetryDeclaration declaration) {
    return wrap(type, target, method -> declaration);
  }

  /**
   * Wraps an object, choosing the retry options for each method.
   *
   * @param type The interface or class to proxy.
   * @param target The object to call.
   * @param declarations Supplies the retry options for each method, or null to call the method
   *     without retrying.
   * @param <T> The proxied type.
   * @return The proxy.
   * @throws InvalidRetryDeclarationException If the options can't be applied to a method.
   */
  public static <T> T wrap(
      Class<T> type, T target, Function<Method, RetryDeclaration> declarations) {
    if (type == null || target == null || declarations == null) {
      throw new IllegalArgumentException("type, target and declarations are all required");
    }
    Map<String, RetryingMethod> retrying = new HashMap<>();
    for (Method method : proxiedMethods(type)) {
      RetryDeclaration declaration = declarations.apply(method);
      if (declaration == null) {
        continue;
      }
      OperationShape shape = OperationShape.of(method);
      CallingConvention convention = CallingConvention.select(shape, declaration);
      if (shape.isAsync() && !method.getReturnType().isAssignableFrom(CompletableFuture.class)) {
        throw new InvalidRetryDeclarationException(
            shape.getName()
                + ": asynchronous methods must return CompletionStage or CompletableFuture");
      }
      log.debug("Retrying {} using {}", shape.getName(), convention);
      retrying.put(
          key(method), new RetryingMethod(method, shape.getName(), convention, declaration));
    }
    return PROXY_FACTORY.createProxy(
        type,
        (method, args) -> {
          Object[] arguments = args == null ? new Object[0] : args;
          RetryingMethod retryingMethod = retrying.get(key(method));
          if (retryingMethod == null) {
            return invokeUnchecked(target, method, arguments);
          }
          return retryingMethod.invoke(target, arguments);
        });
  }

  private static List<Method> proxiedMethods(Class<?> type) {
    List<Method> result = new ArrayList<>();
    if (type.isInterface()) {
      for (Method method : type.getMethods()) {
        if (isProxied(method)) {
          result.add(method);
        }
      }
      return result;
    }
    Map<String, Method> byKey = new HashMap<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      for (Method method : c.getDeclaredMethods()) {
        if (isProxied(method) && !Modifier.isPrivate(method.getModifiers())) {
          byKey.putIfAbsent(key(method), method);
        }
      }
    }
    byKey.values().stream()
        .filter(method -> !Modifier.isFinal(method.getModifiers()))
        .forEach(result::add);
    return result;
  }

  private static boolean isProxied(Method method) {
    return !Modifier.isStatic(method.getModifiers())
        && !method.isSynthetic()
        && !isObjectMethod(method);
  }

  private static boolean isObjectMethod(Method method) {
    try {
      Object.class.getMethod(method.getName(), method.getParameterTypes());
      return true;
    } catch (NoSuchMethodException e) {
      return false;
    }
  }

  private static String key(Method method) {
    return method.getName() + Arrays.toString(method.getParameterTypes());
  }

  private static Object invokeUnchecked(Object target, Method method, Object[] args) {
    try {
      return invoke(target, method, args);
    } catch (Exception e) {
      throw Utils.sneakyThrow(e);
    }
  }

  private static Object invoke(Object target, Method method, Object[] args) throws Exception {
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      throw Utils.sneakyThrow(cause);
    } catch (IllegalAccessException e) {
      throw new UncheckedException(e);
    }
  }

  private static final class RetryingMethod {

    private final Method method;
    private final String name;
    private final CallingConvention convention;
    private final RetryDeclaration declaration;

    RetryingMethod(
        Method method, String name, CallingConvention convention, RetryDeclaration declaration) {
      this.method = method;
      this.name = name;
      this.convention = convention;
      this.declaration = declaration;
      method.trySetAccessible();
    }

    Object invoke(Object target, Object[] args) {
      try {
        return dispatch(target, args);
      } catch (Exception e) {
        throw Utils.sneakyThrow(e);
      }
    }

    private Object dispatch(Object target, Object[] args) throws Exception {
      switch (convention) {
        case BLOCKING:
          return configure(Retry.blocking(() -> RetryProxies.invoke(target, method, args)))
              .call();
        case BLOCKING_WITH_CONTEXT:
          return configure(
                  Retry.blockingWithContext(
                      args.clone(),
                      (Object[] context) ->
                          Attempt.success(context, RetryProxies.invoke(target, method, context))))
              .call()
              .get();
        case ASYNC:
          return configureAsync(Retry.async(() -> invokeAsync(target, args))).call();
        case ASYNC_WITH_CONTEXT:
          return AsyncRetry.values(
              configureAsync(
                      Retry.asyncWithContext(
                          args.clone(),
                          (Object[] context) -> {
                            CompletionStage<Object> stage = invokeAsync(target, context);
                            if (stage == null) {
                              return null;
                            }
                            return stage.thenApply(value -> Attempt.success(context, value));
                          }))
                  .call());
        default:
          throw new IllegalStateException("Unknown calling convention " + convention);
      }
    }

    @SuppressWarnings("unchecked")
    private CompletionStage<Object> invokeAsync(Object target, Object[] args) throws Exception {
      return (CompletionStage<Object>) RetryProxies.invoke(target, method, args);
    }

    private <R extends AbstractBlockingRetry<R>> R configure(R driver) {
      return common(driver).sleeper(declaration.getSleeper());
    }

    private <R extends AbstractAsyncRetry<R>> R configureAsync(R driver) {
      return common(driver).sleeper(declaration.getAsyncSleeper()).adjust(declaration.getAdjust());
    }

    private <S, R extends AbstractRetry<S, R>> R common(R driver) {
      return driver
          .name(name)
          .backoff(declaration.getBackoff())
          .when(declaration.getWhen())
          .notifier(declaration.getNotifier());
    }
  }
}
