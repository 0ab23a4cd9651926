package com.gruelbox.retry.spi;

import com.gruelbox.retry.MissingOptionalDependencyException;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.function.BiFunction;
import lombok.extern.slf4j.Slf4j;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.TypeCache;
import net.bytebuddy.TypeCache.Sort;
import net.bytebuddy.description.modifier.Visibility;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import net.bytebuddy.implementation.InvocationHandlerAdapter;
import net.bytebuddy.matcher.ElementMatchers;
import org.objenesis.Objenesis;
import org.objenesis.ObjenesisStd;
import org.objenesis.instantiator.ObjectInstantiator;

/**
 * Creates proxies which route every call through a single handler. Interfaces are proxied using
 * the JDK. Classes need ByteBuddy, and also Objenesis unless they have a public no-arg constructor.
 * Both are optional dependencies.
 */
@Slf4j
@NotApi
public class ProxyFactory {

  private static final String HANDLER_FIELD = "handler";

  private final Objenesis objenesis = setupObjenesis();
  private final TypeCache<Class<?>> byteBuddyCache = setupByteBuddyCache();

  private static boolean hasDefaultConstructor(Class<?> clazz) {
    try {
      clazz.getConstructor();
      return true;
    } catch (NoSuchMethodException e) {
      return false;
    }
  }

  private TypeCache<Class<?>> setupByteBuddyCache() {
    try {
      return new TypeCache<>(Sort.WEAK);
    } catch (NoClassDefFoundError error) {
      log.info("ByteBuddy is not on the classpath, so only interfaces can be wrapped for retry");
      return null;
    }
  }

  private ObjenesisStd setupObjenesis() {
    try {
      return new ObjenesisStd();
    } catch (NoClassDefFoundError error) {
      log.info(
          "Objenesis is not on the classpath, so only interfaces or classes with default"
              + " constructors can be wrapped for retry");
      return null;
    }
  }

  /**
   * Creates a proxy.
   *
   * @param clazz The interface or class to proxy.
   * @param handler Handles every call to a method of {@code clazz}. For class proxies, methods
   *     declared by {@link Object} and not overridden are not routed to the handler.
   * @param <T> The proxied type.
   * @return The proxy.
   */
  @SuppressWarnings({"unchecked", "cast"})
  public <T> T createProxy(Class<T> clazz, BiFunction<Method, Object[], Object> handler) {
    if (clazz.isInterface()) {
      return (T)
          Proxy.newProxyInstance(
              clazz.getClassLoader(),
              new Class[] {clazz},
              (proxy, method, args) -> handler.apply(method, args));
    } else {
      Class<? extends T> proxy = buildByteBuddyProxyClass(clazz);
      return constructProxy(clazz, handler, proxy);
    }
  }

  private <T> T constructProxy(
      Class<T> clazz, BiFunction<Method, Object[], Object> handler, Class<? extends T> proxy) {
    final T instance;
    if (hasDefaultConstructor(clazz)) {
      instance = Utils.uncheckedly(() -> proxy.getDeclaredConstructor().newInstance());
    } else {
      if (objenesis == null) {
        throw new MissingOptionalDependencyException("org.objenesis", "objenesis");
      }
      ObjectInstantiator<? extends T> instantiator = objenesis.getInstantiatorOf(proxy);
      instance = instantiator.newInstance();
    }
    Utils.uncheck(
        () -> {
          var field = instance.getClass().getDeclaredField(HANDLER_FIELD);
          field.set(
              instance, (InvocationHandler) (self, method, args) -> handler.apply(method, args));
        });
    return instance;
  }

  @SuppressWarnings({"unchecked", "cast"})
  private <T> Class<? extends T> buildByteBuddyProxyClass(Class<T> clazz) {
    if (byteBuddyCache == null) {
      throw new MissingOptionalDependencyException("net.bytebuddy", "byte-buddy");
    }
    return (Class<? extends T>)
        byteBuddyCache.findOrInsert(
            clazz.getClassLoader(),
            clazz,
            () ->
                new ByteBuddy()
                    .subclass(clazz)
                    .defineField(HANDLER_FIELD, InvocationHandler.class, Visibility.PUBLIC)
                    .method(ElementMatchers.not(ElementMatchers.isDeclaredBy(Object.class)))
                    .intercept(InvocationHandlerAdapter.toField(HANDLER_FIELD))
                    .make()
                    .load(clazz.getClassLoader(), ClassLoadingStrategy.Default.INJECTION)
                    .getLoaded());
  }
}
