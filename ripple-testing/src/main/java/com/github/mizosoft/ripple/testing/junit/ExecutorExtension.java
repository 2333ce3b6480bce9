/*
 * Copyright (c) 2024 Moataz Hussein
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.ripple.testing.junit;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.ripple.SchedulingContext;
import com.github.mizosoft.ripple.internal.flow.FlowSupport;
import com.github.mizosoft.ripple.testing.TestUtils;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Executable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ExtensionContext.Namespace;
import org.junit.jupiter.api.extension.ExtensionContext.Store.CloseableResource;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;
import org.junit.platform.commons.support.AnnotationSupport;

/**
 * {@code Extension} that provides {@code Executors}, or {@link SchedulingContext scheduling
 * contexts} running on them, and terminates the executors after tests.
 */
public final class ExecutorExtension implements ArgumentsProvider, ParameterResolver {
  private static final Namespace EXTENSION_NAMESPACE = Namespace.create(ExecutorExtension.class);

  private static final ExecutorConfig DEFAULT_EXECUTOR_CONFIG;

  static {
    try {
      DEFAULT_EXECUTOR_CONFIG =
          requireNonNull(
              ExecutorExtension.class
                  .getDeclaredMethod("defaultExecutorConfigHolder")
                  .getAnnotation(ExecutorConfig.class));
    } catch (NoSuchMethodException e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  private static final int FIXED_POOL_SIZE = 8;

  public ExecutorExtension() {}

  @Override
  public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
    var method = context.getRequiredTestMethod();
    var config = findExecutorConfig(method);
    var executors = ManagedExecutors.get(context);
    boolean wantsContext = firstParameterIsContext(method);
    return Stream.of(config.value())
        .map(
            executorType ->
                Arguments.of(
                    wantsContext
                        ? executors.newContext(executorType)
                        : executors.newExecutor(executorType)));
  }

  @Override
  public boolean supportsParameter(
      ParameterContext parameterContext, ExtensionContext extensionContext)
      throws ParameterResolutionException {
    // Do not compete with our ArgumentsProvider side.
    boolean isPresentAsArgumentsProvider =
        AnnotationSupport.findAnnotation(
                parameterContext.getDeclaringExecutable(), ArgumentsSource.class)
            .map(ArgumentsSource::value)
            .filter(ExecutorExtension.class::equals)
            .isPresent();
    if (isPresentAsArgumentsProvider) {
      return false;
    }

    var type = parameterContext.getParameter().getType();
    return type == Executor.class || type == SchedulingContext.class;
  }

  @Override
  public Object resolveParameter(
      ParameterContext parameterContext, ExtensionContext extensionContext)
      throws ParameterResolutionException {
    var executorType = findExecutorConfig(parameterContext.getDeclaringExecutable()).value()[0];
    var executors = ManagedExecutors.get(extensionContext);
    return parameterContext.getParameter().getType() == SchedulingContext.class
        ? executors.newContext(executorType)
        : executors.newExecutor(executorType);
  }

  private static boolean firstParameterIsContext(Executable executable) {
    var parameterTypes = executable.getParameterTypes();
    return parameterTypes.length > 0 && parameterTypes[0] == SchedulingContext.class;
  }

  private static ExecutorConfig findExecutorConfig(AnnotatedElement element) {
    return AnnotationSupport.findAnnotation(element, ExecutorConfig.class)
        .orElse(DEFAULT_EXECUTOR_CONFIG);
  }

  @ExecutorConfig
  private static void defaultExecutorConfigHolder() {}

  @Target({ElementType.METHOD, ElementType.ANNOTATION_TYPE})
  @Retention(RetentionPolicy.RUNTIME)
  @ArgumentsSource(ExecutorExtension.class)
  public @interface ExecutorSource {}

  /**
   * Runs the test once per configured {@link ExecutorType}, passing an {@code Executor} or a
   * {@code SchedulingContext} as the first argument.
   */
  @Target({ElementType.METHOD, ElementType.ANNOTATION_TYPE})
  @Retention(RetentionPolicy.RUNTIME)
  @ParameterizedTest
  @ExecutorSource
  public @interface ExecutorParameterizedTest {}

  @Target(ElementType.METHOD)
  @Retention(RetentionPolicy.RUNTIME)
  public @interface ExecutorConfig {
    ExecutorType[] value() default {ExecutorType.FIXED_POOL, ExecutorType.CACHED_POOL};
  }

  public enum ExecutorType {
    SAME_THREAD {
      @Override
      public Executor createExecutor() {
        return FlowSupport.SYNC_EXECUTOR;
      }
    },
    FIXED_POOL {
      private final ThreadFactory defaultThreadFactory = Executors.defaultThreadFactory();

      @Override
      public Executor createExecutor() {
        return Executors.newFixedThreadPool(
            FIXED_POOL_SIZE,
            r -> {
              var thread = defaultThreadFactory.newThread(r);
              thread.setDaemon(true);
              return thread;
            });
      }
    },
    CACHED_POOL {
      @Override
      public Executor createExecutor() {
        return Executors.newCachedThreadPool();
      }
    };

    public abstract Executor createExecutor();
  }

  private static final class ManagedExecutors implements CloseableResource {
    private final List<Executor> executors = new ArrayList<>();

    ManagedExecutors() {}

    Executor newExecutor(ExecutorType type) {
      var executor = type.createExecutor();
      executors.add(executor);
      return executor;
    }

    SchedulingContext newContext(ExecutorType type) {
      return SchedulingContext.serial(newExecutor(type));
    }

    void shutdownAndTerminate() throws Exception {
      for (var executor : executors) {
        TestUtils.shutdown(executor);
        // Clear interruption flag to not throw from awaitTermination if this thread is interrupted
        // by some test.
        boolean interrupted = Thread.interrupted();
        try {
          if (executor instanceof ExecutorService
              && !((ExecutorService) executor).awaitTermination(1, TimeUnit.MINUTES)) {
            throw new TimeoutException("timed out while waiting for pool termination: " + executor);
          }
        } finally {
          if (interrupted) {
            Thread.currentThread().interrupt();
          }
        }
      }

      executors.clear();
    }

    @Override
    public void close() throws Throwable {
      shutdownAndTerminate();
    }

    static ManagedExecutors get(ExtensionContext context) {
      return context.getStore(EXTENSION_NAMESPACE).getOrComputeIfAbsent(ManagedExecutors.class);
    }
  }
}
