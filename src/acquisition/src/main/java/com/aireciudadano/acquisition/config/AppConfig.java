package com.aireciudadano.acquisition.config;

import com.aireciudadano.acquisition.prometheus.RetryPolicy;
import com.aireciudadano.acquisition.window.ParallelWindowScheduler;
import com.aireciudadano.acquisition.window.SequentialWindowScheduler;
import com.aireciudadano.acquisition.window.WindowFetchScheduler;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(AcquisitionProperties properties) {
    Duration connectTimeout = properties.getPrometheus().getConnectTimeout();
    HttpClient.Builder builder = HttpClient.newBuilder();
    if (connectTimeout != null) {
      builder.connectTimeout(connectTimeout);
    }
    return builder.build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RetryPolicy retryPolicy(AcquisitionProperties properties) {
    return RetryPolicy.from(properties.getRetry());
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService windowFetchExecutor(AcquisitionProperties properties) {
    return Executors.newFixedThreadPool(
        Math.max(1, properties.getFetch().getParallelism()), daemonThreads("window-fetch-"));
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService acquisitionExecutor() {
    return Executors.newCachedThreadPool(daemonThreads("acquisition-"));
  }

  @Bean
  public WindowFetchScheduler windowFetchScheduler(
      AcquisitionProperties properties,
      @Qualifier("windowFetchExecutor") ExecutorService windowFetchExecutor) {
    return switch (properties.getFetch().getMode()) {
      case PARALLEL -> new ParallelWindowScheduler(windowFetchExecutor);
      case SEQUENTIAL -> new SequentialWindowScheduler();
    };
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
