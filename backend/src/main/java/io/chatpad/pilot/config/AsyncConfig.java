package io.chatpad.pilot.config;

import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

  private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

  public static final String DISPATCH_EXECUTOR = "dispatchExecutor";

  /**
   * Bounded pool for outbound row-change dispatch. A task arriving while the queue is full is
   * dropped with a warning; the committing request never sees the rejection.
   */
  @Bean(name = DISPATCH_EXECUTOR)
  public Executor dispatchExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("dispatch-");
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(500);
    executor.setRejectedExecutionHandler(
        (task, pool) ->
            log.warn(
                "Dispatch queue full (size={}), dropping row-change dispatch",
                pool.getQueue().size()));
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
