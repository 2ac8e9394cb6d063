package com.phillippitts.feedercontrol.config;

import com.phillippitts.feedercontrol.config.properties.SchedulerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ThreadFactory;

/**
 * Thread factories for the long-lived worker threads, and the clock they share.
 *
 * <p>Workers are plain platform threads rather than pool tasks: each one runs for the lifetime
 * of its job or link and owns its own stop signal. Threads are daemons so a stuck serial read can
 * never hold the JVM open.
 *
 * <p>MDC: long-lived workers set their own ThreadContext keys ({@code job},
 * {@code component}) when they start and clear them on exit.
 */
@Configuration
public class ThreadingConfig {

    /**
     * Factory for job workers. {@code JobScheduler} renames each thread to
     * {@code <scheduler.thread-name-prefix><jobName>}.
     */
    @Bean(name = "schedulerThreadFactory")
    public ThreadFactory schedulerThreadFactory(SchedulerProperties props) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(props.getThreadNamePrefix());
        factory.setDaemon(true);
        return factory;
    }

    @Bean(name = "deviceReaderThreadFactory")
    public ThreadFactory deviceReaderThreadFactory() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("device-reader-");
        factory.setDaemon(true);
        return factory;
    }

    /**
     * System clock in the local zone; feed schedules are wall-clock times.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
