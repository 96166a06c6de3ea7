package io.malicki.retrycommander.kafka.consumer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Connects and starts the {@link RetryCommander} with the application context and
 * shuts it down when the context closes.
 */
@Slf4j
public class RetryCommanderLifecycle implements SmartLifecycle {

    private final RetryCommander commander;
    private final boolean autoStartup;

    public RetryCommanderLifecycle(RetryCommander commander, boolean autoStartup) {
        this.commander = commander;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        if (commander.getState() == LifecycleState.CREATED) {
            commander.connect();
        }
        commander.start();
    }

    @Override
    public void stop() {
        commander.shutdown();
    }

    @Override
    public boolean isRunning() {
        return commander.getState() == LifecycleState.RUNNING;
    }

    @Override
    public boolean isAutoStartup() {
        if (!autoStartup) {
            log.info("Auto startup disabled, call RetryCommander.connect() and start() manually");
        }
        return autoStartup;
    }
}
