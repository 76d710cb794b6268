package io.jobkeeper.config;

import io.jobkeeper.Scheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle. Runs in the last phase so
 * the scheduler starts after, and stops before, the beans its handlers use.
 */
public class JobKeeperLifecycle implements SmartLifecycle {
    private final Scheduler scheduler;
    private final SchedulerProperties props;
    private volatile boolean running = false;

    public JobKeeperLifecycle(Scheduler scheduler, SchedulerProperties props) {
        this.scheduler = scheduler;
        this.props = props;
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop(props.getShutdownGracePeriod());
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return props.isAutoStartup();
    }
}
