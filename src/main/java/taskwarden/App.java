package taskwarden;

import taskwarden.tracker.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Standalone janitor process.
 *
 * Opens the tracker store from TASKWARDEN_* environment settings and runs the
 * stale-run reaper and retention cleaner until the JVM is asked to stop.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        Dependencies deps = Dependencies.create();
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping janitors...");
            deps.close();
            stopped.countDown();
        }, "taskwarden-shutdown"));

        deps.startScheduler();
        log.info("Taskwarden janitors running with {}", deps.config());

        stopped.await();
    }
}
