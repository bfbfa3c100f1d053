package taskq.queue.monitor;

import taskq.queue.model.ResourceLoad;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SystemResourceMonitorTest {

    private static final Duration WINDOW = Duration.ofMillis(300);

    @Test
    void sampleReportsPercentages() {
        SystemResourceMonitor monitor = new SystemResourceMonitor(WINDOW);

        ResourceLoad load = monitor.sample();

        assertTrue(load.cpuPercent() >= 0 && load.cpuPercent() <= 100, "cpu " + load.cpuPercent());
        assertTrue(load.memoryPercent() > 0 && load.memoryPercent() <= 100, "memory " + load.memoryPercent());
    }

    @Test
    void firstSampleCoversAFullWindow() {
        SystemResourceMonitor monitor = new SystemResourceMonitor(WINDOW);

        long startedAt = System.nanoTime();
        monitor.sample();

        assertTrue(elapsedMs(startedAt) >= 250, "took " + elapsedMs(startedAt) + "ms");
    }

    @Test
    void backToBackSamplesAreSpacedByTheWindow() {
        SystemResourceMonitor monitor = new SystemResourceMonitor(WINDOW);
        monitor.sample();

        long startedAt = System.nanoTime();
        monitor.sample();
        monitor.sample();

        assertTrue(elapsedMs(startedAt) >= 550, "took " + elapsedMs(startedAt) + "ms");
    }

    @Test
    void sampleAfterTheWindowDoesNotWait() throws Exception {
        SystemResourceMonitor monitor = new SystemResourceMonitor(Duration.ofMillis(50));
        Thread.sleep(100);

        long startedAt = System.nanoTime();
        monitor.sample();

        assertTrue(elapsedMs(startedAt) < 250, "took " + elapsedMs(startedAt) + "ms");
    }

    @Test
    void windowMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SystemResourceMonitor(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new SystemResourceMonitor(Duration.ofMillis(-1)));
    }

    private static long elapsedMs(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }
}
