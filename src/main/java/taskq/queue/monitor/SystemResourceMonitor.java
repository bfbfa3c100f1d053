package taskq.queue.monitor;

import com.sun.management.OperatingSystemMXBean;
import taskq.queue.model.ResourceLoad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Host-wide resource monitor backed by the platform MX bean.
 *
 * Memory usage is (total - available) / total. On Linux "available" comes from
 * MemAvailable in /proc/meminfo, which counts reclaimable page cache; the MX bean's
 * free memory does not and would report a busy-looking host most of the time.
 */
public class SystemResourceMonitor implements ResourceMonitor {

    private static final Logger log = LoggerFactory.getLogger(SystemResourceMonitor.class);

    private static final Path MEMINFO = Path.of("/proc/meminfo");

    static final Duration DEFAULT_CPU_WINDOW = Duration.ofSeconds(1);

    private final OperatingSystemMXBean os;
    private final long windowNanos;
    private long lastReadNanos;

    public SystemResourceMonitor() {
        this(DEFAULT_CPU_WINDOW);
    }

    SystemResourceMonitor(Duration cpuWindow) {
        if (cpuWindow.isNegative() || cpuWindow.isZero()) {
            throw new IllegalArgumentException("CPU sampling window must be positive: " + cpuWindow);
        }
        java.lang.management.OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        if (!(bean instanceof OperatingSystemMXBean sunBean)) {
            throw new IllegalStateException("Platform MX bean does not expose system load: " + bean.getClass());
        }
        this.os = sunBean;
        this.windowNanos = cpuWindow.toNanos();
        // the bean reports load since its previous read; this read opens the first window
        os.getCpuLoad();
        this.lastReadNanos = System.nanoTime();
    }

    /**
     * Sample host load. CPU is averaged over at least the sampling window: a
     * call arriving sooner than that after the previous read blocks for the
     * remainder.
     */
    @Override
    public synchronized ResourceLoad sample() {
        long remaining = windowNanos - (System.nanoTime() - lastReadNanos);
        if (remaining > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while sampling CPU load", e);
            }
        }
        double cpu = os.getCpuLoad();
        lastReadNanos = System.nanoTime();
        if (cpu < 0) {
            throw new IllegalStateException("CPU load is not available");
        }
        ResourceLoad load = new ResourceLoad(cpu * 100.0, memoryPercent());
        log.debug("Resource sample: cpu={}%, memory={}%",
                String.format("%.1f", load.cpuPercent()), String.format("%.1f", load.memoryPercent()));
        return load;
    }

    private double memoryPercent() {
        Long[] meminfo = readMeminfo();
        if (meminfo != null) {
            long total = meminfo[0];
            long available = meminfo[1];
            return 100.0 * (total - available) / total;
        }
        long total = os.getTotalMemorySize();
        if (total <= 0) {
            throw new IllegalStateException("Total memory is not available");
        }
        return 100.0 * (total - os.getFreeMemorySize()) / total;
    }

    /**
     * @return {MemTotal, MemAvailable} in kB, or null if not readable
     */
    private static Long[] readMeminfo() {
        if (!Files.isReadable(MEMINFO)) {
            return null;
        }
        try {
            List<String> lines = Files.readAllLines(MEMINFO);
            Long total = null;
            Long available = null;
            for (String line : lines) {
                if (line.startsWith("MemTotal:")) {
                    total = parseKb(line);
                } else if (line.startsWith("MemAvailable:")) {
                    available = parseKb(line);
                }
            }
            if (total == null || available == null || total <= 0) {
                return null;
            }
            return new Long[] { total, available };
        } catch (IOException | NumberFormatException e) {
            log.debug("Cannot read {}: {}", MEMINFO, e.getMessage());
            return null;
        }
    }

    private static long parseKb(String line) {
        String[] parts = line.trim().split("\\s+");
        return Long.parseLong(parts[1]);
    }
}
