package taskq.queue.monitor;

import taskq.queue.config.QueueConfig;
import taskq.queue.model.ResourceLoad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Load gate in front of the dispatcher. Monitor failures count as overload,
 * so a failing monitor stops admission.
 */
public class AdmissionControl {

    private static final Logger log = LoggerFactory.getLogger(AdmissionControl.class);

    private final ResourceMonitor monitor;
    private final QueueConfig config;

    public AdmissionControl(ResourceMonitor monitor, QueueConfig config) {
        this.monitor = monitor;
        this.config = config;
    }

    /**
     * True when CPU or memory is above the configured thresholds, or when
     * the load cannot be sampled.
     */
    public boolean isOverloaded() {
        return exceeds(config.cpuThreshold(), config.memoryThreshold());
    }

    /**
     * Worker count for a new dispatcher loop: the reduced pool when load is
     * already within {@code loadMargin} of a threshold, the full pool otherwise.
     */
    public int choosePoolSize() {
        double cpu = Math.max(0, config.cpuThreshold() - config.loadMargin());
        double mem = Math.max(0, config.memoryThreshold() - config.loadMargin());
        int size = exceeds(cpu, mem) ? config.reducedWorkers() : config.maxWorkers();
        log.info("Worker pool size {} (max {}, reduced {})", size, config.maxWorkers(), config.reducedWorkers());
        return size;
    }

    private boolean exceeds(double cpuThreshold, double memoryThreshold) {
        try {
            ResourceLoad load = monitor.sample();
            boolean over = load.exceeds(cpuThreshold, memoryThreshold);
            if (over) {
                log.debug("Load {} exceeds cpu {}% / mem {}%", load, cpuThreshold, memoryThreshold);
            }
            return over;
        } catch (RuntimeException e) {
            log.warn("Resource monitor failed, treating host as overloaded: {}", e.getMessage());
            return true;
        }
    }
}
