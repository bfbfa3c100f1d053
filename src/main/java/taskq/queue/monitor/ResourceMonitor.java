package taskq.queue.monitor;

import taskq.queue.model.ResourceLoad;

/**
 * Samples host CPU and memory utilisation.
 */
public interface ResourceMonitor {

    /**
     * Take one sample.
     *
     * @throws IllegalStateException if a reading is unavailable
     */
    ResourceLoad sample();

    /**
     * True if CPU or memory usage exceeds its threshold (percent).
     */
    default boolean isOverloaded(double cpuThreshold, double memoryThreshold) {
        return sample().exceeds(cpuThreshold, memoryThreshold);
    }
}
