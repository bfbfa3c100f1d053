package taskq.queue.model;

/**
 * One sample of host utilisation, both values in percent (0-100).
 */
public record ResourceLoad(double cpuPercent, double memoryPercent) {

    public boolean exceeds(double cpuThreshold, double memoryThreshold) {
        return cpuPercent > cpuThreshold || memoryPercent > memoryThreshold;
    }
}
