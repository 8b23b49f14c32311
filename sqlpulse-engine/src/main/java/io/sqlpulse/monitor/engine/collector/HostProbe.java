package io.sqlpulse.monitor.engine.collector;

/**
 * Host level resource readings
 */
public interface HostProbe {

    /**
     * System-wide CPU load in percent, sampled over a short interval
     */
    double cpuUsagePercent();

    int logicalProcessorCount();

    long memoryTotalBytes();

    long memoryAvailableBytes();

    long swapTotalBytes();

    long swapUsedBytes();

    long diskTotalBytes(String path);

    long diskUsableBytes(String path);
}
