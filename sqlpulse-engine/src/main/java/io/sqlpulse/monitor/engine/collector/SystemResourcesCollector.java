package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.common.analysis.DerivedIndicators;
import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.metrics.MetricNames;
import io.sqlpulse.monitor.common.metrics.MetricSample;
import io.sqlpulse.monitor.engine.connect.Session;

import java.time.Clock;
import java.util.List;

/**
 * CPU, memory, swap and disk of the host the monitor runs on. Issues no SQL.
 */
public class SystemResourcesCollector implements MetricsCollector {

    private final HostProbe probe;
    private final String diskPath;
    private final Clock clock;

    public SystemResourcesCollector(HostProbe probe, String diskPath, Clock clock) {
        this.probe = probe;
        this.diskPath = diskPath;
        this.clock = clock;
    }

    @Override
    public String name() {
        return CheckType.SYSTEM_RESOURCES.getKey();
    }

    @Override
    public CheckType checkType() {
        return CheckType.SYSTEM_RESOURCES;
    }

    @Override
    public List<MetricSample> collect(Session session) {
        SampleRecorder recorder = new SampleRecorder(name(), clock);

        recorder.number(MetricNames.HOST_CPU_USAGE_PERCENT,
                DerivedIndicators.clamp(probe.cpuUsagePercent(), 0.0, 100.0));
        recorder.number(MetricNames.HOST_CPU_LOGICAL_COUNT, probe.logicalProcessorCount());

        long memoryTotal = probe.memoryTotalBytes();
        long memoryUsed = memoryTotal - probe.memoryAvailableBytes();
        recorder.number(MetricNames.HOST_MEMORY_TOTAL_BYTES, memoryTotal)
                .number(MetricNames.HOST_MEMORY_USED_BYTES, memoryUsed)
                .number(MetricNames.HOST_MEMORY_USAGE_PERCENT, DerivedIndicators.usagePercent(memoryUsed, memoryTotal));

        long swapTotal = probe.swapTotalBytes();
        long swapUsed = probe.swapUsedBytes();
        recorder.number(MetricNames.HOST_SWAP_TOTAL_BYTES, swapTotal)
                .number(MetricNames.HOST_SWAP_USED_BYTES, swapUsed)
                .number(MetricNames.HOST_SWAP_USAGE_PERCENT, DerivedIndicators.usagePercent(swapUsed, swapTotal));

        long diskTotal = probe.diskTotalBytes(diskPath);
        long diskUsed = diskTotal - probe.diskUsableBytes(diskPath);
        recorder.number(MetricNames.HOST_DISK_TOTAL_BYTES, diskTotal)
                .number(MetricNames.HOST_DISK_USED_BYTES, diskUsed)
                .number(MetricNames.HOST_DISK_USAGE_PERCENT, DerivedIndicators.usagePercent(diskUsed, diskTotal));

        return recorder.samples();
    }
}
