package io.sqlpulse.monitor.engine.collector;

import oshi.SystemInfo;
import oshi.hardware.CentralProcessor;
import oshi.hardware.GlobalMemory;
import oshi.hardware.HardwareAbstractionLayer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Reads host resources through OSHI. Disk figures come from the file store holding the configured path.
 */
public class OshiHostProbe implements HostProbe {
    private static final long CPU_SAMPLE_MILLIS = 500;

    private final CentralProcessor processor;
    private final GlobalMemory memory;

    public OshiHostProbe() {
        HardwareAbstractionLayer hardware = new SystemInfo().getHardware();
        this.processor = hardware.getProcessor();
        this.memory = hardware.getMemory();
    }

    @Override
    public double cpuUsagePercent() {
        return processor.getSystemCpuLoad(CPU_SAMPLE_MILLIS) * 100.0;
    }

    @Override
    public int logicalProcessorCount() {
        return processor.getLogicalProcessorCount();
    }

    @Override
    public long memoryTotalBytes() {
        return memory.getTotal();
    }

    @Override
    public long memoryAvailableBytes() {
        return memory.getAvailable();
    }

    @Override
    public long swapTotalBytes() {
        return memory.getVirtualMemory().getSwapTotal();
    }

    @Override
    public long swapUsedBytes() {
        return memory.getVirtualMemory().getSwapUsed();
    }

    @Override
    public long diskTotalBytes(String path) {
        try {
            return fileStore(path).getTotalSpace();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read disk usage of " + path, e);
        }
    }

    @Override
    public long diskUsableBytes(String path) {
        try {
            return fileStore(path).getUsableSpace();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read disk usage of " + path, e);
        }
    }

    private static FileStore fileStore(String path) throws IOException {
        return Files.getFileStore(Paths.get(path));
    }
}
