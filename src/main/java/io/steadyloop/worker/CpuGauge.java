package io.steadyloop.worker;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

@FunctionalInterface
public interface CpuGauge {
    double cpuPercent();

    static CpuGauge system() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean sunOs = (com.sun.management.OperatingSystemMXBean) os;
            return () -> {
                double load = sunOs.getCpuLoad();
                return load < 0.0d ? -1.0d : load * 100.0d;
            };
        }
        return () -> {
            double avg = os.getSystemLoadAverage();
            int cpus = Math.max(1, os.getAvailableProcessors());
            return avg < 0.0d ? -1.0d : Math.min(100.0d, avg / cpus * 100.0d);
        };
    }
}
