package com.syncrecovery.engine.system;

import com.syncrecovery.core.model.NetworkStatus;
import com.syncrecovery.core.model.SystemState;
import com.syncrecovery.core.spi.SystemStateProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Clock;
import java.time.Duration;

/**
 * System state read from the running JVM and host.
 *
 * Network status comes from a TCP connect to a configured probe endpoint.
 * Without a probe host the network is assumed ONLINE.
 */
public class JvmSystemStateProvider implements SystemStateProvider {

    private static final Logger log = LoggerFactory.getLogger(JvmSystemStateProvider.class);

    private final Clock clock;
    private final File diskPath;
    private final String probeHost;
    private final int probePort;
    private final Duration probeTimeout;

    public JvmSystemStateProvider(Clock clock, String diskPath, String probeHost, int probePort,
                                  Duration probeTimeout) {
        this.clock = clock;
        this.diskPath = new File(diskPath != null ? diskPath : ".");
        this.probeHost = probeHost;
        this.probePort = probePort;
        this.probeTimeout = probeTimeout != null ? probeTimeout : Duration.ofSeconds(5);
    }

    @Override
    public SystemState snapshot() {
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        double memoryUsage = (double) used / runtime.maxMemory();

        return new SystemState(
            probeNetwork(),
            diskPath.getUsableSpace(),
            clamp(memoryUsage),
            cpuLoad(),
            0,
            0,
            clock.instant()
        );
    }

    /**
     * Connect to the probe endpoint. A connect slower than half the
     * timeout counts as DEGRADED.
     */
    @Override
    public NetworkStatus probeNetwork() {
        if (probeHost == null || probeHost.isBlank()) {
            return NetworkStatus.ONLINE;
        }

        long started = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(probeHost, probePort), (int) probeTimeout.toMillis());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            return elapsed.compareTo(probeTimeout.dividedBy(2)) > 0 ? NetworkStatus.DEGRADED : NetworkStatus.ONLINE;
        } catch (IOException e) {
            log.debug("Network probe to {}:{} failed: {}", probeHost, probePort, e.getMessage());
            return NetworkStatus.OFFLINE;
        }
    }

    private double cpuLoad() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        double load = os.getSystemLoadAverage();
        if (load < 0) {
            // Not available on this platform
            return 0.0;
        }
        return clamp(load / os.getAvailableProcessors());
    }

    private static double clamp(double ratio) {
        return Math.max(0.0, Math.min(1.0, ratio));
    }
}
