package io.jobkeeper.config;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Identifies one scheduler instance in execution records: {@code host-pid-uuid}.
 */
public final class OwnerIds {
    private static final int MAX_LENGTH = 128;

    private OwnerIds() {
    }

    public static String resolve(String configuredOwnerId) {
        if (configuredOwnerId != null && !configuredOwnerId.isBlank()) {
            return configuredOwnerId;
        }

        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException | SecurityException e) {
            host = "jobkeeper";
        }

        String pid = String.valueOf(ManagementFactory.getRuntimeMXBean().getPid());

        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        if (generated.length() > MAX_LENGTH) {
            return generated.substring(0, MAX_LENGTH);
        }
        return generated;
    }
}
