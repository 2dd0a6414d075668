package net.leasehold.core.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/** 이 프로세스의 식별 문자열 (hostname:pid) */
public final class InstanceId {
    private static final Logger log = LoggerFactory.getLogger(InstanceId.class);

    private InstanceId() {}

    public static String detect() {
        return hostname() + ":" + ProcessHandle.current().pid();
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            String fallback = (env == null || env.isBlank()) ? "unknown-host" : env;
            log.debug("local hostname lookup failed ({}), using '{}'", e.getMessage(), fallback);
            return fallback;
        }
    }
}
