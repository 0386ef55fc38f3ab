package com.questrail.echoprobe.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Platform implementations of {@link PrivilegeCheck}.
 */
public final class PrivilegeChecks {

    private static final Path PROC_SELF = Path.of("/proc/self");

    private PrivilegeChecks() {}

    /**
     * Effective-user check on Unix-like systems, no-op (always privileged)
     * elsewhere.
     */
    public static PrivilegeCheck forCurrentPlatform() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return always();
        }
        return PrivilegeChecks::isEffectiveRoot;
    }

    public static PrivilegeCheck always() {
        return () -> true;
    }

    public static PrivilegeCheck never() {
        return () -> false;
    }

    // /proc/self is owned by the effective uid of the process.
    static boolean isEffectiveRoot() {
        if (Files.isDirectory(PROC_SELF)) {
            try {
                Object uid = Files.getAttribute(PROC_SELF, "unix:uid");
                return uid instanceof Integer && (Integer) uid == 0;
            } catch (IOException | UnsupportedOperationException e) {
                // fall through to the account name
            }
        }
        return "root".equals(System.getProperty("user.name"));
    }
}
