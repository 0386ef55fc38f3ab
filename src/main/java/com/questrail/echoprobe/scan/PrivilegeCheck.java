package com.questrail.echoprobe.scan;

/**
 * Reports whether the process holds the privilege needed to probe well-known
 * ports. Implementations are per platform; see {@link PrivilegeChecks}.
 */
@FunctionalInterface
public interface PrivilegeCheck {
    boolean isPrivileged();
}
