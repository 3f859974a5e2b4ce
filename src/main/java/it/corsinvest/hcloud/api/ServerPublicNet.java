/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.util.List;

/**
 * Public network configuration of a server.
 */
public class ServerPublicNet {

    private final String _ipv4;
    private final boolean _ipv4Blocked;
    private final String _ipv4DnsPtr;
    private final String _ipv6;
    private final boolean _ipv6Blocked;
    private final List<Long> _floatingIPs;

    public ServerPublicNet(String ipv4,
            boolean ipv4Blocked,
            String ipv4DnsPtr,
            String ipv6,
            boolean ipv6Blocked,
            List<Long> floatingIPs) {
        _ipv4 = ipv4;
        _ipv4Blocked = ipv4Blocked;
        _ipv4DnsPtr = ipv4DnsPtr;
        _ipv6 = ipv6;
        _ipv6Blocked = ipv6Blocked;
        _floatingIPs = floatingIPs != null ? List.copyOf(floatingIPs) : List.of();
    }

    public String getIPv4() {
        return _ipv4;
    }

    public boolean isIPv4Blocked() {
        return _ipv4Blocked;
    }

    /**
     * Reverse DNS entry of the IPv4 address.
     *
     * @return String
     */
    public String getIPv4DnsPtr() {
        return _ipv4DnsPtr;
    }

    /**
     * IPv6 network in CIDR notation.
     *
     * @return String
     */
    public String getIPv6() {
        return _ipv6;
    }

    public boolean isIPv6Blocked() {
        return _ipv6Blocked;
    }

    /**
     * Ids of the floating IPs assigned to the server.
     *
     * @return List
     */
    public List<Long> getFloatingIPs() {
        return _floatingIPs;
    }
}
