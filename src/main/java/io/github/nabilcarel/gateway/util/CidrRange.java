package io.github.nabilcarel.gateway.util;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * An IPv4 or IPv6 network in CIDR notation, such as {@code 10.0.0.0/8}.
 */
public final class CidrRange {

    private static final Pattern ADDRESS_LITERAL = Pattern.compile("[0-9A-Fa-f:.]+");

    private final byte[] network;
    private final int prefixLength;
    private final String notation;

    private CidrRange(byte[] network, int prefixLength, String notation) {
        this.network = network;
        this.prefixLength = prefixLength;
        this.notation = notation;
    }

    public static CidrRange parse(String cidr) {
        String trimmed = cidr == null ? "" : cidr.trim();
        String[] parts = trimmed.split("/", 2);
        if (!ADDRESS_LITERAL.matcher(parts[0]).matches()) {
            throw new IllegalArgumentException("Not an IP range: '" + cidr + "'");
        }
        byte[] network;
        try {
            network = InetAddress.getByName(parts[0]).getAddress();
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Not an IP range: '" + cidr + "'", e);
        }
        int maxPrefix = network.length * 8;
        int prefixLength;
        try {
            prefixLength = parts.length == 2 ? Integer.parseInt(parts[1]) : maxPrefix;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid prefix length in '" + cidr + "'", e);
        }
        if (prefixLength < 0 || prefixLength > maxPrefix) {
            throw new IllegalArgumentException("Invalid prefix length in '" + cidr + "'");
        }
        return new CidrRange(network, prefixLength, trimmed);
    }

    public boolean contains(InetAddress address) {
        byte[] candidate = address.getAddress();
        if (candidate.length != network.length) {
            return false;
        }
        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (candidate[i] != network[i]) {
                return false;
            }
        }
        int remainingBits = prefixLength % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
    }

    @Override
    public String toString() {
        return notation;
    }
}
