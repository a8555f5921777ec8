package com.platform.netconfig.model;

import java.util.Objects;

/**
 * An IPv4 network in CIDR notation (e.g. {@code 10.0.10.0/24}).
 *
 * <p>Host bits must be zero: {@code 10.0.10.1/24} is rejected, since the
 * controller stores the network address and a mismatch would show up as a
 * permanent diff.
 */
public final class Ipv4Cidr {

    private final int network;
    private final int prefixLength;

    private Ipv4Cidr(int network, int prefixLength) {
        this.network = network;
        this.prefixLength = prefixLength;
    }

    /**
     * Parses CIDR notation.
     *
     * @throws IllegalArgumentException if the text is not a valid IPv4 CIDR block
     */
    public static Ipv4Cidr parse(String cidr) {
        if (cidr == null || cidr.isBlank()) {
            throw new IllegalArgumentException("CIDR cannot be null or empty");
        }
        int slash = cidr.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("CIDR must contain '/' separator: " + cidr);
        }
        int address = parseAddress(cidr.substring(0, slash));
        int prefix;
        try {
            prefix = Integer.parseInt(cidr.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid prefix length in " + cidr);
        }
        if (prefix < 0 || prefix > 32) {
            throw new IllegalArgumentException("Prefix length must be between 0 and 32: " + cidr);
        }
        if ((address & mask(prefix)) != address) {
            throw new IllegalArgumentException("Host bits set in " + cidr + ", expected "
                + formatAddress(address & mask(prefix)) + "/" + prefix);
        }
        return new Ipv4Cidr(address, prefix);
    }

    /**
     * The network containing {@code address}, host bits cleared. Accepts the
     * interface form {@code 10.0.10.1/24} that controllers use for a gateway.
     */
    public static Ipv4Cidr enclosing(String interfaceCidr) {
        if (interfaceCidr == null || interfaceCidr.indexOf('/') < 0) {
            throw new IllegalArgumentException("Not an interface address: " + interfaceCidr);
        }
        int slash = interfaceCidr.indexOf('/');
        int address = parseAddress(interfaceCidr.substring(0, slash));
        int prefix;
        try {
            prefix = Integer.parseInt(interfaceCidr.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid prefix length in " + interfaceCidr);
        }
        if (prefix < 0 || prefix > 32) {
            throw new IllegalArgumentException("Prefix length must be between 0 and 32: " + interfaceCidr);
        }
        return new Ipv4Cidr(address & mask(prefix), prefix);
    }

    /**
     * Parses a dotted-quad IPv4 address into its 32-bit value.
     *
     * @throws IllegalArgumentException if the text is not a dotted-quad address
     */
    public static int parseAddress(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        String[] octets = text.trim().split("\\.", -1);
        if (octets.length != 4) {
            throw new IllegalArgumentException("Not an IPv4 address: " + text);
        }
        int value = 0;
        for (String octet : octets) {
            if (octet.isEmpty() || octet.length() > 3 || !octet.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("Not an IPv4 address: " + text);
            }
            int part = Integer.parseInt(octet);
            if (part > 255) {
                throw new IllegalArgumentException("Octet out of range in " + text);
            }
            value = (value << 8) | part;
        }
        return value;
    }

    public static boolean isValidAddress(String text) {
        try {
            parseAddress(text);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * True when {@code text} is an address already written the way
     * {@link #formatAddress(int)} prints it: no padding, no leading zeros.
     */
    public static boolean isCanonicalAddress(String text) {
        return isValidAddress(text) && formatAddress(parseAddress(text)).equals(text);
    }

    public static String formatAddress(int address) {
        return ((address >>> 24) & 0xFF) + "." + ((address >>> 16) & 0xFF) + "."
            + ((address >>> 8) & 0xFF) + "." + (address & 0xFF);
    }

    private static int mask(int prefix) {
        return prefix == 0 ? 0 : -1 << (32 - prefix);
    }

    public int prefixLength() {
        return prefixLength;
    }

    public int networkAddress() {
        return network;
    }

    public int broadcastAddress() {
        return network | ~mask(prefixLength);
    }

    public boolean contains(int address) {
        return (address & mask(prefixLength)) == network;
    }

    public boolean contains(String address) {
        return contains(parseAddress(address));
    }

    /**
     * Two CIDR blocks intersect exactly when one contains the other's network address.
     */
    public boolean overlaps(Ipv4Cidr other) {
        int shorter = Math.min(prefixLength, other.prefixLength);
        return (network & mask(shorter)) == (other.network & mask(shorter));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ipv4Cidr)) {
            return false;
        }
        Ipv4Cidr other = (Ipv4Cidr) o;
        return network == other.network && prefixLength == other.prefixLength;
    }

    @Override
    public int hashCode() {
        return Objects.hash(network, prefixLength);
    }

    @Override
    public String toString() {
        return formatAddress(network) + "/" + prefixLength;
    }
}
