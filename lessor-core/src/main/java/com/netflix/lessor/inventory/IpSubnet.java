/*
 * Copyright 2016 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.lessor.inventory;

import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Objects;

/**
 * An IPv4 or IPv6 network in CIDR form, able to split itself into equally sized sub-blocks. Sub-blocks are
 * addressed by index and computed on demand, so splitting a large IPv6 block does not materialize every sub-block.
 */
public class IpSubnet {
    private final BigInteger network;
    private final int prefixLength;
    private final int addressBits;

    private IpSubnet(BigInteger network, int prefixLength, int addressBits) {
        this.network = network;
        this.prefixLength = prefixLength;
        this.addressBits = addressBits;
    }

    /**
     * Parse a network in CIDR notation such as {@code 10.1.0.0/17} or {@code 2001:db8::/48}. Host bits are
     * cleared.
     *
     * @param cidr the network
     * @return the parsed network
     * @throws IllegalArgumentException if the text is not an address literal with a valid prefix length
     */
    public static IpSubnet parse(String cidr) {
        if (cidr == null)
            throw new IllegalArgumentException("subnet must not be null");
        final int slash = cidr.indexOf('/');
        if (slash < 0)
            throw new IllegalArgumentException("Missing prefix length in subnet " + cidr);
        final String address = cidr.substring(0, slash).trim();
        if (address.isEmpty() || !(address.indexOf(':') >= 0 || Character.isDigit(address.charAt(0))))
            throw new IllegalArgumentException("Not an address literal: " + cidr);
        final byte[] bytes;
        try {
            bytes = InetAddress.getByName(address).getAddress();
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid address in subnet " + cidr, e);
        }
        final int bits = bytes.length * 8;
        final int prefix;
        try {
            prefix = Integer.parseInt(cidr.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid prefix length in subnet " + cidr, e);
        }
        if (prefix < 0 || prefix > bits)
            throw new IllegalArgumentException("Prefix length out of range in subnet " + cidr);
        return new IpSubnet(mask(new BigInteger(1, bytes), prefix, bits), prefix, bits);
    }

    private static BigInteger mask(BigInteger value, int prefix, int bits) {
        return value.shiftRight(bits - prefix).shiftLeft(bits - prefix);
    }

    public boolean isIpv6() {
        return addressBits == 128;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public BigInteger size() {
        return BigInteger.ONE.shiftLeft(addressBits - prefixLength);
    }

    /**
     * Get the number of sub-blocks of the given prefix length this network splits into.
     *
     * @param newPrefix prefix length of the sub-blocks
     * @return the number of sub-blocks
     */
    public BigInteger subnetCount(int newPrefix) {
        checkNewPrefix(newPrefix);
        return BigInteger.ONE.shiftLeft(newPrefix - prefixLength);
    }

    /**
     * Get a sub-block of this network.
     *
     * @param index index of the sub-block, from 0
     * @param newPrefix prefix length of the sub-block
     * @return the sub-block
     */
    public IpSubnet subnet(BigInteger index, int newPrefix) {
        checkNewPrefix(newPrefix);
        if (index.signum() < 0 || index.compareTo(subnetCount(newPrefix)) >= 0)
            throw new IllegalArgumentException("Sub-block index " + index + " out of range for /" + newPrefix +
                    " in " + this);
        return new IpSubnet(network.add(index.shiftLeft(addressBits - newPrefix)), newPrefix, addressBits);
    }

    /**
     * Get the index of a sub-block within this network.
     *
     * @param other a network
     * @return the index, or -1 if {@code other} is not a sub-block of this network of its own prefix length
     */
    public BigInteger indexOf(IpSubnet other) {
        if (other.addressBits != addressBits || other.prefixLength < prefixLength ||
                !mask(other.network, prefixLength, addressBits).equals(network))
            return BigInteger.ONE.negate();
        return other.network.subtract(network).shiftRight(addressBits - other.prefixLength);
    }

    /**
     * Get the highest host offset usable in this network. IPv4 networks keep their broadcast address out.
     *
     * @return the last usable offset from the network address
     */
    public BigInteger lastHostOffset() {
        if (isIpv6() || prefixLength >= 31)
            return size().subtract(BigInteger.ONE);
        return size().subtract(BigInteger.valueOf(2));
    }

    /**
     * Get the address at an offset from the network address.
     *
     * @param offset offset of the host, 1 for the first host
     * @return the address text
     */
    public String host(long offset) {
        final BigInteger o = BigInteger.valueOf(offset);
        if (o.signum() < 0 || o.compareTo(size()) >= 0)
            throw new IllegalArgumentException("Host offset " + offset + " outside of " + this);
        return format(network.add(o));
    }

    private String format(BigInteger value) {
        final byte[] raw = value.toByteArray();
        final byte[] bytes = new byte[addressBits / 8];
        final int n = Math.min(raw.length, bytes.length);
        System.arraycopy(raw, raw.length - n, bytes, bytes.length - n, n);
        if (isIpv6())
            return compressedIpv6(bytes);
        try {
            return InetAddress.getByAddress(bytes).getHostAddress();
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Unexpected: invalid address length " + Arrays.toString(bytes), e);
        }
    }

    // RFC 5952 text: lower case, no leading zeros, the first longest run of two or more zero groups as "::"
    private static String compressedIpv6(byte[] bytes) {
        final int[] groups = new int[8];
        for (int i = 0; i < groups.length; i++)
            groups[i] = ((bytes[2 * i] & 0xff) << 8) | (bytes[2 * i + 1] & 0xff);
        int bestStart = -1;
        int bestLength = 1;
        for (int i = 0; i < groups.length; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int j = i;
            while (j < groups.length && groups[j] == 0)
                j++;
            if (j - i > bestLength) {
                bestStart = i;
                bestLength = j - i;
            }
            i = j;
        }
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < groups.length; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLength - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':')
                sb.append(':');
            sb.append(Integer.toHexString(groups[i]));
        }
        return sb.toString();
    }

    private void checkNewPrefix(int newPrefix) {
        if (newPrefix < prefixLength || newPrefix > addressBits)
            throw new IllegalArgumentException("Cannot split " + this + " into /" + newPrefix + " sub-blocks");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        IpSubnet ipSubnet = (IpSubnet) o;
        return prefixLength == ipSubnet.prefixLength && addressBits == ipSubnet.addressBits &&
                network.equals(ipSubnet.network);
    }

    @Override
    public int hashCode() {
        return Objects.hash(network, prefixLength, addressBits);
    }

    @Override
    public String toString() {
        return format(network) + "/" + prefixLength;
    }
}
