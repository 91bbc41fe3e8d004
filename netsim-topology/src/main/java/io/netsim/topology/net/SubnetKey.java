package io.netsim.topology.net;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Network address plus prefix length, identifying the interfaces that can reach
/// each other directly. Keys order by network address, then by prefix length.
///
/// @param network the network address with host bits cleared
/// @param prefixLength the prefix length, 0 through 32
public record SubnetKey(int network, int prefixLength) implements Comparable<SubnetKey> {

    public SubnetKey {
        if (prefixLength < 0 || prefixLength > 32) {
            throw new IllegalArgumentException("prefix length out of range: " + prefixLength);
        }
        if ((network & Ipv4.maskOf(prefixLength)) != network) {
            throw new IllegalArgumentException(
                "host bits set in network " + Ipv4.format(network) + "/" + prefixLength);
        }
    }

    /// Derives the subnet key of an address and mask.
    ///
    /// @param address the interface address text
    /// @param mask the mask text, dotted or prefix notation
    /// @return the containing subnet key
    /// @throws IllegalArgumentException if either value is malformed
    public static SubnetKey of(String address, String mask) {
        int prefixLength = Ipv4.parsePrefixLength(mask);
        int ip = Ipv4.parseAddress(address);
        return new SubnetKey(ip & Ipv4.maskOf(prefixLength), prefixLength);
    }

    /// Parses the `a.b.c.d/n` form produced by [#toString()].
    ///
    /// @param cidr the CIDR text
    /// @return the subnet key
    public static SubnetKey parse(String cidr) {
        int slash = cidr.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("missing prefix length in '" + cidr + "'");
        }
        return new SubnetKey(Ipv4.parseAddress(cidr.substring(0, slash)),
            Ipv4.parsePrefixLength(cidr.substring(slash + 1)));
    }

    /// @param address an address as an int
    /// @return true if the address falls inside this subnet
    public boolean contains(int address) {
        return (address & Ipv4.maskOf(prefixLength)) == network;
    }

    @Override
    public int compareTo(SubnetKey other) {
        int byNetwork = Integer.compareUnsigned(network, other.network);
        return byNetwork != 0 ? byNetwork : Integer.compare(prefixLength, other.prefixLength);
    }

    @Override
    public String toString() {
        return Ipv4.format(network) + "/" + prefixLength;
    }
}
