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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Dotted-quad IPv4 address and mask arithmetic on `int` values.
///
/// Addresses are held as 32-bit signed ints; comparisons that need address order
/// go through [Integer#compareUnsigned].
public final class Ipv4 {

    private static final Pattern DOTTED =
        Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern PREFIX = Pattern.compile("^/?(\\d{1,2})$");

    private Ipv4() {
    }

    /// Parses a dotted-quad address.
    ///
    /// @param text the address text, e.g. `10.0.0.1`
    /// @return the address as an int
    /// @throws IllegalArgumentException if the text is not a dotted-quad address
    public static int parseAddress(String text) {
        if (text == null) {
            throw new IllegalArgumentException("address is missing");
        }
        Matcher matcher = DOTTED.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("not a dotted-quad address: '" + text + "'");
        }
        int value = 0;
        for (int group = 1; group <= 4; group++) {
            int octet = Integer.parseInt(matcher.group(group));
            if (octet > 255) {
                throw new IllegalArgumentException("octet out of range in '" + text + "'");
            }
            value = (value << 8) | octet;
        }
        return value;
    }

    /// Parses a subnet mask into a prefix length. Both dotted masks
    /// (`255.255.255.252`) and prefix notation (`/30` or `30`) are accepted.
    ///
    /// @param text the mask text
    /// @return the prefix length, 0 through 32
    /// @throws IllegalArgumentException if the mask is malformed or not contiguous
    public static int parsePrefixLength(String text) {
        if (text == null) {
            throw new IllegalArgumentException("subnet mask is missing");
        }
        String trimmed = text.trim();
        Matcher prefix = PREFIX.matcher(trimmed);
        if (prefix.matches()) {
            int length = Integer.parseInt(prefix.group(1));
            if (length > 32) {
                throw new IllegalArgumentException("prefix length out of range: '" + text + "'");
            }
            return length;
        }
        int mask = parseAddress(trimmed);
        int length = Integer.bitCount(mask);
        if (mask != maskOf(length)) {
            throw new IllegalArgumentException("subnet mask is not contiguous: '" + text + "'");
        }
        return length;
    }

    /// @param prefixLength a prefix length, 0 through 32
    /// @return the mask with the given number of leading one bits
    public static int maskOf(int prefixLength) {
        return prefixLength == 0 ? 0 : -1 << (32 - prefixLength);
    }

    /// Formats an int address in dotted-quad form.
    ///
    /// @param address the address
    /// @return the dotted-quad text
    public static String format(int address) {
        return ((address >>> 24) & 0xff) + "." + ((address >>> 16) & 0xff) + "."
            + ((address >>> 8) & 0xff) + "." + (address & 0xff);
    }

    /// Formats a prefix length as a dotted mask.
    ///
    /// @param prefixLength the prefix length
    /// @return the dotted mask, e.g. `255.255.255.0` for 24
    public static String formatMask(int prefixLength) {
        return format(maskOf(prefixLength));
    }
}
