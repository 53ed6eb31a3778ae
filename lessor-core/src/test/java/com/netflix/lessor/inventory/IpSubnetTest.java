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

import org.junit.Test;

import java.math.BigInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class IpSubnetTest {

    @Test
    public void testParseMasksHostBits() {
        IpSubnet subnet = IpSubnet.parse("10.128.5.7/17");
        assertThat(subnet.toString(), is("10.128.0.0/17"));
        assertThat(subnet, is(IpSubnet.parse("10.128.0.0/17")));
        assertThat(subnet.isIpv6(), is(false));
        assertThat(subnet.getPrefixLength(), is(17));
    }

    @Test
    public void testSplit() {
        IpSubnet parent = IpSubnet.parse("10.128.0.0/17");
        assertThat(parent.subnetCount(24), is(BigInteger.valueOf(128)));
        IpSubnet second = parent.subnet(BigInteger.ONE, 24);
        assertThat(second.toString(), is("10.128.1.0/24"));
        assertThat(parent.indexOf(second), is(BigInteger.ONE));
        assertThat(parent.indexOf(parent.subnet(BigInteger.valueOf(127), 24)), is(BigInteger.valueOf(127)));
        assertThat(parent.indexOf(IpSubnet.parse("10.129.0.0/24")), is(BigInteger.ONE.negate()));
        assertThat(parent.indexOf(IpSubnet.parse("10.0.0.0/8")), is(BigInteger.ONE.negate()));
        assertThat(parent.indexOf(IpSubnet.parse("2602:fcfb:1::/64")), is(BigInteger.ONE.negate()));
    }

    @Test
    public void testHosts() {
        IpSubnet block = IpSubnet.parse("10.128.1.0/24");
        assertThat(block.host(1), is("10.128.1.1"));
        assertThat(block.lastHostOffset(), is(BigInteger.valueOf(254)));
        assertThat(IpSubnet.parse("10.0.0.0/31").lastHostOffset(), is(BigInteger.ONE));
        assertThat(IpSubnet.parse("2602:fcfb:1:1::/64").lastHostOffset(),
                is(BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE)));
    }

    @Test
    public void testIpv6() {
        IpSubnet parent = IpSubnet.parse("2602:fcfb:1::/48");
        assertThat(parent.isIpv6(), is(true));
        assertThat(parent.subnetCount(64), is(BigInteger.valueOf(65536)));
        IpSubnet block = parent.subnet(BigInteger.valueOf(3), 64);
        assertThat(block, is(IpSubnet.parse("2602:fcfb:1:3::/64")));
        assertThat(block.host(1), is("2602:fcfb:1:3::1"));
    }

    @Test
    public void testIpv6TextIsCompressed() {
        IpSubnet block = IpSubnet.parse("2602:FCFB:0001:0001:0000:0000:0000:0000/64");
        assertThat(block.toString(), is("2602:fcfb:1:1::/64"));
        assertThat(block.host(2), is("2602:fcfb:1:1::2"));
        assertThat(IpSubnet.parse("::/0").toString(), is("::/0"));
        assertThat(IpSubnet.parse("::1/128").host(0), is("::1"));
        assertThat(IpSubnet.parse("2001:db8:0:1:0:0:0:0/64").host(1), is("2001:db8:0:1::1"));
        assertThat(IpSubnet.parse("2001:db8::1:0:0:1/128").host(0), is("2001:db8::1:0:0:1"));
        assertThat(IpSubnet.parse("2001:0:0:1:0:0:0:0/64").toString(), is("2001:0:0:1::/64"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingPrefix() {
        IpSubnet.parse("10.0.0.0");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPrefixTooLong() {
        IpSubnet.parse("10.0.0.0/33");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testHostName() {
        IpSubnet.parse("example/8");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCannotSplitIntoLargerBlocks() {
        IpSubnet.parse("10.128.0.0/17").subnetCount(16);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSubBlockIndexOutOfRange() {
        IpSubnet.parse("10.128.0.0/23").subnet(BigInteger.valueOf(2), 24);
    }
}
