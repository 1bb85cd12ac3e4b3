package io.github.nabilcarel.gateway;

import io.github.nabilcarel.gateway.util.CidrRange;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;

import static org.assertj.core.api.Assertions.*;

class CidrRangeTest {

    @Test
    void testContains_ipv4() throws Exception {
        CidrRange range = CidrRange.parse("172.16.0.0/12");

        assertThat(range.contains(InetAddress.getByName("172.16.0.1"))).isTrue();
        assertThat(range.contains(InetAddress.getByName("172.31.255.255"))).isTrue();
        assertThat(range.contains(InetAddress.getByName("172.32.0.0"))).isFalse();
        assertThat(range.contains(InetAddress.getByName("::1"))).isFalse();
    }

    @Test
    void testContains_ipv6() throws Exception {
        CidrRange range = CidrRange.parse("fc00::/7");

        assertThat(range.contains(InetAddress.getByName("fd12:3456::1"))).isTrue();
        assertThat(range.contains(InetAddress.getByName("fe80::1"))).isFalse();
    }

    @Test
    void testParse_withoutPrefixIsSingleAddress() throws Exception {
        CidrRange range = CidrRange.parse("169.254.169.254");

        assertThat(range.contains(InetAddress.getByName("169.254.169.254"))).isTrue();
        assertThat(range.contains(InetAddress.getByName("169.254.169.253"))).isFalse();
    }

    @Test
    void testParse_rejectsInvalidInput() {
        assertThatThrownBy(() -> CidrRange.parse("intranet.local/8")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CidrRange.parse("10.0.0.0/33")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CidrRange.parse("10.0.0.0/x")).isInstanceOf(IllegalArgumentException.class);
    }
}
