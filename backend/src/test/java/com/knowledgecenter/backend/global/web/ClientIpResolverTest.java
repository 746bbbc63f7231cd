package com.knowledgecenter.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientIpResolverTest {

    @Test
    void prefersFirstForwardedForHop() {
        MockHttpServletRequest request = request("10.0.0.1");
        request.addHeader("X-Forwarded-For", " 203.0.113.5 , 10.0.0.2");
        request.addHeader("X-Real-IP", "198.51.100.1");

        assertThat(ClientIpResolver.resolve(request)).isEqualTo("203.0.113.5");
    }

    @Test
    void fallsBackToRealIpHeader() {
        MockHttpServletRequest request = request("10.0.0.1");
        request.addHeader("X-Real-IP", "198.51.100.1:4431");

        assertThat(ClientIpResolver.resolve(request)).isEqualTo("198.51.100.1");
    }

    @Test
    void fallsBackToPeerAddress() {
        assertThat(ClientIpResolver.resolve(request("192.0.2.44"))).isEqualTo("192.0.2.44");
        assertThat(ClientIpResolver.resolve(request("[2001:db8::1]"))).isEqualTo("2001:db8::1");
        assertThat(ClientIpResolver.resolve(request("2001:db8::1"))).isEqualTo("2001:db8::1");
    }

    @ParameterizedTest
    @CsvSource({
            "203.0.113.5:8080, 203.0.113.5",
            "203.0.113.5, 203.0.113.5",
            "[2001:db8::1]:443, 2001:db8::1",
            "[2001:db8::1], 2001:db8::1",
            "2001:db8::1, 2001:db8::1"
    })
    void cleansForwardedAddresses(String raw, String expected) {
        assertThat(ClientIpResolver.cleanIp(raw)).isEqualTo(expected);
    }

    private static MockHttpServletRequest request(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/auth/login");
        request.setRemoteAddr(remoteAddr);
        return request;
    }
}
