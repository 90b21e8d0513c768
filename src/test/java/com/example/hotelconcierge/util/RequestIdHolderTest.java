package com.example.hotelconcierge.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RequestIdHolderTest {

    @AfterEach
    void clear() {
        RequestIdHolder.clear();
    }

    @Test
    void ensureReusesTheCurrentId() {
        RequestIdHolder.set("req-42");

        assertThat(RequestIdHolder.ensure()).isEqualTo("req-42");
        assertThat(RequestIdHolder.get()).isEqualTo("req-42");
    }

    @Test
    void ensureGeneratesAnIdWhenMissing() {
        String generated = RequestIdHolder.ensure();

        assertThat(generated).isNotBlank();
        assertThat(RequestIdHolder.get()).isEqualTo(generated);
    }

    @Test
    void acceptKeepsSafeHeaderValuesAndReplacesOthers() {
        assertThat(RequestIdHolder.accept(" front-desk.42 ")).isEqualTo("front-desk.42");
        assertThat(RequestIdHolder.accept("bad id\nwith newline")).hasSize(36);
        assertThat(RequestIdHolder.accept("x".repeat(65))).hasSize(36);
        assertThat(RequestIdHolder.accept(null)).hasSize(36);
    }
}
