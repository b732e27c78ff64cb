package com.resurrector.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthTypeTest {

    @Test
    void parse_shouldNormaliseSpellings() {
        assertThat(AuthType.parse(null)).isEqualTo(AuthType.NONE);
        assertThat(AuthType.parse("Bearer")).isEqualTo(AuthType.BEARER);
        assertThat(AuthType.parse("api-key")).isEqualTo(AuthType.API_KEY);
        assertThat(AuthType.parse("apiKey")).isEqualTo(AuthType.API_KEY);
        assertThat(AuthType.parse("API_KEY")).isEqualTo(AuthType.API_KEY);
        assertThatThrownBy(() -> AuthType.parse("digest")).isInstanceOf(IllegalArgumentException.class);
    }
}
