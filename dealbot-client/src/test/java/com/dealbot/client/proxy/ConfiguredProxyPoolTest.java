package com.dealbot.client.proxy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ConfiguredProxyPoolTest {

    @Test
    @DisplayName("An empty list yields direct connections")
    void emptyListIsDirect() {
        ConfiguredProxyPool pool = new ConfiguredProxyPool("");
        assertThat(pool.size()).isZero();
        assertThat(pool.nextProxy()).isEmpty();
    }

    @Test
    @DisplayName("Entries are trimmed and blanks dropped")
    void parsesList() {
        ConfiguredProxyPool pool = new ConfiguredProxyPool(" http://a:1 , ,http://u:p@b:2 ");
        assertThat(pool.size()).isEqualTo(2);

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            seen.add(pool.nextProxy().orElseThrow());
        }
        assertThat(seen).containsExactlyInAnyOrder("http://a:1", "http://u:p@b:2");
    }
}
