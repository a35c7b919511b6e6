package com.pgokache.util;

import com.pgokache.model.ConnectionDescriptor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcUrlsTest {

    @Test
    void defaultsPortAndEncodesDatabase() {
        ConnectionDescriptor descriptor = ConnectionDescriptor.builder()
                .host("db.internal").dbname("my db").user("u").password("p").build();

        assertThat(JdbcUrls.postgres(descriptor)).isEqualTo("jdbc:postgresql://db.internal:5432/my+db");
    }

    @Test
    void bracketsIpv6Hosts() {
        ConnectionDescriptor descriptor = ConnectionDescriptor.builder()
                .host("::1").port(5433).dbname("app").user("u").password("p").build();

        assertThat(JdbcUrls.postgres(descriptor)).isEqualTo("jdbc:postgresql://[::1]:5433/app");
    }
}
