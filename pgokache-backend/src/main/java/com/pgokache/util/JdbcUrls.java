package com.pgokache.util;

import com.pgokache.model.ConnectionDescriptor;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

public final class JdbcUrls {

    private static final int DEFAULT_PORT = 5432;

    private JdbcUrls() {
    }

    /**
     * Build a PostgreSQL JDBC URL. Credentials are passed separately and never appear in the URL.
     *
     * @param descriptor connection descriptor
     * @return jdbc url
     */
    public static String postgres(ConnectionDescriptor descriptor) {
        int port = descriptor.getPort() > 0 ? descriptor.getPort() : DEFAULT_PORT;
        String host = descriptor.getHost();
        if (host != null && host.contains(":") && !host.startsWith("[")) {
            host = "[" + host + "]";
        }
        return String.format("jdbc:postgresql://%s:%d/%s", host, port,
                URLEncoder.encode(descriptor.getDbname(), StandardCharsets.UTF_8));
    }
}
