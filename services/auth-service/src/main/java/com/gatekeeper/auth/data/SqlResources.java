package com.gatekeeper.auth.data;

import com.gatekeeper.auth.exception.ServiceException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads SQL text kept as classpath resources, e.g. {@code sql/customer-permissions.sql}.
 */
public final class SqlResources {

    private SqlResources() {
        // utility class
    }

    /**
     * @param path classpath location of the file
     * @return file contents decoded as UTF-8
     * @throws ServiceException VALIDATION when no such resource exists
     */
    public static String load(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw ServiceException.validation("SQL resource not found: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read SQL resource " + path, e);
        }
    }
}
