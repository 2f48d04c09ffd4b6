package com.lifecycle.core.service.archive;

import com.lifecycle.core.service.exception.UnsupportedFormatException;

import java.util.Locale;

/**
 * Bundle compression formats. Only GZIP is implemented; the others are accepted as
 * configuration values so that a request for them fails with a clear error.
 */
public enum CompressionFormat {
    GZIP,
    BZIP2,
    XZ;

    public static CompressionFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return GZIP;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedFormatException(value);
        }
    }

    /**
     * @throws UnsupportedFormatException for anything other than GZIP
     */
    public void requireSupported() {
        if (this != GZIP) {
            throw new UnsupportedFormatException(name().toLowerCase(Locale.ROOT));
        }
    }
}
