package com.advisorscout.crawl.http;

import com.advisorscout.crawl.model.HttpFetchResult;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Inflates fetched bodies. A payload is treated as gzip when the response declares
 * {@code Content-Encoding: gzip} or the body starts with the gzip magic bytes, which covers
 * {@code .xml.gz} sitemaps. Bytes are handed to the parsers undecoded so they can honour the
 * encoding declared inside the document.
 */
public final class PayloadDecoder {

    private PayloadDecoder() {
    }

    public static byte[] inflate(HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null) {
            return null;
        }
        if (isGzipPayload(fetch, bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return gzipInputStream.readAllBytes();
            }
        }
        return bodyBytes;
    }

    static boolean isGzipPayload(HttpFetchResult fetch, byte[] bodyBytes) {
        if (containsIgnoreCase(fetch.contentEncoding(), "gzip")) {
            return true;
        }
        // A .gz URL served already inflated is read as plain text.
        return bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
    }

    private static boolean containsIgnoreCase(String value, String token) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(token);
    }

    /**
     * Charset named by the {@code Content-Type} header, or null when the header names none or an
     * unsupported one.
     */
    public static String declaredCharset(String contentType) {
        if (contentType == null) {
            return null;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.isSupported(name) ? Charset.forName(name).name() : null;
                } catch (IllegalCharsetNameException e) {
                    return null;
                }
            }
        }
        return null;
    }
}
