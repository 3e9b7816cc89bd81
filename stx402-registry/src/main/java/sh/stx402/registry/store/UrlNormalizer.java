// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.store;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

import sh.stx402.core.crypto.Sha256;
import sh.stx402.core.error.ErrorCode;
import sh.stx402.core.error.RegistryException;
import sh.stx402.primitives.Hex;

/**
 * Canonical form of endpoint URLs, and the identifiers derived from it.
 *
 * <p>
 * Normalization lower-cases scheme and host, drops default ports, fragments and
 * user info, and strips a trailing slash from non-root paths. The query is kept.
 */
public final class UrlNormalizer {

    private static final int ID_LENGTH = 16;

    private UrlNormalizer() {
    }

    /**
     * @throws RegistryException with {@code INVALID_INPUT} for malformed or non-http(s) URLs
     */
    public static String normalize(final String url) {
        if (url == null || url.isBlank()) {
            throw RegistryException.invalidInput("url is required");
        }
        final URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new RegistryException(ErrorCode.INVALID_INPUT, "Invalid URL format: " + url, e);
        }
        final String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw RegistryException.invalidInput("URL must use http or https: " + url);
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw RegistryException.invalidInput("URL has no host: " + url);
        }

        final StringBuilder sb = new StringBuilder(url.length());
        sb.append(scheme).append("://").append(uri.getHost().toLowerCase(Locale.ROOT));
        final int port = uri.getPort();
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        sb.append(path);
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        return sb.toString();
    }

    /**
     * Full lowercase SHA-256 hex of a normalized URL.
     */
    public static String urlHash(final String normalizedUrl) {
        return Hex.encodeNoPrefix(Sha256.hashUtf8(normalizedUrl));
    }

    /**
     * Entry id: the first 16 hex characters of the URL hash.
     */
    public static String entryId(final String normalizedUrl) {
        return urlHash(normalizedUrl).substring(0, ID_LENGTH);
    }

    private static boolean isDefaultPort(final String scheme, final int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }
}
