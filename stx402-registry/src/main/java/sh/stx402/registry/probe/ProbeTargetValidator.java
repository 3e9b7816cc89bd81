// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.probe;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Refuses probe targets that point into private or internal networks.
 *
 * <p>
 * Only the literal host is inspected; names are not resolved.
 */
public final class ProbeTargetValidator {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");

    private ProbeTargetValidator() {
    }

    /**
     * @return the reason the URL may not be probed, empty if it may
     */
    public static Optional<String> check(final String url) {
        final URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return Optional.of("Invalid URL format");
        }
        final String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return Optional.of("URL must use http or https");
        }
        if (uri.getHost() == null) {
            return Optional.of("Invalid URL format");
        }
        return Optional.ofNullable(privateHostReason(uri.getHost()));
    }

    /**
     * @return null if the host is allowed
     */
    static String privateHostReason(final String rawHost) {
        String host = rawHost.toLowerCase(Locale.ROOT);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.equals("localhost") || host.endsWith(".localhost")) {
            return "Cannot probe localhost";
        }
        if (host.endsWith(".local") || host.endsWith(".internal") || host.endsWith(".corp")) {
            return "Cannot probe internal hostnames";
        }

        final Matcher ipv4 = IPV4.matcher(host);
        if (ipv4.matches()) {
            final int a = Integer.parseInt(ipv4.group(1));
            final int b = Integer.parseInt(ipv4.group(2));
            if (a == 127) {
                return "Cannot probe loopback addresses";
            }
            if (a == 10 || (a == 172 && b >= 16 && b <= 31) || (a == 192 && b == 168)) {
                return "Cannot probe private IP ranges";
            }
            if (a == 169 && b == 254) {
                return "Cannot probe link-local addresses";
            }
            if (a == 0) {
                return "Cannot probe reserved addresses";
            }
        }

        if (host.contains(":")) {
            if (host.equals("::1")) {
                return "Cannot probe loopback addresses";
            }
            if (host.startsWith("::ffff:")) {
                return "Cannot probe IPv4-mapped IPv6 addresses";
            }
            if (host.startsWith("fe80:")) {
                return "Cannot probe link-local addresses";
            }
            if (host.startsWith("fc") || host.startsWith("fd")) {
                return "Cannot probe private IP ranges";
            }
        }
        return null;
    }
}
