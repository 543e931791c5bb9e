package fr.lapetina.inference.gateway.api;

import java.net.InetSocketAddress;

/**
 * Resolves the client identifier used for rate-limit buckets.
 *
 * <p>The first entry of {@code X-Forwarded-For} wins, else the peer address. The header is
 * trusted as-is, so the gateway is expected to sit behind a proxy that sets it.
 */
public final class ClientIdentity {

    public static final String FORWARDED_FOR = "X-Forwarded-For";
    public static final String UNKNOWN = "unknown";

    private ClientIdentity() {
    }

    public static String resolve(String forwardedFor, InetSocketAddress remoteAddress) {
        if (forwardedFor != null) {
            int comma = forwardedFor.indexOf(',');
            String first = (comma >= 0 ? forwardedFor.substring(0, comma) : forwardedFor).trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }
        return UNKNOWN;
    }
}
