package tech.medops.identity.common;

/**
 * Caller context captured by the routing layer.
 *
 * <p>Values longer than their stored columns are cut to fit.
 *
 * @param ipAddress client address, may be null
 * @param userAgent client user agent, may be null
 */
public record RequestMetadata(String ipAddress, String userAgent) {

    public static final int IP_ADDRESS_MAX = 64;
    public static final int USER_AGENT_MAX = 512;

    public RequestMetadata {
        ipAddress = truncate(ipAddress, IP_ADDRESS_MAX);
        userAgent = truncate(userAgent, USER_AGENT_MAX);
    }

    public static RequestMetadata empty() {
        return new RequestMetadata(null, null);
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }
}
