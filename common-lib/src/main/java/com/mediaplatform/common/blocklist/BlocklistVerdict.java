package com.mediaplatform.common.blocklist;

/**
 * @param reason human-readable explanation; null when accepted
 */
public record BlocklistVerdict(boolean accepted, String reason) {

    private static final BlocklistVerdict ACCEPT = new BlocklistVerdict(true, null);

    public static BlocklistVerdict accept() {
        return ACCEPT;
    }

    public static BlocklistVerdict reject(String reason) {
        return new BlocklistVerdict(false, reason);
    }
}
