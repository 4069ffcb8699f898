package com.openforge.toollog.tenant;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the control-plane resource name of a tenant's database.
 *
 * The name is the join key between a tenant and its remote database across
 * process restarts, so it must stay stable: {@code db-} followed by the first
 * 16 hex characters of SHA-256("organizationId-userId").
 *
 * Inside each component a literal {@code -} is written as {@code \-} and a
 * backslash as {@code \\}, so the joined key is unambiguous: ("acme-eu", "bob")
 * and ("acme", "eu-bob") hash different inputs. Components without either
 * character hash the plain "organizationId-userId" join.
 */
public final class TenantResourceNamer {

    public static final String PREFIX = "db-";
    public static final int    HASH_LENGTH = 16;

    private static final char SEPARATOR = '-';
    private static final char ESCAPE    = '\\';

    private TenantResourceNamer() {}

    public static String nameFor(TenantKey key) {
        if (key == null) {
            throw new IllegalArgumentException("Tenant key must not be null");
        }
        String combined = escape(key.organizationId()) + SEPARATOR + escape(key.userId());
        String hex = HexFormat.of().formatHex(sha256(combined.getBytes(StandardCharsets.UTF_8)));
        return PREFIX + hex.substring(0, HASH_LENGTH);
    }

    static String escape(String component) {
        StringBuilder escaped = new StringBuilder(component.length());
        for (int i = 0; i < component.length(); i++) {
            char c = component.charAt(i);
            if (c == SEPARATOR || c == ESCAPE) escaped.append(ESCAPE);
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
