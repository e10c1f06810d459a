package com.yoursp.relay.modules.vault;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Vault IDs are random (version 4) UUIDs in canonical 8-4-4-4-12 form.
 */
public final class VaultIds {

    private static final Pattern CANONICAL = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private VaultIds() {
        // utility class
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValid(String vaultId) {
        return vaultId != null && CANONICAL.matcher(vaultId).matches();
    }

    /** Lower-cases a valid ID so lookups match what ingest wrote. */
    public static String normalize(String vaultId) {
        return vaultId.toLowerCase(Locale.ROOT);
    }
}
