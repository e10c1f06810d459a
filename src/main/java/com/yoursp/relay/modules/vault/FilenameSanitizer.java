package com.yoursp.relay.modules.vault;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Reduces an uploaded filename to a safe, flat ASCII name.
 * <ul>
 * <li>accents folded, other non-ASCII dropped</li>
 * <li>path separators and whitespace runs become {@code _}</li>
 * <li>only {@code [A-Za-z0-9_.-]} survive</li>
 * <li>leading/trailing dots and underscores stripped</li>
 * </ul>
 * Returns an empty string when nothing usable is left.
 */
public final class FilenameSanitizer {

    private static final Pattern NON_ASCII = Pattern.compile("[^\\p{ASCII}]");
    private static final Pattern SEPARATORS_AND_SPACE = Pattern.compile("[/\\\\\\s]+");
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_.-]");
    private static final Pattern EDGE_DOTS = Pattern.compile("^[._]+|[._]+$");

    private FilenameSanitizer() {
        // utility class
    }

    public static String sanitize(String filename) {
        if (filename == null) {
            return "";
        }
        String name = Normalizer.normalize(filename, Normalizer.Form.NFKD);
        name = NON_ASCII.matcher(name).replaceAll("");
        name = SEPARATORS_AND_SPACE.matcher(name.trim()).replaceAll("_");
        name = UNSAFE.matcher(name).replaceAll("");
        name = EDGE_DOTS.matcher(name).replaceAll("");
        return name;
    }
}
