package io.github.cyfko.torm.core.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/**
 * Format checks shared by the document validator and available to application code.
 *
 * @since 1.0.0
 */
public final class Validators {

    /** Something, an {@code @}, something, a dot, something; no whitespace anywhere. */
    public static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private Validators() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean isEmail(String value) {
        return value != null && EMAIL.matcher(value).matches();
    }

    /**
     * Checks that a string is an {@code http} or {@code https} URL with a host,
     * e.g. {@code https://example.com/path}. The scheme is matched case-insensitively.
     *
     * @param value the candidate
     * @return {@code true} when the string parses as a web URL
     */
    public static boolean isUrl(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return false;
            }
            String authority = uri.getRawAuthority();
            return authority != null && !authority.isEmpty();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Length of a string in Unicode code points, so a surrogate pair counts once.
     *
     * @param value the string
     * @return the number of code points
     */
    public static int codePointLength(String value) {
        return value.codePointCount(0, value.length());
    }
}
