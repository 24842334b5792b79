package org.dxworks.marklex.lexer;

/**
 * Syntactic checks used to accept the content of an autolink such as
 * {@code <https://example.com>} or {@code <user@example.com>}.
 * Implementations must be stateless; no network lookup is expected.
 */
public interface LinkValidator {

    boolean isUrl(String candidate);

    boolean isEmail(String candidate);

    default boolean isAutolink(String candidate) {
        return isUrl(candidate) || isEmail(candidate);
    }
}
