package org.dxworks.marklex.lexer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A typed span of one Markdown line. The value is an owned copy of the matched text.
 * Link-family tokens carry their attributes in {@code details}; every other token has none.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"value", "kind", "details"})
public final class Token {

    static final String NAME = "name";
    static final String LOCATION = "location";
    static final String TITLE = "title";
    static final String PTR = "ptr";

    private String value;
    private TokenKind kind;
    private Map<String, String> details;

    public Token(String value, TokenKind kind) {
        this.value = Objects.requireNonNull(value, "value");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String getValue() {
        return value;
    }

    public TokenKind getKind() {
        return kind;
    }

    /**
     * @return the stored link attributes, or null when none were stored
     */
    public Map<String, String> getDetails() {
        return details == null ? null : Collections.unmodifiableMap(details);
    }

    /**
     * Views this token as a link-family token.
     *
     * @throws IllegalStateException if the token kind carries no link attributes
     */
    public GenericLink asLink() {
        if (!kind.isLinkFamily()) {
            throw new IllegalStateException("Token is not a generic link: " + kind);
        }
        return new GenericLink(this);
    }

    int length() {
        return value.length();
    }

    void updateKind(TokenKind kind) {
        this.kind = kind;
    }

    String detail(String key) {
        return details == null ? null : details.get(key);
    }

    // Empty values are never stored
    void putDetail(String key, String v) {
        if (v == null || v.isEmpty()) {
            return;
        }
        if (details == null) {
            details = new LinkedHashMap<>();
        }
        details.put(key, v);
    }

    /**
     * Keeps the first {@code at} chars and returns the remainder as a new token of the same kind.
     */
    Token splitOff(int at) {
        Token off = new Token(value.substring(at), kind);
        value = value.substring(0, at);
        return off;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return value.equals(other.value)
                && kind == other.kind
                && Objects.equals(details, other.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, kind, details);
    }

    @Override
    public String toString() {
        return details == null
                ? "<" + value + ", " + kind + ">"
                : "<" + value + ", " + kind + ", " + details + ">";
    }
}
