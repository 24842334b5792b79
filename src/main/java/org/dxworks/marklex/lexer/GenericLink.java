package org.dxworks.marklex.lexer;

import java.util.Optional;

/**
 * Read-only view over the attributes of an image, link, autolink, reference link or
 * reference definition token. Obtained through {@link Token#asLink()}.
 */
public final class GenericLink {

    private final Token token;

    GenericLink(Token token) {
        this.token = token;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(token.detail(Token.NAME));
    }

    public Optional<String> getLocation() {
        return Optional.ofNullable(token.detail(Token.LOCATION));
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(token.detail(Token.TITLE));
    }

    /**
     * @return the reference tag of a reference link or reference definition
     */
    public Optional<String> getPtr() {
        return Optional.ofNullable(token.detail(Token.PTR));
    }
}
