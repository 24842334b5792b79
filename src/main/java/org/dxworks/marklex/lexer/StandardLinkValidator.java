package org.dxworks.marklex.lexer;

import org.apache.commons.validator.routines.EmailValidator;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Accepts absolute RFC 3986 URIs (any scheme) and addresses that Commons Validator
 * considers well formed.
 */
public class StandardLinkValidator implements LinkValidator {

    private final EmailValidator emailValidator = EmailValidator.getInstance();

    @Override
    public boolean isUrl(String candidate) {
        if (candidate == null || candidate.isEmpty()) return false;
        try {
            return new URI(candidate).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    @Override
    public boolean isEmail(String candidate) {
        return candidate != null && emailValidator.isValid(candidate);
    }
}
