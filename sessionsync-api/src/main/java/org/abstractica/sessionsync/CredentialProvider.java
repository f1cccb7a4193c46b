package org.abstractica.sessionsync;

import java.util.Optional;

/**
 * Supplies the bearer token for authenticated channels.
 *
 * <p>Credential storage and refresh live outside this library; connections
 * only ask for the current token when opening a socket.</p>
 */
@FunctionalInterface
public interface CredentialProvider
{
    /**
     * Returns the current access token.
     *
     * @return the token, or empty when signed out
     */
    Optional<String> currentToken();

    /**
     * A provider that never has a token.
     *
     * @return an anonymous provider
     */
    static CredentialProvider anonymous()
    {
        return Optional::empty;
    }
}
