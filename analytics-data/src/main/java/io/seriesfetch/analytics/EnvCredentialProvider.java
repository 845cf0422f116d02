package io.seriesfetch.analytics;

/**
 * Token taken from configuration ({@code seriesfetch.accessToken} / {@code GA4_ACCESS_TOKEN}).
 * A missing token is reported on first use, not at construction.
 */
public final class EnvCredentialProvider implements CredentialProvider {
    private final String token;

    public EnvCredentialProvider(String token) {
        this.token = token;
    }

    @Override
    public String accessToken() {
        if (token == null || token.isBlank()) {
            throw new AuthException("no access token configured (set seriesfetch.accessToken or GA4_ACCESS_TOKEN)");
        }
        return token;
    }
}
