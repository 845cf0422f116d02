package io.seriesfetch.analytics;

/** Supplies the bearer token sent with each upstream call. */
@FunctionalInterface
public interface CredentialProvider {
    /** @throws AuthException when no usable credential is available */
    String accessToken();
}
