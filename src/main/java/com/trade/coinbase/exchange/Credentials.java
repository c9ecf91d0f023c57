package com.trade.coinbase.exchange;

/**
 * API credentials handed to the request signer.
 */
public final class Credentials {

    private final String apiKey;
    private final String secret;
    private final String passphrase;
    private final String uid;
    private final String authToken;
    private final String authTokenPrefix;   // e.g. "Bearer ", null for key/secret signing

    public Credentials(String apiKey, String secret, String passphrase, String uid, String authToken) {
        this(apiKey, secret, passphrase, uid, authToken, null);
    }

    public Credentials(String apiKey, String secret, String passphrase, String uid,
                       String authToken, String authTokenPrefix) {
        this.apiKey = apiKey;
        this.secret = secret;
        this.passphrase = passphrase;
        this.uid = uid;
        this.authToken = authToken;
        this.authTokenPrefix = authTokenPrefix;
    }

    public static Credentials none() {
        return new Credentials(null, null, null, null, null);
    }

    public String getApiKey() { return apiKey; }
    public String getSecret() { return secret; }
    public String getPassphrase() { return passphrase; }
    public String getUid() { return uid; }
    public String getAuthToken() { return authToken; }
    public String getAuthTokenPrefix() { return authTokenPrefix; }

    public boolean usesAuthToken() {
        return authToken != null && !authToken.isEmpty();
    }

    public boolean hasKeyPair() {
        return apiKey != null && !apiKey.isEmpty() && secret != null && !secret.isEmpty();
    }

    @Override
    public String toString() {
        // never print secrets
        return "Credentials{apiKey=" + (apiKey == null ? null : "***") + ", authToken="
                + (usesAuthToken() ? "***" : null) + "}";
    }
}
