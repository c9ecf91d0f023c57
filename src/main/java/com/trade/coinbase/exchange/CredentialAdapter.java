package com.trade.coinbase.exchange;

/**
 * Adapts user supplied Coinbase credentials before they reach the signer.
 */
public final class CredentialAdapter {

    public static final String PLACEHOLDER_KEY = "ANY_KEY";
    public static final String PLACEHOLDER_SECRET = "ANY_SECRET";
    public static final String BEARER_PREFIX = "Bearer ";

    private static final String ESCAPED_NEWLINE = "\\n";

    private CredentialAdapter() {}

    /**
     * With an auth token, the key pair is replaced by placeholders and bearer authentication is selected.
     * Otherwise escaped "\n" sequences of a PEM secret pasted from the Coinbase UI become real newlines.
     */
    public static Credentials adapt(Credentials input) {
        if (input.usesAuthToken()) {
            return new Credentials(PLACEHOLDER_KEY, PLACEHOLDER_SECRET, input.getPassphrase(), input.getUid(),
                    input.getAuthToken(), BEARER_PREFIX);
        }
        String secret = input.getSecret();
        if (secret != null && secret.contains(ESCAPED_NEWLINE)) {
            secret = secret.replace(ESCAPED_NEWLINE, "\n");
        }
        return new Credentials(input.getApiKey(), secret, input.getPassphrase(), input.getUid(), null, null);
    }
}
