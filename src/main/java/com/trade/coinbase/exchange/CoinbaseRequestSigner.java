package com.trade.coinbase.exchange;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.util.encoders.DecoderException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.interfaces.ECPrivateKey;
import java.util.Date;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds authentication headers for Coinbase REST calls.
 * <p>
 * Three modes, picked from the credentials:
 * <ul>
 *     <li>auth token: {@code Authorization: <prefix><token>}</li>
 *     <li>cloud API key with a PEM EC secret: ES256 JWT bearer token</li>
 *     <li>legacy key / secret: CB-ACCESS-* HMAC headers</li>
 * </ul>
 * Without credentials no header is added.
 */
public class CoinbaseRequestSigner {

    static final String JWT_ISSUER = "cdp";
    static final long JWT_TTL_SECONDS = 120;

    private static final String PEM_MARKER = "-----BEGIN";

    private final Credentials credentials;
    private final SecureRandom random = new SecureRandom();
    private volatile ECDSASigner jwsSigner;

    public CoinbaseRequestSigner(Credentials credentials) {
        this.credentials = credentials == null ? Credentials.none() : credentials;
    }

    /**
     * @param method        HTTP method
     * @param host          API host, e.g. api.coinbase.com
     * @param path          request path without query
     * @param body          JSON body, empty for GET
     * @param epochSeconds  request time
     */
    public Map<String, String> headers(String method, String host, String path, String body, long epochSeconds)
            throws ExchangeException {
        Map<String, String> headers = new LinkedHashMap<>();
        String upperMethod = method.toUpperCase(Locale.ROOT);
        if (credentials.usesAuthToken()) {
            String prefix = credentials.getAuthTokenPrefix() == null ? "" : credentials.getAuthTokenPrefix();
            headers.put("Authorization", prefix + credentials.getAuthToken());
        } else if (credentials.hasKeyPair() && credentials.getSecret().contains(PEM_MARKER)) {
            headers.put("Authorization", "Bearer " + jwt(upperMethod + " " + host + path, epochSeconds));
        } else if (credentials.hasKeyPair()) {
            String timestamp = String.valueOf(epochSeconds);
            headers.put("CB-ACCESS-KEY", credentials.getApiKey());
            headers.put("CB-ACCESS-SIGN", hmac(timestamp + upperMethod + path + (body == null ? "" : body)));
            headers.put("CB-ACCESS-TIMESTAMP", timestamp);
        }
        return headers;
    }

    String jwt(String uri, long epochSeconds) throws ExchangeException {
        byte[] nonce = new byte[16];
        random.nextBytes(nonce);
        JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.ES256)
                .type(JOSEObjectType.JWT)
                .keyID(credentials.getApiKey())
                .customParam("nonce", HexFormat.of().formatHex(nonce))
                .build();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(credentials.getApiKey())
                .issuer(JWT_ISSUER)
                .notBeforeTime(new Date(epochSeconds * 1000L))
                .expirationTime(new Date((epochSeconds + JWT_TTL_SECONDS) * 1000L))
                .claim("uri", uri)
                .build();
        try {
            SignedJWT token = new SignedJWT(header, claims);
            token.sign(jwsSigner());
            return token.serialize();
        } catch (IOException | JOSEException | DecoderException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.AUTH_FAILED, "Unable to sign coinbase JWT", e);
        }
    }

    private String hmac(String preHash) throws ExchangeException {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(credentials.getSecret().getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(preHash.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.AUTH_FAILED, "Sign failed", e);
        }
    }

    private ECDSASigner jwsSigner() throws IOException, JOSEException {
        ECDSASigner signer = jwsSigner;
        if (signer == null) {
            signer = new ECDSASigner(parsePrivateKey(credentials.getSecret()));
            jwsSigner = signer;
        }
        return signer;
    }

    /**
     * Reads a SEC1 ("EC PRIVATE KEY") or PKCS#8 ("PRIVATE KEY") PEM key.
     */
    static ECPrivateKey parsePrivateKey(String pem) throws IOException {
        Object parsed;
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            parsed = parser.readObject();
        }
        PrivateKeyInfo keyInfo;
        if (parsed instanceof PEMKeyPair) {
            keyInfo = ((PEMKeyPair) parsed).getPrivateKeyInfo();
        } else if (parsed instanceof PrivateKeyInfo) {
            keyInfo = (PrivateKeyInfo) parsed;
        } else {
            throw new PEMException("Unsupported PEM content: " + (parsed == null ? "empty" : parsed.getClass().getSimpleName()));
        }
        PrivateKey key = new JcaPEMKeyConverter().getPrivateKey(keyInfo);
        if (!(key instanceof ECPrivateKey)) {
            throw new PEMException("Not an EC private key: " + key.getAlgorithm());
        }
        return (ECPrivateKey) key;
    }
}
