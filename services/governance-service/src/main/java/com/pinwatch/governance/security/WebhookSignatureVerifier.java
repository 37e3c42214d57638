package com.pinwatch.governance.security;

import com.pinwatch.governance.config.GovernanceProperties;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HMAC-SHA256 verification of {@code X-Hub-Signature-256} headers. Comparison is constant-time;
 * a missing secret rejects everything unless unsigned webhooks are explicitly allowed.
 */
@Component
public class WebhookSignatureVerifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

    static final String PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";
    private static final int DIGEST_HEX_LENGTH = 64;

    private final String secret;
    private final boolean allowUnsigned;

    @Autowired
    public WebhookSignatureVerifier(GovernanceProperties properties) {
        this(properties.getWebhookSecret(), properties.isAllowUnsignedWebhooks());
    }

    public WebhookSignatureVerifier(String secret, boolean allowUnsigned) {
        this.secret = secret;
        this.allowUnsigned = allowUnsigned;
        if (!hasSecret() && allowUnsigned) {
            LOGGER.warn("No webhook secret configured and unsigned webhooks are allowed; signatures are NOT verified");
        } else if (!hasSecret()) {
            LOGGER.warn("No webhook secret configured; every webhook will be rejected");
        }
    }

    public boolean verify(byte[] payload, String signatureHeader) {
        if (!hasSecret()) {
            return allowUnsigned;
        }
        if (payload == null || signatureHeader == null) {
            return false;
        }
        String supplied = signatureHeader.trim();
        if (!supplied.startsWith(PREFIX)) {
            return false;
        }
        String suppliedHex = supplied.substring(PREFIX.length()).toLowerCase(Locale.ROOT);
        if (suppliedHex.length() != DIGEST_HEX_LENGTH || !isHex(suppliedHex)) {
            return false;
        }
        try {
            String expectedHex = sign(payload);
            return MessageDigest.isEqual(
                expectedHex.getBytes(StandardCharsets.US_ASCII),
                suppliedHex.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            LOGGER.error("HMAC computation failed", e);
            return false;
        }
    }

    String sign(byte[] payload) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(ALGORITHM);
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
        return HexFormat.of().formatHex(mac.doFinal(payload));
    }

    private boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }

    private static boolean isHex(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
