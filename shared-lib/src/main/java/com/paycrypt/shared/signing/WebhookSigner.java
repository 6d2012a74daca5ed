package com.paycrypt.shared.signing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signing of webhook payloads.
 *
 * Signed string: {@code "{timestamp}.{canonical JSON}"}, where canonical JSON has
 * object keys sorted at every depth and no whitespace between tokens. Receivers
 * rebuild the same string from the X-Paycrypt-Timestamp header and the parsed
 * body, so key order in the body they receive does not matter.
 *
 * Thread-safe; one instance can be shared.
 */
public class WebhookSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    /**
     * @return lowercase hex HMAC-SHA256 signature
     * @throws IllegalArgumentException if the secret is null or empty, or the payload is not JSON-serialisable
     */
    public String sign(String secret, String timestamp, Object payload) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Webhook secret is required for signing");
        }
        String signingString = timestamp + "." + canonicalJson(payload);
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(signingString.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    /**
     * Constant-time check of a provided signature. Returns false for any failure
     * (missing secret, missing signature, unserialisable payload, mismatch) without
     * saying which.
     */
    public boolean verify(String secret, String timestamp, Object payload, String providedSignature) {
        if (secret == null || secret.isEmpty() || providedSignature == null) {
            return false;
        }
        try {
            String expected = sign(secret, timestamp, payload);
            return MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.UTF_8),
                    providedSignature.getBytes(StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * Canonical JSON text of the payload. Accepts maps, beans, {@code JsonNode}s or a
     * JSON string, which is parsed first so that its own key order is discarded.
     */
    public String canonicalJson(Object payload) {
        try {
            Object tree = payload instanceof String json
                    ? canonicalMapper.readValue(json, Object.class)
                    : canonicalMapper.convertValue(payload, Object.class);
            return canonicalMapper.writeValueAsString(tree);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Payload is not valid JSON: " + e.getMessage(), e);
        }
    }
}
