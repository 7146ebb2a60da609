package com.example.automation.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * HMAC-SHA256 签名：对实际发送的 body 字节签名，输出 "sha256=&lt;hex&gt;"。
 */
@Component
@Slf4j
public class WebhookSigner {

    public static final String SIGNATURE_PREFIX = "sha256=";

    private static final String HMAC_SHA256 = "HmacSHA256";

    /**
     * 计算签名头的值。
     *
     * @param body   待发送的 body 字节
     * @param secret 密钥
     * @return sha256=十六进制 HMAC
     */
    public String sign(byte[] body, String secret) {
        try {
            return SIGNATURE_PREFIX + bytesToHex(calculateHmac(body, secret));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    /**
     * 校验签名（接收方视角），常量时间比较。
     *
     * @param body      收到的 body 字节
     * @param secret    密钥
     * @param signature 签名头的值，可带 "sha256=" 前缀
     * @return 校验通过返回 true
     */
    public boolean verify(byte[] body, String secret, String signature) {
        if (body == null || secret == null || signature == null) {
            return false;
        }

        String cleanSignature = signature.startsWith(SIGNATURE_PREFIX)
                ? signature.substring(SIGNATURE_PREFIX.length())
                : signature;

        try {
            String expectedHash = bytesToHex(calculateHmac(body, secret));
            return MessageDigest.isEqual(
                    cleanSignature.getBytes(StandardCharsets.UTF_8),
                    expectedHash.getBytes(StandardCharsets.UTF_8));
        } catch (Exception e) {
            log.error("HMAC verification error", e);
            return false;
        }
    }

    private byte[] calculateHmac(byte[] data, String key) throws NoSuchAlgorithmException, InvalidKeyException {
        SecretKeySpec secretKey = new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_SHA256);
        Mac mac = Mac.getInstance(HMAC_SHA256);
        mac.init(secretKey);
        return mac.doFinal(data);
    }

    private String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder();
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1)
                hexString.append('0');
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
