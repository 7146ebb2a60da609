package com.example.automation.utils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Webhook 地址校验。
 * 只接受 HTTPS；开启 SSRF 防护时拒绝解析到内网、回环及黑名单网段的主机。
 */
@Component
@Slf4j
public class UrlValidator {

    private final boolean ssrfEnabled;
    private final List<String> blockedIps;

    public UrlValidator(
            @Value("${app.security.ssrf.enabled:true}") boolean ssrfEnabled,
            @Value("${app.security.ssrf.blocked-ips:127.0.0.1,localhost,10.0.0.0/8,172.16.0.0/12,192.168.0.0/16,169.254.169.254}") String blockedIpsConfig) {
        this.ssrfEnabled = ssrfEnabled;
        this.blockedIps = Arrays.stream(blockedIpsConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * 校验 webhook 地址。
     *
     * @param url 目标地址
     * @return 规范化后的 URI
     * @throws IllegalArgumentException 地址不合法或不安全
     */
    public URI validate(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be empty");
        }

        URI uri;
        try {
            uri = URI.create(url.trim()).normalize();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed URL: " + url);
        }

        String scheme = uri.getScheme();
        if (scheme == null || !scheme.equalsIgnoreCase("https")) {
            throw new IllegalArgumentException("Webhook URL must use HTTPS");
        }

        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("Host cannot be empty");
        }

        if (!ssrfEnabled) {
            return uri;
        }

        if (host.equals("0.0.0.0") || host.equals("::") || host.equals("[::]")) {
            throw new IllegalArgumentException("Blocked wildcard address: " + host);
        }

        if (blockedIps.contains(host.toLowerCase())) {
            throw new IllegalArgumentException("Blocked host: " + host);
        }

        InetAddress[] addresses;
        try {
            addresses = InetAddress.getAllByName(host);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Could not resolve host: " + host);
        }

        // 任一解析结果命中黑名单即拒绝整个域名（避免 DNS 轮询绕过）
        for (InetAddress addr : addresses) {
            if (isBlockedAddress(addr)) {
                log.warn("[SSRF] Found blocked IP: {} for host: {}", addr.getHostAddress(), host);
                throw new IllegalArgumentException("Blocked IP detected: " + addr.getHostAddress());
            }
        }
        return uri;
    }

    /**
     * 快速判断 URL 是否可用作 webhook 地址。
     *
     * @param url 目标 URL
     * @return true 表示可用
     */
    public boolean isSafeUrl(String url) {
        try {
            validate(url);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private boolean isBlockedAddress(InetAddress addr) {
        if (addr.isLoopbackAddress() || addr.isSiteLocalAddress() || addr.isLinkLocalAddress()
                || addr.isMulticastAddress() || addr.isAnyLocalAddress()) {
            return true;
        }

        byte[] bytes = addr.getAddress();

        // IPv6 ULA：fc00::/7
        if (bytes.length == 16 && (bytes[0] & 0xFE) == (byte) 0xFC) {
            return true;
        }

        String ip = addr.getHostAddress();
        for (String blocked : blockedIps) {
            if (blocked.contains("/")) {
                if (isInSubnet(addr, blocked))
                    return true;
            } else if (ip.equals(blocked)) {
                return true;
            }
        }
        return false;
    }

    private boolean isInSubnet(InetAddress ipAddr, String cidr) {
        try {
            String[] parts = cidr.split("/");
            int bits = Integer.parseInt(parts[1]);
            byte[] ipBytes = ipAddr.getAddress();
            byte[] subnetBytes = InetAddress.getByName(parts[0]).getAddress();
            if (ipBytes.length != subnetBytes.length) {
                return false;
            }

            int fullBytes = bits / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (ipBytes[i] != subnetBytes[i])
                    return false;
            }

            int remainingBits = bits % 8;
            if (remainingBits > 0) {
                int mask = (0xFF << (8 - remainingBits)) & 0xFF;
                return (ipBytes[fullBytes] & mask) == (subnetBytes[fullBytes] & mask);
            }
            return true;
        } catch (UnknownHostException | RuntimeException e) {
            log.warn("[SSRF] Ignoring malformed CIDR entry: {}", cidr);
            return false;
        }
    }
}
