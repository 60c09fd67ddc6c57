package com.example.tracepipeline.utils;

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
 * SSRF 校验工具类
 * 租户配置的 Webhook 地址不允许指向内网、回环、链路本地等受保护地址
 */
@Component
@Slf4j
public class UrlValidator {

    private final boolean enabled;
    private final List<String> blockedIps;

    public UrlValidator(
            @Value("${app.security.ssrf.enabled:true}") boolean enabled,
            @Value("${app.security.ssrf.blocked-ips:127.0.0.1,localhost,10.0.0.0/8,172.16.0.0/12,192.168.0.0/16,169.254.169.254}") String blockedIpsConfig) {
        this.enabled = enabled;
        this.blockedIps = Arrays.stream(blockedIpsConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * 校验投递地址。
     *
     * @param url 目标 URL
     * @return 规范化后的 URI
     * @throws IllegalArgumentException 如果 URL 不安全
     */
    public URI validate(String url) {
        URI uri;
        try {
            uri = URI.create(url).normalize();
        } catch (IllegalArgumentException e) {
            log.warn("[SSRF] Malformed URL {}: {}", url, e.getMessage());
            throw new IllegalArgumentException("Malformed URL: " + url, e);
        }

        String scheme = uri.getScheme();
        if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
            throw blocked(url, "Blocked protocol: " + scheme);
        }

        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw blocked(url, "Host cannot be empty");
        }

        if (!enabled) {
            return uri;
        }

        // 显式拦截通配/零地址
        if (host.equals("0.0.0.0") || host.equals("::") || host.equals("[::]")) {
            throw blocked(url, "Blocked wildcard address: " + host);
        }

        if (blockedIps.contains(host.toLowerCase())) {
            throw blocked(url, "Blocked host: " + host);
        }

        // 只要有一个解析结果命中黑名单，就拒绝整个域名（避免 DNS 轮询绕过）
        InetAddress[] addresses;
        try {
            addresses = InetAddress.getAllByName(host);
        } catch (UnknownHostException e) {
            throw blocked(url, "Could not resolve host: " + host);
        }
        for (InetAddress addr : addresses) {
            if (isBlockedAddress(addr)) {
                throw blocked(url, "Blocked IP detected: " + addr.getHostAddress());
            }
        }
        return uri;
    }

    /**
     * 快速判断 URL 是否安全。
     *
     * @param url 目标 URL
     * @return true 表示安全
     */
    public boolean isSafeUrl(String url) {
        try {
            validate(url);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private IllegalArgumentException blocked(String url, String reason) {
        log.warn("[SSRF] Validation failed for {}: {}", url, reason);
        return new IllegalArgumentException(reason);
    }

    /**
     * 判断 IP 是否属于受限范围。
     *
     * @param addr IP 地址
     * @return true 表示受限，false 表示允许
     */
    private boolean isBlockedAddress(InetAddress addr) {
        if (addr.isLoopbackAddress() || addr.isSiteLocalAddress() || addr.isLinkLocalAddress()
                || addr.isMulticastAddress() || addr.isAnyLocalAddress()) {
            return true;
        }

        byte[] bytes = addr.getAddress();

        // IPv6 ULA（唯一本地地址）：fc00::/7
        if (bytes.length == 16 && (bytes[0] & 0xFE) == (byte) 0xFC) {
            return true;
        }

        String ip = addr.getHostAddress();
        for (String blocked : blockedIps) {
            if (blocked.contains("/")) {
                if (isInSubnet(addr, blocked)) {
                    return true;
                }
            } else if (ip.equals(blocked)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 判断 IP 是否落入指定 CIDR。地址族不同视为不命中。
     */
    private boolean isInSubnet(InetAddress addr, String cidr) {
        String[] parts = cidr.split("/");
        InetAddress subnetAddr;
        try {
            subnetAddr = InetAddress.getByName(parts[0]);
        } catch (UnknownHostException e) {
            log.warn("[SSRF] Ignoring invalid CIDR entry {}", cidr);
            return false;
        }
        int bits = Integer.parseInt(parts[1]);

        byte[] ipBytes = addr.getAddress();
        byte[] subnetBytes = subnetAddr.getAddress();
        if (ipBytes.length != subnetBytes.length) {
            return false;
        }

        int fullBytes = bits / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (ipBytes[i] != subnetBytes[i]) {
                return false;
            }
        }

        int remainingBits = bits % 8;
        if (remainingBits > 0) {
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (ipBytes[fullBytes] & mask) == (subnetBytes[fullBytes] & mask);
        }
        return true;
    }
}
