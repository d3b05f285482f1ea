package com.carcoverscraper.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + 매물 키 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = (u.getPath() == null || u.getPath().isEmpty()) ? "/" : u.getPath();
        path = path.replaceAll("/{2,}", "/");

        try {
            return new URI(scheme, null, host, port, path, u.getQuery(), null);
        } catch (URISyntaxException e) {
            return u;
        }
    }

    /**
     * 매물 식별용 host+path 키. 쿼리/fragment/끝 슬래시 무시.
     * 예: https://www.olx.in/item/abc-iid-1?ref=x → www.olx.in/item/abc-iid-1
     */
    public static String hostPathKey(String url) {
        if (url == null || url.isBlank()) return "";
        try {
            URI u = normalize(URI.create(url.trim()));
            String path = u.getPath() == null ? "" : u.getPath();
            if (path.length() > 1 && path.endsWith("/")) path = path.substring(0, path.length() - 1);
            String host = u.getHost() == null ? "" : u.getHost();
            return host + path;
        } catch (IllegalArgumentException e) {
            return url.trim().toLowerCase(Locale.ROOT);
        }
    }

    /** 상세 매물 URL 모양인지(OLX: /item/...) */
    public static boolean looksLikeListing(URI u) {
        if (u == null || u.getPath() == null) return false;
        String p = u.getPath().toLowerCase(Locale.ROOT);
        return p.contains("/item/") || p.matches(".*-iid-\\d+.*");
    }

    /** 소문자 host, 없으면 "" */
    public static String host(URI u) {
        if (u == null || u.getHost() == null) return "";
        return u.getHost().toLowerCase(Locale.ROOT);
    }
}
