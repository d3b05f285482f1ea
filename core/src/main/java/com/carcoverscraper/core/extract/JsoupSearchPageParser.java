package com.carcoverscraper.core.extract;

import com.carcoverscraper.core.model.ListingSummary;
import com.carcoverscraper.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OLX 검색 결과 파서.
 * - 카드: li[data-aut-id=itemBox] (없으면 /item/ 링크로 대체)
 * - 다음 페이지: pageNext / rel=next, 없으면 카드가 있을 때 ?page=n+1
 * 같은 상세 URL은 한 번만(첫 카드 기준).
 */
public class JsoupSearchPageParser implements SearchPageParser {

    static final String CARD = "li[data-aut-id=itemBox], div[data-aut-id=itemBox]";
    static final String TITLE = "[data-aut-id=itemTitle]";
    static final String PRICE = "[data-aut-id=itemPrice]";
    static final String LOCATION = "[data-aut-id=item-location]";
    static final String AD_LINK = "a[data-aut-id=itemAd]";
    static final String NEXT = "a[data-aut-id=pageNext], a[rel=next], link[rel=next]";

    @Override
    public SearchPage parse(String html, URI pageUrl, int pageNo) {
        if (html == null || html.isBlank() || pageUrl == null) return SearchPage.empty();
        Document doc = Jsoup.parse(html, pageUrl.toString());

        Map<String, ListingSummary> byKey = new LinkedHashMap<>();
        Elements cards = doc.select(CARD);
        if (!cards.isEmpty()) {
            for (Element card : cards) {
                Element a = card.selectFirst(AD_LINK);
                if (a == null) a = card.selectFirst("a[href]");
                URI detail = (a == null) ? null : absHttp(a.attr("abs:href"));
                if (detail == null) continue;
                byKey.putIfAbsent(UrlUtils.hostPathKey(detail.toString()), new ListingSummary(detail,
                        text(card.selectFirst(TITLE)),
                        text(card.selectFirst(PRICE)),
                        text(card.selectFirst(LOCATION))));
            }
        } else {
            // 마크업이 바뀐 경우: 상세 링크 모양만 보고 수집
            for (Element a : doc.select("a[href]")) {
                URI detail = absHttp(a.attr("abs:href"));
                if (detail == null || !UrlUtils.looksLikeListing(detail)) continue;
                byKey.putIfAbsent(UrlUtils.hostPathKey(detail.toString()),
                        new ListingSummary(detail, a.text(), null, null));
            }
        }

        List<ListingSummary> listings = new ArrayList<>(byKey.values());
        URI next = null;
        Element n = doc.selectFirst(NEXT);
        if (n != null) next = absHttp(n.attr("abs:href"));
        if (next == null && !listings.isEmpty()) next = withPage(pageUrl, pageNo + 1);
        return new SearchPage(listings, next);
    }

    /** query의 page 파라미터를 교체(없으면 추가) */
    static URI withPage(URI u, int page) {
        String q = u.getRawQuery();
        StringBuilder sb = new StringBuilder();
        if (q != null && !q.isEmpty()) {
            for (String part : q.split("&")) {
                if (part.isEmpty() || part.startsWith("page=") || part.equals("page")) continue;
                if (sb.length() > 0) sb.append('&');
                sb.append(part);
            }
        }
        if (sb.length() > 0) sb.append('&');
        sb.append("page=").append(page);
        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        try {
            return URI.create(u.getScheme() + "://" + u.getRawAuthority() + path + "?" + sb);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static URI absHttp(String abs) {
        if (abs == null || abs.isBlank()) return null;
        try {
            URI u = URI.create(abs.trim());
            String s = u.getScheme();
            if (s == null) return null;
            if (!s.equalsIgnoreCase("http") && !s.equalsIgnoreCase("https")) return null;
            return u;
        } catch (IllegalArgumentException ignore) {
            // 잘못된 URL은 무시
            return null;
        }
    }

    private static String text(Element e) {
        return e == null ? null : e.text();
    }
}
