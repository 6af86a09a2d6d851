package dev.kappalib.controller;

import dev.kappalib.dto.SitemapItem;
import dev.kappalib.service.NovelService;
import dev.kappalib.util.XmlUtil;
import io.swagger.v3.oas.annotations.Hidden;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Crawler surface of the public site: sitemap.xml and robots.txt.
 */
@Hidden
@RestController
@Slf4j
public class SitemapController {

    private static final DateTimeFormatter SITEMAP_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private static final List<String> LEGAL_PAGES = List.of("/dmca", "/privacy", "/copyright");

    private final NovelService novelService;
    private final String siteUrl;

    public SitemapController(NovelService novelService,
                             @Value("${app.site-url:https://kappalib.ru}") String siteUrl) {
        this.novelService = novelService;
        this.siteUrl = siteUrl.endsWith("/") ? siteUrl.substring(0, siteUrl.length() - 1) : siteUrl;
    }

    @GetMapping(value = "/sitemap.xml", produces = MediaType.APPLICATION_XML_VALUE)
    public Mono<String> getSitemap() {
        log.debug("Generating sitemap");
        return novelService.getSitemapData()
                .map(this::buildSitemap)
                .doOnError(e -> log.error("Sitemap generation failed: {}", e.getMessage()));
    }

    @GetMapping(value = "/robots.txt", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<String> getRobots() {
        return Mono.just("User-agent: Googlebot\n" +
                "Disallow: /*/chapter/*\n" +
                "\n" +
                "User-agent: *\n" +
                "Allow: /\n" +
                "\n" +
                "Sitemap: " + siteUrl + "/sitemap.xml");
    }

    String buildSitemap(List<SitemapItem> items) {
        StringBuilder xml = new StringBuilder();

        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">\n");

        appendUrl(xml, siteUrl + "/", null, "daily", "1.0");
        for (String page : LEGAL_PAGES) {
            appendUrl(xml, siteUrl + page, null, "monthly", "0.3");
        }

        for (SitemapItem item : items) {
            String lastMod = item.createdAt() != null
                    ? item.createdAt().withOffsetSameInstant(ZoneOffset.UTC).format(SITEMAP_DATE_FORMAT)
                    : null;
            appendUrl(xml, siteUrl + "/" + XmlUtil.escapeXml(item.id()), lastMod, "weekly", "0.8");
        }

        xml.append("</urlset>");
        return xml.toString();
    }

    private static void appendUrl(StringBuilder xml, String loc, String lastMod, String changeFreq, String priority) {
        xml.append("  <url>\n");
        xml.append("    <loc>").append(loc).append("</loc>\n");
        if (lastMod != null) {
            xml.append("    <lastmod>").append(lastMod).append("</lastmod>\n");
        }
        xml.append("    <changefreq>").append(changeFreq).append("</changefreq>\n");
        xml.append("    <priority>").append(priority).append("</priority>\n");
        xml.append("  </url>\n");
    }
}
