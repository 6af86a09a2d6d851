package dev.kappalib.service;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Allow-list sanitizing of user supplied HTML with JSoup.
 */
@Slf4j
@Service
public class HtmlSanitizerService {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Document.OutputSettings COMPACT_OUTPUT = new Document.OutputSettings().prettyPrint(false);

    /**
     * Elements a rendered comment may keep. Links are forced to
     * {@code rel="nofollow noreferrer"}; link and image URLs must be absolute http(s).
     */
    private static final Safelist COMMENT_SAFELIST = new Safelist()
            .addTags("p", "br", "strong", "b", "em", "i", "code", "pre", "blockquote")
            .addTags("h1", "h2", "h3", "h4", "h5", "h6")
            .addTags("ul", "ol", "li")
            .addTags("a", "img")
            .addAttributes("a", "href")
            .addProtocols("a", "href", "http", "https")
            .addEnforcedAttribute("a", "rel", "nofollow noreferrer")
            .addAttributes("img", "src", "alt", "title")
            .addProtocols("img", "src", "http", "https");

    /**
     * Sanitize rendered comment HTML against the comment allow-list.
     *
     * @param html markdown renderer output
     * @return HTML containing only allowed elements, attributes and URL schemes
     */
    public String sanitizeComment(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        log.debug("Sanitizing comment HTML, length={}", html.length());
        return Jsoup.clean(html, "", COMMENT_SAFELIST, COMPACT_OUTPUT).trim();
    }

    /**
     * Reduce input to plain text: all markup removed (script and style bodies included),
     * entities decoded, whitespace runs collapsed to one space, trimmed.
     */
    public String stripHtml(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        String stripped = Jsoup.clean(input, "", Safelist.none(), COMPACT_OUTPUT);
        stripped = Parser.unescapeEntities(stripped, false);
        stripped = WHITESPACE.matcher(stripped).replaceAll(" ");
        return stripped.trim();
    }
}
