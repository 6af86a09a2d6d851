package dev.kappalib.service;

import lombok.extern.slf4j.Slf4j;
import org.commonmark.Extension;
import org.commonmark.ext.autolink.AutolinkExtension;
import org.commonmark.node.Block;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListBlock;
import org.commonmark.node.Node;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Renders the restricted markdown dialect used for comments: CommonMark with autolinks,
 * no tables and no fenced code blocks. Output is untrusted and must go through
 * {@link HtmlSanitizerService#sanitizeComment(String)}.
 */
@Service
@Slf4j
public class MarkdownService {

    private static final Set<Class<? extends Block>> ENABLED_BLOCK_TYPES = Set.of(
            Heading.class,
            HtmlBlock.class,
            ThematicBreak.class,
            IndentedCodeBlock.class,
            BlockQuote.class,
            ListBlock.class
    );

    private final Parser parser;
    private final HtmlRenderer renderer;

    public MarkdownService() {
        List<Extension> extensions = List.of(AutolinkExtension.create());

        this.parser = Parser.builder()
                .extensions(extensions)
                .enabledBlockTypes(ENABLED_BLOCK_TYPES)
                .build();

        this.renderer = HtmlRenderer.builder()
                .extensions(extensions)
                .softbreak("<br>")
                .build();
    }

    /**
     * Convert comment markdown to (unsanitized) HTML.
     */
    public String renderToHtml(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        Node document = parser.parse(markdown);
        return renderer.render(document);
    }
}
