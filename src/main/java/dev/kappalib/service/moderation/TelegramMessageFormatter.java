package dev.kappalib.service.moderation;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Builds moderation messages in Telegram's HTML parse mode from sanitized comment HTML.
 * Telegram accepts only a handful of tags, so block elements become plain line breaks.
 */
@Component
public class TelegramMessageFormatter {

    static final int MAX_MESSAGE_LENGTH = 4000;
    static final int MAX_CALLBACK_ID_LENGTH = 50;

    static final String EMPTY_BODY = "[без текста]";
    static final String DEFAULT_IMAGE_ALT = "изображение";
    static final String APPROVE_BUTTON = "✅ Подтвердить";
    static final String REJECT_BUTTON = "❌ Отклонить";

    private static final String HEADER_TEMPLATE =
            "💬 <b>Новый комментарий</b>\n\n" +
            "👤 Автор: %s\n" +
            "📖 Глава: <code>%s</code>\n\n" +
            "📝 Текст:\n%s";

    /**
     * Complete moderation message for a new comment, truncated to {@value #MAX_MESSAGE_LENGTH}
     * characters plus an ellipsis.
     */
    public String formatNewComment(String authorName, String chapterId, String contentHtml) {
        String text = String.format(HEADER_TEMPLATE,
                escape(authorName),
                escape(chapterId),
                toTelegramHtml(contentHtml));
        return truncate(text);
    }

    /**
     * Inline keyboard with approve and reject buttons. The callback payload is
     * {@code action:commentId}, the id cut to {@value #MAX_CALLBACK_ID_LENGTH} characters.
     */
    public Map<String, Object> moderationKeyboard(String commentId) {
        String callbackId = commentId.length() > MAX_CALLBACK_ID_LENGTH
                ? commentId.substring(0, MAX_CALLBACK_ID_LENGTH)
                : commentId;
        return Map.of("inline_keyboard", List.of(List.of(
                Map.of("text", APPROVE_BUTTON, "callback_data", ModerationAction.APPROVE.callbackData(callbackId)),
                Map.of("text", REJECT_BUTTON, "callback_data", ModerationAction.REJECT.callbackData(callbackId))
        )));
    }

    /**
     * Converts comment HTML to the tag subset Telegram renders.
     * <ul>
     *   <li>h1..h6 become bold followed by a line break</li>
     *   <li>paragraphs end with a blank line, br becomes a line break</li>
     *   <li>list items become "• " lines</li>
     *   <li>strong/em become b/i</li>
     *   <li>images become a link labelled "[🖼 alt]"</li>
     * </ul>
     */
    public String toTelegramHtml(String html) {
        if (html == null || html.isBlank()) {
            return EMPTY_BODY;
        }
        StringBuilder out = new StringBuilder();
        for (Node node : Jsoup.parseBodyFragment(html).body().childNodes()) {
            render(node, out);
        }
        String result = out.toString().trim();
        return result.isEmpty() ? EMPTY_BODY : result;
    }

    private void render(Node node, StringBuilder out) {
        if (node instanceof TextNode) {
            out.append(escape(((TextNode) node).getWholeText()));
            return;
        }
        if (!(node instanceof Element)) {
            return;
        }
        Element element = (Element) node;
        switch (element.normalName()) {
            case "h1", "h2", "h3", "h4", "h5", "h6" -> {
                out.append("<b>");
                renderChildren(element, out);
                out.append("</b>\n");
            }
            case "p" -> {
                renderChildren(element, out);
                out.append("\n\n");
            }
            case "br" -> out.append("\n");
            case "ul", "ol" -> {
                renderChildren(element, out);
                out.append("\n");
            }
            case "li" -> {
                out.append("• ");
                renderChildren(element, out);
                out.append("\n");
            }
            case "strong", "b" -> wrap("b", element, out);
            case "em", "i" -> wrap("i", element, out);
            case "code", "pre", "blockquote" -> wrap(element.normalName(), element, out);
            case "a" -> {
                String href = element.attr("href");
                if (href.isEmpty()) {
                    renderChildren(element, out);
                } else {
                    out.append("<a href=\"").append(escapeAttribute(href)).append("\">");
                    renderChildren(element, out);
                    out.append("</a>");
                }
            }
            case "img" -> renderImage(element, out);
            default -> renderChildren(element, out);
        }
    }

    private void renderImage(Element img, StringBuilder out) {
        String alt = img.attr("alt");
        String label = "[🖼 " + escape(alt.isBlank() ? DEFAULT_IMAGE_ALT : alt) + "]";
        String src = img.attr("src");
        if (src.isEmpty()) {
            out.append(label);
        } else {
            out.append("<a href=\"").append(escapeAttribute(src)).append("\">").append(label).append("</a>");
        }
    }

    private void wrap(String tag, Element element, StringBuilder out) {
        out.append('<').append(tag).append('>');
        renderChildren(element, out);
        out.append("</").append(tag).append('>');
    }

    private void renderChildren(Element element, StringBuilder out) {
        for (Node child : element.childNodes()) {
            render(child, out);
        }
    }

    static String truncate(String text) {
        if (text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        int end = MAX_MESSAGE_LENGTH;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + "...";
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private static String escapeAttribute(String value) {
        return escape(value).replace("\"", "&quot;");
    }
}
