package dev.kappalib.util;

/**
 * Utility class for XML-related operations.
 */
public final class XmlUtil {

    private XmlUtil() {
    }

    /**
     * Escape special XML characters. Null becomes the empty string.
     */
    public static String escapeXml(String input) {
        if (input == null) {
            return "";
        }
        return input
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }
}
