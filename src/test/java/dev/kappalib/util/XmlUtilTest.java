package dev.kappalib.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class XmlUtilTest {

    @Test
    @DisplayName("Should escape the five XML special characters")
    void shouldEscapeSpecialCharacters() {
        assertThat(XmlUtil.escapeXml("<a href=\"x\">Tom & Jerry's</a>"))
                .isEqualTo("&lt;a href=&quot;x&quot;&gt;Tom &amp; Jerry&apos;s&lt;/a&gt;");
    }

    @Test
    @DisplayName("Should leave Cyrillic and plain ids untouched")
    void shouldLeavePlainText() {
        assertThat(XmlUtil.escapeXml("nvl_1 Мастер")).isEqualTo("nvl_1 Мастер");
    }

    @Test
    @DisplayName("Null should become empty")
    void nullBecomesEmpty() {
        assertThat(XmlUtil.escapeXml(null)).isEmpty();
    }
}
