package dev.kappalib.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlSanitizerServiceTest {

    private HtmlSanitizerService sanitizer;

    @BeforeEach
    void setUp() {
        sanitizer = new HtmlSanitizerService();
    }

    @Nested
    @DisplayName("sanitizeComment")
    class SanitizeComment {

        @Test
        @DisplayName("Should remove script elements")
        void shouldRemoveScripts() {
            String result = sanitizer.sanitizeComment("<p>hi</p><script>alert(1)</script>");

            assertThat(result).isEqualTo("<p>hi</p>");
        }

        @Test
        @DisplayName("Should remove event handler attributes")
        void shouldRemoveEventHandlers() {
            String result = sanitizer.sanitizeComment("<p onclick=\"steal()\">text</p>");

            assertThat(result).isEqualTo("<p>text</p>");
        }

        @Test
        @DisplayName("Should force rel on links and drop javascript URLs")
        void shouldHardenLinks() {
            assertThat(sanitizer.sanitizeComment("<a href=\"https://example.com\">x</a>"))
                    .isEqualTo("<a href=\"https://example.com\" rel=\"nofollow noreferrer\">x</a>");
            assertThat(sanitizer.sanitizeComment("<a href=\"javascript:alert(1)\">x</a>"))
                    .doesNotContain("javascript");
        }

        @Test
        @DisplayName("Should keep http images and drop data URLs")
        void shouldFilterImageSources() {
            assertThat(sanitizer.sanitizeComment("<img src=\"https://example.com/a.png\" alt=\"a\">"))
                    .contains("src=\"https://example.com/a.png\"");
            assertThat(sanitizer.sanitizeComment("<img src=\"data:image/png;base64,AAAA\">"))
                    .doesNotContain("data:");
        }

        @Test
        @DisplayName("Should drop tags outside the allow-list but keep their text")
        void shouldDropUnknownTags() {
            assertThat(sanitizer.sanitizeComment("<table><tr><td>cell</td></tr></table>")).isEqualTo("cell");
        }
    }

    @Nested
    @DisplayName("stripHtml")
    class StripHtml {

        @Test
        @DisplayName("Should return plain text with collapsed whitespace")
        void shouldStripAndCollapse() {
            assertThat(sanitizer.stripHtml("  <b>Тихий</b>\n\t  Лис  ")).isEqualTo("Тихий Лис");
        }

        @Test
        @DisplayName("Should decode entities and drop script bodies")
        void shouldDecodeEntities() {
            assertThat(sanitizer.stripHtml("Tom &amp; Jerry<script>x()</script>")).isEqualTo("Tom & Jerry");
        }

        @Test
        @DisplayName("Null should become empty")
        void nullBecomesEmpty() {
            assertThat(sanitizer.stripHtml(null)).isEmpty();
        }
    }
}
