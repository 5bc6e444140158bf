package com.narrativefeed.backend.content;

import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

/**
 * Provider payloads often carry HTML fragments and entities; extraction wants plain text.
 */
@Component
public class ContentTextSanitizer {

    public String toPlainText(String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        if (trimmed.indexOf('<') < 0 && trimmed.indexOf('&') < 0) {
            return trimmed;
        }
        return Jsoup.parse(trimmed).text().trim();
    }
}
