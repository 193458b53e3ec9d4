package com.itguru.service;

import com.itguru.api.dto.SourceResult;
import com.itguru.config.SourceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the numbered "Sources" block shown under an answer.
 *
 * <p>Titles and labels are HTML-escaped; URLs are printed as-is. The URL
 * allow-list only filters when {@code itguru.sources.allowlist.enforce} is on.</p>
 */
@Slf4j
@Component
public class SourcesMarkdown {

    static final String HEADER = "**📚 Sources:**";

    private final SourceProperties.Allowlist allowlist;

    public SourcesMarkdown(SourceProperties props) {
        this.allowlist = props.getAllowlist();
    }

    public String render(List<SourceResult> results) {
        if (results == null || results.isEmpty()) return "";
        List<String> lines = new ArrayList<>();
        lines.add("\n");
        lines.add(HEADER);
        int n = 0;
        for (SourceResult r : results) {
            String url = r.url() == null ? "" : r.url();
            if (!isUrlAllowed(url)) {
                log.debug("[sources] dropping non-allow-listed url {}", url);
                continue;
            }
            String title = escape(StringUtils.hasText(r.title()) ? r.title() : "Untitled");
            String source = escape(r.source());
            String suffix = source.isEmpty() ? "" : " (" + source + ")";
            lines.add(++n + ". [" + title + "](" + url + ")" + suffix + " — " + url);
        }
        return n == 0 ? "" : String.join("\n", lines);
    }

    public boolean isUrlAllowed(String url) {
        if (!allowlist.isEnforce()) return true;
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (host == null) return false;
        String h = host.toLowerCase(Locale.ROOT);
        for (String allowed : allowlist.getDomains()) {
            String a = allowed.toLowerCase(Locale.ROOT);
            if (h.equals(a) || h.endsWith("." + a)) return true;
        }
        return false;
    }

    public static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text);
    }
}
