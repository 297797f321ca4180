package org.smileyface.leaguecrawler.util;

import java.net.URI;
import java.util.regex.Pattern;

public class CrawlerUtils {

    private static final Pattern CUP_KEYWORDS = Pattern.compile("cup|copa|trophy|shield|knockout",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_SLASHES = Pattern.compile("/+$");

    private CrawlerUtils() {
        // No instanciation
    }

    /**
     * Returns the last path segment of the URL, ignoring trailing slashes.
     * {@code https://site/football/england/premier-league/} gives {@code premier-league}.
     */
    public static String slug(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = stripTrailingSlashes(url);
        int idx = trimmed.lastIndexOf('/');
        return idx >= 0 ? trimmed.substring(idx + 1) : trimmed;
    }

    /**
     * True when the URL contains one of the cup/knockout keywords. Classification is purely
     * lexical, the site publishes no competition type.
     */
    public static boolean isCup(String url) {
        return url != null && CUP_KEYWORDS.matcher(url).find();
    }

    // league url -> standings page url
    public static String standingsUrl(String leagueUrl) {
        return stripTrailingSlashes(leagueUrl) + "/standings/";
    }

    /**
     * Rewrites the host part of a URL to its mirror site, e.g. flashscore.com to flashscoreusa.com.
     * Returns null when no target host is configured.
     */
    public static String mirrorUrl(String url, String sourceHost, String targetHost) {
        if (url == null || sourceHost == null || sourceHost.isBlank()
                || targetHost == null || targetHost.isBlank()) {
            return null;
        }
        return url.replace(sourceHost, targetHost);
    }

    /**
     * Scheme, host and port of the URL without a trailing slash, or an empty string for
     * relative/unparseable input.
     */
    public static String originOf(String url) {
        if (url == null || url.isBlank()) return "";
        try {
            URI uri = URI.create(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) return "";
            StringBuilder sb = new StringBuilder();
            sb.append(uri.getScheme()).append("://").append(uri.getHost());
            if (uri.getPort() != -1) {
                sb.append(':').append(uri.getPort());
            }
            return sb.toString();
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    private static String stripTrailingSlashes(String url) {
        return TRAILING_SLASHES.matcher(url).replaceAll("");
    }
}
