package io.modelgate.core.media;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classification and safety checks for media references attached to user messages.
 */
public final class MediaReferences {
    public static final int MAX_MEDIA_COUNT = 10;

    private static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".gif", ".webp", ".bmp", ".svg");
    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https", "data");
    private static final Set<String> BLOCKED_HOSTS = Set.of(
        "localhost",
        "127.0.0.1",
        "0.0.0.0",
        "169.254.169.254",
        "metadata.google.internal",
        "metadata.azure.com"
    );
    private static final List<Pattern> PRIVATE_IPV4 = List.of(
        Pattern.compile("^10\\."),
        Pattern.compile("^172\\.(1[6-9]|2[0-9]|3[0-1])\\."),
        Pattern.compile("^192\\.168\\."),
        Pattern.compile("^192\\.0\\.0\\."),
        Pattern.compile("^100\\.(6[4-9]|[7-9][0-9]|1[01][0-9]|12[0-7])\\.")
    );

    private MediaReferences() {
    }

    /**
     * True if any reference looks like an image, by extension, MIME token or data URI prefix.
     */
    public static boolean hasImage(List<String> media) {
        if (media == null || media.isEmpty()) {
            return false;
        }
        for (String reference : media) {
            if (reference == null) {
                continue;
            }
            String lower = reference.toLowerCase(Locale.ROOT);
            if (IMAGE_EXTENSIONS.stream().anyMatch(lower::endsWith)
                || lower.contains("image/")
                || lower.startsWith("data:image")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Strict check used when encoding content parts: data URIs, or http(s) URLs whose path ends
     * in an image extension.
     */
    public static boolean isImageUrl(String reference) {
        if (reference == null) {
            return false;
        }
        String lower = reference.toLowerCase(Locale.ROOT);
        if (lower.startsWith("data:image/")) {
            return true;
        }
        try {
            URI uri = new URI(reference);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ("http".equals(scheme) || "https".equals(scheme)) {
                String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
                return IMAGE_EXTENSIONS.stream().anyMatch(path::endsWith);
            }
            return false;
        } catch (URISyntaxException e) {
            return IMAGE_EXTENSIONS.stream().anyMatch(lower::endsWith);
        }
    }

    /**
     * Rejects references that would make the model provider fetch from loopback, cloud metadata
     * endpoints or private address ranges.
     */
    public static boolean isSafeImageUrl(String reference) {
        if (reference == null) {
            return false;
        }
        if (reference.toLowerCase(Locale.ROOT).startsWith("data:image/")) {
            return true;
        }
        try {
            URI uri = new URI(reference);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!ALLOWED_SCHEMES.contains(scheme) || "data".equals(scheme)) {
                return false;
            }
            String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            if (host.isEmpty()) {
                return false;
            }
            for (String blocked : BLOCKED_HOSTS) {
                if (host.equals(blocked) || host.endsWith("." + blocked)) {
                    return false;
                }
            }
            return PRIVATE_IPV4.stream().noneMatch(pattern -> pattern.matcher(host).find());
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
