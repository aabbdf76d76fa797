package dev.station.model;

/**
 * A link shown beside a step in the operator console.
 */
public record Link(
    String url,
    String text // nullable, the url is shown when absent
) {
    public Link {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Link url must not be empty");
        }
    }

    public static Link of(String url) {
        return new Link(url, null);
    }

    public String displayText() {
        return text != null ? text : url;
    }
}
