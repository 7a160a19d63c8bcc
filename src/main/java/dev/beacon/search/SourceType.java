package dev.beacon.search;

/**
 * Where a passage originated: a live website page or a static archival document.
 */
public enum SourceType {
    WEBSITE("website"),
    ARCHIVE("archive");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
