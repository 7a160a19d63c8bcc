package dev.beacon.search;

/**
 * Temporal label of a passage relative to a reference day.
 *
 * <p>Declaration order is the ordering applied to date-sensitive queries: passages mentioning an
 * upcoming date first, undated passages next, passages whose dates have all passed last.
 */
public enum DateRelevance {
    HAS_FUTURE_DATES("future"),
    NO_DATES("undated"),
    ONLY_PAST_DATES("past");

    private final String value;

    DateRelevance(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
