package ai.refgraph.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** How an identifier token is used at one site. Serialized in lower case. */
public enum OccurrenceKind {
    DEFINITION,
    CALL,
    REF,
    ATTR,
    STORE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OccurrenceKind fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
