package org.dxworks.coqu.model.cobol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CopybookStatus {
    RESOLVED,
    UNRESOLVED,
    ERROR;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CopybookStatus fromTag(String tag) {
        return valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }
}
