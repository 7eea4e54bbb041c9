package org.dxworks.coqu.model.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntryCategory {
    DIVISION("division"),
    SECTION("section"),
    PARAGRAPH("paragraph"),
    COPYBOOK("copybook"),
    DATA_ITEM("data_item"),
    ID_ENTRY("id_entry"),
    FILE_ENTRY("file_entry"),
    FILE_CLAUSE("file_clause");

    private final String tag;

    EntryCategory(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static EntryCategory fromTag(String tag) {
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (EntryCategory category : values()) {
            if (category.tag.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown entry category: " + tag);
    }
}
