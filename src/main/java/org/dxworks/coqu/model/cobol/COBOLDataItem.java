package org.dxworks.coqu.model.cobol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class COBOLDataItem {
    public String name;
    public int level;
    public int lineStart;
    public int lineEnd;
    public String picture;
    public String usage;
    public String value;
    public Integer occurs;
    public String redefines;
    public List<COBOLDataItem> children = new ArrayList<>();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof COBOLDataItem)) return false;
        COBOLDataItem that = (COBOLDataItem) o;
        return level == that.level
                && lineStart == that.lineStart
                && lineEnd == that.lineEnd
                && Objects.equals(name, that.name)
                && Objects.equals(picture, that.picture)
                && Objects.equals(usage, that.usage)
                && Objects.equals(value, that.value)
                && Objects.equals(occurs, that.occurs)
                && Objects.equals(redefines, that.redefines)
                && Objects.equals(children, that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, level, lineStart, lineEnd, picture, usage, value, occurs, redefines, children);
    }
}
