package org.dxworks.coqu.model.cobol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class COBOLStatement {
    public String type;   // "MOVE", "PERFORM", "END-IF", "EXEC-SQL", ...
    public int lineStart;
    public int lineEnd;
    public String target; // nullable, PERFORM/CALL/GO target when known
    public List<String> arguments = new ArrayList<>();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof COBOLStatement)) return false;
        COBOLStatement that = (COBOLStatement) o;
        return lineStart == that.lineStart
                && lineEnd == that.lineEnd
                && Objects.equals(type, that.type)
                && Objects.equals(target, that.target)
                && Objects.equals(arguments, that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lineStart, lineEnd, target, arguments);
    }
}
