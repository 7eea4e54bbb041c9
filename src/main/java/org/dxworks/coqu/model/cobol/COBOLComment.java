package org.dxworks.coqu.model.cobol;

import java.util.Objects;

public class COBOLComment {
    public String text;
    public int line;
    public boolean inline;

    public COBOLComment() {
    }

    public COBOLComment(String text, int line, boolean inline) {
        this.text = text;
        this.line = line;
        this.inline = inline;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof COBOLComment)) return false;
        COBOLComment that = (COBOLComment) o;
        return line == that.line && inline == that.inline && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, line, inline);
    }
}
