package org.dxworks.coqu.workspace;

import java.util.Objects;

/**
 * A paragraph of a loaded program that CALLs some other program.
 */
public final class CallSite {

    private final String program;
    private final String paragraph;

    public CallSite(String program, String paragraph) {
        this.program = program;
        this.paragraph = paragraph;
    }

    public String getProgram() {
        return program;
    }

    public String getParagraph() {
        return paragraph;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallSite)) return false;
        CallSite that = (CallSite) o;
        return program.equals(that.program) && paragraph.equals(that.paragraph);
    }

    @Override
    public int hashCode() {
        return Objects.hash(program, paragraph);
    }

    @Override
    public String toString() {
        return program + "." + paragraph;
    }
}
