package org.dxworks.coqu.model.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Grammar-free structural index of one COBOL source.
 * Every list is ordered by start line and unmodifiable.
 */
@JsonPropertyOrder({"totalLines", "divisions", "sections", "paragraphs", "copybooks",
        "level01DataItems", "dataItems", "identificationEntries", "fileEntries",
        "statements", "execStatements"})
public final class StructuralIndex {

    private final int totalLines;
    private final List<IndexEntry> divisions;
    private final List<IndexEntry> sections;
    private final List<IndexEntry> paragraphs;
    private final List<IndexEntry> copybooks;
    private final List<IndexEntry> level01DataItems;
    private final List<IndexEntry> dataItems;
    private final List<IndexEntry> identificationEntries;
    private final List<IndexEntry> fileEntries;
    private final List<StatementEntry> statements;
    private final List<StatementEntry> execStatements;

    @JsonCreator
    public StructuralIndex(@JsonProperty("totalLines") int totalLines,
                           @JsonProperty("divisions") List<IndexEntry> divisions,
                           @JsonProperty("sections") List<IndexEntry> sections,
                           @JsonProperty("paragraphs") List<IndexEntry> paragraphs,
                           @JsonProperty("copybooks") List<IndexEntry> copybooks,
                           @JsonProperty("level01DataItems") List<IndexEntry> level01DataItems,
                           @JsonProperty("dataItems") List<IndexEntry> dataItems,
                           @JsonProperty("identificationEntries") List<IndexEntry> identificationEntries,
                           @JsonProperty("fileEntries") List<IndexEntry> fileEntries,
                           @JsonProperty("statements") List<StatementEntry> statements,
                           @JsonProperty("execStatements") List<StatementEntry> execStatements) {
        this.totalLines = totalLines;
        this.divisions = freeze(divisions);
        this.sections = freeze(sections);
        this.paragraphs = freeze(paragraphs);
        this.copybooks = freeze(copybooks);
        this.level01DataItems = freeze(level01DataItems);
        this.dataItems = freeze(dataItems);
        this.identificationEntries = freeze(identificationEntries);
        this.fileEntries = freeze(fileEntries);
        this.statements = freeze(statements);
        this.execStatements = freeze(execStatements);
    }

    public static StructuralIndex empty(int totalLines) {
        return new StructuralIndex(totalLines, null, null, null, null, null, null, null, null, null, null);
    }

    private static <T> List<T> freeze(List<T> entries) {
        return entries == null ? List.of() : List.copyOf(entries);
    }

    public int getTotalLines() {
        return totalLines;
    }

    public List<IndexEntry> getDivisions() {
        return divisions;
    }

    public List<IndexEntry> getSections() {
        return sections;
    }

    public List<IndexEntry> getParagraphs() {
        return paragraphs;
    }

    public List<IndexEntry> getCopybooks() {
        return copybooks;
    }

    /** Level-01 records only, named without the level number. */
    public List<IndexEntry> getLevel01DataItems() {
        return level01DataItems;
    }

    /** Every numbered or special level, named {@code "<level> <name>"}. */
    public List<IndexEntry> getDataItems() {
        return dataItems;
    }

    public List<IndexEntry> getIdentificationEntries() {
        return identificationEntries;
    }

    public List<IndexEntry> getFileEntries() {
        return fileEntries;
    }

    public List<StatementEntry> getStatements() {
        return statements;
    }

    public List<StatementEntry> getExecStatements() {
        return execStatements;
    }

    public List<String> divisionNames() {
        return names(divisions);
    }

    public List<String> sectionNames() {
        return names(sections);
    }

    public List<String> paragraphNames() {
        return names(paragraphs);
    }

    public List<String> copybookNames() {
        return names(copybooks);
    }

    /**
     * Case-insensitive lookup of the first entry with the given name in a category's list.
     */
    public Optional<IndexEntry> findEntry(String name, EntryCategory category) {
        if (name == null) return Optional.empty();
        String wanted = name.toUpperCase(Locale.ROOT);
        return entriesOf(category).stream()
                .filter(e -> e.getName().toUpperCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    public List<IndexEntry> entriesOf(EntryCategory category) {
        switch (category) {
            case DIVISION:
                return divisions;
            case SECTION:
                return sections;
            case PARAGRAPH:
                return paragraphs;
            case COPYBOOK:
                return copybooks;
            case DATA_ITEM:
                return level01DataItems;
            case ID_ENTRY:
                return identificationEntries;
            case FILE_ENTRY:
            case FILE_CLAUSE:
                return fileEntries.stream()
                        .filter(e -> e.getCategory() == category)
                        .collect(Collectors.toUnmodifiableList());
            default:
                return List.of();
        }
    }

    private static List<String> names(List<IndexEntry> entries) {
        return entries.stream().map(IndexEntry::getName).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructuralIndex)) return false;
        StructuralIndex that = (StructuralIndex) o;
        return totalLines == that.totalLines
                && divisions.equals(that.divisions)
                && sections.equals(that.sections)
                && paragraphs.equals(that.paragraphs)
                && copybooks.equals(that.copybooks)
                && level01DataItems.equals(that.level01DataItems)
                && dataItems.equals(that.dataItems)
                && identificationEntries.equals(that.identificationEntries)
                && fileEntries.equals(that.fileEntries)
                && statements.equals(that.statements)
                && execStatements.equals(that.execStatements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalLines, divisions, sections, paragraphs, copybooks, level01DataItems,
                dataItems, identificationEntries, fileEntries, statements, execStatements);
    }
}
