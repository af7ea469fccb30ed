package com.gitcli.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.gitcli.model.NumstatEntry;
import com.gitcli.model.NumstatResult;

/**
 * Parses {@code git diff --numstat --shortstat [--dirstat]} output.
 *
 * <p>Renames are printed either as {@code old => new} or with the common part factored out as
 * {@code dir/{old => new}/file}; both are resolved to full source and destination paths.
 */
public class NumstatParser implements OutputParser<NumstatResult> {
    private static final Pattern COUNT_PATTERN = Pattern.compile("\\d+|-");
    private static final Pattern BRACE_RENAME_PATTERN = Pattern.compile("^(.*)\\{(.*) => (.*)\\}(.*)$");
    private static final Pattern RENAME_PATTERN = Pattern.compile("^(.+) => (.+)$");

    private final boolean includeDirstat;

    public NumstatParser() {
        this(false);
    }

    public NumstatParser(boolean includeDirstat) {
        this.includeDirstat = includeDirstat;
    }

    @Override
    public NumstatResult parse(String output) {
        StatSections sections = StatSections.split(OutputLine.split(output), includeDirstat, output);
        List<NumstatEntry> entries = new ArrayList<>();
        for (OutputLine line : sections.numstat()) {
            entries.add(parseLine(line, output));
        }
        return NumstatResult.of(
                entries,
                sections.shortstat() == null ? null : ShortstatParser.parse(sections.shortstatText()),
                includeDirstat ? DirstatParser.parseLines(sections.dirstat(), output) : null);
    }

    /**
     * Indexes numstat lines by destination path so they can be joined with another listing of the
     * same diff regardless of line order.
     */
    static Map<String, NumstatEntry> index(List<OutputLine> lines, String output) {
        Map<String, NumstatEntry> byPath = new LinkedHashMap<>();
        for (OutputLine line : lines) {
            NumstatEntry entry = parseLine(line, output);
            byPath.put(entry.path(), entry);
        }
        return byPath;
    }

    static NumstatEntry parseLine(OutputLine line, String output) {
        String[] fields = line.text().split("\t", 3);
        if (fields.length != 3
                || !COUNT_PATTERN.matcher(fields[0]).matches()
                || !COUNT_PATTERN.matcher(fields[1]).matches()) {
            throw line.unexpected("Malformed numstat line", output);
        }
        boolean binary = "-".equals(fields[0]) && "-".equals(fields[1]);
        String[] paths = splitRename(fields[2]);
        return new NumstatEntry(
                EscapedPath.unescapeIfQuoted(paths[0]),
                paths[1] == null ? null : EscapedPath.unescapeIfQuoted(paths[1]),
                countValue(fields[0]),
                countValue(fields[1]),
                binary);
    }

    /** Returns {@code [destination, source]}; source is {@code null} when the name is not a rename. */
    static String[] splitRename(String name) {
        Matcher brace = BRACE_RENAME_PATTERN.matcher(name);
        if (brace.matches()) {
            String prefix = brace.group(1);
            String suffix = brace.group(4);
            return new String[] { joinRenamePart(prefix, brace.group(3), suffix), joinRenamePart(prefix, brace.group(2), suffix) };
        }
        Matcher plain = RENAME_PATTERN.matcher(name);
        if (plain.matches()) {
            return new String[] { plain.group(2), plain.group(1) };
        }
        return new String[] { name, null };
    }

    // "lib/{ => sub}/a.rb" has an empty side; joining it must not leave "lib//a.rb"
    private static String joinRenamePart(String prefix, String part, String suffix) {
        if (part.isEmpty() && prefix.endsWith("/") && suffix.startsWith("/")) {
            return prefix + suffix.substring(1);
        }
        return prefix + part + suffix;
    }

    private static int countValue(String value) {
        return "-".equals(value) ? 0 : Integer.parseInt(value);
    }
}
