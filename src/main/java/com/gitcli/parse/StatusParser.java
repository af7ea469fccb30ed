package com.gitcli.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.gitcli.model.StatusEntry;
import com.gitcli.model.StatusReport;

/**
 * Parses {@code git status --porcelain=v2} output (without {@code -z}).
 *
 * <p>Entry lines have a fixed number of space separated fields followed by the path, which may
 * itself contain spaces and is therefore taken verbatim from the remainder of the line:
 * <pre>
 * 1 XY sub mH mI mW hH hI path
 * 2 XY sub mH mI mW hH hI Xscore path&lt;TAB&gt;origPath
 * u XY sub m1 m2 m3 mW h1 h2 h3 path
 * ? path
 * ! path
 * </pre>
 * Header lines ({@code # branch.oid ...}) are skipped.
 */
public class StatusParser implements OutputParser<StatusReport> {
    private static final String ZERO_MODE = "000000";
    static final String STAGE_NORMAL = "0";

    @Override
    public StatusReport parse(String output) {
        Map<String, StatusEntry> entries = new LinkedHashMap<>();
        List<String> ignored = new ArrayList<>();
        for (OutputLine line : OutputLine.split(output)) {
            String text = line.text();
            if (text.startsWith("# ")) {
                continue;
            }
            if (text.length() < 3 || text.charAt(1) != ' ') {
                throw line.unexpected("Malformed status line", output);
            }
            StatusEntry entry;
            switch (text.charAt(0)) {
                case '1' -> entry = parseOrdinary(line, output);
                case '2' -> entry = parseRenamed(line, output);
                case 'u' -> entry = parseUnmerged(line, output);
                case '?' -> entry = StatusEntry.untracked(EscapedPath.unescapeIfQuoted(text.substring(2)));
                case '!' -> {
                    ignored.add(EscapedPath.unescapeIfQuoted(text.substring(2)));
                    continue;
                }
                default -> throw line.unexpected("Unknown status entry type", output);
            }
            entries.put(entry.path(), entry);
        }
        return new StatusReport(entries, ignored);
    }

    private static StatusEntry parseOrdinary(OutputLine line, String output) {
        String[] fields = fields(line, 9, output);
        return new StatusEntry(
                EscapedPath.unescapeIfQuoted(fields[8]),
                changeType(fields[1], line, output),
                STAGE_NORMAL,
                false,
                fields[4],
                fields[7],
                fields[3],
                fields[6],
                null);
    }

    private static StatusEntry parseRenamed(OutputLine line, String output) {
        String[] fields = fields(line, 10, output);
        String[] paths = fields[9].split("\t", -1);
        if (paths.length != 2) {
            throw line.unexpected("Rename entry without original path", output);
        }
        return new StatusEntry(
                EscapedPath.unescapeIfQuoted(paths[0]),
                changeType(fields[1], line, output),
                STAGE_NORMAL,
                false,
                fields[4],
                fields[7],
                fields[3],
                fields[6],
                EscapedPath.unescapeIfQuoted(paths[1]));
    }

    /*
     * The index holds up to three stages for a conflicted path. The highest stage present is
     * reported as the index side and stage 2 ("ours", the HEAD content) as the repo side.
     */
    private static StatusEntry parseUnmerged(OutputLine line, String output) {
        String[] fields = fields(line, 11, output);
        int stage = 3;
        while (stage > 1 && ZERO_MODE.equals(fields[2 + stage])) {
            stage--;
        }
        return new StatusEntry(
                EscapedPath.unescapeIfQuoted(fields[10]),
                "U",
                String.valueOf(stage),
                false,
                fields[2 + stage],
                fields[6 + stage],
                fields[4],
                fields[8],
                null);
    }

    private static String[] fields(OutputLine line, int count, String output) {
        String[] fields = line.text().split(" ", count);
        if (fields.length != count || fields[count - 1].isEmpty()) {
            throw line.unexpected("Expected " + count + " fields", output);
        }
        return fields;
    }

    // index-side change wins over the worktree-side change
    private static String changeType(String xy, OutputLine line, String output) {
        if (xy.length() != 2) {
            throw line.unexpected("Malformed XY status '" + xy + "'", output);
        }
        char index = xy.charAt(0);
        char worktree = xy.charAt(1);
        if (index != '.') {
            return String.valueOf(index);
        }
        if (worktree != '.') {
            return String.valueOf(worktree);
        }
        return null;
    }
}
