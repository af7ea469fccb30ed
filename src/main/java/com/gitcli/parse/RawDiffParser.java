package com.gitcli.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.gitcli.model.DiffEntry;
import com.gitcli.model.DiffResult;
import com.gitcli.model.DiffStatus;
import com.gitcli.model.FileRef;
import com.gitcli.model.NumstatEntry;

/**
 * Parses {@code git diff --raw --numstat --shortstat [--dirstat]} output.
 *
 * <p>Raw records look like {@code :100644 100644 abc1234 def5678 M<TAB>path}, or
 * {@code ... R085<TAB>src<TAB>dst} for renames and copies. Line counts and binary detection come
 * from the numstat lines of the same output, joined by destination path.
 */
public class RawDiffParser implements OutputParser<DiffResult> {
    static final String NULL_MODE = "000000";

    private final boolean includeDirstat;

    public RawDiffParser() {
        this(false);
    }

    public RawDiffParser(boolean includeDirstat) {
        this.includeDirstat = includeDirstat;
    }

    @Override
    public DiffResult parse(String output) {
        List<OutputLine> rawLines = new ArrayList<>();
        List<OutputLine> statLines = new ArrayList<>();
        for (OutputLine line : OutputLine.split(output)) {
            if (line.text().startsWith(":")) {
                rawLines.add(line);
            } else {
                statLines.add(line);
            }
        }

        StatSections sections = StatSections.split(statLines, includeDirstat, output);
        Map<String, NumstatEntry> stats = NumstatParser.index(sections.numstat(), output);

        List<DiffEntry> entries = new ArrayList<>(rawLines.size());
        for (OutputLine line : rawLines) {
            entries.add(parseRecord(line, stats, output));
        }
        return DiffResult.of(
                entries,
                sections.shortstat() == null ? null : ShortstatParser.parse(sections.shortstatText()),
                includeDirstat ? DirstatParser.parseLines(sections.dirstat(), output) : null);
    }

    private DiffEntry parseRecord(OutputLine line, Map<String, NumstatEntry> stats, String output) {
        if (line.text().startsWith("::")) {
            throw line.unexpected("Combined diff records are not supported", output);
        }
        // paths may contain spaces but never an unescaped tab
        String[] fields = line.text().substring(1).split("\t", -1);
        String[] info = fields[0].trim().split("\\s+");
        if (info.length != 5 || info[4].isEmpty()) {
            throw line.unexpected("Malformed raw diff record", output);
        }

        String statusToken = info[4];
        DiffStatus status = DiffStatus.fromLetter(statusToken.charAt(0))
                .orElseThrow(() -> line.unexpected("Unknown diff status '" + statusToken + "'", output));
        Integer similarity = parseScore(statusToken, status, line, output);

        int expectedPaths = status.carriesSimilarity() ? 2 : 1;
        if (fields.length - 1 != expectedPaths) {
            throw line.unexpected("Expected " + expectedPaths + " path(s) for status " + status, output);
        }
        String srcPath = EscapedPath.unescapeIfQuoted(fields[1]);
        String dstPath = expectedPaths == 2 ? EscapedPath.unescapeIfQuoted(fields[2]) : srcPath;

        FileRef src = fileRef(info[0], info[2], srcPath);
        FileRef dst = fileRef(info[1], info[3], dstPath);
        NumstatEntry stat = stats.get(dstPath);
        boolean binary = stat != null && stat.binary();

        try {
            return new DiffEntry(
                    status,
                    dstPath,
                    src,
                    dst,
                    status.carriesSimilarity() ? srcPath : null,
                    similarity,
                    stat == null ? 0 : stat.insertions(),
                    stat == null ? 0 : stat.deletions(),
                    binary,
                    null);
        } catch (IllegalArgumentException e) {
            throw new UnexpectedResultException(e.getMessage(), line.text(), line.index(), output, e);
        }
    }

    // the score after M (with -B) is a dissimilarity index and is not kept
    private static Integer parseScore(String statusToken, DiffStatus status, OutputLine line, String output) {
        if (statusToken.length() == 1 || !status.carriesSimilarity()) {
            return null;
        }
        try {
            return Integer.parseInt(statusToken.substring(1));
        } catch (NumberFormatException e) {
            throw new UnexpectedResultException("Malformed similarity score", line.text(), line.index(), output, e);
        }
    }

    private static FileRef fileRef(String mode, String sha, String path) {
        return NULL_MODE.equals(mode) ? null : new FileRef(path, mode, sha);
    }
}
