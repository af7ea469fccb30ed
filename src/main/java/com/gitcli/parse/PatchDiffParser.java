package com.gitcli.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.gitcli.model.DiffEntry;
import com.gitcli.model.DiffResult;
import com.gitcli.model.DiffStatus;
import com.gitcli.model.DirstatInfo;
import com.gitcli.model.FileRef;
import com.gitcli.model.NumstatEntry;

/**
 * Parses {@code git diff --patch --numstat --shortstat [--dirstat]} output.
 *
 * <p>Every {@code diff --git} header starts one entry. git splits a change between file types (for
 * example a regular file replaced by a symlink) into a deletion followed by an addition of the same
 * path, and that stays two entries here.
 */
public class PatchDiffParser implements OutputParser<DiffResult> {
    private static final Pattern DIFF_HEADER_PATTERN = Pattern.compile("^diff --git (\"?)a/(.+?)\\1 (\"?)b/(.+?)\\3$");
    private static final Pattern INDEX_PATTERN = Pattern.compile("^index ([0-9a-f]{4,64})\\.\\.([0-9a-f]{4,64})(?: (\\d{6}))?$");
    private static final Pattern FILE_MODE_PATTERN = Pattern.compile("^(new|deleted) file mode (\\d{6})$");
    private static final Pattern OLD_MODE_PATTERN = Pattern.compile("^old mode (\\d{6})$");
    private static final Pattern NEW_MODE_PATTERN = Pattern.compile("^new mode (\\d{6})$");
    private static final Pattern BINARY_PATTERN = Pattern.compile("^Binary files .* differ$");
    private static final Pattern RENAME_FROM_PATTERN = Pattern.compile("^rename from (.+)$");
    private static final Pattern RENAME_TO_PATTERN = Pattern.compile("^rename to (.+)$");
    private static final Pattern COPY_FROM_PATTERN = Pattern.compile("^copy from (.+)$");
    private static final Pattern COPY_TO_PATTERN = Pattern.compile("^copy to (.+)$");
    private static final Pattern SIMILARITY_PATTERN = Pattern.compile("^similarity index (\\d+)%$");
    private static final String DIFF_HEADER_PREFIX = "diff --git ";
    private static final String GIT_BINARY_PATCH = "GIT binary patch";

    private final boolean includeDirstat;

    public PatchDiffParser() {
        this(false);
    }

    public PatchDiffParser(boolean includeDirstat) {
        this.includeDirstat = includeDirstat;
    }

    @Override
    public DiffResult parse(String output) {
        if (output == null || output.isEmpty()) {
            return DiffResult.of(List.of(), null, includeDirstat ? new DirstatInfo(List.of()) : null);
        }
        String[] lines = output.split("\n", -1);
        int firstHeader = lines.length;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].startsWith(DIFF_HEADER_PREFIX)) {
                firstHeader = i;
                break;
            }
        }

        List<OutputLine> statLines = new ArrayList<>();
        for (int i = 0; i < firstHeader; i++) {
            if (!lines[i].isEmpty()) {
                statLines.add(new OutputLine(i, lines[i]));
            }
        }
        StatSections sections = StatSections.split(statLines, includeDirstat, output);
        Map<String, NumstatEntry> stats = NumstatParser.index(sections.numstat(), output);

        List<DiffEntry> entries = new ArrayList<>();
        FileState current = null;
        int end = output.endsWith("\n") ? lines.length - 1 : lines.length;
        for (int i = firstHeader; i < end; i++) {
            String line = lines[i];
            Matcher header = DIFF_HEADER_PATTERN.matcher(line);
            if (header.matches()) {
                if (current != null) {
                    entries.add(current.toEntry(stats, output));
                }
                current = new FileState(new OutputLine(i, line),
                        path(header.group(1), header.group(2)),
                        path(header.group(3), header.group(4)));
            } else if (current == null) {
                throw new UnexpectedResultException("Patch text before the first file header", line, i, output);
            } else {
                current.accept(line);
            }
        }
        if (current != null) {
            entries.add(current.toEntry(stats, output));
        }

        return DiffResult.of(
                entries,
                sections.shortstat() == null ? null : ShortstatParser.parse(sections.shortstatText()),
                includeDirstat ? DirstatParser.parseLines(sections.dirstat(), output) : null);
    }

    private static String path(String quote, String path) {
        return quote.isEmpty() ? path : EscapedPath.unescape(path);
    }

    private static final class FileState {
        private final OutputLine header;
        private final StringBuilder patch;
        private String srcPath;
        private String dstPath;
        private String srcMode;
        private String dstMode;
        private String srcSha = "";
        private String dstSha = "";
        private DiffStatus status = DiffStatus.MODIFIED;
        private Integer similarity;
        private boolean binary;
        private boolean inHunks;

        private FileState(OutputLine header, String srcPath, String dstPath) {
            this.header = header;
            this.patch = new StringBuilder(header.text());
            this.srcPath = srcPath;
            this.dstPath = dstPath;
        }

        private void accept(String line) {
            patch.append('\n').append(line);
            if (inHunks) {
                return;
            }
            if (line.startsWith("@@")) {
                inHunks = true;
                return;
            }
            Matcher matcher;
            if ((matcher = INDEX_PATTERN.matcher(line)).matches()) {
                srcSha = matcher.group(1);
                dstSha = matcher.group(2);
                if (matcher.group(3) != null && srcMode == null && dstMode == null) {
                    srcMode = matcher.group(3);
                    dstMode = matcher.group(3);
                }
            } else if ((matcher = FILE_MODE_PATTERN.matcher(line)).matches()) {
                if ("new".equals(matcher.group(1))) {
                    status = DiffStatus.ADDED;
                    dstMode = matcher.group(2);
                    srcPath = null;
                } else {
                    status = DiffStatus.DELETED;
                    srcMode = matcher.group(2);
                    dstPath = null;
                }
            } else if ((matcher = OLD_MODE_PATTERN.matcher(line)).matches()) {
                srcMode = matcher.group(1);
                detectTypeChange();
            } else if ((matcher = NEW_MODE_PATTERN.matcher(line)).matches()) {
                dstMode = matcher.group(1);
                detectTypeChange();
            } else if ((matcher = RENAME_FROM_PATTERN.matcher(line)).matches()) {
                srcPath = EscapedPath.unescapeIfQuoted(matcher.group(1));
                status = DiffStatus.RENAMED;
            } else if ((matcher = RENAME_TO_PATTERN.matcher(line)).matches()) {
                dstPath = EscapedPath.unescapeIfQuoted(matcher.group(1));
                status = DiffStatus.RENAMED;
            } else if ((matcher = COPY_FROM_PATTERN.matcher(line)).matches()) {
                srcPath = EscapedPath.unescapeIfQuoted(matcher.group(1));
                status = DiffStatus.COPIED;
            } else if ((matcher = COPY_TO_PATTERN.matcher(line)).matches()) {
                dstPath = EscapedPath.unescapeIfQuoted(matcher.group(1));
                status = DiffStatus.COPIED;
            } else if ((matcher = SIMILARITY_PATTERN.matcher(line)).matches()) {
                similarity = Integer.parseInt(matcher.group(1));
            } else if (BINARY_PATTERN.matcher(line).matches() || GIT_BINARY_PATCH.equals(line)) {
                binary = true;
            }
        }

        // 100644 -> 100755 is a mode change; 100644 -> 120000 changes the file type
        private void detectTypeChange() {
            if (srcMode != null && dstMode != null && status == DiffStatus.MODIFIED
                    && !srcMode.regionMatches(0, dstMode, 0, 3)) {
                status = DiffStatus.TYPE_CHANGED;
            }
        }

        private DiffEntry toEntry(Map<String, NumstatEntry> stats, String output) {
            String path = dstPath != null ? dstPath : srcPath;
            NumstatEntry stat = stats.get(path);
            int insertions = stat == null || binary || status == DiffStatus.DELETED ? 0 : stat.insertions();
            int deletions = stat == null || binary || status == DiffStatus.ADDED ? 0 : stat.deletions();
            try {
                return new DiffEntry(
                        status,
                        path,
                        srcPath == null ? null : new FileRef(srcPath, srcMode, srcSha),
                        dstPath == null ? null : new FileRef(dstPath, dstMode, dstSha),
                        srcPath,
                        status.carriesSimilarity() ? similarity : null,
                        insertions,
                        deletions,
                        binary || (stat != null && stat.binary()),
                        patch.toString());
            } catch (IllegalArgumentException e) {
                throw new UnexpectedResultException(e.getMessage(), header.text(), header.index(), output, e);
            }
        }
    }
}
