package com.gitcli.parse;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.gitcli.Fixtures;
import com.gitcli.model.DiffEntry;
import com.gitcli.model.DiffResult;
import com.gitcli.model.DiffStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatchDiffParserTest {

    @Test
    void shouldSplitOneEntryPerFileHeader() {
        DiffResult result = new PatchDiffParser().parse(Fixtures.read("diff_patch.txt"));

        assertEquals(List.of(DiffStatus.MODIFIED, DiffStatus.RENAMED, DiffStatus.DELETED, DiffStatus.ADDED,
                DiffStatus.MODIFIED, DiffStatus.MODIFIED),
                result.entries().stream().map(DiffEntry::status).toList());
        assertEquals(6, result.filesChanged());
        assertEquals(5, result.shortstat().filesChanged());
    }

    @Test
    void shouldKeepSplitTypeChangeAsDeleteAndAddWithConsistentTotals() {
        DiffResult result = new PatchDiffParser().parse(Fixtures.read("diff_patch.txt"));

        DiffEntry deleted = result.entries().get(2);
        DiffEntry added = result.entries().get(3);
        assertEquals("link", deleted.path());
        assertEquals("link", added.path());
        assertNull(deleted.dst());
        assertNull(added.src());
        assertEquals("100644", deleted.src().mode());
        assertTrue(added.dst().isSymlink());
        assertEquals(0, deleted.insertions());
        assertEquals(1, deleted.deletions());
        assertEquals(1, added.insertions());
        assertEquals(0, added.deletions());
        assertEquals(4, result.totalInsertions());
        assertEquals(2, result.totalDeletions());
    }

    @Test
    void shouldAttachPatchTextToEachEntry() {
        DiffEntry readme = new PatchDiffParser().parse(Fixtures.read("diff_patch.txt")).entries().get(0);

        assertEquals("README.md", readme.path());
        assertEquals("1111111", readme.src().sha());
        assertEquals("2222222", readme.dst().sha());
        assertEquals(3, readme.insertions());
        assertEquals(1, readme.deletions());
        assertTrue(readme.patch().startsWith("diff --git a/README.md b/README.md\n"));
        assertTrue(readme.patch().endsWith("+added two\n context"));
    }

    @Test
    void shouldReadRenameMetadata() {
        DiffEntry rename = new PatchDiffParser().parse(Fixtures.read("diff_patch.txt")).entries().get(1);

        assertEquals("lib/new.rb", rename.path());
        assertEquals("lib/old.rb", rename.srcPath());
        assertEquals(100, rename.similarity());
    }

    @Test
    void shouldKeepModeChangeWithinFileFamilyAsModified() {
        DiffEntry script = new PatchDiffParser().parse(Fixtures.read("diff_patch.txt")).entries().get(5);

        assertTrue(script.isModified());
        assertEquals("100644", script.src().mode());
        assertTrue(script.dst().isExecutable());
    }

    @Test
    void shouldMarkBinaryEntries() {
        DiffEntry logo = new PatchDiffParser().parse(Fixtures.read("diff_patch.txt")).entries().get(4);

        assertTrue(logo.binary());
        assertEquals(0, logo.insertions());
    }

    @Test
    void shouldReportTypeChangeInsideSingleHeader() {
        DiffEntry entry = new PatchDiffParser()
                .parse("diff --git a/x b/x\nold mode 100644\nnew mode 120000\n")
                .entries().get(0);

        assertTrue(entry.isTypeChanged());
    }

    @Test
    void shouldDecodeQuotedHeaderPaths() {
        String output = "diff --git \"a/file\\342\\230\\240skull.rb\" \"b/file\\342\\230\\240skull.rb\"\n"
                + "new file mode 100644\n"
                + "index 0000000..1234567\n";

        DiffEntry entry = new PatchDiffParser().parse(output).entries().get(0);

        assertTrue(entry.isAdded());
        assertEquals("file☠skull.rb", entry.path());
    }

    @Test
    void shouldRejectPatchTextBeforeFirstHeader() {
        String output = "1\t0\ta.txt\n 1 file changed, 1 insertion(+)\n+stray\n";

        assertThrows(UnexpectedResultException.class, () -> new PatchDiffParser().parse(output));
    }

    @Test
    void shouldReturnEmptyResultForEmptyOutput() {
        assertTrue(new PatchDiffParser().parse("").isEmpty());
    }
}
