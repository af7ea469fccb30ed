package com.gitcli.parse;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.gitcli.Fixtures;
import com.gitcli.model.NumstatEntry;
import com.gitcli.model.NumstatResult;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NumstatParserTest {

    @Test
    void shouldParseCountsAndResolveBothRenameNotations() {
        NumstatResult result = new NumstatParser().parse(Fixtures.read("diff_numstat.txt"));

        List<NumstatEntry> entries = result.entries();
        assertEquals(5, entries.size());
        assertEquals(new NumstatEntry("README.md", null, 3, 1, false), entries.get(0));
        assertEquals(new NumstatEntry("lib/new.rb", "lib/old.rb", 0, 0, false), entries.get(1));
        assertEquals(new NumstatEntry("src/main/App.java", "src/App.java", 2, 2, false), entries.get(2));
        assertEquals(new NumstatEntry("manual/guide.md", "docs/guide.md", 5, 0, false), entries.get(3));
        assertFalse(entries.get(0).isRenamed());
        assertTrue(entries.get(3).isRenamed());
    }

    @Test
    void shouldTreatDashCountsAsBinary() {
        NumstatEntry logo = new NumstatParser().parse(Fixtures.read("diff_numstat.txt")).entries().get(4);

        assertTrue(logo.binary());
        assertEquals(0, logo.insertions());
        assertEquals(0, logo.deletions());
    }

    @Test
    void shouldDeriveTotalsFromEntriesAndKeepShortstat() {
        NumstatResult result = new NumstatParser().parse(Fixtures.read("diff_numstat.txt"));

        assertEquals(10, result.totalInsertions());
        assertEquals(3, result.totalDeletions());
        assertEquals(5, result.filesChanged());
        assertEquals(5, result.shortstat().filesChanged());
        assertEquals(10, result.shortstat().insertions());
        assertEquals(3, result.shortstat().deletions());
        assertNull(result.dirstat());
    }

    @Test
    void shouldCollapseEmptyRenameSide() {
        assertArrayEquals(new String[] { "lib/sub/a.rb", "lib/a.rb" }, NumstatParser.splitRename("lib/{ => sub}/a.rb"));
        assertArrayEquals(new String[] { "lib/a.rb", "lib/sub/a.rb" }, NumstatParser.splitRename("lib/{sub => }/a.rb"));
        assertArrayEquals(new String[] { "plain.txt", null }, NumstatParser.splitRename("plain.txt"));
    }

    @Test
    void shouldRejectMalformedLine() {
        UnexpectedResultException error = assertThrows(UnexpectedResultException.class,
                () -> new NumstatParser().parse("3\t1\tok.txt\nthree\t1\tbad.txt\n"));

        assertEquals(1, error.lineIndex());
        assertEquals("three\t1\tbad.txt", error.line());
    }
}
