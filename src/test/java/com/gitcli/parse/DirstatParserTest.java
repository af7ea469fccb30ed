package com.gitcli.parse;

import org.junit.jupiter.api.Test;

import com.gitcli.model.DirstatInfo;
import com.gitcli.model.Shortstat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirstatParserTest {

    @Test
    void shouldParseDecimalPercentagesInEmissionOrder() {
        DirstatInfo info = new DirstatParser().parse("  62.5% lib/\n  37.5% docs/api/\n");

        assertEquals(2, info.size());
        assertEquals("lib/", info.entries().get(0).directory());
        assertEquals(37.5, info.percentOf("docs/api/").orElseThrow());
        assertFalse(info.percentOf("missing/").isPresent());
    }

    @Test
    void shouldAcceptIntegerPercentages() {
        assertEquals(100.0, new DirstatParser().parse("100% ./\n").percentOf("./").orElseThrow());
    }

    @Test
    void shouldRejectDirectoryWithoutTrailingSlash() {
        assertThrows(UnexpectedResultException.class, () -> new DirstatParser().parse("  50.0% lib\n"));
    }

    @Test
    void shouldRejectMalformedLine() {
        assertThrows(UnexpectedResultException.class, () -> new DirstatParser().parse("fifty lib/\n"));
    }

    @Test
    void shouldParseShortstatVariants() {
        assertTrue(ShortstatParser.isShortstat(" 1 file changed, 1 insertion(+)"));
        assertFalse(ShortstatParser.isShortstat("1\t1\tfile changed"));
        assertEquals(new Shortstat(1, 1, 0), ShortstatParser.parse(" 1 file changed, 1 insertion(+)"));
        assertEquals(new Shortstat(2, 0, 7), ShortstatParser.parse(" 2 files changed, 7 deletions(-)"));
        assertEquals(Shortstat.EMPTY, ShortstatParser.parse(null));
    }
}
