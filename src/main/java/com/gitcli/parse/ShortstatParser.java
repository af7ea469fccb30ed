package com.gitcli.parse;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.gitcli.model.Shortstat;

public final class ShortstatParser {
    private static final Pattern SHORTSTAT_PATTERN = Pattern.compile("^\\s*\\d+\\s+files?\\s+changed");
    private static final Pattern FILES_PATTERN = Pattern.compile("(\\d+)\\s+files?\\s+changed");
    private static final Pattern INSERTIONS_PATTERN = Pattern.compile("(\\d+)\\s+insertions?\\(\\+\\)");
    private static final Pattern DELETIONS_PATTERN = Pattern.compile("(\\d+)\\s+deletions?\\(-\\)");

    private ShortstatParser() {
    }

    public static boolean isShortstat(String line) {
        return SHORTSTAT_PATTERN.matcher(line).find();
    }

    /** Parses {@code " 3 files changed, 10 insertions(+), 2 deletions(-)"}; absent counts are 0. */
    public static Shortstat parse(String line) {
        if (line == null) {
            return Shortstat.EMPTY;
        }
        return new Shortstat(count(FILES_PATTERN, line), count(INSERTIONS_PATTERN, line), count(DELETIONS_PATTERN, line));
    }

    private static int count(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
    }
}
