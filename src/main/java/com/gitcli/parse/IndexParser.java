package com.gitcli.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.gitcli.model.StatusEntry;

/**
 * Parses {@code git ls-files --stage} output, {@code <mode> <sha> <stage><TAB><path>} per line,
 * into clean {@link StatusEntry} values. A conflicted path appears once per stage.
 */
public class IndexParser implements OutputParser<List<StatusEntry>> {
    private static final Pattern STAGE_PATTERN = Pattern.compile("^([0-7]{6}) ([0-9a-f]{40,64}) ([0-3])\t(.+)$");

    @Override
    public List<StatusEntry> parse(String output) {
        List<StatusEntry> entries = new ArrayList<>();
        for (OutputLine line : OutputLine.split(output)) {
            Matcher matcher = STAGE_PATTERN.matcher(line.text());
            if (!matcher.matches()) {
                throw line.unexpected("Malformed index entry", output);
            }
            entries.add(StatusEntry.clean(
                    EscapedPath.unescapeIfQuoted(matcher.group(4)),
                    matcher.group(3),
                    matcher.group(1),
                    matcher.group(2)));
        }
        return entries;
    }
}
