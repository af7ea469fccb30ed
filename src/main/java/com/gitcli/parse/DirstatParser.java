package com.gitcli.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.gitcli.model.DirstatEntry;
import com.gitcli.model.DirstatInfo;

/**
 * Parses {@code --dirstat} lines such as {@code "  62.5% lib/"}. Emission order is kept.
 */
public class DirstatParser implements OutputParser<DirstatInfo> {
    private static final Pattern DIRSTAT_PATTERN = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)%\\s+(.+)$");

    @Override
    public DirstatInfo parse(String output) {
        return parseLines(OutputLine.split(output), output);
    }

    static DirstatInfo parseLines(List<OutputLine> lines, String output) {
        List<DirstatEntry> entries = new ArrayList<>();
        for (OutputLine line : lines) {
            Matcher matcher = DIRSTAT_PATTERN.matcher(line.text());
            if (!matcher.matches()) {
                throw line.unexpected("Malformed dirstat line", output);
            }
            String directory = matcher.group(2);
            if (!directory.endsWith("/")) {
                throw line.unexpected("Dirstat directory does not end with '/'", output);
            }
            entries.add(new DirstatEntry(directory, Double.parseDouble(matcher.group(1))));
        }
        return new DirstatInfo(entries);
    }
}
