package com.gitcli.parse;

import java.util.List;

/**
 * The stat part of a diff listing: numstat lines, then the shortstat line, then dirstat lines.
 * git always prints them in that order.
 */
record StatSections(List<OutputLine> numstat, OutputLine shortstat, List<OutputLine> dirstat) {

    static StatSections split(List<OutputLine> lines, boolean includeDirstat, String output) {
        int shortstatIndex = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (ShortstatParser.isShortstat(lines.get(i).text())) {
                shortstatIndex = i;
                break;
            }
        }
        if (shortstatIndex < 0) {
            return new StatSections(lines, null, List.of());
        }
        List<OutputLine> trailing = lines.subList(shortstatIndex + 1, lines.size());
        if (!includeDirstat && !trailing.isEmpty()) {
            throw trailing.get(0).unexpected("Unexpected line after the shortstat summary", output);
        }
        return new StatSections(lines.subList(0, shortstatIndex), lines.get(shortstatIndex), trailing);
    }

    String shortstatText() {
        return shortstat == null ? null : shortstat.text();
    }
}
