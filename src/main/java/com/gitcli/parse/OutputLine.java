package com.gitcli.parse;

import java.util.ArrayList;
import java.util.List;

/** A non-empty output line together with its 0-based index in the full output. */
record OutputLine(int index, String text) {

    static List<OutputLine> split(String output) {
        List<OutputLine> lines = new ArrayList<>();
        if (output == null || output.isEmpty()) {
            return lines;
        }
        String[] raw = output.split("\n", -1);
        for (int i = 0; i < raw.length; i++) {
            String text = raw[i].endsWith("\r") ? raw[i].substring(0, raw[i].length() - 1) : raw[i];
            if (!text.isEmpty()) {
                lines.add(new OutputLine(i, text));
            }
        }
        return lines;
    }

    UnexpectedResultException unexpected(String reason, String output) {
        return new UnexpectedResultException(reason, text, index, output);
    }
}
