package com.gitcli.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gitcli.model.FsckObject;
import com.gitcli.model.FsckObjectType;
import com.gitcli.model.FsckResult;

/**
 * Parses {@code git fsck} reports.
 *
 * <p>Recognized lines:
 * <pre>
 * dangling|missing|unreachable &lt;type&gt; &lt;sha&gt; [(&lt;name&gt;)]
 * warning in &lt;type&gt; &lt;sha&gt;: &lt;message&gt;
 * root &lt;sha&gt;
 * tagged &lt;type&gt; &lt;sha&gt; (&lt;tag name&gt;) in &lt;sha&gt;
 * </pre>
 * A line that starts with one of these categories but does not have its shape is an error. Other
 * diagnostics fsck prints ({@code notice:}, {@code Checking ...}, {@code broken link ...}) are skipped.
 */
public class FsckParser implements OutputParser<FsckResult> {
    private static final Logger log = LoggerFactory.getLogger(FsckParser.class);

    private static final Pattern OBJECT_PATTERN = Pattern.compile("^(dangling|missing|unreachable) (\\w+) ([0-9a-f]{40})(?: \\((.+)\\))?$");
    private static final Pattern WARNING_PATTERN = Pattern.compile("^warning in (\\w+) ([0-9a-f]{40}): (.+)$");
    private static final Pattern ROOT_PATTERN = Pattern.compile("^root ([0-9a-f]{40})$");
    private static final Pattern TAGGED_PATTERN = Pattern.compile("^tagged (\\w+) ([0-9a-f]{40}) \\((.+)\\) in ([0-9a-f]{40})$");
    private static final Pattern CATEGORY_PATTERN = Pattern.compile("^(dangling|missing|unreachable|root|tagged|warning in) .*");

    @Override
    public FsckResult parse(String output) {
        List<FsckObject> dangling = new ArrayList<>();
        List<FsckObject> missing = new ArrayList<>();
        List<FsckObject> unreachable = new ArrayList<>();
        List<FsckObject> warnings = new ArrayList<>();
        List<FsckObject> root = new ArrayList<>();
        List<FsckObject> tagged = new ArrayList<>();

        for (OutputLine line : OutputLine.split(output)) {
            String text = line.text().strip();
            Matcher matcher;
            if ((matcher = OBJECT_PATTERN.matcher(text)).matches()) {
                FsckObject object = new FsckObject(type(matcher.group(2), line, output), matcher.group(3), matcher.group(4), null);
                switch (matcher.group(1)) {
                    case "dangling" -> dangling.add(object);
                    case "missing" -> missing.add(object);
                    default -> unreachable.add(object);
                }
            } else if ((matcher = WARNING_PATTERN.matcher(text)).matches()) {
                warnings.add(new FsckObject(type(matcher.group(1), line, output), matcher.group(2), null, matcher.group(3)));
            } else if ((matcher = ROOT_PATTERN.matcher(text)).matches()) {
                root.add(new FsckObject(FsckObjectType.COMMIT, matcher.group(1)));
            } else if ((matcher = TAGGED_PATTERN.matcher(text)).matches()) {
                tagged.add(new FsckObject(type(matcher.group(1), line, output), matcher.group(2), matcher.group(3), null));
            } else if (CATEGORY_PATTERN.matcher(text).matches()) {
                throw line.unexpected("Malformed fsck report line", output);
            } else {
                log.debug("Skipping fsck diagnostic line={}", text);
            }
        }
        return new FsckResult(dangling, missing, unreachable, warnings, root, tagged);
    }

    private static FsckObjectType type(String name, OutputLine line, String output) {
        return FsckObjectType.fromName(name)
                .orElseThrow(() -> line.unexpected("Unknown object type '" + name + "'", output));
    }
}
