package com.gitcli.command;

import java.util.List;

/**
 * Flags for {@code git fsck}. {@code Boolean} fields are tri-state: {@code null} keeps git's
 * default, otherwise {@code --x} or {@code --no-x} is passed.
 */
public record FsckOptions(
        boolean unreachable,
        boolean tags,
        boolean root,
        boolean cache,
        boolean noReflogs,
        Boolean full,
        boolean connectivityOnly,
        boolean strict,
        boolean lostFound,
        Boolean dangling,
        Boolean nameObjects,
        Boolean references,
        List<String> objects) {

    public FsckOptions {
        objects = objects == null ? List.of() : List.copyOf(objects);
        GitArguments.requireRevisions("object", objects);
    }

    public static FsckOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    void appendTo(List<String> args) {
        if (unreachable) {
            args.add("--unreachable");
        }
        if (tags) {
            args.add("--tags");
        }
        if (root) {
            args.add("--root");
        }
        if (cache) {
            args.add("--cache");
        }
        if (noReflogs) {
            args.add("--no-reflogs");
        }
        GitArguments.appendNegatable(args, "full", full);
        if (connectivityOnly) {
            args.add("--connectivity-only");
        }
        if (strict) {
            args.add("--strict");
        }
        if (lostFound) {
            args.add("--lost-found");
        }
        GitArguments.appendNegatable(args, "dangling", dangling);
        GitArguments.appendNegatable(args, "name-objects", nameObjects);
        GitArguments.appendNegatable(args, "references", references);
        args.addAll(objects);
    }

    public static final class Builder {
        private boolean unreachable;
        private boolean tags;
        private boolean root;
        private boolean cache;
        private boolean noReflogs;
        private Boolean full;
        private boolean connectivityOnly;
        private boolean strict;
        private boolean lostFound;
        private Boolean dangling;
        private Boolean nameObjects;
        private Boolean references;
        private List<String> objects = List.of();

        private Builder() {
        }

        public Builder unreachable(boolean unreachable) {
            this.unreachable = unreachable;
            return this;
        }

        public Builder tags(boolean tags) {
            this.tags = tags;
            return this;
        }

        public Builder root(boolean root) {
            this.root = root;
            return this;
        }

        public Builder cache(boolean cache) {
            this.cache = cache;
            return this;
        }

        public Builder noReflogs(boolean noReflogs) {
            this.noReflogs = noReflogs;
            return this;
        }

        public Builder full(Boolean full) {
            this.full = full;
            return this;
        }

        public Builder connectivityOnly(boolean connectivityOnly) {
            this.connectivityOnly = connectivityOnly;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder lostFound(boolean lostFound) {
            this.lostFound = lostFound;
            return this;
        }

        public Builder dangling(Boolean dangling) {
            this.dangling = dangling;
            return this;
        }

        public Builder nameObjects(Boolean nameObjects) {
            this.nameObjects = nameObjects;
            return this;
        }

        public Builder references(Boolean references) {
            this.references = references;
            return this;
        }

        public Builder objects(List<String> objects) {
            this.objects = objects;
            return this;
        }

        public FsckOptions build() {
            return new FsckOptions(unreachable, tags, root, cache, noReflogs, full, connectivityOnly, strict,
                    lostFound, dangling, nameObjects, references, objects);
        }
    }
}
