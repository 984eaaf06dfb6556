package dev.makefmt.runner;

import java.nio.file.Path;
import java.util.List;

/**
 * What a single invocation should do with its inputs.
 *
 * @param files   files to format in order; empty means standard input
 * @param check   report unformatted inputs through the exit code only
 * @param diff    print a unified diff instead of the formatted text
 * @param write   rewrite files in place, the default for file arguments; rejected for standard input
 * @param quiet   do not list unformatted files in check mode
 * @param verbose list every file on stderr as it is processed
 */
public record RunOptions(List<Path> files, boolean check, boolean diff, boolean write, boolean quiet, boolean verbose) {

    public RunOptions {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public boolean readsStdin() {
        return files.isEmpty();
    }
}
