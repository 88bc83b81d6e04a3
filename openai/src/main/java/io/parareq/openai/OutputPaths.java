package io.parareq.openai;

import java.nio.file.Files;
import java.nio.file.Path;

/** Naming rules for the results file. */
public final class OutputPaths {
    static final String JSONL = ".jsonl";

    private OutputPaths() {}

    /** {@code requests.jsonl -> requests_results.jsonl}. */
    public static Path resultsFor(Path requests) {
        return requests.resolveSibling(stem(requests) + "_results" + extension(requests));
    }

    /** {@code x_results.jsonl -> x_results_with_errors.jsonl}. */
    public static Path withErrors(Path results) {
        return results.resolveSibling(stem(results) + "_with_errors" + extension(results));
    }

    /** The path itself when free, otherwise the first free {@code <stem>_<n><ext>}, n from 1. */
    public static Path firstFree(Path path) {
        if (!Files.exists(path)) return path;
        for (int i = 1; ; i++) {
            Path candidate = path.resolveSibling(stem(path) + "_" + i + extension(path));
            if (!Files.exists(candidate)) return candidate;
        }
    }

    static String stem(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static String extension(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }
}
