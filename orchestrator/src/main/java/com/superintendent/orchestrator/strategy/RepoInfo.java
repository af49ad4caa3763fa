package com.superintendent.orchestrator.strategy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Signals gathered from a repository checkout that drive the target decision.
 *
 * {@link #fromPath} only looks for well-known marker files at the repo root;
 * it never reads file contents.
 */
public record RepoInfo(
        boolean      hasDockerfile,
        boolean      hasDevcontainer,
        boolean      hasEnvFile,
        boolean      needsAuth,
        List<String> languages,
        Complexity   estimatedComplexity) {

    private static final List<String> DOCKER_MARKERS = List.of(
            "Dockerfile", "docker-compose.yml", "docker-compose.yaml", "compose.yml", "compose.yaml");
    private static final List<String> ENV_MARKERS = List.of(
            ".env", ".env.example", ".env.local", ".env.sample");
    private static final List<String> AUTH_MARKERS = List.of(
            ".npmrc", "pip.conf", ".pypirc");

    public RepoInfo {
        languages = languages == null ? List.of() : List.copyOf(languages);
        if (estimatedComplexity == null) estimatedComplexity = Complexity.SIMPLE;
    }

    /** No signals at all; used for remote repos that are not checked out yet. */
    public static RepoInfo none() {
        return new RepoInfo(false, false, false, false, List.of(), Complexity.SIMPLE);
    }

    public static RepoInfo fromPath(Path repo) {
        if (!Files.exists(repo)) {
            throw new IllegalArgumentException("Repository path does not exist: " + repo);
        }
        if (!Files.isDirectory(repo)) {
            throw new IllegalArgumentException("Repository path is not a directory: " + repo);
        }

        boolean dockerfile   = anyExists(repo, DOCKER_MARKERS);
        boolean devcontainer = Files.isDirectory(repo.resolve(".devcontainer"));
        boolean envFile      = anyExists(repo, ENV_MARKERS);
        boolean auth         = anyExists(repo, AUTH_MARKERS);
        List<String> languages = detectLanguages(repo);

        int score = (dockerfile ? 1 : 0) + (devcontainer ? 1 : 0) + (envFile ? 1 : 0) + (auth ? 1 : 0)
                + Math.max(0, languages.size() - 1);
        Complexity complexity = score >= 3 ? Complexity.COMPLEX
                : score >= 1 ? Complexity.MODERATE
                : Complexity.SIMPLE;

        return new RepoInfo(dockerfile, devcontainer, envFile, auth, languages, complexity);
    }

    private static List<String> detectLanguages(Path repo) {
        List<String> languages = new ArrayList<>();
        if (anyExists(repo, List.of("pyproject.toml", "setup.py", "setup.cfg", "requirements.txt", "Pipfile"))) {
            languages.add("python");
        }
        if (Files.exists(repo.resolve("package.json")))  languages.add("javascript");
        if (Files.exists(repo.resolve("tsconfig.json"))) languages.add("typescript");
        if (Files.exists(repo.resolve("Cargo.toml")))    languages.add("rust");
        if (Files.exists(repo.resolve("go.mod")))        languages.add("go");
        if (anyExists(repo, List.of("pom.xml", "build.gradle", "build.gradle.kts"))) {
            languages.add("java");
        }
        return languages;
    }

    private static boolean anyExists(Path repo, List<String> names) {
        return names.stream().anyMatch(name -> Files.exists(repo.resolve(name)));
    }
}
