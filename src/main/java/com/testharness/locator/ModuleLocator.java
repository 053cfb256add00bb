package com.testharness.locator;

import com.testharness.core.HarnessConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Resolves the set of candidate test-module JARs for a run.
 *
 * Resolution rules:
 *   1. A non-empty explicit module list wins. Each entry is made absolute; entries
 *      that are not existing files are dropped with a warning.
 *   2. Otherwise every search path is classified:
 *        - an existing {@code .jar} file is taken as-is
 *        - an existing directory is listed (non-recursively) for files matching the glob
 *        - anything else is logged and ignored
 *   3. The result is deduplicated, keeps first-seen order, and may be empty.
 *
 * Nothing here throws for a bad path: one unreadable search directory never stops
 * the remaining ones from being located.
 */
public class ModuleLocator {

    private static final Logger log = LoggerFactory.getLogger(ModuleLocator.class);

    private final List<String> explicitModules;
    private final List<String> searchPaths;
    private final String pattern;

    public ModuleLocator(List<String> explicitModules, List<String> searchPaths, String pattern) {
        this.explicitModules = explicitModules != null ? explicitModules : Collections.emptyList();
        this.searchPaths     = searchPaths != null ? searchPaths : Collections.emptyList();
        this.pattern         = (pattern != null && !pattern.isBlank()) ? pattern : HarnessConfig.DEFAULT_MODULE_PATTERN;
    }

    public ModuleLocator(HarnessConfig config) {
        this(config.getTestModules(), config.getTestModulesPaths(), config.getTestModulePattern());
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Returns absolute, normalized, distinct module paths. Never null.
     */
    public List<Path> locate() {
        if (!explicitModules.isEmpty()) {
            List<Path> resolved = resolveExplicit();
            if (resolved.isEmpty()) {
                log.warn("ModuleLocator: None of the {} explicitly configured module(s) exist", explicitModules.size());
            }
            return resolved;
        }

        if (searchPaths.isEmpty()) {
            log.warn("ModuleLocator: No explicit test modules and no search paths configured");
            return Collections.emptyList();
        }

        List<Path> found = searchPaths();
        if (found.isEmpty()) {
            log.warn("ModuleLocator: No test modules found using pattern '{}' in {}", pattern, searchPaths);
        } else {
            log.info("ModuleLocator: {} test module(s) found using pattern '{}'", found.size(), pattern);
        }
        return found;
    }

    public String getPattern() { return pattern; }

    // ── Explicit list ─────────────────────────────────────────────────────────

    private List<Path> resolveExplicit() {
        Set<Path> resolved = new LinkedHashSet<>();
        for (String entry : explicitModules) {
            Path full;
            try {
                full = absolute(entry);
            } catch (InvalidPathException e) {
                log.warn("ModuleLocator: Ignoring invalid module path '{}': {}", entry, e.getMessage());
                continue;
            }
            if (Files.isRegularFile(full)) {
                resolved.add(full);
            } else {
                log.warn("ModuleLocator: Test module {}, dropping: {}", whyNotAModule(full), full);
            }
        }
        return new ArrayList<>(resolved);
    }

    // ── Search paths ──────────────────────────────────────────────────────────

    private List<Path> searchPaths() {
        Set<Path> found = new LinkedHashSet<>();
        for (String entry : searchPaths) {
            try {
                Path full = absolute(entry);

                if (Files.isRegularFile(full) && isModuleFile(full)) {
                    found.add(full);
                    continue;
                }

                if (!Files.isDirectory(full)) {
                    log.warn("ModuleLocator: Test module path {}: {}", whyNotAModule(full), full);
                    continue;
                }

                found.addAll(listMatching(full));
            } catch (IOException | UncheckedIOException | SecurityException | IllegalArgumentException e) {
                log.warn("ModuleLocator: Failed to enumerate test modules in {}: {}", entry, e.getMessage(), e);
            }
        }
        return new ArrayList<>(found);
    }

    private List<Path> listMatching(Path directory) throws IOException {
        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, pattern)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    matches.add(p.toAbsolutePath().normalize());
                }
            }
        }
        matches.sort(null);
        log.debug("ModuleLocator: {} match(es) for '{}' in {}", matches.size(), pattern, directory);
        return matches;
    }

    /** Reason a path cannot be used as a module, for the warning that drops it. */
    static String whyNotAModule(Path path) {
        return Files.exists(path) ? "is not a module file" : "does not exist";
    }

    private static boolean isModuleFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(HarnessConfig.MODULE_EXTENSION);
    }

    private static Path absolute(String entry) {
        return Paths.get(entry.trim()).toAbsolutePath().normalize();
    }
}
