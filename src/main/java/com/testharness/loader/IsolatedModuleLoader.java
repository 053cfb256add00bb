package com.testharness.loader;

import com.testharness.core.HarnessConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.jar.JarFile;

/**
 * Creates one {@link ModuleContext} per test module.
 *
 * A module's dependencies are resolved from its own directory first: every other
 * {@code *.jar} next to the module joins its class path (sorted by file name),
 * and manifest {@code Class-Path} entries are honoured relative to the module.
 * Only when a class is in none of those does lookup fall back to the host.
 *
 * The archive is opened once up front so a truncated or non-JAR file fails here,
 * as a {@link ModuleLoadException}, instead of later as a confusing
 * {@code ClassNotFoundException} during discovery.
 */
public class IsolatedModuleLoader {

    private static final Logger log = LoggerFactory.getLogger(IsolatedModuleLoader.class);

    private final ClassLoader hostLoader;
    private final List<String> parentFirstPrefixes;

    public IsolatedModuleLoader() {
        this(IsolatedModuleLoader.class.getClassLoader(), List.of());
    }

    /**
     * @param hostLoader          fallback loader for anything the module directory does not provide
     * @param parentFirstPrefixes class-name prefixes that must always come from the host
     *                            (e.g. a test framework API shared with an in-process engine)
     */
    public IsolatedModuleLoader(ClassLoader hostLoader, List<String> parentFirstPrefixes) {
        this.hostLoader = hostLoader;
        this.parentFirstPrefixes = List.copyOf(parentFirstPrefixes);
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Loads {@code modulePath} into a fresh, unshared context. The caller owns the
     * returned context and must close it once the module's tests have run.
     *
     * @throws ModuleLoadException if the file is missing or is not a readable JAR
     */
    public ModuleContext load(Path modulePath) throws ModuleLoadException {
        Path full = modulePath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(full)) {
            throw new ModuleLoadException(full, "Test module does not exist");
        }

        int entries = verifyArchive(full);

        List<Path> classPath = new ArrayList<>();
        classPath.add(full);
        classPath.addAll(siblingDependencies(full));

        try {
            ModuleContext context = new ModuleContext(full, classPath, hostLoader, parentFirstPrefixes);
            log.info("IsolatedModuleLoader: Loaded {} ({} entries, {} dependenc{} from module directory)",
                full.getFileName(), entries, classPath.size() - 1, classPath.size() == 2 ? "y" : "ies");
            return context;
        } catch (MalformedURLException e) {
            throw new ModuleLoadException(full, "Could not build class path for test module", e);
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private int verifyArchive(Path module) throws ModuleLoadException {
        try (JarFile jar = new JarFile(module.toFile(), true)) {
            return jar.size();
        } catch (IOException | SecurityException e) {
            throw new ModuleLoadException(module, "Not a readable JAR", e);
        }
    }

    private List<Path> siblingDependencies(Path module) {
        List<Path> deps = new ArrayList<>();
        Path dir = module.getParent();
        if (dir == null) return deps;

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + HarnessConfig.MODULE_EXTENSION)) {
            for (Path p : stream) {
                Path candidate = p.toAbsolutePath().normalize();
                if (!candidate.equals(module) && Files.isRegularFile(candidate)) {
                    deps.add(candidate);
                }
            }
        } catch (IOException e) {
            log.warn("IsolatedModuleLoader: Could not list dependencies next to {}: {}", module, e.getMessage());
        }
        deps.sort(null);
        return deps;
    }
}
