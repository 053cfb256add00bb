package com.testharness.loader;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The isolation context for one test module: a child-first class loader whose
 * class path is the module JAR followed by the JARs that sit next to it.
 *
 * <p>Lookup order for a class:
 * <ol>
 *   <li>the JDK (platform class loader), so {@code java.*} is always shared</li>
 *   <li>packages listed as parent-first go straight to the host loader</li>
 *   <li>the module's own class path (module JAR, then sibling JARs)</li>
 *   <li>the host loader, as a last resort</li>
 * </ol>
 *
 * Two modules that bundle different versions of the same library therefore each
 * see their own copy. A context belongs to exactly one module and must stay open
 * until discovery and execution of that module are complete; {@link #close()}
 * releases the JAR handles so the context and every class it defined can be collected.
 */
public final class ModuleContext extends URLClassLoader {

    static {
        ClassLoader.registerAsParallelCapable();
    }

    private final Path modulePath;
    private final List<Path> classPath;
    private final List<String> parentFirstPrefixes;
    private final ClassLoader platform = ClassLoader.getPlatformClassLoader();
    private volatile boolean closed;

    ModuleContext(Path modulePath, List<Path> classPath, ClassLoader host, List<String> parentFirstPrefixes)
            throws MalformedURLException {
        super("module:" + modulePath.getFileName(), toUrls(classPath), host);
        this.modulePath = modulePath;
        this.classPath = List.copyOf(classPath);
        this.parentFirstPrefixes = List.copyOf(parentFirstPrefixes);
    }

    // ── Class loading ─────────────────────────────────────────────────────────

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                c = findPlatformClass(name);
            }
            if (c == null && isParentFirst(name)) {
                return super.loadClass(name, resolve);
            }
            if (c == null) {
                c = findOwnClass(name);
            }
            if (c == null) {
                ClassLoader host = getParent();
                if (host == null) {
                    throw new ClassNotFoundException(name + " (not found in " + modulePath.getFileName() + ")");
                }
                c = host.loadClass(name);
            }
            if (resolve) {
                resolveClass(c);
            }
            return c;
        }
    }

    @Override
    public URL getResource(String name) {
        URL own = findResource(name);
        return own != null ? own : super.getResource(name);
    }

    private Class<?> findPlatformClass(String name) {
        try {
            return platform.loadClass(name);
        } catch (ClassNotFoundException e) {
            return null;
        }
    }

    private Class<?> findOwnClass(String name) {
        try {
            return findClass(name);
        } catch (ClassNotFoundException e) {
            return null;
        }
    }

    private boolean isParentFirst(String name) {
        for (String prefix : parentFirstPrefixes) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    @Override
    public void close() throws IOException {
        closed = true;
        super.close();
    }

    public boolean isClosed() { return closed; }

    // ── Getters ───────────────────────────────────────────────────────────────

    /** The module JAR this context was created for. */
    public Path getModulePath() { return modulePath; }

    /** Module JAR first, then the sibling dependency JARs, in lookup order. */
    public List<Path> getClassPath() { return classPath; }

    /** The module JAR as a URL, for scanners that only need the module itself. */
    public URL getModuleUrl() { return getURLs()[0]; }

    @Override
    public String toString() {
        return String.format("ModuleContext{module=%s, classPath=%d entr%s, closed=%s}",
            modulePath.getFileName(), classPath.size(), classPath.size() == 1 ? "y" : "ies", closed);
    }

    private static URL[] toUrls(List<Path> paths) throws MalformedURLException {
        List<URL> urls = new ArrayList<>(paths.size());
        for (Path p : paths) {
            urls.add(p.toUri().toURL());
        }
        return urls.toArray(new URL[0]);
    }
}
