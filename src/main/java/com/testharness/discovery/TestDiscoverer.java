package com.testharness.discovery;

import com.testharness.loader.ModuleContext;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds the test methods in one loaded module.
 *
 * Discovery runs in two passes:
 *   1. The Reflections library reads the module JAR's bytecode and indexes every
 *      annotated method by annotation name, plus each type's direct supertypes.
 *      Only names on the {@link MarkerFamily} allow-list are kept. No class is
 *      loaded in this pass.
 *   2. Every concrete type that declares or inherits a marked method is loaded
 *      through the module's {@link ModuleContext}. Its class hierarchy is walked
 *      from the type upwards and declared methods are matched against the indexed
 *      signatures. Inherited tests are reported under the concrete type; a method
 *      redeclared lower in the hierarchy shadows the one above it.
 *
 * Abstract types and interfaces are never run on their own. Only supertypes that
 * live in the module JAR itself contribute marked methods.
 *
 * Failures narrow instead of propagating: a type that cannot be loaded is logged
 * and skipped, a method whose signature cannot be read is logged and skipped, and
 * a JAR that cannot be scanned at all yields an empty list.
 *
 * Output order is stable across runs: types by name, then methods by name and
 * signature. Source declaration order is not recoverable through reflection.
 */
public class TestDiscoverer {

    private static final Logger log = LoggerFactory.getLogger(TestDiscoverer.class);

    private static final Comparator<Method> METHOD_ORDER =
        Comparator.comparing(Method::getName).thenComparing(TestDiscoverer::signatureKey);

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Returns every marked method in the module, each exactly once per concrete type.
     */
    public List<DiscoveredTest> discover(ModuleContext context) {
        ModuleIndex index = scan(context);
        if (index.markers.isEmpty()) {
            log.info("TestDiscoverer: No marked test methods in {}", context.getModulePath().getFileName());
            return Collections.emptyList();
        }

        Set<String> candidates = candidateTypes(index);
        List<DiscoveredTest> discovered = new ArrayList<>();
        for (String typeName : candidates) {
            discoverInType(context, typeName, index.markers, discovered);
        }

        log.info("TestDiscoverer: {} test method(s) in {} candidate type(s) of {}",
            discovered.size(), candidates.size(), context.getModulePath().getFileName());
        return discovered;
    }

    // ── Pass 1: bytecode index ────────────────────────────────────────────────

    /** What the bytecode scan learned about one module. */
    private static final class ModuleIndex {
        /** declaring type name -> (method signature key -> marker name), types sorted by name */
        final Map<String, Map<String, String>> markers;
        /** supertype name -> direct subtype names, for types in the module */
        final Map<String, Set<String>> subTypes;

        ModuleIndex(Map<String, Map<String, String>> markers, Map<String, Set<String>> subTypes) {
            this.markers  = markers;
            this.subTypes = subTypes;
        }
    }

    /**
     * When a method carries several recognised markers the first in allow-list order is kept.
     */
    private ModuleIndex scan(ModuleContext context) {
        Map<String, Set<String>> annotated;
        Map<String, Set<String>> subTypes;
        try {
            Reflections reflections = new Reflections(new ConfigurationBuilder()
                .setUrls(context.getModuleUrl())
                .setClassLoaders(new ClassLoader[]{context})
                .setExpandSuperTypes(false)
                .setScanners(Scanners.MethodsAnnotated, Scanners.SubTypes));
            annotated = reflections.getStore().getOrDefault(Scanners.MethodsAnnotated.index(), Collections.emptyMap());
            subTypes  = reflections.getStore().getOrDefault(Scanners.SubTypes.index(), Collections.emptyMap());
        } catch (RuntimeException e) {
            log.warn("TestDiscoverer: Failed to scan {}: {}", context.getModulePath(), e.getMessage(), e);
            return new ModuleIndex(Collections.emptyMap(), Collections.emptyMap());
        }

        Map<String, Map<String, String>> byType = new TreeMap<>();
        for (String marker : MarkerFamily.allMarkers()) {
            List<String> signatures = annotated.getOrDefault(marker, Collections.emptySet())
                .stream().sorted().toList();
            for (String signature : signatures) {
                int open = signature.indexOf('(');
                int dot = open > 0 ? signature.lastIndexOf('.', open) : -1;
                if (dot <= 0) {
                    log.debug("TestDiscoverer: Unrecognised method signature '{}' for @{}", signature, marker);
                    continue;
                }
                String typeName = signature.substring(0, dot);
                String key = normalize(signature.substring(dot + 1));
                byType.computeIfAbsent(typeName, t -> new TreeMap<>()).putIfAbsent(key, marker);
            }
        }
        return new ModuleIndex(byType, subTypes);
    }

    /** Types that declare marked methods, plus every module type that extends one of them. */
    private static Set<String> candidateTypes(ModuleIndex index) {
        Set<String> candidates = new TreeSet<>();
        Deque<String> pending = new ArrayDeque<>(index.markers.keySet());
        while (!pending.isEmpty()) {
            String typeName = pending.poll();
            if (!candidates.add(typeName)) continue;
            pending.addAll(index.subTypes.getOrDefault(typeName, Collections.emptySet()));
        }
        return candidates;
    }

    // ── Pass 2: reflection ────────────────────────────────────────────────────

    private void discoverInType(ModuleContext context, String typeName,
                                Map<String, Map<String, String>> markers, List<DiscoveredTest> out) {
        Class<?> type;
        try {
            type = Class.forName(typeName, false, context);
        } catch (ClassNotFoundException | LinkageError | TypeNotPresentException e) {
            log.warn("TestDiscoverer: Type {} in {} failed to load; continuing with the types that did: {}",
                typeName, context.getModulePath().getFileName(), e.toString());
            return;
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            log.debug("TestDiscoverer: Not running abstract type {} directly", typeName);
            return;
        }

        Set<String> seen = new HashSet<>();
        List<Method> tests = new ArrayList<>();
        Map<Method, String> markerOf = new HashMap<>();
        for (Class<?> level = type; level != null && level != Object.class; level = level.getSuperclass()) {
            Map<String, String> marked = markers.getOrDefault(level.getName(), Collections.emptyMap());
            Method[] methods;
            try {
                methods = level.getDeclaredMethods();
            } catch (LinkageError | TypeNotPresentException e) {
                log.warn("TestDiscoverer: Failed to read methods of {} for {}: {}",
                    level.getName(), typeName, e.toString());
                break;
            }

            for (Method method : methods) {
                if (method.isSynthetic() || method.isBridge()) continue;

                String key;
                try {
                    key = signatureKey(method);
                } catch (LinkageError | TypeNotPresentException e) {
                    log.warn("TestDiscoverer: Failed to read metadata for {}.{}: {}",
                        level.getName(), method.getName(), e.toString());
                    continue;
                }
                if (!seen.add(key)) continue;

                String marker = marked.get(key);
                if (marker == null) continue;
                tests.add(method);
                markerOf.put(method, marker);
            }
        }

        tests.sort(METHOD_ORDER);
        for (Method method : tests) {
            String marker = markerOf.get(method);
            MarkerFamily family = MarkerFamily.forMarker(marker).orElseThrow();
            DiscoveredTest test = new DiscoveredTest(context.getModulePath(), type, method, family, marker);
            out.add(test);
            log.debug("TestDiscoverer: Discovered {} via @{}", test, marker);
        }
    }

    // ── Signature keys ────────────────────────────────────────────────────────

    /** {@code name(type1,type2)} using binary type names, matching the bytecode index. */
    static String signatureKey(Method method) {
        return method.getName() + Arrays.stream(method.getParameterTypes())
            .map(Class::getTypeName)
            .collect(Collectors.joining(",", "(", ")"));
    }

    private static String normalize(String signature) {
        return signature.replace(" ", "");
    }
}
