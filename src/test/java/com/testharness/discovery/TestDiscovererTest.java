package com.testharness.discovery;

import com.testharness.fixtures.AbstractBaseSuite;
import com.testharness.fixtures.ConcreteSuite;
import com.testharness.fixtures.JupiterStyleSuite;
import com.testharness.fixtures.OrphanedSuite;
import com.testharness.fixtures.SampleSuite;
import com.testharness.fixtures.UninstantiableSuite;
import com.testharness.fixtures.dep.GreetingHelper;
import com.testharness.loader.IsolatedModuleLoader;
import com.testharness.loader.ModuleContext;
import com.testharness.support.ModuleJarBuilder;
import com.testharness.support.TempDirs;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.lang.reflect.Method;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for annotation-name discovery over real module JARs.
 */
public class TestDiscovererTest {

    private Path dir;
    private TestDiscoverer discoverer;

    @BeforeMethod
    public void setUp() {
        dir = TempDirs.create("test-discoverer");
        discoverer = new TestDiscoverer();
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() throws IOException {
        TempDirs.delete(dir);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Marker matching
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void discoversEveryMarkedMethod_inStableOrder() throws Exception {
        Path jar = ModuleJarBuilder.at(dir.resolve("Sample.Tests.jar")).with(SampleSuite.class).build();

        try (ModuleContext context = new IsolatedModuleLoader().load(jar)) {
            List<DiscoveredTest> tests = discoverer.discover(context);

            assertThat(tests).extracting(DiscoveredTest::testName).containsExactly(
                "asyncFails", "asyncPasses", "failsWithAssertion", "parameterized",
                "passes", "privatePasses", "staticPasses", "throwsUnchecked");
            assertThat(tests).extracting(DiscoveredTest::family).containsOnly(MarkerFamily.TESTNG);
            assertThat(tests).extracting(DiscoveredTest::className).containsOnly(SampleSuite.class.getName());
        }
    }

    @Test
    public void unmarkedMethods_areNotDiscovered() throws Exception {
        Path jar = ModuleJarBuilder.at(dir.resolve("Sample.Tests.jar")).with(SampleSuite.class).build();

        try (ModuleContext context = new IsolatedModuleLoader().load(jar)) {
            assertThat(discoverer.discover(context)).extracting(DiscoveredTest::testName)
                .doesNotContain("notATest");
        }
    }

    @Test
    public void discoveredTypes_belongToTheModuleContext() throws Exception {
        Path jar = ModuleJarBuilder.at(dir.resolve("Sample.Tests.jar")).with(SampleSuite.class).build();

        try (ModuleContext context = new IsolatedModuleLoader().load(jar)) {
            List<DiscoveredTest> tests = discoverer.discover(context);

            assertThat(tests).isNotEmpty();
            assertThat(tests).allSatisfy(t -> {
                assertThat(t.declaringType().getClassLoader()).isSameAs(context);
                assertThat(t.module()).isEqualTo(context.getModulePath());
            });
        }
    }

    @Test
    public void methodWithTwoMarkers_isDiscoveredOnce_withHigherPriorityFamily() throws Exception {
        Path jar = ModuleJarBuilder.at(dir.resolve("Jupiter.Tests.jar")).with(JupiterStyleSuite.class).build();

        try (ModuleContext context = new IsolatedModuleLoader().load(jar)) {
            List<DiscoveredTest> tests = discoverer.discover(context);

            assertThat(tests).extracting(DiscoveredTest::testName)
                .containsExactly("adds", "markedTwice", "subtractsWrong");
            DiscoveredTest twice = tests.get(1);
            assertThat(twice.family()).isEqualTo(MarkerFamily.JUNIT_JUPITER);
            assertThat(twice.marker()).isEqualTo("org.junit.jupiter.api.Test");
        }
    }

    @Test
    public void typesAreOrderedByName() throws Exception {
        Path jar = ModuleJarBuilder.at(dir.resolve("Mixed.Tests.jar"))
            .with(UninstantiableSuite.class, SampleSuite.class)
            .build();

        try (ModuleContext context = new IsolatedModuleLoader().load(jar)) {
            List<DiscoveredTest> tests = discoverer.discover(context);

            assertThat(tests.get(0).className()).isEqualTo(SampleSuite.class.getName());
            assertThat(tests.get(tests.size() - 1).className()).isEqualTo(UninstantiableSuite.class.getName());
        }
    }

    @Test
    public void moduleWithoutMarkers_yieldsEmptyList() throws Exception {
        Path jar = ModuleJarBuilder.at(dir.resolve("Helpers.Tests.jar")).with(GreetingHelper.class).build();

        try (ModuleContext context = new IsolatedModuleLoader().load(jar)) {
            assertThat(discoverer.discover(context)).isEmpty();
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // Class hierarchies
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void inheritedTests_areReportedUnderTheConcreteType() throws Exception {
        Path jar = ModuleJarBuilder.at(dir.resolve("Hierarchy.Tests.jar"))
            .with(AbstractBaseSuite.class, ConcreteSuite.class)
            .build();

        try (ModuleContext context = new IsolatedModuleLoader().load(jar)) {
            List<DiscoveredTest> tests = discoverer.discover(context);

            assertThat(tests).extracting(DiscoveredTest::testName)
                .containsExactly("inherited", "overridden", "own");
            assertThat(tests).extracting(DiscoveredTest::className).containsOnly(ConcreteSuite.class.getName());
            assertThat(tests.get(0).method().getDeclaringClass().getName()).isEqualTo(AbstractBaseSuite.class.getName());
            assertThat(tests.get(1).method().getDeclaringClass().getName()).isEqualTo(ConcreteSuite.class.getName());
        }
    }

    @Test
    public void typeWhoseSuperclassIsMissing_isSkipped_othersStillDiscovered() throws Exception {
        Path jar = ModuleJarBuilder.at(dir.resolve("Partial.Tests.jar"))
            .with(OrphanedSuite.class, SampleSuite.class)
            .build();
        IsolatedModuleLoader moduleOnly = new IsolatedModuleLoader(ClassLoader.getPlatformClassLoader(), List.of());

        try (ModuleContext context = moduleOnly.load(jar)) {
            List<DiscoveredTest> tests = discoverer.discover(context);

            assertThat(tests).isNotEmpty();
            assertThat(tests).extracting(DiscoveredTest::className).containsOnly(SampleSuite.class.getName());
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // Signature keys
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void signatureKey_usesBinaryParameterTypeNames() throws Exception {
        Method noArgs = SampleSuite.class.getDeclaredMethod("passes");
        Method withInt = SampleSuite.class.getDeclaredMethod("parameterized", int.class);

        assertThat(TestDiscoverer.signatureKey(noArgs)).isEqualTo("passes()");
        assertThat(TestDiscoverer.signatureKey(withInt)).isEqualTo("parameterized(int)");
    }

    @Test
    public void markerFamily_priorityOrder() {
        assertThat(MarkerFamily.allMarkers()).containsExactly(
            "org.junit.jupiter.api.Test",
            "org.junit.jupiter.params.ParameterizedTest",
            "org.junit.Test",
            "org.testng.annotations.Test");
        assertThat(MarkerFamily.forMarker("org.junit.Test")).contains(MarkerFamily.JUNIT4);
        assertThat(MarkerFamily.forMarker("org.example.NotAMarker")).isEmpty();
    }
}
