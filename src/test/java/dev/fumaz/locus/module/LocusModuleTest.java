package dev.fumaz.locus.module;

import dev.fumaz.locus.bind.Lifetime;
import dev.fumaz.locus.container.Container;
import dev.fumaz.locus.exception.NotExistException;
import dev.fumaz.locus.exception.ValidationException;
import dev.fumaz.locus.invoke.Invocable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocusModuleTest {

    interface Repository {
        String find();
    }

    static class MemoryRepository implements Repository {
        private final String value;

        MemoryRepository(String value) {
            this.value = value;
        }

        @Override
        public String find() {
            return value;
        }
    }

    static class Report {
        private final Repository repository;
        private final Map<String, Repository> mirrors;

        Report(Repository repository, Map<String, Repository> mirrors) {
            this.repository = repository;
            this.mirrors = mirrors;
        }
    }

    static void produceNothing() {
    }

    static class StorageModule extends LocusModule {
        @Override
        protected void configure() {
            bind(String.class).toInstance("primary");
            bind(Repository.class).asStatic().toConstructor(MemoryRepository.class);
            bind(Repository.class).named("east").toInstance(new MemoryRepository("east"));
            bind(Repository.class).named("west").toFactory(resolver -> new MemoryRepository("west"));
        }
    }

    static class ReportModule extends LocusModule {
        @Override
        protected void configure() {
            install(new StorageModule());
            bind(Report.class).lifetime(Lifetime.PER_REQUEST).toConstructor(Report.class);
        }
    }

    @Test
    void installsRegistrationsOfModule() {
        Container container = Container.create();
        container.install(new StorageModule());

        Repository repository = container.resolve(Repository.class);

        assertEquals("primary", repository.find());
        assertSame(repository, container.resolve(Repository.class));
        assertEquals("east", container.resolveByName(Repository.class, "east").find());
        assertEquals(List.of("east", "west"), List.copyOf(container.resolveMap(Repository.class).keySet()));
    }

    @Test
    void installsNestedModules() {
        Container container = Container.create();
        container.install(new ReportModule());

        Report first = container.resolve(Report.class);
        Report second = container.resolve(Report.class);

        assertNotSame(first, second);
        assertSame(first.repository, second.repository);
        assertEquals(2, first.mirrors.size());
    }

    @Test
    void moduleCannotInstallItself() {
        LocusModule module = new LocusModule() {
            @Override
            protected void configure() {
                install(this);
            }
        };

        assertThrows(IllegalArgumentException.class, () -> Container.create().install(module));
    }

    @Test
    void bindingOutsideConfigureFails() {
        StorageModule module = new StorageModule();

        assertThrows(IllegalStateException.class, () -> module.bind(String.class));
    }

    @Test
    void replacingBuilderDropsEarlierRegistrations() {
        Container container = Container.create();
        container.install(new StorageModule());

        container.bind(Repository.class).replacing().toInstance(new MemoryRepository("replacement"));

        assertEquals(1, container.resolveAll(Repository.class).size());
        assertTrue(container.resolveMap(Repository.class).isEmpty());
        assertEquals("replacement", container.resolve(Repository.class).find());
    }

    @Test
    void replacingConstructorDropsEarlierRegistrations() {
        Container container = Container.create();
        container.install(new StorageModule());
        container.bind(String.class).replacing().toInstance("rebuilt");

        container.bind(Repository.class).replacing().toConstructor(MemoryRepository.class);

        assertEquals("rebuilt", container.resolve(Repository.class).find());
        assertEquals(1, container.resolveAll(Repository.class).size());
    }

    @Test
    void rejectedReplacementKeepsEarlierRegistrations() throws Exception {
        Container container = Container.create();
        container.install(new StorageModule());
        Invocable nothing = Invocable.of(LocusModuleTest.class.getDeclaredMethod("produceNothing"));
        Invocable report = Invocable.constructorOf(Report.class);

        assertThrows(ValidationException.class, () -> container.bind(Repository.class).replacing().toConstructor(nothing));
        assertThrows(ValidationException.class, () -> container.bind(Repository.class).replacing().toConstructor(report));

        assertEquals("primary", container.resolve(Repository.class).find());
        assertEquals(3, container.resolveAll(Repository.class).size());
    }

    @Test
    void lambdaModulesWork() {
        Container container = Container.create();
        container.install(target -> target.registerInstance(String.class, "from lambda"));

        assertEquals("from lambda", container.resolve(String.class));
        assertThrows(NotExistException.class, () -> container.resolve(Repository.class));
    }
}
