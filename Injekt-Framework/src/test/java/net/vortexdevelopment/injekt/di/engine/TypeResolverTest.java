package net.vortexdevelopment.injekt.di.engine;

import net.vortexdevelopment.injekt.di.DependencyContainer;
import net.vortexdevelopment.injekt.di.UnresolvableAbstractTypeException;
import net.vortexdevelopment.injekt.di.scan.fixtures.AbstractCache;
import net.vortexdevelopment.injekt.di.scan.fixtures.ArchiveStorage;
import net.vortexdevelopment.injekt.di.scan.fixtures.FileStorage;
import net.vortexdevelopment.injekt.di.scan.fixtures.LocalCache;
import net.vortexdevelopment.injekt.di.scan.fixtures.Notifier;
import net.vortexdevelopment.injekt.di.scan.fixtures.Storage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the order in which a required type is resolved.
 */
class TypeResolverTest {

    private DependencyContainer container;
    private TypeResolver resolver;

    @BeforeEach
    void setUp() {
        container = new DependencyContainer();
        resolver = container.getTypeResolver();
    }

    @Test
    void exactRegistrationWinsOverEverythingElse() {
        container.markInjectable(PostgresStore.class);
        InMemoryStore registered = new InMemoryStore();
        container.getRegistry().put(Store.class, registered);

        assertThat(resolver.resolve(Store.class)).isSameAs(registered);
        assertThat(container.getDependencyOrNull(PostgresStore.class)).isNull();
    }

    @Test
    void registeredSubtypeIsReusedBeforeConstructingImplementer() {
        container.markInjectable(PostgresStore.class);
        container.markInjectable(InMemoryStore.class);
        InMemoryStore inMemory = container.construct(InMemoryStore.class);

        assertThat(resolver.resolve(Store.class)).isSameAs(inMemory);
        assertThat(container.getDependencyOrNull(PostgresStore.class)).isNull();
    }

    @Test
    void firstRegisteredSubtypeWins() {
        InMemoryStore inMemory = container.construct(InMemoryStore.class);
        PostgresStore postgres = container.construct(PostgresStore.class);

        assertThat(resolver.resolve(Store.class)).isSameAs(inMemory);
        assertThat(postgres).isNotNull();
    }

    @Test
    void firstMarkedImplementerWins() {
        container.markInjectable(PostgresStore.class);
        container.markInjectable(InMemoryStore.class);

        Object resolved = resolver.resolve(Store.class);

        assertThat(resolved).isInstanceOf(PostgresStore.class);
        assertThat(container.getDependency(PostgresStore.class)).isSameAs(resolved);
        assertThat(container.getDependencyOrNull(InMemoryStore.class)).isNull();
    }

    @Test
    void abstractSubtypesAreSkipped() {
        container.markInjectable(AbstractStore.class);
        container.markInjectable(InMemoryStore.class);

        assertThat(resolver.resolve(Store.class)).isInstanceOf(InMemoryStore.class);
    }

    @Test
    void implementerDependenciesAreResolvedRecursively() {
        container.markInjectable(PostgresStore.class);

        Object resolved = resolver.resolve(Store.class);

        assertThat(((PostgresStore) resolved).settings).isSameAs(container.getDependency(ConnectionSettings.class));
    }

    @Test
    void concreteTypeWithSubtypePrefersSubtype() {
        container.markInjectable(RetryingClient.class);

        assertThat(resolver.resolve(HttpClient.class)).isInstanceOf(RetryingClient.class);
    }

    @Test
    void concreteTypeWithoutSubtypesIsConstructed() {
        Object resolved = resolver.resolve(ConnectionSettings.class);

        assertThat(resolved).isInstanceOf(ConnectionSettings.class);
        assertThat(container.getDependency(ConnectionSettings.class)).isSameAs(resolved);
    }

    @Test
    void interfaceWithoutSubtypesFails() {
        assertThatThrownBy(() -> resolver.resolve(Store.class))
                .isInstanceOf(UnresolvableAbstractTypeException.class)
                .hasMessageContaining(Store.class.getName());
    }

    @Test
    void onlyAbstractSubtypesFails() {
        container.markInjectable(AbstractStore.class);

        assertThatThrownBy(() -> resolver.resolve(Store.class))
                .isInstanceOf(UnresolvableAbstractTypeException.class)
                .hasMessageContaining(Store.class.getName());
    }

    @Test
    void markedImplementersComeBeforeScannedOnes() {
        container.scanPackages("net.vortexdevelopment.injekt.di.scan.fixtures");
        container.markInjectable(ArchiveStorage.class);

        assertThat(resolver.getKnownSubtypes(Storage.class))
                .startsWith(FileStorage.class, ArchiveStorage.class)
                .doesNotHaveDuplicates();
    }

    @Test
    void scannedSubtypesAreOrderedByName() {
        container.scanPackages("net.vortexdevelopment.injekt.di.scan.fixtures");

        assertThat(resolver.resolve(AbstractCache.class)).isInstanceOf(LocalCache.class);
    }

    @Test
    void scannedAbstractOnlyHierarchyFails() {
        container.scanPackages("net.vortexdevelopment.injekt.di.scan.fixtures");

        assertThatThrownBy(() -> resolver.resolve(Notifier.class))
                .isInstanceOf(UnresolvableAbstractTypeException.class);
    }

    interface Store {
    }

    abstract static class AbstractStore implements Store {
    }

    static class ConnectionSettings {
    }

    static class PostgresStore implements Store {
        final ConnectionSettings settings;

        PostgresStore(ConnectionSettings settings) {
            this.settings = settings;
        }
    }

    static class InMemoryStore implements Store {
    }

    static class HttpClient {
    }

    static class RetryingClient extends HttpClient {
    }
}
