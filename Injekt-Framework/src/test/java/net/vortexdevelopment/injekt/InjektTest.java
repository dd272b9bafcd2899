package net.vortexdevelopment.injekt;

import net.vortexdevelopment.injekt.annotation.Injectable;
import net.vortexdevelopment.injekt.di.DependencyContainer;
import net.vortexdevelopment.injekt.di.SuppliedArguments;
import net.vortexdevelopment.injekt.di.UnresolvableAbstractTypeException;
import net.vortexdevelopment.injekt.testing.TestInjektContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests through the static entry point and the shared container.
 */
class InjektTest {

    @BeforeEach
    void resetBefore() {
        Injekt.reset();
    }

    @AfterEach
    void resetAfter() {
        Injekt.reset();
    }

    @Test
    void groupServiceReceivesSharedPersonService() {
        GroupService groupService = Injekt.construct(GroupService.class);

        assertThat(groupService.describe()).isEqualTo("Group with John Doe");
        assertThat(Injekt.construct(GroupService.class)).isSameAs(groupService);
        assertThat(Injekt.construct(PersonService.class)).isSameAs(groupService.personService);
    }

    @Test
    void resetDetachesPreviousInstances() {
        PersonService before = Injekt.construct(PersonService.class);

        Injekt.reset();

        assertThat(Injekt.getDependencyOrNull(PersonService.class)).isNull();
        assertThat(Injekt.construct(PersonService.class)).isNotSameAs(before);
    }

    @Test
    void facadeUsesTheProcessWideContainer() {
        PersonService person = Injekt.construct(PersonService.class);

        assertThat(DependencyContainer.getInstance().getDependency(PersonService.class)).isSameAs(person);
        assertThat(DependencyContainer.getInstance()).isSameAs(DependencyContainer.getInstance());
    }

    @Test
    void mockDependencyCanBeSupplied() {
        RecordingLogger logger = new RecordingLogger();

        AuditService service = Injekt.construct(AuditService.class, SuppliedArguments.named("logger", logger));

        assertThat(service.doSomething()).isTrue();
        assertThat(logger.messages).containsExactly("Something was done");
        assertThat(Injekt.getDependencyOrNull(AuditLogger.class)).isNull();
        assertThat(Injekt.getDependencyOrNull(RecordingLogger.class)).isNull();
    }

    @Test
    void markedImplementationIsInjected() {
        try (TestInjektContext context = TestInjektContext.builder()
                .withInjectables(ConsoleLogger.class)
                .build()) {

            AuditService service = context.getComponent(AuditService.class);

            assertThat(service.logger).isInstanceOf(ConsoleLogger.class);
            assertThat(context.getComponent(ConsoleLogger.class)).isSameAs(service.logger);
        }
    }

    @Test
    void unknownImplementationFails() {
        try (TestInjektContext context = TestInjektContext.builder().build()) {
            assertThatThrownBy(() -> context.getComponent(PaymentService.class))
                    .isInstanceOf(UnresolvableAbstractTypeException.class)
                    .hasMessageContaining(PaymentGateway.class.getName());
        }
    }

    @Test
    void contextResetsOnClose() {
        PersonService person;
        try (TestInjektContext context = TestInjektContext.builder().build()) {
            person = context.getComponent(PersonService.class);
            assertThat(context.getRepository().getDependencyOrNull(PersonService.class)).isSameAs(person);
        }

        assertThat(Injekt.getDependencyOrNull(PersonService.class)).isNull();
    }

    @Test
    void markInjectableIsIdempotent() {
        Injekt.markInjectable(ConsoleLogger.class);
        Injekt.markInjectable(ConsoleLogger.class);

        assertThat(DependencyContainer.getInstance().getImplementerIndex().getSubtypes(AuditLogger.class))
                .containsOnlyOnce(ConsoleLogger.class);
    }

    // Test components

    @Injectable
    static class PersonService {
        String getPersonName() {
            return "John Doe";
        }
    }

    @Injectable
    static class GroupService {
        final PersonService personService;

        GroupService(PersonService personService) {
            this.personService = personService;
        }

        String describe() {
            return "Group with " + personService.getPersonName();
        }
    }

    interface AuditLogger {
        void log(String message);
    }

    static class ConsoleLogger implements AuditLogger {
        @Override
        public void log(String message) {
        }
    }

    static class RecordingLogger implements AuditLogger {
        final List<String> messages = new ArrayList<>();

        @Override
        public void log(String message) {
            messages.add(message);
        }
    }

    @Injectable
    static class AuditService {
        final AuditLogger logger;

        AuditService(AuditLogger logger) {
            this.logger = logger;
        }

        boolean doSomething() {
            logger.log("Something was done");
            return true;
        }
    }

    interface PaymentGateway {
    }

    static class PaymentService {
        PaymentService(PaymentGateway gateway) {
        }
    }
}
