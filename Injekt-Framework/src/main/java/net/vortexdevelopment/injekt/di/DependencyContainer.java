package net.vortexdevelopment.injekt.di;

import lombok.Getter;
import net.vortexdevelopment.injekt.annotation.Injectable;
import net.vortexdevelopment.injekt.config.Environment;
import net.vortexdevelopment.injekt.debug.DebugLogger;
import net.vortexdevelopment.injekt.di.descriptor.ConstructorDescriptor;
import net.vortexdevelopment.injekt.di.descriptor.ConstructorDescriptorFactory;
import net.vortexdevelopment.injekt.di.engine.InjectionEngine;
import net.vortexdevelopment.injekt.di.engine.TypeResolver;
import net.vortexdevelopment.injekt.di.scan.ClasspathScanner;
import net.vortexdevelopment.injekt.di.scan.ImplementerIndex;
import net.vortexdevelopment.injekt.di.utils.DependencyUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Getter
public class DependencyContainer implements DependencyRepository {

    private static DependencyContainer instance;

    private final InstanceRegistry registry;
    private final ImplementerIndex implementerIndex;
    private final ConstructorDescriptorFactory descriptorFactory;
    private final List<ClasspathScanner> scanners;
    private final TypeResolver typeResolver;
    private final InjectionEngine injectionEngine;
    private final Set<Class<?>> injectableTypes;
    private final Set<String> scannedPackages;

    public DependencyContainer() {
        registry = new InstanceRegistry();
        implementerIndex = new ImplementerIndex();
        descriptorFactory = new ConstructorDescriptorFactory();
        scanners = new CopyOnWriteArrayList<>();
        injectableTypes = ConcurrentHashMap.newKeySet();
        scannedPackages = ConcurrentHashMap.newKeySet();
        typeResolver = new TypeResolver(this);
        injectionEngine = new InjectionEngine(typeResolver);

        List<String> packages = Environment.getInstance().getPropertyAsList(Environment.SCAN_PACKAGES);
        if (!packages.isEmpty()) {
            scanPackages(packages.toArray(new String[0]));
        }
    }

    /**
     * The process-wide container, created on first use.
     */
    public static synchronized @NotNull DependencyContainer getInstance() {
        if (instance == null) {
            instance = new DependencyContainer();
        }
        return instance;
    }

    @Override
    public void markInjectable(@NotNull Class<?> type) {
        if (!injectableTypes.add(type)) {
            return;
        }
        implementerIndex.register(type);
        DebugLogger.enableFromAnnotations(type);
        DebugLogger.log("Marked %s as injectable", type.getName());
    }

    @Override
    public boolean isInjectable(@NotNull Class<?> type) {
        return injectableTypes.contains(type) || type.isAnnotationPresent(Injectable.class);
    }

    @Override
    public <T> @NotNull T construct(@NotNull Class<T> type) {
        return construct(type, SuppliedArguments.none());
    }

    @Override
    public <T> @NotNull T construct(@NotNull Class<T> type, @NotNull SuppliedArguments arguments) {
        if (!DependencyUtils.isConcrete(type)) {
            if (!arguments.isEmpty()) {
                throw new IllegalArgumentException("Arguments cannot be supplied for abstract type: " + type.getName());
            }
            return type.cast(typeResolver.resolve(type));
        }

        // Types reached as dependencies become singletons even when nobody marked them
        markInjectable(type);
        return registry.computeIfAbsent(type, clazz -> {
            ConstructorDescriptor<T> descriptor = descriptorFactory.describe(clazz);
            Object[] values = injectionEngine.resolveArguments(descriptor, arguments);
            T created = descriptor.instantiate(values);
            DebugLogger.log("Constructed %s", clazz.getName());
            return created;
        });
    }

    @Override
    public <T> @NotNull T getDependency(@NotNull Class<T> dependency) {
        T result = registry.get(dependency);
        if (result == null) {
            throw new RuntimeException("Dependency not found for class: " + dependency.getName());
        }
        return result;
    }

    @Override
    public <T> @Nullable T getDependencyOrNull(@NotNull Class<T> dependency) {
        return registry.get(dependency);
    }

    @Override
    public void registerDescriptor(@NotNull ConstructorDescriptor<?> descriptor) {
        descriptorFactory.register(descriptor);
    }

    @Override
    public void scanPackages(@NotNull String... packages) {
        ClasspathScanner scanner = new ClasspathScanner(packages);
        scanners.add(scanner);
        scannedPackages.addAll(scanner.getPackages());
        for (Class<?> type : scanner.getInjectableTypes()) {
            markInjectable(type);
        }
        DebugLogger.log("Scanned packages %s", scanner.getPackages());
    }

    /**
     * Mark the {@link Injectable} classes found in the packages of the given types. Each package
     * is looked at once per container, and only packages on the class path are considered.
     *
     * @param types The types whose packages should be searched, null entries are skipped
     * @return true if at least one package was searched
     */
    public boolean discoverInjectables(@Nullable Class<?>... types) {
        List<String> packages = new ArrayList<>();
        for (Class<?> type : types) {
            if (type == null || type.getModule().isNamed()) {
                continue;
            }
            String packageName = type.getPackageName();
            if (!packageName.isEmpty() && scannedPackages.add(packageName)) {
                packages.add(packageName);
            }
        }
        if (packages.isEmpty()) {
            return false;
        }

        ClasspathScanner scanner = new ClasspathScanner(packages.toArray(new String[0]));
        for (Class<?> type : scanner.getInjectableTypes()) {
            markInjectable(type);
        }
        DebugLogger.log("Discovered injectable types in packages %s", packages);
        return true;
    }

    @Override
    public void reset() {
        int size = registry.size();
        registry.clear();
        DebugLogger.log("Reset registry, dropped %d instances", size);
    }
}
