package net.vortexdevelopment.injekt.di.scan;

import lombok.Getter;
import net.vortexdevelopment.injekt.annotation.Injectable;
import org.jetbrains.annotations.NotNull;
import org.reflections.Configuration;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Scans a set of packages for injectable classes and for the subtypes of a given type.
 * Results are sorted by class name so that repeated scans return the same order.
 */
public class ClasspathScanner {

    @Getter
    private final List<String> packages;

    private final Reflections reflections;

    public ClasspathScanner(String... packages) {
        if (packages.length == 0) {
            throw new IllegalArgumentException("At least one package must be given to scan");
        }
        this.packages = Arrays.asList(packages);
        this.reflections = new Reflections(createConfiguration(this.packages));
    }

    /**
     * Create the Reflections configuration restricted to the classes under the given packages.
     */
    public static Configuration createConfiguration(List<String> packages) {
        List<String> packagePaths = packages.stream()
                .map(packageName -> packageName.replace('.', '/') + "/")
                .collect(Collectors.toList());

        return new ConfigurationBuilder()
                .forPackages(packages.toArray(new String[0]))
                .setScanners(Scanners.SubTypes, Scanners.TypesAnnotated)
                .filterInputsBy(s -> {
                    if (s == null) return false;
                    if (s.startsWith("META-INF")) return false;
                    if (!s.endsWith(".class")) return false;

                    for (String packagePath : packagePaths) {
                        if (s.startsWith(packagePath)) {
                            return true;
                        }
                    }
                    return false;
                });
    }

    /**
     * Classes directly annotated with {@link Injectable}.
     */
    @NotNull
    public List<Class<?>> getInjectableTypes() {
        return reflections.getTypesAnnotatedWith(Injectable.class).stream()
                .filter(type -> type.isAnnotationPresent(Injectable.class))
                .sorted(Comparator.comparing(Class::getName))
                .collect(Collectors.toList());
    }

    /**
     * All scanned subtypes of the given type, excluding the type itself. Anonymous, local and
     * synthetic classes are left out, they are never candidates for injection.
     */
    @NotNull
    public List<Class<?>> getSubTypesOf(@NotNull Class<?> type) {
        List<Class<?>> subtypes = new ArrayList<>(reflections.getSubTypesOf(type));
        subtypes.removeIf(subtype -> subtype == type
                || subtype.isAnonymousClass()
                || subtype.isLocalClass()
                || subtype.isSynthetic());
        subtypes.sort(Comparator.comparing(Class::getName));
        return subtypes;
    }
}
