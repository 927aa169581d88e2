package de.t14d3.dbexecutor.mapping;

import de.t14d3.dbexecutor.annotations.Entity;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class MappingScanner {
    private static final Logger LOG = LoggerFactory.getLogger(MappingScanner.class);

    /**
     * Scans the classpath for all @Entity types under the base package and registers them.
     * Invalid mappings fail here rather than on first use.
     *
     * @return the registered types, sorted by name
     */
    public static List<Class<?>> scan(String basePackage, MappingRegistry registry) {
        Reflections reflections = new Reflections(
                new ConfigurationBuilder()
                        .setUrls(ClasspathHelper.forPackage(basePackage))
                        .filterInputsBy(new FilterBuilder().includePackage(basePackage))
                        .setScanners(Scanners.TypesAnnotated)
        );
        Set<Class<?>> entities = reflections.getTypesAnnotatedWith(Entity.class);

        List<Class<?>> sorted = entities.stream()
                .sorted(Comparator.comparing(Class::getName))
                .collect(Collectors.toList());
        for (Class<?> cls : sorted) {
            registry.register(cls);
        }

        LOG.info("Registered {} mapped type(s) from package {}", sorted.size(), basePackage);
        return sorted;
    }
}
