package com.belgraph.compiler.definition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** Remote locations are served only when registered; nothing is fetched over the network. */
@Component
public class ResourceDefinitionResolver implements DefinitionResolver {
    private static final Logger log = LoggerFactory.getLogger(ResourceDefinitionResolver.class);

    private final ResourceLoader resourceLoader;
    private final boolean cacheEnabled;
    private final Map<String, Set<String>> registered = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> cache = new ConcurrentHashMap<>();

    public ResourceDefinitionResolver(ResourceLoader resourceLoader,
                                      @Value("${bel.compiler.definitions.cache-enabled:true}") boolean cacheEnabled) {
        this.resourceLoader = resourceLoader;
        this.cacheEnabled = cacheEnabled;
    }

    public static ResourceDefinitionResolver standalone() {
        return new ResourceDefinitionResolver(new DefaultResourceLoader(), true);
    }

    public void register(String location, Collection<String> values) {
        registered.put(location, Set.copyOf(values));
    }

    @Override
    public Set<String> resolve(String location) {
        Set<String> values = registered.get(location);
        if (values != null) return values;
        if (!cacheEnabled) return load(location);
        return cache.computeIfAbsent(location, this::load);
    }

    private Set<String> load(String location) {
        if (location.startsWith("http://") || location.startsWith("https://") || location.startsWith("ftp://")) {
            throw new DefinitionResolutionException(location, "remote definition not registered: " + location);
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new DefinitionResolutionException(location, "definition resource not found: " + location);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            Set<String> values = parseValues(reader.lines().toList(), location);
            log.debug("Loaded {} values from {}", values.size(), location);
            return values;
        } catch (IOException e) {
            throw new DefinitionResolutionException(location, "cannot read definition " + location, e);
        }
    }

    static Set<String> parseValues(List<String> lines, String location) {
        Set<String> values = new LinkedHashSet<>();
        boolean inValues = false;
        boolean sawValues = false;
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("[") && line.endsWith("]")) {
                inValues = line.equals("[Values]");
                sawValues |= inValues;
                continue;
            }
            if (!inValues) continue;
            int bar = line.indexOf('|');
            String value = (bar < 0 ? line : line.substring(0, bar)).strip();
            if (!value.isEmpty()) values.add(value);
        }
        if (!sawValues) {
            throw new DefinitionResolutionException(location, "no [Values] section in " + location);
        }
        return Collections.unmodifiableSet(values);
    }
}
