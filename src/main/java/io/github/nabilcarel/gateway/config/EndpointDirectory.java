package io.github.nabilcarel.gateway.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.nabilcarel.gateway.exception.EndpointLoadException;
import io.github.nabilcarel.gateway.model.EndpointDefinition;
import io.github.nabilcarel.gateway.model.EndpointEntity;
import io.github.nabilcarel.gateway.model.EndpointType;
import io.github.nabilcarel.gateway.model.composite.CompositeDefinition;
import io.github.nabilcarel.gateway.service.CompositeDefinitionValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves logical endpoint names to their definitions. Definitions are read from
 * {@code <endpoints-directory>/<Name>/entity.json}; names are matched case-insensitively.
 */
@Component
@Slf4j
public class EndpointDirectory implements ApplicationListener<ApplicationReadyEvent> {

    public static final String ENTITY_FILE = "entity.json";

    private final GatewayProperties properties;
    private final CompositeDefinitionValidator compositeValidator;
    private final ObjectMapper definitionMapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private volatile Map<String, EndpointDefinition> endpoints = Collections.emptyMap();

    public EndpointDirectory(GatewayProperties properties, CompositeDefinitionValidator compositeValidator) {
        this.properties = properties;
        this.compositeValidator = compositeValidator;
    }

    @Override
    public void onApplicationEvent(@NonNull ApplicationReadyEvent event) {
        reload();
    }

    public Optional<EndpointDefinition> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(endpoints.get(name));
    }

    /**
     * Endpoints callers may address directly, private ones excluded.
     */
    public List<EndpointDefinition> getAvailableEndpoints() {
        return endpoints.values().stream()
                .filter(endpoint -> !endpoint.isPrivate())
                .collect(Collectors.toList());
    }

    public Collection<EndpointDefinition> getAllEndpoints() {
        return endpoints.values();
    }

    public int size() {
        return endpoints.size();
    }

    /**
     * Re-reads every definition and replaces the current set in one step. Files that
     * cannot be parsed or composites that fail validation are skipped.
     */
    public synchronized int reload() {
        Path root = Paths.get(properties.getEndpointsDirectory());
        if (!Files.isDirectory(root)) {
            log.warn("Endpoints directory {} does not exist, no endpoints loaded", root.toAbsolutePath());
            endpoints = Collections.emptyMap();
            return 0;
        }

        Map<String, EndpointDefinition> loaded = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        try (Stream<Path> files = Files.walk(root)) {
            files.filter(file -> ENTITY_FILE.equalsIgnoreCase(file.getFileName().toString()))
                    .sorted()
                    .forEach(file -> load(file).ifPresent(endpoint -> {
                        if (loaded.putIfAbsent(endpoint.getName(), endpoint) != null) {
                            log.error("Duplicate endpoint name {} in {}, keeping the first definition",
                                    endpoint.getName(), file);
                        }
                    }));
        } catch (IOException e) {
            throw new EndpointLoadException("Failed to read endpoints directory " + root.toAbsolutePath(), e);
        }

        endpoints = Collections.unmodifiableMap(loaded);
        log.info("Loaded {} endpoints from {}", loaded.size(), root.toAbsolutePath());
        return loaded.size();
    }

    private Optional<EndpointDefinition> load(Path file) {
        Path parent = file.getParent();
        String name = parent == null ? null : parent.getFileName().toString();
        try {
            EndpointEntity entity = definitionMapper.readValue(file.toFile(), EndpointEntity.class);
            return toDefinition(name, entity, file);
        } catch (IOException e) {
            log.error("Skipping endpoint {}: cannot parse {}: {}", name, file, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<EndpointDefinition> toDefinition(String name, EndpointEntity entity, Path file) {
        CompositeDefinition composite = entity.getCompositeConfig();
        EndpointType type = entity.getType();
        if (type == null) {
            type = composite != null ? EndpointType.COMPOSITE
                    : entity.isPrivateEndpoint() ? EndpointType.PRIVATE : EndpointType.STANDARD;
        }

        if (type == EndpointType.COMPOSITE) {
            if (composite == null) {
                log.error("Skipping composite endpoint {}: no compositeConfig in {}", name, file);
                return Optional.empty();
            }
            if (!StringUtils.hasText(composite.getName())) {
                composite.setName(name);
            }
            List<String> errors = compositeValidator.validate(composite);
            if (!errors.isEmpty()) {
                log.error("Skipping composite endpoint {}: {}", name, errors);
                return Optional.empty();
            }
        } else if (!StringUtils.hasText(entity.getUrl())) {
            log.error("Skipping endpoint {}: no url in {}", name, file);
            return Optional.empty();
        }

        Set<String> methods = entity.getMethods() == null ? new LinkedHashSet<>() : entity.getMethods().stream()
                .map(String::toUpperCase)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (methods.isEmpty()) {
            methods.add(type == EndpointType.COMPOSITE ? "POST" : "GET");
        }

        EndpointDefinition definition = EndpointDefinition.builder()
                .name(name)
                .url(entity.getUrl())
                .allowedMethods(Collections.unmodifiableSet(methods))
                .type(type)
                .isPrivate(type == EndpointType.PRIVATE || entity.isPrivateEndpoint())
                .allowedEnvironments(entity.getAllowedEnvironments() == null ? Set.of()
                        : Set.copyOf(entity.getAllowedEnvironments()))
                .compositeConfig(type == EndpointType.COMPOSITE ? composite : null)
                .cacheDuration(entity.getCacheDurationSeconds() == null ? null
                        : Duration.ofSeconds(entity.getCacheDurationSeconds()))
                .build();
        log.debug("Registered endpoint {}", definition);
        return Optional.of(definition);
    }
}
