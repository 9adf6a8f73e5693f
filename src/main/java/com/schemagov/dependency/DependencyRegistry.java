package com.schemagov.dependency;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Source of truth for which services consume which schema targets. Keeps a forward index
 * (target to dependents) and a backward index (service to the targets it consumes) in step on every write.
 */
public class DependencyRegistry {
    private static final Logger log = LoggerFactory.getLogger(DependencyRegistry.class);

    private final Path registryPath;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, List<ServiceDependency>> dependentsByTarget = new LinkedHashMap<>();
    private final Map<String, Set<String>> targetsByService = new LinkedHashMap<>();
    private final Map<String, ServiceInfo> services = new LinkedHashMap<>();

    public DependencyRegistry() {
        this(null, Clock.systemUTC());
    }

    public DependencyRegistry(Path registryPath) throws IOException {
        this(registryPath, Clock.systemUTC());
        load();
    }

    DependencyRegistry(Path registryPath, Clock clock) {
        this.registryPath = registryPath;
        this.clock = clock;
    }

    public void registerServiceDependency(String target, ServiceDependency dependency) throws IOException {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(dependency, "dependency");
        ServiceDependency stamped = dependency.registeredAt() == null ? dependency.withRegisteredAt(clock.instant()) : dependency;

        lock.writeLock().lock();
        try {
            List<ServiceDependency> dependents = dependentsByTarget.computeIfAbsent(target, ignored -> new ArrayList<>());
            int existing = indexOf(dependents, stamped.serviceName());
            if (existing >= 0) {
                dependents.set(existing, stamped);
            } else {
                dependents.add(stamped);
            }
            targetsByService.computeIfAbsent(stamped.serviceName(), ignored -> new LinkedHashSet<>()).add(target);
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("registry.dependency_registered target={} service={} strength={} team={}",
                target, stamped.serviceName(), stamped.strength().value(), stamped.owningTeam());
    }

    public void registerService(ServiceInfo service) throws IOException {
        Objects.requireNonNull(service, "service");
        lock.writeLock().lock();
        try {
            services.put(service.serviceName(), service);
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("registry.service_registered service={} system={}", service.serviceName(), service.system());
    }

    public List<ServiceDependency> dependentsOf(String target) {
        lock.readLock().lock();
        try {
            return List.copyOf(dependentsByTarget.getOrDefault(target, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Targets the given service has been registered against, in registration order.
     */
    public List<String> targetsConsumedBy(String serviceName) {
        lock.readLock().lock();
        try {
            return List.copyOf(targetsByService.getOrDefault(serviceName, Set.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ServiceDependency> findDependency(String target, String serviceName) {
        return dependentsOf(target).stream()
                .filter(dependency -> dependency.serviceName().equals(serviceName))
                .findFirst();
    }

    public ServiceDependency requireDependency(String target, String serviceName) {
        return findDependency(target, serviceName)
                .orElseThrow(() -> new DependencyAnalysisException(
                        "Service " + serviceName + " is not registered as a dependent of " + target));
    }

    public Optional<ServiceInfo> serviceInfo(String serviceName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(services.get(serviceName));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> registeredTargets() {
        lock.readLock().lock();
        try {
            return List.copyOf(dependentsByTarget.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void load() throws IOException {
        if (registryPath == null || !Files.exists(registryPath) || Files.size(registryPath) == 0) {
            return;
        }
        RegistryDocument document = mapper.readValue(registryPath.toFile(), RegistryDocument.class);
        lock.writeLock().lock();
        try {
            document.dependencies().forEach((target, dependents) -> {
                dependentsByTarget.put(target, new ArrayList<>(dependents));
                for (ServiceDependency dependency : dependents) {
                    targetsByService.computeIfAbsent(dependency.serviceName(), ignored -> new LinkedHashSet<>()).add(target);
                }
            });
            services.putAll(document.services());
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("registry.loaded path={} targets={} services={}", registryPath, dependentsByTarget.size(), services.size());
    }

    private void persist() throws IOException {
        if (registryPath == null) {
            return;
        }
        if (registryPath.getParent() != null) {
            Files.createDirectories(registryPath.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(registryPath.toFile(),
                new RegistryDocument(dependentsByTarget, services));
    }

    private static int indexOf(List<ServiceDependency> dependents, String serviceName) {
        for (int i = 0; i < dependents.size(); i++) {
            if (dependents.get(i).serviceName().equals(serviceName)) {
                return i;
            }
        }
        return -1;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RegistryDocument(Map<String, List<ServiceDependency>> dependencies, Map<String, ServiceInfo> services) {
        RegistryDocument {
            dependencies = dependencies == null ? Map.of() : dependencies;
            services = services == null ? Map.of() : services;
        }
    }
}
