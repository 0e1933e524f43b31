package com.pmatic.ccu.client.catalog;

import com.google.common.collect.ImmutableSortedMap;
import com.pmatic.ccu.client.api.MethodDescriptor;
import com.pmatic.ccu.client.utils.NameTranslator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Methods offered by the CCU, keyed by their local name.
 * <p>
 * The catalog is only ever replaced as a whole. When two remote names translate to the same
 * local name, the one listed first by the CCU wins and the others are dropped.
 * <p>
 * Not thread safe, the owner guards access.
 */
public class MethodCatalog {
    private static final Logger log = LoggerFactory.getLogger(MethodCatalog.class);

    private Map<String, MethodDescriptor> methods = Collections.emptyMap();

    /**
     * Replace the content with the given methods.
     *
     * @param remoteNames method names in the order reported by the introspection call.
     */
    public void rebuild(List<String> remoteNames) {
        Map<String, MethodDescriptor> rebuilt = new LinkedHashMap<>();
        for (String remoteName : remoteNames) {
            String localName = NameTranslator.toLocalName(remoteName);
            MethodDescriptor kept = rebuilt.putIfAbsent(localName, MethodDescriptor.of(remoteName));
            if (kept != null) {
                log.debug("Dropping method {}, {} already uses the local name {}", remoteName, kept.remoteName(), localName);
            }
        }
        this.methods = rebuilt;
    }

    public Optional<MethodDescriptor> find(String localName) {
        return Optional.ofNullable(methods.get(localName));
    }

    public int size() {
        return methods.size();
    }

    public boolean isEmpty() {
        return methods.isEmpty();
    }

    /**
     * @return an immutable copy sorted by local name.
     */
    public SortedMap<String, MethodDescriptor> snapshot() {
        return ImmutableSortedMap.copyOf(methods);
    }

    public void clear() {
        this.methods = Collections.emptyMap();
    }
}
