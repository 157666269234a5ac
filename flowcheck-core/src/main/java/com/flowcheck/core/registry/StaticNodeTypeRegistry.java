package com.flowcheck.core.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable map-backed {@link NodeTypeRegistry}.
 *
 * <p>The bundled instance is read once from {@code flowcheck/node-types.yaml} on the
 * classpath.</p>
 */
public final class StaticNodeTypeRegistry implements NodeTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(StaticNodeTypeRegistry.class);
    static final String RESOURCE = "flowcheck/node-types.yaml";

    private final Map<String, NodeTypeSignature> signatures;

    StaticNodeTypeRegistry(Map<String, List<String>> nodeTypes) {
        Map<String, NodeTypeSignature> entries = new LinkedHashMap<>();
        if (nodeTypes != null) {
            nodeTypes.forEach((name, required) -> entries.put(name, new NodeTypeSignature(name, required)));
        }
        this.signatures = Collections.unmodifiableMap(entries);
    }

    @Override
    public Optional<NodeTypeSignature> lookup(String nodeType) {
        return nodeType == null ? Optional.empty() : Optional.ofNullable(signatures.get(nodeType));
    }

    @Override
    public Map<String, NodeTypeSignature> signatures() {
        return signatures;
    }

    static NodeTypeRegistry bundled() {
        return Holder.BUNDLED;
    }

    private static NodeTypeRegistry load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = StaticNodeTypeRegistry.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource: " + RESOURCE);
            }
            NodeTypesDocument document = mapper.readValue(in, NodeTypesDocument.class);
            StaticNodeTypeRegistry registry = new StaticNodeTypeRegistry(document.nodeTypes());
            log.debug("Loaded {} built-in node types", registry.signatures().size());
            return registry;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled resource: " + RESOURCE, e);
        }
    }

    private static final class Holder {
        private static final NodeTypeRegistry BUNDLED = load();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NodeTypesDocument(@JsonProperty("nodeTypes") Map<String, List<String>> nodeTypes) {
    }
}
