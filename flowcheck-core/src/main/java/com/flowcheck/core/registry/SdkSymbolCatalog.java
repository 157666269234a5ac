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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static knowledge about the workflow SDK's import surface.
 *
 * <p>Holds the SDK root package, the canonical module of each public SDK class, the
 * standard-library module names used to group imports, and the modules considered
 * expensive to import. The bundled catalog is read once from
 * {@code flowcheck/sdk-catalog.yaml}.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * SdkSymbolCatalog catalog = SdkSymbolCatalog.defaults();
 * catalog.canonicalModule("WorkflowBuilder"); // Optional[kailash.workflow.builder]
 * catalog.isSdkModule("kailash.nodes.base");  // true
 * }</pre>
 */
public final class SdkSymbolCatalog {

    private static final Logger log = LoggerFactory.getLogger(SdkSymbolCatalog.class);
    static final String RESOURCE = "flowcheck/sdk-catalog.yaml";

    private final String sdkRoot;
    private final Map<String, String> symbols;
    private final Set<String> standardLibrary;
    private final Set<String> heavyModules;

    public SdkSymbolCatalog(
        String sdkRoot,
        Map<String, String> symbols,
        Set<String> standardLibrary,
        Set<String> heavyModules
    ) {
        this.sdkRoot = Objects.requireNonNull(sdkRoot, "sdkRoot must not be null");
        this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols != null ? symbols : Map.of()));
        this.standardLibrary = Collections.unmodifiableSet(
            new LinkedHashSet<>(standardLibrary != null ? standardLibrary : Set.of()));
        this.heavyModules = Collections.unmodifiableSet(
            new LinkedHashSet<>(heavyModules != null ? heavyModules : Set.of()));
    }

    public static SdkSymbolCatalog defaults() {
        return Holder.BUNDLED;
    }

    public String sdkRoot() {
        return sdkRoot;
    }

    public Map<String, String> symbols() {
        return symbols;
    }

    public boolean isSdkSymbol(String name) {
        return symbols.containsKey(name);
    }

    public Optional<String> canonicalModule(String symbol) {
        return Optional.ofNullable(symbols.get(symbol));
    }

    /**
     * Checks whether a dotted module path belongs to the SDK.
     *
     * @param module dotted module path
     * @return true for the SDK root package and its submodules
     */
    public boolean isSdkModule(String module) {
        return module != null && (module.equals(sdkRoot) || module.startsWith(sdkRoot + "."));
    }

    public boolean isStandardLibrary(String module) {
        return module != null && standardLibrary.contains(topLevel(module));
    }

    /**
     * Checks whether a module or any segment of its dotted path is a heavy module.
     *
     * @param module dotted module path
     * @return true when the import is expensive
     */
    public boolean isHeavy(String module) {
        if (module == null || module.isEmpty()) {
            return false;
        }
        for (String segment : module.split("\\.")) {
            if (heavyModules.contains(segment)) {
                return true;
            }
        }
        return false;
    }

    private static String topLevel(String module) {
        int dot = module.indexOf('.');
        return dot >= 0 ? module.substring(0, dot) : module;
    }

    private static SdkSymbolCatalog load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = SdkSymbolCatalog.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource: " + RESOURCE);
            }
            CatalogDocument document = mapper.readValue(in, CatalogDocument.class);
            SdkSymbolCatalog catalog = new SdkSymbolCatalog(
                document.sdkRoot(),
                document.symbols(),
                document.standardLibrary() != null ? new LinkedHashSet<>(document.standardLibrary()) : Set.of(),
                document.heavyModules() != null ? new LinkedHashSet<>(document.heavyModules()) : Set.of()
            );
            log.debug("Loaded SDK catalog with {} symbols", catalog.symbols().size());
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled resource: " + RESOURCE, e);
        }
    }

    private static final class Holder {
        private static final SdkSymbolCatalog BUNDLED = load();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogDocument(
        @JsonProperty("sdkRoot") String sdkRoot,
        @JsonProperty("symbols") Map<String, String> symbols,
        @JsonProperty("standardLibrary") List<String> standardLibrary,
        @JsonProperty("heavyModules") List<String> heavyModules
    ) {
    }
}
