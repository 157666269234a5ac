package com.flowcheck.core;

import com.flowcheck.core.analysis.ComplexityAnalyzer;
import com.flowcheck.core.analysis.ComplexityReport;
import com.flowcheck.core.config.ValidatorConfig;
import com.flowcheck.core.diagnostic.DiagnosticAggregator;
import com.flowcheck.core.graph.GraphBuilder;
import com.flowcheck.core.graph.WorkflowGraph;
import com.flowcheck.core.ir.ConnectionDeclaration;
import com.flowcheck.core.ir.ConnectionShape;
import com.flowcheck.core.ir.IrExtractor;
import com.flowcheck.core.ir.WorkflowIr;
import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.DiagnosticCategory;
import com.flowcheck.core.model.DiagnosticCode;
import com.flowcheck.core.model.PatternCheckResult;
import com.flowcheck.core.model.PatternMatch;
import com.flowcheck.core.model.Suggestion;
import com.flowcheck.core.model.ValidationPattern;
import com.flowcheck.core.model.ValidationResponse;
import com.flowcheck.core.parser.PythonParser;
import com.flowcheck.core.parser.PythonSyntaxException;
import com.flowcheck.core.parser.ast.PythonAst.Module;
import com.flowcheck.core.registry.NodeTypeRegistry;
import com.flowcheck.core.registry.SdkSymbolCatalog;
import com.flowcheck.core.registry.ValidationPatternCatalog;
import com.flowcheck.core.suggestion.FixSuggestionEngine;
import com.flowcheck.core.suggestion.SuggestionTemplates;
import com.flowcheck.core.validator.RuleValidator;
import com.flowcheck.core.validator.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Entry point of the workflow static validator.
 *
 * <p>Every operation is a pure function of its input and the shared read-only catalogs.
 * One instance can serve concurrent callers. Input problems never surface as
 * exceptions: a parse failure becomes a single {@code SYN001}, and a fault inside one
 * rule pass becomes {@code VAL001} while the remaining passes still report.</p>
 *
 * <p><b>Pipeline:</b> source text, parser, IR extractor, graph builder, rule passes,
 * aggregator, suggestion engine.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * WorkflowValidator validator = new WorkflowValidator();
 * ValidationResponse response = validator.validateWorkflow(source);
 * if (response.hasErrors()) {
 *     response.errors().forEach(d -> System.out.println(d.code() + ": " + d.message()));
 * }
 * }</pre>
 */
public class WorkflowValidator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowValidator.class);

    static final String SYNTAX_ERROR_PREFIX = "Syntax error in workflow code: ";
    static final String PASS = "pass";

    private static final Set<DiagnosticCategory> ALL_PASSES = EnumSet.of(
        DiagnosticCategory.PARAMETER,
        DiagnosticCategory.CONNECTION,
        DiagnosticCategory.CYCLE,
        DiagnosticCategory.IMPORT,
        DiagnosticCategory.GOLD_STANDARD);

    private static final List<String> CONNECTION_FIELDS = List.of("source", "output", "target", "input");

    private static final ExecutorService WORKERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "flowcheck-worker");
        thread.setDaemon(true);
        return thread;
    });

    private final ValidatorConfig config;
    private final NodeTypeRegistry registry;
    private final SdkSymbolCatalog catalog;
    private final List<RuleValidator> validators;
    private final IrExtractor extractor = new IrExtractor();
    private final GraphBuilder graphBuilder = new GraphBuilder();
    private final DiagnosticAggregator aggregator;
    private final FixSuggestionEngine suggestionEngine = new FixSuggestionEngine();
    private final ComplexityAnalyzer complexityAnalyzer = new ComplexityAnalyzer();

    public WorkflowValidator() {
        this(ValidatorConfig.defaults());
    }

    public WorkflowValidator(ValidatorConfig config) {
        this(config, NodeTypeRegistry.defaults(), SdkSymbolCatalog.defaults(), discoverValidators());
    }

    /**
     * Creates a validator with explicit collaborators.
     *
     * @param config configuration; its registry section extends {@code registry}
     * @param registry known node types
     * @param catalog SDK import catalog
     * @param validators rule passes
     */
    public WorkflowValidator(
        ValidatorConfig config,
        NodeTypeRegistry registry,
        SdkSymbolCatalog catalog,
        List<RuleValidator> validators
    ) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null")
            .withAdditional(config.registry().nodeTypes());
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.validators = List.copyOf(Objects.requireNonNull(validators, "validators must not be null"));
        this.aggregator = new DiagnosticAggregator(config.output().tieBreak());
    }

    /**
     * Discovers rule passes registered through {@link ServiceLoader}, ordered by category.
     *
     * @return rule passes
     */
    public static List<RuleValidator> discoverValidators() {
        List<RuleValidator> discovered = new ArrayList<>();
        ServiceLoader.load(RuleValidator.class, WorkflowValidator.class.getClassLoader()).forEach(discovered::add);
        discovered.sort(Comparator.comparing(RuleValidator::getCategory));
        if (log.isDebugEnabled()) {
            discovered.forEach(validator -> log.debug("  - {} ({})", validator.getId(), validator.getDisplayName()));
        }
        return discovered;
    }

    public ValidatorConfig config() {
        return config;
    }

    public NodeTypeRegistry registry() {
        return registry;
    }

    // ==================== Operations ====================

    /**
     * Runs every rule pass.
     *
     * @param source workflow source
     * @return response with suggestions for the reported codes
     */
    public ValidationResponse validateWorkflow(String source) {
        return validate(source, ALL_PASSES);
    }

    /**
     * Runs the parameter pass only.
     *
     * @param source workflow or node-class source
     * @return response
     */
    public ValidationResponse checkNodeParameters(String source) {
        return validate(source, EnumSet.of(DiagnosticCategory.PARAMETER));
    }

    /**
     * Runs the gold-standard pass only.
     *
     * @param source workflow source
     * @return response
     */
    public ValidationResponse validateGoldStandards(String source) {
        return validate(source, EnumSet.of(DiagnosticCategory.GOLD_STANDARD));
    }

    /**
     * Runs the import pass only.
     *
     * @param source workflow source
     * @return response
     */
    public ValidationResponse validateImports(String source) {
        return validate(source, EnumSet.of(DiagnosticCategory.IMPORT));
    }

    /**
     * Validates bare connection descriptions.
     *
     * <p>Each entry needs {@code source}, {@code output}, {@code target} and {@code input}.
     * An entry with only {@code source} and {@code target} is {@code CON002}; any other
     * missing field is {@code CON001}. Well-formed entries then go through the
     * connection pass (cycles and field names). Endpoints are not resolved because no
     * nodes are declared. Diagnostics carry the 1-based entry position as {@code line}
     * and the 0-based {@code connection_index} in context.</p>
     *
     * @param connections connection entries
     * @return response
     */
    public ValidationResponse validateConnections(List<Map<String, Object>> connections) {
        List<Map<String, Object>> entries = connections != null ? connections : List.of();
        return guarded(() -> checkConnections(entries), this::faultResponse);
    }

    /**
     * Produces one suggestion per distinct code, in first-seen order.
     *
     * @param diagnostics diagnostics, possibly from another tool
     * @return suggestions
     */
    public List<Suggestion> suggestFixes(List<Diagnostic> diagnostics) {
        return suggestionEngine.suggest(diagnostics);
    }

    public List<ValidationPattern> getValidationPatterns() {
        return ValidationPatternCatalog.patterns();
    }

    /**
     * Looks for one family of error patterns.
     *
     * @param source workflow source
     * @param patternType family name such as {@code "connection_syntax"}
     * @return matches with the fix text of each, none for unknown families or unparsable source
     */
    public PatternCheckResult checkErrorPattern(String source, String patternType) {
        return ErrorPatternType.fromWire(patternType)
            .map(type -> checkErrorPattern(source, type))
            .orElseGet(() -> {
                log.debug("Unknown pattern type '{}'", patternType);
                return PatternCheckResult.none();
            });
    }

    public PatternCheckResult checkErrorPattern(String source, ErrorPatternType type) {
        ValidationResponse response = validate(source, type.categories());
        List<PatternMatch> matches = new ArrayList<>();
        for (Diagnostic diagnostic : response.diagnostics()) {
            if (!type.includes(diagnostic.code())) {
                continue;
            }
            String fix = diagnostic.knownCode()
                .map(code -> SuggestionTemplates.forCode(code).render(diagnostic).fix())
                .orElse(diagnostic.message());
            matches.add(new PatternMatch(diagnostic.line(), diagnostic.code(), fix));
        }
        matches.sort(Comparator.comparing(PatternMatch::line, Comparator.nullsLast(Comparator.<Integer>naturalOrder())));
        return PatternCheckResult.of(matches);
    }

    /**
     * Computes complexity metrics and optimisation hints.
     *
     * @param source workflow source
     * @return report; not analysed when the source does not parse
     */
    public ComplexityReport analyzeComplexity(String source) {
        String text = source != null ? source : "";
        return guarded(() -> {
            Module module;
            try {
                module = PythonParser.parse(text);
            } catch (PythonSyntaxException e) {
                return ComplexityReport.failed(SYNTAX_ERROR_PREFIX + e.getMessage());
            } catch (StackOverflowError e) {
                return ComplexityReport.failed(SYNTAX_ERROR_PREFIX + "source is nested too deeply");
            }
            WorkflowIr ir = extractor.extract(module);
            return complexityAnalyzer.analyze(ir, graphBuilder.build(ir));
        }, ComplexityReport::failed);
    }

    // ==================== Pipeline ====================

    private ValidationResponse validate(String source, Set<DiagnosticCategory> passes) {
        String text = source != null ? source : "";
        return guarded(() -> runPipeline(text, passes), this::faultResponse);
    }

    private ValidationResponse runPipeline(String source, Set<DiagnosticCategory> passes) {
        Module module;
        try {
            module = PythonParser.parse(source);
        } catch (PythonSyntaxException e) {
            log.debug("Source does not parse: {}", e.getMessage());
            return syntaxError(e.getMessage(), e.getLine(), e.getColumn());
        } catch (StackOverflowError e) {
            log.debug("Source is nested too deeply to parse");
            return syntaxError("source is nested too deeply", null, null);
        }

        WorkflowIr ir = extractor.extract(module);
        WorkflowGraph graph = graphBuilder.build(ir);
        ValidationContext context = new ValidationContext(module, ir, graph, config, registry, catalog);
        return respond(runPasses(context, passes));
    }

    private List<Diagnostic> runPasses(ValidationContext context, Set<DiagnosticCategory> passes) {
        List<List<Diagnostic>> results = new ArrayList<>();
        for (RuleValidator validator : validators) {
            if (!passes.contains(validator.getCategory())) {
                continue;
            }
            results.add(runPass(validator, context));
        }
        return aggregator.merge(results);
    }

    private List<Diagnostic> runPass(RuleValidator validator, ValidationContext context) {
        try {
            return validator.validate(context);
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Validator {} failed: {}", validator.getId(), e.getMessage(), e);
            Map<String, Object> faultContext = new LinkedHashMap<>();
            faultContext.put(PASS, validator.getId());
            return List.of(Diagnostic.of(DiagnosticCode.VAL001,
                "Validation error in " + validator.getDisplayName() + ": " + e,
                null, faultContext));
        }
    }

    private ValidationResponse respond(List<Diagnostic> diagnostics) {
        return aggregator.respond(diagnostics, suggestionEngine.suggest(diagnostics));
    }

    private ValidationResponse syntaxError(String message, Integer line, Integer column) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (column != null) {
            context.put("column", column);
        }
        Diagnostic diagnostic = Diagnostic.of(DiagnosticCode.SYN001, SYNTAX_ERROR_PREFIX + message, line, context);
        return respond(List.of(diagnostic));
    }

    private ValidationResponse faultResponse(String message) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(PASS, "pipeline");
        return respond(List.of(Diagnostic.of(DiagnosticCode.VAL001, message, null, context)));
    }

    // ==================== Connection lists ====================

    private ValidationResponse checkConnections(List<Map<String, Object>> entries) {
        List<Diagnostic> shapeDiagnostics = new ArrayList<>();
        List<ConnectionDeclaration> wellFormed = new ArrayList<>();

        for (int index = 0; index < entries.size(); index++) {
            Map<String, Object> entry = entries.get(index) != null ? entries.get(index) : Map.of();
            int position = index + 1;
            List<String> missing = CONNECTION_FIELDS.stream().filter(field -> !entry.containsKey(field)).toList();

            if (missing.isEmpty()) {
                wellFormed.add(new ConnectionDeclaration(
                    text(entry.get("source")), text(entry.get("output")),
                    text(entry.get("target")), text(entry.get("input")),
                    ConnectionShape.FOUR_ARGUMENT, 4, false, position));
                continue;
            }

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("connection_index", index);
            boolean legacy = entry.size() == 2 && entry.containsKey("source") && entry.containsKey("target");
            if (legacy) {
                context.put("source", text(entry.get("source")));
                context.put("target", text(entry.get("target")));
                shapeDiagnostics.add(Diagnostic.of(DiagnosticCode.CON002,
                    "Connection " + index + " uses old 2-parameter syntax. "
                        + "Use 4-parameter: add_connection(source, output, target, input)",
                    position, context));
            } else {
                context.put("missing_fields", missing);
                context.put("arg_count", CONNECTION_FIELDS.size() - missing.size());
                shapeDiagnostics.add(Diagnostic.of(DiagnosticCode.CON001,
                    "Connection " + index + " missing required fields: " + missing,
                    position, context));
            }
        }

        WorkflowIr ir = new WorkflowIr(null, null, wellFormed, null, null, null, null, null);
        WorkflowGraph graph = graphBuilder.buildDetached(wellFormed);
        ValidationContext context = new ValidationContext(
            new Module(List.of()), ir, graph, config, registry, catalog);

        List<List<Diagnostic>> results = new ArrayList<>();
        results.add(shapeDiagnostics);
        for (RuleValidator validator : validators) {
            if (validator.getCategory() == DiagnosticCategory.CONNECTION) {
                results.add(runPass(validator, context));
            }
        }
        return respond(aggregator.merge(results));
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    // ==================== Timeout ====================

    /**
     * Runs a task under the configured wall-clock limit. Unexpected faults and timeouts
     * are turned into a result by {@code onFault}.
     */
    private <T> T guarded(Callable<T> task, Function<String, T> onFault) {
        int timeoutSeconds = config.analysis().timeoutSecondsOrDefault();
        if (timeoutSeconds <= 0) {
            try {
                return task.call();
            } catch (Exception e) {
                log.error("Validation failed: {}", e.getMessage(), e);
                return onFault.apply("Validation error: " + e);
            }
        }

        Future<T> future = WORKERS.submit(task);
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Validation timed out after {} seconds", timeoutSeconds);
            return onFault.apply("Validation timed out after " + timeoutSeconds + " seconds");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.error("Validation interrupted");
            return onFault.apply("Validation interrupted");
        } catch (ExecutionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Validation failed: {}", cause.getMessage(), cause);
            return onFault.apply("Validation error: " + cause);
        }
    }
}
