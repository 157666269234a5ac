package com.flowcheck.core.ir;

import com.flowcheck.core.parser.ast.AstWalker;
import com.flowcheck.core.parser.ast.PythonAst;
import com.flowcheck.core.parser.ast.PythonAst.Alias;
import com.flowcheck.core.parser.ast.PythonAst.AnnAssign;
import com.flowcheck.core.parser.ast.PythonAst.Assign;
import com.flowcheck.core.parser.ast.PythonAst.AugAssign;
import com.flowcheck.core.parser.ast.PythonAst.Call;
import com.flowcheck.core.parser.ast.PythonAst.ClassDef;
import com.flowcheck.core.parser.ast.PythonAst.ComprehensionClause;
import com.flowcheck.core.parser.ast.PythonAst.Constant;
import com.flowcheck.core.parser.ast.PythonAst.ConstantKind;
import com.flowcheck.core.parser.ast.PythonAst.Delete;
import com.flowcheck.core.parser.ast.PythonAst.DictExpr;
import com.flowcheck.core.parser.ast.PythonAst.ExceptHandler;
import com.flowcheck.core.parser.ast.PythonAst.Expr;
import com.flowcheck.core.parser.ast.PythonAst.For;
import com.flowcheck.core.parser.ast.PythonAst.FunctionDef;
import com.flowcheck.core.parser.ast.PythonAst.Global;
import com.flowcheck.core.parser.ast.PythonAst.Import;
import com.flowcheck.core.parser.ast.PythonAst.ImportFrom;
import com.flowcheck.core.parser.ast.PythonAst.Keyword;
import com.flowcheck.core.parser.ast.PythonAst.ListExpr;
import com.flowcheck.core.parser.ast.PythonAst.Module;
import com.flowcheck.core.parser.ast.PythonAst.Name;
import com.flowcheck.core.parser.ast.PythonAst.NamedExpr;
import com.flowcheck.core.parser.ast.PythonAst.Parameter;
import com.flowcheck.core.parser.ast.PythonAst.ParameterKind;
import com.flowcheck.core.parser.ast.PythonAst.Starred;
import com.flowcheck.core.parser.ast.PythonAst.Stmt;
import com.flowcheck.core.parser.ast.PythonAst.Subscript;
import com.flowcheck.core.parser.ast.PythonAst.TupleExpr;
import com.flowcheck.core.parser.ast.PythonAst.With;
import com.flowcheck.core.parser.ast.PythonAst.WithItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a parsed module and extracts the workflow IR.
 *
 * <p>Recognized call shapes:</p>
 * <ul>
 *   <li>{@code builder.add_node("ClassName", "id", {config})}</li>
 *   <li>{@code builder.add_connection("src", "output", "dst", "input")}, optionally tagged {@code cycle=True}</li>
 *   <li>{@code builder.create_cycle("name")} with chained or variable-bound
 *       {@code connect}, {@code max_iterations}, {@code converge_when}, {@code timeout} and {@code build} calls</li>
 *   <li>{@code NodeParameter(...)} inside {@code get_parameters} of node classes</li>
 *   <li>{@code import} and {@code from ... import} statements</li>
 * </ul>
 *
 * <p>Everything else is ignored. The extractor is stateless and thread safe.</p>
 */
public class IrExtractor {

    private static final Logger log = LoggerFactory.getLogger(IrExtractor.class);

    static final String ADD_NODE = "add_node";
    static final String ADD_CONNECTION = "add_connection";
    static final String CREATE_CYCLE = "create_cycle";
    static final String NODE_PARAMETER = "NodeParameter";

    private static final List<String> SOURCE_NODE_KEYWORDS = List.of("from_node", "source_node");
    private static final List<String> SOURCE_OUTPUT_KEYWORDS = List.of("from_output", "source_output");
    private static final List<String> TARGET_NODE_KEYWORDS = List.of("to_node", "target_node");
    private static final List<String> TARGET_INPUT_KEYWORDS = List.of("to_input", "target_input");

    private static final Set<String> ADD_NODE_KEYWORDS = Set.of("node_type", "node_id", "config");
    private static final Set<String> RUN_METHODS = Set.of("run", "execute", "async_run");
    private static final Set<String> IMPLICIT_PARAMETERS = Set.of("self", "cls");

    /**
     * Extracts the IR of a module.
     *
     * @param module parsed module
     * @return workflow IR
     */
    public WorkflowIr extract(Module module) {
        Extraction extraction = new Extraction();
        extraction.run(module);
        WorkflowIr ir = extraction.result();
        log.debug("Extracted {} nodes, {} connections, {} cycles, {} custom node classes, {} imports",
            ir.nodes().size(), ir.connections().size(), ir.cycles().size(),
            ir.customClasses().size(), ir.imports().size());
        return ir;
    }

    /**
     * Per-call extraction state.
     */
    private static final class Extraction {

        private final Map<String, NodeDeclaration> nodes = new LinkedHashMap<>();
        private final List<NodeDeclaration> duplicates = new ArrayList<>();
        private final List<ConnectionDeclaration> connections = new ArrayList<>();
        private final List<CycleBuilder> cycles = new ArrayList<>();
        private final Map<String, CycleBuilder> cycleVariables = new HashMap<>();
        private final Set<Call> handledChains = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Set<String> referencedClasses = new LinkedHashSet<>();
        private final List<CustomNodeClass> customClasses = new ArrayList<>();
        private final List<ImportDeclaration> imports = new ArrayList<>();
        private final Map<String, Integer> usedNames = new LinkedHashMap<>();
        private final Set<String> localNames = new LinkedHashSet<>();
        private final Set<Name> storedNames = Collections.newSetFromMap(new IdentityHashMap<>());

        void run(Module module) {
            collectImports(module);
            collectBindings(module);

            AstWalker.walk(module, node -> {
                if (node instanceof Assign assign) {
                    visitAssign(assign);
                } else if (node instanceof Call call) {
                    visitCall(call);
                }
            });

            AstWalker.collect(module, ClassDef.class).stream()
                .filter(this::isNodeClass)
                .map(this::extractClass)
                .forEach(customClasses::add);

            AstWalker.walk(module, node -> {
                if (node instanceof Name name && !storedNames.contains(name)) {
                    usedNames.putIfAbsent(name.id(), name.line());
                }
            });
        }

        WorkflowIr result() {
            return new WorkflowIr(
                List.copyOf(nodes.values()),
                duplicates,
                connections,
                cycles.stream().map(CycleBuilder::build).toList(),
                customClasses,
                imports,
                usedNames,
                localNames
            );
        }

        // ------------------------------------------------------------- calls

        private void visitCall(Call call) {
            String method = call.methodName();
            if (ADD_NODE.equals(method)) {
                extractNode(call);
            } else if (ADD_CONNECTION.equals(method)) {
                extractConnection(call);
            }
            if (!handledChains.contains(call)) {
                visitChain(call, null);
            }
        }

        private void visitAssign(Assign assign) {
            if (assign.targets().size() == 1
                && assign.targets().get(0) instanceof Name target
                && assign.value() instanceof Call call) {
                visitChain(call, target.id());
            }
        }

        private void extractNode(Call call) {
            List<Expr> args = call.args();
            if (args.stream().anyMatch(Starred.class::isInstance)) {
                return;
            }
            Expr classExpr = args.size() > 0 ? args.get(0) : call.keyword("node_type");
            Expr idExpr = args.size() > 1 ? args.get(1) : call.keyword("node_id");
            String id = LiteralEvaluator.string(idExpr);
            if (id == null) {
                return;
            }

            String className = className(classExpr);
            if (className != null) {
                referencedClasses.add(className);
            }

            Map<String, Object> config = new LinkedHashMap<>();
            boolean resolved = true;
            Expr configExpr = args.size() > 2 ? args.get(2) : call.keyword("config");
            if (configExpr instanceof DictExpr dict) {
                resolved = dict.keys().stream().allMatch(key -> LiteralEvaluator.string(key) != null);
                config.putAll(LiteralEvaluator.evaluateEntries(dict));
            } else if (configExpr != null && !isNone(configExpr)) {
                resolved = false;
            }
            if (args.size() > 3) {
                resolved = false;
            }
            for (Keyword keyword : call.keywords()) {
                if (keyword.name() == null) {
                    resolved = false;
                } else if (!ADD_NODE_KEYWORDS.contains(keyword.name())) {
                    config.putIfAbsent(keyword.name(), LiteralEvaluator.evaluate(keyword.value()));
                }
            }

            NodeDeclaration declaration = new NodeDeclaration(id, className, config, resolved, call.line());
            if (nodes.containsKey(id)) {
                duplicates.add(declaration);
            } else {
                nodes.put(id, declaration);
            }
        }

        private void extractConnection(Call call) {
            if (call.hasStarredArguments()) {
                return;
            }
            boolean cycleEdge = call.keyword("cycle") != null;
            Expr[] slots = new Expr[4];
            int count = call.args().size();
            for (int i = 0; i < Math.min(count, slots.length); i++) {
                slots[i] = call.args().get(i);
            }
            for (Keyword keyword : call.keywords()) {
                int slot = slotOf(keyword.name());
                if (slot >= 0) {
                    count++;
                    if (slots[slot] == null) {
                        slots[slot] = keyword.value();
                    }
                }
            }

            ConnectionShape shape = count == 4 ? ConnectionShape.FOUR_ARGUMENT
                : count == 2 ? ConnectionShape.TWO_ARGUMENT
                : ConnectionShape.INVALID_ARITY;

            String sourceNode = LiteralEvaluator.string(slots[0]);
            String sourceOutput = LiteralEvaluator.string(slots[1]);
            String targetNode = LiteralEvaluator.string(slots[2]);
            String targetInput = LiteralEvaluator.string(slots[3]);
            if (shape == ConnectionShape.TWO_ARGUMENT && call.args().size() == 2) {
                targetNode = LiteralEvaluator.string(call.args().get(1));
                sourceOutput = null;
            }
            connections.add(new ConnectionDeclaration(
                sourceNode, sourceOutput, targetNode, targetInput, shape, count, cycleEdge, call.line()));
        }

        private static int slotOf(String keyword) {
            if (keyword == null) {
                return -1;
            }
            if (SOURCE_NODE_KEYWORDS.contains(keyword)) {
                return 0;
            }
            if (SOURCE_OUTPUT_KEYWORDS.contains(keyword)) {
                return 1;
            }
            if (TARGET_NODE_KEYWORDS.contains(keyword)) {
                return 2;
            }
            if (TARGET_INPUT_KEYWORDS.contains(keyword)) {
                return 3;
            }
            return -1;
        }

        // ------------------------------------------------------------ cycles

        /**
         * Handles a method chain such as {@code wf.create_cycle("c").connect(...).build()}
         * or {@code builder.max_iterations(10)}.
         */
        private void visitChain(Call outer, String assignedVariable) {
            List<Call> chain = new ArrayList<>();
            Expr current = outer;
            while (current instanceof Call call && call.receiver() != null) {
                chain.add(0, call);
                current = call.receiver();
            }
            if (chain.isEmpty()) {
                return;
            }

            int start = -1;
            for (int i = chain.size() - 1; i >= 0; i--) {
                if (CREATE_CYCLE.equals(chain.get(i).methodName())) {
                    start = i;
                    break;
                }
            }

            CycleBuilder builder;
            int firstConfigCall;
            if (start >= 0) {
                Call create = chain.get(start);
                String name = create.args().isEmpty()
                    ? LiteralEvaluator.string(create.keyword("cycle_id"))
                    : LiteralEvaluator.string(create.args().get(0));
                if (name == null) {
                    name = assignedVariable != null ? assignedVariable : "cycle_" + (cycles.size() + 1);
                }
                builder = new CycleBuilder(name, create.line());
                cycles.add(builder);
                firstConfigCall = start + 1;
            } else if (current instanceof Name root && cycleVariables.containsKey(root.id())) {
                builder = cycleVariables.get(root.id());
                firstConfigCall = 0;
            } else {
                return;
            }

            for (int i = firstConfigCall; i < chain.size(); i++) {
                builder.apply(chain.get(i));
            }
            handledChains.addAll(chain);
            if (assignedVariable != null) {
                cycleVariables.put(assignedVariable, builder);
            }
        }

        // ----------------------------------------------------------- classes

        private boolean isNodeClass(ClassDef classDef) {
            if (referencedClasses.contains(classDef.name())) {
                return true;
            }
            return baseNames(classDef).stream().anyMatch(base -> lastSegment(base).endsWith("Node"));
        }

        private CustomNodeClass extractClass(ClassDef classDef) {
            FunctionDef getParameters = classDef.method("get_parameters");
            List<ParameterDeclaration> parameters = getParameters != null
                ? extractParameters(getParameters)
                : List.of();

            FunctionDef runMethod = classDef.body().stream()
                .filter(FunctionDef.class::isInstance)
                .map(FunctionDef.class::cast)
                .filter(def -> RUN_METHODS.contains(def.name()))
                .findFirst()
                .orElse(null);
            List<ParameterUsage> usages = runMethod != null ? extractUsages(runMethod) : List.of();

            return new CustomNodeClass(
                classDef.name(), baseNames(classDef), getParameters != null, parameters, usages, classDef.line());
        }

        private List<ParameterDeclaration> extractParameters(FunctionDef method) {
            Map<Call, String> dictKeys = new IdentityHashMap<>();
            for (DictExpr dict : AstWalker.collect(method, DictExpr.class)) {
                for (int i = 0; i < dict.keys().size(); i++) {
                    String key = LiteralEvaluator.string(dict.keys().get(i));
                    if (key != null && dict.values().get(i) instanceof Call call && isNodeParameter(call)) {
                        dictKeys.put(call, key);
                    }
                }
            }

            List<ParameterDeclaration> parameters = new ArrayList<>();
            for (Call call : AstWalker.collect(method, Call.class)) {
                if (!isNodeParameter(call)) {
                    continue;
                }
                String name = LiteralEvaluator.string(call.keyword("name"));
                if (name == null && !call.args().isEmpty()) {
                    name = LiteralEvaluator.string(call.args().get(0));
                }
                if (name == null) {
                    name = dictKeys.get(call);
                }

                Expr typeExpr = call.keyword("type");
                if (typeExpr == null && call.args().size() >= 2) {
                    typeExpr = call.args().get(1);
                }
                String type = typeExpr != null && !isNone(typeExpr) ? typeName(typeExpr) : null;

                Object required = LiteralEvaluator.evaluate(call.keyword("required"));
                Expr defaultExpr = call.keyword("default");
                parameters.add(new ParameterDeclaration(
                    name,
                    type,
                    Boolean.TRUE.equals(required),
                    defaultExpr != null ? LiteralEvaluator.evaluate(defaultExpr) : null,
                    call.line()));
            }
            return parameters;
        }

        private List<ParameterUsage> extractUsages(FunctionDef method) {
            Map<String, ParameterUsage> usages = new LinkedHashMap<>();
            String kwargsName = null;
            for (Parameter parameter : method.arguments().parameters()) {
                if (parameter.kind() == ParameterKind.VAR_KEYWORD) {
                    kwargsName = parameter.name();
                } else if ((parameter.kind() == ParameterKind.POSITIONAL || parameter.kind() == ParameterKind.KEYWORD_ONLY)
                    && !IMPLICIT_PARAMETERS.contains(parameter.name())) {
                    usages.putIfAbsent(parameter.name(), new ParameterUsage(parameter.name(), parameter.line()));
                }
            }
            if (kwargsName == null) {
                return List.copyOf(usages.values());
            }

            String kwargs = kwargsName;
            AstWalker.walk(method, node -> {
                if (node instanceof Call call
                    && "get".equals(call.methodName())
                    && call.receiver() instanceof Name receiver
                    && receiver.id().equals(kwargs)
                    && !call.args().isEmpty()) {
                    String name = LiteralEvaluator.string(call.args().get(0));
                    if (name != null) {
                        usages.putIfAbsent(name, new ParameterUsage(name, call.line()));
                    }
                } else if (node instanceof Subscript subscript
                    && subscript.value() instanceof Name receiver
                    && receiver.id().equals(kwargs)) {
                    String name = LiteralEvaluator.string(subscript.slice());
                    if (name != null) {
                        usages.putIfAbsent(name, new ParameterUsage(name, subscript.line()));
                    }
                }
            });
            return List.copyOf(usages.values());
        }

        private static boolean isNodeParameter(Call call) {
            return NODE_PARAMETER.equals(call.functionName()) || NODE_PARAMETER.equals(call.methodName());
        }

        private static List<String> baseNames(ClassDef classDef) {
            List<String> names = new ArrayList<>();
            for (Expr base : classDef.bases()) {
                String dotted = PythonAst.dottedName(base);
                if (dotted != null) {
                    names.add(dotted);
                }
            }
            return names;
        }

        // ----------------------------------------------------------- imports

        private void collectImports(Module module) {
            Set<Stmt> topLevel = Collections.newSetFromMap(new IdentityHashMap<>());
            topLevel.addAll(module.body());

            AstWalker.walk(module, node -> {
                if (node instanceof Import statement) {
                    for (Alias alias : statement.names()) {
                        String bound = alias.asName() != null ? alias.asName() : alias.name().split("\\.")[0];
                        imports.add(new ImportDeclaration(
                            alias.name(), alias.name(), bound, 0, false, topLevel.contains(statement), statement.line()));
                    }
                } else if (node instanceof ImportFrom statement) {
                    for (Alias alias : statement.names()) {
                        String bound = alias.asName() != null ? alias.asName() : alias.name();
                        imports.add(new ImportDeclaration(
                            statement.module(), alias.name(), bound, statement.level(), true,
                            topLevel.contains(statement), statement.line()));
                    }
                }
            });
        }

        // ---------------------------------------------------------- bindings

        private void collectBindings(Module module) {
            AstWalker.walk(module, node -> {
                if (node instanceof Assign assign) {
                    assign.targets().forEach(this::bindTarget);
                } else if (node instanceof AugAssign augAssign && augAssign.target() instanceof Name name) {
                    // augmented assignment reads the name as well, so it stays a load
                    localNames.add(name.id());
                } else if (node instanceof AnnAssign annAssign) {
                    bindTarget(annAssign.target());
                } else if (node instanceof For loop) {
                    bindTarget(loop.target());
                } else if (node instanceof With with) {
                    with.items().stream().map(WithItem::target).forEach(this::bindTarget);
                } else if (node instanceof ComprehensionClause clause) {
                    bindTarget(clause.target());
                } else if (node instanceof NamedExpr named) {
                    bindTarget(named.target());
                } else if (node instanceof Delete delete) {
                    delete.targets().forEach(this::bindTarget);
                } else if (node instanceof FunctionDef def) {
                    localNames.add(def.name());
                } else if (node instanceof ClassDef classDef) {
                    localNames.add(classDef.name());
                } else if (node instanceof Parameter parameter) {
                    localNames.add(parameter.name());
                } else if (node instanceof ExceptHandler handler && handler.name() != null) {
                    localNames.add(handler.name());
                } else if (node instanceof Global global) {
                    localNames.addAll(global.names());
                }
            });
        }

        private void bindTarget(Expr target) {
            if (target instanceof Name name) {
                storedNames.add(name);
                localNames.add(name.id());
            } else if (target instanceof TupleExpr tuple) {
                tuple.elements().forEach(this::bindTarget);
            } else if (target instanceof ListExpr list) {
                list.elements().forEach(this::bindTarget);
            } else if (target instanceof Starred starred) {
                bindTarget(starred.value());
            }
        }

        // ----------------------------------------------------------- helpers

        private static String className(Expr expr) {
            if (expr == null) {
                return null;
            }
            String literal = LiteralEvaluator.string(expr);
            if (literal != null) {
                return lastSegment(literal);
            }
            String dotted = PythonAst.dottedName(expr);
            return dotted != null ? lastSegment(dotted) : null;
        }

        private static String typeName(Expr expr) {
            String literal = LiteralEvaluator.string(expr);
            if (literal != null) {
                return literal;
            }
            String dotted = PythonAst.dottedName(expr);
            if (dotted != null) {
                return dotted;
            }
            if (expr instanceof Subscript subscript && PythonAst.dottedName(subscript.value()) != null) {
                return PythonAst.dottedName(subscript.value()) + "[...]";
            }
            return Unresolved.EXPRESSION.toString();
        }

        private static boolean isNone(Expr expr) {
            return expr instanceof Constant constant && constant.kind() == ConstantKind.NONE;
        }

        private static String lastSegment(String dotted) {
            int dot = dotted.lastIndexOf('.');
            return dot >= 0 ? dotted.substring(dot + 1) : dotted;
        }
    }

    /**
     * Mutable accumulator for one {@code create_cycle} declaration.
     */
    private static final class CycleBuilder {

        private final String name;
        private final int line;
        private final List<CycleEdge> edges = new ArrayList<>();
        private CycleSetting maxIterations;
        private CycleSetting convergeWhen;
        private CycleSetting timeout;
        private boolean built;

        CycleBuilder(String name, int line) {
            this.name = name;
            this.line = line;
        }

        void apply(Call call) {
            String method = call.methodName();
            if (method == null) {
                return;
            }
            switch (method) {
                case "connect" -> edges.add(edge(call));
                case "max_iterations" -> maxIterations = setting(call, "max_iterations", "iterations");
                case "converge_when" -> convergeWhen = setting(call, "condition", "converge_when");
                case "timeout" -> timeout = setting(call, "seconds", "timeout");
                case "build" -> built = true;
                default -> {
                    // other builder methods carry no validated configuration
                }
            }
        }

        private static CycleEdge edge(Call call) {
            List<Expr> args = call.args();
            Expr source = args.size() > 0 ? args.get(0) : firstKeyword(call, "source_node", "from_node", "source");
            Expr target = args.size() > 1 ? args.get(1) : firstKeyword(call, "target_node", "to_node", "target");
            Expr mapping = args.size() > 2 ? args.get(2) : call.keyword("mapping");
            boolean mappingGiven = mapping != null
                && !(mapping instanceof Constant constant && constant.kind() == ConstantKind.NONE);
            return new CycleEdge(
                LiteralEvaluator.string(source),
                LiteralEvaluator.string(target),
                mappingGiven ? LiteralEvaluator.evaluate(mapping) : null,
                mappingGiven,
                call.line());
        }

        private static CycleSetting setting(Call call, String... keywordNames) {
            Expr value = call.args().isEmpty() ? firstKeyword(call, keywordNames) : call.args().get(0);
            return new CycleSetting(value != null ? LiteralEvaluator.evaluate(value) : null, call.line());
        }

        private static Expr firstKeyword(Call call, String... names) {
            for (String name : names) {
                Expr value = call.keyword(name);
                if (value != null) {
                    return value;
                }
            }
            return null;
        }

        CycleDefinition build() {
            return new CycleDefinition(name, edges, maxIterations, convergeWhen, timeout, built, line);
        }
    }

}
