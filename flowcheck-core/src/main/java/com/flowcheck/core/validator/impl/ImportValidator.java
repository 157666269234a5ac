package com.flowcheck.core.validator.impl;

import com.flowcheck.core.ir.ImportDeclaration;
import com.flowcheck.core.ir.WorkflowIr;
import com.flowcheck.core.model.Diagnostic;
import com.flowcheck.core.model.DiagnosticCategory;
import com.flowcheck.core.model.DiagnosticCode;
import com.flowcheck.core.registry.SdkSymbolCatalog;
import com.flowcheck.core.validator.AbstractRuleValidator;
import com.flowcheck.core.validator.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cross-references names read in the source with the names its imports bind.
 *
 * <ul>
 *   <li>{@code IMP001} SDK class used but never imported or defined</li>
 *   <li>{@code IMP002} imported name never referenced</li>
 *   <li>{@code IMP003} SDK class imported from a module other than its canonical one</li>
 *   <li>{@code IMP004} relative import of an SDK class or module</li>
 *   <li>{@code IMP006} top-level imports out of group order</li>
 *   <li>{@code IMP008} heavy module imported and never used, reported instead of {@code IMP002}</li>
 * </ul>
 */
public class ImportValidator extends AbstractRuleValidator {

    static final String IMPORT_NAME = "import_name";

    /**
     * Import groups in their expected order.
     */
    enum ImportGroup {
        STANDARD("standard library"),
        THIRD_PARTY("third-party"),
        SDK("SDK"),
        LOCAL("local");

        private final String label;

        ImportGroup(String label) {
            this.label = label;
        }
    }

    @Override
    public String getId() {
        return "imports";
    }

    @Override
    public String getDisplayName() {
        return "Import Validator";
    }

    @Override
    public DiagnosticCategory getCategory() {
        return DiagnosticCategory.IMPORT;
    }

    @Override
    protected List<Diagnostic> check(ValidationContext context) {
        WorkflowIr ir = context.ir();
        SdkSymbolCatalog catalog = context.catalog();
        List<Diagnostic> diagnostics = new ArrayList<>();

        checkMissing(ir, catalog, diagnostics);
        for (ImportDeclaration declaration : ir.imports()) {
            checkUnused(declaration, ir, catalog, diagnostics);
            checkPath(declaration, catalog, diagnostics);
            checkRelative(declaration, catalog, diagnostics);
        }
        checkOrder(ir, catalog, diagnostics);
        return diagnostics;
    }

    private void checkMissing(WorkflowIr ir, SdkSymbolCatalog catalog, List<Diagnostic> diagnostics) {
        Set<String> bound = ir.imports().stream()
            .map(ImportDeclaration::boundName)
            .collect(Collectors.toSet());
        boolean starFromSdk = ir.imports().stream()
            .anyMatch(declaration -> declaration.isStar() && catalog.isSdkModule(declaration.module()));

        for (Map.Entry<String, Integer> used : ir.usedNames().entrySet()) {
            String name = used.getKey();
            if (!catalog.isSdkSymbol(name) || bound.contains(name) || ir.localNames().contains(name) || starFromSdk) {
                continue;
            }
            String statement = "from " + catalog.canonicalModule(name).orElseThrow() + " import " + name;
            diagnostics.add(diagnostic(DiagnosticCode.IMP001,
                "Missing import for '" + name + "'",
                used.getValue(),
                context("missing_name", name, "import_statement", statement)));
        }
    }

    private void checkUnused(ImportDeclaration declaration, WorkflowIr ir, SdkSymbolCatalog catalog, List<Diagnostic> diagnostics) {
        if (declaration.isStar() || "__future__".equals(declaration.module()) || ir.isUsed(declaration.boundName())) {
            return;
        }
        boolean heavy = catalog.isHeavy(declaration.effectiveModule()) || catalog.isHeavy(declaration.boundName());
        if (heavy) {
            diagnostics.add(diagnostic(DiagnosticCode.IMP008,
                "Heavy import '" + declaration.boundName() + "' is unused and may impact performance",
                declaration.line(),
                context(IMPORT_NAME, declaration.boundName(), "statement", declaration.statement())));
        } else {
            diagnostics.add(diagnostic(DiagnosticCode.IMP002,
                "Unused import '" + declaration.boundName() + "'",
                declaration.line(),
                context(IMPORT_NAME, declaration.boundName(), "statement", declaration.statement())));
        }
    }

    private void checkPath(ImportDeclaration declaration, SdkSymbolCatalog catalog, List<Diagnostic> diagnostics) {
        if (!declaration.fromImport() || declaration.isRelative()) {
            return;
        }
        Optional<String> canonical = catalog.canonicalModule(declaration.name());
        if (canonical.isEmpty() || canonical.get().equals(declaration.module())) {
            return;
        }
        diagnostics.add(diagnostic(DiagnosticCode.IMP003,
            "Incorrect import path for '" + declaration.name() + "'. Expected 'from " + canonical.get()
                + " import " + declaration.name() + "', got 'from " + declaration.module()
                + " import " + declaration.name() + "'",
            declaration.line(),
            context(IMPORT_NAME, declaration.name(),
                "current_path", declaration.module(),
                "correct_path", canonical.get())));
    }

    private void checkRelative(ImportDeclaration declaration, SdkSymbolCatalog catalog, List<Diagnostic> diagnostics) {
        if (!declaration.isRelative()) {
            return;
        }
        String module = declaration.module();
        boolean sdkPath = catalog.isSdkModule(module)
            || (!module.isEmpty() && catalog.symbols().values().stream().anyMatch(path -> path.endsWith("." + module)));
        if (!catalog.isSdkSymbol(declaration.name()) && !sdkPath) {
            return;
        }
        diagnostics.add(diagnostic(DiagnosticCode.IMP004,
            "Relative import detected for '" + declaration.boundName()
                + "'. Use absolute imports for better compatibility",
            declaration.line(),
            context(IMPORT_NAME, declaration.boundName(), "statement", declaration.statement())));
    }

    private void checkOrder(WorkflowIr ir, SdkSymbolCatalog catalog, List<Diagnostic> diagnostics) {
        ImportGroup current = ImportGroup.STANDARD;
        int lastLine = -1;
        for (ImportDeclaration declaration : ir.imports()) {
            if (!declaration.topLevel() || declaration.line() == lastLine) {
                continue;
            }
            lastLine = declaration.line();
            ImportGroup group = groupOf(declaration, catalog);
            if (group.ordinal() < current.ordinal()) {
                diagnostics.add(diagnostic(DiagnosticCode.IMP006,
                    "Import order violation: " + group.label + " imports should come before "
                        + current.label + " imports",
                    declaration.line(),
                    context(IMPORT_NAME, declaration.boundName(), "statement", declaration.statement())));
            } else {
                current = group;
            }
        }
    }

    static ImportGroup groupOf(ImportDeclaration declaration, SdkSymbolCatalog catalog) {
        if (declaration.isRelative()) {
            return ImportGroup.LOCAL;
        }
        String module = declaration.effectiveModule();
        if (catalog.isSdkModule(module)) {
            return ImportGroup.SDK;
        }
        if (catalog.isStandardLibrary(module)) {
            return ImportGroup.STANDARD;
        }
        return ImportGroup.THIRD_PARTY;
    }
}
