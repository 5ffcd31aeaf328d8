package com.g2c.compiler;

import com.g2c.compiler.analysis.DocumentAnalysis;
import com.g2c.compiler.analysis.GraphAnalyzer;
import com.g2c.compiler.codegen.CodeGenerator;
import com.g2c.compiler.codegen.GeneratorOptions;
import com.g2c.compiler.codegen.RuleRegistry;
import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeCatalog;
import com.g2c.compiler.plugin.PluginRegistry;
import com.g2c.compiler.validation.Diagnostic;
import com.g2c.compiler.validation.GraphValidator;
import com.g2c.compiler.validation.ValidationResult;

/**
 * Entry point of the compiler: validate, then generate. Generation never runs on a document
 * with error diagnostics.
 *
 * <p>Instances hold only immutable tables (node catalog, rule registry, options), so one
 * compiler can serve any number of documents.
 */
public class GraphCompiler {

    private final NodeCatalog catalog;
    private final GraphValidator validator;
    private final GraphAnalyzer analyzer;
    private final CodeGenerator generator;

    public GraphCompiler() {
        this(PluginRegistry.empty(), GeneratorOptions.defaults());
    }

    public GraphCompiler(PluginRegistry plugins, GeneratorOptions options) {
        this.catalog = plugins.extend(NodeCatalog.builtIns());
        RuleRegistry rules = RuleRegistry.builtIns();
        plugins.registerRules(rules);
        this.validator = new GraphValidator(catalog);
        this.analyzer = new GraphAnalyzer(catalog);
        this.generator = new CodeGenerator(rules, options);
    }

    public NodeCatalog catalog() {
        return catalog;
    }

    public ValidationResult validate(GraphModel.Graph document) {
        return validator.validate(document);
    }

    /**
     * Validates and generates.
     *
     * @throws ValidationFailedException if validation reports any error
     * @throws CodeGenerator.GenerationException on an invariant violation during generation
     */
    public CodeGenerator.GeneratedProgram compile(GraphModel.Graph document) {
        ValidationResult result = validator.validate(document);
        if (!result.isOk()) {
            throw new ValidationFailedException(result);
        }
        DocumentAnalysis analysis = analyzer.analyzeDocument(document);
        return generator.generate(document, analysis);
    }

    /** Carries the diagnostics of a document that failed validation. */
    public static class ValidationFailedException extends RuntimeException {
        private final ValidationResult result;

        public ValidationFailedException(ValidationResult result) {
            super(summary(result));
            this.result = result;
        }

        public ValidationResult result() {
            return result;
        }

        private static String summary(ValidationResult result) {
            int errors = result.errors().size();
            Diagnostic first = result.errors().isEmpty() ? null : result.errors().get(0);
            return "Graph validation failed with " + errors + " error(s)"
                    + (first != null ? "; first: " + first.format() : "");
        }
    }
}
