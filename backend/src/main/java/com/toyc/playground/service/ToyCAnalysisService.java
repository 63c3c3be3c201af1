package com.toyc.playground.service;

import com.toyc.playground.analysis.ComplexityEstimator;
import com.toyc.playground.analysis.ControlFlowBuilder;
import com.toyc.playground.analysis.DiagnosticsCollector;
import com.toyc.playground.analysis.Lexer;
import com.toyc.playground.analysis.ParseTree;
import com.toyc.playground.analysis.Parser;
import com.toyc.playground.analysis.ScopeAnalyzer;
import com.toyc.playground.analysis.ScopeAnalyzer.ScopeAnalysis;
import com.toyc.playground.config.AnalyzerProperties;
import com.toyc.playground.dto.AnalysisResult;
import com.toyc.playground.dto.ComplexityInfo;
import com.toyc.playground.dto.ControlFlowNode;
import com.toyc.playground.dto.Diagnostic;
import com.toyc.playground.dto.Token;
import com.toyc.playground.exception.AnalysisException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Never throws; internal faults come back as a result with a single fatal diagnostic.
 */
@Service
public class ToyCAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(ToyCAnalysisService.class);

    private final AnalyzerProperties properties;
    private final Lexer lexer;
    private final Parser parser;
    private final ScopeAnalyzer scopeAnalyzer;
    private final ControlFlowBuilder controlFlowBuilder;
    private final ComplexityEstimator complexityEstimator;
    private final DiagnosticsCollector diagnosticsCollector;

    public ToyCAnalysisService(
            AnalyzerProperties properties,
            Lexer lexer,
            Parser parser,
            ScopeAnalyzer scopeAnalyzer,
            ControlFlowBuilder controlFlowBuilder,
            ComplexityEstimator complexityEstimator,
            DiagnosticsCollector diagnosticsCollector) {
        this.properties = properties;
        this.lexer = lexer;
        this.parser = parser;
        this.scopeAnalyzer = scopeAnalyzer;
        this.controlFlowBuilder = controlFlowBuilder;
        this.complexityEstimator = complexityEstimator;
        this.diagnosticsCollector = diagnosticsCollector;
    }

    public AnalysisResult analyze(String sourceCode) {
        long startTime = System.currentTimeMillis();
        String code = sourceCode == null ? "" : sourceCode;

        simulateProcessingDelay();

        if (code.length() > properties.maxSourceLength()) {
            logger.warn("Rejected source of {} characters (limit {})", code.length(), properties.maxSourceLength());
            return AnalysisResult.failure(
                    "Source code exceeds maximum length of " + properties.maxSourceLength() + " characters");
        }

        try {
            logger.info("Starting analysis of {} characters", code.length());

            List<Token> tokens = lexer.tokenize(code);
            ParseTree parseTree = parser.parse(tokens);
            ScopeAnalysis scopes = scopeAnalyzer.analyze(parseTree);
            ControlFlowNode controlFlow = controlFlowBuilder.build(parseTree);
            ComplexityInfo complexity = complexityEstimator.estimate(parseTree);
            List<Diagnostic> errors = diagnosticsCollector.collect(tokens, parseTree, scopes.errors());

            long analysisTime = System.currentTimeMillis() - startTime;
            logger.info("Analysis completed in {}ms: {} tokens, {} nodes, {} diagnostics, time {}",
                    analysisTime, tokens.size(), parseTree.size(), errors.size(), complexity.time().notation());

            return new AnalysisResult(
                    tokens,
                    parseTree.root(),
                    List.of(scopes.global()),
                    controlFlow,
                    complexity,
                    errors);

        } catch (AnalysisException e) {
            logger.error("Analysis pipeline invariant violated: {}", e.getMessage(), e);
            return AnalysisResult.fatal(e);
        } catch (Exception e) {
            logger.error("Unexpected error during analysis: {}", e.getMessage(), e);
            return AnalysisResult.fatal(e);
        } catch (StackOverflowError e) {
            logger.error("Analysis ran out of stack on {} characters", code.length());
            return AnalysisResult.fatal(e);
        }
    }

    private void simulateProcessingDelay() {
        long delayMs = properties.processingDelay().toMillis();
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            logger.debug("Processing delay interrupted");
            Thread.currentThread().interrupt();
        }
    }
}
