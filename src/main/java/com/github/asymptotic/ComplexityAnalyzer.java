package com.github.asymptotic;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.asymptotic.cost.CostComposer;
import com.github.asymptotic.cost.CostExpression;
import com.github.asymptotic.cost.LoopClassifier;
import com.github.asymptotic.dp.DpPatternDetector;
import com.github.asymptotic.parser.Parser;
import com.github.asymptotic.parser.Program;
import com.github.asymptotic.recursion.HeuristicSolver;
import com.github.asymptotic.recursion.RecursionAnalyzer;
import com.github.asymptotic.result.AnalysisResult;
import com.github.asymptotic.result.ResultSynthesizer;

import lombok.Setter;

/**
 * Entry point: pseudocode text in, worst, best and tight bounds out.
 * <p>
 * Instances hold no state between calls and can be shared.
 */
public class ComplexityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final Tokenizer tokenizer = new Tokenizer();
    private final String defaultFunctionName;
    private final ResultSynthesizer synthesizer;

    private ComplexityAnalyzer(Builder builder) {
        this.defaultFunctionName = builder.defaultFunctionName;
        var loopClassifier = new LoopClassifier();
        var composer = new CostComposer(loopClassifier);
        var dpDetector = new DpPatternDetector();
        var recursionAnalyzer = new RecursionAnalyzer(composer, loopClassifier, new HeuristicSolver(builder.heuristicSizes), dpDetector);
        Map<String, CostExpression> subroutines = new LinkedHashMap<>();
        builder.subroutines.forEach((name, cost) -> subroutines.put(name.toLowerCase(Locale.ROOT), cost));
        this.synthesizer = new ResultSynthesizer(composer, recursionAnalyzer, dpDetector, subroutines, builder.entry);
    }

    /** An analyzer configured from {@code complexity-analyzer.properties} on the classpath. */
    public static ComplexityAnalyzer fromConfig() {
        return fromConfig(Optional.empty());
    }

    public static ComplexityAnalyzer fromConfig(Optional<Path> override) {
        var builder = new Builder();
        ConfigReader.readConfig(override).applyConfig(builder);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Program parse(String source) {
        var tokens = tokenizer.tokenize(source);
        return new Parser(defaultFunctionName).parseProgram(tokens);
    }

    public AnalysisResult analyze(String source) {
        var program = parse(source);
        logger.debug("analyzing {} function(s)", program.functions().size());
        return synthesizer.synthesize(program);
    }

    public AnalysisResult analyzeFile(Path path) throws IOException {
        logger.info("Analyzing {}", path);
        return analyze(Files.readString(path));
    }

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 2) {
            logger.error("usage: ComplexityAnalyzer <file> [config-override.properties]");
            System.exit(2);
        }
        var override = args.length == 2 ? Optional.of(Path.of(args[1])) : Optional.<Path>empty();
        var analyzer = fromConfig(override);
        try {
            var result = analyzer.analyzeFile(Path.of(args[0]));
            logger.info("{}", result.render());
            logger.info("{}", result.rangeLabel());
        } catch (PseudocodeException e) {
            logger.error("{}", e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            logger.error("cannot read {}", args[0], e);
            System.exit(1);
        }
    }

    @Setter
    public static class Builder implements ConfigReader.ConfigTarget {
        private Optional<String> entry = Optional.empty();
        private String defaultFunctionName = "main";
        private Map<String, CostExpression> subroutines = new LinkedHashMap<>();
        private List<Integer> heuristicSizes = HeuristicSolver.DEFAULT_SIZES;

        private Builder() {}

        public ComplexityAnalyzer build() {
            return new ComplexityAnalyzer(this);
        }
    }

}
