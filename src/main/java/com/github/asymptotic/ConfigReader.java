package com.github.asymptotic;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.asymptotic.cost.ComplexityLiteral;
import com.github.asymptotic.cost.CostExpression;
import com.github.asymptotic.recursion.HeuristicSolver;

public class ConfigReader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigReader.class);

    static final String RESOURCE = "complexity-analyzer.properties";
    static final String SUBROUTINE_PREFIX = "analyzer.subroutines.";

    static Config readConfig() {
        return readConfig(Optional.empty());
    }

    /** Classpath defaults, then the keys of {@code override} on top. */
    static Config readConfig(Optional<Path> override) {
        Properties properties = new Properties();
        try (InputStream in = ConfigReader.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.debug("no {} on the classpath, using built-in defaults", RESOURCE);
            }
            if (override.isPresent()) {
                try (var reader = Files.newBufferedReader(override.get())) {
                    properties.load(reader);
                }
                logger.info("Read configuration override {}", override.get());
            }
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return readConfig(properties);
    }

    static Config readConfig(Properties properties) {
        var config = new Config();
        var entry = properties.getProperty("analyzer.entry", "").trim();
        config.entry = entry.isEmpty() ? Optional.empty() : Optional.of(entry);
        config.defaultFunctionName = properties.getProperty("analyzer.entry.default-name", "main").trim();

        for (var key : properties.stringPropertyNames()) {
            if (key.startsWith(SUBROUTINE_PREFIX)) {
                var name = key.substring(SUBROUTINE_PREFIX.length()).toLowerCase(Locale.ROOT);
                var literal = properties.getProperty(key).trim();
                var cost = ComplexityLiteral.parseHint(literal).map(hint -> hint.cost())
                        .or(() -> ComplexityLiteral.parseCost(literal))
                        .orElseThrow(() -> new IllegalArgumentException("bad complexity '" + literal + "' for " + key));
                config.subroutines.put(name, cost);
            }
        }

        var sizes = properties.getProperty("analyzer.heuristic.sizes", "").trim();
        if (!sizes.isEmpty()) {
            config.heuristicSizes = Arrays.stream(sizes.split(",")).map(String::trim).map(Integer::valueOf).toList();
        }
        logger.debug("configuration: entry {}, default name {}, subroutines {}, sizes {}",
                config.entry, config.defaultFunctionName, config.subroutines, config.heuristicSizes);
        return config;
    }

    static class Config {
        Optional<String> entry = Optional.empty();
        String defaultFunctionName = "main";
        Map<String, CostExpression> subroutines = new LinkedHashMap<>();
        List<Integer> heuristicSizes = HeuristicSolver.DEFAULT_SIZES;

        public void applyConfig(ConfigTarget ct) {
            ct.setEntry(entry);
            ct.setDefaultFunctionName(defaultFunctionName);
            ct.setSubroutines(subroutines);
            ct.setHeuristicSizes(heuristicSizes);
        }
    }

    interface ConfigTarget {
        void setEntry(Optional<String> entry);
        void setDefaultFunctionName(String defaultFunctionName);
        void setSubroutines(Map<String, CostExpression> subroutines);
        void setHeuristicSizes(List<Integer> heuristicSizes);
    }

}
