package com.github.asymptotic;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Comparator;

import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

public class ComplexityAnalyzerTest {

    private final ComplexityAnalyzer analyzer = ComplexityAnalyzer.fromConfig();

    @TestFactory
    public DynamicNode testFactory() {
        String basePathString = "src/test/resources/analyzer-tests";
        Path basePath = Paths.get(basePathString);

        var testFiles = basePath.toFile().listFiles((dir, name) -> name.endsWith(".pseudo"));
        var tests = Arrays.stream(testFiles)
            .sorted(Comparator.comparing(File::getName))
            .map(this::createTest).toList();

        return DynamicContainer.dynamicContainer("Analyzer tests", tests);
    }

    private DynamicNode createTest(File testFile) {
        var testName = testFile.getName().substring(0, testFile.getName().indexOf('.'));
        return DynamicTest.dynamicTest("analyze " + testName, () -> {
            String output;
            try {
                var result = analyzer.analyzeFile(testFile.toPath());
                output = result.worstLabel() + "\n" + result.bestLabel() + "\n" + result.tightLabel() + "\n";
            } catch (PseudocodeException e) {
                output = "error: " + e.getMessage() + "\n";
            }

            String expectedOutput;
            try (var s = Files.lines(testFile.toPath())) {
                expectedOutput = s.dropWhile(l -> !l.equals("// EXPECTED-OUTPUT")).skip(1)
                    .map(l -> l.substring(2).trim()).reduce("", (a, b) -> a + b + "\n");
            }

            assertEquals(expectedOutput, output);
        });
    }

}
