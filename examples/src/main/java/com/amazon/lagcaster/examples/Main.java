/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.lagcaster.examples;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.lagcaster.examples.forecasting.GaussianForecast;
import com.amazon.lagcaster.examples.forecasting.PoissonAnomalyScore;
import com.amazon.lagcaster.examples.forecasting.QuantileForecast;
import com.amazon.lagcaster.examples.serialization.JsonExample;

/**
 * Runs one of the examples by name, or all of them in turn with {@code all}.
 */
public class Main {

    public static final String ARCHIVE_NAME = "lagcaster-examples-1.0.jar";

    public static final String ALL = "all";

    public static void main(String[] args) throws Exception {
        new Main(Arrays.asList(new PoissonAnomalyScore(), new QuantileForecast(), new GaussianForecast(),
                new JsonExample())).run(args);
    }

    // insertion order is the order of the usage text and of "all"
    private final Map<String, Example> examples = new LinkedHashMap<>();

    public Main(List<Example> available) {
        for (Example example : available) {
            if (examples.putIfAbsent(example.command(), example) != null) {
                throw new IllegalArgumentException("duplicate example command: " + example.command());
            }
        }
    }

    public void run(String[] args) throws Exception {
        if (args == null || args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage();
            return;
        }

        String command = args[0];
        if (ALL.equals(command)) {
            for (Example example : examples.values()) {
                System.out.printf("== %s ==%n", example.command());
                example.run();
            }
            return;
        }
        Example example = examples.get(command);
        if (example == null) {
            throw new IllegalArgumentException("No such example: " + command + ", expected one of " + examples.keySet());
        }
        example.run();
    }

    public void printUsage() {
        System.out.printf("Usage: java -jar %s [example|%s]%n", ARCHIVE_NAME, ALL);
        System.out.println("Examples:");
        int width = examples.keySet().stream().mapToInt(String::length).max().orElse(1);
        String format = "\t %-" + width + "s  %s%n";
        examples.values().forEach(example -> System.out.printf(format, example.command(), example.description()));
    }
}
