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

package com.amazon.lagcaster.serialize;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.lagcaster.LagForecaster;
import com.amazon.lagcaster.exceptions.NotFittedException;
import com.amazon.lagcaster.state.LagForecasterMapper;
import com.amazon.lagcaster.state.LagForecasterState;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * {@link LagForecaster} serialization. Internally we use the
 * {@link LagForecasterMapper} class to convert a fitted forecaster into a
 * state object, and we use <a href="https://github.com/google/gson">Gson</a>
 * to write the state object as a JSON string. The Gson instance is exposed so
 * users can customize the output (e.g., by enabling pretty printing).
 */
@Slf4j
@Getter
public class LagForecasterSerDe {

    private final LagForecasterMapper mapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization. Regressor
     * coefficients may overflow, so special floating point values are allowed.
     */
    public LagForecasterSerDe() {
        this(new LagForecasterMapper(), new GsonBuilder().serializeSpecialFloatingPointValues().create());
    }

    /**
     * Create a SerDe instance using the provided mapper and Gson objects.
     *
     * @param mapper used to convert a forecaster to a state object
     * @param gson   used to generate JSON for a {@link LagForecasterState}
     */
    public LagForecasterSerDe(LagForecasterMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    /**
     * @param forecaster a fitted forecaster
     * @return a json string serialized from the forecaster
     * @throws NotFittedException if the forecaster has not been fit
     */
    public String toJson(LagForecaster forecaster) {
        return gson.toJson(mapper.toState(forecaster));
    }

    public LagForecaster fromJson(String json) {
        LagForecasterState state = gson.fromJson(json, LagForecasterState.class);
        return mapper.toModel(state);
    }

    /**
     * @param json a json string serialized from a forecaster
     * @param seed used for sampling if the saved forecaster was not seeded
     * @return the restored forecaster
     */
    public LagForecaster fromJson(String json, long seed) {
        LagForecasterState state = gson.fromJson(json, LagForecasterState.class);
        return mapper.toModel(state, seed);
    }

    /**
     * writes a fitted forecaster to a file; nothing is written if the forecaster
     * has not been fit
     *
     * @param forecaster a fitted forecaster
     * @param path       the file
     * @throws IOException        if the file cannot be written
     * @throws NotFittedException if the forecaster has not been fit
     */
    public void export(LagForecaster forecaster, Path path) throws IOException {
        LagForecasterState state = mapper.toState(forecaster);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson.toJson(state, writer);
        }
        log.info("exported forecaster to {}", path);
    }

    public LagForecaster read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return mapper.toModel(gson.fromJson(reader, LagForecasterState.class));
        }
    }
}
