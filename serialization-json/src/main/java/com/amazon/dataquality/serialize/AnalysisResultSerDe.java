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


package com.amazon.dataquality.serialize;

import lombok.Getter;

import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.state.AnalysisResultMapper;
import com.amazon.dataquality.state.AnalysisResultState;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.ToNumberPolicy;

/**
 * {@link AnalysisResult} serialization. The result is converted into an
 * {@link AnalysisResultState} by {@link AnalysisResultMapper} and the state
 * object is written as JSON with <a href="https://github.com/google/gson">Gson</a>.
 * The Gson instance is exposed so callers can customize the output, e.g. by
 * enabling pretty printing.
 * <p>
 * The default Gson reads untyped numbers in {@code details} and
 * {@code evidence} back as {@code Long} when they are integral and as
 * {@code Double} otherwise, and writes NaN and infinite values as bare
 * literals.
 */
@Getter
public class AnalysisResultSerDe {

    private final AnalysisResultMapper mapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization.
     */
    public AnalysisResultSerDe() {
        this(new AnalysisResultMapper(), new GsonBuilder().serializeSpecialFloatingPointValues()
                .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE).create());
    }

    /**
     * Create a SerDe instance using the provided mapper and Gson objects.
     *
     * @param mapper converts an AnalysisResult to a corresponding state object
     * @param gson   writes and reads {@link AnalysisResultState} objects
     */
    public AnalysisResultSerDe(AnalysisResultMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    /**
     * Serializes a result to a json string.
     *
     * @param result an analysis result
     * @return a json string serialized from the result
     */
    public String toJson(AnalysisResult result) {
        return gson.toJson(mapper.toState(result));
    }

    /**
     * Deserializes a json string produced by {@link #toJson(AnalysisResult)}.
     *
     * @param json a json string serialized from a result
     * @return the deserialized result
     * @throws IllegalArgumentException if the state version is not supported or
     *                                  the state breaks a result invariant
     */
    public AnalysisResult fromJson(String json) {
        AnalysisResultState state = gson.fromJson(json, AnalysisResultState.class);
        return mapper.toModel(state);
    }
}
