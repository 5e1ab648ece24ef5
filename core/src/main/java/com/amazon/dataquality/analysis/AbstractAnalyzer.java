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

package com.amazon.dataquality.analysis;

import static com.amazon.dataquality.CommonUtils.checkNotNull;

import java.time.Clock;
import java.time.LocalDate;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.dataquality.config.AnalysisConfig;
import com.amazon.dataquality.dataset.DataProvider;
import com.amazon.dataquality.dataset.Dataset;
import com.amazon.dataquality.dataset.QueryIntent;
import com.amazon.dataquality.exception.ConfigException;
import com.amazon.dataquality.exception.DataFetchException;
import com.amazon.dataquality.exception.InsufficientDataException;
import com.amazon.dataquality.returntypes.AnalysisResult;

/**
 * Base class of the analyzers. {@link #analyze} is the only entry point and
 * never throws: configuration errors, provider failures and computation errors
 * become failed results, and an {@link InsufficientDataException} becomes a
 * passing result that says nothing was evaluated.
 *
 * <p>
 * Analyzers keep no state between calls apart from the injected provider and
 * clock, so a single instance may be shared by concurrent callers.
 *
 * @param <C> the configuration type
 */
@Slf4j
public abstract class AbstractAnalyzer<C extends AnalysisConfig> {

    @Getter
    protected final DataProvider dataProvider;

    @Getter
    protected final Clock clock;

    protected AbstractAnalyzer(DataProvider dataProvider, Clock clock) {
        this.dataProvider = checkNotNull(dataProvider, "dataProvider must not be null");
        this.clock = checkNotNull(clock, "clock must not be null");
    }

    /**
     * Runs the analysis of one model.
     *
     * @param model  the model (table) to analyze
     * @param config the analysis configuration
     * @return the result; never null
     */
    public final AnalysisResult analyze(String model, C config) {
        try {
            if (model == null || model.isEmpty()) {
                throw ConfigException.missingField("model");
            }
            if (config == null) {
                throw ConfigException.missingField("config");
            }
            config.validate();
            log.debug("{} analysis of {} started", getName(), model);
            AnalysisResult result = doAnalyze(model, config);
            log.debug("{} analysis of {} finished: passed={}, anomalies={}", getName(), model, result.isPassed(),
                    result.getAnomaliesCount());
            return result;
        } catch (InsufficientDataException e) {
            log.debug("{} analysis of {} not evaluated: {}", getName(), model, e.getMessage());
            return AnalysisResult.insufficientData(e.getMessage(), null);
        } catch (DataFetchException | RuntimeException e) {
            log.error("{} analysis failed for {}: {}", getName(), model, e.getMessage(), e);
            return AnalysisResult.failure(getName() + " analysis failed: " + e.getMessage(), e);
        }
    }

    /**
     * The analysis proper, called with a validated configuration.
     */
    protected abstract AnalysisResult doAnalyze(String model, C config) throws DataFetchException;

    /**
     * @return the name used in messages, e.g. "Correlation"
     */
    public abstract String getName();

    protected LocalDate today() {
        return LocalDate.now(clock);
    }

    protected Dataset fetch(QueryIntent intent) throws DataFetchException {
        Dataset dataset = dataProvider.fetch(intent);
        return dataset == null ? Dataset.empty() : dataset;
    }
}
