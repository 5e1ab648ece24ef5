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

import static com.amazon.dataquality.CommonUtils.copyOf;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.config.FindingType;
import com.amazon.dataquality.config.MultivariateConfig;
import com.amazon.dataquality.consensus.ConsensusAggregator;
import com.amazon.dataquality.consensus.ConsensusOutcome;
import com.amazon.dataquality.dataset.DataProvider;
import com.amazon.dataquality.dataset.Dataset;
import com.amazon.dataquality.dataset.DateRange;
import com.amazon.dataquality.dataset.Filter;
import com.amazon.dataquality.dataset.QueryIntent;
import com.amazon.dataquality.detector.DetectionOutput;
import com.amazon.dataquality.detector.DetectionResult;
import com.amazon.dataquality.detector.IsolationForestDetector;
import com.amazon.dataquality.exception.AlgorithmException;
import com.amazon.dataquality.exception.DataFetchException;
import com.amazon.dataquality.exception.InsufficientDataException;
import com.amazon.dataquality.preprocessor.FeaturePreparer;
import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.returntypes.AnomalyFinding;
import com.amazon.dataquality.returntypes.ConsensusVote;
import com.amazon.dataquality.statistics.Percentiles;
import com.amazon.dataquality.tree.IsolationForest;

/**
 * Runs an ensemble of outlier detectors over the rows of the analysis window
 * and reports the rows that enough detectors agree on.
 *
 * <p>
 * The feature matrix is robustly scaled once per call; every detector sees the
 * same scaled matrix. A detector that fails is left out of the vote, and the
 * analysis only fails when none of the requested detectors completed.
 */
@Slf4j
public class MultivariateAnalyzer extends AbstractAnalyzer<MultivariateConfig> {

    public MultivariateAnalyzer(DataProvider dataProvider) {
        this(dataProvider, Clock.system(ZoneOffset.UTC));
    }

    public MultivariateAnalyzer(DataProvider dataProvider, Clock clock) {
        super(dataProvider, clock);
    }

    @Override
    public String getName() {
        return "Multivariate";
    }

    @Override
    protected AnalysisResult doAnalyze(String model, MultivariateConfig config) throws DataFetchException {
        Dataset data = load(model, config);
        if (data.size() < config.getMinSamples()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("minSamples", config.getMinSamples());
            details.put("samples", data.size());
            return AnalysisResult.insufficientData(insufficientMessage(config, data), details);
        }

        double[][] scaled = FeaturePreparer.fitTransform(FeaturePreparer.extract(data, config.getFeatures()),
                config.getClipFactor());

        List<DetectionResult> results = new ArrayList<>();
        for (DetectorType type : config.getAlgorithms()) {
            results.add(DetectionResult.run(type.newDetector(config), scaled, config.getContamination()));
        }

        Map<String, Object> perAlgorithm = new LinkedHashMap<>();
        Map<String, Object> failed = new LinkedHashMap<>();
        for (DetectionResult result : results) {
            if (result.isSuccess()) {
                DetectionOutput output = result.getOutput().get();
                Map<String, Object> summary = new LinkedHashMap<>();
                summary.put("anomalies", output.getAnomaliesCount());
                summary.putAll(output.getDiagnostics());
                perAlgorithm.put(result.getType().label(), summary);
            } else {
                failed.put(result.getType().label(), result.getError().get().getMessage());
            }
        }
        if (failed.size() == results.size()) {
            throw new AlgorithmException("all requested algorithms failed: " + failed);
        }

        ConsensusOutcome consensus = ConsensusAggregator.aggregate(results);
        List<AnomalyFinding> findings = new ArrayList<>(consensus.getVotes().size());
        for (ConsensusVote vote : consensus.getVotes()) {
            findings.add(toFinding(vote, data, config));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("samples", data.size());
        details.put("features", config.getFeatures());
        details.put("algorithmsRun", consensus.getAlgorithmsRun());
        details.put("algorithms", perAlgorithm);
        details.put("failedAlgorithms", failed);
        details.put("consensusThreshold", consensus.getThreshold());
        details.put("totalCandidates", consensus.getTotalCandidates());

        String message = findings.isEmpty() ? "No consensus multivariate anomalies detected"
                : String.format(Locale.ROOT, "%d consensus anomalies detected (%d total candidates from all algorithms)",
                        findings.size(), consensus.getTotalCandidates());
        return AnalysisResult.of(findings, message, details);
    }

    /**
     * Estimates how much each feature drives the isolation scores. One forest is
     * fitted on the scaled matrix; each feature column in turn is shuffled and
     * the rows rescored. The importance of a feature is the mean absolute score
     * change plus the change in the number of rows above the baseline threshold
     * relative to the number of rows, normalized so that the importances sum to
     * one.
     *
     * <p>
     * Never throws: on any failure every feature gets the same importance.
     *
     * @param model  the model to analyze
     * @param config the analysis configuration
     * @return importance per feature, in feature order
     */
    public Map<String, Double> featureImportance(String model, MultivariateConfig config) {
        if (config == null || config.getFeatures() == null) {
            return Collections.emptyMap();
        }
        List<String> features = config.getFeatures();
        try {
            config.validate();
            Dataset data = load(model, config);
            if (data.size() < config.getMinSamples()) {
                throw new InsufficientDataException(insufficientMessage(config, data));
            }
            double[][] scaled = FeaturePreparer.fitTransform(FeaturePreparer.extract(data, features),
                    config.getClipFactor());
            IsolationForest forest = new IsolationForestDetector(config.getNumberOfTrees(), config.getSampleSize(),
                    config.getRandomSeed()).fit(scaled);
            double[] baseline = forest.score(scaled);
            double threshold = Percentiles.percentile(baseline, 100 * (1 - config.getContamination()));
            int baselineCount = countAbove(baseline, threshold);

            Random random = new Random(config.getRandomSeed());
            double[] raw = new double[features.size()];
            double total = 0;
            for (int j = 0; j < features.size(); j++) {
                double[][] shuffled = copyOf(scaled);
                shuffleColumn(shuffled, j, random);
                double[] scores = forest.score(shuffled);
                double delta = 0;
                for (int i = 0; i < scores.length; i++) {
                    delta += Math.abs(scores[i] - baseline[i]);
                }
                raw[j] = delta / scores.length
                        + (double) Math.abs(countAbove(scores, threshold) - baselineCount) / scores.length;
                total += raw[j];
            }
            if (!(total > 0)) {
                return uniform(features);
            }
            Map<String, Double> importance = new LinkedHashMap<>();
            for (int j = 0; j < features.size(); j++) {
                importance.put(features.get(j), raw[j] / total);
            }
            return importance;
        } catch (DataFetchException | RuntimeException e) {
            log.warn("feature importance for {} falls back to uniform: {}", model, e.getMessage());
            return uniform(features);
        }
    }

    private Dataset load(String model, MultivariateConfig config) throws DataFetchException {
        QueryIntent.Builder intent = QueryIntent.builder(model).column(config.getDateColumn())
                .columns(config.getFeatures()).dateColumn(config.getDateColumn())
                .dateRange(DateRange.lastDays(today(), config.getWindowDays())).orderBy(config.getDateColumn())
                .descending(true);
        for (String feature : config.getFeatures()) {
            intent.filter(Filter.notNull(feature));
        }
        Dataset data = fetch(intent.build());
        data.requireColumns(config.getFeatures());
        return data;
    }

    private AnomalyFinding toFinding(ConsensusVote vote, Dataset data, MultivariateConfig config) {
        Map<String, Object> row = data.getRow(vote.getIndex());
        Map<String, Object> evidence = new LinkedHashMap<>();
        for (String feature : config.getFeatures()) {
            evidence.put(feature, row.get(feature));
        }
        List<String> algorithms = vote.getAlgorithms().stream().map(DetectorType::label)
                .collect(Collectors.toList());
        evidence.put("algorithms", algorithms);
        evidence.put("votes", vote.getVotes());
        evidence.put("rowIndex", vote.getIndex());

        String description = String.format(Locale.ROOT, "Row %d flagged by %d of %d algorithms (%s)",
                vote.getIndex(), vote.getVotes(), Math.round(vote.getVotes() / vote.getConfidence()),
                String.join(", ", algorithms));
        return AnomalyFinding.builder().type(FindingType.CONSENSUS_OUTLIER).subject("row_" + vote.getIndex())
                .statistic(vote.getVotes()).severity(ConsensusAggregator.severity(vote.getConfidence()))
                .confidence(vote.getConfidence()).description(description).evidence(evidence).build();
    }

    private static String insufficientMessage(MultivariateConfig config, Dataset data) {
        return String.format(Locale.ROOT, "Insufficient data for multivariate analysis (need %d, got %d)",
                config.getMinSamples(), data.size());
    }

    private static int countAbove(double[] scores, double threshold) {
        int count = 0;
        for (double score : scores) {
            if (score > threshold) {
                ++count;
            }
        }
        return count;
    }

    private static void shuffleColumn(double[][] matrix, int column, Random random) {
        for (int i = matrix.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            double t = matrix[i][column];
            matrix[i][column] = matrix[j][column];
            matrix[j][column] = t;
        }
    }

    private static Map<String, Double> uniform(List<String> features) {
        Map<String, Double> importance = new LinkedHashMap<>();
        for (String feature : features) {
            importance.put(feature, 1.0 / features.size());
        }
        return importance;
    }
}
