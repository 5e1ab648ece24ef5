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

package com.amazon.dataquality.dataset;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.dataquality.exception.DataFetchException;

public class InMemoryDataProviderTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 24);

    private InMemoryDataProvider provider;

    private static Map<String, Object> row(LocalDate date, String country, Double amount) {
        Map<String, Object> row = new HashMap<>();
        row.put("created_at", date);
        row.put("country", country);
        row.put("amount", amount);
        return row;
    }

    @BeforeEach
    public void setUp() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row(DAY, "FR", 10.0));
        rows.add(row(DAY, "DE", 20.0));
        rows.add(row(DAY.plusDays(1), "FR", 30.0));
        rows.add(row(DAY.plusDays(1), null, null));
        rows.add(row(DAY.plusDays(8), "FR", 5.0));
        provider = new InMemoryDataProvider("orders", rows);
    }

    @Test
    public void testProjectionWithRangeAndFilter() throws DataFetchException {
        QueryIntent intent = QueryIntent.builder("orders").column("country").column("amount")
                .dateColumn("created_at").dateRange(new DateRange(DAY, DAY.plusDays(2)))
                .filter(Filter.notNull("amount")).orderBy("amount").descending(true).build();
        Dataset dataset = provider.fetch(intent);
        assertThat(dataset.getColumns(), contains("country", "amount"));
        assertEquals(3, dataset.size());
        assertEquals(30.0, dataset.getRow(0).get("amount"));
        assertEquals(10.0, dataset.getRow(2).get("amount"));
    }

    @Test
    public void testDailyAggregates() throws DataFetchException {
        QueryIntent intent = QueryIntent.builder("orders").dateColumn("created_at").dateBucket(DateBucket.DAY)
                .aggregation(Aggregation.sum("amount", "amount")).aggregation(Aggregation.count("count"))
                .orderBy(QueryIntent.PERIOD_COLUMN).build();
        Dataset dataset = provider.fetch(intent);
        assertEquals(3, dataset.size());
        assertEquals(DAY, dataset.getRow(0).get(QueryIntent.PERIOD_COLUMN));
        assertEquals(30.0, dataset.getRow(0).get("amount"));
        assertEquals(2L, dataset.getRow(0).get("count"));
        assertEquals(30.0, dataset.getRow(1).get("amount"));
        assertEquals(2L, dataset.getRow(1).get("count"));
    }

    @Test
    public void testWeeklyGroupedAggregates() throws DataFetchException {
        QueryIntent intent = QueryIntent.builder("orders").dateColumn("created_at").dateBucket(DateBucket.WEEK)
                .groupBy("country").aggregation(Aggregation.count("count"))
                .aggregation(Aggregation.avg("amount", "avg")).orderBy(QueryIntent.PERIOD_COLUMN).orderBy("country")
                .build();
        Dataset dataset = provider.fetch(intent);
        // week of DAY: null, DE, FR; next week: FR
        assertEquals(4, dataset.size());
        assertNull(dataset.getRow(0).get("country"));
        assertNull(dataset.getRow(0).get("avg"));
        assertEquals("DE", dataset.getRow(1).get("country"));
        assertEquals(20.0, dataset.getRow(1).get("avg"));
        assertEquals("FR", dataset.getRow(2).get("country"));
        assertEquals(20.0, dataset.getRow(2).get("avg"));
        assertEquals(DAY.plusDays(7), dataset.getRow(3).get(QueryIntent.PERIOD_COLUMN));
    }

    @Test
    public void testGlobalAggregateOverNoRows() throws DataFetchException {
        QueryIntent intent = QueryIntent.builder("orders").dateColumn("created_at")
                .dateRange(new DateRange(DAY.minusDays(10), DAY.minusDays(5))).aggregation(Aggregation.count("n"))
                .aggregation(Aggregation.sum("amount", "total")).build();
        Dataset dataset = provider.fetch(intent);
        assertEquals(1, dataset.size());
        assertEquals(0L, dataset.getRow(0).get("n"));
        assertNull(dataset.getRow(0).get("total"));
    }

    @Test
    public void testStddev() {
        List<Map<String, Object>> rows = List.of(Map.of("v", 2.0), Map.of("v", 4.0), Map.of("v", 6.0));
        assertEquals(2.0, (Double) InMemoryDataProvider.evaluate(Aggregation.stddev("v", "s"), rows), 1e-12);
        assertNull(InMemoryDataProvider.evaluate(Aggregation.stddev("v", "s"), rows.subList(0, 1)));
        assertEquals(3L, InMemoryDataProvider.evaluate(new Aggregation(AggregateFunction.COUNT, "v", "c"), rows));
    }

    @Test
    public void testUnknownModelAndColumn() {
        DataFetchException e = assertThrows(DataFetchException.class,
                () -> provider.fetch(QueryIntent.builder("missing").build()));
        assertTrue(e.getMessage().contains("missing"));
        e = assertThrows(DataFetchException.class,
                () -> provider.fetch(QueryIntent.builder("orders").column("nope").build()));
        assertEquals("column nope does not exist in orders", e.getMessage());
    }

    @Test
    public void testCompareCells() {
        assertTrue(InMemoryDataProvider.compareCells(null, 1) < 0);
        assertTrue(InMemoryDataProvider.compareCells(2, 1.5) > 0);
        assertTrue(InMemoryDataProvider.compareCells(DAY, "2024-06-25") < 0);
        assertEquals(0, InMemoryDataProvider.compareCells("a", "a"));
    }

    @Test
    public void testIntentValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> QueryIntent.builder("orders").dateBucket(DateBucket.DAY).build());
        assertThrows(IllegalArgumentException.class,
                () -> QueryIntent.builder("orders").column("a").aggregation(Aggregation.count("n")).build());
    }
}
