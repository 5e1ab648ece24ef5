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

import com.amazon.dataquality.exception.DataFetchException;

/**
 * The data-fetch layer consumed by the analyzers. Implementations translate a
 * dialect-neutral {@link QueryIntent} into whatever their store understands and
 * return the materialized result. Timeouts and retries, if any, belong to the
 * implementation.
 */
public interface DataProvider {

    /**
     * @param intent what to fetch
     * @return the fetched rows, possibly empty but never null
     * @throws DataFetchException if the store could not be queried
     */
    Dataset fetch(QueryIntent intent) throws DataFetchException;
}
