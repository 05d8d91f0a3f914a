/**
 * Copyright (C) 2020  Wikimedia Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wikimedia.analytics.mediasearch.hive;

import org.apache.hadoop.hive.ql.exec.Description;
import org.apache.hadoop.hive.ql.exec.UDF;
import org.wikimedia.analytics.mediasearch.core.aggregate.CategoryNormalizer;

/**
 * A hive UDF to normalize a filter value before counting it:
 * NULL, empty and blank values become 'reset'.
 *
 * Example of use:
 *     SELECT normalize_filter_value(event.filter_value), COUNT(*)
 *     FROM event.mediasearch_interaction
 *     WHERE ...
 *     GROUP BY normalize_filter_value(event.filter_value);
 */
@Description(
    name = "normalize_filter_value",
    value = "_FUNC_(value) - Returns the value, or 'reset' if it is NULL or blank.")
public class NormalizeFilterValueUDF extends UDF {

    public String evaluate(String value) {
        return CategoryNormalizer.normalize(value);
    }
}
