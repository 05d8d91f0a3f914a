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

package org.wikimedia.analytics.mediasearch.core.aggregate;

import org.apache.commons.lang3.StringUtils;

/**
 * Normalizes categorical values before they are counted.
 *
 * Clearing a filter is logged with an empty value. Null and blank values
 * are counted under {@link #RESET_LABEL}, never under an empty label.
 */
public class CategoryNormalizer {

    public static final String RESET_LABEL = "reset";

    private CategoryNormalizer() {
    }

    public static String normalize(Object value) {
        if (value == null) {
            return RESET_LABEL;
        }
        String text = value.toString();
        return StringUtils.isBlank(text) ? RESET_LABEL : text;
    }
}
