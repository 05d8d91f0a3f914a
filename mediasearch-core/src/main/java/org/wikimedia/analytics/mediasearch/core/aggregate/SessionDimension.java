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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import com.google.common.base.Preconditions;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.funnel.SessionFunnel;
import org.wikimedia.analytics.mediasearch.core.funnel.StepOutcome;

/**
 * Categorical key sessions are grouped by before counting, such as the
 * funnel path type or the namespace a search started in.
 *
 * Declared values are groups that get a row even when no session falls
 * in them.
 */
public final class SessionDimension {

    public static final String UNKNOWN_LABEL = "unknown";

    private final String column;
    private final String stepName;
    private final Function<SessionFunnel, String> extractor;
    private final List<String> declaredValues;

    private SessionDimension(String column, String stepName, Function<SessionFunnel, String> extractor,
                             List<String> declaredValues) {
        Preconditions.checkArgument(column != null && !column.isEmpty(), "A dimension needs a column name");
        this.column = column;
        this.stepName = stepName;
        this.extractor = extractor;
        this.declaredValues = Collections.unmodifiableList(new ArrayList<>(declaredValues));
    }

    /**
     * Same value for every session.
     */
    public static SessionDimension constant(String column, String value) {
        return new SessionDimension(column, null, funnel -> value, Collections.singletonList(value));
    }

    /**
     * Variant label of the funnel definition the session was matched with.
     */
    public static SessionDimension variant(String column) {
        return new SessionDimension(column, null, funnel -> {
            String variant = funnel.getDefinition().getVariant();
            return variant == null ? UNKNOWN_LABEL : variant;
        }, Collections.<String>emptyList());
    }

    /**
     * Attribute of the event that completed a step, the default label when
     * the step is absent or the event lacks the attribute.
     */
    public static SessionDimension stepAttribute(String column, String stepName, String attribute,
                                                 String defaultLabel) {
        Preconditions.checkNotNull(defaultLabel, "Dimension %s needs a default label", column);
        Preconditions.checkArgument(stepName != null, "Dimension %s needs a step", column);
        return new SessionDimension(column, stepName, funnel -> {
            StepOutcome outcome = funnel.getOutcome(stepName);
            if (!outcome.isPresent()) {
                return defaultLabel;
            }
            Event event = outcome.getEvent();
            String value = event.getStringAttribute(attribute);
            return value == null || value.isEmpty() ? defaultLabel : value;
        }, Collections.<String>emptyList());
    }

    public SessionDimension withDeclaredValues(List<String> values) {
        return new SessionDimension(column, stepName, extractor, values);
    }

    public String getColumn() {
        return column;
    }

    /**
     * @return the step whose event the value is read from, null when the
     *         value does not depend on a step
     */
    public String getStepName() {
        return stepName;
    }

    public List<String> getDeclaredValues() {
        return declaredValues;
    }

    public String valueFor(SessionFunnel funnel) {
        return extractor.apply(funnel);
    }

    @Override
    public String toString() {
        return "SessionDimension{" + column + (declaredValues.isEmpty() ? "" : ", " + declaredValues) + '}';
    }
}
