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

package org.wikimedia.analytics.mediasearch.core.funnel;

import com.google.common.base.Preconditions;

/**
 * One step of a funnel.
 *
 * Required steps form the chain of the funnel: each one is looked for from
 * the time the previous required step happened, and a session that misses
 * one can not complete any later required step.
 *
 * Branch steps (filter usage, copy actions, closing a dialog...) are looked
 * for from the time of their anchor step. They are independent of each other
 * and never break the chain.
 */
public final class FunnelStep {

    private final String name;
    private final EventPredicate predicate;
    private final boolean required;
    private final String anchor;

    private FunnelStep(String name, EventPredicate predicate, boolean required, String anchor) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "A step needs a name");
        this.name = name;
        this.predicate = Preconditions.checkNotNull(predicate, "Step %s needs a predicate", name);
        this.required = required;
        this.anchor = anchor;
    }

    public static FunnelStep required(String name, EventPredicate predicate) {
        return new FunnelStep(name, predicate, true, null);
    }

    /**
     * @param anchor name of an earlier step this one is looked for from
     */
    public static FunnelStep branch(String name, EventPredicate predicate, String anchor) {
        Preconditions.checkNotNull(anchor, "Branch step %s needs an anchor step", name);
        return new FunnelStep(name, predicate, false, anchor);
    }

    public String getName() {
        return name;
    }

    public EventPredicate getPredicate() {
        return predicate;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * @return the anchor step name for branch steps, null for required steps
     */
    public String getAnchor() {
        return anchor;
    }

    @Override
    public String toString() {
        return name + (required ? "" : " (from " + anchor + ")") + ": " + predicate;
    }
}
