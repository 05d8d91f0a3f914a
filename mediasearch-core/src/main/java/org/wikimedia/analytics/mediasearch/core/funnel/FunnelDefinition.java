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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * Ordered list of funnel steps, the first of which starts the session.
 *
 * Several definitions can share step names and differ in their predicates,
 * for instance the "add media" and "edit media" paths through the same
 * dialog. The variant label tells their results apart.
 */
public final class FunnelDefinition {

    private final String name;
    private final String variant;
    private final List<FunnelStep> steps;
    private final Map<String, Integer> stepIndexes;

    public FunnelDefinition(String name, List<FunnelStep> steps) {
        this(name, null, steps);
    }

    public FunnelDefinition(String name, String variant, List<FunnelStep> steps) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "A funnel needs a name");
        Preconditions.checkArgument(steps != null && !steps.isEmpty(), "Funnel %s has no steps", name);
        Preconditions.checkArgument(steps.get(0).isRequired(),
            "The first step of funnel %s starts the session and must be required", name);

        Map<String, Integer> indexes = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            FunnelStep step = steps.get(i);
            Preconditions.checkArgument(!indexes.containsKey(step.getName()),
                "Funnel %s has two steps named %s", name, step.getName());
            if (!step.isRequired()) {
                Preconditions.checkArgument(indexes.containsKey(step.getAnchor()),
                    "Step %s of funnel %s is anchored on %s which is not an earlier step",
                    step.getName(), name, step.getAnchor());
            }
            indexes.put(step.getName(), i);
        }

        this.name = name;
        this.variant = variant;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.stepIndexes = Collections.unmodifiableMap(indexes);
    }

    public String getName() {
        return name;
    }

    /**
     * @return the variant label, null when the funnel has a single variant
     */
    public String getVariant() {
        return variant;
    }

    public List<FunnelStep> getSteps() {
        return steps;
    }

    public FunnelStep getStartStep() {
        return steps.get(0);
    }

    public FunnelStep getStep(int index) {
        return steps.get(index);
    }

    public int size() {
        return steps.size();
    }

    /**
     * @return the position of the named step, -1 if there is none
     */
    public int indexOf(String stepName) {
        Integer index = stepIndexes.get(stepName);
        return index == null ? -1 : index;
    }

    public List<String> getStepNames() {
        List<String> names = new ArrayList<>(steps.size());
        for (FunnelStep step : steps) {
            names.add(step.getName());
        }
        return names;
    }

    @Override
    public String toString() {
        return "FunnelDefinition{" + name + (variant == null ? "" : "/" + variant) + ", steps=" + steps + '}';
    }
}
