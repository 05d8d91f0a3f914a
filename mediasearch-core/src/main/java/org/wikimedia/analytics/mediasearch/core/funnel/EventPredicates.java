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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import org.wikimedia.analytics.mediasearch.core.Event;

/**
 * Factory for the predicates funnel definitions are built from.
 *
 * Attribute comparisons are done on the string form of values so that a
 * position of 3 read from YAML matches a position of "3" read from a log.
 */
public class EventPredicates {

    private EventPredicates() {
    }

    /**
     * Matches events whose action is one of the given actions.
     */
    public static EventPredicate action(String... actions) {
        return action(Arrays.asList(actions));
    }

    public static EventPredicate action(List<String> actions) {
        Preconditions.checkArgument(!actions.isEmpty(), "At least one action is required");
        return new ActionPredicate(new LinkedHashSet<>(actions));
    }

    public static EventPredicate attributeEquals(String name, Object value) {
        Preconditions.checkNotNull(name, "attribute name is required");
        Preconditions.checkNotNull(value, "attribute value is required, use hasAttribute to test presence");
        return new AttributeEquals(name, value.toString());
    }

    public static EventPredicate hasAttribute(String name) {
        Preconditions.checkNotNull(name, "attribute name is required");
        return new HasAttribute(name);
    }

    public static EventPredicate anyOf(EventPredicate... predicates) {
        return anyOf(Arrays.asList(predicates));
    }

    public static EventPredicate anyOf(List<EventPredicate> predicates) {
        Preconditions.checkArgument(!predicates.isEmpty(), "anyOf needs at least one predicate");
        return predicates.size() == 1 ? predicates.get(0) : new AnyOf(predicates);
    }

    public static EventPredicate allOf(EventPredicate... predicates) {
        return allOf(Arrays.asList(predicates));
    }

    public static EventPredicate allOf(List<EventPredicate> predicates) {
        Preconditions.checkArgument(!predicates.isEmpty(), "allOf needs at least one predicate");
        return predicates.size() == 1 ? predicates.get(0) : new AllOf(predicates);
    }

    public static EventPredicate not(EventPredicate predicate) {
        return new Not(Preconditions.checkNotNull(predicate));
    }

    private static final class ActionPredicate implements EventPredicate {
        private final Set<String> actions;

        ActionPredicate(Set<String> actions) {
            this.actions = Collections.unmodifiableSet(actions);
        }

        @Override
        public boolean matches(Event event) {
            return event.getAction() != null && actions.contains(event.getAction());
        }

        @Override
        public String toString() {
            return actions.size() == 1
                ? "action=" + actions.iterator().next()
                : "action in [" + Joiner.on(", ").join(actions) + "]";
        }
    }

    private static final class AttributeEquals implements EventPredicate {
        private final String name;
        private final String value;

        AttributeEquals(String name, String value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public boolean matches(Event event) {
            return value.equals(event.getStringAttribute(name));
        }

        @Override
        public String toString() {
            return name + "=" + value;
        }
    }

    private static final class HasAttribute implements EventPredicate {
        private final String name;

        HasAttribute(String name) {
            this.name = name;
        }

        @Override
        public boolean matches(Event event) {
            return event.hasAttribute(name);
        }

        @Override
        public String toString() {
            return "has(" + name + ")";
        }
    }

    private static final class AnyOf implements EventPredicate {
        private final List<EventPredicate> predicates;

        AnyOf(List<EventPredicate> predicates) {
            this.predicates = Collections.unmodifiableList(new ArrayList<>(predicates));
        }

        @Override
        public boolean matches(Event event) {
            for (EventPredicate predicate : predicates) {
                if (predicate.matches(event)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String toString() {
            return "(" + Joiner.on(" OR ").join(predicates) + ")";
        }
    }

    private static final class AllOf implements EventPredicate {
        private final List<EventPredicate> predicates;

        AllOf(List<EventPredicate> predicates) {
            this.predicates = Collections.unmodifiableList(new ArrayList<>(predicates));
        }

        @Override
        public boolean matches(Event event) {
            for (EventPredicate predicate : predicates) {
                if (!predicate.matches(event)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String toString() {
            return "(" + Joiner.on(" AND ").join(predicates) + ")";
        }
    }

    private static final class Not implements EventPredicate {
        private final EventPredicate predicate;

        Not(EventPredicate predicate) {
            this.predicate = predicate;
        }

        @Override
        public boolean matches(Event event) {
            return !predicate.matches(event);
        }

        @Override
        public String toString() {
            return "NOT " + predicate;
        }
    }
}
