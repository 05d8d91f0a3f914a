package org.wikimedia.analytics.mediasearch.core.funnel;

import org.wikimedia.analytics.mediasearch.core.Event;

/**
 * Condition an event must satisfy to count as a funnel step.
 *
 * Alternatives for one step (two ways of closing a dialog, say) are a
 * single compound predicate, see {@link EventPredicates#anyOf}.
 */
public interface EventPredicate {

    boolean matches(Event event);
}
