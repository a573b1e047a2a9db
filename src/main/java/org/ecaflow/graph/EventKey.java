package org.ecaflow.graph;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Canonical identity of an Event node.
 *
 * Two triggers with the same kind, subject, target and discriminating
 * parameters map to equal keys regardless of which automation they come
 * from or where they appear in it.
 *
 * @param kind    trigger platform ({@code state}, {@code time}, ...)
 * @param subject primary discriminator: the entity for entity triggers, the
 *                time for {@code time}, the event type for {@code event}, ...
 * @param target  target value, e.g. the {@code to} state; null means "any"
 * @param params  remaining discriminating parameters, sorted by name
 */
public record EventKey(
        String kind,
        String subject,
        String target,
        SortedMap<String, String> params
) {
    public static final String STATE_KIND = "state";

    public EventKey {
        params = Collections.unmodifiableSortedMap(new TreeMap<>(params));
    }

    public static EventKey of(String kind, String subject, String target) {
        return new EventKey(kind, subject, target, new TreeMap<>());
    }

    /**
     * Key of a plain state trigger {@code entity -> state}, the only kind of
     * Event an action effect can fire.
     */
    public static EventKey stateChange(String entityId, String toState) {
        return of(STATE_KIND, entityId, toState);
    }

    /**
     * Report label, e.g. {@code E:state(light.l2→on)} or
     * {@code E:sun(sunset)[offset=-00:30:00]}.
     */
    public String label() {
        StringBuilder sb = new StringBuilder("E:").append(kind);
        if (subject != null) {
            sb.append('(').append(subject);
            if (target != null) {
                sb.append('→').append(target);
            }
            sb.append(')');
        } else if (target != null) {
            sb.append("(→").append(target).append(')');
        }
        if (!params.isEmpty()) {
            sb.append(params.entrySet().stream()
                .map(Map.Entry::toString)
                .collect(Collectors.joining(", ", "[", "]")));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return label();
    }
}
