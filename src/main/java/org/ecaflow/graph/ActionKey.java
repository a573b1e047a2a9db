package org.ecaflow.graph;

/**
 * Canonical identity of an Action node.
 *
 * @param signature      service signature, e.g. {@code light.turn_on} or
 *                       {@code climate.set_hvac_mode:cool}
 * @param entityId       target entity, null when the call has none
 * @param resultingState state the effect catalog says the call produces,
 *                       null when the signature is not cataloged
 */
public record ActionKey(String signature, String entityId, String resultingState) {

    public boolean hasEffect() {
        return entityId != null && resultingState != null;
    }

    /**
     * Report label, e.g. {@code A:light.turn_on(light.l1=on)}.
     */
    public String label() {
        StringBuilder sb = new StringBuilder("A:").append(signature);
        if (entityId != null) {
            sb.append('(').append(entityId);
            if (resultingState != null) {
                sb.append('=').append(resultingState);
            }
            sb.append(')');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return label();
    }
}
