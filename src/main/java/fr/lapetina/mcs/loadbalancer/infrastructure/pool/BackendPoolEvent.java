package fr.lapetina.mcs.loadbalancer.infrastructure.pool;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;

/**
 * Event for backend pool changes.
 */
public record BackendPoolEvent(Type type, BackendEndpoint backend) {
    public enum Type {
        ADDED,
        REMOVED,
        PRESENCE_CHANGED,
        HEALTH_CHANGED
    }
}
