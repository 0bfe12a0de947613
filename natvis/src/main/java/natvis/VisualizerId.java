package natvis;

/**
 * A UI visualizer (custom viewer) offered for a value, as (service guid, id within service).
 */
public final class VisualizerId {
    public final String serviceId;
    public final int id;

    public VisualizerId(String serviceId, int id) {
        this.serviceId = serviceId;
        this.id = id;
    }

    @Override
    public int hashCode() {
        return 31 * serviceId.hashCode() + id;
    }

    @Override
    public boolean equals(Object v) {
        if (v instanceof VisualizerId) {
            var other = (VisualizerId)v;
            return other.serviceId.equals(serviceId) && other.id == id;
        }
        return false;
    }

    @Override
    public String toString() {
        return "{serviceId=" + serviceId + ", id=" + id + "}";
    }
}
