package natvis.rules;

public final class UiVisualizerRegistration {
    public final String serviceId;
    public final int id;
    public final String menuName;

    public UiVisualizerRegistration(String serviceId, int id, String menuName) {
        this.serviceId = serviceId;
        this.id = id;
        this.menuName = menuName;
    }
}
