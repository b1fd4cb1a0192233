package idforecast.config;

public enum ModelClass {
    GBQR("gbqr"),
    SARIX("sarix");

    private final String configName;

    ModelClass(String configName) {
        this.configName = configName;
    }

    public static ModelClass fromConfig(String name) {
        for (ModelClass m : values()) {
            if (m.configName.equals(name)) return m;
        }
        throw new IllegalArgumentException("unsupported model_class '" + name + "': must be \"gbqr\" or \"sarix\"");
    }

    public String getConfigName() { return configName; }
}
