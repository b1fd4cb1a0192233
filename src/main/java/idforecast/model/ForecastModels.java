package idforecast.model;

import idforecast.config.ModelConfig;

public final class ForecastModels {

    private ForecastModels() {
    }

    public static ForecastModel create(ModelConfig config) {
        switch (config.getModelClass()) {
            case GBQR: return new GbqrModel(config);
            case SARIX: return new SarixModel(config);
            default: throw new IllegalArgumentException("unsupported model class " + config.getModelClass());
        }
    }
}
