package idforecast.config;

import java.util.List;

/**
 * Immutable settings for one model. Built once per run and handed to every component that needs it.
 */
public final class ModelConfig {

    private final ModelClass modelClass;
    private final String modelName;
    private final int numBags;
    private final double bagFracSamples;
    private final boolean fitLocationsSeparately;
    private final PowerTransform powerTransform;
    private final boolean inclLevelFeats;
    private final List<String> sources;
    private final String targetSource;
    private final int numThreads;
    private final BoosterParams booster;
    private final SarixParams sarix;

    private ModelConfig(Builder b) {
        if (b.modelName == null || b.modelName.isBlank()) {
            throw new IllegalArgumentException("model_name required");
        }
        if (b.numBags < 1) throw new IllegalArgumentException("num_bags must be >= 1");
        if (!(b.bagFracSamples > 0 && b.bagFracSamples <= 1)) {
            throw new IllegalArgumentException("bag_frac_samples must be in (0, 1], got " + b.bagFracSamples);
        }
        if (b.numThreads < 1) throw new IllegalArgumentException("num_threads must be >= 1");
        if (b.targetSource == null || b.targetSource.isBlank()) {
            throw new IllegalArgumentException("target_source required");
        }
        if (b.sources == null || !b.sources.contains(b.targetSource)) {
            throw new IllegalArgumentException("sources must include the target source '" + b.targetSource + "'");
        }
        this.modelClass = b.modelClass;
        this.modelName = b.modelName;
        this.numBags = b.numBags;
        this.bagFracSamples = b.bagFracSamples;
        this.fitLocationsSeparately = b.fitLocationsSeparately;
        this.powerTransform = b.powerTransform;
        this.inclLevelFeats = b.inclLevelFeats;
        this.sources = List.copyOf(b.sources);
        this.targetSource = b.targetSource;
        this.numThreads = b.numThreads;
        this.booster = b.booster;
        this.sarix = b.sarix;
    }

    public static Builder builder(String modelName) {
        return new Builder(modelName);
    }

    public ModelClass getModelClass() { return modelClass; }
    public String getModelName() { return modelName; }
    public int getNumBags() { return numBags; }
    public double getBagFracSamples() { return bagFracSamples; }
    public boolean isFitLocationsSeparately() { return fitLocationsSeparately; }
    public PowerTransform getPowerTransform() { return powerTransform; }
    public boolean isInclLevelFeats() { return inclLevelFeats; }
    public List<String> getSources() { return sources; }
    /** Source whose rows are published; the others only inform training. */
    public String getTargetSource() { return targetSource; }
    public int getNumThreads() { return numThreads; }
    public BoosterParams getBooster() { return booster; }
    public SarixParams getSarix() { return sarix; }

    public static final class Builder {
        private ModelClass modelClass = ModelClass.GBQR;
        private final String modelName;
        private int numBags = 100;
        private double bagFracSamples = 0.7;
        private boolean fitLocationsSeparately;
        private PowerTransform powerTransform = PowerTransform.FOURTH_ROOT;
        private boolean inclLevelFeats = true;
        private List<String> sources = List.of("nhsn");
        private String targetSource = "nhsn";
        private int numThreads = 1;
        private BoosterParams booster = BoosterParams.DEFAULTS;
        private SarixParams sarix = SarixParams.DEFAULTS;

        private Builder(String modelName) {
            this.modelName = modelName;
        }

        public Builder modelClass(ModelClass v) { this.modelClass = v; return this; }
        public Builder numBags(int v) { this.numBags = v; return this; }
        public Builder bagFracSamples(double v) { this.bagFracSamples = v; return this; }
        public Builder fitLocationsSeparately(boolean v) { this.fitLocationsSeparately = v; return this; }
        public Builder powerTransform(PowerTransform v) { this.powerTransform = v; return this; }
        public Builder inclLevelFeats(boolean v) { this.inclLevelFeats = v; return this; }
        public Builder sources(List<String> v) { this.sources = v; return this; }
        public Builder targetSource(String v) { this.targetSource = v; return this; }
        public Builder numThreads(int v) { this.numThreads = v; return this; }
        public Builder booster(BoosterParams v) { this.booster = v; return this; }
        public Builder sarix(SarixParams v) { this.sarix = v; return this; }

        public ModelConfig build() {
            return new ModelConfig(this);
        }
    }
}
