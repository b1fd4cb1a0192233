package idforecast.config;

/**
 * Variance-stabilizing power transform applied upstream to incidence per 100k population.
 * <p>
 * Forward: trans = (inc + floor)^(1/invPower), then cs = trans / (scale + stabilizer) - center.
 * <p>
 * Each transform owns the constants that pair with it, so a new transform family brings its own.
 */
public enum PowerTransform {

    NONE("none", 1, 0.01, 0.01 + Math.pow(0.75, 4)),
    FOURTH_ROOT("4rt", 4, 0.01, 0.01 + Math.pow(0.75, 4));

    private final String configName;
    private final int inversePower;
    /** Added to the per-series scale factor before multiplying by it. */
    private final double scaleStabilizer;
    /** Offset added before the forward power and subtracted after the inverse. */
    private final double floorOffset;

    PowerTransform(String configName, int inversePower, double scaleStabilizer, double floorOffset) {
        this.configName = configName;
        this.inversePower = inversePower;
        this.scaleStabilizer = scaleStabilizer;
        this.floorOffset = floorOffset;
    }

    /** Resolve a config value; null means no transform. */
    public static PowerTransform fromConfig(String name) {
        if (name == null || name.equalsIgnoreCase("none")) return NONE;
        if (name.equals(FOURTH_ROOT.configName)) return FOURTH_ROOT;
        throw new IllegalArgumentException("unsupported power_transform '" + name + "': must be \"4rt\" or none");
    }

    public String getConfigName() { return configName; }
    public int getInversePower() { return inversePower; }
    public double getScaleStabilizer() { return scaleStabilizer; }
    public double getFloorOffset() { return floorOffset; }

    /** Forward power transform of an incidence rate. */
    public double forward(double incPer100k) {
        return Math.pow(incPer100k + floorOffset, 1.0 / inversePower);
    }

    /** Inverse power transform; negative inputs are clamped to zero first. */
    public double inverse(double transformed) {
        return Math.pow(Math.max(transformed, 0.0), inversePower) - floorOffset;
    }

    /** Center and scale a transformed value the way the upstream feature builder does. */
    public double centerAndScale(double transformed, double centerFactor, double scaleFactor) {
        return transformed / (scaleFactor + scaleStabilizer) - centerFactor;
    }

    /** Undo {@link #centerAndScale}. */
    public double uncenterAndUnscale(double centered, double centerFactor, double scaleFactor) {
        return (centered + centerFactor) * (scaleFactor + scaleStabilizer);
    }
}
