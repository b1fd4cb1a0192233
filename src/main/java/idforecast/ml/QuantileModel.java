package idforecast.ml;

/** A fitted model for one quantile level. */
public interface QuantileModel {

    /** One prediction per row of {@code x}, which must have the training column count. */
    double[] predict(double[][] x);

    /** Importance score per training feature column. */
    double[] featureImportance();
}
