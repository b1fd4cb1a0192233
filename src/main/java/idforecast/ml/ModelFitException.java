package idforecast.ml;

/** A model fit failed; the run is aborted without partial results. */
public class ModelFitException extends RuntimeException {

    public ModelFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
