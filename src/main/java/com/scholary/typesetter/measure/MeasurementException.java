package com.scholary.typesetter.measure;

/** Exception thrown when a fragment cannot be measured. */
public class MeasurementException extends RuntimeException {

  public MeasurementException(String message) {
    super(message);
  }

  public MeasurementException(String message, Throwable cause) {
    super(message, cause);
  }
}
