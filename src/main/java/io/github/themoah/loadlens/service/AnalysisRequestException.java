package io.github.themoah.loadlens.service;

/**
 * Thrown when an analysis request cannot be decoded.
 */
public class AnalysisRequestException extends Exception {

  public AnalysisRequestException(String message) {
    super(message);
  }

  public AnalysisRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
