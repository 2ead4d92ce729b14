package com.proptrading.domain.positions;

public class PositionDomainException extends RuntimeException {
  public PositionDomainException(String message) {
    super(message);
  }
}
