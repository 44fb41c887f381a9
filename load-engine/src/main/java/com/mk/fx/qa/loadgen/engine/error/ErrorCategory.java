package com.mk.fx.qa.loadgen.engine.error;

import com.mk.fx.qa.loadgen.rest.TransportException;
import java.util.Locale;

/** Coarse failure categories used for outcome events and the error breakdown. */
public enum ErrorCategory {
  CLIENT_ERROR,
  SERVER_ERROR,
  NETWORK_ERROR,
  TIMEOUT_ERROR,
  TLS_ERROR,
  ASSERTION_FAILURE,
  OTHER_ERROR;

  /** Category of an HTTP status, or {@code null} when the status is not an error. */
  public static ErrorCategory fromStatusCode(int status) {
    if (status >= 400 && status < 500) {
      return CLIENT_ERROR;
    }
    if (status >= 500 && status < 600) {
      return SERVER_ERROR;
    }
    return null;
  }

  public static ErrorCategory fromTransportKind(TransportException.Kind kind) {
    if (kind == null) {
      return OTHER_ERROR;
    }
    return switch (kind) {
      case DNS, CONNECT, IO -> NETWORK_ERROR;
      case TIMEOUT -> TIMEOUT_ERROR;
      case TLS -> TLS_ERROR;
      case REQUEST -> OTHER_ERROR;
    };
  }

  /** Lower-case label used in reports, e.g. {@code server_error}. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
