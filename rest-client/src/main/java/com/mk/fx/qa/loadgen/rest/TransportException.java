package com.mk.fx.qa.loadgen.rest;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import javax.net.ssl.SSLException;
import lombok.Getter;

/**
 * Raised by {@link LoadHttpClient} when a request could not be completed at the transport level
 * (DNS, connect, TLS, timeout, I/O). HTTP error statuses are not transport failures and are
 * returned as regular {@link RestResponseData}.
 */
@Getter
public class TransportException extends RuntimeException {

  /** Coarse classification of the underlying failure. */
  public enum Kind {
    DNS,
    CONNECT,
    TLS,
    TIMEOUT,
    IO,
    REQUEST
  }

  private final Kind kind;

  public TransportException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /** Walks the cause chain and classifies the deepest recognised failure. */
  public static Kind classify(Throwable t) {
    Kind kind = Kind.IO;
    Throwable current = t;
    while (current != null) {
      if (current instanceof HttpConnectTimeoutException) {
        return Kind.TIMEOUT;
      }
      if (current instanceof HttpTimeoutException || current instanceof SocketTimeoutException) {
        kind = Kind.TIMEOUT;
      } else if (current instanceof UnknownHostException) {
        return Kind.DNS;
      } else if (current instanceof SSLException) {
        return Kind.TLS;
      } else if (current instanceof ConnectException
          || current instanceof NoRouteToHostException) {
        kind = kind == Kind.TIMEOUT ? kind : Kind.CONNECT;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return kind;
  }
}
