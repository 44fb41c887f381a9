package com.mk.fx.qa.loadgen.engine.data;

import com.mk.fx.qa.loadgen.engine.error.LoadConfigException;

/** Tabular input could not be loaded or has no data rows. */
public class DataSourceException extends LoadConfigException {

  public DataSourceException(String message) {
    super("dataSource", message);
  }

  public DataSourceException(String message, Throwable cause) {
    super("dataSource", message, cause);
  }
}
