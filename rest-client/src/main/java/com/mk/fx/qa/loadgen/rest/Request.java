package com.mk.fx.qa.loadgen.rest;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

@Data
public class Request {
  private HttpMethod method;
  private String path;
  private Map<String, String> headers = new LinkedHashMap<>();
  private String body;
}
