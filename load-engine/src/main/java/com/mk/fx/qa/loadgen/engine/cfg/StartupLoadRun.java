package com.mk.fx.qa.loadgen.engine.cfg;

import com.mk.fx.qa.loadgen.engine.error.LoadConfigException;
import com.mk.fx.qa.loadgen.engine.executors.LoadRunner;
import com.mk.fx.qa.loadgen.engine.executors.RequestWorkUnit;
import com.mk.fx.qa.loadgen.engine.executors.RunParameters;
import com.mk.fx.qa.loadgen.engine.executors.RunResult;
import com.mk.fx.qa.loadgen.engine.metrics.EngineContext;
import com.mk.fx.qa.loadgen.engine.model.LoadModel;
import com.mk.fx.qa.loadgen.rest.HttpMethod;
import com.mk.fx.qa.loadgen.rest.LoadHttpClient;
import com.mk.fx.qa.loadgen.rest.Request;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Runs a single-request load against {@code loadgen.http.base-url} once the context is up. */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "loadgen.run", name = "enabled", havingValue = "true")
public class StartupLoadRun implements ApplicationRunner {

  private final LoadGeneratorProperties properties;
  private final ObjectProvider<LoadHttpClient> client;
  private final EngineContext context;

  public StartupLoadRun(
      LoadGeneratorProperties properties,
      ObjectProvider<LoadHttpClient> client,
      EngineContext context) {
    this.properties = properties;
    this.client = client;
    this.context = context;
  }

  @Override
  public void run(ApplicationArguments args) throws InterruptedException {
    var run = properties.getRun();
    var httpClient = client.getIfAvailable();
    if (httpClient == null) {
      throw new LoadConfigException("loadgen.http.base-url", "required when loadgen.run.enabled is set");
    }
    var method =
        HttpMethod.parse(run.getMethod())
            .orElseThrow(
                () ->
                    new LoadConfigException(
                        "loadgen.run.method", "unsupported HTTP method '" + run.getMethod() + "'"));

    var request = new Request();
    request.setMethod(method);
    request.setPath(run.getPath());
    request.setBody(run.getBody());

    LoadModel model =
        run.getTargetRps() == null ? new LoadModel.Concurrent() : new LoadModel.Rps(run.getTargetRps());
    var config = new RuntimeConfigHolder(model);

    RunResult result =
        LoadRunner.execute(
            UUID.randomUUID().toString(),
            new RunParameters(run.getWorkers(), run.getDuration()),
            config,
            context,
            new RequestWorkUnit(httpClient, request, context),
            () -> false);
    log.info(
        "Startup run complete: iterations={} failures={} elapsed={}",
        result.iterations(),
        result.failures(),
        result.elapsed());
  }
}
