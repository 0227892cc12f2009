package dev;

import com.retrykit.core.cancel.CancellationToken;
import com.retrykit.core.config.RetryConfig;
import com.retrykit.core.config.YamlConfigLoader;
import com.retrykit.core.model.RetryResult;
import com.retrykit.core.retry.CountingRetryListener;
import com.retrykit.core.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * java.net.http GET을 RetryExecutor로 감싸는 스모크 클라이언트.
 * 5xx / 429 응답과 IOException만 재시도, 나머지는 즉시 종료.
 */
public final class SmokeRunner {

  private static final Logger LOG = LoggerFactory.getLogger(SmokeRunner.class);

  private final HttpClient client;
  private final RetryConfig config;
  private final CountingRetryListener counter = new CountingRetryListener();
  private final RetryExecutor executor;

  public SmokeRunner(RetryConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    this.executor = RetryExecutor.fromConfig(config, counter);
  }

  /** 상태 코드가 재시도 대상인지 */
  static boolean isRetryableStatus(int code) {
    return code == 429 || code >= 500;
  }

  public RetryResult<HttpResponse<String>> get(URI uri, CancellationToken token) {
    HttpRequest req = HttpRequest.newBuilder(uri).timeout(Duration.ofSeconds(5)).GET().build();
    return executor.run(
        () -> client.send(req, HttpResponse.BodyHandlers.ofString()),
        resp -> isRetryableStatus(resp.statusCode()),
        e -> e instanceof IOException,
        config,
        token);
  }

  public CountingRetryListener counter() { return counter; }

  /** args: [retry.yml 경로]. 없으면 클래스패스의 retry.yml */
  public static void main(String[] args) throws Exception {
    RetryConfig cfg = loadConfig(args);
    LOG.info("smoke config: {}", cfg);

    try (SmokeTarget target = SmokeTarget.start(0)) {
      SmokeRunner runner = new SmokeRunner(cfg);
      URI flaky = target.baseUri().resolve("/flaky?key=smoke&failures=" + (cfg.getMaxAttempts() - 1));
      URI teapot = target.baseUri().resolve("/teapot");

      report("flaky", runner.get(flaky, CancellationToken.none()));
      report("teapot", runner.get(teapot, CancellationToken.none()));
      LOG.info("retries={}, totalBackoff={}ms",
          runner.counter().getBackoffCount(), runner.counter().getTotalBackoff().toMillis());
    }
  }

  static RetryConfig loadConfig(String[] args) throws IOException {
    if (args.length > 0) return YamlConfigLoader.load(Path.of(args[0]));
    try (InputStream in = SmokeRunner.class.getResourceAsStream("/retry.yml")) {
      if (in == null) return RetryConfig.defaults().setInitialDelayMs(50).setMaxDelayMs(500);
      return YamlConfigLoader.load(in);
    }
  }

  private static void report(String name, RetryResult<HttpResponse<String>> r) {
    if (r.isSuccess()) {
      LOG.info("[{}] status={} attempts={} body={}", name, r.getValue().statusCode(), r.attempts(), r.getValue().body());
    } else {
      LOG.warn("[{}] {}", name, r.getFailure().getMessage());
    }
  }
}
