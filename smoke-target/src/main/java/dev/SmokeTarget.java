package dev;

import com.sun.net.httpserver.*;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 재시도 스모크용 로컬 HTTP 타깃.
 *  - /health                    : 항상 200
 *  - /flaky?key=K&failures=N    : 키별로 처음 N번은 503, 이후 200
 *  - /teapot                    : 항상 418 (재시도 대상 아님)
 */
public class SmokeTarget implements AutoCloseable {

  private final HttpServer http;
  private final ExecutorService pool;
  private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private SmokeTarget(HttpServer http, ExecutorService pool) {
    this.http = http;
    this.pool = pool;
  }

  /** port=0이면 임의 포트 */
  public static SmokeTarget start(int port) throws IOException {
    HttpServer http = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
    ExecutorService pool = Executors.newFixedThreadPool(4);
    SmokeTarget t = new SmokeTarget(http, pool);
    t.wireEndpoints();
    http.setExecutor(pool);
    http.start();
    return t;
  }

  public static void main(String[] args) throws Exception {
    int port = args.length > 0 ? Integer.parseInt(args[0]) : 8080;
    SmokeTarget t = start(port);
    System.out.println("[retrykit] smoke target on " + t.baseUri());
  }

  public URI baseUri() {
    return URI.create("http://localhost:" + http.getAddress().getPort());
  }

  /** 지금까지 key로 들어온 /flaky 요청 수 */
  public int hits(String key) {
    AtomicInteger n = hits.get(key);
    return n == null ? 0 : n.get();
  }

  @Override public void close() {
    if (!closed.compareAndSet(false, true)) return;
    http.stop(0);
    pool.shutdownNow();
  }

  static void add(HttpServer s, String path, HttpHandler h) { s.createContext(path, h); }

  private void wireEndpoints() {
    add(http, "/health", ex -> resp(ex, 200, "text/plain", "ok"));

    add(http, "/flaky", ex -> {
      var q = query(ex.getRequestURI());
      String key = q.getOrDefault("key", "default");
      int failures = parseInt(q.get("failures"), 2);
      int n = hits.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
      if (n <= failures) {
        ex.getResponseHeaders().set("Retry-After", "0");
        resp(ex, 503, "text/plain", "try again (" + n + "/" + failures + ")");
      } else {
        resp(ex, 200, "text/plain", "ok after " + n);
      }
    });

    add(http, "/teapot", ex -> resp(ex, 418, "text/plain", "short and stout"));
  }

  // ===== 공통 유틸 =====
  static Map<String,String> query(URI u){
    Map<String,String> m = new LinkedHashMap<>();
    String q = u.getRawQuery(); if (q==null) return m;
    for (String p: q.split("&")) {
      int i = p.indexOf('=');
      String k = i<0? p : p.substring(0,i);
      String v = i<0? "" : p.substring(i+1);
      m.put(URLDecoder.decode(k, StandardCharsets.UTF_8), URLDecoder.decode(v, StandardCharsets.UTF_8));
    }
    return m;
  }

  static int parseInt(String s, int def) {
    if (s == null || s.isBlank()) return def;
    try { return Integer.parseInt(s.trim()); } catch (NumberFormatException e) { return def; }
  }

  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", ct+"; charset=utf-8");
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
