package com.mk.fx.qa.loadgen.engine.scenario;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class SessionStoreTest {

  @Test
  void absorb_storesCookiesAndBuildsHeader() {
    var store = new SessionStore();
    store.absorb(List.of("session=abc; Path=/; HttpOnly", "theme=\"dark\""));

    assertEquals("abc", store.cookie("session").orElseThrow());
    assertEquals("dark", store.cookie("theme").orElseThrow());
    assertEquals("session=abc; theme=dark", store.cookieHeader().orElseThrow());
  }

  @Test
  void laterCookieReplacesEarlierValue() {
    var store = new SessionStore();
    store.absorb(List.of("session=one"));
    store.absorb(List.of("session=two"));
    assertEquals(1, store.size());
    assertEquals("two", store.cookie("session").orElseThrow());
  }

  @Test
  void maxAgeZeroOrEmptyValue_removesCookie() {
    var store = new SessionStore();
    store.absorb(List.of("a=1", "b=2"));
    store.absorb(List.of("a=deleted; Max-Age=0", "b="));
    assertTrue(store.cookieHeader().isEmpty());
  }

  @Test
  void malformedHeaders_areIgnored() {
    var store = new SessionStore();
    store.absorb(List.of("", "novalue", "=x"));
    assertEquals(0, store.size());
  }

  @Test
  void useFromAnotherThread_isRejected() throws Exception {
    var store = new SessionStore();
    store.absorb(List.of("a=1"));

    var failure = new AtomicReference<Throwable>();
    var other = new Thread(() -> {
      try {
        store.cookieHeader();
      } catch (Throwable t) {
        failure.set(t);
      }
    });
    other.start();
    other.join();

    assertInstanceOf(IllegalStateException.class, failure.get());
  }

  @Test
  void clear_emptiesJar() {
    var store = new SessionStore();
    store.absorb(List.of("a=1"));
    store.clear();
    assertTrue(store.cookieHeader().isEmpty());
  }
}
