package com.changefeed.domain.sessions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ResumeTokenTest {
  @Test
  void shouldParseThreeSegmentToken() {
    ResumeToken token = ResumeToken.parse("c0ffee.abc123.7");

    assertEquals("c0ffee", token.connectionIdentity());
    assertEquals("abc123", token.signature());
    assertEquals(7L, token.lastDeliveredSequence());
    assertEquals("c0ffee.abc123", token.resumeKey());
    assertEquals("c0ffee.abc123.7", token.encode());
  }

  @Test
  void shouldRejectMalformedTokens() {
    assertThrows(SessionDomainException.class, () -> ResumeToken.parse(""));
    assertThrows(SessionDomainException.class, () -> ResumeToken.parse("only.two"));
    assertThrows(SessionDomainException.class, () -> ResumeToken.parse("a.b.c.d"));
    assertThrows(SessionDomainException.class, () -> ResumeToken.parse("a.b.seven"));
    assertThrows(SessionDomainException.class, () -> ResumeToken.parse("a.b.-1"));
    assertThrows(SessionDomainException.class, () -> ResumeToken.parse("a..1"));
  }
}
