package io.remindly.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class RuleChainTest {
  private static final ZonedDateTime NOW =
      ZonedDateTime.of(2024, 7, 1, 9, 0, 0, 0, ZoneId.of("Asia/Tokyo"));

  /** Claims phrases containing a marker and resolves them to a fixed result. */
  private record FixedRule(String name, String marker, Optional<Resolution> result)
      implements TemporalRule {
    @Override
    public boolean claims(String text) {
      return text.contains(marker);
    }

    @Override
    public Optional<Resolution> resolve(String text, ZonedDateTime now) {
      return result;
    }
  }

  private static final class TestChain extends RuleChain {
    TestChain(List<TemporalRule> rules) {
      super(rules);
    }
  }

  @Test
  void testFirstClaimingRuleWins() {
    Resolution first = Resolution.once(NOW.plusDays(1));
    Resolution second = Resolution.once(NOW.plusDays(2));
    RuleChain chain =
        new TestChain(
            List.of(
                new FixedRule("a", "x", Optional.of(first)),
                new FixedRule("b", "x", Optional.of(second))));
    assertEquals(Optional.of(first), chain.resolve("x", NOW));
  }

  @Test
  void testNoFallThroughAfterClaim() {
    RuleChain chain =
        new TestChain(
            List.of(
                new FixedRule("impossible", "x", Optional.empty()),
                new FixedRule("fallback", "x", Optional.of(Resolution.once(NOW)))));
    assertEquals("impossible", chain.claim("x").orElseThrow().name());
    assertTrue(chain.resolve("x", NOW).isEmpty());
  }

  @Test
  void testNothingClaims() {
    RuleChain chain = new TestChain(List.of(new FixedRule("a", "x", Optional.empty())));
    assertTrue(chain.claim("y").isEmpty());
    assertTrue(chain.resolve("y", NOW).isEmpty());
  }
}
