package com.example.audit.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.audit.model.ActionFilter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RetentionPolicyTest {

  @Test
  void resolvesExactMatchThenDefaultThenFallback() {
    final RetentionPolicy withDefault = RetentionPolicy.of(Map.of("LOGIN", 180, "DEFAULT", 60));
    final RetentionPolicy withoutDefault = RetentionPolicy.of(Map.of("LOGIN", 180));

    assertThat(withDefault.resolve("LOGIN")).isEqualTo(180);
    assertThat(withDefault.resolve("SOMETHING_ELSE")).isEqualTo(60);
    assertThat(withDefault.resolve(null)).isEqualTo(60);
    assertThat(withoutDefault.resolve("SOMETHING_ELSE"))
        .isEqualTo(RetentionPolicy.FALLBACK_RETENTION_DAYS);
  }

  @Test
  void builtInTableCoversKnownActions() {
    final RetentionPolicy policy = RetentionPolicy.builtIn();

    assertThat(policy.resolve("BOOK_VIEWED")).isEqualTo(30);
    assertThat(policy.resolve("BOOK_CREATED")).isEqualTo(730);
    assertThat(policy.resolve("UNAUTHORIZED_ACCESS")).isEqualTo(365);
    assertThat(policy.resolve("UNLISTED")).isEqualTo(180);
    assertThat(policy.defaultDays()).hasValue(180);
    assertThat(policy.namedActions()).hasSize(13).doesNotContain(RetentionPolicy.DEFAULT_KEY);
  }

  @Test
  void rulesKeepConfigurationOrderWithDefaultLast() {
    final Map<String, Integer> policies = new LinkedHashMap<>();
    policies.put("DEFAULT", 90);
    policies.put("LOGOUT", 30);
    policies.put("LOGIN", 180);

    final List<RetentionRule> rules = RetentionPolicy.of(policies).rules();

    assertThat(rules)
        .containsExactly(
            RetentionRule.named("LOGOUT", 30),
            RetentionRule.named("LOGIN", 180),
            RetentionRule.fallback(90));
  }

  @Test
  void noDefaultRuleWithoutDefaultEntry() {
    assertThat(RetentionPolicy.of(Map.of("LOGIN", 180)).rules())
        .containsExactly(RetentionRule.named("LOGIN", 180));
  }

  @Test
  void fallbackRuleExcludesNamedActions() {
    final RetentionPolicy policy = RetentionPolicy.of(Map.of("LOGIN", 180, "DEFAULT", 60));

    final ActionFilter filter = RetentionRule.fallback(60).toFilter(policy.namedActions());

    assertThat(filter.fallback()).isTrue();
    assertThat(filter.matches("LOGIN")).isFalse();
    assertThat(filter.matches("BOOK_VIEWED")).isTrue();
    assertThat(RetentionRule.named("LOGIN", 180).toFilter(policy.namedActions()).matches("LOGIN"))
        .isTrue();
  }

  @Test
  void rejectsInvalidEntries() {
    final Map<String, Integer> nullDays = new LinkedHashMap<>();
    nullDays.put("LOGIN", null);

    assertThatThrownBy(() -> RetentionPolicy.of(Map.of("LOGIN", 0)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RetentionPolicy.of(Map.of(" ", 10)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RetentionPolicy.of(nullDays))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void asMapIncludesDefault() {
    assertThat(RetentionPolicy.of(Map.of("LOGIN", 180, "DEFAULT", 60)).asMap())
        .containsOnly(Map.entry("LOGIN", 180), Map.entry("DEFAULT", 60));
  }
}
