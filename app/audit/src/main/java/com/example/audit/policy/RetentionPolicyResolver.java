/*
 * Where: Audit retention policy
 * What: Builds the policy table from configuration
 * Why: Falls back to the built-in table so a bare deployment never deletes on an empty policy
 */
package com.example.audit.policy;

import com.example.audit.config.AuditRetentionProperties;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RetentionPolicyResolver {

  private static final Logger logger = LoggerFactory.getLogger(RetentionPolicyResolver.class);

  private final AuditRetentionProperties properties;
  private final AtomicBoolean builtInWarned = new AtomicBoolean();

  /** Policy table for one run; later configuration changes do not affect a returned snapshot. */
  public RetentionPolicy snapshot() {
    if (properties.policies().isEmpty()) {
      if (builtInWarned.compareAndSet(false, true)) {
        logger.warn("audit.retention.policies is empty, using built-in retention policies");
      }
      return RetentionPolicy.builtIn();
    }
    return RetentionPolicy.of(properties.policies());
  }

  public int resolve(String actionType) {
    return snapshot().resolve(actionType);
  }
}
