package com.example.audit.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "topActions is copied into an unmodifiable map in the constructor")
public record MonthlyStatistic(String month, long count, Map<String, Long> topActions) {

  public MonthlyStatistic {
    topActions =
        topActions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(topActions));
  }
}
