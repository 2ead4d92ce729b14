package com.proptrading.engine.risk;

import com.proptrading.engine.positions.PositionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Applies the latest funding rate to open positions every eight hours. */
@Component
public class FundingScheduler {
  private static final Logger log = LoggerFactory.getLogger(FundingScheduler.class);

  private final PositionManager positions;

  public FundingScheduler(PositionManager positions) {
    this.positions = positions;
  }

  @Scheduled(cron = "${engine.funding-cron:0 0 0,8,16 * * *}", zone = "UTC")
  public int applyFunding() {
    int charged = positions.accrueFunding();
    log.info("Funding applied to {} positions", charged);
    return charged;
  }
}
