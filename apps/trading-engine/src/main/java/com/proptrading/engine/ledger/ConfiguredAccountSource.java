package com.proptrading.engine.ledger;

import com.proptrading.domain.ledger.AccountOpening;
import com.proptrading.domain.ledger.AccountStatus;
import com.proptrading.domain.ledger.EvaluationRules;
import com.proptrading.engine.config.EngineProperties;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/** Accounts declared under {@code engine.accounts}. */
public class ConfiguredAccountSource implements AccountSource {
  private final List<EngineProperties.SeedAccount> seeds;

  public ConfiguredAccountSource(List<EngineProperties.SeedAccount> seeds) {
    this.seeds = List.copyOf(seeds);
  }

  @Override
  public List<AccountOpening> loadAccounts() {
    return seeds.stream().map(ConfiguredAccountSource::toOpening).toList();
  }

  private static AccountOpening toOpening(EngineProperties.SeedAccount seed) {
    BigDecimal current =
        seed.getCurrentBalance() != null ? seed.getCurrentBalance() : seed.getStartingBalance();
    return new AccountOpening(
        seed.getId(),
        seed.getUserId(),
        AccountStatus.valueOf(seed.getStatus().trim().toUpperCase(Locale.ROOT)),
        seed.getStartingBalance(),
        current,
        current,
        seed.getStartingBalance().max(current),
        seed.getDailyLossLimit(),
        seed.getMaxDrawdownLimit(),
        seed.getMajorMaxLeverage(),
        seed.getAltcoinMaxLeverage(),
        evaluationOf(seed),
        seed.getTradingDays());
  }

  private static EvaluationRules evaluationOf(EngineProperties.SeedAccount seed) {
    if (seed.getProfitTargetPercent() == null) {
      return null;
    }
    return new EvaluationRules(
        seed.getEvaluationStep(),
        seed.getEvaluationSteps(),
        seed.getProfitTargetPercent(),
        seed.getMinTradingDays());
  }
}
