package com.proptrading.engine.ledger;

import com.proptrading.domain.ledger.AccountOpening;
import java.util.List;

/** Supplies the accounts the engine starts with. */
public interface AccountSource {
  List<AccountOpening> loadAccounts();
}
