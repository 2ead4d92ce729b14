package com.proptrading.domain.orders;

public enum RejectionCode {
  MALFORMED_MESSAGE(Category.CLIENT_CORRECTABLE),
  MISSING_FIELD(Category.CLIENT_CORRECTABLE),
  INVALID_SYMBOL(Category.CLIENT_CORRECTABLE),
  INVALID_SIDE(Category.CLIENT_CORRECTABLE),
  INVALID_ORDER_TYPE(Category.CLIENT_CORRECTABLE),
  INVALID_QUANTITY(Category.CLIENT_CORRECTABLE),
  QUANTITY_OUT_OF_RANGE(Category.CLIENT_CORRECTABLE),
  INVALID_LEVERAGE(Category.CLIENT_CORRECTABLE),
  LEVERAGE_TOO_HIGH(Category.CLIENT_CORRECTABLE),
  INVALID_LIMIT_PRICE(Category.CLIENT_CORRECTABLE),
  INVALID_TAKE_PROFIT(Category.CLIENT_CORRECTABLE),
  INVALID_STOP_LOSS(Category.CLIENT_CORRECTABLE),
  INVALID_CLOSE_QUANTITY(Category.CLIENT_CORRECTABLE),
  RATE_LIMITED(Category.RETRYABLE),
  TIMESTAMP_INVALID(Category.RETRYABLE),
  PRICE_STALE(Category.RETRYABLE),
  PRICE_UNAVAILABLE(Category.RETRYABLE),
  LOCK_TIMEOUT(Category.RETRYABLE),
  INSUFFICIENT_MARGIN(Category.BUSINESS_RULE),
  LIMIT_PRICE_NOT_MET(Category.BUSINESS_RULE),
  ORDER_NOT_FOUND(Category.BUSINESS_RULE),
  ORDER_NOT_CANCELLABLE(Category.BUSINESS_RULE),
  POSITION_NOT_FOUND(Category.BUSINESS_RULE),
  ACCOUNT_NOT_FOUND(Category.BUSINESS_RULE),
  ACCOUNT_NOT_ACTIVE(Category.BUSINESS_RULE),
  OWNERSHIP_MISMATCH(Category.BUSINESS_RULE),
  DUPLICATE_ORDER(Category.BUSINESS_RULE),
  INTERNAL_ERROR(Category.INTERNAL);

  public enum Category {
    CLIENT_CORRECTABLE,
    RETRYABLE,
    BUSINESS_RULE,
    INTERNAL
  }

  private final Category category;

  RejectionCode(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }

  public boolean isRetryable() {
    return category == Category.RETRYABLE;
  }
}
