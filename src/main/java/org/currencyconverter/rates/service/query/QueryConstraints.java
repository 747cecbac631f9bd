package org.currencyconverter.rates.service.query;

final class QueryConstraints {

  static final String CURRENCY_CODE_PATTERN = "^[A-Z]{3}$";

  static final int MAX_PAGE_SIZE = 100;

  private QueryConstraints() {}
}
