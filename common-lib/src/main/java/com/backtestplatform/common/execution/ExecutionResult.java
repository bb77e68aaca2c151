package com.backtestplatform.common.execution;

import com.backtestplatform.common.ledger.Portfolio;

import java.util.List;

/**
 * @param portfolio verified working copy, ready for {@code PortfolioLedger.commit}
 * @param fills     one fill per order, in order of application
 */
public record ExecutionResult(Portfolio portfolio, List<Fill> fills) {}
