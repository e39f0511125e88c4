package com.tradejournal.tradebuilder;

import com.tradejournal.domain.model.RebuildProblem;
import com.tradejournal.domain.model.Trade;
import java.util.List;
import lombok.Value;

/** Trades and diagnostics for a whole order set, produced without touching storage. */
@Value
public class ConstructionResult {

    List<Trade> trades;
    List<RebuildProblem> problems;
}
