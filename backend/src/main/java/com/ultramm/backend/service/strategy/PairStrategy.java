package com.ultramm.backend.service.strategy;

import com.ultramm.backend.model.MarketView;
import com.ultramm.backend.model.PairKey;
import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.model.Signal;

import java.util.List;

/**
 * Strategy trading two symbols together. Produces zero or one signal per leg.
 */
public interface PairStrategy extends TradingStrategy {

    List<PairKey> pairs();

    List<Signal> evaluate(PairKey pair, MarketView first, MarketView second,
                          PositionSnapshot firstPosition, PositionSnapshot secondPosition);
}
