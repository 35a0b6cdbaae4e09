package com.ultramm.backend.service.exchange;

import com.ultramm.backend.model.MarketEvent;

@FunctionalInterface
public interface MarketEventListener {

    void onMarketEvent(MarketEvent event);
}
